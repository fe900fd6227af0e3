package de.codesourcery.bcasm.assembler.exceptions;

import de.codesourcery.bcasm.source.SourceLine;

public class UnresolvedSymbolException extends AssemblyException
{
	public enum Kind {
		LABEL("label"),
		MNEMONIC("mnemonic");

		private final String description;

		private Kind(String description) {
			this.description = description;
		}
	}

	public final Kind kind;

	public UnresolvedSymbolException(SourceLine line,String symbol,Kind kind)
	{
		super( "Unknown "+kind.description+" '"+symbol+"'" , line , symbol );
		this.kind = kind;
	}
}
