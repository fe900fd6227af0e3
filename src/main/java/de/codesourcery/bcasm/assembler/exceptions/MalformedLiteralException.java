package de.codesourcery.bcasm.assembler.exceptions;

import de.codesourcery.bcasm.source.SourceLine;

public class MalformedLiteralException extends AssemblyException
{
	public MalformedLiteralException(SourceLine line,String literal,String expected) {
		super( "Malformed literal '"+literal+"', expected "+expected , line , literal );
	}
}
