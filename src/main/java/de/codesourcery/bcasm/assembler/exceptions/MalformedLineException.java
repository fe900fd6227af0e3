package de.codesourcery.bcasm.assembler.exceptions;

import de.codesourcery.bcasm.source.SourceLine;

/**
 * A line lacks a token its directive or instruction requires.
 */
public class MalformedLineException extends AssemblyException
{
	public MalformedLineException(String message,SourceLine line,String token) {
		super( message , line , token );
	}
}
