package de.codesourcery.bcasm.assembler.exceptions;

import de.codesourcery.bcasm.source.SourceLine;

/**
 * Input was exhausted without an END directive.
 */
public class MissingEndDirectiveException extends AssemblyException
{
	/**
	 * @param lastLine last line of input, <code>null</code> for empty input
	 */
	public MissingEndDirectiveException(SourceLine lastLine) {
		super( "Reached end of input without END directive" , lastLine , null );
	}
}
