package de.codesourcery.bcasm.isa;

/**
 * Thrown when an instruction table definition is malformed.
 */
public class InstructionTableException extends RuntimeException
{
	public final String source;
	public final int lineNumber;

	public InstructionTableException(String message,String source,int lineNumber)
	{
		super( source+", line "+lineNumber+": "+message );
		this.source = source;
		this.lineNumber = lineNumber;
	}
}
