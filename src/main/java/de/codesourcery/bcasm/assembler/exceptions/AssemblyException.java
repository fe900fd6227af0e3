package de.codesourcery.bcasm.assembler.exceptions;

import de.codesourcery.bcasm.source.SourceLine;

/**
 * Base class of all errors that abort an assembly run.
 *
 * Carries the offending source line (if any) and the offending token.
 */
public abstract class AssemblyException extends RuntimeException
{
	private final SourceLine line;
	private final String token;

	protected AssemblyException(String message,SourceLine line,String token)
	{
		this( message , line , token , null );
	}

	protected AssemblyException(String message,SourceLine line,String token,Throwable cause)
	{
		super( format( message , line ) , cause );
		this.line = line;
		this.token = token;
	}

	private static String format(String message,SourceLine line)
	{
		if ( line == null ) {
			return message;
		}
		return "Line "+line.getLineNumber()+": "+message+"\n    "+line.getText().trim();
	}

	/**
	 * @return offending line or <code>null</code>
	 */
	public SourceLine getLine() {
		return line;
	}

	/**
	 * @return 1-based line number or -1 if the error is not tied to a line
	 */
	public int getLineNumber() {
		return line == null ? -1 : line.getLineNumber();
	}

	/**
	 * @return offending token or <code>null</code>
	 */
	public String getToken() {
		return token;
	}
}
