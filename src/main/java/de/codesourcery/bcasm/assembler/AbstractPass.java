package de.codesourcery.bcasm.assembler;

import org.apache.commons.lang.Validate;

import de.codesourcery.bcasm.assembler.exceptions.AddressOverflowException;
import de.codesourcery.bcasm.assembler.exceptions.MalformedLineException;
import de.codesourcery.bcasm.assembler.exceptions.MalformedLiteralException;
import de.codesourcery.bcasm.source.SourceLine;
import de.codesourcery.bcasm.utils.Misc;

/**
 * Line handling shared by both passes.
 */
public abstract class AbstractPass
{
	protected final AssemblerOptions options;

	protected AbstractPass(AssemblerOptions options)
	{
		Validate.notNull( options , "options must not be NULL" );
		this.options = options;
	}

	protected final boolean isLabel(String token) {
		return token != null && token.endsWith( options.getLabelDelimiter() );
	}

	protected final String labelName(SourceLine line)
	{
		final String token = line.firstToken();
		final String name = token.substring( 0 , token.length() - options.getLabelDelimiter().length() );
		if ( name.isEmpty() ) {
			throw new MalformedLineException("Empty label name",line,token);
		}
		return name;
	}

	/**
	 * Evaluates the operand of an ORG directive.
	 *
	 * @param line
	 * @return new location counter value
	 */
	protected final int parseOrigin(SourceLine line)
	{
		final String operand = requireToken( line , 1 , "ORG requires a hexadecimal address" );
		final Integer value = Misc.parseHex( operand );
		if ( value == null ) {
			throw new MalformedLiteralException( line , operand , "hexadecimal address" );
		}
		if ( ! Misc.isValidAddress( value ) ) {
			throw new AddressOverflowException( line , operand , value );
		}
		return value;
	}

	protected final void checkLocation(SourceLine line,int location)
	{
		if ( ! Misc.isValidAddress( location ) ) {
			throw new AddressOverflowException( line , line.firstToken() , location );
		}
	}

	protected static String requireToken(SourceLine line,int index,String message)
	{
		if ( ! line.hasToken( index ) ) {
			throw new MalformedLineException( message , line , line.firstToken() );
		}
		return line.getToken( index );
	}
}
