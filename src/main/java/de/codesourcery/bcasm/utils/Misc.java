package de.codesourcery.bcasm.utils;

import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;

/**
 * Number formatting and parsing helpers.
 */
public class Misc
{
	private static final Pattern VALID_HEX_STRING = Pattern.compile("^[0-9a-fA-F]+$");

	private static final Pattern VALID_BINARY_STRING = Pattern.compile("^[01]+$");

	/**
	 * Number of bits in a memory address.
	 */
	public static final int ADDRESS_BITS = 12;

	/**
	 * Number of bits in a memory word.
	 */
	public static final int WORD_BITS = 16;

	public static final int MAX_ADDRESS = (1 << ADDRESS_BITS) - 1;

	public static final int MAX_WORD = (1 << WORD_BITS) - 1;

	private Misc() {
	}

	/**
	 * Renders a non-negative value as a zero-padded binary string.
	 *
	 * @param value
	 * @param bits
	 * @return
	 * @throws IllegalArgumentException if the value is negative or needs more than <code>bits</code> bits
	 */
	public static String toBinary(int value,int bits)
	{
		if ( value < 0 || bits < 1 || bits > 30 || value >= ( 1 << bits ) ) {
			throw new IllegalArgumentException("Value "+value+" does not fit into "+bits+" bits");
		}
		return StringUtils.leftPad( Integer.toBinaryString( value ) , bits , '0' );
	}

	public static String toAddressString(int location) {
		return toBinary( location , ADDRESS_BITS );
	}

	public static String to12BitHex(int value) {
		return StringUtils.leftPad( Integer.toHexString( value & 0xfff ) , 3 , '0' );
	}

	public static String to16BitHex(int value) {
		return StringUtils.leftPad( Integer.toHexString( value & 0xffff ) , 4 , '0' );
	}

	/**
	 * Parses a hexadecimal literal (without any prefix).
	 *
	 * @param input
	 * @return parsed value or <code>null</code> if the input is not a valid hex number
	 * or too large to fit into an <code>int</code>
	 */
	public static Integer parseHex(String input)
	{
		if ( input == null || ! VALID_HEX_STRING.matcher( input ).matches() ) {
			return null;
		}
		final String digits = StringUtils.stripStart( input , "0" );
		if ( digits.length() > 7 ) {
			return null;
		}
		return digits.isEmpty() ? 0 : Integer.parseInt( digits , 16 );
	}

	public static boolean isValidBinary(String input,int bits)
	{
		return input != null && input.length() == bits && VALID_BINARY_STRING.matcher( input ).matches();
	}

	public static boolean isValidAddress(int location) {
		return location >= 0 && location <= MAX_ADDRESS;
	}
}
