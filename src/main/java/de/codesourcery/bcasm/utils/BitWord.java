package de.codesourcery.bcasm.utils;

import org.apache.commons.lang.Validate;

/**
 * An immutable, fixed-width binary value.
 *
 * <p>Instances are compared by width and value, so <code>0101</code> (4 bits)
 * and <code>00101</code> (5 bits) are different words.</p>
 */
public final class BitWord
{
	private final int value;
	private final int width;

	private BitWord(int value, int width)
	{
		this.value = value;
		this.width = width;
	}

	public static BitWord of(int value,int width)
	{
		if ( width < 1 || width > Misc.WORD_BITS ) {
			throw new IllegalArgumentException("Unsupported width "+width);
		}
		if ( value < 0 || value >= ( 1 << width ) ) {
			throw new IllegalArgumentException("Value "+value+" does not fit into "+width+" bits");
		}
		return new BitWord( value , width );
	}

	public static BitWord word(int value) {
		return of( value , Misc.WORD_BITS );
	}

	/**
	 * Parses a string of '0' and '1' characters, the string length becomes the word's width.
	 *
	 * @param bits
	 * @return
	 */
	public static BitWord parse(String bits)
	{
		Validate.notNull( bits , "bits must not be NULL" );
		if ( ! Misc.isValidBinary( bits , bits.length() ) ) {
			throw new IllegalArgumentException("Not a binary string: '"+bits+"'");
		}
		return of( Integer.parseInt( bits , 2 ) , bits.length() );
	}

	/**
	 * Appends another word to the right of this one.
	 *
	 * @param other
	 * @return word of width <code>this.width + other.width</code>
	 */
	public BitWord concat(BitWord other)
	{
		return of( ( value << other.width ) | other.value , width + other.width );
	}

	public int getValue() {
		return value;
	}

	public int getWidth() {
		return width;
	}

	@Override
	public String toString() {
		return Misc.toBinary( value , width );
	}

	@Override
	public int hashCode() {
		return 31 * value + width;
	}

	@Override
	public boolean equals(Object obj)
	{
		if ( obj instanceof BitWord ) {
			final BitWord other = (BitWord) obj;
			return value == other.value && width == other.width;
		}
		return false;
	}
}
