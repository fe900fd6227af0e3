package de.codesourcery.bcasm.assembler;

import org.apache.commons.lang.Validate;

import de.codesourcery.bcasm.utils.BitWord;

/**
 * Content of one memory location during assembly.
 *
 * <p>Either {@link Raw}, a mnemonic that still awaits resolution, or {@link Encoded},
 * a finished instruction or data word.</p>
 */
public abstract class CellValue
{
	public interface IVisitor<T>
	{
		public T visitRaw(Raw raw);

		public T visitEncoded(Encoded encoded);
	}

	private CellValue() {
	}

	public static Raw raw(String text) {
		return new Raw( text );
	}

	public static Encoded encoded(BitWord word) {
		return new Encoded( word );
	}

	public abstract <T> T accept(IVisitor<T> visitor);

	public abstract boolean isResolved();

	/**
	 * @return the text this cell contributes to the binary output
	 */
	public abstract String asString();

	@Override
	public String toString() {
		return asString();
	}

	public static final class Raw extends CellValue
	{
		public final String text;

		private Raw(String text)
		{
			Validate.notNull( text , "text must not be NULL" );
			this.text = text;
		}

		@Override
		public <T> T accept(IVisitor<T> visitor) {
			return visitor.visitRaw( this );
		}

		@Override
		public boolean isResolved() {
			return false;
		}

		@Override
		public String asString() {
			return text;
		}

		@Override
		public int hashCode() {
			return text.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Raw && ((Raw) obj).text.equals( text );
		}
	}

	public static final class Encoded extends CellValue
	{
		public final BitWord word;

		private Encoded(BitWord word)
		{
			Validate.notNull( word , "word must not be NULL" );
			this.word = word;
		}

		@Override
		public <T> T accept(IVisitor<T> visitor) {
			return visitor.visitEncoded( this );
		}

		@Override
		public boolean isResolved() {
			return true;
		}

		@Override
		public String asString() {
			return word.toString();
		}

		@Override
		public int hashCode() {
			return word.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Encoded && ((Encoded) obj).word.equals( word );
		}
	}
}
