package de.codesourcery.bcasm.assembler;

/**
 * Pseudo instructions understood by the assembler.
 */
public enum Directive
{
	/**
	 * <code>ORG 100</code> , sets the location counter (hex operand).
	 */
	ORG("org"),
	/**
	 * <code>END</code> , terminates the program.
	 */
	END("end"),
	/**
	 * <code>X, HEX 1F</code> , literal word (hex operand).
	 */
	HEX("hex"),
	/**
	 * <code>DEC 12</code> , recognized but not encoded by either pass.
	 */
	DEC("dec");

	public final String keyword;

	private Directive(String keyword) {
		this.keyword = keyword;
	}

	/**
	 * @param token lowercase token
	 * @return directive or <code>null</code>
	 */
	public static Directive fromToken(String token)
	{
		if ( token != null ) {
			for ( Directive d : values() ) {
				if ( d.keyword.equals( token ) ) {
					return d;
				}
			}
		}
		return null;
	}

	public static boolean isDirective(String token) {
		return fromToken( token ) != null;
	}
}
