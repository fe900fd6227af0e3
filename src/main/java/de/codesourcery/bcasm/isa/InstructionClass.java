package de.codesourcery.bcasm.isa;

/**
 * The three instruction classes of the Basic Computer.
 */
public enum InstructionClass
{
	/**
	 * AND/ADD/LDA/... , 3-bit opcode that gets combined with addressing mode and address.
	 */
	MEMORY_REFERENCE(3,"isa/mri.txt"),
	/**
	 * CLA/CLE/..., complete 16-bit word.
	 */
	REGISTER_REFERENCE(16,"isa/rri.txt"),
	/**
	 * INP/OUT/..., complete 16-bit word.
	 */
	INPUT_OUTPUT(16,"isa/ioi.txt");

	private final int encodingBits;
	private final String defaultResource;

	private InstructionClass(int encodingBits,String defaultResource) {
		this.encodingBits = encodingBits;
		this.defaultResource = defaultResource;
	}

	public int getEncodingBits() {
		return encodingBits;
	}

	/**
	 * Classpath location of the bundled table for this class.
	 */
	public String getDefaultResource() {
		return defaultResource;
	}
}
