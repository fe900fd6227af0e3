package de.codesourcery.bcasm.assembler;

import de.codesourcery.bcasm.utils.BitWord;

public enum AddressingMode
{
	/**
	 * LDA X
	 */
	DIRECT(0),
	/**
	 * LDAI X
	 */
	INDIRECT(1);

	private final BitWord modeBit;

	private AddressingMode(int bit) {
		this.modeBit = BitWord.of( bit , 1 );
	}

	/**
	 * @return the 1-bit flag that leads a memory-reference instruction word
	 */
	public BitWord getModeBit() {
		return modeBit;
	}
}
