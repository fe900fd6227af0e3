package de.codesourcery.bcasm.isa;

import de.codesourcery.bcasm.assembler.AddressingMode;
import de.codesourcery.bcasm.utils.BitWord;

/**
 * A memory-reference mnemonic resolved to its base opcode and addressing mode.
 */
public final class MemoryReference
{
	public final String baseMnemonic;
	public final BitWord opcode;
	public final AddressingMode addressingMode;

	public MemoryReference(String baseMnemonic, BitWord opcode, AddressingMode addressingMode)
	{
		this.baseMnemonic = baseMnemonic;
		this.opcode = opcode;
		this.addressingMode = addressingMode;
	}

	/**
	 * Builds the 16-bit instruction word <code>mode (1) | opcode (3) | address (12)</code>.
	 *
	 * @param address 12-bit operand address
	 * @return
	 */
	public BitWord encode(BitWord address)
	{
		return addressingMode.getModeBit().concat( opcode ).concat( address );
	}

	@Override
	public String toString() {
		return baseMnemonic+" ("+addressingMode+")";
	}
}
