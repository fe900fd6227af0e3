package de.codesourcery.bcasm.isa;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.bcasm.assembler.AddressingMode;
import de.codesourcery.bcasm.utils.BitWord;

/**
 * The memory-reference, register-reference and input/output tables used by one assembly run.
 */
public final class InstructionSet
{
	private final InstructionTable memoryReference;
	private final InstructionTable registerReference;
	private final InstructionTable inputOutput;

	public InstructionSet(InstructionTable memoryReference,InstructionTable registerReference,InstructionTable inputOutput)
	{
		this.memoryReference = checkClass( memoryReference , InstructionClass.MEMORY_REFERENCE );
		this.registerReference = checkClass( registerReference , InstructionClass.REGISTER_REFERENCE );
		this.inputOutput = checkClass( inputOutput , InstructionClass.INPUT_OUTPUT );
	}

	private static InstructionTable checkClass(InstructionTable table,InstructionClass expected)
	{
		Validate.notNull( table , "table must not be NULL" );
		if ( table.getInstructionClass() != expected ) {
			throw new IllegalArgumentException("Expected a "+expected+" table, got "+table.getInstructionClass());
		}
		return table;
	}

	public static InstructionSet empty()
	{
		return new InstructionSet( InstructionTable.empty( InstructionClass.MEMORY_REFERENCE ),
				InstructionTable.empty( InstructionClass.REGISTER_REFERENCE ),
				InstructionTable.empty( InstructionClass.INPUT_OUTPUT ) );
	}

	public InstructionSet withTable(InstructionTable table)
	{
		switch( table.getInstructionClass() )
		{
			case MEMORY_REFERENCE:
				return new InstructionSet( table , registerReference , inputOutput );
			case REGISTER_REFERENCE:
				return new InstructionSet( memoryReference , table , inputOutput );
			case INPUT_OUTPUT:
				return new InstructionSet( memoryReference , registerReference , table );
			default:
				throw new RuntimeException("Unhandled instruction class: "+table.getInstructionClass());
		}
	}

	/**
	 * Looks up a register-reference or I/O mnemonic.
	 *
	 * @param mnemonic
	 * @return complete 16-bit word or <code>null</code>
	 */
	public BitWord lookupComplete(String mnemonic)
	{
		final BitWord result = registerReference.lookup( mnemonic );
		return result != null ? result : inputOutput.lookup( mnemonic );
	}

	/**
	 * Resolves a memory-reference mnemonic.
	 *
	 * <p>A mnemonic found verbatim in the MRI table uses direct addressing. A mnemonic
	 * that ends with <code>indirectMarker</code> and whose remainder is in the table uses
	 * indirect addressing (<code>ldai</code> is indirect <code>lda</code>).</p>
	 *
	 * @param mnemonic
	 * @param indirectMarker
	 * @return resolved reference or <code>null</code> if this is no memory-reference mnemonic
	 */
	public MemoryReference resolveMemoryReference(String mnemonic,String indirectMarker)
	{
		if ( mnemonic == null ) {
			return null;
		}
		final BitWord direct = memoryReference.lookup( mnemonic );
		if ( direct != null ) {
			return new MemoryReference( mnemonic , direct , AddressingMode.DIRECT );
		}
		if ( StringUtils.isNotEmpty( indirectMarker ) && mnemonic.length() > indirectMarker.length() && mnemonic.endsWith( indirectMarker ) )
		{
			final String base = mnemonic.substring( 0 , mnemonic.length() - indirectMarker.length() );
			final BitWord indirect = memoryReference.lookup( base );
			if ( indirect != null ) {
				return new MemoryReference( base , indirect , AddressingMode.INDIRECT );
			}
		}
		return null;
	}

	/**
	 * Checks whether a mnemonic is known to any of the three tables.
	 */
	public boolean isKnownMnemonic(String mnemonic,String indirectMarker) {
		return lookupComplete( mnemonic ) != null || resolveMemoryReference( mnemonic , indirectMarker ) != null;
	}

	public InstructionTable getMemoryReference() {
		return memoryReference;
	}

	public InstructionTable getRegisterReference() {
		return registerReference;
	}

	public InstructionTable getInputOutput() {
		return inputOutput;
	}
}
