package de.codesourcery.bcasm.isa;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang.Validate;

import de.codesourcery.bcasm.utils.BitWord;

/**
 * Immutable mapping from (lowercase) mnemonic to its binary encoding.
 *
 * All encodings in one table have the width dictated by the table's {@link InstructionClass}.
 */
public final class InstructionTable
{
	private final InstructionClass instructionClass;
	private final Map<String,BitWord> encodings;

	public InstructionTable(InstructionClass instructionClass,Map<String,BitWord> encodings)
	{
		Validate.notNull( instructionClass , "instructionClass must not be NULL" );
		Validate.notNull( encodings , "encodings must not be NULL" );

		final Map<String,BitWord> copy = new TreeMap<>();
		for ( Map.Entry<String,BitWord> entry : encodings.entrySet() )
		{
			final BitWord encoding = entry.getValue();
			if ( encoding == null || encoding.getWidth() != instructionClass.getEncodingBits() ) {
				throw new IllegalArgumentException("Encoding of '"+entry.getKey()+"' must have "+
						instructionClass.getEncodingBits()+" bits, got "+encoding);
			}
			final String mnemonic = entry.getKey().toLowerCase();
			if ( copy.containsKey( mnemonic ) ) {
				throw new IllegalArgumentException("Duplicate mnemonic '"+mnemonic+"'");
			}
			copy.put( mnemonic , encoding );
		}
		this.instructionClass = instructionClass;
		this.encodings = Collections.unmodifiableMap( copy );
	}

	public static InstructionTable empty(InstructionClass instructionClass) {
		return new InstructionTable( instructionClass , Collections.<String,BitWord>emptyMap() );
	}

	public InstructionClass getInstructionClass() {
		return instructionClass;
	}

	public boolean contains(String mnemonic) {
		return mnemonic != null && encodings.containsKey( mnemonic );
	}

	/**
	 * @param mnemonic
	 * @return encoding or <code>null</code> if this table has no such mnemonic
	 */
	public BitWord lookup(String mnemonic) {
		return mnemonic == null ? null : encodings.get( mnemonic );
	}

	public int size() {
		return encodings.size();
	}

	@Override
	public String toString() {
		return instructionClass+" "+encodings;
	}
}
