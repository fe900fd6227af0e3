package de.codesourcery.bcasm.assembler;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.bcasm.assembler.exceptions.UnresolvedSymbolException;
import de.codesourcery.bcasm.isa.InstructionSet;
import de.codesourcery.bcasm.isa.MemoryReference;
import de.codesourcery.bcasm.source.SourceLine;
import de.codesourcery.bcasm.utils.BitWord;
import de.codesourcery.bcasm.utils.Misc;

/**
 * Turns the first pass' raw cells into instruction words.
 *
 * <p>Register-reference and I/O mnemonics are substituted up front. Memory-reference
 * instructions are encoded while re-walking the source because addressing mode and
 * operand are only known from the line itself.</p>
 *
 * <p>A memory-reference mnemonic that follows a label on the same line is not
 * encoded and stays a {@link CellValue.Raw} cell in the image.</p>
 */
public class SecondPass extends AbstractPass
{
	private static final Logger LOG = LoggerFactory.getLogger(SecondPass.class);

	private final InstructionSet instructionSet;

	public SecondPass(InstructionSet instructionSet,AssemblerOptions options)
	{
		super(options);
		Validate.notNull( instructionSet , "instructionSet must not be NULL" );
		this.instructionSet = instructionSet;
	}

	public BinaryImage encode(List<SourceLine> lines,FirstPassResult firstPass)
	{
		Validate.notNull( lines , "lines must not be NULL" );
		Validate.notNull( firstPass , "firstPass must not be NULL" );

		final AddressSymbolTable table = firstPass.getSymbolTable().mutableCopy();
		final ILabelTable labels = firstPass.getLabelTable();

		substituteCompleteWords( table );

		int location = 0;
		for ( SourceLine line : lines )
		{
			if ( line.isEmpty() ) {
				continue;
			}
			final String opcode = line.firstToken();
			final Directive directive = Directive.fromToken( opcode );
			if ( directive == Directive.ORG )
			{
				location = parseOrigin( line );
				continue;
			}
			if ( directive == Directive.END ) {
				break;
			}

			if ( directive == null )
			{
				// register-reference and I/O mnemonics take precedence, step A already encoded them
				final MemoryReference ref = instructionSet.lookupComplete( opcode ) != null ? null :
					instructionSet.resolveMemoryReference( opcode , options.getIndirectMarker() );
				if ( ref != null )
				{
					checkLocation( line , location );
					final BitWord word = ref.encode( resolveOperand( line , labels ) );
					table.put( location , CellValue.encoded( word ) );
					LOG.trace("{} : {} -> {}", Misc.to12BitHex( location ) , ref , word );
				} else {
					checkResolvable( line );
				}
			}
			location++;
		}

		final BinaryImage result = new BinaryImage( table , labels );
		LOG.debug("Pass 2 finished: {} locations, {} unresolved", result.size() , result.getUnresolvedLocations().size() );
		return result;
	}

	private void substituteCompleteWords(AddressSymbolTable table)
	{
		for ( Map.Entry<Integer,CellValue> entry : new TreeMap<>( table.getCells() ).entrySet() )
		{
			final BitWord word = entry.getValue().accept( new CellValue.IVisitor<BitWord>()
			{
				@Override
				public BitWord visitRaw(CellValue.Raw raw) {
					return instructionSet.lookupComplete( raw.text );
				}

				@Override
				public BitWord visitEncoded(CellValue.Encoded encoded) {
					return null;
				}
			});
			if ( word != null ) {
				table.put( entry.getKey() , CellValue.encoded( word ) );
			}
		}
	}

	private BitWord resolveOperand(SourceLine line,ILabelTable labels)
	{
		final String operand = requireToken( line , 1 , "Memory-reference instruction requires a label operand" );
		final Integer target = labels.getLocation( operand );
		if ( target == null ) {
			throw new UnresolvedSymbolException( line , operand , UnresolvedSymbolException.Kind.LABEL );
		}
		return BitWord.of( target , Misc.ADDRESS_BITS );
	}

	/*
	 * Lines that get no encoding here must still name something the tables know,
	 * otherwise the cell would silently keep a typo.
	 */
	private void checkResolvable(SourceLine line)
	{
		String mnemonic = line.firstToken();
		if ( isLabel( mnemonic ) ) {
			mnemonic = line.getToken( 1 );
		}
		if ( ! Directive.isDirective( mnemonic ) && ! instructionSet.isKnownMnemonic( mnemonic , options.getIndirectMarker() ) ) {
			throw new UnresolvedSymbolException( line , mnemonic , UnresolvedSymbolException.Kind.MNEMONIC );
		}
	}
}
