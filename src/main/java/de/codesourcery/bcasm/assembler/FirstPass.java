package de.codesourcery.bcasm.assembler;

import java.util.List;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.bcasm.assembler.exceptions.MalformedLiteralException;
import de.codesourcery.bcasm.assembler.exceptions.MissingEndDirectiveException;
import de.codesourcery.bcasm.source.SourceLine;
import de.codesourcery.bcasm.utils.BitWord;
import de.codesourcery.bcasm.utils.Misc;

/**
 * Assigns locations and collects labels.
 *
 * <p>Nothing gets encoded here except HEX literals, every other
 * instruction is recorded as the raw mnemonic for the second pass.</p>
 */
public class FirstPass extends AbstractPass
{
	private static final Logger LOG = LoggerFactory.getLogger(FirstPass.class);

	public FirstPass(AssemblerOptions options) {
		super(options);
	}

	public FirstPassResult scan(List<SourceLine> lines)
	{
		Validate.notNull( lines , "lines must not be NULL" );

		final AddressSymbolTable symbols = new AddressSymbolTable();
		final LabelTable labels = new LabelTable();
		SourceLine endLine = null;

		int location = 0;
		for ( SourceLine line : lines )
		{
			if ( line.isEmpty() ) {
				continue;
			}
			final String opcode = line.firstToken();
			if ( isLabel( opcode ) )
			{
				checkLocation( line , location );
				final String label = labelName( line );
				final String instruction = requireToken( line , 1 , "Label '"+label+"' must be followed by an instruction or HEX" );
				labels.define( label , location , line );
				if ( Directive.HEX.keyword.equals( instruction ) ) {
					symbols.put( location , CellValue.encoded( parseHexWord( line ) ) );
				} else {
					symbols.put( location , CellValue.raw( instruction ) );
				}
				LOG.trace("{} : label {} -> {}", Misc.to12BitHex( location ) , label , symbols.get( location ) );
			}
			else if ( Directive.ORG.keyword.equals( opcode ) )
			{
				location = parseOrigin( line );
				LOG.trace("ORG {}", Misc.to12BitHex( location ) );
				continue;
			}
			else if ( Directive.END.keyword.equals( opcode ) )
			{
				endLine = line;
				break;
			}
			else
			{
				checkLocation( line , location );
				symbols.put( location , CellValue.raw( opcode ) );
			}
			location++;
		}

		if ( endLine == null && options.isRequireEndDirective() ) {
			throw new MissingEndDirectiveException( lastLine( lines ) );
		}
		LOG.debug("Pass 1 finished: {} locations, {} labels", symbols.size() , labels.getLabels().size() );
		return new FirstPassResult( symbols.snapshot() , labels.snapshot() , endLine );
	}

	private static BitWord parseHexWord(SourceLine line)
	{
		final String literal = requireToken( line , 2 , "HEX requires a hexadecimal value" );
		final Integer value = Misc.parseHex( literal );
		if ( value == null || value > Misc.MAX_WORD ) {
			throw new MalformedLiteralException( line , literal , "hexadecimal value 0...ffff" );
		}
		return BitWord.word( value );
	}

	private static SourceLine lastLine(List<SourceLine> lines) {
		return lines.isEmpty() ? null : lines.get( lines.size() - 1 );
	}
}
