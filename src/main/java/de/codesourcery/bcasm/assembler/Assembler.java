package de.codesourcery.bcasm.assembler;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.bcasm.isa.InstructionSet;
import de.codesourcery.bcasm.source.LineTokenizer;
import de.codesourcery.bcasm.source.SourceLine;

/**
 * Two-pass assembler for the Basic Computer.
 *
 * <p>Pass 1 assigns locations and records labels, pass 2 encodes instructions.
 * Instances keep no state between runs and can be reused.</p>
 */
public class Assembler
{
	private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);

	private final InstructionSet instructionSet;
	private final AssemblerOptions options;

	public Assembler(InstructionSet instructionSet) {
		this( instructionSet , new AssemblerOptions() );
	}

	public Assembler(InstructionSet instructionSet,AssemblerOptions options)
	{
		Validate.notNull( instructionSet , "instructionSet must not be NULL" );
		Validate.notNull( options , "options must not be NULL" );
		this.instructionSet = instructionSet;
		this.options = new AssemblerOptions( options );
	}

	public BinaryImage assemble(String source) {
		return assemble( createTokenizer().tokenize( source ) );
	}

	public BinaryImage assemble(File file) throws IOException
	{
		LOG.debug("Assembling {}", file );
		return assemble( createTokenizer().read( file ) );
	}

	public BinaryImage assemble(List<SourceLine> lines)
	{
		Validate.notNull( lines , "lines must not be NULL" );
		final FirstPassResult firstPass = new FirstPass( options ).scan( lines );
		return new SecondPass( instructionSet , options ).encode( lines , firstPass );
	}

	public LineTokenizer createTokenizer() {
		return new LineTokenizer( options.getCommentMarker() );
	}

	public InstructionSet getInstructionSet() {
		return instructionSet;
	}

	public AssemblerOptions getOptions() {
		return new AssemblerOptions( options );
	}
}
