package de.codesourcery.bcasm.isa;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.bcasm.utils.BitWord;
import de.codesourcery.bcasm.utils.Misc;

/**
 * Reads instruction tables from plain text.
 *
 * <p>Each line holds a mnemonic and its binary encoding separated by whitespace,
 * e.g. <code>CLA 0111100000000000</code>. Mnemonics are lowercased. Blank lines
 * and lines starting with '/' are ignored.</p>
 */
public class InstructionTableLoader
{
	private static final Logger LOG = LoggerFactory.getLogger(InstructionTableLoader.class);

	public InstructionTable load(File file,InstructionClass instructionClass) throws IOException
	{
		Validate.notNull( file , "file must not be NULL" );
		try ( InputStream in = new FileInputStream( file ) ) {
			return load( in , file.getName() , instructionClass );
		}
	}

	public InstructionTable load(InputStream in,String sourceName,InstructionClass instructionClass) throws IOException
	{
		Validate.notNull( in , "input stream must not be NULL" );
		Validate.notNull( instructionClass , "instructionClass must not be NULL" );

		final List<String> lines = IOUtils.readLines( in , StandardCharsets.UTF_8 );
		final Map<String,BitWord> encodings = new LinkedHashMap<>();
		int lineNo = 0;
		for ( String line : lines )
		{
			lineNo++;
			final String trimmed = line.trim();
			if ( trimmed.isEmpty() || trimmed.startsWith("/") ) {
				continue;
			}
			final String[] parts = StringUtils.split( trimmed.toLowerCase() );
			if ( parts.length != 2 ) {
				throw new InstructionTableException("Expected '<mnemonic> <binary encoding>' but got '"+trimmed+"'",sourceName,lineNo);
			}
			final String mnemonic = parts[0];
			final String encoding = parts[1];
			if ( ! Misc.isValidBinary( encoding , instructionClass.getEncodingBits() ) ) {
				throw new InstructionTableException("Encoding of '"+mnemonic+"' must be a "+instructionClass.getEncodingBits()+
						"-bit binary string, got '"+encoding+"'",sourceName,lineNo);
			}
			if ( encodings.containsKey( mnemonic ) ) {
				throw new InstructionTableException("Duplicate mnemonic '"+mnemonic+"'",sourceName,lineNo);
			}
			encodings.put( mnemonic , BitWord.parse( encoding ) );
		}
		LOG.debug("Loaded {} {} instructions from {}",encodings.size(),instructionClass,sourceName);
		return new InstructionTable( instructionClass , encodings );
	}

	public InstructionTable loadDefault(InstructionClass instructionClass) throws IOException
	{
		final String resource = instructionClass.getDefaultResource();
		try ( InputStream in = InstructionTableLoader.class.getClassLoader().getResourceAsStream( resource ) )
		{
			if ( in == null ) {
				throw new IOException("Classpath resource "+resource+" not found");
			}
			return load( in , resource , instructionClass );
		}
	}

	/**
	 * Loads the instruction set bundled with this assembler.
	 *
	 * @return
	 * @throws IOException
	 */
	public InstructionSet loadDefaults() throws IOException
	{
		return new InstructionSet( loadDefault( InstructionClass.MEMORY_REFERENCE ),
				loadDefault( InstructionClass.REGISTER_REFERENCE ),
				loadDefault( InstructionClass.INPUT_OUTPUT ) );
	}
}
