package de.codesourcery.bcasm;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import de.codesourcery.bcasm.assembler.Assembler;
import de.codesourcery.bcasm.assembler.AssemblerOptions;
import de.codesourcery.bcasm.assembler.BinaryImage;
import de.codesourcery.bcasm.assembler.exceptions.AssemblyException;
import de.codesourcery.bcasm.isa.InstructionClass;
import de.codesourcery.bcasm.isa.InstructionSet;
import de.codesourcery.bcasm.isa.InstructionTableException;
import de.codesourcery.bcasm.isa.InstructionTableLoader;
import de.codesourcery.bcasm.utils.ImageFormatter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

/**
 * Command line front end.
 */
@Command(
	name = "bcasm",
	mixinStandardHelpOptions = true,
	version = "bcasm 1.0",
	description = "Assembles Basic Computer source (.asm/.S) into a binary listing"
)
public class Main implements Callable<Integer>
{
	private static final Logger LOG = LoggerFactory.getLogger(Main.class);

	public static final int EXIT_OK = 0;
	public static final int EXIT_ASSEMBLY_ERROR = 1;
	public static final int EXIT_USAGE = 2;

	@Parameters(index = "0", paramLabel = "SOURCE", description = "Assembly source file (.asm or .S)")
	private File source;

	@Option(names = "--mri", paramLabel = "FILE", description = "Memory-reference instruction table (default: bundled)")
	private File mriTable;

	@Option(names = "--rri", paramLabel = "FILE", description = "Register-reference instruction table (default: bundled)")
	private File rriTable;

	@Option(names = "--ioi", paramLabel = "FILE", description = "Input/output instruction table (default: bundled)")
	private File ioiTable;

	@Option(names = {"-c", "--config"}, paramLabel = "FILE", description = "Configuration file overriding reference.conf")
	private File configFile;

	@Option(names = {"-f", "--format"}, description = "Listing format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private ImageFormatter.Format format = ImageFormatter.Format.BINARY;

	@Option(names = "-o", paramLabel = "FILE", description = "Write listing to file instead of stdout")
	private File outputFile;

	@Option(names = "--symbols", description = "Also print the label table")
	private boolean printSymbols;

	@Option(names = "--lenient", description = "Accept sources without END directive")
	private boolean lenient;

	@Spec
	private CommandSpec spec;

	public static void main(String[] args)
	{
		System.exit( createCommandLine().execute( args ) );
	}

	public static CommandLine createCommandLine()
	{
		final CommandLine commandLine = new CommandLine( new Main() );
		commandLine.setCaseInsensitiveEnumValuesAllowed( true );
		commandLine.setExitCodeExceptionMapper( t -> EXIT_USAGE );
		return commandLine;
	}

	@Override
	public Integer call()
	{
		final AssemblerOptions options;
		final InstructionSet instructionSet;
		try {
			options = loadOptions();
			instructionSet = loadInstructionSet();
		}
		catch (IOException | InstructionTableException | ConfigException | IllegalArgumentException e)
		{
			LOG.error("Failed to load configuration: {}", e.getMessage());
			spec.commandLine().getErr().println( "ERROR: "+e.getMessage() );
			return EXIT_USAGE;
		}

		final BinaryImage image;
		try {
			image = new Assembler( instructionSet , options ).assemble( source );
		}
		catch(AssemblyException e)
		{
			LOG.debug("Assembly of {} failed", source.getName() , e );
			spec.commandLine().getErr().println( source.getName()+": "+e.getMessage() );
			return EXIT_ASSEMBLY_ERROR;
		}
		catch(IOException | IllegalArgumentException e)
		{
			spec.commandLine().getErr().println( "ERROR: "+e.getMessage() );
			return EXIT_USAGE;
		}

		if ( ! image.isFullyResolved() ) {
			LOG.warn("{} location(s) could not be encoded: {}", image.getUnresolvedLocations().size() , image.getUnresolvedLocations() );
		}
		final ImageFormatter formatter = new ImageFormatter( format );
		String listing = formatter.format( image );
		if ( printSymbols ) {
			listing += "\n"+formatter.formatLabels( image.getLabels() );
		}
		try {
			write( listing );
		} catch (IOException e) {
			spec.commandLine().getErr().println( "ERROR: Failed to write "+outputFile+": "+e.getMessage() );
			return EXIT_USAGE;
		}
		return EXIT_OK;
	}

	private void write(String listing) throws IOException
	{
		if ( outputFile != null ) {
			FileUtils.writeStringToFile( outputFile , listing , StandardCharsets.UTF_8 );
			LOG.info("Wrote {}", outputFile );
			return;
		}
		final PrintWriter out = spec.commandLine().getOut();
		out.print( listing );
		out.flush();
	}

	private AssemblerOptions loadOptions() throws IOException
	{
		Config config = ConfigFactory.load();
		if ( configFile != null )
		{
			if ( ! configFile.isFile() ) {
				throw new IOException("Configuration file not found: "+configFile.getAbsolutePath());
			}
			config = ConfigFactory.parseFile( configFile ).withFallback( config ).resolve();
		}
		final AssemblerOptions options = AssemblerOptions.fromConfig( config );
		if ( lenient ) {
			options.setRequireEndDirective( false );
		}
		return options;
	}

	private InstructionSet loadInstructionSet() throws IOException
	{
		final InstructionTableLoader loader = new InstructionTableLoader();
		InstructionSet result = loader.loadDefaults();
		if ( mriTable != null ) {
			result = result.withTable( loader.load( mriTable , InstructionClass.MEMORY_REFERENCE ) );
		}
		if ( rriTable != null ) {
			result = result.withTable( loader.load( rriTable , InstructionClass.REGISTER_REFERENCE ) );
		}
		if ( ioiTable != null ) {
			result = result.withTable( loader.load( ioiTable , InstructionClass.INPUT_OUTPUT ) );
		}
		return result;
	}
}
