package de.codesourcery.bcasm.source;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

/**
 * Splits assembly source into lowercase, whitespace-delimited tokens.
 *
 * <p>A token starting with the comment marker starts a comment, it and everything
 * after it on the same line is dropped. Lines left without tokens are still returned
 * so that line numbers stay intact.</p>
 */
public class LineTokenizer
{
	public static final String DEFAULT_COMMENT_MARKER = "/";

	private final String commentMarker;

	public LineTokenizer() {
		this( DEFAULT_COMMENT_MARKER );
	}

	public LineTokenizer(String commentMarker)
	{
		if ( StringUtils.isBlank( commentMarker ) ) {
			throw new IllegalArgumentException("Comment marker must not be blank");
		}
		this.commentMarker = commentMarker;
	}

	public List<SourceLine> tokenize(String source)
	{
		Validate.notNull( source , "source must not be NULL" );

		final List<SourceLine> result = new ArrayList<>();
		final String[] lines = source.split("\r?\n|\r",-1);
		int count = lines.length;
		// a trailing newline does not start another line
		if ( count > 0 && lines[count-1].isEmpty() ) {
			count--;
		}
		for ( int i = 0 ; i < count ; i++ ) {
			result.add( tokenizeLine( i+1 , lines[i] ) );
		}
		return result;
	}

	public SourceLine tokenizeLine(int lineNumber,String text)
	{
		final List<String> tokens = new ArrayList<>();
		for ( String token : StringUtils.split( StringUtils.defaultString( text ).toLowerCase() ) )
		{
			if ( token.startsWith( commentMarker ) ) {
				break;
			}
			tokens.add( token );
		}
		return new SourceLine( lineNumber , text , tokens );
	}

	/**
	 * Reads and tokenizes an assembly source file.
	 *
	 * @param file file ending with <code>.asm</code> or <code>.S</code>
	 * @return
	 * @throws IOException
	 */
	public List<SourceLine> read(File file) throws IOException
	{
		Validate.notNull( file , "file must not be NULL" );
		if ( ! isSourceFile( file ) ) {
			throw new IllegalArgumentException("File "+file.getName()+" does not end with .asm or .S");
		}
		return tokenize( FileUtils.readFileToString( file , StandardCharsets.UTF_8 ) );
	}

	public static boolean isSourceFile(File file)
	{
		final String extension = FilenameUtils.getExtension( file.getName() );
		return "asm".equals( extension ) || "S".equals( extension );
	}

	public String getCommentMarker() {
		return commentMarker;
	}
}
