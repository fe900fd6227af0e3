package de.codesourcery.bcasm.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang.StringUtils;

/**
 * One line of assembly source.
 *
 * <p>Tokens are lowercase with comments already removed. The raw text is kept
 * as read so error messages can show what the user actually wrote.</p>
 */
public final class SourceLine
{
	private final int lineNumber;
	private final String text;
	private final List<String> tokens;

	public SourceLine(int lineNumber,String text,List<String> tokens)
	{
		if ( lineNumber < 1 ) {
			throw new IllegalArgumentException("Line numbers are 1-based, got "+lineNumber);
		}
		this.lineNumber = lineNumber;
		this.text = text == null ? "" : text;
		this.tokens = Collections.unmodifiableList( new ArrayList<>( tokens ) );
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public String getText() {
		return text;
	}

	public List<String> getTokens() {
		return tokens;
	}

	public boolean isEmpty() {
		return tokens.isEmpty();
	}

	public int size() {
		return tokens.size();
	}

	public boolean hasToken(int index) {
		return index >= 0 && index < tokens.size();
	}

	public String getToken(int index) {
		return tokens.get( index );
	}

	public String firstToken() {
		return tokens.isEmpty() ? null : tokens.get(0);
	}

	@Override
	public String toString() {
		return "line "+lineNumber+": "+StringUtils.join( tokens , ' ' );
	}
}
