package de.codesourcery.bcasm.assembler;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.commons.lang.StringUtils;

import de.codesourcery.bcasm.assembler.exceptions.DuplicateLabelException;
import de.codesourcery.bcasm.source.SourceLine;
import de.codesourcery.bcasm.utils.Misc;

public final class LabelTable implements ILabelTable
{
	private final SortedMap<String,Integer> labels = new TreeMap<>();

	/**
	 * Binds a label to a location.
	 *
	 * @param label
	 * @param location
	 * @param line line that defines the label, used for error reporting
	 * @throws DuplicateLabelException if the label is already defined
	 */
	public void define(String label,int location,SourceLine line)
	{
		if ( StringUtils.isBlank( label ) ) {
			throw new IllegalArgumentException("label must not be blank");
		}
		final Integer existing = labels.get( label );
		if ( existing != null ) {
			throw new DuplicateLabelException( line , label , existing );
		}
		labels.put( label , location );
	}

	@Override
	public boolean isDefined(String label) {
		return label != null && labels.containsKey( label );
	}

	@Override
	public Integer getLocation(String label) {
		return label == null ? null : labels.get( label );
	}

	@Override
	public SortedMap<String,Integer> getLabels() {
		return Collections.unmodifiableSortedMap( labels );
	}

	/**
	 * @return read-only copy
	 */
	public ILabelTable snapshot()
	{
		final SortedMap<String,Integer> copy = Collections.unmodifiableSortedMap( new TreeMap<>( labels ) );
		return new ILabelTable()
		{
			@Override
			public boolean isDefined(String label) {
				return label != null && copy.containsKey( label );
			}

			@Override
			public Integer getLocation(String label) {
				return label == null ? null : copy.get( label );
			}

			@Override
			public SortedMap<String,Integer> getLabels() {
				return copy;
			}

			@Override
			public String toString() {
				return format( copy );
			}
		};
	}

	@Override
	public String toString() {
		return format( labels );
	}

	private static String format(Map<String,Integer> labels)
	{
		final StringBuilder buffer = new StringBuilder("=== Label table ===\n");
		for ( Map.Entry<String,Integer> entry : labels.entrySet() ) {
			buffer.append("\n").append( entry.getKey() ).append(" : ").append( Misc.to12BitHex( entry.getValue() ) );
		}
		return buffer.toString();
	}
}
