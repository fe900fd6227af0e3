package de.codesourcery.bcasm.assembler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import de.codesourcery.bcasm.utils.Misc;

/**
 * Result of an assembly run: memory contents by location plus the labels.
 */
public final class BinaryImage
{
	private final SortedMap<Integer,CellValue> cells;
	private final ILabelTable labels;

	public BinaryImage(AddressSymbolTable table,ILabelTable labels)
	{
		this.cells = Collections.unmodifiableSortedMap( new TreeMap<>( table.getCells() ) );
		this.labels = labels;
	}

	public SortedMap<Integer,CellValue> getCells() {
		return cells;
	}

	/**
	 * @param location
	 * @return cell or <code>null</code>
	 */
	public CellValue get(int location) {
		return cells.get( location );
	}

	public ILabelTable getLabels() {
		return labels;
	}

	public int size() {
		return cells.size();
	}

	public boolean isEmpty() {
		return cells.isEmpty();
	}

	/**
	 * @return locations holding cells that were never encoded, ascending
	 */
	public List<Integer> getUnresolvedLocations()
	{
		final List<Integer> result = new ArrayList<>();
		for ( Map.Entry<Integer,CellValue> entry : cells.entrySet() ) {
			if ( ! entry.getValue().isResolved() ) {
				result.add( entry.getKey() );
			}
		}
		return result;
	}

	public boolean isFullyResolved() {
		return getUnresolvedLocations().isEmpty();
	}

	/**
	 * Renders the image as 12-bit binary location to 16-bit binary word.
	 *
	 * Unresolved cells are rendered with their raw text.
	 *
	 * @return map in ascending location order
	 */
	public Map<String,String> toBinaryMap()
	{
		final Map<String,String> result = new LinkedHashMap<>();
		for ( Map.Entry<Integer,CellValue> entry : cells.entrySet() ) {
			result.put( Misc.toAddressString( entry.getKey() ) , entry.getValue().asString() );
		}
		return result;
	}

	@Override
	public int hashCode() {
		return cells.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof BinaryImage && ((BinaryImage) obj).cells.equals( cells );
	}

	@Override
	public String toString() {
		return toBinaryMap().toString();
	}
}
