package de.codesourcery.bcasm.assembler;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.commons.lang.Validate;

import de.codesourcery.bcasm.utils.Misc;

/**
 * Location to {@link CellValue} mapping, iterated in ascending location order.
 */
public final class AddressSymbolTable
{
	private final SortedMap<Integer,CellValue> cells;
	private final boolean readOnly;

	public AddressSymbolTable() {
		this( new TreeMap<Integer,CellValue>() , false );
	}

	private AddressSymbolTable(SortedMap<Integer,CellValue> cells,boolean readOnly)
	{
		this.cells = cells;
		this.readOnly = readOnly;
	}

	public void put(int location,CellValue value)
	{
		if ( readOnly ) {
			throw new UnsupportedOperationException("Address symbol table is read-only");
		}
		if ( ! Misc.isValidAddress( location ) ) {
			throw new IllegalArgumentException("Location out of range: "+location);
		}
		Validate.notNull( value , "value must not be NULL" );
		cells.put( location , value );
	}

	/**
	 * @param location
	 * @return cell value or <code>null</code> if nothing was assigned to this location
	 */
	public CellValue get(int location) {
		return cells.get( location );
	}

	public boolean contains(int location) {
		return cells.containsKey( location );
	}

	public int size() {
		return cells.size();
	}

	public boolean isEmpty() {
		return cells.isEmpty();
	}

	public boolean isReadOnly() {
		return readOnly;
	}

	/**
	 * @return read-only view of all cells
	 */
	public SortedMap<Integer,CellValue> getCells() {
		return Collections.unmodifiableSortedMap( cells );
	}

	/**
	 * @return independent, writable copy
	 */
	public AddressSymbolTable mutableCopy() {
		return new AddressSymbolTable( new TreeMap<>( cells ) , false );
	}

	/**
	 * @return independent, read-only copy
	 */
	public AddressSymbolTable snapshot() {
		return new AddressSymbolTable( new TreeMap<>( cells ) , true );
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder("=== Address symbol table ===\n");
		for ( Map.Entry<Integer,CellValue> entry : cells.entrySet() ) {
			buffer.append("\n").append( Misc.toAddressString( entry.getKey() ) ).append(" : ").append( entry.getValue() );
		}
		return buffer.toString();
	}
}
