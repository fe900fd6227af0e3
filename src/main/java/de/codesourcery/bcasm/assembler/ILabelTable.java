package de.codesourcery.bcasm.assembler;

import java.util.SortedMap;

/**
 * Read access to label definitions.
 */
public interface ILabelTable
{
	public boolean isDefined(String label);

	/**
	 * @param label
	 * @return location or <code>null</code> if the label is not defined
	 */
	public Integer getLocation(String label);

	/**
	 * @return all labels sorted by name
	 */
	public SortedMap<String,Integer> getLabels();
}
