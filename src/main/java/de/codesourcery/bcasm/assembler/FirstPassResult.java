package de.codesourcery.bcasm.assembler;

import de.codesourcery.bcasm.source.SourceLine;

/**
 * Immutable outcome of the first pass.
 */
public final class FirstPassResult
{
	private final AddressSymbolTable symbolTable;
	private final ILabelTable labelTable;
	private final SourceLine endLine;

	public FirstPassResult(AddressSymbolTable symbolTable,ILabelTable labelTable,SourceLine endLine)
	{
		if ( ! symbolTable.isReadOnly() ) {
			throw new IllegalArgumentException("symbol table must be a read-only snapshot");
		}
		this.symbolTable = symbolTable;
		this.labelTable = labelTable;
		this.endLine = endLine;
	}

	public AddressSymbolTable getSymbolTable() {
		return symbolTable;
	}

	public ILabelTable getLabelTable() {
		return labelTable;
	}

	public boolean isEndSeen() {
		return endLine != null;
	}

	/**
	 * @return the line holding the END directive or <code>null</code>
	 */
	public SourceLine getEndLine() {
		return endLine;
	}
}
