package de.codesourcery.bcasm.assembler.exceptions;

import de.codesourcery.bcasm.source.SourceLine;
import de.codesourcery.bcasm.utils.Misc;

public class DuplicateLabelException extends AssemblyException
{
	public final String label;

	public DuplicateLabelException(SourceLine line,String label,int previousLocation)
	{
		super( "Duplicate label '"+label+"', already defined at "+Misc.to12BitHex( previousLocation ) , line , label );
		this.label = label;
	}
}
