package de.codesourcery.bcasm.assembler.exceptions;

import de.codesourcery.bcasm.source.SourceLine;
import de.codesourcery.bcasm.utils.Misc;

public class AddressOverflowException extends AssemblyException
{
	public final int location;

	public AddressOverflowException(SourceLine line,String token,int location)
	{
		super( "Address "+location+" (0x"+Integer.toHexString( location )+") exceeds the "+Misc.ADDRESS_BITS+
				"-bit address space (0x000...0x"+Integer.toHexString( Misc.MAX_ADDRESS )+")" , line , token );
		this.location = location;
	}
}
