package de.codesourcery.bcasm.utils;

import java.util.Map;

import org.apache.commons.lang.StringUtils;

import de.codesourcery.bcasm.assembler.BinaryImage;
import de.codesourcery.bcasm.assembler.CellValue;
import de.codesourcery.bcasm.assembler.ILabelTable;

/**
 * Renders a {@link BinaryImage} as a text listing, one location per line.
 */
public class ImageFormatter
{
	public enum Format
	{
		/**
		 * <code>000100000000 0111100000000000</code>
		 */
		BINARY,
		/**
		 * <code>100: 7800</code>
		 */
		HEX;
	}

	private final Format format;

	public ImageFormatter(Format format) {
		this.format = format;
	}

	public String format(BinaryImage image)
	{
		final StringBuilder buffer = new StringBuilder();
		for ( Map.Entry<Integer,CellValue> entry : image.getCells().entrySet() )
		{
			final int location = entry.getKey();
			final CellValue value = entry.getValue();
			switch( format )
			{
				case BINARY:
					buffer.append( Misc.toAddressString( location ) ).append(' ').append( value.asString() );
					break;
				case HEX:
					buffer.append( Misc.to12BitHex( location ) ).append(": ").append( hex( value ) );
					break;
				default:
					throw new RuntimeException("Unhandled format: "+format);
			}
			buffer.append('\n');
		}
		return buffer.toString();
	}

	private static String hex(CellValue value)
	{
		return value.accept( new CellValue.IVisitor<String>()
		{
			@Override
			public String visitRaw(CellValue.Raw raw) {
				return raw.text+" (unresolved)";
			}

			@Override
			public String visitEncoded(CellValue.Encoded encoded) {
				return Misc.to16BitHex( encoded.word.getValue() );
			}
		});
	}

	public String formatLabels(ILabelTable labels)
	{
		int width = 0;
		for ( String label : labels.getLabels().keySet() ) {
			width = Math.max( width , label.length() );
		}
		final StringBuilder buffer = new StringBuilder();
		for ( Map.Entry<String,Integer> entry : labels.getLabels().entrySet() )
		{
			final String address = format == Format.HEX ? Misc.to12BitHex( entry.getValue() ) : Misc.toAddressString( entry.getValue() );
			buffer.append( StringUtils.rightPad( entry.getKey() , width ) ).append(' ').append( address ).append('\n');
		}
		return buffer.toString();
	}
}
