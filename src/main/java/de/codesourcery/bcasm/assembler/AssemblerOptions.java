package de.codesourcery.bcasm.assembler;

import org.apache.commons.lang.StringUtils;

import com.typesafe.config.Config;

import de.codesourcery.bcasm.source.LineTokenizer;

/**
 * Settings for an assembly run.
 *
 * Defaults match <code>reference.conf</code>.
 */
public final class AssemblerOptions
{
	public static final String CONFIG_PREFIX = "bcasm";

	private String commentMarker = LineTokenizer.DEFAULT_COMMENT_MARKER;
	private String labelDelimiter = ",";
	private String indirectMarker = "i";
	private boolean requireEndDirective = true;

	public AssemblerOptions() {
	}

	public AssemblerOptions(AssemblerOptions other)
	{
		this.commentMarker = other.commentMarker;
		this.labelDelimiter = other.labelDelimiter;
		this.indirectMarker = other.indirectMarker;
		this.requireEndDirective = other.requireEndDirective;
	}

	/**
	 * Reads options from the <code>bcasm</code> section of a configuration.
	 *
	 * @param config configuration, usually with <code>reference.conf</code> as fallback
	 * @return
	 * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type
	 */
	public static AssemblerOptions fromConfig(Config config)
	{
		final Config section = config.getConfig( CONFIG_PREFIX );
		final AssemblerOptions result = new AssemblerOptions();
		result.setCommentMarker( section.getString("comment-marker") );
		result.setLabelDelimiter( section.getString("label-delimiter") );
		result.setIndirectMarker( section.getString("indirect-marker") );
		result.setRequireEndDirective( section.getBoolean("require-end") );
		return result;
	}

	private static String requireNonBlank(String value,String name)
	{
		if ( StringUtils.isBlank( value ) ) {
			throw new IllegalArgumentException( name+" must not be blank");
		}
		return value.toLowerCase();
	}

	public String getCommentMarker() {
		return commentMarker;
	}

	public void setCommentMarker(String commentMarker) {
		this.commentMarker = requireNonBlank( commentMarker , "commentMarker" );
	}

	public String getLabelDelimiter() {
		return labelDelimiter;
	}

	public void setLabelDelimiter(String labelDelimiter) {
		this.labelDelimiter = requireNonBlank( labelDelimiter , "labelDelimiter" );
	}

	public String getIndirectMarker() {
		return indirectMarker;
	}

	public void setIndirectMarker(String indirectMarker) {
		this.indirectMarker = requireNonBlank( indirectMarker , "indirectMarker" );
	}

	public boolean isRequireEndDirective() {
		return requireEndDirective;
	}

	public void setRequireEndDirective(boolean requireEndDirective) {
		this.requireEndDirective = requireEndDirective;
	}

	@Override
	public String toString() {
		return "AssemblerOptions[commentMarker="+commentMarker+", labelDelimiter="+labelDelimiter+
				", indirectMarker="+indirectMarker+", requireEndDirective="+requireEndDirective+"]";
	}
}
