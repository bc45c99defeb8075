package org.cnext.codegen;

import org.cnext.util.FileUtils;

/**
 * An {@code #include} from a source file, kept unrendered so each output (C
 * implementation, C header, C++ header) can spell C-Next includes with its own
 * extension.
 */
public final class IncludeLine
{
	private final String target;
	private final boolean system;

	public IncludeLine(String target, boolean system)
	{
		this.target = target;
		this.system = system;
	}

	/**
	 * Parses the text of an include directive, e.g. {@code #include "motor.cnx"}.
	 */
	public static IncludeLine parse(String directive)
	{
		String text = directive.trim();
		int angle = text.indexOf('<');
		int quote = text.indexOf('"');
		if (angle >= 0 && (quote < 0 || angle < quote))
		{
			return new IncludeLine(text.substring(angle + 1, text.lastIndexOf('>')), true);
		}
		return new IncludeLine(text.substring(quote + 1, text.lastIndexOf('"')), false);
	}

	public String getTarget()
	{
		return target;
	}

	public boolean isCNext()
	{
		String extension = FileUtils.getFileExtension(target);
		return ".cnx".equals(extension) || ".cnext".equals(extension);
	}

	/**
	 * @param headerExtension {@code .h} or {@code .hpp}; replaces a C-Next extension
	 */
	public String render(String headerExtension)
	{
		String path = isCNext() ? FileUtils.replaceExtension(target, headerExtension) : target;
		return system ? "#include <" + path + ">" : "#include \"" + path + "\"";
	}

	@Override
	public String toString()
	{
		return render(".h");
	}
}
