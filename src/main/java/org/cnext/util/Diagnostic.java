package org.cnext.util;

/**
 * A structured compiler diagnostic. Field names are part of the JSON output
 * written by {@code --emit-diagnostics}.
 */
public class Diagnostic
{
	public final String code;
	public final String file;
	public final int line;
	public final int column;
	public final String message;
	public final String hint;

	public Diagnostic(String code, String file, int line, int column, String message, String hint)
	{
		this.code = code;
		this.file = file;
		this.line = line;
		this.column = column;
		this.message = message;
		this.hint = hint;
	}

	@Override
	public String toString()
	{
		String base = String.format("%s:%d:%d %s: %s", file, line, column, code, message);
		return hint == null ? base : base + " (" + hint + ")";
	}
}
