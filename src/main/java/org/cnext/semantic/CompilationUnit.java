package org.cnext.semantic;

import org.cnext.parser.CNextParser;

/**
 * One parsed input file.
 */
public class CompilationUnit
{
	private final String file;
	private final CNextParser.ProgramContext tree;

	public CompilationUnit(String file, CNextParser.ProgramContext tree)
	{
		this.file = file;
		this.tree = tree;
	}

	public String getFile()
	{
		return file;
	}

	public CNextParser.ProgramContext getTree()
	{
		return tree;
	}

	/**
	 * A file that includes any header may use types that header defines.
	 */
	public boolean hasIncludes()
	{
		return !tree.includeDirective().isEmpty();
	}

	@Override
	public String toString()
	{
		return file;
	}
}
