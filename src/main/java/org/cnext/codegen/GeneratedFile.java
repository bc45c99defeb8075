package org.cnext.codegen;

import org.cnext.codegen.helpers.HelperDemand;

import java.util.List;

/**
 * The result of generating one source file: the implementation text plus what
 * the header generator and helper synthesis need to know about it.
 */
public final class GeneratedFile
{
	private final String sourceFile;
	private final String baseName;
	private final String implementation;
	private final List<IncludeLine> includes;
	private final HelperDemand helperDemand;
	private final boolean usesIsr;

	public GeneratedFile(String sourceFile, String baseName, String implementation, List<IncludeLine> includes, HelperDemand helperDemand, boolean usesIsr)
	{
		this.sourceFile = sourceFile;
		this.baseName = baseName;
		this.implementation = implementation;
		this.includes = List.copyOf(includes);
		this.helperDemand = helperDemand;
		this.usesIsr = usesIsr;
	}

	public String getSourceFile()
	{
		return sourceFile;
	}

	public String getBaseName()
	{
		return baseName;
	}

	public String getImplementation()
	{
		return implementation;
	}

	public List<IncludeLine> getIncludes()
	{
		return includes;
	}

	public HelperDemand getHelperDemand()
	{
		return helperDemand;
	}

	public boolean usesIsr()
	{
		return usesIsr;
	}
}
