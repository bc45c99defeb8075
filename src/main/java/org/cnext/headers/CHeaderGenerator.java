package org.cnext.headers;

import org.cnext.pipeline.TranspilerOptions;
import org.cnext.semantic.ParameterMutationTable;
import org.cnext.semantic.TypeResolver;

import java.util.Set;

/**
 * The {@code .h} header: C type spelling, declarations wrapped in
 * {@code extern "C"} when included from C++.
 */
public class CHeaderGenerator extends HeaderGenerator
{
	public CHeaderGenerator(TypeResolver typeResolver, ParameterMutationTable mutationTable, TranspilerOptions options, Set<String> callbackTypes)
	{
		super(typeResolver, mutationTable, options, callbackTypes);
	}

	@Override
	protected boolean isCppSpelling()
	{
		return false;
	}

	@Override
	protected boolean wrapsExternC()
	{
		return true;
	}

	@Override
	public String getExtension()
	{
		return ".h";
	}
}
