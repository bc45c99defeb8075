package org.cnext.headers;

import org.cnext.pipeline.TranspilerOptions;
import org.cnext.semantic.ParameterMutationTable;
import org.cnext.semantic.TypeResolver;

import java.util.Set;

/**
 * The {@code .hpp} header for C++ builds. Structs and typed enums use the C++
 * spelling and the declarations keep C++ linkage.
 */
public class CppHeaderGenerator extends HeaderGenerator
{
	public CppHeaderGenerator(TypeResolver typeResolver, ParameterMutationTable mutationTable, TranspilerOptions options, Set<String> callbackTypes)
	{
		super(typeResolver, mutationTable, options, callbackTypes);
	}

	@Override
	protected boolean isCppSpelling()
	{
		return true;
	}

	@Override
	protected boolean wrapsExternC()
	{
		return false;
	}

	@Override
	public String getExtension()
	{
		return ".hpp";
	}
}
