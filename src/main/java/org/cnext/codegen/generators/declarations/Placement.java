package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorState;
import org.cnext.pipeline.TranspilerOptions;
import org.cnext.semantic.NameMangler;
import org.cnext.semantic.symbol.TypeSymbol;

/**
 * Where a type definition goes. Exported types are defined by the file's header,
 * which the implementation includes; file-local types are defined in the
 * implementation.
 */
final class Placement
{
	private Placement()
	{
	}

	static String cNameOf(String name, GeneratorState state)
	{
		return NameMangler.forMember(state.getCurrentScope().getPath(), name);
	}

	static boolean inHeader(TypeSymbol symbol)
	{
		return symbol.isExported();
	}

	/**
	 * With forward-declaring headers, the implementation still owns the layout of
	 * exported structs.
	 */
	static boolean layoutInImplementation(TypeSymbol symbol, GeneratorInput input)
	{
		return symbol.isExported() && input.getOptions().getHeaderLayout() == TranspilerOptions.HeaderLayout.FORWARD;
	}
}
