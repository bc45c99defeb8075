package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.RegisterSymbol;

/**
 * Register members become {@code #define}d volatile lvalues at base + offset.
 * Access rules are enforced where members are read and written, not here.
 */
public class RegisterGenerator implements Generator<CNextParser.RegisterDeclarationContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.RegisterDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		RegisterSymbol register = input.getRegistry().findRegister(Placement.cNameOf(node.IDENTIFIER().getText(), state)).orElseThrow();
		if (Placement.inHeader(register))
		{
			return GeneratorOutput.of("");
		}
		return GeneratorOutput.of(new TypeBodyRenderer(input.getTypeResolver(), input.getOptions().isCppMode()).renderRegister(register));
	}
}
