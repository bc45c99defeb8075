package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.EnumSymbol;

public class EnumGenerator implements Generator<CNextParser.EnumDeclarationContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.EnumDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		EnumSymbol enumSymbol = input.getRegistry().findEnum(Placement.cNameOf(node.IDENTIFIER().getText(), state)).orElseThrow();
		if (Placement.inHeader(enumSymbol))
		{
			return GeneratorOutput.of("");
		}
		return GeneratorOutput.of(new TypeBodyRenderer(input.getTypeResolver(), input.getOptions().isCppMode()).renderEnum(enumSymbol));
	}
}
