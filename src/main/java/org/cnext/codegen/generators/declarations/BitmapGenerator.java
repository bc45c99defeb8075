package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.BitmapSymbol;

public class BitmapGenerator implements Generator<CNextParser.BitmapDeclarationContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.BitmapDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		BitmapSymbol bitmap = input.getRegistry().findBitmap(Placement.cNameOf(node.IDENTIFIER().getText(), state)).orElseThrow();
		if (Placement.inHeader(bitmap))
		{
			return GeneratorOutput.of("");
		}
		return GeneratorOutput.of(new TypeBodyRenderer(input.getTypeResolver(), input.getOptions().isCppMode()).renderBitmap(bitmap));
	}
}
