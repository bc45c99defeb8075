package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.TypeResolver;
import org.cnext.semantic.symbol.StructSymbol;

import java.util.ArrayList;
import java.util.List;

/**
 * Struct definitions. Callback-typed fields are recorded so initializers and
 * assignments can check the functions stored in them.
 */
public class StructGenerator implements Generator<CNextParser.StructDeclarationContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.StructDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		String cName = Placement.cNameOf(node.IDENTIFIER().getText(), state);
		StructSymbol struct = input.getRegistry().findStruct(cName).orElseThrow();
		TypeResolver types = input.getTypeResolver();

		List<GenerationEffect> effects = new ArrayList<>();
		for (StructSymbol.Field field : struct.getFields().values())
		{
			if (types.isCallbackType(field.getType()))
			{
				effects.add(GenerationEffect.registerCallbackField(cName + "." + field.getName(), field.getType().getUserTypeName()));
			}
			if (types.isIsrType(field.getType()))
			{
				effects.add(GenerationEffect.isrTypedef());
			}
		}

		TypeBodyRenderer renderer = new TypeBodyRenderer(types, input.getOptions().isCppMode());
		String code;
		if (Placement.layoutInImplementation(struct, input))
		{
			code = renderer.renderStructLayout(struct);
		}
		else if (Placement.inHeader(struct))
		{
			code = "";
		}
		else
		{
			code = renderer.renderStruct(struct);
		}
		return new GeneratorOutput(code, effects);
	}
}
