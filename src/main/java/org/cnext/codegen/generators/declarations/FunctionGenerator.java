package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.SignatureBuilder;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.NameMangler;
import org.cnext.semantic.TypeResolver;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Function definitions. Parameter bindings are installed before the body is
 * generated; the signature comes from {@link SignatureBuilder}, the same source
 * the headers use. Bit-access shadows of float variables requested while
 * generating the body are declared at its top.
 */
public class FunctionGenerator implements Generator<CNextParser.FunctionDeclarationContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.FunctionDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		String cName = NameMangler.forFunction(state.getCurrentScope().getPath(), node.IDENTIFIER().getText(), input.getRegistry().getEntryPoint());
		FunctionSymbol fn = input.getRegistry().findFunction(cName).orElseThrow();
		SignatureBuilder signatures = input.getSignatureBuilder();
		Debug.logDebug("Generating function " + cName);

		orchestrator.applyEffects(List.of(
				GenerationEffect.setParameters(signatures.bindAll(fn)),
				GenerationEffect.enterFunctionBody(cName)));

		String body = orchestrator.generate(node.block());
		List<String> shadows = new ArrayList<>();
		for (String shadow : state.getFloatShadows())
		{
			TypeDescriptor shadowType = state.getRegisteredType(shadow).orElseThrow();
			shadows.add(shadowType.getBaseCType() + " " + shadow + ";");
		}
		if (!shadows.isEmpty())
		{
			body = "{\n" + CodeGenerator.indent(String.join("\n", shadows)) + body.substring(1);
		}

		List<GenerationEffect> effects = new ArrayList<>();
		if (usesIsr(fn, input.getTypeResolver()))
		{
			effects.add(GenerationEffect.isrTypedef());
		}
		effects.add(GenerationEffect.exitFunctionBody());
		effects.add(GenerationEffect.clearParameters());
		return new GeneratorOutput(signatures.renderDefinitionHead(fn) + " " + body, effects);
	}

	private static boolean usesIsr(FunctionSymbol fn, TypeResolver types)
	{
		if (types.isIsrType(fn.getReturnType()))
		{
			return true;
		}
		for (ParameterSymbol parameter : fn.getParameters())
		{
			if (types.isIsrType(parameter.getType()))
			{
				return true;
			}
		}
		return false;
	}
}
