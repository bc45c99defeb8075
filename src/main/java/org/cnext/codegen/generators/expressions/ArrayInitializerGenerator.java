package org.cnext.codegen.generators.expressions;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.ConstantEvaluator;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@code [1, 2, 3]} and the fill form {@code [v*]}. Reports the element count so
 * the declaration can size an array declared with {@code []}.
 */
public class ArrayInitializerGenerator implements Generator<CNextParser.ArrayInitializerContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.ArrayInitializerContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		TypeDescriptor expected = state.getExpectedType().filter(TypeDescriptor::isArray).orElse(null);
		TypeDescriptor element = expected != null ? expected.elementType() : null;
		Optional<Long> declaredCount = expected != null ? parseCount(expected.getDimensions().get(0)) : Optional.empty();

		if (node.STAR() != null)
		{
			return fill(node, element, declaredCount, input, state, orchestrator);
		}

		List<String> values = new ArrayList<>();
		for (CNextParser.ArrayInitializerElementContext item : node.arrayInitializerElement())
		{
			values.add(orchestrator.generateWithExpectedType((ParserRuleContext) item.getChild(0), element));
		}
		if (declaredCount.isPresent() && values.size() > declaredCount.get())
		{
			throw new CompileException(ErrorCode.INVALID_CONSTANT, node,
					String.format("Array initializer has %d elements but the array holds %d", values.size(), declaredCount.get()));
		}
		return GeneratorOutput.of("{" + String.join(", ", values) + "}", GenerationEffect.setArrayInitCount(values.size()));
	}

	private GeneratorOutput fill(CNextParser.ArrayInitializerContext node, TypeDescriptor element, Optional<Long> count,
								 GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		if (count.isEmpty())
		{
			throw new CompileException(ErrorCode.INVALID_CONSTANT, node,
					"Fill initializer '[" + node.expression().getText() + "*]' needs an array with a constant size");
		}
		String value = orchestrator.generateWithExpectedType(node.expression(), element);
		Optional<Long> folded = ConstantEvaluator.evaluate(node.expression(), CodegenUtils.constants(state, input.getTypeResolver()));
		if (folded.isPresent() && folded.get() == 0 || "false".equals(value))
		{
			return GeneratorOutput.of("{0}", GenerationEffect.setArrayInitCount(count.get()));
		}
		String code = "{" + String.join(", ", Collections.nCopies(count.get().intValue(), value)) + "}";
		return GeneratorOutput.of(code, GenerationEffect.setArrayInitCount(count.get()));
	}

	private static Optional<Long> parseCount(String dimension)
	{
		try
		{
			return dimension.isEmpty() ? Optional.empty() : Optional.of(Long.parseLong(dimension));
		}
		catch (NumberFormatException e)
		{
			return Optional.empty();
		}
	}
}
