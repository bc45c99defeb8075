package org.cnext.codegen.generators.expressions;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.Optional;

/**
 * {@code (cond) ? a : b}. The condition must be boolean; the branches keep the
 * expected type of the whole expression.
 */
public class TernaryGenerator implements Generator<CNextParser.TernaryExpressionContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.TernaryExpressionContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		if (node.orExpression().size() == 1)
		{
			return GeneratorOutput.of(orchestrator.generate(node.orExpression(0)));
		}
		CNextParser.OrExpressionContext condition = node.orExpression(0);
		Optional<TypeDescriptor> type = input.getTypeResolver().resolveExpressionType(condition, state);
		if (type.isPresent() && !type.get().isBool())
		{
			throw new CompileException(ErrorCode.NON_BOOLEAN_CONDITION, condition,
					"Ternary condition must be a boolean expression, found " + type.get(), "compare explicitly, e.g. 'x != 0'");
		}
		String code = "(" + orchestrator.generateUntyped(condition) + ") ? "
				+ orchestrator.generate(node.orExpression(1)) + " : "
				+ orchestrator.generate(node.orExpression(2));
		return GeneratorOutput.of(code);
	}
}
