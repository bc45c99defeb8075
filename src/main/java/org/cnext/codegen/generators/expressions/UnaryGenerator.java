package org.cnext.codegen.generators.expressions;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.Optional;

public class UnaryGenerator implements Generator<CNextParser.UnaryExpressionContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.UnaryExpressionContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		if (node.postfixExpression() != null)
		{
			return GeneratorOutput.of(orchestrator.generate(node.postfixExpression()));
		}
		String operand = node.NOT() != null
				? orchestrator.generateUntyped(node.unaryExpression())
				: orchestrator.generate(node.unaryExpression());
		if (node.NOT() != null)
		{
			return GeneratorOutput.of("!" + operand);
		}
		if (node.MINUS() != null)
		{
			return GeneratorOutput.of(operand.startsWith("-") ? "-(" + operand + ")" : "-" + operand);
		}
		if (node.BITAND() != null)
		{
			return GeneratorOutput.of("&" + operand);
		}

		// ~ promotes to int; narrow unsigned results are cast back
		Optional<PrimitiveType> type = input.getTypeResolver().resolveExpressionType(node.unaryExpression(), state)
				.filter(TypeDescriptor::isInteger)
				.map(TypeDescriptor::getPrimitive);
		if (type.isPresent() && !type.get().isSigned() && type.get().getBits() < 32)
		{
			return GeneratorOutput.of("(" + type.get().getCType() + ")~" + operand);
		}
		return GeneratorOutput.of("~" + operand);
	}
}
