package org.cnext.codegen.generators.expressions;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.type.PrimitiveType;

public class CastGenerator implements Generator<CNextParser.CastExpressionContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.CastExpressionContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		PrimitiveType target = PrimitiveType.fromKeyword(node.primitiveType().getText()).orElseThrow();
		return GeneratorOutput.of("(" + target.getCType() + ")" + orchestrator.generateUntyped(node.unaryExpression()));
	}
}
