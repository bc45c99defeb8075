package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;

public class ExpressionStatementGenerator implements Generator<CNextParser.ExpressionStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.ExpressionStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		return GeneratorOutput.of(orchestrator.generateUntyped(node.expression()) + ";");
	}
}
