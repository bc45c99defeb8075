package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;

public class WhileGenerator implements Generator<CNextParser.WhileStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.WhileStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		Conditions.check(node.expression(), "while", input, state);
		return GeneratorOutput.of("while (" + orchestrator.generateUntyped(node.expression()) + ") "
				+ BlockGenerator.braced(node.statement(), orchestrator));
	}
}
