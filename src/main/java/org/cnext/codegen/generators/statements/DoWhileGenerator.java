package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;

public class DoWhileGenerator implements Generator<CNextParser.DoWhileStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.DoWhileStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		Conditions.check(node.expression(), "do-while", input, state);
		String body = orchestrator.generate(node.block());
		return GeneratorOutput.of("do " + body + " while (" + orchestrator.generateUntyped(node.expression()) + ");");
	}
}
