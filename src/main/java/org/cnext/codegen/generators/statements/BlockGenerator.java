package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;

import java.util.ArrayList;
import java.util.List;

public class BlockGenerator implements Generator<CNextParser.BlockContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.BlockContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		List<String> statements = new ArrayList<>();
		for (CNextParser.StatementContext statement : node.statement())
		{
			String code = orchestrator.generate(statement);
			if (!code.isBlank())
			{
				statements.add(code);
			}
		}
		if (statements.isEmpty())
		{
			return GeneratorOutput.of("{\n}");
		}
		return GeneratorOutput.of("{\n" + CodeGenerator.indent(String.join("\n", statements)) + "\n}");
	}

	/**
	 * Braces a statement that is not already a block, so bodies always render
	 * the same way.
	 */
	static String braced(CNextParser.StatementContext statement, CodeGenerator orchestrator)
	{
		String code = orchestrator.generate(statement);
		if (statement.block() != null)
		{
			return code;
		}
		return "{\n" + CodeGenerator.indent(code) + "\n}";
	}
}
