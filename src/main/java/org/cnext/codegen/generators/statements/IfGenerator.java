package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.LengthCache;
import org.cnext.parser.CNextParser;
import org.cnext.util.Debug;

import java.util.Map;

/**
 * {@code if (cond) {...} else {...}}.
 * <p>
 * A string whose {@code .length} the condition reads more than once gets its
 * {@code strlen} computed once into a local declared in a block around the
 * statement.
 */
public class IfGenerator implements Generator<CNextParser.IfStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.IfStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		CNextParser.ExpressionContext condition = node.expression();
		Conditions.check(condition, "if", input, state);

		Map<String, String> cached = LengthCache.repeatedLengths(condition, "", input, state, orchestrator);
		String declarations = orchestrator.setupLengthCache(cached);
		String code;
		try
		{
			StringBuilder sb = new StringBuilder();
			sb.append("if (").append(orchestrator.generateUntyped(condition)).append(") ");
			sb.append(BlockGenerator.braced(node.statement(0), orchestrator));
			if (node.ELSE() != null)
			{
				CNextParser.StatementContext otherwise = node.statement(1);
				sb.append(" else ");
				sb.append(otherwise.ifStatement() != null ? orchestrator.generate(otherwise) : BlockGenerator.braced(otherwise, orchestrator));
			}
			code = sb.toString();
		}
		finally
		{
			orchestrator.clearLengthCache();
		}

		if (cached.isEmpty())
		{
			return GeneratorOutput.of(code);
		}
		Debug.logDebug("Caching string lengths " + cached.keySet());
		return GeneratorOutput.of("{\n" + CodeGenerator.indent(declarations + code) + "\n}");
	}
}
