package org.cnext.codegen.generators.statements;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

/**
 * {@code critical { ... }}: saves PRIMASK, disables interrupts, and restores the
 * saved mask at the end of the block. Leaving the block early would skip the
 * restore, so {@code return} is rejected inside it.
 */
public class CriticalGenerator implements Generator<CNextParser.CriticalStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.CriticalStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		CNextParser.ReturnStatementContext nested = findReturn(node.block());
		if (nested != null)
		{
			throw new CompileException(ErrorCode.RETURN_IN_CRITICAL, nested,
					"'return' inside a critical section", "set a flag and return after the critical block");
		}
		String body = CodeGenerator.blockContents(orchestrator.generate(node.block()));
		return GeneratorOutput.of(wrap(body.stripTrailing()), GenerationEffect.irqWrappers());
	}

	static String wrap(String statements)
	{
		StringBuilder inner = new StringBuilder();
		inner.append("uint32_t __primask = __cnx_get_PRIMASK();\n");
		inner.append("__cnx_disable_irq();\n");
		if (!statements.isBlank())
		{
			inner.append(statements).append('\n');
		}
		inner.append("__cnx_set_PRIMASK(__primask);");
		return "{\n" + CodeGenerator.indent(inner.toString()) + "\n}";
	}

	private static CNextParser.ReturnStatementContext findReturn(ParserRuleContext node)
	{
		if (node instanceof CNextParser.ReturnStatementContext found)
		{
			return found;
		}
		for (int i = 0; i < node.getChildCount(); i++)
		{
			ParseTree child = node.getChild(i);
			if (child instanceof ParserRuleContext rule)
			{
				CNextParser.ReturnStatementContext found = findReturn(rule);
				if (found != null)
				{
					return found;
				}
			}
		}
		return null;
	}
}
