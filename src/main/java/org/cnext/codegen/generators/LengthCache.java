package org.cnext.codegen.generators;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.expressions.AccessChainRenderer;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.AccessStep;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds strings whose {@code .length} one statement reads more than once, so
 * their {@code strlen} can be computed once.
 */
public final class LengthCache
{
	private LengthCache()
	{
	}

	/**
	 * @param namePrefix prepended to each cache variable name
	 * @return string C name to cache variable name, in name order
	 */
	public static Map<String, String> repeatedLengths(ParseTree scanned, String namePrefix, GeneratorInput input,
													  GeneratorState state, CodeGenerator orchestrator)
	{
		Map<String, Integer> counts = new HashMap<>();
		collect(scanned, input, state, orchestrator, counts);
		Map<String, String> cached = new LinkedHashMap<>();
		counts.entrySet().stream()
				.filter(e -> e.getValue() > 1)
				.map(Map.Entry::getKey)
				.sorted()
				.forEach(code -> cached.put(code, namePrefix + CodegenUtils.lengthCacheName(code)));
		return cached;
	}

	private static void collect(ParseTree node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator,
								Map<String, Integer> counts)
	{
		if (node instanceof CNextParser.PostfixExpressionContext postfix && !postfix.postfixOp().isEmpty())
		{
			List<AccessStep> steps = input.getTypeResolver().resolveChain(postfix, state);
			for (int i = 1; i < steps.size(); i++)
			{
				if (steps.get(i).getKind() == AccessStep.Kind.STRING_LENGTH)
				{
					String owner = new AccessChainRenderer(input, state, orchestrator).render(steps, i, false);
					if (owner != null)
					{
						counts.merge(owner, 1, Integer::sum);
					}
				}
			}
		}
		if (node instanceof ParserRuleContext rule)
		{
			for (int i = 0; i < rule.getChildCount(); i++)
			{
				collect(rule.getChild(i), input, state, orchestrator, counts);
			}
		}
	}
}
