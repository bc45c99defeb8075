package org.cnext.codegen;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.codegen.generators.declarations.DeclarationGenerators;
import org.cnext.codegen.generators.expressions.ExpressionGenerators;
import org.cnext.codegen.generators.statements.StatementGenerators;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Generators keyed by the parse-tree node class they handle.
 */
public class GeneratorRegistry
{
	private final Map<Class<? extends ParserRuleContext>, Generator<ParserRuleContext>> generators = new HashMap<>();

	public <T extends ParserRuleContext> GeneratorRegistry register(Class<T> nodeType, Generator<T> generator)
	{
		generators.put(nodeType, (node, input, state, orchestrator) -> generator.generate(nodeType.cast(node), input, state, orchestrator));
		return this;
	}

	public Optional<Generator<ParserRuleContext>> lookup(Class<? extends ParserRuleContext> nodeType)
	{
		return Optional.ofNullable(generators.get(nodeType));
	}

	/**
	 * The complete table for C-Next.
	 */
	public static GeneratorRegistry createDefault()
	{
		GeneratorRegistry registry = new GeneratorRegistry();
		DeclarationGenerators.registerAll(registry);
		StatementGenerators.registerAll(registry);
		ExpressionGenerators.registerAll(registry);
		return registry;
	}
}
