package org.cnext.codegen;

import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Generates C for one kind of parse-tree node. Implementations are stateless:
 * they read {@code input} and {@code state}, call back into the orchestrator for
 * child nodes, and return their text with the effects they need applied.
 */
@FunctionalInterface
public interface Generator<T extends ParserRuleContext>
{
	GeneratorOutput generate(T node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator);
}
