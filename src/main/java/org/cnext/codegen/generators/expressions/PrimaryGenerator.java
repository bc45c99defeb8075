package org.cnext.codegen.generators.expressions;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;

/**
 * Primaries that are not names: parentheses, literals, casts, sizeof and
 * initializers. Names are resolved as part of the postfix chain.
 */
public class PrimaryGenerator implements Generator<CNextParser.PrimaryExpressionContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.PrimaryExpressionContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		if (node.LPAREN() != null)
		{
			return GeneratorOutput.of("(" + orchestrator.generate(node.expression()) + ")");
		}
		if (node.IDENTIFIER() != null || node.THIS() != null || node.GLOBAL() != null)
		{
			throw new IllegalStateException("Names are generated through their postfix chain: " + node.getText());
		}
		return GeneratorOutput.of(orchestrator.generate((ParserRuleContext) node.getChild(0)));
	}
}
