package org.cnext.codegen.generators.expressions;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.AccessStep;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.List;

/**
 * Reads of identifiers, members, indexes, bits and calls.
 */
public class PostfixGenerator implements Generator<CNextParser.PostfixExpressionContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.PostfixExpressionContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		List<AccessStep> steps = input.getTypeResolver().resolveChain(node, state);
		AccessChainRenderer renderer = new AccessChainRenderer(input, state, orchestrator);
		String code = renderer.render(steps, steps.size(), false);
		if (code == null)
		{
			throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, node, "'" + node.getText() + "' does not name a value");
		}
		return new GeneratorOutput(code, renderer.getEffects());
	}
}
