package org.cnext.codegen.generators.expressions;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.type.PrimitiveType;

import java.math.BigInteger;

public class LiteralGenerator implements Generator<CNextParser.LiteralContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.LiteralContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		String text = node.getText();
		if (node.BINARY_LITERAL() != null)
		{
			return GeneratorOutput.of(CodegenUtils.binaryToHex(text));
		}
		if (node.HEX_LITERAL() != null)
		{
			return GeneratorOutput.of(text + CodegenUtils.wideSuffix(new BigInteger(text.substring(2), 16)));
		}
		if (node.INTEGER_LITERAL() != null)
		{
			return GeneratorOutput.of(text + CodegenUtils.wideSuffix(new BigInteger(text)));
		}
		if (node.FLOAT_LITERAL() != null)
		{
			boolean single = state.getExpectedType().map(t -> t.isPrimitive(PrimitiveType.F32)).orElse(false);
			return GeneratorOutput.of(single ? text + "f" : text);
		}
		// Strings, characters, true and false are spelled the same in C
		return GeneratorOutput.of(text);
	}
}
