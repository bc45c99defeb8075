package org.cnext.codegen.generators.statements;

import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.ExpressionUnwrapper;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.Optional;

/**
 * Rules shared by every statement that branches on a condition.
 */
final class Conditions
{
	private Conditions()
	{
	}

	/**
	 * A condition must be boolean and must not call a function.
	 *
	 * @param statement keyword used in the message, e.g. {@code if}
	 */
	static void check(CNextParser.ExpressionContext condition, String statement, GeneratorInput input, GeneratorState state)
	{
		if (ExpressionUnwrapper.containsFunctionCall(condition))
		{
			throw new CompileException(ErrorCode.CALL_IN_CONDITION, condition,
					"Function call in '" + statement + "' condition",
					"store the result in a variable before the " + statement);
		}
		Optional<TypeDescriptor> type = input.getTypeResolver().resolveExpressionType(condition, state);
		if (type.isPresent() && !type.get().isBool())
		{
			throw new CompileException(ErrorCode.NON_BOOLEAN_CONDITION, condition,
					"'" + statement + "' condition must be a boolean expression, found " + type.get(),
					"compare explicitly, e.g. 'x != 0'");
		}
	}
}
