// File: src/main/java/org/cnext/codegen/generators/expressions/BinaryExpressionGenerator.java
package org.cnext.codegen.generators.expressions;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.ConstantEvaluator;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.Optional;

/**
 * One generator for every binary precedence level. Each level has the shape
 * {@code operand (op operand)*} and maps to C operator by operator; the only
 * spelling change is {@code =} to {@code ==}.
 * <p>
 * C binds {@code & ^ |} looser than comparisons while C-Next binds them tighter,
 * so a bitwise operand of a comparison is parenthesized.
 */
public class BinaryExpressionGenerator<T extends ParserRuleContext> implements Generator<T>
{
	@Override
	public GeneratorOutput generate(T node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		if (node.getChildCount() == 1)
		{
			return GeneratorOutput.of(orchestrator.generate((ParserRuleContext) node.getChild(0)));
		}

		boolean comparison = node instanceof CNextParser.EqualityExpressionContext || node instanceof CNextParser.RelationalExpressionContext;
		Optional<String> enumType = comparison ? comparedEnum(node, input, state) : Optional.empty();
		if (node instanceof CNextParser.ShiftExpressionContext)
		{
			checkShifts(node, input, state);
		}

		StringBuilder code = new StringBuilder();
		for (ParseTree child : node.children)
		{
			if (child instanceof TerminalNode operator)
			{
				code.append(' ').append(toC(operator.getText())).append(' ');
				continue;
			}
			ParserRuleContext operand = (ParserRuleContext) child;
			String text;
			if (comparison)
			{
				text = enumType.isPresent()
						? orchestrator.generateWithExpectedType(operand, TypeDescriptor.user(enumType.get()))
						: orchestrator.generateUntyped(operand);
				if (isBitwise(operand))
				{
					text = "(" + text + ")";
				}
			}
			else
			{
				text = orchestrator.generate(operand);
			}
			code.append(text);
		}
		return GeneratorOutput.of(code.toString());
	}

	private static String toC(String operator)
	{
		return "=".equals(operator) ? "==" : operator;
	}

	/**
	 * The enum type of the first operand that has one, so a bare member on the
	 * other side can be qualified.
	 */
	private Optional<String> comparedEnum(T node, GeneratorInput input, GeneratorState state)
	{
		for (ParseTree child : node.children)
		{
			if (!(child instanceof ParserRuleContext operand))
			{
				continue;
			}
			CNextParser.PostfixExpressionContext postfix = singlePostfix(operand);
			if (postfix != null)
			{
				Optional<String> found = input.getEnumResolver().resolve(postfix, state);
				if (found.isPresent())
				{
					return found;
				}
			}
		}
		return Optional.empty();
	}

	private static CNextParser.PostfixExpressionContext singlePostfix(ParserRuleContext operand)
	{
		ParseTree current = operand;
		while (current instanceof ParserRuleContext rule && !(current instanceof CNextParser.PostfixExpressionContext))
		{
			if (rule.getChildCount() != 1)
			{
				return null;
			}
			current = rule.getChild(0);
		}
		return current instanceof CNextParser.PostfixExpressionContext postfix ? postfix : null;
	}

	private static boolean isBitwise(ParserRuleContext operand)
	{
		ParseTree current = operand;
		while (current instanceof ParserRuleContext rule && rule.getChildCount() == 1)
		{
			current = rule.getChild(0);
		}
		return current.getChildCount() > 1 && (current instanceof CNextParser.BitwiseOrExpressionContext
				|| current instanceof CNextParser.BitwiseXorExpressionContext
				|| current instanceof CNextParser.BitwiseAndExpressionContext);
	}

	private void checkShifts(T node, GeneratorInput input, GeneratorState state)
	{
		Optional<TypeDescriptor> leftType = input.getTypeResolver().resolveExpressionType(node.getChild(0), state);
		Optional<PrimitiveType> left = leftType.flatMap(input.getTypeResolver()::integerView).filter(PrimitiveType::isInteger);
		if (left.isEmpty())
		{
			return;
		}
		int bits = left.get().getBits();
		for (int i = 2; i < node.getChildCount(); i += 2)
		{
			Optional<Long> amount = ConstantEvaluator.evaluate(node.getChild(i), CodegenUtils.constants(state, input.getTypeResolver()));
			if (amount.isPresent() && (amount.get() < 0 || amount.get() >= bits))
			{
				throw new CompileException(ErrorCode.SHIFT_OUT_OF_RANGE, (ParserRuleContext) node.getChild(i),
						String.format("Shift amount %d is out of range for %s (0..%d)", amount.get(), left.get().getKeyword(), bits - 1));
			}
		}
	}
}
