package org.cnext.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.cnext.parser.CNextParser;

import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Function;

/**
 * Folds integer constant expressions (enum values, array sizes, bitmap widths).
 * Each precedence level is a left fold over {@code operand (op operand)*}, so the
 * folding is generic over the rule shape.
 */
public final class ConstantEvaluator
{
	private ConstantEvaluator()
	{
	}

	public static Optional<Long> evaluate(ParseTree tree)
	{
		return evaluate(tree, name -> Optional.empty());
	}

	/**
	 * @param constants resolves a bare identifier to a known constant value
	 */
	public static Optional<Long> evaluate(ParseTree tree, Function<String, Optional<Long>> constants)
	{
		if (tree instanceof CNextParser.LiteralContext literal)
		{
			return parseIntegerLiteral(literal.getText());
		}
		if (tree instanceof CNextParser.PrimaryExpressionContext primary)
		{
			if (primary.IDENTIFIER() != null)
			{
				return constants.apply(primary.IDENTIFIER().getText());
			}
			if (primary.literal() != null)
			{
				return evaluate(primary.literal(), constants);
			}
			if (primary.expression() != null)
			{
				return evaluate(primary.expression(), constants);
			}
			return Optional.empty();
		}
		if (tree instanceof CNextParser.PostfixExpressionContext postfix)
		{
			return postfix.postfixOp().isEmpty() ? evaluate(postfix.primaryExpression(), constants) : Optional.empty();
		}
		if (tree instanceof CNextParser.UnaryExpressionContext unary)
		{
			if (unary.postfixExpression() != null)
			{
				return evaluate(unary.postfixExpression(), constants);
			}
			Optional<Long> operand = evaluate(unary.unaryExpression(), constants);
			if (unary.MINUS() != null)
			{
				return operand.map(v -> -v);
			}
			if (unary.BITNOT() != null)
			{
				return operand.map(v -> ~v);
			}
			return Optional.empty();
		}
		if (tree instanceof CNextParser.TernaryExpressionContext ternary && ternary.orExpression().size() > 1)
		{
			return Optional.empty();
		}
		if (tree instanceof CNextParser.ExpressionContext || tree instanceof CNextParser.TernaryExpressionContext)
		{
			return evaluate(tree.getChild(0), constants);
		}
		if (tree instanceof ParserRuleContext rule)
		{
			return foldBinary(rule, constants);
		}
		return Optional.empty();
	}

	private static Optional<Long> foldBinary(ParserRuleContext rule, Function<String, Optional<Long>> constants)
	{
		if (rule.getChildCount() == 0)
		{
			return Optional.empty();
		}
		Optional<Long> acc = evaluate(rule.getChild(0), constants);
		for (int i = 1; i + 1 < rule.getChildCount() && acc.isPresent(); i += 2)
		{
			if (!(rule.getChild(i) instanceof TerminalNode op))
			{
				return Optional.empty();
			}
			Optional<Long> right = evaluate(rule.getChild(i + 1), constants);
			if (right.isEmpty())
			{
				return Optional.empty();
			}
			long a = acc.get();
			long b = right.get();
			switch (op.getText())
			{
				case "+" -> acc = Optional.of(a + b);
				case "-" -> acc = Optional.of(a - b);
				case "*" -> acc = Optional.of(a * b);
				case "/" -> acc = b == 0 ? Optional.empty() : Optional.of(a / b);
				case "%" -> acc = b == 0 ? Optional.empty() : Optional.of(a % b);
				case "<<" -> acc = Optional.of(a << b);
				case ">>" -> acc = Optional.of(a >> b);
				case "&" -> acc = Optional.of(a & b);
				case "|" -> acc = Optional.of(a | b);
				case "^" -> acc = Optional.of(a ^ b);
				default -> acc = Optional.empty();
			}
		}
		return acc;
	}

	/**
	 * Parses decimal, {@code 0x} hex, {@code 0b} binary and character literals.
	 */
	public static Optional<Long> parseIntegerLiteral(String text)
	{
		try
		{
			String lower = text.toLowerCase();
			if (lower.startsWith("0x"))
			{
				return Optional.of(new BigInteger(text.substring(2), 16).longValue());
			}
			if (lower.startsWith("0b"))
			{
				return Optional.of(new BigInteger(text.substring(2), 2).longValue());
			}
			if (text.startsWith("'") && text.length() == 3)
			{
				return Optional.of((long) text.charAt(1));
			}
			if (!text.isEmpty() && Character.isDigit(text.charAt(0)) && !text.contains("."))
			{
				return Optional.of(new BigInteger(text).longValue());
			}
		}
		catch (NumberFormatException e)
		{
			return Optional.empty();
		}
		return Optional.empty();
	}
}
