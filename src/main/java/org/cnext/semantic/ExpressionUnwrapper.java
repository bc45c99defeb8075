package org.cnext.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.cnext.parser.CNextParser;

import java.util.Optional;

/**
 * Walks the fixed precedence chain of an expression one level at a time. An
 * expression is "simple" when every level has exactly one operand and no unary
 * operator is applied, i.e. it is just a postfix chain such as {@code a}, {@code a.b[2]}
 * or {@code this.f()}.
 */
public final class ExpressionUnwrapper
{
	private ExpressionUnwrapper()
	{
	}

	public static Optional<CNextParser.PostfixExpressionContext> unwrapToPostfix(CNextParser.ExpressionContext expr)
	{
		if (expr == null)
		{
			return Optional.empty();
		}
		CNextParser.TernaryExpressionContext ternary = expr.ternaryExpression();
		if (ternary.orExpression().size() != 1 || ternary.LPAREN() != null)
		{
			return Optional.empty();
		}
		return unwrapOr(ternary.orExpression(0));
	}

	public static Optional<CNextParser.PostfixExpressionContext> unwrapOr(CNextParser.OrExpressionContext or)
	{
		if (or.andExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.AndExpressionContext and = or.andExpression(0);
		if (and.equalityExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.EqualityExpressionContext eq = and.equalityExpression(0);
		if (eq.relationalExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.RelationalExpressionContext rel = eq.relationalExpression(0);
		if (rel.bitwiseOrExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.BitwiseOrExpressionContext bor = rel.bitwiseOrExpression(0);
		if (bor.bitwiseXorExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.BitwiseXorExpressionContext bxor = bor.bitwiseXorExpression(0);
		if (bxor.bitwiseAndExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.BitwiseAndExpressionContext band = bxor.bitwiseAndExpression(0);
		if (band.shiftExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.ShiftExpressionContext shift = band.shiftExpression(0);
		if (shift.additiveExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.AdditiveExpressionContext add = shift.additiveExpression(0);
		if (add.multiplicativeExpression().size() != 1)
		{
			return Optional.empty();
		}
		CNextParser.MultiplicativeExpressionContext mul = add.multiplicativeExpression(0);
		if (mul.unaryExpression().size() != 1)
		{
			return Optional.empty();
		}
		return Optional.ofNullable(mul.unaryExpression(0).postfixExpression());
	}

	/**
	 * The identifier of a bare variable reference such as {@code count}, else empty.
	 */
	public static Optional<String> getSimpleIdentifier(CNextParser.ExpressionContext expr)
	{
		return unwrapToPostfix(expr)
				.filter(p -> p.postfixOp().isEmpty())
				.map(CNextParser.PostfixExpressionContext::primaryExpression)
				.map(CNextParser.PrimaryExpressionContext::IDENTIFIER)
				.map(TerminalNode::getText);
	}

	/**
	 * A literal operand such as {@code 3}, {@code 0x10} or {@code true}, else empty.
	 */
	public static Optional<CNextParser.LiteralContext> getLiteral(CNextParser.ExpressionContext expr)
	{
		return unwrapToPostfix(expr)
				.filter(p -> p.postfixOp().isEmpty())
				.map(CNextParser.PostfixExpressionContext::primaryExpression)
				.map(CNextParser.PrimaryExpressionContext::literal);
	}

	public static boolean containsFunctionCall(ParseTree tree)
	{
		if (tree instanceof CNextParser.PostfixOpContext op && op.LPAREN() != null)
		{
			return true;
		}
		for (int i = 0; i < tree.getChildCount(); i++)
		{
			if (containsFunctionCall(tree.getChild(i)))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Nearest ancestor of the given type, or null.
	 */
	public static <T extends ParserRuleContext> T findAncestor(ParserRuleContext ctx, Class<T> type)
	{
		ParserRuleContext current = ctx.getParent();
		while (current != null)
		{
			if (type.isInstance(current))
			{
				return type.cast(current);
			}
			current = current.getParent();
		}
		return null;
	}
}
