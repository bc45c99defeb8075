package org.cnext.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.Optional;

/**
 * Rejects {@code /}, {@code %}, {@code /<-} and {@code %<-} whose divisor folds to
 * zero, whether written as a literal or through a constant.
 */
public class DivisionByZeroAnalyzer extends FunctionBodyAnalyzer
{
	public DivisionByZeroAnalyzer(TypeResolver typeResolver)
	{
		super(typeResolver);
	}

	@Override
	protected void analyzeFunction(ScopeSymbol scope, FunctionSymbol fn, CNextParser.FunctionDeclarationContext ctx)
	{
		new Scanner(fn, scope).visit(ctx.block());
	}

	private class Scanner extends FunctionBodyScanner
	{
		Scanner(FunctionSymbol fn, ScopeSymbol scope)
		{
			super(DivisionByZeroAnalyzer.this.typeResolver, fn, scope);
		}

		@Override
		public Void visitMultiplicativeExpression(CNextParser.MultiplicativeExpressionContext ctx)
		{
			for (int i = 1; i < ctx.getChildCount(); i += 2)
			{
				check(ctx.getChild(i).getText(), ctx.unaryExpression((i + 1) / 2));
			}
			return visitChildren(ctx);
		}

		@Override
		public Void visitAssignmentStatement(CNextParser.AssignmentStatementContext ctx)
		{
			checkCompound(ctx.assignmentOperator(), ctx.expression());
			return visitChildren(ctx);
		}

		@Override
		public Void visitForAssignment(CNextParser.ForAssignmentContext ctx)
		{
			checkCompound(ctx.assignmentOperator(), ctx.expression());
			return visitChildren(ctx);
		}

		@Override
		public Void visitForUpdate(CNextParser.ForUpdateContext ctx)
		{
			checkCompound(ctx.assignmentOperator(), ctx.expression());
			return visitChildren(ctx);
		}

		private void checkCompound(CNextParser.AssignmentOperatorContext op, CNextParser.ExpressionContext divisor)
		{
			if (op.SLASH_ASSIGN() != null)
			{
				check("/", divisor);
			}
			else if (op.PERCENT_ASSIGN() != null)
			{
				check("%", divisor);
			}
		}

		private void check(String operator, ParserRuleContext divisor)
		{
			if (!operator.equals("/") && !operator.equals("%"))
			{
				return;
			}
			Optional<Long> value = ConstantEvaluator.evaluate(divisor, constants());
			if (value.isEmpty() || value.get() != 0)
			{
				return;
			}
			boolean division = operator.equals("/");
			throw new CompileException(division ? ErrorCode.DIVISION_BY_ZERO : ErrorCode.MODULO_BY_ZERO, divisor,
					(division ? "Division" : "Modulo") + " by zero",
					"use " + (division ? "safe_div()" : "safe_mod()") + " when the divisor may be zero");
		}
	}
}
