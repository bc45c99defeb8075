package org.cnext.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.Debug;
import org.cnext.util.ErrorCode;

import java.util.List;

/**
 * Rejects {@code %} and {@code %<-} on {@code f32} or {@code f64} operands, which C
 * does not accept.
 */
public class FloatModuloAnalyzer extends FunctionBodyAnalyzer
{
	public FloatModuloAnalyzer(TypeResolver typeResolver)
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
			super(FloatModuloAnalyzer.this.typeResolver, fn, scope);
		}

		@Override
		public Void visitMultiplicativeExpression(CNextParser.MultiplicativeExpressionContext ctx)
		{
			for (int i = 1; i < ctx.getChildCount(); i += 2)
			{
				if (ctx.getChild(i).getText().equals("%"))
				{
					// The left side of a chain has the type of its first operand
					CNextParser.UnaryExpressionContext right = ctx.unaryExpression((i + 1) / 2);
					if (isFloat(ctx.unaryExpression(0)) || isFloat(right))
					{
						throw floatModulo(ctx.getChild(i).getText(), right);
					}
				}
			}
			return visitChildren(ctx);
		}

		@Override
		public Void visitAssignmentStatement(CNextParser.AssignmentStatementContext ctx)
		{
			checkCompound(ctx.assignmentTarget(), ctx.assignmentOperator(), ctx.expression());
			return visitChildren(ctx);
		}

		@Override
		public Void visitForAssignment(CNextParser.ForAssignmentContext ctx)
		{
			checkCompound(ctx.assignmentTarget(), ctx.assignmentOperator(), ctx.expression());
			return visitChildren(ctx);
		}

		@Override
		public Void visitForUpdate(CNextParser.ForUpdateContext ctx)
		{
			checkCompound(ctx.assignmentTarget(), ctx.assignmentOperator(), ctx.expression());
			return visitChildren(ctx);
		}

		private void checkCompound(CNextParser.AssignmentTargetContext target, CNextParser.AssignmentOperatorContext op,
								   CNextParser.ExpressionContext value)
		{
			if (op.PERCENT_ASSIGN() != null && (isFloatTarget(target) || isFloat(value)))
			{
				throw floatModulo(op.getText(), target);
			}
		}

		private boolean isFloat(ParseTree operand)
		{
			if (isFloatLiteral(operand))
			{
				return true;
			}
			try
			{
				return typeResolver.resolveExpressionType(operand, this).filter(TypeDescriptor::isFloat).isPresent();
			}
			catch (CompileException e)
			{
				// Generation reports unresolvable operands with their own diagnostic
				Debug.logDebug("No operand type for '" + operand.getText() + "': " + e.getMessage());
				return false;
			}
		}

		private boolean isFloatTarget(CNextParser.AssignmentTargetContext target)
		{
			try
			{
				List<AccessStep> steps = typeResolver.resolveTarget(target, this);
				TypeDescriptor type = steps.get(steps.size() - 1).getType();
				return type != null && type.isFloat();
			}
			catch (CompileException e)
			{
				Debug.logDebug("No target type for '" + target.getText() + "': " + e.getMessage());
				return false;
			}
		}

		private boolean isFloatLiteral(ParseTree operand)
		{
			if (operand instanceof CNextParser.LiteralContext literal)
			{
				return literal.FLOAT_LITERAL() != null;
			}
			// Descend only through single-operand levels
			if (operand instanceof ParserRuleContext rule && rule.getChildCount() == 1)
			{
				return isFloatLiteral(rule.getChild(0));
			}
			if (operand instanceof CNextParser.UnaryExpressionContext unary && unary.MINUS() != null)
			{
				return isFloatLiteral(unary.unaryExpression());
			}
			if (operand instanceof CNextParser.PrimaryExpressionContext primary && primary.expression() != null)
			{
				return isFloatLiteral(primary.expression());
			}
			return false;
		}

		private CompileException floatModulo(String operator, ParserRuleContext at)
		{
			return new CompileException(ErrorCode.FLOAT_MODULO, at,
					"Modulo operator '" + operator + "' not supported for floating-point types",
					"use fmod() from <math.h>");
		}
	}
}
