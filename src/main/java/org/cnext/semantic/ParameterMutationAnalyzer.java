package org.cnext.semantic;

import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.util.Debug;

import java.util.*;

/**
 * Builds the {@link ParameterMutationTable} one function at a time, in the order the
 * functions are declared.
 * <p>
 * A parameter is mutated when it is assigned (wholly, by field, element or bit), when
 * its address is taken, or when it is passed where the callee mutates the matching
 * parameter. A callee that has not been analyzed yet counts as mutating.
 */
public class ParameterMutationAnalyzer extends FunctionBodyAnalyzer
{
	private static final Set<String> OUTPUT_BUILTINS = Set.of("safe_div", "safe_mod");

	private final ParameterMutationTable table = new ParameterMutationTable();

	public ParameterMutationAnalyzer(TypeResolver typeResolver)
	{
		super(typeResolver);
	}

	@Override
	protected void analyzeFunction(ScopeSymbol scope, FunctionSymbol fn, CNextParser.FunctionDeclarationContext ctx)
	{
		BodyScanner scanner = new BodyScanner(fn, scope);
		scanner.visit(ctx.block());
		table.record(fn, scanner.mutated);
		if (!scanner.mutated.isEmpty())
		{
			Debug.logDebug("Function " + fn.getCName() + " mutates parameter(s) " + scanner.mutated);
		}
	}

	public ParameterMutationTable getTable()
	{
		return table;
	}

	private class BodyScanner extends FunctionBodyScanner
	{
		private final BitSet mutated = new BitSet();

		BodyScanner(FunctionSymbol fn, ScopeSymbol scope)
		{
			super(ParameterMutationAnalyzer.this.typeResolver, fn, scope);
		}

		private Optional<ParameterSymbol> parameter(String name)
		{
			return locals.containsKey(name) ? Optional.empty() : Optional.ofNullable(parameters.get(name));
		}

		private void mark(String name)
		{
			parameter(name).ifPresent(p -> mutated.set(p.getIndex()));
		}

		@Override
		public Void visitAssignmentTarget(CNextParser.AssignmentTargetContext ctx)
		{
			if (ctx.THIS() == null && ctx.GLOBAL() == null)
			{
				mark(ctx.IDENTIFIER().getText());
			}
			return visitChildren(ctx);
		}

		@Override
		public Void visitUnaryExpression(CNextParser.UnaryExpressionContext ctx)
		{
			if (ctx.BITAND() != null)
			{
				referencedName(ctx.unaryExpression()).ifPresent(this::mark);
			}
			return visitChildren(ctx);
		}

		@Override
		public Void visitPostfixExpression(CNextParser.PostfixExpressionContext ctx)
		{
			List<CNextParser.PostfixOpContext> ops = ctx.postfixOp();
			if (ops.stream().anyMatch(op -> op.LPAREN() != null))
			{
				List<AccessStep> steps = typeResolver.resolveChain(ctx, this);
				for (int i = 0; i < ops.size(); i++)
				{
					CNextParser.PostfixOpContext op = ops.get(i);
					if (op.LPAREN() != null && op.argumentList() != null)
					{
						scanCall(steps.get(i + 1), op.argumentList().expression());
					}
				}
			}
			return visitChildren(ctx);
		}

		private void scanCall(AccessStep call, List<CNextParser.ExpressionContext> args)
		{
			FunctionSymbol callee = call.getSymbol() instanceof FunctionSymbol fn ? fn : null;
			for (int index = 0; index < args.size(); index++)
			{
				Optional<String> name = ExpressionUnwrapper.getSimpleIdentifier(args.get(index));
				if (name.isEmpty() || parameter(name.get()).isEmpty())
				{
					continue;
				}
				boolean mutates;
				if (callee != null)
				{
					mutates = !table.isAnalyzed(callee) || table.isMutated(callee, index);
				}
				else if (OUTPUT_BUILTINS.contains(call.getName()))
				{
					mutates = index == 0;
				}
				else
				{
					// Scalars are copied into C functions; anything passed by address may be written
					mutates = !typeResolver.isScalar(parameter(name.get()).get().getType());
				}
				if (mutates)
				{
					mark(name.get());
				}
			}
		}

		private Optional<String> referencedName(CNextParser.UnaryExpressionContext operand)
		{
			if (operand.postfixExpression() == null || !operand.postfixExpression().postfixOp().isEmpty())
			{
				return Optional.empty();
			}
			return Optional.ofNullable(operand.postfixExpression().primaryExpression().IDENTIFIER()).map(id -> id.getText());
		}
	}
}
