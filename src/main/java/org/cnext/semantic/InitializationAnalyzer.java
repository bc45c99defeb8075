package org.cnext.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Rejects reads of locals declared without an initializer before every path to
 * the read has assigned them.
 * <p>
 * Parameters and globals start initialized. Struct locals are tracked per field and
 * become whole once every field is assigned; writing one array element counts for
 * the whole array. A plain variable passed to a call is not read there and counts
 * as assigned afterwards, since the callee receives it by address.
 * <p>
 * After an {@code if} or {@code switch} a variable is assigned only if every branch
 * assigned it. Loop bodies may not run, except a {@code for} that counts up from 0
 * to a positive literal bound.
 */
public class InitializationAnalyzer extends FunctionBodyAnalyzer
{
	private static final Pattern COUNTED_LOOP = Pattern.compile("^\\w+<0*[1-9]\\d*$");
	private static final Set<String> STRING_RUNTIME_PROPERTIES = Set.of("length", "capacity", "size");

	public InitializationAnalyzer(TypeResolver typeResolver)
	{
		super(typeResolver);
	}

	@Override
	protected void analyzeFunction(ScopeSymbol scope, FunctionSymbol fn, CNextParser.FunctionDeclarationContext ctx)
	{
		new Scanner(fn, scope).visit(ctx.block());
	}

	private static final class VariableState
	{
		private boolean initialized;
		private final Set<String> initializedFields;
		private final Set<String> structFields;
		private final boolean string;

		VariableState(boolean initialized, Set<String> initializedFields, Set<String> structFields, boolean string)
		{
			this.initialized = initialized;
			this.initializedFields = initializedFields;
			this.structFields = structFields;
			this.string = string;
		}

		VariableState copy()
		{
			return new VariableState(initialized, new HashSet<>(initializedFields), structFields, string);
		}

		void assignAll()
		{
			initialized = true;
			if (structFields != null)
			{
				initializedFields.addAll(structFields);
			}
		}

		void assignField(String field)
		{
			initializedFields.add(field);
			if (structFields != null && initializedFields.containsAll(structFields))
			{
				initialized = true;
			}
		}

		boolean isFieldAssigned(String field)
		{
			return initialized || initializedFields.contains(field);
		}
	}

	private class Scanner extends FunctionBodyScanner
	{
		private Map<String, VariableState> tracked = new HashMap<>();
		private final Set<CNextParser.PostfixExpressionContext> passedToCall = new HashSet<>();

		Scanner(FunctionSymbol fn, ScopeSymbol scope)
		{
			super(InitializationAnalyzer.this.typeResolver, fn, scope);
		}

		// --- Declarations and assignments ---

		@Override
		public Void visitVariableDeclaration(CNextParser.VariableDeclarationContext ctx)
		{
			super.visitVariableDeclaration(ctx);
			declare(ctx.IDENTIFIER().getText(), ctx.expression() != null);
			return null;
		}

		@Override
		public Void visitForVarDecl(CNextParser.ForVarDeclContext ctx)
		{
			super.visitForVarDecl(ctx);
			declare(ctx.IDENTIFIER().getText(), ctx.expression() != null);
			return null;
		}

		private void declare(String name, boolean hasInitializer)
		{
			if (hasInitializer)
			{
				tracked.remove(name);
				return;
			}
			TypeDescriptor type = locals.get(name);
			Set<String> structFields = null;
			if (!type.isArray() && typeResolver.isStructType(type))
			{
				structFields = registry.findStruct(type.getUserTypeName()).orElseThrow().getFields().keySet();
			}
			tracked.put(name, new VariableState(false, new HashSet<>(), structFields, type.isString() && !type.isArray()));
		}

		@Override
		public Void visitAssignmentStatement(CNextParser.AssignmentStatementContext ctx)
		{
			assign(ctx.assignmentTarget(), ctx.assignmentOperator(), ctx.expression());
			return null;
		}

		@Override
		public Void visitForAssignment(CNextParser.ForAssignmentContext ctx)
		{
			assign(ctx.assignmentTarget(), ctx.assignmentOperator(), ctx.expression());
			return null;
		}

		@Override
		public Void visitForUpdate(CNextParser.ForUpdateContext ctx)
		{
			assign(ctx.assignmentTarget(), ctx.assignmentOperator(), ctx.expression());
			return null;
		}

		private void assign(CNextParser.AssignmentTargetContext target, CNextParser.AssignmentOperatorContext op,
							CNextParser.ExpressionContext value)
		{
			visit(value);
			List<CNextParser.TargetSuffixContext> suffixes = target.targetSuffix();
			for (CNextParser.TargetSuffixContext suffix : suffixes)
			{
				suffix.expression().forEach(this::visit);
			}
			if (target.THIS() != null || target.GLOBAL() != null)
			{
				return;
			}
			String name = target.IDENTIFIER().getText();
			VariableState state = tracked.get(name);
			if (state == null)
			{
				return;
			}
			String field = fieldOf(suffixes);
			if (op.ASSIGN() == null)
			{
				checkRead(name, field, state, target);
			}
			if (field != null)
			{
				state.assignField(field);
			}
			else
			{
				state.assignAll();
			}
		}

		/**
		 * The field a target writes when it is {@code name.field(.more)*}; any subscript
		 * makes the write count for the whole variable.
		 */
		private String fieldOf(List<CNextParser.TargetSuffixContext> suffixes)
		{
			if (suffixes.isEmpty() || suffixes.stream().anyMatch(s -> s.LBRACKET() != null))
			{
				return null;
			}
			return suffixes.get(0).IDENTIFIER().getText();
		}

		@Override
		public Void visitArgumentList(CNextParser.ArgumentListContext ctx)
		{
			for (CNextParser.ExpressionContext argument : ctx.expression())
			{
				ExpressionUnwrapper.unwrapToPostfix(argument).ifPresent(passedToCall::add);
			}
			visitChildren(ctx);
			for (CNextParser.ExpressionContext argument : ctx.expression())
			{
				ExpressionUnwrapper.getSimpleIdentifier(argument)
						.map(tracked::get)
						.ifPresent(VariableState::assignAll);
			}
			return null;
		}

		// --- Reads ---

		@Override
		public Void visitPostfixExpression(CNextParser.PostfixExpressionContext ctx)
		{
			CNextParser.PrimaryExpressionContext primary = ctx.primaryExpression();
			if (primary.IDENTIFIER() != null && !passedToCall.contains(ctx))
			{
				checkRead(primary.IDENTIFIER().getText(), ctx.postfixOp(), ctx);
			}
			return visitChildren(ctx);
		}

		@Override
		public Void visitSizeofExpression(CNextParser.SizeofExpressionContext ctx)
		{
			return null;
		}

		private void checkRead(String name, List<CNextParser.PostfixOpContext> ops, ParserRuleContext at)
		{
			VariableState state = tracked.get(name);
			if (state == null)
			{
				return;
			}
			if (!ops.isEmpty() && ops.get(0).DOT() != null)
			{
				checkRead(name, ops.get(0).IDENTIFIER().getText(), state, at);
				return;
			}
			// Element counts of arrays are known without reading the array
			boolean lengthOfElement = !ops.isEmpty() && ops.get(0).LBRACKET() != null
					&& ops.get(ops.size() - 1).getText().equals(".length");
			if (!state.string && lengthOfElement)
			{
				return;
			}
			checkRead(name, null, state, at);
		}

		private void checkRead(String name, String field, VariableState state, ParserRuleContext at)
		{
			if (field == null)
			{
				if (!state.initialized)
				{
					throw uninitialized(name, at);
				}
			}
			else if (state.structFields != null)
			{
				if (state.structFields.contains(field) && !state.isFieldAssigned(field))
				{
					throw uninitialized(name + "." + field, at);
				}
			}
			else if (state.string && STRING_RUNTIME_PROPERTIES.contains(field) && !state.initialized)
			{
				throw uninitialized(name, at);
			}
		}

		private CompileException uninitialized(String name, ParserRuleContext at)
		{
			return new CompileException(ErrorCode.USE_BEFORE_INIT, at,
					"use of uninitialized variable '" + name + "'",
					"assign '" + name + "' before reading it");
		}

		// --- Control flow ---

		@Override
		public Void visitIfStatement(CNextParser.IfStatementContext ctx)
		{
			visit(ctx.expression());
			Map<String, VariableState> before = snapshot(tracked);
			visit(ctx.statement(0));
			if (ctx.statement().size() == 1)
			{
				tracked = before;
				return null;
			}
			Map<String, VariableState> afterThen = tracked;
			tracked = snapshot(before);
			visit(ctx.statement(1));
			tracked = merge(before, List.of(afterThen, tracked));
			return null;
		}

		@Override
		public Void visitWhileStatement(CNextParser.WhileStatementContext ctx)
		{
			visit(ctx.expression());
			Map<String, VariableState> before = snapshot(tracked);
			visit(ctx.statement());
			tracked = before;
			return null;
		}

		@Override
		public Void visitForStatement(CNextParser.ForStatementContext ctx)
		{
			if (ctx.forInit() != null)
			{
				visit(ctx.forInit());
			}
			Map<String, VariableState> before = snapshot(tracked);
			if (ctx.expression() != null)
			{
				visit(ctx.expression());
			}
			visit(ctx.statement());
			if (ctx.forUpdate() != null)
			{
				visit(ctx.forUpdate());
			}
			if (!runsAtLeastOnce(ctx))
			{
				tracked = before;
			}
			return null;
		}

		@Override
		public Void visitSwitchStatement(CNextParser.SwitchStatementContext ctx)
		{
			visit(ctx.expression());
			Map<String, VariableState> before = snapshot(tracked);
			List<Map<String, VariableState>> branches = new ArrayList<>();
			for (CNextParser.SwitchCaseContext switchCase : ctx.switchCase())
			{
				tracked = snapshot(before);
				visit(switchCase.block());
				branches.add(tracked);
			}
			if (ctx.defaultCase() != null)
			{
				tracked = snapshot(before);
				visit(ctx.defaultCase().block());
				branches.add(tracked);
			}
			else
			{
				branches.add(before);
			}
			tracked = merge(before, branches);
			return null;
		}

		/**
		 * {@code for (i <- 0; i < N; ...)} with a literal {@code N > 0}.
		 */
		private boolean runsAtLeastOnce(CNextParser.ForStatementContext ctx)
		{
			if (ctx.forInit() == null || ctx.expression() == null)
			{
				return false;
			}
			CNextParser.ForInitContext init = ctx.forInit();
			CNextParser.ExpressionContext start = init.forVarDecl() != null
					? init.forVarDecl().expression()
					: init.forAssignment().expression();
			return start != null && start.getText().equals("0") && COUNTED_LOOP.matcher(ctx.expression().getText()).matches();
		}

		private Map<String, VariableState> snapshot(Map<String, VariableState> states)
		{
			Map<String, VariableState> copy = new HashMap<>();
			states.forEach((name, state) -> copy.put(name, state.copy()));
			return copy;
		}

		/**
		 * Keeps the variables known before the branches, assigned where every branch
		 * assigned them.
		 */
		private Map<String, VariableState> merge(Map<String, VariableState> before, List<Map<String, VariableState>> branches)
		{
			Map<String, VariableState> merged = snapshot(before);
			for (Map.Entry<String, VariableState> entry : merged.entrySet())
			{
				VariableState state = entry.getValue();
				boolean initialized = true;
				Set<String> fields = null;
				for (Map<String, VariableState> branch : branches)
				{
					VariableState branchState = branch.getOrDefault(entry.getKey(), before.get(entry.getKey()));
					initialized &= branchState.initialized;
					if (fields == null)
					{
						fields = new HashSet<>(branchState.initializedFields);
					}
					else
					{
						fields.retainAll(branchState.initializedFields);
					}
				}
				state.initialized = initialized;
				state.initializedFields.clear();
				state.initializedFields.addAll(fields);
			}
			return merged;
		}
	}
}
