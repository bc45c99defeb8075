// File: src/main/java/org/cnext/semantic/TypeResolver.java
package org.cnext.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.*;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves declared types and the types of expressions against the registry.
 * Stateless apart from the registry, which is read-only by the time generation runs.
 */
public class TypeResolver
{
	public static final String ISR_TYPE = "ISR";

	private final SymbolRegistry registry;

	public TypeResolver(SymbolRegistry registry)
	{
		this.registry = registry;
	}

	public SymbolRegistry getRegistry()
	{
		return registry;
	}

	// --- Declared types ---

	public TypeDescriptor resolveType(CNextParser.TypeContext ctx, ScopeSymbol currentScope, List<CNextParser.ArrayDimensionContext> dims)
	{
		TypeDescriptor base = resolveType(ctx, currentScope);
		if (dims == null || dims.isEmpty())
		{
			return base;
		}
		return base.withDimensions(dimensionTexts(dims, currentScope));
	}

	public TypeDescriptor resolveType(CNextParser.TypeContext ctx, ScopeSymbol currentScope)
	{
		if (ctx.primitiveType() != null)
		{
			return TypeDescriptor.of(PrimitiveType.fromKeyword(ctx.primitiveType().getText()).orElseThrow());
		}
		if (ctx.VOID() != null)
		{
			return TypeDescriptor.VOID;
		}
		if (ctx.stringType() != null)
		{
			return TypeDescriptor.string(Integer.parseInt(ctx.stringType().INTEGER_LITERAL().getText()));
		}
		if (ctx.scopedType() != null)
		{
			if (currentScope.isGlobal())
			{
				throw new CompileException(ErrorCode.UNKNOWN_TYPE, ctx, "'this." + ctx.scopedType().IDENTIFIER().getText() + "' used outside of a scope");
			}
			return TypeDescriptor.user(NameMangler.forMember(currentScope.getPath(), ctx.scopedType().IDENTIFIER().getText()));
		}
		if (ctx.globalType() != null)
		{
			List<String> parts = new ArrayList<>();
			ctx.globalType().IDENTIFIER().forEach(id -> parts.add(id.getText()));
			return TypeDescriptor.user(NameMangler.joinQualified(parts));
		}
		if (ctx.qualifiedType() != null)
		{
			List<String> parts = new ArrayList<>();
			ctx.qualifiedType().IDENTIFIER().forEach(id -> parts.add(id.getText()));
			String member = parts.get(parts.size() - 1);
			String ownerPath = String.join(".", parts.subList(0, parts.size() - 1));
			Optional<ScopeSymbol> owner = registry.findScope(ownerPath);
			// A type named from inside its own scope counts as reached through this.
			if (owner.isPresent() && owner.get().resolveLocally(member).isPresent()
					&& !registry.isVisible(owner.get(), member, currentScope, true))
			{
				throw new VisibilityException(member, ownerPath, false, ctx.getStart());
			}
			return TypeDescriptor.user(NameMangler.joinQualified(parts));
		}

		String name = ctx.userType().IDENTIFIER().getText();
		if (registry.findType(name).isPresent() || currentScope.isGlobal())
		{
			return TypeDescriptor.user(name);
		}
		String scoped = NameMangler.forMember(currentScope.getPath(), name);
		if (registry.findType(scoped).isPresent())
		{
			return TypeDescriptor.user(scoped);
		}
		return TypeDescriptor.user(name);
	}

	/**
	 * C text of each array dimension. Constant dimensions are folded to their value
	 * because C does not accept a const variable as a file-scope array size.
	 */
	public List<String> dimensionTexts(List<CNextParser.ArrayDimensionContext> dims, ScopeSymbol currentScope)
	{
		List<String> texts = new ArrayList<>();
		for (CNextParser.ArrayDimensionContext dim : dims)
		{
			if (dim.expression() == null)
			{
				texts.add("");
				continue;
			}
			Optional<Long> folded = ConstantEvaluator.evaluate(dim.expression(), name -> lookupConstant(name, currentScope));
			texts.add(folded.map(String::valueOf).orElse(dim.expression().getText()));
		}
		return texts;
	}

	/**
	 * Value of a named integer constant: a global constant, or one of the current scope.
	 */
	public Optional<Long> lookupConstant(String name, ScopeSymbol currentScope)
	{
		Optional<Symbol> symbol = registry.getGlobalScope().resolveLocally(name);
		if (symbol.isEmpty() && currentScope != null)
		{
			symbol = currentScope.resolveLocally(name);
		}
		return symbol.filter(VariableSymbol.class::isInstance)
				.map(VariableSymbol.class::cast)
				.map(VariableSymbol::getConstValue);
	}

	// --- Type classification ---

	public boolean isEnumType(TypeDescriptor type)
	{
		return type != null && type.isUserType() && registry.findEnum(type.getUserTypeName()).isPresent();
	}

	public boolean isStructType(TypeDescriptor type)
	{
		return type != null && type.isUserType() && registry.findStruct(type.getUserTypeName())
				.filter(s -> s.getLanguage() == SourceLanguage.CNEXT).isPresent();
	}

	public boolean isBitmapType(TypeDescriptor type)
	{
		return type != null && type.isUserType() && registry.findBitmap(type.getUserTypeName()).isPresent();
	}

	public boolean isCallbackType(TypeDescriptor type)
	{
		return type != null && type.isUserType() && registry.findFunction(type.getUserTypeName()).isPresent();
	}

	public boolean isIsrType(TypeDescriptor type)
	{
		return type != null && type.isUserType() && ISR_TYPE.equals(type.getUserTypeName());
	}

	/**
	 * A type with no C-Next definition: defined by an included header and usable only by pointer.
	 */
	public boolean isOpaqueType(TypeDescriptor type)
	{
		if (type == null || !type.isUserType() || isIsrType(type) || isCallbackType(type))
		{
			return false;
		}
		Optional<TypeSymbol> symbol = registry.findType(type.getUserTypeName());
		return symbol.isEmpty() || symbol.get().getLanguage() != SourceLanguage.CNEXT;
	}

	/**
	 * Value types are copied on assignment and passed by value unless mutated.
	 */
	public boolean isScalar(TypeDescriptor type)
	{
		if (type.isArray() || type.isString())
		{
			return false;
		}
		return type.isPrimitive() || isEnumType(type) || isBitmapType(type) || isCallbackType(type) || isIsrType(type);
	}

	/**
	 * C spelling of a type without array suffix.
	 */
	public String toCType(TypeDescriptor type)
	{
		if (isCallbackType(type))
		{
			return type.getUserTypeName() + "_fp";
		}
		if (isBitmapType(type))
		{
			return registry.findBitmap(type.getUserTypeName()).orElseThrow().getBackingType().getCType();
		}
		return type.getBaseCType();
	}

	public static PrimitiveType smallestUnsigned(int bits)
	{
		if (bits <= 8)
		{
			return PrimitiveType.U8;
		}
		if (bits <= 16)
		{
			return PrimitiveType.U16;
		}
		return bits <= 32 ? PrimitiveType.U32 : PrimitiveType.U64;
	}

	/**
	 * The integer type whose bits are addressed by {@code x[i]}: the primitive itself,
	 * or the backing type of a bitmap.
	 */
	public Optional<PrimitiveType> integerView(TypeDescriptor type)
	{
		if (type == null || type.isArray())
		{
			return Optional.empty();
		}
		if (type.isInteger() || type.isFloat())
		{
			return Optional.of(type.getPrimitive());
		}
		if (isBitmapType(type))
		{
			return Optional.of(registry.findBitmap(type.getUserTypeName()).orElseThrow().getBackingType());
		}
		return Optional.empty();
	}

	// --- Expression types ---

	public Optional<TypeDescriptor> resolveExpressionType(ParseTree tree, ResolutionContext ctx)
	{
		if (tree instanceof CNextParser.ExpressionContext expr)
		{
			return resolveExpressionType(expr.ternaryExpression(), ctx);
		}
		if (tree instanceof CNextParser.TernaryExpressionContext ternary)
		{
			int branch = ternary.orExpression().size() == 3 ? 1 : 0;
			return resolveExpressionType(ternary.orExpression(branch), ctx);
		}
		if (tree instanceof CNextParser.OrExpressionContext
				|| tree instanceof CNextParser.AndExpressionContext
				|| tree instanceof CNextParser.EqualityExpressionContext
				|| tree instanceof CNextParser.RelationalExpressionContext)
		{
			if (tree.getChildCount() > 1)
			{
				return Optional.of(TypeDescriptor.BOOL);
			}
			return resolveExpressionType(tree.getChild(0), ctx);
		}
		if (tree instanceof CNextParser.UnaryExpressionContext unary)
		{
			if (unary.postfixExpression() != null)
			{
				return resolveExpressionType(unary.postfixExpression(), ctx);
			}
			if (unary.NOT() != null)
			{
				return Optional.of(TypeDescriptor.BOOL);
			}
			if (unary.BITAND() != null)
			{
				return Optional.empty();
			}
			return resolveExpressionType(unary.unaryExpression(), ctx);
		}
		if (tree instanceof CNextParser.PostfixExpressionContext postfix)
		{
			List<AccessStep> steps = resolveChain(postfix, ctx);
			return Optional.ofNullable(steps.get(steps.size() - 1).getType());
		}
		if (tree instanceof ParserRuleContext rule && rule.getChildCount() > 0)
		{
			// Arithmetic, bitwise and shift levels take the type of their left operand
			return resolveExpressionType(rule.getChild(0), ctx);
		}
		return Optional.empty();
	}

	// --- Postfix chains ---

	public List<AccessStep> resolveChain(CNextParser.PostfixExpressionContext postfix, ResolutionContext ctx)
	{
		List<AccessStep> steps = new ArrayList<>();
		AccessStep current = resolvePrimary(postfix.primaryExpression(), ctx);
		steps.add(current);
		for (CNextParser.PostfixOpContext op : postfix.postfixOp())
		{
			current = resolveOp(current, op, ctx);
			steps.add(current);
		}
		return steps;
	}

	/**
	 * Resolves {@code [this. | global.] name (. name)*} as written on the left of an assignment.
	 */
	public List<AccessStep> resolveTarget(CNextParser.AssignmentTargetContext target, ResolutionContext ctx)
	{
		List<AccessStep> steps = new ArrayList<>();
		AccessStep current;
		if (target.THIS() != null || target.GLOBAL() != null)
		{
			current = target.THIS() != null ? thisStep(target, ctx) : new AccessStep(AccessStep.Kind.SCOPE, "global", null, null, registry.getGlobalScope(), target);
			steps.add(current);
			current = memberOf(current, target.IDENTIFIER().getText(), target, ctx);
		}
		else
		{
			current = resolveIdentifier(target.IDENTIFIER().getText(), target, ctx);
		}
		steps.add(current);
		for (CNextParser.TargetSuffixContext suffix : target.targetSuffix())
		{
			if (suffix.DOT() != null)
			{
				current = memberOf(current, suffix.IDENTIFIER().getText(), suffix, ctx);
			}
			else
			{
				current = indexOf(current, suffix.expression().size() == 2, suffix);
			}
			steps.add(current);
		}
		return steps;
	}

	private AccessStep resolvePrimary(CNextParser.PrimaryExpressionContext primary, ResolutionContext ctx)
	{
		if (primary.THIS() != null)
		{
			return thisStep(primary, ctx);
		}
		if (primary.GLOBAL() != null)
		{
			return new AccessStep(AccessStep.Kind.SCOPE, "global", null, null, registry.getGlobalScope(), primary);
		}
		if (primary.IDENTIFIER() != null)
		{
			return resolveIdentifier(primary.IDENTIFIER().getText(), primary, ctx);
		}

		TypeDescriptor type = null;
		if (primary.literal() != null)
		{
			CNextParser.LiteralContext literal = primary.literal();
			if (literal.TRUE() != null || literal.FALSE() != null)
			{
				type = TypeDescriptor.BOOL;
			}
			else if (literal.STRING_LITERAL() != null)
			{
				type = TypeDescriptor.string(literal.getText().length() - 2);
			}
		}
		else if (primary.castExpression() != null)
		{
			type = TypeDescriptor.of(PrimitiveType.fromKeyword(primary.castExpression().primitiveType().getText()).orElseThrow());
		}
		else if (primary.sizeofExpression() != null)
		{
			type = TypeDescriptor.of(PrimitiveType.U32);
		}
		else if (primary.structInitializer() != null)
		{
			type = resolveStructName(primary.structInitializer().IDENTIFIER().getText(), ctx.getCurrentScope());
		}
		else if (primary.expression() != null)
		{
			type = resolveExpressionType(primary.expression(), ctx).orElse(null);
		}
		return new AccessStep(AccessStep.Kind.EXPRESSION, primary.getText(), type, null, null, primary);
	}

	private AccessStep thisStep(ParserRuleContext node, ResolutionContext ctx)
	{
		if (ctx.getCurrentScope().isGlobal())
		{
			throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, node, "'this' can only be used inside a scope");
		}
		return new AccessStep(AccessStep.Kind.SCOPE, "this", null, null, ctx.getCurrentScope(), node);
	}

	/**
	 * Struct type named in an initializer: a global struct or one of the current scope.
	 */
	public TypeDescriptor resolveStructName(String name, ScopeSymbol currentScope)
	{
		if (registry.findStruct(name).isPresent() || currentScope.isGlobal())
		{
			return TypeDescriptor.user(name);
		}
		String scoped = NameMangler.forMember(currentScope.getPath(), name);
		return registry.findStruct(scoped).isPresent() ? TypeDescriptor.user(scoped) : TypeDescriptor.user(name);
	}

	private AccessStep resolveIdentifier(String name, ParserRuleContext node, ResolutionContext ctx)
	{
		Optional<TypeDescriptor> local = ctx.lookupLocalType(name);
		if (local.isPresent())
		{
			return new AccessStep(AccessStep.Kind.LOCAL, name, local.get(), null, null, node);
		}
		ScopeSymbol global = registry.getGlobalScope();
		Optional<Symbol> member = global.resolveLocally(name);
		if (member.isPresent())
		{
			return stepForMember(member.get(), global, node);
		}
		return new AccessStep(AccessStep.Kind.UNKNOWN, name, null, null, null, node);
	}

	private AccessStep stepForMember(Symbol symbol, ScopeSymbol owner, ParserRuleContext node)
	{
		if (symbol instanceof VariableSymbol variable)
		{
			return new AccessStep(AccessStep.Kind.VARIABLE, variable.getName(), variable.getType(), variable, owner, node);
		}
		if (symbol instanceof FunctionSymbol fn)
		{
			return new AccessStep(AccessStep.Kind.FUNCTION, fn.getName(), null, fn, owner, node);
		}
		if (symbol instanceof ScopeSymbol scope)
		{
			return new AccessStep(AccessStep.Kind.SCOPE, scope.getName(), null, null, scope, node);
		}
		return new AccessStep(AccessStep.Kind.TYPE, symbol.getName(), null, symbol, owner, node);
	}

	private AccessStep resolveOp(AccessStep previous, CNextParser.PostfixOpContext op, ResolutionContext ctx)
	{
		if (op.DOT() != null)
		{
			return memberOf(previous, op.IDENTIFIER().getText(), op, ctx);
		}
		if (op.LBRACKET() != null)
		{
			return indexOf(previous, op.expression().size() == 2, op);
		}
		return callOf(previous, op);
	}

	private AccessStep memberOf(AccessStep previous, String name, ParserRuleContext node, ResolutionContext ctx)
	{
		switch (previous.getKind())
		{
			case SCOPE ->
			{
				ScopeSymbol scope = previous.getScope();
				Optional<Symbol> member = scope.resolveLocally(name);
				if (member.isEmpty())
				{
					String where = scope.isGlobal() ? "global scope" : "scope '" + scope.getPath() + "'";
					throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, node, "'" + name + "' is not declared in " + where);
				}
				boolean viaSelf = "this".equals(previous.getName());
				if (!registry.isVisible(scope, name, ctx.getCurrentScope(), viaSelf))
				{
					throw new VisibilityException(name, scope.getPath(), scope == ctx.getCurrentScope(), node.getStart());
				}
				return stepForMember(member.get(), scope, node);
			}
			case TYPE ->
			{
				Symbol type = previous.getSymbol();
				if (type instanceof EnumSymbol enumSymbol)
				{
					EnumMemberSymbol member = enumSymbol.getMember(name).orElseThrow(() ->
							new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, node, "'" + name + "' is not a member of enum '" + enumSymbol.getName() + "'"));
					return new AccessStep(AccessStep.Kind.ENUM_MEMBER, name, TypeDescriptor.user(enumSymbol.getCName()), member, previous.getScope(), node);
				}
				if (type instanceof RegisterSymbol register)
				{
					RegisterMemberSymbol member = register.getMember(name).orElseThrow(() ->
							new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, node, "'" + name + "' is not a member of register '" + register.getName() + "'"));
					return new AccessStep(AccessStep.Kind.REGISTER_MEMBER, name, member.getType(), member, previous.getScope(), node);
				}
				throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, node, "type '" + type.getName() + "' has no member '" + name + "'");
			}
			case UNKNOWN ->
			{
				return new AccessStep(AccessStep.Kind.UNKNOWN, name, null, null, null, node);
			}
			default ->
			{
				return valueMemberOf(previous, name, node);
			}
		}
	}

	private AccessStep valueMemberOf(AccessStep previous, String name, ParserRuleContext node)
	{
		TypeDescriptor type = previous.getType();
		if (type == null)
		{
			return new AccessStep(AccessStep.Kind.UNKNOWN, name, null, null, null, node);
		}
		if ("length".equals(name))
		{
			if (type.isArray())
			{
				return new AccessStep(AccessStep.Kind.ARRAY_LENGTH, type.getDimensions().get(0), TypeDescriptor.of(PrimitiveType.U32), null, null, node);
			}
			if (type.isString())
			{
				return new AccessStep(AccessStep.Kind.STRING_LENGTH, name, TypeDescriptor.of(PrimitiveType.U32), null, null, node);
			}
		}
		if (type.isUserType() && !type.isArray())
		{
			Optional<StructSymbol> struct = registry.findStruct(type.getUserTypeName());
			if (struct.isPresent() && struct.get().getLanguage() == SourceLanguage.CNEXT)
			{
				StructSymbol.Field field = struct.get().getField(name).orElseThrow(() ->
						new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, node, "struct '" + struct.get().getName() + "' has no field '" + name + "'"));
				return new AccessStep(AccessStep.Kind.FIELD, name, field.getType(), struct.get(), null, node);
			}
			Optional<BitmapSymbol> bitmap = registry.findBitmap(type.getUserTypeName());
			if (bitmap.isPresent())
			{
				BitmapFieldSymbol field = bitmap.get().getField(name).orElseThrow(() ->
						new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, node, "bitmap '" + bitmap.get().getName() + "' has no field '" + name + "'"));
				TypeDescriptor fieldType = field.getWidth() == 1 ? TypeDescriptor.BOOL : TypeDescriptor.of(smallestUnsigned(field.getWidth()));
				return new AccessStep(AccessStep.Kind.BITMAP_FIELD, name, fieldType, field, null, node);
			}
		}
		return new AccessStep(AccessStep.Kind.UNKNOWN, name, null, null, null, node);
	}

	private AccessStep indexOf(AccessStep previous, boolean isRange, ParserRuleContext node)
	{
		TypeDescriptor type = previous.getType();
		if (type != null && type.isArray())
		{
			return new AccessStep(AccessStep.Kind.INDEX, null, type.elementType(), null, null, node);
		}
		if (type != null && integerView(type).isPresent())
		{
			if (isRange)
			{
				return new AccessStep(AccessStep.Kind.BIT_RANGE, null, TypeDescriptor.of(integerView(type).get()), null, null, node);
			}
			return new AccessStep(AccessStep.Kind.BIT, null, TypeDescriptor.BOOL, null, null, node);
		}
		if (type != null && type.isString())
		{
			return new AccessStep(AccessStep.Kind.INDEX, null, TypeDescriptor.of(PrimitiveType.U8), null, null, node);
		}
		return new AccessStep(AccessStep.Kind.INDEX, null, null, null, null, node);
	}

	private AccessStep callOf(AccessStep previous, CNextParser.PostfixOpContext op)
	{
		if (previous.getKind() == AccessStep.Kind.FUNCTION)
		{
			FunctionSymbol fn = (FunctionSymbol) previous.getSymbol();
			TypeDescriptor returnType = fn.getReturnType().isPrimitive(PrimitiveType.VOID) ? null : fn.getReturnType();
			return new AccessStep(AccessStep.Kind.CALL, fn.getName(), returnType, fn, previous.getScope(), op);
		}
		if (isCallbackType(previous.getType()))
		{
			FunctionSymbol prototype = registry.findFunction(previous.getType().getUserTypeName()).orElseThrow();
			TypeDescriptor returnType = prototype.getReturnType().isPrimitive(PrimitiveType.VOID) ? null : prototype.getReturnType();
			return new AccessStep(AccessStep.Kind.CALL, previous.getName(), returnType, prototype, null, op);
		}
		if (previous.getKind() == AccessStep.Kind.UNKNOWN || isIsrType(previous.getType()))
		{
			return new AccessStep(AccessStep.Kind.CALL, previous.getName(), null, null, null, op);
		}
		throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, op, "'" + previous.getName() + "' is not callable");
	}

	public static String text(TerminalNode node)
	{
		return node == null ? null : node.getText();
	}
}
