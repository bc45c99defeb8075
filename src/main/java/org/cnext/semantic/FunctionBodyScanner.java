package org.cnext.semantic;

import org.cnext.parser.CNextBaseVisitor;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Tree walk over one function body that keeps track of the parameters and of the
 * locals declared so far, so expressions in the body can be resolved.
 */
public abstract class FunctionBodyScanner extends CNextBaseVisitor<Void> implements ResolutionContext
{
	protected final TypeResolver typeResolver;
	protected final ScopeSymbol scope;
	protected final Map<String, ParameterSymbol> parameters = new HashMap<>();
	protected final Map<String, TypeDescriptor> locals = new HashMap<>();
	private final Map<String, Long> localConstants = new HashMap<>();

	protected FunctionBodyScanner(TypeResolver typeResolver, FunctionSymbol fn, ScopeSymbol scope)
	{
		this.typeResolver = typeResolver;
		this.scope = scope;
		for (ParameterSymbol parameter : fn.getParameters())
		{
			parameters.put(parameter.getName(), parameter);
		}
	}

	@Override
	public ScopeSymbol getCurrentScope()
	{
		return scope;
	}

	@Override
	public Optional<TypeDescriptor> lookupLocalType(String name)
	{
		if (locals.containsKey(name))
		{
			return Optional.of(locals.get(name));
		}
		return Optional.ofNullable(parameters.get(name)).map(ParameterSymbol::getType);
	}

	@Override
	public Void visitVariableDeclaration(CNextParser.VariableDeclarationContext ctx)
	{
		visitChildren(ctx);
		String name = ctx.IDENTIFIER().getText();
		locals.put(name, typeResolver.resolveType(ctx.type(), scope, ctx.arrayDimension()));
		localConstants.remove(name);
		if (ctx.constModifier() != null && ctx.expression() != null)
		{
			ConstantEvaluator.evaluate(ctx.expression(), constants()).ifPresent(value -> localConstants.put(name, value));
		}
		return null;
	}

	@Override
	public Void visitForVarDecl(CNextParser.ForVarDeclContext ctx)
	{
		visitChildren(ctx);
		locals.put(ctx.IDENTIFIER().getText(), typeResolver.resolveType(ctx.type(), scope));
		localConstants.remove(ctx.IDENTIFIER().getText());
		return null;
	}

	/**
	 * Constant lookup for folding: local constants first, then globals and the
	 * enclosing scope. Non-constant locals and parameters hide outer constants.
	 */
	protected Function<String, Optional<Long>> constants()
	{
		return name ->
		{
			if (localConstants.containsKey(name))
			{
				return Optional.of(localConstants.get(name));
			}
			if (lookupLocalType(name).isPresent())
			{
				return Optional.empty();
			}
			return typeResolver.lookupConstant(name, scope);
		};
	}
}
