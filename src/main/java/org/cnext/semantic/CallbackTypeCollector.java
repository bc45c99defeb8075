package org.cnext.semantic;

import org.cnext.parser.CNextBaseVisitor;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.Set;
import java.util.TreeSet;

/**
 * Finds every function that some file uses as a type. Each such function gets a
 * {@code <name>_fp} pointer typedef, emitted once next to its definition.
 */
public class CallbackTypeCollector extends CNextBaseVisitor<Void>
{
	private final SymbolRegistry registry;
	private final TypeResolver typeResolver;
	private final Set<String> callbackTypes = new TreeSet<>();
	private ScopeSymbol currentScope;

	public CallbackTypeCollector(TypeResolver typeResolver)
	{
		this.typeResolver = typeResolver;
		this.registry = typeResolver.getRegistry();
		this.currentScope = registry.getGlobalScope();
	}

	public void collect(CompilationUnit unit)
	{
		currentScope = registry.getGlobalScope();
		visit(unit.getTree());
	}

	@Override
	public Void visitScopeDeclaration(CNextParser.ScopeDeclarationContext ctx)
	{
		ScopeSymbol previous = currentScope;
		String name = ctx.IDENTIFIER().getText();
		currentScope = registry.findScope(previous.isGlobal() ? name : previous.getPath() + "." + name).orElse(previous);
		try
		{
			return visitChildren(ctx);
		}
		finally
		{
			currentScope = previous;
		}
	}

	@Override
	public Void visitType(CNextParser.TypeContext ctx)
	{
		TypeDescriptor type = typeResolver.resolveType(ctx, currentScope);
		if (typeResolver.isCallbackType(type))
		{
			callbackTypes.add(type.getUserTypeName());
		}
		return null;
	}

	/**
	 * Mangled names of the callback functions, sorted.
	 */
	public Set<String> getCallbackTypes()
	{
		return callbackTypes;
	}
}
