package org.cnext.semantic;

import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;

import java.util.Optional;

/**
 * Visits every function body of a compilation unit, global functions and scope
 * members alike, in the order they are declared.
 */
public abstract class FunctionBodyAnalyzer
{
	protected final TypeResolver typeResolver;
	protected final SymbolRegistry registry;

	protected FunctionBodyAnalyzer(TypeResolver typeResolver)
	{
		this.typeResolver = typeResolver;
		this.registry = typeResolver.getRegistry();
	}

	public void analyze(CompilationUnit unit)
	{
		for (CNextParser.DeclarationContext declaration : unit.getTree().declaration())
		{
			if (declaration.functionDeclaration() != null)
			{
				analyzeDeclared(registry.getGlobalScope(), declaration.functionDeclaration());
			}
			else if (declaration.scopeDeclaration() != null)
			{
				ScopeSymbol scope = registry.findScope(declaration.scopeDeclaration().IDENTIFIER().getText()).orElseThrow();
				for (CNextParser.ScopeMemberContext member : declaration.scopeDeclaration().scopeMember())
				{
					if (member.functionDeclaration() != null)
					{
						analyzeDeclared(scope, member.functionDeclaration());
					}
				}
			}
		}
	}

	private void analyzeDeclared(ScopeSymbol scope, CNextParser.FunctionDeclarationContext ctx)
	{
		Optional<FunctionSymbol> symbol = scope.resolveLocally(ctx.IDENTIFIER().getText())
				.filter(FunctionSymbol.class::isInstance)
				.map(FunctionSymbol.class::cast);
		if (symbol.isPresent() && symbol.get().getBody() == ctx)
		{
			analyzeFunction(scope, symbol.get(), ctx);
		}
	}

	protected abstract void analyzeFunction(ScopeSymbol scope, FunctionSymbol fn, CNextParser.FunctionDeclarationContext ctx);
}
