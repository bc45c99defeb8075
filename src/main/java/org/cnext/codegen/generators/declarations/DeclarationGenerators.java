package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.GeneratorRegistry;
import org.cnext.parser.CNextParser;

public final class DeclarationGenerators
{
	private DeclarationGenerators()
	{
	}

	public static void registerAll(GeneratorRegistry registry)
	{
		registry.register(CNextParser.IncludeDirectiveContext.class, new IncludeGenerator())
				.register(CNextParser.PreprocessorDirectiveContext.class, new PreprocessorGenerator())
				.register(CNextParser.ScopeDeclarationContext.class, new ScopeGenerator())
				.register(CNextParser.StructDeclarationContext.class, new StructGenerator())
				.register(CNextParser.EnumDeclarationContext.class, new EnumGenerator())
				.register(CNextParser.BitmapDeclarationContext.class, new BitmapGenerator())
				.register(CNextParser.RegisterDeclarationContext.class, new RegisterGenerator())
				.register(CNextParser.FunctionDeclarationContext.class, new FunctionGenerator())
				.register(CNextParser.VariableDeclarationContext.class, new VariableGenerator());
	}
}
