package org.cnext.codegen.generators.statements;

import org.cnext.codegen.GeneratorRegistry;
import org.cnext.parser.CNextParser;

public final class StatementGenerators
{
	private StatementGenerators()
	{
	}

	public static void registerAll(GeneratorRegistry registry)
	{
		registry.register(CNextParser.BlockContext.class, new BlockGenerator())
				.register(CNextParser.ExpressionStatementContext.class, new ExpressionStatementGenerator())
				.register(CNextParser.AssignmentStatementContext.class, new AssignmentGenerator())
				.register(CNextParser.IfStatementContext.class, new IfGenerator())
				.register(CNextParser.WhileStatementContext.class, new WhileGenerator())
				.register(CNextParser.DoWhileStatementContext.class, new DoWhileGenerator())
				.register(CNextParser.ForStatementContext.class, new ForGenerator())
				.register(CNextParser.SwitchStatementContext.class, new SwitchGenerator())
				.register(CNextParser.ReturnStatementContext.class, new ReturnGenerator())
				.register(CNextParser.CriticalStatementContext.class, new CriticalGenerator());
	}
}
