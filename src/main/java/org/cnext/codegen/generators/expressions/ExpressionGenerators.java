package org.cnext.codegen.generators.expressions;

import org.cnext.codegen.GeneratorRegistry;
import org.cnext.parser.CNextParser;

/**
 * Registers the expression generators.
 */
public final class ExpressionGenerators
{
	private ExpressionGenerators()
	{
	}

	public static void registerAll(GeneratorRegistry registry)
	{
		registry.register(CNextParser.TernaryExpressionContext.class, new TernaryGenerator());
		registry.register(CNextParser.OrExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.AndExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.EqualityExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.RelationalExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.BitwiseOrExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.BitwiseXorExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.BitwiseAndExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.ShiftExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.AdditiveExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.MultiplicativeExpressionContext.class, new BinaryExpressionGenerator<>());
		registry.register(CNextParser.UnaryExpressionContext.class, new UnaryGenerator());
		registry.register(CNextParser.PostfixExpressionContext.class, new PostfixGenerator());
		registry.register(CNextParser.PrimaryExpressionContext.class, new PrimaryGenerator());
		registry.register(CNextParser.LiteralContext.class, new LiteralGenerator());
		registry.register(CNextParser.CastExpressionContext.class, new CastGenerator());
		registry.register(CNextParser.SizeofExpressionContext.class, new SizeofGenerator());
		registry.register(CNextParser.StructInitializerContext.class, new StructInitializerGenerator());
		registry.register(CNextParser.ArrayInitializerContext.class, new ArrayInitializerGenerator());
	}
}
