package org.cnext.semantic;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.cnext.parser.CNextLexer;
import org.cnext.parser.CNextParser;
import org.cnext.pipeline.TranspileResult;
import org.cnext.pipeline.Transpiler;
import org.cnext.pipeline.TranspilerOptions;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.ErrorCode;
import org.cnext.util.ErrorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EnumTypeResolverTest
{
	private static final String SOURCE = String.join("\n",
			"scope Motor {",
			"    public enum Mode { SLOW, FAST }",
			"    enum Fault { NONE, STALL }",
			"}",
			"enum Color { RED, GREEN }",
			"struct Point { i32 x; i32 y; }",
			"");

	private SymbolRegistry registry;
	private EnumTypeResolver resolver;

	@BeforeEach
	void setUp()
	{
		TranspileResult result = new Transpiler(TranspilerOptions.defaults(), new ErrorHandler())
				.transpileSources(Map.of("types.cnx", SOURCE));
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());
		registry = result.getRegistry();
		resolver = new EnumTypeResolver(new TypeResolver(registry));
	}

	private static CNextParser.ExpressionContext expression(String text)
	{
		return new CNextParser(new CommonTokenStream(new CNextLexer(CharStreams.fromString(text)))).expression();
	}

	/**
	 * Position at global scope with one local, {@code Point p}.
	 */
	private ResolutionContext atGlobalScope()
	{
		return new ResolutionContext()
		{
			@Override
			public ScopeSymbol getCurrentScope()
			{
				return registry.getGlobalScope();
			}

			@Override
			public Optional<TypeDescriptor> lookupLocalType(String name)
			{
				return name.equals("p") ? Optional.of(TypeDescriptor.user("Point")) : Optional.empty();
			}
		};
	}

	@Test
	void globalEnumMemberHasItsEnumType()
	{
		assertEquals(Optional.of("Color"), resolver.resolve(expression("Color.RED"), atGlobalScope()));
	}

	@Test
	void publicScopedEnumMemberResolvesThroughScope()
	{
		assertEquals(Optional.of("Motor_Mode"), resolver.resolve(expression("Motor.Mode.FAST"), atGlobalScope()));
	}

	@Test
	void privateScopedEnumIsNotVisibleOutside()
	{
		VisibilityException e = assertThrows(VisibilityException.class,
				() -> resolver.resolve(expression("Motor.Fault.STALL"), atGlobalScope()));
		assertEquals(ErrorCode.VISIBILITY, e.getErrorCode());
	}

	@Test
	void unknownStructFieldIsNotAnEnum()
	{
		assertEquals(Optional.empty(), resolver.resolve(expression("p.z"), atGlobalScope()));
		assertEquals(Optional.empty(), resolver.resolve(expression("p.x"), atGlobalScope()));
	}
}
