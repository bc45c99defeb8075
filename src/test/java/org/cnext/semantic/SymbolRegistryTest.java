package org.cnext.semantic;

import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.OverflowBehavior;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.symbol.VariableSymbol;
import org.cnext.semantic.symbol.Visibility;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolRegistryTest
{
	private static VariableSymbol variable(ScopeSymbol scope, String name, Visibility visibility, String file)
	{
		return new VariableSymbol(name, NameMangler.forMember(scope.getPath(), name), scope.getId(), TypeDescriptor.of(PrimitiveType.U8),
				visibility, false, OverflowBehavior.CLAMP, null, null, file, 1);
	}

	@Test
	void samePathYieldsSameScope()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol first = registry.getOrCreateScope("Motor.Control");
		ScopeSymbol second = registry.getOrCreateScope("Motor.Control");

		assertSame(first, second);
		assertEquals("Motor", registry.getParent(first).getPath());
		assertSame(registry.getGlobalScope(), registry.getParent(registry.getParent(first)));
	}

	@Test
	void globalScopeIsItsOwnParent()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol global = registry.getGlobalScope();

		assertEquals(SymbolRegistry.GLOBAL_SCOPE_ID, global.getId());
		assertEquals("", global.getPath());
		assertSame(global, registry.getParent(global));
	}

	@Test
	void functionNamesAreMangledExceptEntryPoint()
	{
		SymbolRegistry registry = new SymbolRegistry("app_main");
		ScopeSymbol motor = registry.getOrCreateScope("Motor");
		FunctionSymbol start = registry.registerFunction(motor, "start", TypeDescriptor.VOID, List.of(), Visibility.PUBLIC, null, "motor.cnx", 3);
		FunctionSymbol entry = registry.registerFunction(motor, "app_main", TypeDescriptor.VOID, List.of(), Visibility.PUBLIC, null, "motor.cnx", 7);

		assertEquals("Motor_start", start.getCName());
		assertEquals("app_main", entry.getCName());
		assertTrue(start.isExported());
	}

	@Test
	void duplicateInSameScopeIsRejected()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol global = registry.getGlobalScope();
		registry.registerVariable(global, variable(global, "counter", Visibility.PUBLIC, "a.cnx"));

		DuplicateSymbolException e = assertThrows(DuplicateSymbolException.class,
				() -> registry.registerVariable(global, variable(global, "counter", Visibility.PUBLIC, "b.cnx")));
		assertEquals(ErrorCode.DUPLICATE_SYMBOL, e.getErrorCode());
		assertTrue(e.getHint().contains("a.cnx"));
	}

	@Test
	void sameNameInDifferentScopesIsAllowed()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol left = registry.getOrCreateScope("Left");
		ScopeSymbol right = registry.getOrCreateScope("Right");
		registry.registerVariable(left, variable(left, "speed", Visibility.PUBLIC, "a.cnx"));
		registry.registerVariable(right, variable(right, "speed", Visibility.PUBLIC, "a.cnx"));

		assertTrue(registry.findVariable("Left_speed").isPresent());
		assertTrue(registry.findVariable("Right_speed").isPresent());
	}

	@Test
	void frozenRegistryRejectsMutation()
	{
		SymbolRegistry registry = new SymbolRegistry();
		registry.freeze();

		IllegalStateException e = assertThrows(IllegalStateException.class, () -> registry.getOrCreateScope("Late"));
		assertTrue(e.getMessage().contains("read-only"));
		// Lookups of existing scopes still work
		assertSame(registry.getGlobalScope(), registry.getOrCreateScope(""));
	}

	@Test
	void rollbackRemovesOnlyThatFilesSymbols()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol global = registry.getGlobalScope();
		registry.registerVariable(global, variable(global, "kept", Visibility.PUBLIC, "good.cnx"));
		registry.registerVariable(global, variable(global, "dropped", Visibility.PUBLIC, "bad.cnx"));

		registry.rollbackFile("bad.cnx");

		assertTrue(registry.findVariable("kept").isPresent());
		assertFalse(registry.findVariable("dropped").isPresent());
		assertTrue(registry.getSymbolsForFile("bad.cnx").isEmpty());
		// The name is free again
		registry.registerVariable(global, variable(global, "dropped", Visibility.PUBLIC, "other.cnx"));
	}

	@Test
	void privateFunctionIsHiddenOutsideItsScope()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol motor = registry.getOrCreateScope("Motor");
		registry.registerFunction(motor, "calibrate", TypeDescriptor.VOID, List.of(), Visibility.PRIVATE, null, "motor.cnx", 2);
		registry.registerFunction(motor, "start", TypeDescriptor.VOID, List.of(), Visibility.PUBLIC, null, "motor.cnx", 5);

		assertTrue(registry.resolveFunction("Motor.start", registry.getGlobalScope()).isPresent());
		assertTrue(registry.resolveFunction("global.Motor.start", registry.getGlobalScope()).isPresent());
		assertTrue(registry.resolveFunction("this.calibrate", motor).isPresent());

		VisibilityException e = assertThrows(VisibilityException.class,
				() -> registry.resolveFunction("Motor.calibrate", registry.getGlobalScope()));
		assertEquals(ErrorCode.VISIBILITY, e.getErrorCode());
		assertFalse(registry.findFunction("Motor_calibrate").orElseThrow().isExported());
	}

	@Test
	void thisOutsideScopeResolvesNothing()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol global = registry.getGlobalScope();
		registry.registerFunction(global, "tick", TypeDescriptor.VOID, List.of(), Visibility.PRIVATE, null, "a.cnx", 1);

		Optional<FunctionSymbol> viaThis = registry.resolveFunction("this.tick", global);
		assertTrue(viaThis.isEmpty());
		// Global symbols are always exported
		assertTrue(registry.resolveFunction("tick", global).orElseThrow().isExported());
	}

	@Test
	void symbolsForFileKeepDeclarationOrderAndSkipScopes()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol motor = registry.getOrCreateScope("Motor");
		registry.registerVariable(motor, variable(motor, "b", Visibility.PUBLIC, "m.cnx"));
		registry.registerVariable(motor, variable(motor, "a", Visibility.PRIVATE, "m.cnx"));

		List<String> names = registry.getSymbolsForFile("m.cnx").stream().map(s -> s.getName()).toList();
		assertEquals(List.of("b", "a"), names);
	}

	@Test
	void scopeSplitAcrossFilesCollectsMembersFromBoth()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol fromA = registry.getOrCreateScope("Motor");
		registry.registerVariable(fromA, variable(fromA, "speed", Visibility.PUBLIC, "a.cnx"));
		registry.registerFunction(fromA, "start", TypeDescriptor.VOID, List.of(), Visibility.PUBLIC, null, "a.cnx", 2);
		ScopeSymbol fromB = registry.getOrCreateScope("Motor");
		registry.registerVariable(fromB, variable(fromB, "torque", Visibility.PRIVATE, "b.cnx"));
		FunctionSymbol stop = registry.registerFunction(fromB, "stop", TypeDescriptor.VOID, List.of(), Visibility.PUBLIC, null, "b.cnx", 4);

		assertSame(fromA, fromB);
		assertSame(fromA, registry.findScope("Motor").orElseThrow());
		assertSame(fromA, registry.getScope(fromA.getId()));
		assertEquals(List.of("speed", "start", "torque", "stop"), fromA.getMemberNames());
		assertEquals(List.of("speed", "torque"), fromA.getVariableNames());
		assertEquals(2, fromA.getFunctionIds().size());
		assertTrue(fromA.getFunctionIds().contains(stop.getId()));
	}

	@Test
	void rollbackOfOneFileKeepsOtherFilesScopeMembers()
	{
		SymbolRegistry registry = new SymbolRegistry();
		ScopeSymbol motor = registry.getOrCreateScope("Motor");
		registry.registerVariable(motor, variable(motor, "speed", Visibility.PUBLIC, "a.cnx"));
		FunctionSymbol start = registry.registerFunction(motor, "start", TypeDescriptor.VOID, List.of(), Visibility.PUBLIC, null, "a.cnx", 2);
		registry.registerVariable(motor, variable(motor, "torque", Visibility.PUBLIC, "b.cnx"));
		registry.registerFunction(motor, "stop", TypeDescriptor.VOID, List.of(), Visibility.PUBLIC, null, "b.cnx", 4);

		registry.rollbackFile("b.cnx");

		assertSame(motor, registry.findScope("Motor").orElseThrow());
		assertEquals(List.of("speed", "start"), motor.getMemberNames());
		assertEquals(List.of("speed"), motor.getVariableNames());
		assertEquals(List.of(start.getId()), motor.getFunctionIds());
		assertTrue(registry.findFunction("Motor_start").isPresent());
		assertFalse(registry.findFunction("Motor_stop").isPresent());
		assertFalse(registry.findVariable("Motor_torque").isPresent());
	}
}
