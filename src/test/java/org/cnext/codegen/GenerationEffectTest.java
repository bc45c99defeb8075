package org.cnext.codegen;

import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

public class GenerationEffectTest
{
	private final ParameterSymbol value = new ParameterSymbol("value", TypeDescriptor.of(PrimitiveType.U8), 0);

	private ParameterBinding binding(ParameterBinding.Passing passing)
	{
		return new ParameterBinding(value, passing, false);
	}

	@Test
	void parameterSetsWithSameBindingsAreEqual()
	{
		GenerationEffect first = GenerationEffect.setParameters(Map.of("value", binding(ParameterBinding.Passing.VALUE)));
		GenerationEffect second = GenerationEffect.setParameters(Map.of("value", binding(ParameterBinding.Passing.VALUE)));

		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
	}

	@Test
	void parameterSetsDifferingOnlyInBindingsAreDistinct()
	{
		GenerationEffect byValue = GenerationEffect.setParameters(Map.of("value", binding(ParameterBinding.Passing.VALUE)));
		GenerationEffect byPointer = GenerationEffect.setParameters(Map.of("value", binding(ParameterBinding.Passing.SCALAR_POINTER)));

		assertNotEquals(byValue, byPointer);
		assertNotEquals(byValue.hashCode(), byPointer.hashCode());
		Set<GenerationEffect> effects = new HashSet<>(List.of(byValue, byPointer));
		assertEquals(2, effects.size());
	}
}
