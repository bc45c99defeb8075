package org.cnext.codegen.helpers;

import org.cnext.semantic.type.PrimitiveType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HelperSynthesizerTest
{
	private static final String HEADER = "cnx_helpers.h";

	@Test
	void emptyDemandProducesNothing()
	{
		assertEquals("", new HelperSynthesizer(OverflowMode.CLAMP).synthesize(new HelperDemand(), HEADER));
	}

	@Test
	void helpersAreEmittedOnceInKeyOrder()
	{
		HelperDemand demand = new HelperDemand();
		demand.requireOverflow("mul", PrimitiveType.U32);
		demand.requireOverflow("add", PrimitiveType.U8);
		demand.requireOverflow("sub", PrimitiveType.U16);
		demand.requireOverflow("add", PrimitiveType.U8);

		String text = new HelperSynthesizer(OverflowMode.CLAMP).synthesize(demand, HEADER);

		int add = text.indexOf("cnx_clamp_add_u8(");
		int mul = text.indexOf("cnx_clamp_mul_u32(");
		int sub = text.indexOf("cnx_clamp_sub_u16(");
		assertTrue(add > 0 && add < mul && mul < sub, text);
		assertEquals(add, text.lastIndexOf("cnx_clamp_add_u8("));
	}

	@Test
	void outputDependsOnlyOnTheDemandedSet()
	{
		HelperDemand first = new HelperDemand();
		first.requireOverflow("add", PrimitiveType.I16);
		first.requireSafeDiv("div", PrimitiveType.U32);
		HelperDemand second = new HelperDemand();
		second.requireSafeDiv("div", PrimitiveType.U32);
		second.requireOverflow("add", PrimitiveType.I16);
		second.requireOverflow("add", PrimitiveType.I16);

		HelperSynthesizer synthesizer = new HelperSynthesizer(OverflowMode.CLAMP);
		assertEquals(synthesizer.synthesize(first, HEADER), synthesizer.synthesize(second, HEADER));
	}

	@Test
	void headerIsGuarded()
	{
		HelperDemand demand = new HelperDemand();
		demand.requireOverflow("add", PrimitiveType.U8);

		String text = new HelperSynthesizer(OverflowMode.CLAMP).synthesize(demand, HEADER);

		assertTrue(text.contains("#ifndef CNX_HELPERS_H\n#define CNX_HELPERS_H"));
		assertTrue(text.contains("#include <limits.h>"));
		assertTrue(text.trim().endsWith("#endif /* CNX_HELPERS_H */"));
	}

	@Test
	void unsignedAddClampsToMax()
	{
		HelperDemand demand = new HelperDemand();
		demand.requireOverflow("add", PrimitiveType.U8);

		String text = new HelperSynthesizer(OverflowMode.CLAMP).synthesize(demand, HEADER);

		assertTrue(text.contains("static inline uint8_t cnx_clamp_add_u8(uint8_t a, uint32_t b) {"), text);
		assertTrue(text.contains("if (b > (uint32_t)(UINT8_MAX - a)) return UINT8_MAX;"), text);
		assertTrue(text.contains("__builtin_add_overflow(a, (uint8_t)b, &result)"), text);
	}

	@Test
	void unsignedSubClampsToZero()
	{
		HelperDemand demand = new HelperDemand();
		demand.requireOverflow("sub", PrimitiveType.U16);

		String text = new HelperSynthesizer(OverflowMode.CLAMP).synthesize(demand, HEADER);

		assertTrue(text.contains("return 0;"), text);
		assertTrue(text.contains("__builtin_sub_overflow"), text);
	}

	@Test
	void widestSignedAddChecksBoundariesBeforeComputing()
	{
		HelperDemand demand = new HelperDemand();
		demand.requireOverflow("add", PrimitiveType.I64);

		String text = new HelperSynthesizer(OverflowMode.CLAMP).synthesize(demand, HEADER);

		assertTrue(text.contains("static inline int64_t cnx_clamp_add_i64(int64_t a, int64_t b) {"), text);
		assertTrue(text.contains("if (b > 0 && a > INT64_MAX - b) return INT64_MAX;"), text);
		assertTrue(text.contains("if (b < 0 && a < INT64_MIN - b) return INT64_MIN;"), text);
		assertTrue(text.contains("return a + b;"), text);
	}

	@Test
	void narrowSignedComputesInWiderType()
	{
		HelperDemand demand = new HelperDemand();
		demand.requireOverflow("mul", PrimitiveType.I16);

		String text = new HelperSynthesizer(OverflowMode.CLAMP).synthesize(demand, HEADER);

		assertTrue(text.contains("if (result > INT16_MAX) return INT16_MAX;"), text);
		assertTrue(text.contains("if (result < INT16_MIN) return INT16_MIN;"), text);
		assertTrue(text.contains("return (int16_t)result;"), text);
	}

	@Test
	void panicModeAbortsWithMessage()
	{
		HelperDemand demand = new HelperDemand();
		demand.requireOverflow("sub", PrimitiveType.U8);
		demand.requireOverflow("add", PrimitiveType.I32);

		String text = new HelperSynthesizer(OverflowMode.PANIC).synthesize(demand, HEADER);

		assertTrue(text.contains("#include <stdio.h>"));
		assertTrue(text.contains("#include <stdlib.h>"));
		assertTrue(text.contains("fprintf(stderr, \"PANIC: Integer underflow in u8 subtraction\\n\");"), text);
		assertTrue(text.contains("fprintf(stderr, \"PANIC: Integer overflow in i32 addition\\n\");"), text);
		assertTrue(text.contains("abort();"));
		// Same helper names in both modes
		assertTrue(text.contains("cnx_clamp_sub_u8("));
		assertFalse(text.contains("return UINT8_MAX;"));
	}

	@Test
	void safeDivisionStoresDefaultOnZeroDivisor()
	{
		HelperDemand demand = new HelperDemand();
		demand.requireSafeDiv("div", PrimitiveType.U32);
		demand.requireSafeDiv("mod", PrimitiveType.I8);

		String text = new HelperSynthesizer(OverflowMode.CLAMP).synthesize(demand, HEADER);

		assertTrue(text.contains("static inline bool cnx_safe_div_u32(uint32_t* output, uint32_t numerator, uint32_t divisor, uint32_t defaultValue) {"), text);
		assertTrue(text.contains("*output = defaultValue;\n        return true;"), text);
		assertTrue(text.contains("*output = numerator / divisor;\n    return false;"), text);
		assertTrue(text.contains("*output = numerator % divisor;"), text);
		// Division alone needs no limits
		assertFalse(text.contains("<limits.h>"));
	}
}
