package org.cnext.util;

/**
 * Stable diagnostic codes. The numeric range groups codes by category:
 * 00xx syntax, 01xx declaration, 04xx resolution, 05xx preprocessor,
 * 03xx initialization, 06xx sizeof, 07xx conditions, 08xx arithmetic and
 * critical sections.
 */
public enum ErrorCode
{
	SYNTAX("E0001"),

	DUPLICATE_SYMBOL("E0101"),
	UNKNOWN_TYPE("E0102"),
	INVALID_MODIFIER("E0103"),
	INVALID_CONSTANT("E0104"),

	USE_BEFORE_INIT("E0381"),

	UNKNOWN_IDENTIFIER("E0401"),
	VISIBILITY("E0402"),
	READ_ONLY_REGISTER("E0403"),
	WRITE_ONLY_REGISTER("E0404"),
	BITMAP_WIDTH("E0405"),
	SHIFT_OUT_OF_RANGE("E0406"),
	AMBIGUOUS_SYMBOL("E0424"),

	FUNCTION_MACRO("E0501"),
	DEFINE_WITH_VALUE("E0502"),
	IMPLEMENTATION_INCLUDE("E0503"),

	SIZEOF_ARRAY_PARAMETER("E0601"),
	SIZEOF_SIDE_EFFECT("E0602"),

	NON_BOOLEAN_CONDITION("E0701"),
	CALL_IN_CONDITION("E0702"),

	DIVISION_BY_ZERO("E0800"),
	MODULO_BY_ZERO("E0802"),
	FLOAT_MODULO("E0804"),
	RETURN_IN_CRITICAL("E0853");

	private final String code;

	ErrorCode(String code)
	{
		this.code = code;
	}

	public String getCode()
	{
		return code;
	}
}
