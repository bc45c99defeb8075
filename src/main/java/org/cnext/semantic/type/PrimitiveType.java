// File: src/main/java/org/cnext/semantic/type/PrimitiveType.java
package org.cnext.semantic.type;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of C-Next primitive types and their C mappings.
 */
public enum PrimitiveType
{
	U8("u8", "uint8_t", 8, false, true, "uint32_t"),
	U16("u16", "uint16_t", 16, false, true, "uint32_t"),
	U32("u32", "uint32_t", 32, false, true, "uint64_t"),
	U64("u64", "uint64_t", 64, false, true, "uint64_t"),
	I8("i8", "int8_t", 8, true, true, "int32_t"),
	I16("i16", "int16_t", 16, true, true, "int32_t"),
	I32("i32", "int32_t", 32, true, true, "int64_t"),
	I64("i64", "int64_t", 64, true, true, "int64_t"),
	F32("f32", "float", 32, true, false, "double"),
	F64("f64", "double", 64, true, false, "double"),
	BOOL("bool", "bool", 8, false, false, "bool"),
	VOID("void", "void", 0, false, false, "void"),
	STRING("string", "char", 8, false, false, "char");

	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;

	static
	{
		Map<String, PrimitiveType> map = new HashMap<>();
		for (PrimitiveType type : values())
		{
			map.put(type.keyword, type);
		}
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);
	}

	private final String keyword;
	private final String cType;
	private final int bits;
	private final boolean signed;
	private final boolean integer;
	private final String widerCType;

	PrimitiveType(String keyword, String cType, int bits, boolean signed, boolean integer, String widerCType)
	{
		this.keyword = keyword;
		this.cType = cType;
		this.bits = bits;
		this.signed = signed;
		this.integer = integer;
		this.widerCType = widerCType;
	}

	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_TYPE_MAP.get(keyword));
	}

	public String getKeyword()
	{
		return keyword;
	}

	public String getCType()
	{
		return cType;
	}

	public int getBits()
	{
		return bits;
	}

	public boolean isSigned()
	{
		return signed;
	}

	public boolean isInteger()
	{
		return integer;
	}

	public boolean isFloat()
	{
		return this == F32 || this == F64;
	}

	/**
	 * The type an overflow helper computes in. 64-bit types have no wider type
	 * and map to themselves.
	 */
	public String getWiderCType()
	{
		return widerCType;
	}

	public boolean hasWiderType()
	{
		return integer && bits < 64;
	}

	public String getMaxMacro()
	{
		return (signed ? "INT" : "UINT") + bits + "_MAX";
	}

	public String getMinMacro()
	{
		return signed ? "INT" + bits + "_MIN" : "0";
	}
}
