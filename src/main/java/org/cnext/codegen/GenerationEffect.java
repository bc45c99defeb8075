// File: src/main/java/org/cnext/codegen/GenerationEffect.java
package org.cnext.codegen;

import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A state change requested by a generator. Generators never mutate state
 * themselves; the {@link CodeGenerator} applies effects in the order they are
 * returned.
 */
public final class GenerationEffect
{
	public enum Kind
	{
		INCLUDE,
		ISR_TYPEDEF,
		IRQ_WRAPPERS,
		OVERFLOW_HELPER,
		SAFE_DIV_HELPER,
		REGISTER_TYPE,
		REGISTER_LOCAL,
		REGISTER_CONST,
		PUSH_SCOPE,
		POP_SCOPE,
		ENTER_FUNCTION_BODY,
		EXIT_FUNCTION_BODY,
		SET_PARAMETERS,
		CLEAR_PARAMETERS,
		REGISTER_CALLBACK_FIELD,
		SET_ARRAY_INIT_COUNT
	}

	static final String WRAP = "wrap";

	private final Kind kind;
	private final String name;
	private final String value;
	private final TypeDescriptor type;
	private final PrimitiveType primitive;
	private final boolean isArray;
	private final long count;
	private final Map<String, ParameterBinding> parameters;

	private GenerationEffect(Kind kind, String name, String value, TypeDescriptor type, PrimitiveType primitive, boolean isArray, long count,
							 Map<String, ParameterBinding> parameters)
	{
		this.kind = kind;
		this.name = name;
		this.value = value;
		this.type = type;
		this.primitive = primitive;
		this.isArray = isArray;
		this.count = count;
		this.parameters = parameters;
	}

	private static GenerationEffect of(Kind kind, String name)
	{
		return new GenerationEffect(kind, name, null, null, null, false, 0, Map.of());
	}

	/**
	 * @param header the text between {@code #include} and end of line, e.g. {@code <stdint.h>}
	 */
	public static GenerationEffect include(String header)
	{
		return of(Kind.INCLUDE, header);
	}

	public static GenerationEffect isrTypedef()
	{
		return of(Kind.ISR_TYPEDEF, null);
	}

	public static GenerationEffect irqWrappers()
	{
		return of(Kind.IRQ_WRAPPERS, null);
	}

	/**
	 * @param op one of {@code add}, {@code sub}, {@code mul}
	 */
	public static GenerationEffect overflowHelper(String op, PrimitiveType type)
	{
		return new GenerationEffect(Kind.OVERFLOW_HELPER, op, null, null, type, false, 0, Map.of());
	}

	/**
	 * @param op {@code div} or {@code mod}
	 */
	public static GenerationEffect safeDivHelper(String op, PrimitiveType type)
	{
		return new GenerationEffect(Kind.SAFE_DIV_HELPER, op, null, null, type, false, 0, Map.of());
	}

	public static GenerationEffect registerType(String name, TypeDescriptor type)
	{
		return new GenerationEffect(Kind.REGISTER_TYPE, name, null, type, null, false, 0, Map.of());
	}

	public static GenerationEffect registerLocal(String name, TypeDescriptor type, boolean isArray)
	{
		return registerLocal(name, type, isArray, false);
	}

	/**
	 * @param wraps true for a {@code wrap} local, whose arithmetic is not clamped
	 */
	public static GenerationEffect registerLocal(String name, TypeDescriptor type, boolean isArray, boolean wraps)
	{
		return new GenerationEffect(Kind.REGISTER_LOCAL, name, wraps ? WRAP : null, type, null, isArray, 0, Map.of());
	}

	public static GenerationEffect registerConst(String name, long value)
	{
		return new GenerationEffect(Kind.REGISTER_CONST, name, null, null, null, false, value, Map.of());
	}

	public static GenerationEffect pushScope(String path)
	{
		return of(Kind.PUSH_SCOPE, path);
	}

	public static GenerationEffect popScope()
	{
		return of(Kind.POP_SCOPE, null);
	}

	/**
	 * @param functionCName mangled name of the function whose body starts
	 */
	public static GenerationEffect enterFunctionBody(String functionCName)
	{
		return of(Kind.ENTER_FUNCTION_BODY, functionCName);
	}

	public static GenerationEffect exitFunctionBody()
	{
		return of(Kind.EXIT_FUNCTION_BODY, null);
	}

	public static GenerationEffect setParameters(Map<String, ParameterBinding> parameters)
	{
		return new GenerationEffect(Kind.SET_PARAMETERS, null, null, null, null, false, 0,
				Collections.unmodifiableMap(new LinkedHashMap<>(parameters)));
	}

	public static GenerationEffect clearParameters()
	{
		return of(Kind.CLEAR_PARAMETERS, null);
	}

	/**
	 * @param structField {@code StructCName.field}
	 */
	public static GenerationEffect registerCallbackField(String structField, String callbackType)
	{
		return new GenerationEffect(Kind.REGISTER_CALLBACK_FIELD, structField, callbackType, null, null, false, 0, Map.of());
	}

	public static GenerationEffect setArrayInitCount(long count)
	{
		return new GenerationEffect(Kind.SET_ARRAY_INIT_COUNT, null, null, null, null, false, count, Map.of());
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getName()
	{
		return name;
	}

	public String getValue()
	{
		return value;
	}

	public TypeDescriptor getType()
	{
		return type;
	}

	public PrimitiveType getPrimitive()
	{
		return primitive;
	}

	public boolean isArray()
	{
		return isArray;
	}

	public long getCount()
	{
		return count;
	}

	public Map<String, ParameterBinding> getParameters()
	{
		return parameters;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof GenerationEffect other))
		{
			return false;
		}
		return kind == other.kind && isArray == other.isArray && count == other.count
				&& Objects.equals(name, other.name) && Objects.equals(value, other.value)
				&& Objects.equals(type, other.type) && primitive == other.primitive
				&& Objects.equals(parameters, other.parameters);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, name, value, type, primitive, isArray, count, parameters);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(kind.name());
		if (name != null)
		{
			sb.append('(').append(name);
			if (primitive != null)
			{
				sb.append(", ").append(primitive.getKeyword());
			}
			if (value != null)
			{
				sb.append(", ").append(value);
			}
			sb.append(')');
		}
		return sb.toString();
	}
}
