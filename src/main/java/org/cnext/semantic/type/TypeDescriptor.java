package org.cnext.semantic.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A resolved C-Next type: either a primitive or a reference to a user type by its
 * mangled C name, plus array dimensions and qualifiers. Immutable.
 */
public final class TypeDescriptor
{
	public static final TypeDescriptor VOID = new TypeDescriptor(PrimitiveType.VOID, null, List.of(), false, false, 0);
	public static final TypeDescriptor BOOL = of(PrimitiveType.BOOL);

	private final PrimitiveType primitive;
	private final String userTypeName;
	private final List<String> dimensions;
	private final boolean isConst;
	private final boolean isAtomic;
	private final int stringCapacity;

	private TypeDescriptor(PrimitiveType primitive, String userTypeName, List<String> dimensions, boolean isConst, boolean isAtomic, int stringCapacity)
	{
		this.primitive = primitive;
		this.userTypeName = userTypeName;
		this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
		this.isConst = isConst;
		this.isAtomic = isAtomic;
		this.stringCapacity = stringCapacity;
	}

	public static TypeDescriptor of(PrimitiveType primitive)
	{
		return new TypeDescriptor(primitive, null, List.of(), false, false, 0);
	}

	public static TypeDescriptor user(String userTypeName)
	{
		return new TypeDescriptor(null, userTypeName, List.of(), false, false, 0);
	}

	public static TypeDescriptor string(int capacity)
	{
		return new TypeDescriptor(PrimitiveType.STRING, null, List.of(), false, false, capacity);
	}

	public TypeDescriptor withDimensions(List<String> newDimensions)
	{
		return new TypeDescriptor(primitive, userTypeName, newDimensions, isConst, isAtomic, stringCapacity);
	}

	public TypeDescriptor withConst(boolean value)
	{
		return new TypeDescriptor(primitive, userTypeName, dimensions, value, isAtomic, stringCapacity);
	}

	public TypeDescriptor withAtomic(boolean value)
	{
		return new TypeDescriptor(primitive, userTypeName, dimensions, isConst, value, stringCapacity);
	}

	/**
	 * The type of one element: drops the outermost dimension.
	 */
	public TypeDescriptor elementType()
	{
		if (dimensions.isEmpty())
		{
			return this;
		}
		return withDimensions(dimensions.subList(1, dimensions.size()));
	}

	public boolean isPrimitive()
	{
		return primitive != null;
	}

	public boolean isPrimitive(PrimitiveType type)
	{
		return primitive == type;
	}

	public boolean isUserType()
	{
		return userTypeName != null;
	}

	public boolean isArray()
	{
		return !dimensions.isEmpty();
	}

	public boolean isString()
	{
		return primitive == PrimitiveType.STRING;
	}

	public boolean isInteger()
	{
		return primitive != null && primitive.isInteger() && dimensions.isEmpty();
	}

	public boolean isFloat()
	{
		return primitive != null && primitive.isFloat() && dimensions.isEmpty();
	}

	public boolean isBool()
	{
		return primitive == PrimitiveType.BOOL && dimensions.isEmpty();
	}

	public PrimitiveType getPrimitive()
	{
		return primitive;
	}

	public String getUserTypeName()
	{
		return userTypeName;
	}

	public List<String> getDimensions()
	{
		return dimensions;
	}

	public boolean isConst()
	{
		return isConst;
	}

	public boolean isAtomic()
	{
		return isAtomic;
	}

	public int getStringCapacity()
	{
		return stringCapacity;
	}

	/**
	 * The C spelling of the base type without dimensions or qualifiers.
	 */
	public String getBaseCType()
	{
		return primitive != null ? primitive.getCType() : userTypeName;
	}

	/**
	 * C array suffix including the string terminator slot:
	 * {@code string<16>[3] -> [3][17]}.
	 */
	public String getCArraySuffix()
	{
		StringBuilder sb = new StringBuilder();
		for (String dim : dimensions)
		{
			sb.append('[').append(dim).append(']');
		}
		if (isString())
		{
			sb.append('[').append(stringCapacity + 1).append(']');
		}
		return sb.toString();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof TypeDescriptor other))
		{
			return false;
		}
		return primitive == other.primitive
				&& Objects.equals(userTypeName, other.userTypeName)
				&& dimensions.equals(other.dimensions)
				&& isConst == other.isConst
				&& isAtomic == other.isAtomic
				&& stringCapacity == other.stringCapacity;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(primitive, userTypeName, dimensions, isConst, isAtomic, stringCapacity);
	}

	@Override
	public String toString()
	{
		String base = primitive == PrimitiveType.STRING ? "string<" + stringCapacity + ">" : primitive != null ? primitive.getKeyword() : userTypeName;
		StringBuilder sb = new StringBuilder(base);
		for (String dim : dimensions)
		{
			sb.append('[').append(dim).append(']');
		}
		return sb.toString();
	}
}
