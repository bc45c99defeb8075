package org.cnext.codegen;

import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.type.TypeDescriptor;

/**
 * How a parameter is passed, and therefore how the function body must spell it.
 */
public final class ParameterBinding
{
	public enum Passing
	{
		/** Scalar copied into the callee. */
		VALUE,
		/** Mutated scalar; read and written as {@code (*name)}. */
		SCALAR_POINTER,
		/** Struct behind a pointer; fields read as {@code name->field}. */
		STRUCT_POINTER,
		/** Arrays and strings decay to pointers and keep their spelling. */
		ARRAY,
		/** External type passed by pointer. */
		OPAQUE_POINTER
	}

	private final ParameterSymbol symbol;
	private final Passing passing;
	private final boolean constQualified;

	public ParameterBinding(ParameterSymbol symbol, Passing passing, boolean constQualified)
	{
		this.symbol = symbol;
		this.passing = passing;
		this.constQualified = constQualified;
	}

	public ParameterSymbol getSymbol()
	{
		return symbol;
	}

	public String getName()
	{
		return symbol.getName();
	}

	public TypeDescriptor getType()
	{
		return symbol.getType();
	}

	public Passing getPassing()
	{
		return passing;
	}

	public boolean isConstQualified()
	{
		return constQualified;
	}

	public boolean isPointer()
	{
		return passing != Passing.VALUE && passing != Passing.ARRAY;
	}

	/**
	 * The parameter as an rvalue or lvalue in the body.
	 */
	public String valueExpression()
	{
		return passing == Passing.SCALAR_POINTER ? "(*" + getName() + ")" : getName();
	}

	/**
	 * Separator for a field access on this parameter.
	 */
	public String memberSeparator()
	{
		return passing == Passing.STRUCT_POINTER || passing == Passing.OPAQUE_POINTER ? "->" : ".";
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof ParameterBinding other && other.symbol == symbol && other.passing == passing && other.constQualified == constQualified;
	}

	@Override
	public int hashCode()
	{
		return symbol.getName().hashCode() * 31 + passing.hashCode();
	}
}
