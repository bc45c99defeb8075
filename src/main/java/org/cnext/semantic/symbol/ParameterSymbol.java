package org.cnext.semantic.symbol;

import org.cnext.semantic.type.TypeDescriptor;

public class ParameterSymbol
{
	private final String name;
	private final TypeDescriptor type;
	private final int index;

	public ParameterSymbol(String name, TypeDescriptor type, int index)
	{
		this.name = name;
		this.type = type;
		this.index = index;
	}

	public String getName()
	{
		return name;
	}

	public TypeDescriptor getType()
	{
		return type;
	}

	public int getIndex()
	{
		return index;
	}

	public boolean isDeclaredConst()
	{
		return type.isConst();
	}
}
