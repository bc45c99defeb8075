package org.cnext.semantic.symbol;

import org.cnext.parser.CNextParser;
import org.cnext.semantic.type.TypeDescriptor;

public class VariableSymbol extends Symbol
{
	private final String cName;
	private final TypeDescriptor type;
	private final Visibility visibility;
	private final boolean isVolatile;
	private final OverflowBehavior overflow;
	private final CNextParser.ExpressionContext initializer;
	private final Long constValue;

	public VariableSymbol(String name, String cName, int scopeId, TypeDescriptor type, Visibility visibility, boolean isVolatile,
						  OverflowBehavior overflow, CNextParser.ExpressionContext initializer, Long constValue, String sourceFile, int sourceLine)
	{
		super(name, scopeId, sourceFile, sourceLine, SourceLanguage.CNEXT);
		this.cName = cName;
		this.type = type;
		this.visibility = visibility;
		this.isVolatile = isVolatile;
		this.overflow = overflow;
		this.initializer = initializer;
		this.constValue = constValue;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.VARIABLE;
	}

	public String getCName()
	{
		return cName;
	}

	public TypeDescriptor getType()
	{
		return type;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}

	public boolean isConst()
	{
		return type.isConst();
	}

	public boolean isVolatile()
	{
		return isVolatile;
	}

	public OverflowBehavior getOverflow()
	{
		return overflow;
	}

	public CNextParser.ExpressionContext getInitializer()
	{
		return initializer;
	}

	/**
	 * Folded value of a scalar integer constant, or null.
	 */
	public Long getConstValue()
	{
		return constValue;
	}
}
