package org.cnext.semantic.symbol;

public class EnumMemberSymbol extends Symbol
{
	private final String enumCName;
	private final long value;

	public EnumMemberSymbol(String name, String enumCName, long value, int scopeId, String sourceFile, int sourceLine)
	{
		super(name, scopeId, sourceFile, sourceLine, SourceLanguage.CNEXT);
		this.enumCName = enumCName;
		this.value = value;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.ENUM_MEMBER;
	}

	public long getValue()
	{
		return value;
	}

	public String getCName()
	{
		return enumCName + "_" + getName();
	}
}
