package org.cnext.semantic.symbol;

/**
 * A symbol that names a type (struct, enum, bitmap, register). Carries the
 * mangled C name used everywhere in generated code.
 */
public abstract class TypeSymbol extends Symbol
{
	private final String cName;
	private final Visibility visibility;

	protected TypeSymbol(String name, String cName, int scopeId, Visibility visibility, String sourceFile, int sourceLine, SourceLanguage language)
	{
		super(name, scopeId, sourceFile, sourceLine, language);
		this.cName = cName;
		this.visibility = visibility;
	}

	public String getCName()
	{
		return cName;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}
}
