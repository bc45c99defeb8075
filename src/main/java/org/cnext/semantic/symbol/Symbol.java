// File: src/main/java/org/cnext/semantic/symbol/Symbol.java
package org.cnext.semantic.symbol;

/**
 * Base of every registry entry. The owning scope is held as an arena id,
 * never as an object reference; use {@code SymbolRegistry.getScope(id)}.
 */
public abstract class Symbol
{
	private final String name;
	private final int scopeId;
	private final String sourceFile;
	private final int sourceLine;
	private final SourceLanguage language;
	private boolean exported;

	protected Symbol(String name, int scopeId, String sourceFile, int sourceLine, SourceLanguage language)
	{
		this.name = name;
		this.scopeId = scopeId;
		this.sourceFile = sourceFile;
		this.sourceLine = sourceLine;
		this.language = language;
	}

	public abstract SymbolKind getKind();

	public String getName()
	{
		return name;
	}

	public int getScopeId()
	{
		return scopeId;
	}

	public String getSourceFile()
	{
		return sourceFile;
	}

	public int getSourceLine()
	{
		return sourceLine;
	}

	public SourceLanguage getLanguage()
	{
		return language;
	}

	public boolean isExported()
	{
		return exported;
	}

	public void setExported(boolean exported)
	{
		this.exported = exported;
	}

	@Override
	public String toString()
	{
		return getKind().name().toLowerCase() + " " + name;
	}
}
