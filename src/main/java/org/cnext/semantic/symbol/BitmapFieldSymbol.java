package org.cnext.semantic.symbol;

public class BitmapFieldSymbol extends Symbol
{
	private final int offset;
	private final int width;

	public BitmapFieldSymbol(String name, int offset, int width, int scopeId, String sourceFile, int sourceLine)
	{
		super(name, scopeId, sourceFile, sourceLine, SourceLanguage.CNEXT);
		this.offset = offset;
		this.width = width;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.BITMAP_FIELD;
	}

	public int getOffset()
	{
		return offset;
	}

	public int getWidth()
	{
		return width;
	}
}
