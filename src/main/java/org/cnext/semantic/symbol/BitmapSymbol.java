package org.cnext.semantic.symbol;

import org.cnext.semantic.type.PrimitiveType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A named bit layout over an 8/16/24/32-bit backing integer. Fields are packed
 * from bit 0 upward in declaration order.
 */
public class BitmapSymbol extends TypeSymbol
{
	private final int width;
	private final Map<String, BitmapFieldSymbol> fields = new LinkedHashMap<>();

	public BitmapSymbol(String name, String cName, int scopeId, Visibility visibility, int width, String sourceFile, int sourceLine)
	{
		super(name, cName, scopeId, visibility, sourceFile, sourceLine, SourceLanguage.CNEXT);
		this.width = width;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.BITMAP;
	}

	public int getWidth()
	{
		return width;
	}

	/**
	 * bitmap24 has no exact C type and is stored in a uint32_t.
	 */
	public PrimitiveType getBackingType()
	{
		return switch (width)
		{
			case 8 -> PrimitiveType.U8;
			case 16 -> PrimitiveType.U16;
			default -> PrimitiveType.U32;
		};
	}

	public void addField(BitmapFieldSymbol field)
	{
		fields.put(field.getName(), field);
	}

	public Optional<BitmapFieldSymbol> getField(String name)
	{
		return Optional.ofNullable(fields.get(name));
	}

	public Map<String, BitmapFieldSymbol> getFields()
	{
		return Collections.unmodifiableMap(fields);
	}
}
