package org.cnext.semantic.symbol;

import org.cnext.semantic.type.TypeDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class StructSymbol extends TypeSymbol
{
	private final Map<String, Field> fields = new LinkedHashMap<>();

	public StructSymbol(String name, String cName, int scopeId, Visibility visibility, String sourceFile, int sourceLine, SourceLanguage language)
	{
		super(name, cName, scopeId, visibility, sourceFile, sourceLine, language);
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.STRUCT;
	}

	public void addField(String name, TypeDescriptor type)
	{
		fields.put(name, new Field(name, type, fields.size()));
	}

	public Optional<Field> getField(String name)
	{
		return Optional.ofNullable(fields.get(name));
	}

	public Map<String, Field> getFields()
	{
		return Collections.unmodifiableMap(fields);
	}

	/**
	 * A struct member; {@code offset} is its declaration ordinal.
	 */
	public static class Field
	{
		private final String name;
		private final TypeDescriptor type;
		private final int offset;

		public Field(String name, TypeDescriptor type, int offset)
		{
			this.name = name;
			this.type = type;
			this.offset = offset;
		}

		public String getName()
		{
			return name;
		}

		public TypeDescriptor getType()
		{
			return type;
		}

		public int getOffset()
		{
			return offset;
		}
	}
}
