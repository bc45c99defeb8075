package org.cnext.semantic.symbol;

import org.cnext.semantic.type.PrimitiveType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class EnumSymbol extends TypeSymbol
{
	private final Map<String, EnumMemberSymbol> members = new LinkedHashMap<>();
	private final PrimitiveType backingType;

	public EnumSymbol(String name, String cName, int scopeId, Visibility visibility, PrimitiveType backingType, String sourceFile, int sourceLine, SourceLanguage language)
	{
		super(name, cName, scopeId, visibility, sourceFile, sourceLine, language);
		this.backingType = backingType;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.ENUM;
	}

	public void addMember(EnumMemberSymbol member)
	{
		members.put(member.getName(), member);
	}

	public Optional<EnumMemberSymbol> getMember(String name)
	{
		return Optional.ofNullable(members.get(name));
	}

	public Map<String, EnumMemberSymbol> getMembers()
	{
		return Collections.unmodifiableMap(members);
	}

	/**
	 * Explicit backing type from {@code enum Name : u8 { ... }}, or null.
	 */
	public PrimitiveType getBackingType()
	{
		return backingType;
	}
}
