package org.cnext.semantic.symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A memory-mapped peripheral: a base address and typed members at fixed offsets.
 */
public class RegisterSymbol extends TypeSymbol
{
	private final String baseAddress;
	private final Map<String, RegisterMemberSymbol> members = new LinkedHashMap<>();

	public RegisterSymbol(String name, String cName, int scopeId, Visibility visibility, String baseAddress, String sourceFile, int sourceLine)
	{
		super(name, cName, scopeId, visibility, sourceFile, sourceLine, SourceLanguage.CNEXT);
		this.baseAddress = baseAddress;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.REGISTER;
	}

	public String getBaseAddress()
	{
		return baseAddress;
	}

	public void addMember(RegisterMemberSymbol member)
	{
		members.put(member.getName(), member);
	}

	public Optional<RegisterMemberSymbol> getMember(String name)
	{
		return Optional.ofNullable(members.get(name));
	}

	public Map<String, RegisterMemberSymbol> getMembers()
	{
		return Collections.unmodifiableMap(members);
	}

	public String getMemberCName(String member)
	{
		return getCName() + "_" + member;
	}
}
