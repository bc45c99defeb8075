package org.cnext.semantic.symbol;

import org.cnext.semantic.type.TypeDescriptor;

public class RegisterMemberSymbol extends Symbol
{
	private final TypeDescriptor type;
	private final AccessMode access;
	private final String offset;

	public RegisterMemberSymbol(String name, TypeDescriptor type, AccessMode access, String offset, int scopeId, String sourceFile, int sourceLine)
	{
		super(name, scopeId, sourceFile, sourceLine, SourceLanguage.CNEXT);
		this.type = type;
		this.access = access;
		this.offset = offset;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.REGISTER_MEMBER;
	}

	public TypeDescriptor getType()
	{
		return type;
	}

	public AccessMode getAccess()
	{
		return access;
	}

	/**
	 * Offset from the register base, as C source text.
	 */
	public String getOffset()
	{
		return offset;
	}
}
