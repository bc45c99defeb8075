package org.cnext.semantic.symbol;

public enum SymbolKind
{
	FUNCTION,
	VARIABLE,
	STRUCT,
	ENUM,
	ENUM_MEMBER,
	BITMAP,
	BITMAP_FIELD,
	REGISTER,
	REGISTER_MEMBER,
	SCOPE
}
