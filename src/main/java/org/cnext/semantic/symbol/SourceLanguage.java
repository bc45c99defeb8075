package org.cnext.semantic.symbol;

/**
 * Where a symbol was declared: in C-Next source, or imported from a C or C++ header.
 */
public enum SourceLanguage
{
	CNEXT,
	C,
	CPP
}
