package org.cnext.semantic;

import org.cnext.util.ErrorCode;

public class DuplicateSymbolException extends DeclarationException
{
	public DuplicateSymbolException(String name, String scopePath, int line, String previousFile, int previousLine)
	{
		super(ErrorCode.DUPLICATE_SYMBOL, line, 0,
				String.format("Symbol '%s' is already declared in %s", name, scopePath.isEmpty() ? "global scope" : "scope '" + scopePath + "'"),
				previousFile != null ? String.format("previous declaration at %s:%d", previousFile, previousLine) : null);
	}
}
