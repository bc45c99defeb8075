package org.cnext.semantic;

import org.antlr.v4.runtime.Token;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

public class VisibilityException extends CompileException
{
	public VisibilityException(String member, String scopePath, boolean fromSameScope, Token at)
	{
		super(ErrorCode.VISIBILITY, at,
				String.format("Cannot access private member '%s' of scope '%s'", member, scopePath),
				fromSameScope ? "use 'this." + member + "' inside the scope" : "declare it 'public' to use it outside '" + scopePath + "'");
	}
}
