package org.cnext.semantic;

import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

/**
 * A problem found while registering declarations. Aborts registration of the
 * declaring file only.
 */
public class DeclarationException extends CompileException
{
	public DeclarationException(ErrorCode errorCode, int line, int column, String message, String hint)
	{
		super(errorCode, line, column, message, hint);
	}
}
