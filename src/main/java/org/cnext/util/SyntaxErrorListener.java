package org.cnext.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * A custom error listener for the ANTLR lexer and parser that records syntax
 * errors as diagnostics of the file being parsed.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final String file;
	private final ErrorHandler errorHandler;
	private int errorCount = 0;

	public SyntaxErrorListener(String file, ErrorHandler errorHandler)
	{
		this.file = file;
		this.errorHandler = errorHandler;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		errorCount++;
		errorHandler.report(new Diagnostic(ErrorCode.SYNTAX.getCode(), file, line, charPositionInLine + 1, msg, null));
	}

	public int getErrorCount()
	{
		return errorCount;
	}
}
