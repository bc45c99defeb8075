package org.cnext.util;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

/**
 * Thrown when a language rule is violated. Aborts generation of the
 * current file; the pipeline turns it into a {@link Diagnostic}.
 */
public class CompileException extends RuntimeException
{
	private final ErrorCode errorCode;
	private final int line;
	private final int column;
	private final String hint;

	public CompileException(ErrorCode errorCode, int line, int column, String message, String hint)
	{
		super(message);
		this.errorCode = errorCode;
		this.line = line;
		this.column = column;
		this.hint = hint;
	}

	public CompileException(ErrorCode errorCode, Token token, String message, String hint)
	{
		this(errorCode, token != null ? token.getLine() : 0, token != null ? token.getCharPositionInLine() + 1 : 0, message, hint);
	}

	public CompileException(ErrorCode errorCode, ParserRuleContext ctx, String message, String hint)
	{
		this(errorCode, ctx != null ? ctx.getStart() : null, message, hint);
	}

	public CompileException(ErrorCode errorCode, ParserRuleContext ctx, String message)
	{
		this(errorCode, ctx, message, null);
	}

	public ErrorCode getErrorCode()
	{
		return errorCode;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public String getHint()
	{
		return hint;
	}

	public Diagnostic toDiagnostic(String file)
	{
		return new Diagnostic(errorCode.getCode(), file, line, column, getMessage(), hint);
	}
}
