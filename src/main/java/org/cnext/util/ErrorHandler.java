// File: src/main/java/org/cnext/util/ErrorHandler.java
package org.cnext.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects diagnostics for a whole build. Generation of separate files may run
 * on worker threads, so every mutator is synchronized.
 */
public class ErrorHandler
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private boolean hasErrors = false;

	public synchronized void report(Diagnostic diagnostic)
	{
		String err = String.format("[%s] %s - line %d:%d - %s: %s",
				diagnostic.code.equals(ErrorCode.SYNTAX.getCode()) ? "Syntax Error" : "Semantic Error",
				diagnostic.file, diagnostic.line, diagnostic.column, diagnostic.code, diagnostic.message);
		Debug.logError(err);
		if (diagnostic.hint != null)
		{
			Debug.logWarning("    help: " + diagnostic.hint);
		}
		diagnostics.add(diagnostic);
		hasErrors = true;
	}

	public void report(String file, CompileException e)
	{
		report(e.toDiagnostic(file));
	}

	public synchronized boolean hasErrors()
	{
		return hasErrors;
	}

	public synchronized boolean hasErrors(String file)
	{
		return diagnostics.stream().anyMatch(d -> d.file.equals(file));
	}

	public synchronized List<Diagnostic> getDiagnostics()
	{
		return new ArrayList<>(diagnostics);
	}
}
