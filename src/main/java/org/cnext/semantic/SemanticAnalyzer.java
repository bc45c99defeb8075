package org.cnext.semantic;

import org.cnext.util.CompileException;
import org.cnext.util.Debug;
import org.cnext.util.ErrorHandler;

import java.util.*;

/**
 * Runs the declaration pass over every input file, then freezes the registry and
 * builds the parameter mutation table. The last pass checks the function bodies.
 * Generation starts only after this returns.
 */
public class SemanticAnalyzer
{
	private final SymbolRegistry registry;
	private final TypeResolver typeResolver;
	private final ErrorHandler errorHandler;
	private final Set<String> headerTypes;
	private final Set<String> failedFiles = new LinkedHashSet<>();
	private ParameterMutationTable mutationTable;

	public SemanticAnalyzer(SymbolRegistry registry, ErrorHandler errorHandler, Set<String> headerTypes)
	{
		this.registry = registry;
		this.typeResolver = new TypeResolver(registry);
		this.errorHandler = errorHandler;
		this.headerTypes = headerTypes;
	}

	/**
	 * @return true if every file registered cleanly
	 */
	public boolean analyze(List<CompilationUnit> units)
	{
		Debug.logDebug("Starting semantic analysis across " + units.size() + " file(s)...");

		// --- PASS 1: Scopes and type names ---
		Debug.logDebug("PASS 1: Discovering types...");
		for (CompilationUnit unit : units)
		{
			runCollector(unit, new DeclarationCollector(registry, typeResolver, unit.getFile(), headerTypes, true));
		}

		// --- PASS 2: Members, functions and variables ---
		Debug.logDebug("PASS 2: Defining members...");
		Map<CompilationUnit, DeclarationCollector> collectors = new LinkedHashMap<>();
		for (CompilationUnit unit : units)
		{
			if (failedFiles.contains(unit.getFile()))
			{
				continue;
			}
			DeclarationCollector collector = new DeclarationCollector(registry, typeResolver, unit.getFile(), headerTypes, false);
			if (runCollector(unit, collector))
			{
				collectors.put(unit, collector);
			}
		}

		// --- Type references, now that every file has declared its types ---
		for (Map.Entry<CompilationUnit, DeclarationCollector> entry : collectors.entrySet())
		{
			String file = entry.getKey().getFile();
			try
			{
				entry.getValue().validateTypeReferences();
			}
			catch (CompileException e)
			{
				fail(file, e);
			}
		}

		registry.freeze();
		Debug.logDebug("Registry frozen with " + registry.getScopes().size() + " scope(s)");

		// --- PASS 3: Parameter mutation, in declaration order ---
		Debug.logDebug("PASS 3: Analyzing parameter mutation...");
		ParameterMutationAnalyzer mutationAnalyzer = new ParameterMutationAnalyzer(typeResolver);
		for (CompilationUnit unit : units)
		{
			if (failedFiles.contains(unit.getFile()))
			{
				continue;
			}
			try
			{
				mutationAnalyzer.analyze(unit);
			}
			catch (CompileException e)
			{
				errorHandler.report(unit.getFile(), e);
				failedFiles.add(unit.getFile());
			}
		}
		mutationTable = mutationAnalyzer.getTable();

		// --- PASS 4: Arithmetic and initialization checks ---
		Debug.logDebug("PASS 4: Checking function bodies...");
		List<FunctionBodyAnalyzer> checks = List.of(
				new DivisionByZeroAnalyzer(typeResolver),
				new FloatModuloAnalyzer(typeResolver),
				new InitializationAnalyzer(typeResolver));
		for (CompilationUnit unit : units)
		{
			if (failedFiles.contains(unit.getFile()))
			{
				continue;
			}
			try
			{
				for (FunctionBodyAnalyzer check : checks)
				{
					check.analyze(unit);
				}
			}
			catch (CompileException e)
			{
				errorHandler.report(unit.getFile(), e);
				failedFiles.add(unit.getFile());
			}
		}

		if (!failedFiles.isEmpty())
		{
			Debug.logError("Errors encountered during semantic analysis in " + failedFiles.size() + " file(s).");
			return false;
		}
		Debug.logDebug("Semantic analysis completed successfully across all files.");
		return true;
	}

	private boolean runCollector(CompilationUnit unit, DeclarationCollector collector)
	{
		try
		{
			collector.visit(unit.getTree());
			return true;
		}
		catch (CompileException e)
		{
			fail(unit.getFile(), e);
			return false;
		}
	}

	private void fail(String file, CompileException e)
	{
		errorHandler.report(file, e);
		failedFiles.add(file);
		registry.rollbackFile(file);
	}

	public SymbolRegistry getRegistry()
	{
		return registry;
	}

	public TypeResolver getTypeResolver()
	{
		return typeResolver;
	}

	public ParameterMutationTable getMutationTable()
	{
		return mutationTable;
	}

	public Set<String> getFailedFiles()
	{
		return Collections.unmodifiableSet(failedFiles);
	}
}
