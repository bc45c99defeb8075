// File: src/main/java/org/cnext/pipeline/Transpiler.java
package org.cnext.pipeline;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GeneratedFile;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorRegistry;
import org.cnext.codegen.helpers.HelperDemand;
import org.cnext.codegen.helpers.HelperSynthesizer;
import org.cnext.headers.CHeaderGenerator;
import org.cnext.headers.CppHeaderGenerator;
import org.cnext.headers.HeaderGenerator;
import org.cnext.parser.CNextLexer;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.CallbackTypeCollector;
import org.cnext.semantic.CompilationUnit;
import org.cnext.semantic.SemanticAnalyzer;
import org.cnext.semantic.SymbolRegistry;
import org.cnext.util.CompileException;
import org.cnext.util.Debug;
import org.cnext.util.ErrorHandler;
import org.cnext.util.SyntaxErrorListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a whole build: parse, declaration pass over every file, registry freeze,
 * per-file generation, helper synthesis and headers.
 * <p>
 * A file that fails at any stage produces no output. Other files still build,
 * unless they depend on what the failed file would have declared.
 */
public class Transpiler
{
	private final TranspilerOptions options;
	private final ErrorHandler errorHandler;

	public Transpiler(TranspilerOptions options, ErrorHandler errorHandler)
	{
		this.options = options;
		this.errorHandler = errorHandler;
	}

	public TranspileResult transpile(List<Path> files) throws IOException
	{
		Map<String, CharStream> sources = new LinkedHashMap<>();
		for (Path file : files)
		{
			sources.put(file.toString(), CharStreams.fromPath(file));
		}
		return run(sources);
	}

	/**
	 * Builds in-memory sources, keyed by file name in input order.
	 */
	public TranspileResult transpileSources(Map<String, String> sources)
	{
		Map<String, CharStream> streams = new LinkedHashMap<>();
		for (Map.Entry<String, String> entry : sources.entrySet())
		{
			streams.put(entry.getKey(), CharStreams.fromString(entry.getValue(), entry.getKey()));
		}
		return run(streams);
	}

	private TranspileResult run(Map<String, CharStream> sources)
	{
		Set<String> failed = new LinkedHashSet<>();

		// --- Parse ---
		List<CompilationUnit> units = new ArrayList<>();
		for (Map.Entry<String, CharStream> source : sources.entrySet())
		{
			CompilationUnit unit = parse(source.getKey(), source.getValue());
			if (unit == null)
			{
				failed.add(source.getKey());
			}
			else
			{
				units.add(unit);
			}
		}

		// --- Declaration pass, freeze, parameter mutation ---
		SymbolRegistry registry = new SymbolRegistry(options.getEntryPoint());
		SemanticAnalyzer analyzer = new SemanticAnalyzer(registry, errorHandler, options.getTypeHeaders().keySet());
		analyzer.analyze(units);
		failed.addAll(analyzer.getFailedFiles());
		List<CompilationUnit> healthy = new ArrayList<>();
		for (CompilationUnit unit : units)
		{
			if (!failed.contains(unit.getFile()))
			{
				healthy.add(unit);
			}
		}

		CallbackTypeCollector callbackCollector = new CallbackTypeCollector(analyzer.getTypeResolver());
		for (CompilationUnit unit : List.copyOf(healthy))
		{
			try
			{
				callbackCollector.collect(unit);
			}
			catch (CompileException e)
			{
				errorHandler.report(unit.getFile(), e);
				failed.add(unit.getFile());
				healthy.remove(unit);
			}
		}
		Set<String> callbackTypes = callbackCollector.getCallbackTypes();

		// --- Generation ---
		List<GeneratedFile> generated = generateAll(healthy, analyzer, callbackTypes, failed);

		List<OutputFile> outputs = new ArrayList<>();
		HelperDemand merged = new HelperDemand();
		HeaderGenerator headers = options.isCppMode()
				? new CppHeaderGenerator(analyzer.getTypeResolver(), analyzer.getMutationTable(), options, callbackTypes)
				: new CHeaderGenerator(analyzer.getTypeResolver(), analyzer.getMutationTable(), options, callbackTypes);
		for (GeneratedFile file : generated)
		{
			merged.merge(file.getHelperDemand());
			outputs.add(new OutputFile(file.getSourceFile(), file.getBaseName() + options.getImplementationExtension(), file.getImplementation()));
			if (headers.hasExports(file.getSourceFile()))
			{
				outputs.add(new OutputFile(file.getSourceFile(), file.getBaseName() + headers.getExtension(),
						headers.generate(file.getSourceFile(), file.getIncludes())));
			}
		}

		// --- Helpers, once per build ---
		String helperHeader = new HelperSynthesizer(options.getOverflowMode()).synthesize(merged, options.getHelperHeaderName());
		if (!helperHeader.isEmpty())
		{
			outputs.add(new OutputFile(null, options.getHelperHeaderName(), helperHeader));
		}

		if (failed.isEmpty())
		{
			Debug.logDebug("Transpiled " + generated.size() + " file(s) into " + outputs.size() + " output(s)");
		}
		else
		{
			Debug.logError("Errors in " + failed.size() + " file(s); no output for: " + String.join(", ", failed));
		}
		return new TranspileResult(registry, analyzer.getMutationTable(), outputs, failed);
	}

	/**
	 * Parses one file. Syntax errors are reported and yield null.
	 */
	public CompilationUnit parse(String file, CharStream input)
	{
		SyntaxErrorListener listener = new SyntaxErrorListener(file, errorHandler);
		CNextLexer lexer = new CNextLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(listener);
		CNextParser parser = new CNextParser(new CommonTokenStream(lexer));

		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(listener);

		CNextParser.ProgramContext tree = parser.program();
		if (listener.getErrorCount() > 0)
		{
			Debug.logError("Compilation failed due to syntax errors in " + file);
			return null;
		}
		return new CompilationUnit(file, tree);
	}

	/**
	 * Generates every file, on {@code jobs} threads when more than one. Results
	 * keep input order whatever order the files finish in.
	 */
	private List<GeneratedFile> generateAll(List<CompilationUnit> units, SemanticAnalyzer analyzer, Set<String> callbackTypes, Set<String> failed)
	{
		GeneratorRegistry generators = GeneratorRegistry.createDefault();
		List<GeneratedFile> results = new ArrayList<>();
		if (options.getJobs() <= 1 || units.size() <= 1)
		{
			for (CompilationUnit unit : units)
			{
				GeneratedFile file = generateOne(unit, analyzer, callbackTypes, generators);
				if (file == null)
				{
					failed.add(unit.getFile());
				}
				else
				{
					results.add(file);
				}
			}
			return results;
		}

		ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.getJobs(), units.size()));
		try
		{
			List<Future<GeneratedFile>> futures = new ArrayList<>();
			for (CompilationUnit unit : units)
			{
				futures.add(pool.submit(() -> generateOne(unit, analyzer, callbackTypes, generators)));
			}
			for (int i = 0; i < units.size(); i++)
			{
				GeneratedFile file = await(futures.get(i));
				if (file == null)
				{
					failed.add(units.get(i).getFile());
				}
				else
				{
					results.add(file);
				}
			}
			return results;
		}
		finally
		{
			pool.shutdownNow();
		}
	}

	private GeneratedFile generateOne(CompilationUnit unit, SemanticAnalyzer analyzer, Set<String> callbackTypes, GeneratorRegistry generators)
	{
		GeneratorInput input = new GeneratorInput(analyzer.getRegistry(), analyzer.getTypeResolver(), analyzer.getMutationTable(),
				options, unit.getFile(), callbackTypes, unit.hasIncludes());
		try
		{
			return new CodeGenerator(input, generators).generateFile(unit);
		}
		catch (CompileException e)
		{
			errorHandler.report(unit.getFile(), e);
			return null;
		}
	}

	private static GeneratedFile await(Future<GeneratedFile> future)
	{
		try
		{
			return future.get();
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while generating", e);
		}
		catch (ExecutionException e)
		{
			if (e.getCause() instanceof RuntimeException runtime)
			{
				throw runtime;
			}
			throw new IllegalStateException(e.getCause());
		}
	}
}
