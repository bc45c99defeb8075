package org.cnext;

import org.cnext.pipeline.TranspileResult;
import org.cnext.pipeline.Transpiler;
import org.cnext.util.CompilerArguments;
import org.cnext.util.Debug;
import org.cnext.util.ErrorHandler;
import org.cnext.util.FileUtils;
import org.cnext.util.SymbolExporter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point: parses arguments and runs one build.
 */
public class Main
{
	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * @return the process exit code: 0 on success, 1 when any file failed, 2 on bad usage
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return arguments.isUsageError() ? 2 : 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("cnext (C-Next Transpiler) version 0.1.0");
				return 0;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}
			if (!validatePaths(arguments.getInputFiles()))
			{
				Debug.logError("Aborting.");
				return 2;
			}

			ErrorHandler errorHandler = new ErrorHandler();
			Transpiler transpiler = new Transpiler(arguments.toOptions(), errorHandler);
			TranspileResult result = transpiler.transpile(arguments.getInputFiles());

			Path outputDirectory = arguments.getOutputPath();
			Path reportDirectory = outputDirectory != null ? outputDirectory : Paths.get(".");
			if (arguments.isEmitDiagnostics())
			{
				SymbolExporter.writeDiagnostics(errorHandler.getDiagnostics(), reportDirectory.resolve("diagnostics.json"));
			}

			if (arguments.isCheckOnly())
			{
				if (result.isSuccess())
				{
					Debug.logInfo("Check passed. No output generated (-k flag).");
				}
				return result.isSuccess() ? 0 : 1;
			}

			result.write(outputDirectory);
			if (arguments.isEmitSymbols())
			{
				new SymbolExporter(result.getRegistry(), result.getMutationTable()).write(reportDirectory.resolve("symbols.json"));
			}

			if (!result.isSuccess())
			{
				Debug.logError("Transpilation failed for " + result.getFailedFiles().size() + " file(s).");
				return 1;
			}
			Debug.logInfo("Transpilation successful: " + result.getOutputs().size() + " file(s) written.");
			return 0;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Transpiler initialization failed: " + e.getMessage());
			return 2;
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
			return 1;
		}
	}

	private static boolean validatePaths(List<Path> inputs)
	{
		boolean valid = true;
		for (Path input : inputs)
		{
			if (!Files.exists(input))
			{
				Debug.logError("Input file not found: " + input);
				valid = false;
			}
			else if (!".cnx".equals(FileUtils.getFileExtension(input)))
			{
				Debug.logWarning("Input file does not have the .cnx extension: " + input);
			}
		}
		return valid;
	}
}
