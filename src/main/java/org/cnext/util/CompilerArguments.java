package org.cnext.util;

import org.cnext.codegen.helpers.OverflowMode;
import org.cnext.pipeline.TranspilerOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses and holds all command-line arguments of the transpiler.
 */
public class CompilerArguments
{
	private final List<Path> inputFiles = new ArrayList<>();
	private final Map<String, String> typeHeaders = new LinkedHashMap<>();
	private boolean helpFlag = false;
	private boolean usageError = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private boolean cppMode = false;
	private boolean emitSymbols = false;
	private boolean emitDiagnostics = false;
	private OverflowMode overflowMode = OverflowMode.CLAMP;
	private TranspilerOptions.HeaderLayout headerLayout = TranspilerOptions.HeaderLayout.FULL;
	private String entryPoint = null; // Default: null (main)
	private Path outputPath = null; // Default: null (next to each source)
	private int jobs = 1;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			parsedArgs.usageError = true;
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals("--cpp"))
				{
					parsedArgs.cppMode = true;
					continue;
				}
				if (arg.equals("--debug-mode"))
				{
					parsedArgs.overflowMode = OverflowMode.PANIC;
					continue;
				}
				if (arg.equals("--emit-symbols"))
				{
					parsedArgs.emitSymbols = true;
					continue;
				}
				if (arg.equals("--emit-diagnostics"))
				{
					parsedArgs.emitDiagnostics = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-e") || arg.equals("--entry"))
				{
					parsedArgs.entryPoint = getNextArg(args, ++i, arg);
					continue;
				}
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-j") || arg.equals("--jobs"))
				{
					String value = getNextArg(args, ++i, arg);
					try
					{
						parsedArgs.jobs = Integer.parseInt(value);
					}
					catch (NumberFormatException e)
					{
						throw new IllegalArgumentException("Invalid value for " + arg + ": " + value);
					}
					if (parsedArgs.jobs < 1)
					{
						throw new IllegalArgumentException("Invalid value for " + arg + ": " + value);
					}
					continue;
				}
				if (arg.equals("--type-header"))
				{
					String mapping = getNextArg(args, ++i, arg);
					int eq = mapping.indexOf('=');
					if (eq <= 0 || eq == mapping.length() - 1)
					{
						throw new IllegalArgumentException("Expected <Type>=<header> after --type-header, got: " + mapping);
					}
					parsedArgs.typeHeaders.put(mapping.substring(0, eq), mapping.substring(eq + 1));
					continue;
				}
				if (arg.startsWith("--overflow="))
				{
					String value = arg.substring(arg.indexOf('=') + 1);
					parsedArgs.overflowMode = switch (value)
					{
						case "clamp" -> OverflowMode.CLAMP;
						case "panic" -> OverflowMode.PANIC;
						default -> throw new IllegalArgumentException("Invalid value for --overflow: " + value);
					};
					continue;
				}
				if (arg.startsWith("--header-layout="))
				{
					String value = arg.substring(arg.indexOf('=') + 1);
					parsedArgs.headerLayout = switch (value)
					{
						case "full" -> TranspilerOptions.HeaderLayout.FULL;
						case "forward" -> TranspilerOptions.HeaderLayout.FORWARD;
						default -> throw new IllegalArgumentException("Invalid value for --header-layout: " + value);
					};
					continue;
				}

				// --- Handle file inputs ---
				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's an input file
				parsedArgs.inputFiles.add(Paths.get(arg));
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
			parsedArgs.usageError = true;
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Transpiler from C-Next to C and C++.");
		System.out.println("\nUSAGE: cnext [options] file...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                  Show this help message and exit.");
		System.out.println("  --version                   Show transpiler version and exit.");
		System.out.println("  -v, --verbose               Enable verbose debug logging.");
		System.out.println("  -o, --output <dir>          Write outputs to this directory instead of next to each source.");
		System.out.println("  -e, --entry <name>          Name of the entry-point function (default: main).");
		System.out.println("  -j, --jobs <n>              Generate up to n files in parallel.");
		System.out.println("  -k, --check                 Run analysis and generation only; do not write output.");
		System.out.println("  --type-header <T>=<header>  Include <header> for external type T instead of forward-declaring it.");
		System.out.println("\nFLAGS:");
		System.out.println("  --cpp                       Emit .cpp/.hpp instead of .c/.h.");
		System.out.println("  --overflow=<mode>           Overflow helper behavior: clamp (default), panic.");
		System.out.println("  --debug-mode                Same as --overflow=panic.");
		System.out.println("  --header-layout=<layout>    full (default): struct layouts in headers; forward: layouts in the implementation.");
		System.out.println("  --emit-symbols              Write symbols.json with the resolved symbol table.");
		System.out.println("  --emit-diagnostics          Write diagnostics.json with every reported error.");
	}

	/**
	 * The transpiler settings these arguments select.
	 */
	public TranspilerOptions toOptions()
	{
		TranspilerOptions.Builder builder = TranspilerOptions.builder()
				.cppMode(cppMode)
				.overflowMode(overflowMode)
				.headerLayout(headerLayout)
				.typeHeaders(typeHeaders)
				.jobs(jobs);
		if (entryPoint != null)
		{
			builder.entryPoint(entryPoint);
		}
		return builder.build();
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public Map<String, String> getTypeHeaders()
	{
		return typeHeaders;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	/**
	 * True when help is shown because the arguments were missing or invalid.
	 */
	public boolean isUsageError()
	{
		return usageError;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isCppMode()
	{
		return cppMode;
	}

	public boolean isEmitSymbols()
	{
		return emitSymbols;
	}

	public boolean isEmitDiagnostics()
	{
		return emitDiagnostics;
	}

	public OverflowMode getOverflowMode()
	{
		return overflowMode;
	}

	public TranspilerOptions.HeaderLayout getHeaderLayout()
	{
		return headerLayout;
	}

	public String getEntryPoint()
	{
		return entryPoint;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public int getJobs()
	{
		return jobs;
	}
}
