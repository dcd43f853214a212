package org.lokray.scope.util;

import org.lokray.scope.semantic.AnalysisOptions;
import org.lokray.scope.semantic.TargetEnvironment;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds the command-line arguments of the scope analyzer.
 */
public class AnalyzerArguments
{
	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private Path outputPath = null; // Default: <input>.scope.json next to each input
	private TargetEnvironment target = TargetEnvironment.BROWSER;
	private int ecmaVersion = AnalysisOptions.DEFAULT_ECMA_VERSION;
	private boolean optimistic = true;

	// Private constructor, use parse()
	private AnalyzerArguments()
	{
	}

	public static AnalyzerArguments parse(String[] args)
	{
		AnalyzerArguments parsedArgs = new AnalyzerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
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
					Debug.ENABLE_DEBUG = true;
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals("--no-optimistic"))
				{
					parsedArgs.optimistic = false;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-t") || arg.equals("--target"))
				{
					String name = getNextArg(args, ++i, arg);
					parsedArgs.target = TargetEnvironment.fromOptionName(name)
							.orElseThrow(() -> new IllegalArgumentException("Invalid value for " + arg + ": " + name));
					continue;
				}
				if (arg.equals("--ecma-version"))
				{
					parsedArgs.ecmaVersion = parseEcmaVersion(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's an input file
				parsedArgs.inputFiles.add(Paths.get(arg));
			}

			if (parsedArgs.outputPath != null && parsedArgs.inputFiles.size() > 1)
			{
				throw new IllegalArgumentException("-o/--output can only be used with a single input file");
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
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

	private static int parseEcmaVersion(String value)
	{
		int version;
		try
		{
			version = Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid value for --ecma-version: " + value);
		}
		// Edition years map to edition numbers: 2015 is 6
		if (version >= 2015)
		{
			version -= 2009;
		}
		if (version < 3 || version > 7)
		{
			throw new IllegalArgumentException("Unsupported ecmaVersion: " + value + " (supported: 3 to 7)");
		}
		return version;
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Lexical scope analyzer for JavaScript.");
		System.out.println("\nUSAGE: scopec [options] file...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show analyzer version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -t, --target <env>        Target environment: browser (default), browser-no-eval, node.");
		System.out.println("  -o, --output <file>       Write the scope report to <file> (single input only).");
		System.out.println("  -k, --check               Analyze only; do not write a scope report.");
		System.out.println("\nFLAGS:");
		System.out.println("  --ecma-version <n>        Language level, 3 to 7 or 2015 to 2016 (default 7).");
		System.out.println("  --no-optimistic           Leave references in eval/with-tainted scopes unresolved.");
	}

	/**
	 * The analysis settings selected on the command line; the grammar mode is left to the prober.
	 */
	public AnalysisOptions toAnalysisOptions()
	{
		return AnalysisOptions.defaults()
				.withHostedModule(target.isHostedModule())
				.withEcmaVersion(ecmaVersion)
				.withOptimistic(optimistic);
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
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

	public Path getOutputPath()
	{
		return outputPath;
	}

	public TargetEnvironment getTarget()
	{
		return target;
	}

	public int getEcmaVersion()
	{
		return ecmaVersion;
	}

	public boolean isOptimistic()
	{
		return optimistic;
	}
}
