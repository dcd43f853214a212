package org.lokray.scope;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.scope.ast.AstBuildException;
import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.SourceParser;
import org.lokray.scope.dto.ScopeReportDTO;
import org.lokray.scope.semantic.GrammarModeProber;
import org.lokray.scope.semantic.GraphConstructionException;
import org.lokray.scope.semantic.InvariantViolationException;
import org.lokray.scope.semantic.ScopeAnalysisPass;
import org.lokray.scope.semantic.ScopeAnalysisResult;
import org.lokray.scope.semantic.ScopeGraphAnalyzer;
import org.lokray.scope.semantic.ScopeGraphBuildException;
import org.lokray.scope.semantic.Variable;
import org.lokray.scope.util.AnalyzerArguments;
import org.lokray.scope.util.Debug;
import org.lokray.scope.util.ErrorHandler;
import org.lokray.scope.util.ScopeReportConverter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Command-line driver: parses each input file, runs the scope analysis pass and writes a JSON scope report.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static void main(String[] args)
	{
		int exitCode = run(args);
		if (exitCode != 0)
		{
			System.exit(exitCode);
		}
	}

	static int run(String[] args)
	{
		try
		{
			AnalyzerArguments arguments = AnalyzerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				AnalyzerArguments.printUsage();
				return 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("scopec (JavaScript scope analyzer) version " + VERSION);
				return 0;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			ErrorHandler errorHandler = new ErrorHandler();
			for (Path file : arguments.getInputFiles())
			{
				analyzeFile(file, arguments, errorHandler);
			}

			if (errorHandler.hasErrors())
			{
				Debug.logError("Scope analysis failed with " + errorHandler.getErrorCount() + " error(s).");
				return 1;
			}
			return 0;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Analyzer initialization failed: " + e.getMessage());
			return 2;
		}
	}

	/**
	 * Runs the pipeline for one file. Failures are reported and do not stop the remaining files.
	 */
	private static void analyzeFile(Path file, AnalyzerArguments args, ErrorHandler errorHandler)
	{
		Debug.logDebug("\nAnalyzing " + file + "...");
		if (!Files.exists(file))
		{
			errorHandler.logError(file, "Input file not found");
			return;
		}

		try
		{
			Node program = SourceParser.parse(file);
			if (program == null)
			{
				errorHandler.logError(file, "Skipped due to syntax errors");
				return;
			}

			GrammarModeProber prober = new GrammarModeProber(new ScopeGraphAnalyzer(), args.toAnalysisOptions());
			ScopeAnalysisResult result = new ScopeAnalysisPass(prober, args.getTarget()).run(program);
			Debug.logDebug("Analyzed " + file + " as " + result.graph().getGrammarMode() + " for target '"
					+ args.getTarget().getOptionName() + "' with " + result.graph().getScopes().size() + " scopes.");
			for (Variable leaked : result.graph().getGlobalScope().getImplicitVariables())
			{
				Node at = leaked.getIdentifiers().get(0);
				Debug.logWarning(String.format("[Scope Warning] %s - line %d:%d - Assignment creates implicit global '%s'",
						file, at.getLine(), at.getColumn() + 1, leaked.getName()));
			}

			if (args.isCheckOnly())
			{
				Debug.logInfo("Scope check passed: " + file + " (no report written, -k flag).");
				return;
			}

			ScopeReportDTO report = ScopeReportConverter.toReport(file.toString(), result);
			Path outputPath = getOutputPath(args, file);
			writeReport(report, outputPath);
		}
		catch (GraphConstructionException e)
		{
			Throwable cause = e.getCause();
			Node node = cause instanceof ScopeGraphBuildException buildFailure ? buildFailure.getNode() : null;
			errorHandler.logError(file, node, e.getMessage());
		}
		catch (InvariantViolationException e)
		{
			errorHandler.logError(file, e.getNode(), e.getMessage());
		}
		catch (AstBuildException e)
		{
			errorHandler.logError(file, e.getNode(), e.getMessage());
		}
		catch (IOException e)
		{
			errorHandler.logError(file, "I/O error: " + e.getMessage());
		}
	}

	private static void writeReport(ScopeReportDTO report, Path outPath) throws IOException
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, gson.toJson(report), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote scope report to: " + outPath);
	}

	/**
	 * The explicit -o path, or {@code <input>.scope.json} next to the input.
	 */
	static Path getOutputPath(AnalyzerArguments args, Path inputFile)
	{
		if (args.getOutputPath() != null)
		{
			return args.getOutputPath();
		}
		return inputFile.resolveSibling(inputFile.getFileName().toString() + ".scope.json");
	}
}
