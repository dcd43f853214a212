package org.lokray.scope.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.lokray.scope.semantic.AnalysisOptions;
import org.lokray.scope.semantic.GrammarMode;
import org.lokray.scope.semantic.TargetEnvironment;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void no_arguments_shows_help()
	{
		assertTrue(AnalyzerArguments.parse(new String[0]).isHelpFlag());
	}

	@Test
	void defaults_for_single_input()
	{
		AnalyzerArguments args = AnalyzerArguments.parse(new String[]{"app.js"});

		assertFalse(args.isHelpFlag());
		assertEquals(List.of(Paths.get("app.js")), args.getInputFiles());
		assertEquals(TargetEnvironment.BROWSER, args.getTarget());
		assertEquals(AnalysisOptions.DEFAULT_ECMA_VERSION, args.getEcmaVersion());
		assertTrue(args.isOptimistic());
		assertFalse(args.isCheckOnly());
		assertNull(args.getOutputPath());
	}

	@Test
	void all_options_are_parsed()
	{
		AnalyzerArguments args = AnalyzerArguments.parse(new String[]{
				"-t", "node", "-o", "out.json", "-k", "--ecma-version", "2015", "--no-optimistic", "a.js"});

		assertFalse(args.isHelpFlag());
		assertEquals(TargetEnvironment.NODE, args.getTarget());
		assertEquals(Paths.get("out.json"), args.getOutputPath());
		assertTrue(args.isCheckOnly());
		assertEquals(6, args.getEcmaVersion());
		assertFalse(args.isOptimistic());
		assertEquals(List.of(Paths.get("a.js")), args.getInputFiles());
	}

	@Test
	void analysis_options_follow_arguments()
	{
		AnalysisOptions options = AnalyzerArguments.parse(new String[]{"--target", "node", "--ecma-version", "5", "--no-optimistic", "a.js"})
				.toAnalysisOptions();

		assertEquals(GrammarMode.SCRIPT, options.grammarMode());
		assertTrue(options.treatAsHostedModule());
		assertEquals(5, options.ecmaVersion());
		assertFalse(options.optimistic());
	}

	@Test
	void invalid_target_shows_help()
	{
		assertTrue(AnalyzerArguments.parse(new String[]{"-t", "deno", "a.js"}).isHelpFlag());
	}

	@Test
	void unsupported_ecma_version_shows_help()
	{
		assertTrue(AnalyzerArguments.parse(new String[]{"--ecma-version", "2020", "a.js"}).isHelpFlag());
		assertTrue(AnalyzerArguments.parse(new String[]{"--ecma-version", "es6", "a.js"}).isHelpFlag());
	}

	@Test
	void unknown_option_shows_help()
	{
		assertTrue(AnalyzerArguments.parse(new String[]{"--frobnicate", "a.js"}).isHelpFlag());
	}

	@Test
	void missing_option_value_shows_help()
	{
		assertTrue(AnalyzerArguments.parse(new String[]{"a.js", "-o"}).isHelpFlag());
		assertTrue(AnalyzerArguments.parse(new String[]{"-t", "-k", "a.js"}).isHelpFlag());
	}

	@Test
	void output_with_several_inputs_shows_help()
	{
		assertTrue(AnalyzerArguments.parse(new String[]{"-o", "out.json", "a.js", "b.js"}).isHelpFlag());
	}

	@Test
	void version_flag_stops_parsing()
	{
		AnalyzerArguments args = AnalyzerArguments.parse(new String[]{"--version", "--frobnicate"});
		assertTrue(args.isVersionFlag());
		assertFalse(args.isHelpFlag());
	}

	@Test
	void verbose_enables_debug_logging()
	{
		AnalyzerArguments args = AnalyzerArguments.parse(new String[]{"-v", "a.js"});
		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
	}
}
