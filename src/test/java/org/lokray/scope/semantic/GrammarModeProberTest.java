package org.lokray.scope.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.SourceParser;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarModeProberTest
{
	private static Node parse(String src)
	{
		Node program = SourceParser.parse(src);
		assertNotNull(program);
		return program;
	}

	@Test
	void plain_script_is_built_as_script()
	{
		GrammarModeProber prober = new GrammarModeProber(new ScopeGraphAnalyzer());
		ScopeGraph graph = prober.build(parse("var a = 1; with (a) { }"), false);

		assertEquals(GrammarMode.SCRIPT, graph.getGrammarMode());
		assertFalse(graph.getScopes().stream().anyMatch(scope -> scope.getType() == ScopeType.MODULE));
	}

	@Test
	void import_falls_back_to_module()
	{
		GrammarModeProber prober = new GrammarModeProber(new ScopeGraphAnalyzer());
		ScopeGraph graph = prober.build(parse("import x from 'm'; x;"), false);

		assertEquals(GrammarMode.MODULE, graph.getGrammarMode());
		assertEquals(ScopeType.MODULE, graph.getScopes().get(1).getType());
	}

	@Test
	void program_rejected_in_every_mode_fails_with_last_cause()
	{
		GrammarModeProber prober = new GrammarModeProber(new ScopeGraphAnalyzer());
		Node program = parse("import x from 'm'; with (x) { }");

		GraphConstructionException e = assertThrows(GraphConstructionException.class, () -> prober.build(program, false));
		ScopeGraphBuildException cause = assertInstanceOf(ScopeGraphBuildException.class, e.getCause());
		assertTrue(cause.getMessage().contains("strict"), cause.getMessage());
	}

	@Test
	void stops_at_first_accepting_mode()
	{
		List<AnalysisOptions> seen = new ArrayList<>();
		ScopeGraphAnalyzer analyzer = new ScopeGraphAnalyzer();
		GrammarModeProber prober = new GrammarModeProber((root, options) ->
		{
			seen.add(options);
			return analyzer.build(root, options);
		});

		prober.build(parse("var a;"), false);
		assertEquals(1, seen.size());
		assertEquals(GrammarMode.SCRIPT, seen.get(0).grammarMode());
	}

	@Test
	void tries_script_then_module_and_forwards_hosted_flag()
	{
		List<AnalysisOptions> seen = new ArrayList<>();
		GrammarModeProber prober = new GrammarModeProber((root, options) ->
		{
			seen.add(options);
			throw new ScopeGraphBuildException("rejected " + options.grammarMode(), root);
		});

		GraphConstructionException e = assertThrows(GraphConstructionException.class, () -> prober.build(parse("var a;"), true));

		assertEquals(List.of(GrammarMode.SCRIPT, GrammarMode.MODULE), seen.stream().map(AnalysisOptions::grammarMode).toList());
		assertTrue(seen.stream().allMatch(AnalysisOptions::treatAsHostedModule));
		assertTrue(e.getCause().getMessage().startsWith("rejected MODULE"));
	}

	@Test
	void base_options_are_kept_for_every_attempt()
	{
		List<AnalysisOptions> seen = new ArrayList<>();
		AnalysisOptions base = AnalysisOptions.defaults().withEcmaVersion(6).withOptimistic(false);
		GrammarModeProber prober = new GrammarModeProber((root, options) ->
		{
			seen.add(options);
			return new ScopeGraphAnalyzer().build(root, options);
		}, base);

		ScopeGraph graph = prober.build(parse("var a;"), false);
		assertEquals(6, seen.get(0).ecmaVersion());
		assertFalse(graph.getOptions().optimistic());
	}

	@Test
	void other_exceptions_are_not_treated_as_mode_rejection()
	{
		GrammarModeProber prober = new GrammarModeProber((root, options) ->
		{
			throw new IllegalStateException("boom");
		});

		assertThrows(IllegalStateException.class, () -> prober.build(parse("var a;"), false));
	}
}
