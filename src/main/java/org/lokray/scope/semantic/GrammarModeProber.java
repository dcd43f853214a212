// File: src/main/java/org/lokray/scope/semantic/GrammarModeProber.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a scope graph under the first grammar mode that accepts the program, trying script before module.
 */
public class GrammarModeProber
{
	static final List<GrammarMode> CANDIDATE_MODES = List.of(GrammarMode.SCRIPT, GrammarMode.MODULE);

	private final ScopeGraphBuilder builder;
	private final AnalysisOptions baseOptions;

	public GrammarModeProber(ScopeGraphBuilder builder, AnalysisOptions baseOptions)
	{
		this.builder = builder;
		this.baseOptions = baseOptions;
	}

	public GrammarModeProber(ScopeGraphBuilder builder)
	{
		this(builder, AnalysisOptions.defaults());
	}

	private record Attempt(GrammarMode mode, ScopeGraph graph, ScopeGraphBuildException failure)
	{
		boolean succeeded()
		{
			return graph != null;
		}
	}

	/**
	 * @param treatAsHostedModule passed unchanged to every attempt
	 * @throws GraphConstructionException if no candidate mode accepts the program
	 */
	public ScopeGraph build(Node root, boolean treatAsHostedModule)
	{
		List<Attempt> attempts = new ArrayList<>();
		for (GrammarMode mode : CANDIDATE_MODES)
		{
			Attempt attempt = attempt(root, baseOptions.withGrammarMode(mode).withHostedModule(treatAsHostedModule));
			attempts.add(attempt);
			if (attempt.succeeded())
			{
				return attempt.graph();
			}
			Debug.logDebug("Scope analysis as " + mode + " failed: " + attempt.failure().getMessage());
		}

		Attempt last = attempts.get(attempts.size() - 1);
		throw new GraphConstructionException("Scope analysis failed in every grammar mode: " + last.failure().getMessage(), last.failure());
	}

	private Attempt attempt(Node root, AnalysisOptions options)
	{
		try
		{
			return new Attempt(options.grammarMode(), builder.build(root, options), null);
		}
		catch (ScopeGraphBuildException e)
		{
			return new Attempt(options.grammarMode(), null, e);
		}
	}
}
