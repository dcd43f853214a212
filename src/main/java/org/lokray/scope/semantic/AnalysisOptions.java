// File: src/main/java/org/lokray/scope/semantic/AnalysisOptions.java
package org.lokray.scope.semantic;

/**
 * Settings for one scope graph construction.
 *
 * @param grammarMode         script or module dialect
 * @param treatAsHostedModule wrap the program in an implicit function scope (Node.js style)
 * @param ecmaVersion         language level; block scopes need 6 or later
 * @param optimistic          resolve references statically even in scopes tainted by {@code eval} or {@code with}
 */
public record AnalysisOptions(GrammarMode grammarMode, boolean treatAsHostedModule, int ecmaVersion, boolean optimistic)
{
	public static final int DEFAULT_ECMA_VERSION = 7;

	public static AnalysisOptions defaults()
	{
		return new AnalysisOptions(GrammarMode.SCRIPT, false, DEFAULT_ECMA_VERSION, true);
	}

	public AnalysisOptions withGrammarMode(GrammarMode mode)
	{
		return new AnalysisOptions(mode, treatAsHostedModule, ecmaVersion, optimistic);
	}

	public AnalysisOptions withHostedModule(boolean hosted)
	{
		return new AnalysisOptions(grammarMode, hosted, ecmaVersion, optimistic);
	}

	public AnalysisOptions withEcmaVersion(int version)
	{
		return new AnalysisOptions(grammarMode, treatAsHostedModule, version, optimistic);
	}

	public AnalysisOptions withOptimistic(boolean value)
	{
		return new AnalysisOptions(grammarMode, treatAsHostedModule, ecmaVersion, value);
	}

	public boolean isModule()
	{
		return grammarMode == GrammarMode.MODULE;
	}

	public boolean isEs6()
	{
		return ecmaVersion >= 6;
	}
}
