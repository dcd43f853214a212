// File: src/main/java/org/lokray/scope/semantic/ScopeGraphAnalyzer.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeKind;
import org.lokray.scope.util.Debug;

public class ScopeGraphAnalyzer implements ScopeGraphBuilder
{
	@Override
	public ScopeGraph build(Node root, AnalysisOptions options)
	{
		if (root == null || !root.is(NodeKind.PROGRAM))
		{
			throw new ScopeGraphBuildException("Scope analysis must start at a Program node", root);
		}
		if (options.isModule() && !options.isEs6())
		{
			throw new ScopeGraphBuildException("Module code requires ecmaVersion 6 or later", root);
		}

		Debug.logDebug("Building scope graph (" + options.grammarMode() + ", hosted module: " + options.treatAsHostedModule() + ")");
		ScopeGraph graph = new BindingWalker(options).walk(root);
		Debug.logDebug("Scope graph built with " + graph.getScopes().size() + " scopes.");
		return graph;
	}
}
