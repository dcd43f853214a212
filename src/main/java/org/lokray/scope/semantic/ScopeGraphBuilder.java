// File: src/main/java/org/lokray/scope/semantic/ScopeGraphBuilder.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

/**
 * Produces the scope graph of a program under one set of options.
 */
@FunctionalInterface
public interface ScopeGraphBuilder
{
	/**
	 * @throws ScopeGraphBuildException if the program is not valid under the requested grammar mode
	 */
	ScopeGraph build(Node root, AnalysisOptions options);
}
