// File: src/main/java/org/lokray/scope/semantic/ScopeGraphBuildException.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

/**
 * A single scope graph construction attempt rejected the program.
 */
public class ScopeGraphBuildException extends ScopeAnalysisException
{
	private final Node node;

	public ScopeGraphBuildException(String message, Node node)
	{
		super(node != null ? message + " (line " + node.getLine() + ":" + (node.getColumn() + 1) + ")" : message);
		this.node = node;
	}

	public Node getNode()
	{
		return node;
	}
}
