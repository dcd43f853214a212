// File: src/main/java/org/lokray/scope/semantic/InvariantViolationException.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

/**
 * The syntax tree is malformed: a node other than the root has no parent.
 */
public class InvariantViolationException extends ScopeAnalysisException
{
	private final Node node;

	public InvariantViolationException(String message, Node node)
	{
		super(message);
		this.node = node;
	}

	public Node getNode()
	{
		return node;
	}
}
