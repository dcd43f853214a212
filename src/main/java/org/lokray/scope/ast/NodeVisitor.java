// File: src/main/java/org/lokray/scope/ast/NodeVisitor.java
package org.lokray.scope.ast;

/**
 * Callbacks invoked by {@link NodeTraverser}.
 */
@FunctionalInterface
public interface NodeVisitor
{
	/**
	 * Called once per node before its children, in document order.
	 *
	 * @param node       The visited node.
	 * @param parentNode The node it was reached from, or {@code null} for the traversal root.
	 */
	void enter(Node node, Node parentNode);

	default void leave(Node node, Node parentNode)
	{
	}
}
