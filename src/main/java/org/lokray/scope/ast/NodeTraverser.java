// File: src/main/java/org/lokray/scope/ast/NodeTraverser.java
package org.lokray.scope.ast;

public final class NodeTraverser
{
	private NodeTraverser()
	{
	}

	/**
	 * Depth-first walk over {@code root} and its descendants in document order.
	 */
	public static void traverse(Node root, NodeVisitor visitor)
	{
		visit(root, null, visitor);
	}

	private static void visit(Node node, Node parentNode, NodeVisitor visitor)
	{
		visitor.enter(node, parentNode);
		for (Node child : node.getChildren())
		{
			visit(child, node, visitor);
		}
		visitor.leave(node, parentNode);
	}
}
