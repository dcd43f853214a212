// File: src/main/java/org/lokray/scope/ast/AstBuildException.java
package org.lokray.scope.ast;

/**
 * Raised when a parse tree is grammatical but cannot form a valid syntax tree,
 * e.g. {@code (a + b) = c}.
 */
public class AstBuildException extends RuntimeException
{
	private final Node node;

	public AstBuildException(String message, Node node)
	{
		super(message);
		this.node = node;
	}

	public Node getNode()
	{
		return node;
	}
}
