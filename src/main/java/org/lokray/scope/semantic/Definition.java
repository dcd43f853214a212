// File: src/main/java/org/lokray/scope/semantic/Definition.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

/**
 * One declaration site of a {@link Variable}.
 *
 * @param type   what kind of construct declares the name
 * @param name   the declaring identifier
 * @param node   the enclosing declarator, function, class, catch clause or import specifier
 * @param parent the enclosing declaration statement, if any
 * @param kind   {@code var}, {@code let} or {@code const} for variable definitions, otherwise {@code null}
 */
public record Definition(DefinitionType type, Node name, Node node, Node parent, String kind)
{
	public Definition(DefinitionType type, Node name, Node node)
	{
		this(type, name, node, null, null);
	}

	/**
	 * Class names and lexical declarations can be resolved statically even in the dynamic global scope.
	 */
	boolean isLexical()
	{
		return type == DefinitionType.CLASS_NAME || (type == DefinitionType.VARIABLE && !"var".equals(kind));
	}
}
