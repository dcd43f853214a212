// File: src/main/java/org/lokray/scope/ast/Node.java
package org.lokray.scope.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A JavaScript syntax tree node.
 * Children are kept twice: by role (ESTree field) and in document order for traversal.
 * Identity is object identity; two identifiers with the same name are different nodes.
 */
public final class Node
{
	private final NodeKind kind;
	private final int start;
	private final int end;
	private final int line;
	private final int column;
	private final Map<NodeRole, List<Node>> slots = new EnumMap<>(NodeRole.class);
	private final List<Node> children = new ArrayList<>();
	private Node parent;

	// Identifier name, literal source text, or operator text
	private String name;
	// "var" / "let" / "const" on declarations, "init" / "get" / "set" / "method" / "constructor" on members
	private String variant;
	private boolean computed;
	private boolean isStatic;
	private boolean shorthand;
	private boolean prefix;

	public Node(NodeKind kind, int start, int end, int line, int column)
	{
		this.kind = kind;
		this.start = start;
		this.end = end;
		this.line = line;
		this.column = column;
	}

	/**
	 * Creates a node of another kind covering the same source range.
	 */
	public Node(NodeKind kind, Node positionOf)
	{
		this(kind, positionOf.start, positionOf.end, positionOf.line, positionOf.column);
	}

	/**
	 * Appends {@code child} under {@code role} and makes this node its parent.
	 * A {@code null} child records a hole (elided array element) in the role list only.
	 * The same node may fill two roles, e.g. {@code imported} and {@code local} of {@code import {a}}.
	 */
	public Node add(NodeRole role, Node child)
	{
		slots.computeIfAbsent(role, r -> new ArrayList<>()).add(child);
		if (child != null)
		{
			if (!containsChild(child))
			{
				children.add(child);
			}
			child.parent = this;
		}
		return this;
	}

	private boolean containsChild(Node child)
	{
		for (Node existing : children)
		{
			if (existing == child)
			{
				return true;
			}
		}
		return false;
	}

	public Node get(NodeRole role)
	{
		List<Node> nodes = slots.get(role);
		return nodes == null || nodes.isEmpty() ? null : nodes.get(0);
	}

	public List<Node> getAll(NodeRole role)
	{
		List<Node> nodes = slots.get(role);
		return nodes == null ? List.of() : Collections.unmodifiableList(nodes);
	}

	public List<Node> getChildren()
	{
		return Collections.unmodifiableList(children);
	}

	public boolean is(NodeKind kind)
	{
		return this.kind == kind;
	}

	public NodeKind getKind()
	{
		return kind;
	}

	public Node getParent()
	{
		return parent;
	}

	/**
	 * Overrides the ancestor link. AST providers may point a root at itself instead of leaving it empty.
	 */
	public void setParent(Node parent)
	{
		this.parent = parent;
	}

	public int getStart()
	{
		return start;
	}

	public int getEnd()
	{
		return end;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public String getName()
	{
		return name;
	}

	public void setName(String name)
	{
		this.name = name;
	}

	public String getOperator()
	{
		return name;
	}

	public void setOperator(String operator)
	{
		this.name = operator;
	}

	public String getVariant()
	{
		return variant;
	}

	public void setVariant(String variant)
	{
		this.variant = variant;
	}

	public boolean isComputed()
	{
		return computed;
	}

	public void setComputed(boolean computed)
	{
		this.computed = computed;
	}

	public boolean isStatic()
	{
		return isStatic;
	}

	public void setStatic(boolean isStatic)
	{
		this.isStatic = isStatic;
	}

	public boolean isShorthand()
	{
		return shorthand;
	}

	public void setShorthand(boolean shorthand)
	{
		this.shorthand = shorthand;
	}

	public boolean isPrefix()
	{
		return prefix;
	}

	public void setPrefix(boolean prefix)
	{
		this.prefix = prefix;
	}

	@Override
	public String toString()
	{
		String label = name != null ? kind + "(" + name + ")" : kind.toString();
		return label + "@" + line + ":" + (column + 1);
	}
}
