// File: src/main/java/org/lokray/scope/semantic/PatternWalker.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Finds the identifiers bound by a binding or assignment pattern. Expressions found inside the
 * pattern (defaults, computed keys, member targets) are collected as right-hand nodes for the caller to visit.
 */
final class PatternWalker
{
	/**
	 * @param topLevel    the identifier is the whole pattern
	 * @param assignments the enclosing defaults, outermost first
	 */
	record PatternInfo(boolean topLevel, List<Node> assignments)
	{
	}

	private final Node rootPattern;
	private final BiConsumer<Node, PatternInfo> callback;
	private final List<Node> assignments = new ArrayList<>();
	private final List<Node> rightHandNodes = new ArrayList<>();

	PatternWalker(Node rootPattern, BiConsumer<Node, PatternInfo> callback)
	{
		this.rootPattern = rootPattern;
		this.callback = callback;
	}

	void walk(Node pattern)
	{
		if (pattern == null)
		{
			return;
		}
		switch (pattern.getKind())
		{
			case IDENTIFIER -> callback.accept(pattern, new PatternInfo(pattern == rootPattern, List.copyOf(assignments)));
			case PROPERTY ->
			{
				if (pattern.isComputed())
				{
					rightHandNodes.add(pattern.get(NodeRole.KEY));
				}
				walk(pattern.get(NodeRole.VALUE));
			}
			case OBJECT_PATTERN ->
			{
				for (Node property : pattern.getAll(NodeRole.PROPERTIES))
				{
					walk(property);
				}
			}
			case ARRAY_PATTERN, ARRAY_EXPRESSION ->
			{
				for (Node element : pattern.getAll(NodeRole.ELEMENTS))
				{
					walk(element);
				}
			}
			case ASSIGNMENT_PATTERN, ASSIGNMENT_EXPRESSION ->
			{
				assignments.add(pattern);
				walk(pattern.get(NodeRole.LEFT));
				rightHandNodes.add(pattern.get(NodeRole.RIGHT));
				assignments.remove(assignments.size() - 1);
			}
			case REST_ELEMENT, SPREAD_ELEMENT -> walk(pattern.get(NodeRole.ARGUMENT));
			case MEMBER_EXPRESSION ->
			{
				if (pattern.isComputed())
				{
					rightHandNodes.add(pattern.get(NodeRole.PROPERTY));
				}
				rightHandNodes.add(pattern.get(NodeRole.OBJECT));
			}
			case CALL_EXPRESSION ->
			{
				rightHandNodes.addAll(pattern.getAll(NodeRole.ARGUMENTS));
				walk(pattern.get(NodeRole.CALLEE));
			}
			default ->
			{
				for (Node child : pattern.getChildren())
				{
					walk(child);
				}
			}
		}
	}

	List<Node> getRightHandNodes()
	{
		return Collections.unmodifiableList(rightHandNodes);
	}
}
