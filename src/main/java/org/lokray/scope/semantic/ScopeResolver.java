// File: src/main/java/org/lokray/scope/semantic/ScopeResolver.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeKind;
import org.lokray.scope.util.Debug;

import java.util.Optional;

/**
 * Finds the scope that binds an identifier by walking from the identifier toward the program root
 * and inspecting the scopes each ancestor introduced.
 */
public final class ScopeResolver
{
	private ScopeResolver()
	{
	}

	/**
	 * Returns the scope owning the variable {@code identifier} declares, or, for a use, the scope supplying
	 * its binding. Identifiers that are neither (property keys, labels) fall back to the global scope.
	 * Reads the graph only.
	 *
	 * @throws InvariantViolationException if a node other than the root has no parent
	 */
	public static Scope resolve(ScopeGraph graph, Node identifier)
	{
		Optional<Reference> reference = graph.findReference(identifier);
		Node current = identifier;
		while (true)
		{
			boolean root = isRoot(graph, current);
			if (current.getParent() == null && !root)
			{
				throw new InvariantViolationException("Node " + current + " has no parent but is not the program root", current);
			}

			for (Scope scope : graph.acquireAll(current))
			{
				if (declares(scope, identifier))
				{
					return scope;
				}
				if (reference.isPresent() && reference.get().getFrom() == scope)
				{
					return reference.get().getBindingScope();
				}
			}

			if (root)
			{
				break;
			}
			current = current.getParent();
		}

		// TODO: decide whether an identifier no scope knows about should be reported rather than bound globally
		Debug.logDebug("No scope declares or references " + identifier + "; using the global scope.");
		return graph.getGlobalScope();
	}

	/**
	 * A program node, a node that is its own parent, or the node the graph was built for.
	 */
	static boolean isRoot(ScopeGraph graph, Node node)
	{
		return node.is(NodeKind.PROGRAM) || node.getParent() == node || graph.isBuiltFor(node);
	}

	private static boolean declares(Scope scope, Node identifier)
	{
		return scope.getVariable(identifier.getName())
				.map(variable -> variable.isDeclaredBy(identifier))
				.orElse(false);
	}
}
