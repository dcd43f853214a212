// File: src/main/java/org/lokray/scope/semantic/ScopeAttachments.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;

/**
 * The scope resolved for each identifier, kept beside the tree rather than on its nodes.
 * Keys are held weakly and compared by identity.
 */
public final class ScopeAttachments
{
	private final Map<Node, Scope> scopes = new WeakHashMap<>();

	void attach(Node identifier, Scope scope)
	{
		scopes.put(identifier, scope);
	}

	public Optional<Scope> scopeOf(Node identifier)
	{
		return Optional.ofNullable(scopes.get(identifier));
	}

	public boolean isResolved(Node identifier)
	{
		return scopes.containsKey(identifier);
	}

	public int size()
	{
		return scopes.size();
	}
}
