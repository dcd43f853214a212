// File: src/main/java/org/lokray/scope/semantic/ScopeGraph.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Every scope of one program, plus the lookup from a structural node to the scopes it introduced.
 * Exposes read-only views; nothing changes once construction has finished.
 */
public final class ScopeGraph
{
	private final Node root;
	private final AnalysisOptions options;
	private final List<Scope> scopes;
	private final Map<Node, List<Scope>> nodeToScopes = new IdentityHashMap<>();
	private final Map<Node, Reference> identifierToReference = new IdentityHashMap<>();

	ScopeGraph(Node root, AnalysisOptions options, List<Scope> scopes)
	{
		this.root = root;
		this.options = options;
		this.scopes = List.copyOf(scopes);
		for (Scope scope : scopes)
		{
			// Innermost first: a scope is always created after the scopes enclosing it
			nodeToScopes.computeIfAbsent(scope.getBlock(), node -> new ArrayList<>()).add(0, scope);
			for (Reference reference : scope.getReferences())
			{
				identifierToReference.put(reference.getIdentifier(), reference);
			}
		}
	}

	/**
	 * The scopes introduced by {@code node}, innermost first. A program may introduce global, hosted-module
	 * and module scopes; a named function expression its name scope and its function scope.
	 */
	public List<Scope> acquireAll(Node node)
	{
		List<Scope> introduced = nodeToScopes.get(node);
		return introduced == null ? List.of() : Collections.unmodifiableList(introduced);
	}

	/**
	 * The reference recorded for {@code identifier}, if it is a use of a name.
	 */
	public Optional<Reference> findReference(Node identifier)
	{
		return Optional.ofNullable(identifierToReference.get(identifier));
	}

	public GlobalScope getGlobalScope()
	{
		return (GlobalScope) scopes.get(0);
	}

	public List<Scope> getScopes()
	{
		return scopes;
	}

	public Node getRoot()
	{
		return root;
	}

	public boolean isBuiltFor(Node node)
	{
		return node == root;
	}

	public AnalysisOptions getOptions()
	{
		return options;
	}

	public GrammarMode getGrammarMode()
	{
		return options.grammarMode();
	}
}
