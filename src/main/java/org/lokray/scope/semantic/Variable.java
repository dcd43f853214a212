// File: src/main/java/org/lokray/scope/semantic/Variable.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named binding owned by one scope. Hoisted and redeclared bindings have several declaring identifiers.
 */
public class Variable
{
	private final String name;
	private final Scope scope;
	private final List<Node> identifiers = new ArrayList<>();
	private final List<Definition> definitions = new ArrayList<>();
	private final List<Reference> references = new ArrayList<>();
	private boolean tainted;
	private boolean stack = true;

	Variable(String name, Scope scope)
	{
		this.name = name;
		this.scope = scope;
	}

	void addIdentifier(Node identifier)
	{
		identifiers.add(identifier);
	}

	void addDefinition(Definition definition)
	{
		definitions.add(definition);
	}

	void addReference(Reference reference, boolean sameVariableScope)
	{
		references.add(reference);
		stack = stack && sameVariableScope;
	}

	void taint()
	{
		this.tainted = true;
	}

	/**
	 * Identity check: a same-named identifier elsewhere in the tree is not a declaration of this variable.
	 */
	public boolean isDeclaredBy(Node identifier)
	{
		for (Node declaring : identifiers)
		{
			if (declaring == identifier)
			{
				return true;
			}
		}
		return false;
	}

	public String getName()
	{
		return name;
	}

	public Scope getScope()
	{
		return scope;
	}

	public List<Node> getIdentifiers()
	{
		return Collections.unmodifiableList(identifiers);
	}

	public List<Definition> getDefinitions()
	{
		return Collections.unmodifiableList(definitions);
	}

	public List<Reference> getReferences()
	{
		return Collections.unmodifiableList(references);
	}

	public boolean isTainted()
	{
		return tainted;
	}

	/**
	 * Whether a reference from another function resolves to this variable.
	 */
	public boolean isCaptured()
	{
		return !stack;
	}

	@Override
	public String toString()
	{
		return "Variable(" + name + ")";
	}
}
