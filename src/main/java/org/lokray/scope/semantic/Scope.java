// File: src/main/java/org/lokray/scope/semantic/Scope.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeKind;
import org.lokray.scope.ast.NodeRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A lexical region introduced by one structural node.
 * References made in a scope stay pending until the scope closes; they are then resolved against
 * its variables or delegated to the enclosing scope.
 */
public class Scope
{
	private final int id;
	private final ScopeType type;
	private final Node block;
	private final Scope upper;
	private final Scope variableScope;
	private final Map<String, Variable> set = new LinkedHashMap<>();
	private final List<Variable> variables = new ArrayList<>();
	private final List<Reference> references = new ArrayList<>();
	private final List<Reference> through = new ArrayList<>();
	private final List<Scope> childScopes = new ArrayList<>();
	private final Set<String> taints = new HashSet<>();
	private List<Reference> left = new ArrayList<>();
	private boolean strict;
	private boolean dynamic;
	private boolean directCallToEval;
	private boolean thisFound;

	Scope(int id, ScopeType type, Scope upper, Node block, boolean methodDefinition)
	{
		this.id = id;
		this.type = type;
		this.upper = upper;
		this.block = block;
		this.variableScope = type.isVariableScope() ? this : upper.variableScope;
		this.dynamic = type == ScopeType.GLOBAL || type == ScopeType.WITH;
		this.strict = isStrictScope(methodDefinition);
		if (upper != null)
		{
			upper.childScopes.add(this);
		}
	}

	private boolean isStrictScope(boolean methodDefinition)
	{
		if (upper != null && upper.strict)
		{
			return true;
		}
		if (methodDefinition || type == ScopeType.CLASS || type == ScopeType.MODULE)
		{
			return true;
		}

		Node body;
		if (type == ScopeType.FUNCTION)
		{
			if (block.is(NodeKind.ARROW_FUNCTION_EXPRESSION) && !block.get(NodeRole.BODY).is(NodeKind.BLOCK_STATEMENT))
			{
				return false;
			}
			body = block.is(NodeKind.PROGRAM) ? block : block.get(NodeRole.BODY);
		}
		else if (type == ScopeType.GLOBAL)
		{
			body = block;
		}
		else
		{
			return false;
		}
		return hasUseStrictDirective(body);
	}

	/**
	 * Scans the directive prologue: the leading run of string-literal expression statements.
	 */
	private static boolean hasUseStrictDirective(Node body)
	{
		for (Node statement : body.getAll(NodeRole.BODY))
		{
			if (!statement.is(NodeKind.EXPRESSION_STATEMENT))
			{
				break;
			}
			Node expression = statement.get(NodeRole.EXPRESSION);
			if (!expression.is(NodeKind.LITERAL) || !isStringLiteral(expression.getName()))
			{
				break;
			}
			String raw = expression.getName();
			if (raw.equals("\"use strict\"") || raw.equals("'use strict'"))
			{
				return true;
			}
		}
		return false;
	}

	private static boolean isStringLiteral(String raw)
	{
		return raw != null && !raw.isEmpty() && (raw.charAt(0) == '"' || raw.charAt(0) == '\'');
	}

	// --- Construction, driven by the binding walker ---

	void setStrict(boolean strict)
	{
		this.strict = strict;
	}

	void define(Node node, Definition definition)
	{
		if (node != null && node.is(NodeKind.IDENTIFIER))
		{
			defineGeneric(node.getName(), set, variables, node, definition);
		}
	}

	final Variable defineGeneric(String name, Map<String, Variable> target, List<Variable> targetVariables, Node node, Definition definition)
	{
		Variable variable = target.get(name);
		if (variable == null)
		{
			variable = new Variable(name, this);
			target.put(name, variable);
			targetVariables.add(variable);
		}
		if (definition != null)
		{
			variable.addDefinition(definition);
		}
		if (node != null)
		{
			variable.addIdentifier(node);
		}
		return variable;
	}

	/**
	 * Defines a name with no declaring identifier, such as a function's implicit {@code arguments}.
	 */
	void defineImplicit(String name)
	{
		defineGeneric(name, set, variables, null, null);
		taints.add(name);
	}

	void referencing(Node node)
	{
		referencing(node, ReferenceFlag.READ, null, null, false, false);
	}

	void referencing(Node node, ReferenceFlag flag, Node writeExpression, Reference.ImplicitGlobalCandidate candidate, boolean partial, boolean init)
	{
		if (node == null || !node.is(NodeKind.IDENTIFIER))
		{
			return;
		}
		Reference reference = new Reference(node, this, flag, writeExpression, candidate, partial, init);
		references.add(reference);
		left.add(reference);
	}

	/**
	 * A direct {@code eval} call can introduce bindings at run time, so no enclosing scope can be resolved statically.
	 */
	void detectEval()
	{
		directCallToEval = true;
		for (Scope current = this; current != null; current = current.upper)
		{
			current.dynamic = true;
		}
	}

	void detectThis()
	{
		thisFound = true;
	}

	// --- Closing ---

	List<Reference> pendingReferences()
	{
		return left;
	}

	final boolean shouldStaticallyClose(boolean optimistic)
	{
		return !dynamic || optimistic;
	}

	/**
	 * Resolves every pending reference and returns the enclosing scope.
	 */
	Scope close(boolean optimistic)
	{
		boolean closeStatically = shouldStaticallyClose(optimistic);
		for (Reference reference : left)
		{
			if (closeStatically)
			{
				staticCloseReference(reference);
			}
			else if (type != ScopeType.GLOBAL)
			{
				dynamicCloseReference(reference);
			}
			else
			{
				globalCloseReference(reference);
			}
		}
		left = null;
		return upper;
	}

	final void markClosed()
	{
		left = null;
	}

	private void staticCloseReference(Reference reference)
	{
		if (!resolve(reference))
		{
			delegateToUpperScope(reference);
		}
	}

	private void dynamicCloseReference(Reference reference)
	{
		for (Scope current = this; current != null; current = current.upper)
		{
			current.through.add(reference);
		}
	}

	private void globalCloseReference(Reference reference)
	{
		if (shouldStaticallyCloseForGlobal(reference))
		{
			staticCloseReference(reference);
		}
		else
		{
			dynamicCloseReference(reference);
		}
	}

	private boolean shouldStaticallyCloseForGlobal(Reference reference)
	{
		Variable variable = set.get(reference.getName());
		if (variable == null || variable.getDefinitions().isEmpty())
		{
			return false;
		}
		return variable.getDefinitions().stream().allMatch(Definition::isLexical);
	}

	boolean isValidResolution(Reference reference, Variable variable)
	{
		return true;
	}

	private boolean resolve(Reference reference)
	{
		Variable variable = set.get(reference.getName());
		if (variable == null || !isValidResolution(reference, variable))
		{
			return false;
		}
		variable.addReference(reference, reference.getFrom().variableScope == variableScope);
		if (reference.isTainted())
		{
			variable.taint();
			taints.add(variable.getName());
		}
		reference.resolveTo(variable);
		return true;
	}

	final void delegateToUpperScope(Reference reference)
	{
		if (upper != null)
		{
			upper.left.add(reference);
		}
		through.add(reference);
	}

	// --- Read-only view ---

	public int getId()
	{
		return id;
	}

	public ScopeType getType()
	{
		return type;
	}

	/**
	 * The structural node that introduced this scope.
	 */
	public Node getBlock()
	{
		return block;
	}

	public Scope getUpper()
	{
		return upper;
	}

	/**
	 * The nearest function, module or global scope, where {@code var} declarations land.
	 */
	public Scope getVariableScope()
	{
		return variableScope;
	}

	public List<Scope> getChildScopes()
	{
		return Collections.unmodifiableList(childScopes);
	}

	public List<Variable> getVariables()
	{
		return Collections.unmodifiableList(variables);
	}

	public Optional<Variable> getVariable(String name)
	{
		return Optional.ofNullable(set.get(name));
	}

	public List<Reference> getReferences()
	{
		return Collections.unmodifiableList(references);
	}

	/**
	 * References this scope could not resolve itself.
	 */
	public List<Reference> getThrough()
	{
		return Collections.unmodifiableList(through);
	}

	public boolean isStrict()
	{
		return strict;
	}

	public boolean isDynamic()
	{
		return dynamic;
	}

	public boolean isStatic()
	{
		return !dynamic;
	}

	public boolean isTainted(String name)
	{
		return taints.contains(name);
	}

	public boolean hasDirectCallToEval()
	{
		return directCallToEval;
	}

	public boolean isThisFound()
	{
		return thisFound;
	}

	public boolean isFunctionExpressionScope()
	{
		return type == ScopeType.FUNCTION_EXPRESSION_NAME;
	}

	public boolean isClosed()
	{
		return left == null;
	}

	@Override
	public String toString()
	{
		return type.getLabel() + " scope #" + id + " (" + block.getKind() + "@" + block.getLine() + ")";
	}
}
