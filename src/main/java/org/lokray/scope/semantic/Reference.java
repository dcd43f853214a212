// File: src/main/java/org/lokray/scope/semantic/Reference.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

/**
 * A use of a name. {@link #getFrom()} is the scope the use occurs in;
 * {@link #getBindingScope()} is the scope that supplies its binding.
 */
public class Reference
{
	/**
	 * An assignment target that becomes a global if nothing declares its name.
	 */
	record ImplicitGlobalCandidate(Node pattern, Node node)
	{
	}

	private final Node identifier;
	private final Scope from;
	private final ReferenceFlag flag;
	private final Node writeExpression;
	private final boolean partial;
	private final boolean init;
	private final ImplicitGlobalCandidate implicitGlobalCandidate;
	private Variable resolved;
	private boolean tainted;
	private Scope bindingScope;

	Reference(Node identifier, Scope from, ReferenceFlag flag, Node writeExpression, ImplicitGlobalCandidate implicitGlobalCandidate, boolean partial, boolean init)
	{
		this.identifier = identifier;
		this.from = from;
		this.flag = flag;
		this.writeExpression = flag.isWrite() ? writeExpression : null;
		this.partial = flag.isWrite() && partial;
		this.init = init;
		this.implicitGlobalCandidate = implicitGlobalCandidate;
	}

	void resolveTo(Variable variable)
	{
		this.resolved = variable;
	}

	void taint()
	{
		this.tainted = true;
	}

	void bindTo(Scope scope)
	{
		this.bindingScope = scope;
	}

	ImplicitGlobalCandidate getImplicitGlobalCandidate()
	{
		return implicitGlobalCandidate;
	}

	public Node getIdentifier()
	{
		return identifier;
	}

	public String getName()
	{
		return identifier.getName();
	}

	public Scope getFrom()
	{
		return from;
	}

	/**
	 * The declaring scope of the resolved variable. A reference left unresolved by {@code eval} or
	 * {@code with} is bound to the nearest enclosing scope declaring its name; an undeclared name to the
	 * global scope.
	 */
	public Scope getBindingScope()
	{
		return bindingScope;
	}

	public Variable getResolved()
	{
		return resolved;
	}

	public boolean isResolved()
	{
		return resolved != null;
	}

	public boolean isRead()
	{
		return flag.isRead();
	}

	public boolean isWrite()
	{
		return flag.isWrite();
	}

	public boolean isReadOnly()
	{
		return flag == ReferenceFlag.READ;
	}

	public boolean isWriteOnly()
	{
		return flag == ReferenceFlag.WRITE;
	}

	public boolean isReadWrite()
	{
		return flag == ReferenceFlag.READ_WRITE;
	}

	public Node getWriteExpression()
	{
		return writeExpression;
	}

	/**
	 * Whether the write targets only part of the value, as in a destructuring pattern or a default.
	 */
	public boolean isPartial()
	{
		return partial;
	}

	/**
	 * Whether the write initializes a declaration.
	 */
	public boolean isInit()
	{
		return init;
	}

	public boolean isTainted()
	{
		return tainted;
	}

	public boolean isStatic()
	{
		return !tainted && resolved != null && resolved.getScope().isStatic();
	}

	@Override
	public String toString()
	{
		return "Reference(" + getName() + ", " + flag + ")";
	}
}
