// File: src/main/java/org/lokray/scope/semantic/WithScope.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;

/**
 * The body of a {@code with} statement. Outside optimistic mode its references cannot be resolved
 * statically and are tainted on their way out.
 */
public class WithScope extends Scope
{
	WithScope(int id, Scope upper, Node block)
	{
		super(id, ScopeType.WITH, upper, block, false);
	}

	@Override
	Scope close(boolean optimistic)
	{
		if (shouldStaticallyClose(optimistic))
		{
			return super.close(optimistic);
		}
		for (Reference reference : pendingReferences())
		{
			reference.taint();
			delegateToUpperScope(reference);
		}
		markClosed();
		return getUpper();
	}
}
