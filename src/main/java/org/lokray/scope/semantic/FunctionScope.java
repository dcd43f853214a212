// File: src/main/java/org/lokray/scope/semantic/FunctionScope.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeKind;
import org.lokray.scope.ast.NodeRole;

public class FunctionScope extends Scope
{
	FunctionScope(int id, Scope upper, Node block, boolean methodDefinition)
	{
		super(id, ScopeType.FUNCTION, upper, block, methodDefinition);
		if (!block.is(NodeKind.ARROW_FUNCTION_EXPRESSION))
		{
			defineImplicit("arguments");
		}
	}

	/**
	 * A parameter default cannot see a variable that only the body declares:
	 * in {@code function f(a = b) { var b; }} the {@code b} in the default is resolved outside {@code f}.
	 */
	@Override
	boolean isValidResolution(Reference reference, Variable variable)
	{
		if (getBlock().is(NodeKind.PROGRAM))
		{
			return true;
		}
		int bodyStart = getBlock().get(NodeRole.BODY).getStart();
		return !(variable.getScope() == this
				&& reference.getIdentifier().getStart() < bodyStart
				&& variable.getDefinitions().stream().allMatch(definition -> definition.name().getStart() >= bodyStart));
	}
}
