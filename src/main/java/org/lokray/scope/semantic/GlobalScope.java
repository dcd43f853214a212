// File: src/main/java/org/lokray/scope/semantic/GlobalScope.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The program-level scope. Also collects the implicit globals created by sloppy-mode assignments
 * to undeclared names.
 */
public class GlobalScope extends Scope
{
	private final Map<String, Variable> implicitSet = new LinkedHashMap<>();
	private final List<Variable> implicitVariables = new ArrayList<>();

	GlobalScope(int id, Node program)
	{
		super(id, ScopeType.GLOBAL, null, program, false);
	}

	@Override
	Scope close(boolean optimistic)
	{
		List<Reference.ImplicitGlobalCandidate> implicit = new ArrayList<>();
		for (Reference reference : pendingReferences())
		{
			Reference.ImplicitGlobalCandidate candidate = reference.getImplicitGlobalCandidate();
			if (candidate != null && getVariable(reference.getName()).isEmpty())
			{
				implicit.add(candidate);
			}
		}
		for (Reference.ImplicitGlobalCandidate candidate : implicit)
		{
			Node pattern = candidate.pattern();
			if (pattern.is(NodeKind.IDENTIFIER))
			{
				defineGeneric(pattern.getName(), implicitSet, implicitVariables, pattern,
						new Definition(DefinitionType.IMPLICIT_GLOBAL, pattern, candidate.node()));
			}
		}
		return super.close(optimistic);
	}

	/**
	 * Globals created by assignment rather than declaration. They are not part of {@link #getVariables()},
	 * so references to them stay unresolved.
	 */
	public List<Variable> getImplicitVariables()
	{
		return Collections.unmodifiableList(implicitVariables);
	}
}
