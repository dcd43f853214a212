// File: src/main/java/org/lokray/scope/semantic/ScopeType.java
package org.lokray.scope.semantic;

public enum ScopeType
{
	GLOBAL("global"),
	MODULE("module"),
	FUNCTION("function"),
	FUNCTION_EXPRESSION_NAME("function-expression-name"),
	BLOCK("block"),
	SWITCH("switch"),
	CATCH("catch"),
	WITH("with"),
	FOR("for"),
	CLASS("class");

	private final String label;

	ScopeType(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}

	/**
	 * Scopes that receive hoisted {@code var} declarations.
	 */
	public boolean isVariableScope()
	{
		return this == GLOBAL || this == MODULE || this == FUNCTION;
	}
}
