// File: src/main/java/org/lokray/scope/ast/NodeKind.java
package org.lokray.scope.ast;

/**
 * Closed set of ESTree node types produced by {@link AstBuilder}.
 */
public enum NodeKind
{
	PROGRAM,
	IDENTIFIER,
	LITERAL,
	THIS_EXPRESSION,
	SUPER,

	// Declarations
	VARIABLE_DECLARATION,
	VARIABLE_DECLARATOR,
	FUNCTION_DECLARATION,
	CLASS_DECLARATION,
	CLASS_BODY,
	METHOD_DEFINITION,

	// Statements
	BLOCK_STATEMENT,
	EMPTY_STATEMENT,
	EXPRESSION_STATEMENT,
	IF_STATEMENT,
	FOR_STATEMENT,
	FOR_IN_STATEMENT,
	FOR_OF_STATEMENT,
	WHILE_STATEMENT,
	DO_WHILE_STATEMENT,
	RETURN_STATEMENT,
	BREAK_STATEMENT,
	CONTINUE_STATEMENT,
	THROW_STATEMENT,
	TRY_STATEMENT,
	CATCH_CLAUSE,
	SWITCH_STATEMENT,
	SWITCH_CASE,
	LABELED_STATEMENT,
	WITH_STATEMENT,
	DEBUGGER_STATEMENT,

	// Modules
	IMPORT_DECLARATION,
	IMPORT_SPECIFIER,
	IMPORT_DEFAULT_SPECIFIER,
	IMPORT_NAMESPACE_SPECIFIER,
	EXPORT_NAMED_DECLARATION,
	EXPORT_DEFAULT_DECLARATION,
	EXPORT_ALL_DECLARATION,
	EXPORT_SPECIFIER,

	// Expressions
	FUNCTION_EXPRESSION,
	ARROW_FUNCTION_EXPRESSION,
	CLASS_EXPRESSION,
	ARRAY_EXPRESSION,
	OBJECT_EXPRESSION,
	PROPERTY,
	SPREAD_ELEMENT,
	ASSIGNMENT_EXPRESSION,
	BINARY_EXPRESSION,
	LOGICAL_EXPRESSION,
	UNARY_EXPRESSION,
	UPDATE_EXPRESSION,
	CONDITIONAL_EXPRESSION,
	CALL_EXPRESSION,
	NEW_EXPRESSION,
	MEMBER_EXPRESSION,
	SEQUENCE_EXPRESSION,

	// Patterns
	ARRAY_PATTERN,
	OBJECT_PATTERN,
	ASSIGNMENT_PATTERN,
	REST_ELEMENT;

	/**
	 * Kinds that may stand on the left of a binding or a plain {@code =} assignment.
	 */
	public boolean isPattern()
	{
		return switch (this)
		{
			case IDENTIFIER, ARRAY_PATTERN, OBJECT_PATTERN, ASSIGNMENT_PATTERN, REST_ELEMENT -> true;
			default -> false;
		};
	}
}
