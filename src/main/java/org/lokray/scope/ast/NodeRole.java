// File: src/main/java/org/lokray/scope/ast/NodeRole.java
package org.lokray.scope.ast;

/**
 * The field a child occupies in its parent, named after the ESTree property.
 */
public enum NodeRole
{
	ID,
	PARAMS,
	BODY,
	INIT,
	TEST,
	UPDATE,
	CONSEQUENT,
	ALTERNATE,
	LEFT,
	RIGHT,
	ARGUMENT,
	ARGUMENTS,
	CALLEE,
	OBJECT,
	PROPERTY,
	KEY,
	VALUE,
	DECLARATIONS,
	DECLARATION,
	BLOCK,
	HANDLER,
	FINALIZER,
	PARAM,
	SUPER_CLASS,
	ELEMENTS,
	PROPERTIES,
	EXPRESSION,
	EXPRESSIONS,
	DISCRIMINANT,
	CASES,
	LABEL,
	SPECIFIERS,
	LOCAL,
	IMPORTED,
	EXPORTED,
	SOURCE
}
