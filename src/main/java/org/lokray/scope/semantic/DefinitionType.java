// File: src/main/java/org/lokray/scope/semantic/DefinitionType.java
package org.lokray.scope.semantic;

public enum DefinitionType
{
	VARIABLE,
	PARAMETER,
	FUNCTION_NAME,
	CLASS_NAME,
	CATCH_CLAUSE,
	IMPORT_BINDING,
	IMPLICIT_GLOBAL
}
