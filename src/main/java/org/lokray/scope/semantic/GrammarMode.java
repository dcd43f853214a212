// File: src/main/java/org/lokray/scope/semantic/GrammarMode.java
package org.lokray.scope.semantic;

/**
 * The source dialect a program is analyzed under.
 */
public enum GrammarMode
{
	SCRIPT,
	MODULE
}
