// File: src/main/java/org/lokray/scope/semantic/ScopeAnalysisException.java
package org.lokray.scope.semantic;

/**
 * Base class of the fatal failures raised while analyzing a program's scopes.
 */
public class ScopeAnalysisException extends RuntimeException
{
	public ScopeAnalysisException(String message)
	{
		super(message);
	}

	public ScopeAnalysisException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
