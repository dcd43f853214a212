// File: src/main/java/org/lokray/scope/semantic/GraphConstructionException.java
package org.lokray.scope.semantic;

/**
 * Every candidate grammar mode failed to produce a scope graph. The cause is the last attempt's failure.
 */
public class GraphConstructionException extends ScopeAnalysisException
{
	public GraphConstructionException(String message, Throwable lastFailure)
	{
		super(message, lastFailure);
	}
}
