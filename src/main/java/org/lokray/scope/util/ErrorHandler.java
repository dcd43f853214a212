// File: src/main/java/org/lokray/scope/util/ErrorHandler.java
package org.lokray.scope.util;

import org.lokray.scope.ast.Node;

import java.nio.file.Path;

public class ErrorHandler
{
	private int errorCount = 0;

	public void logError(Path file, Node node, String msg)
	{
		String location = node != null
				? String.format("line %d:%d", node.getLine(), node.getColumn() + 1)
				: "-";
		String err = String.format("[Scope Error] %s - %s - %s", file != null ? file : "<source>", location, msg);
		Debug.logError(err);
		errorCount++;
	}

	public void logError(Path file, String msg)
	{
		logError(file, null, msg);
	}

	public boolean hasErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}
}
