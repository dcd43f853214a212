package org.lokray.scope.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Routes lexer and parser syntax errors through Debug.logError and counts them,
 * so one listener instance can serve both recognizers of a source file.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final String sourceName;
	private int errorCount = 0;

	public SyntaxErrorListener(String sourceName)
	{
		this.sourceName = sourceName;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		String err = String.format("[Syntax Error] %s line %d:%d - %s", sourceName, line, charPositionInLine + 1, msg);
		Debug.logError(err);
		errorCount++;
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
