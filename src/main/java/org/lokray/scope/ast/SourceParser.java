// File: src/main/java/org/lokray/scope/ast/SourceParser.java
package org.lokray.scope.ast;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.lokray.scope.parser.JavaScriptLexer;
import org.lokray.scope.parser.JavaScriptParser;
import org.lokray.scope.util.Debug;
import org.lokray.scope.util.SyntaxErrorListener;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses JavaScript source into a {@link Node} tree.
 */
public final class SourceParser
{
	private SourceParser()
	{
	}

	/**
	 * @return the program node, or {@code null} if the file has syntax errors
	 */
	public static Node parse(Path file) throws IOException
	{
		return parse(CharStreams.fromPath(file), file.toString());
	}

	public static Node parse(String source)
	{
		return parse(CharStreams.fromString(source), "<source>");
	}

	/**
	 * @throws AstBuildException if the source parses but is not a valid program, e.g. {@code 1 = x}
	 */
	private static Node parse(CharStream input, String sourceName)
	{
		SyntaxErrorListener errorListener = new SyntaxErrorListener(sourceName);

		JavaScriptLexer lexer = new JavaScriptLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(errorListener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		JavaScriptParser parser = new JavaScriptParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(errorListener);

		JavaScriptParser.ProgramContext tree = parser.program();
		if (errorListener.hasErrors())
		{
			Debug.logError("Parsing failed due to syntax errors in " + sourceName);
			return null;
		}
		return new AstBuilder().visit(tree);
	}
}
