// File: src/main/java/org/lokray/scope/ast/AstBuilder.java
package org.lokray.scope.ast;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.lokray.scope.parser.JavaScriptBaseVisitor;
import org.lokray.scope.parser.JavaScriptParser;

import java.util.List;

/**
 * Converts an ANTLR parse tree into the ESTree-shaped {@link Node} tree with parent links.
 * Array and object literals on the left of {@code =} (and in for-in/of heads) become patterns.
 */
public class AstBuilder extends JavaScriptBaseVisitor<Node>
{
	// --- Node factories ---

	private static Node node(NodeKind kind, ParserRuleContext ctx)
	{
		Token start = ctx.getStart();
		Token stop = ctx.getStop();
		int startIndex = Math.max(0, start.getStartIndex());
		int endIndex = stop != null && stop.getStopIndex() >= startIndex ? stop.getStopIndex() + 1 : startIndex;
		return new Node(kind, startIndex, endIndex, start.getLine(), start.getCharPositionInLine());
	}

	private static Node node(NodeKind kind, Token token)
	{
		return new Node(kind, token.getStartIndex(), token.getStopIndex() + 1, token.getLine(), token.getCharPositionInLine());
	}

	private static Node literal(Token token)
	{
		Node literal = node(NodeKind.LITERAL, token);
		literal.setName(token.getText());
		return literal;
	}

	private static Node identifierNamed(ParserRuleContext ctx)
	{
		Node identifier = node(NodeKind.IDENTIFIER, ctx);
		identifier.setName(ctx.getText());
		return identifier;
	}

	private static Node copyIdentifier(Node identifier)
	{
		Node copy = new Node(NodeKind.IDENTIFIER, identifier);
		copy.setName(identifier.getName());
		return copy;
	}

	private void addStatements(Node parent, JavaScriptParser.StatementListContext list)
	{
		if (list == null)
		{
			return;
		}
		for (JavaScriptParser.StatementContext statement : list.statement())
		{
			parent.add(NodeRole.BODY, visit(statement));
		}
	}

	private void addParameters(Node function, JavaScriptParser.FormalParameterListContext list)
	{
		if (list == null)
		{
			return;
		}
		for (JavaScriptParser.FormalParameterContext parameter : list.formalParameter())
		{
			function.add(NodeRole.PARAMS, visit(parameter));
		}
		if (list.restParameter() != null)
		{
			function.add(NodeRole.PARAMS, visit(list.restParameter()));
		}
	}

	private void addArguments(Node call, JavaScriptParser.ArgumentsContext arguments)
	{
		if (arguments == null)
		{
			return;
		}
		for (JavaScriptParser.ArgumentContext argument : arguments.argument())
		{
			Node value = visit(argument.singleExpression());
			if (argument.Ellipsis() != null)
			{
				Node spread = node(NodeKind.SPREAD_ELEMENT, argument);
				spread.add(NodeRole.ARGUMENT, value);
				value = spread;
			}
			call.add(NodeRole.ARGUMENTS, value);
		}
	}

	/**
	 * Sets the key of a property or method from its property name, marking computed keys.
	 */
	private void addKey(Node member, JavaScriptParser.PropertyNameContext ctx)
	{
		if (ctx.singleExpression() != null)
		{
			member.setComputed(true);
			member.add(NodeRole.KEY, visit(ctx.singleExpression()));
		}
		else if (ctx.identifierName() != null)
		{
			member.add(NodeRole.KEY, identifierNamed(ctx.identifierName()));
		}
		else
		{
			member.add(NodeRole.KEY, literal(ctx.getStart()));
		}
	}

	private Node function(NodeKind kind, ParserRuleContext ctx, JavaScriptParser.IdentifierContext id,
						  JavaScriptParser.FormalParameterListContext parameters, JavaScriptParser.FunctionBodyContext body)
	{
		Node function = node(kind, ctx);
		if (id != null)
		{
			function.add(NodeRole.ID, visit(id));
		}
		addParameters(function, parameters);
		function.add(NodeRole.BODY, visit(body));
		return function;
	}

	private Node accessor(ParserRuleContext ctx, JavaScriptParser.FormalParameterContext parameter, JavaScriptParser.FunctionBodyContext body)
	{
		Node function = node(NodeKind.FUNCTION_EXPRESSION, ctx);
		if (parameter != null)
		{
			function.add(NodeRole.PARAMS, visit(parameter));
		}
		function.add(NodeRole.BODY, visit(body));
		return function;
	}

	private Node member(NodeKind kind, ParserRuleContext ctx, JavaScriptParser.PropertyNameContext name, String variant, Node function)
	{
		Node member = node(kind, ctx);
		member.setVariant(variant);
		addKey(member, name);
		member.add(NodeRole.VALUE, function);
		return member;
	}

	private Node classNode(NodeKind kind, ParserRuleContext ctx, JavaScriptParser.IdentifierContext id, JavaScriptParser.ClassTailContext tail)
	{
		Node classNode = node(kind, ctx);
		if (id != null)
		{
			classNode.add(NodeRole.ID, visit(id));
		}
		if (tail.singleExpression() != null)
		{
			classNode.add(NodeRole.SUPER_CLASS, visit(tail.singleExpression()));
		}
		Node body = node(NodeKind.CLASS_BODY, tail);
		for (JavaScriptParser.ClassElementContext element : tail.classElement())
		{
			if (element.methodDefinition() == null)
			{
				continue;
			}
			Node method = visit(element.methodDefinition());
			if (element.Static() != null)
			{
				method.setStatic(true);
				if ("constructor".equals(method.getVariant()))
				{
					method.setVariant("method");
				}
			}
			body.add(NodeRole.BODY, method);
		}
		classNode.add(NodeRole.BODY, body);
		return classNode;
	}

	private Node unary(NodeKind kind, ParserRuleContext ctx, String operator, JavaScriptParser.SingleExpressionContext argument, boolean prefix)
	{
		Node unary = node(kind, ctx);
		unary.setOperator(operator);
		unary.setPrefix(prefix);
		unary.add(NodeRole.ARGUMENT, visit(argument));
		return unary;
	}

	private Node binary(NodeKind kind, ParserRuleContext ctx, List<JavaScriptParser.SingleExpressionContext> operands)
	{
		Node binary = node(kind, ctx);
		binary.setOperator(ctx.getChild(1).getText());
		binary.add(NodeRole.LEFT, visit(operands.get(0)));
		binary.add(NodeRole.RIGHT, visit(operands.get(1)));
		return binary;
	}

	/**
	 * Reinterprets an expression in binding position as a pattern.
	 */
	private Node toPattern(Node expression)
	{
		switch (expression.getKind())
		{
			case IDENTIFIER, MEMBER_EXPRESSION, ARRAY_PATTERN, OBJECT_PATTERN, ASSIGNMENT_PATTERN, REST_ELEMENT ->
			{
				return expression;
			}
			case ARRAY_EXPRESSION ->
			{
				Node pattern = new Node(NodeKind.ARRAY_PATTERN, expression);
				for (Node element : expression.getAll(NodeRole.ELEMENTS))
				{
					pattern.add(NodeRole.ELEMENTS, element == null ? null : toPattern(element));
				}
				return pattern;
			}
			case SPREAD_ELEMENT ->
			{
				Node rest = new Node(NodeKind.REST_ELEMENT, expression);
				rest.add(NodeRole.ARGUMENT, toPattern(expression.get(NodeRole.ARGUMENT)));
				return rest;
			}
			case OBJECT_EXPRESSION ->
			{
				Node pattern = new Node(NodeKind.OBJECT_PATTERN, expression);
				for (Node property : expression.getAll(NodeRole.PROPERTIES))
				{
					if (!"init".equals(property.getVariant()))
					{
						throw new AstBuildException("Invalid destructuring assignment target", property);
					}
					Node converted = new Node(NodeKind.PROPERTY, property);
					converted.setVariant("init");
					converted.setComputed(property.isComputed());
					converted.setShorthand(property.isShorthand());
					converted.add(NodeRole.KEY, property.get(NodeRole.KEY));
					converted.add(NodeRole.VALUE, toPattern(property.get(NodeRole.VALUE)));
					pattern.add(NodeRole.PROPERTIES, converted);
				}
				return pattern;
			}
			case ASSIGNMENT_EXPRESSION ->
			{
				if (!"=".equals(expression.getOperator()))
				{
					throw new AstBuildException("Invalid destructuring assignment target", expression);
				}
				Node pattern = new Node(NodeKind.ASSIGNMENT_PATTERN, expression);
				pattern.add(NodeRole.LEFT, toPattern(expression.get(NodeRole.LEFT)));
				pattern.add(NodeRole.RIGHT, expression.get(NodeRole.RIGHT));
				return pattern;
			}
			default -> throw new AstBuildException("Invalid assignment target", expression);
		}
	}

	private Node forInLeft(JavaScriptParser.ForInLeftContext ctx)
	{
		if (ctx.variableDeclarationList() != null)
		{
			return visit(ctx.variableDeclarationList());
		}
		return toPattern(visit(ctx.singleExpression()));
	}

	// --- Program & statements ---

	@Override
	public Node visitProgram(JavaScriptParser.ProgramContext ctx)
	{
		Node program = node(NodeKind.PROGRAM, ctx);
		addStatements(program, ctx.statementList());
		return program;
	}

	@Override
	public Node visitStatement(JavaScriptParser.StatementContext ctx)
	{
		return visit(ctx.getChild(0));
	}

	@Override
	public Node visitBlock(JavaScriptParser.BlockContext ctx)
	{
		Node block = node(NodeKind.BLOCK_STATEMENT, ctx);
		addStatements(block, ctx.statementList());
		return block;
	}

	@Override
	public Node visitVariableStatement(JavaScriptParser.VariableStatementContext ctx)
	{
		return visit(ctx.variableDeclarationList());
	}

	@Override
	public Node visitVariableDeclarationList(JavaScriptParser.VariableDeclarationListContext ctx)
	{
		Node declaration = node(NodeKind.VARIABLE_DECLARATION, ctx);
		declaration.setVariant(ctx.varModifier().getText());
		for (JavaScriptParser.VariableDeclarationContext declarator : ctx.variableDeclaration())
		{
			declaration.add(NodeRole.DECLARATIONS, visit(declarator));
		}
		return declaration;
	}

	@Override
	public Node visitVariableDeclaration(JavaScriptParser.VariableDeclarationContext ctx)
	{
		Node declarator = node(NodeKind.VARIABLE_DECLARATOR, ctx);
		declarator.add(NodeRole.ID, visit(ctx.bindingTarget()));
		if (ctx.singleExpression() != null)
		{
			declarator.add(NodeRole.INIT, visit(ctx.singleExpression()));
		}
		return declarator;
	}

	@Override
	public Node visitEmptyStatement(JavaScriptParser.EmptyStatementContext ctx)
	{
		return node(NodeKind.EMPTY_STATEMENT, ctx);
	}

	@Override
	public Node visitExpressionStatement(JavaScriptParser.ExpressionStatementContext ctx)
	{
		Node statement = node(NodeKind.EXPRESSION_STATEMENT, ctx);
		statement.add(NodeRole.EXPRESSION, visit(ctx.expressionSequence()));
		return statement;
	}

	@Override
	public Node visitIfStatement(JavaScriptParser.IfStatementContext ctx)
	{
		Node statement = node(NodeKind.IF_STATEMENT, ctx);
		statement.add(NodeRole.TEST, visit(ctx.expressionSequence()));
		statement.add(NodeRole.CONSEQUENT, visit(ctx.statement(0)));
		if (ctx.Else() != null)
		{
			statement.add(NodeRole.ALTERNATE, visit(ctx.statement(1)));
		}
		return statement;
	}

	@Override
	public Node visitDoStatement(JavaScriptParser.DoStatementContext ctx)
	{
		Node statement = node(NodeKind.DO_WHILE_STATEMENT, ctx);
		statement.add(NodeRole.BODY, visit(ctx.statement()));
		statement.add(NodeRole.TEST, visit(ctx.expressionSequence()));
		return statement;
	}

	@Override
	public Node visitWhileStatement(JavaScriptParser.WhileStatementContext ctx)
	{
		Node statement = node(NodeKind.WHILE_STATEMENT, ctx);
		statement.add(NodeRole.TEST, visit(ctx.expressionSequence()));
		statement.add(NodeRole.BODY, visit(ctx.statement()));
		return statement;
	}

	@Override
	public Node visitForStatement(JavaScriptParser.ForStatementContext ctx)
	{
		Node statement = node(NodeKind.FOR_STATEMENT, ctx);
		if (ctx.forInit() != null)
		{
			statement.add(NodeRole.INIT, visit(ctx.forInit().getChild(0)));
		}
		if (ctx.test != null)
		{
			statement.add(NodeRole.TEST, visit(ctx.test));
		}
		if (ctx.update != null)
		{
			statement.add(NodeRole.UPDATE, visit(ctx.update));
		}
		statement.add(NodeRole.BODY, visit(ctx.statement()));
		return statement;
	}

	@Override
	public Node visitForInStatement(JavaScriptParser.ForInStatementContext ctx)
	{
		Node statement = node(NodeKind.FOR_IN_STATEMENT, ctx);
		statement.add(NodeRole.LEFT, forInLeft(ctx.forInLeft()));
		statement.add(NodeRole.RIGHT, visit(ctx.expressionSequence()));
		statement.add(NodeRole.BODY, visit(ctx.statement()));
		return statement;
	}

	@Override
	public Node visitForOfStatement(JavaScriptParser.ForOfStatementContext ctx)
	{
		Node statement = node(NodeKind.FOR_OF_STATEMENT, ctx);
		statement.add(NodeRole.LEFT, forInLeft(ctx.forInLeft()));
		statement.add(NodeRole.RIGHT, visit(ctx.singleExpression()));
		statement.add(NodeRole.BODY, visit(ctx.statement()));
		return statement;
	}

	@Override
	public Node visitContinueStatement(JavaScriptParser.ContinueStatementContext ctx)
	{
		Node statement = node(NodeKind.CONTINUE_STATEMENT, ctx);
		if (ctx.identifier() != null)
		{
			statement.add(NodeRole.LABEL, visit(ctx.identifier()));
		}
		return statement;
	}

	@Override
	public Node visitBreakStatement(JavaScriptParser.BreakStatementContext ctx)
	{
		Node statement = node(NodeKind.BREAK_STATEMENT, ctx);
		if (ctx.identifier() != null)
		{
			statement.add(NodeRole.LABEL, visit(ctx.identifier()));
		}
		return statement;
	}

	@Override
	public Node visitReturnStatement(JavaScriptParser.ReturnStatementContext ctx)
	{
		Node statement = node(NodeKind.RETURN_STATEMENT, ctx);
		if (ctx.expressionSequence() != null)
		{
			statement.add(NodeRole.ARGUMENT, visit(ctx.expressionSequence()));
		}
		return statement;
	}

	@Override
	public Node visitWithStatement(JavaScriptParser.WithStatementContext ctx)
	{
		Node statement = node(NodeKind.WITH_STATEMENT, ctx);
		statement.add(NodeRole.OBJECT, visit(ctx.expressionSequence()));
		statement.add(NodeRole.BODY, visit(ctx.statement()));
		return statement;
	}

	@Override
	public Node visitSwitchStatement(JavaScriptParser.SwitchStatementContext ctx)
	{
		Node statement = node(NodeKind.SWITCH_STATEMENT, ctx);
		statement.add(NodeRole.DISCRIMINANT, visit(ctx.expressionSequence()));
		for (JavaScriptParser.SwitchCaseContext switchCase : ctx.switchCase())
		{
			statement.add(NodeRole.CASES, visit(switchCase));
		}
		return statement;
	}

	@Override
	public Node visitSwitchCase(JavaScriptParser.SwitchCaseContext ctx)
	{
		Node switchCase = node(NodeKind.SWITCH_CASE, ctx);
		if (ctx.Case() != null)
		{
			switchCase.add(NodeRole.TEST, visit(ctx.expressionSequence()));
		}
		if (ctx.statementList() != null)
		{
			for (JavaScriptParser.StatementContext statement : ctx.statementList().statement())
			{
				switchCase.add(NodeRole.CONSEQUENT, visit(statement));
			}
		}
		return switchCase;
	}

	@Override
	public Node visitLabelledStatement(JavaScriptParser.LabelledStatementContext ctx)
	{
		Node statement = node(NodeKind.LABELED_STATEMENT, ctx);
		statement.add(NodeRole.LABEL, visit(ctx.identifier()));
		statement.add(NodeRole.BODY, visit(ctx.statement()));
		return statement;
	}

	@Override
	public Node visitThrowStatement(JavaScriptParser.ThrowStatementContext ctx)
	{
		Node statement = node(NodeKind.THROW_STATEMENT, ctx);
		statement.add(NodeRole.ARGUMENT, visit(ctx.expressionSequence()));
		return statement;
	}

	@Override
	public Node visitTryStatement(JavaScriptParser.TryStatementContext ctx)
	{
		Node statement = node(NodeKind.TRY_STATEMENT, ctx);
		statement.add(NodeRole.BLOCK, visit(ctx.block()));
		if (ctx.catchProduction() != null)
		{
			statement.add(NodeRole.HANDLER, visit(ctx.catchProduction()));
		}
		if (ctx.finallyProduction() != null)
		{
			statement.add(NodeRole.FINALIZER, visit(ctx.finallyProduction().block()));
		}
		return statement;
	}

	@Override
	public Node visitCatchProduction(JavaScriptParser.CatchProductionContext ctx)
	{
		Node clause = node(NodeKind.CATCH_CLAUSE, ctx);
		clause.add(NodeRole.PARAM, visit(ctx.bindingTarget()));
		clause.add(NodeRole.BODY, visit(ctx.block()));
		return clause;
	}

	@Override
	public Node visitDebuggerStatement(JavaScriptParser.DebuggerStatementContext ctx)
	{
		return node(NodeKind.DEBUGGER_STATEMENT, ctx);
	}

	// --- Modules ---

	@Override
	public Node visitImportStatement(JavaScriptParser.ImportStatementContext ctx)
	{
		Node declaration = node(NodeKind.IMPORT_DECLARATION, ctx);
		JavaScriptParser.ImportClauseContext clause = ctx.importClause();
		if (clause != null)
		{
			if (clause.identifier() != null)
			{
				Node specifier = node(NodeKind.IMPORT_DEFAULT_SPECIFIER, clause.identifier());
				specifier.add(NodeRole.LOCAL, visit(clause.identifier()));
				declaration.add(NodeRole.SPECIFIERS, specifier);
			}
			if (clause.namespaceImport() != null)
			{
				Node specifier = node(NodeKind.IMPORT_NAMESPACE_SPECIFIER, clause.namespaceImport());
				specifier.add(NodeRole.LOCAL, visit(clause.namespaceImport().identifier()));
				declaration.add(NodeRole.SPECIFIERS, specifier);
			}
			if (clause.namedImports() != null)
			{
				for (JavaScriptParser.ImportSpecifierContext named : clause.namedImports().importSpecifier())
				{
					Node specifier = node(NodeKind.IMPORT_SPECIFIER, named);
					Node imported = identifierNamed(named.identifierName());
					specifier.add(NodeRole.IMPORTED, imported);
					specifier.add(NodeRole.LOCAL, named.identifier() != null ? visit(named.identifier()) : imported);
					declaration.add(NodeRole.SPECIFIERS, specifier);
				}
			}
		}
		declaration.add(NodeRole.SOURCE, literal(ctx.StringLiteral().getSymbol()));
		return declaration;
	}

	@Override
	public Node visitExportDefaultDeclaration(JavaScriptParser.ExportDefaultDeclarationContext ctx)
	{
		Node declaration = node(NodeKind.EXPORT_DEFAULT_DECLARATION, ctx);
		ParserRuleContext exported = ctx.functionDeclaration() != null ? ctx.functionDeclaration() : ctx.classDeclaration();
		declaration.add(NodeRole.DECLARATION, visit(exported));
		return declaration;
	}

	@Override
	public Node visitExportDefaultExpression(JavaScriptParser.ExportDefaultExpressionContext ctx)
	{
		Node declaration = node(NodeKind.EXPORT_DEFAULT_DECLARATION, ctx);
		declaration.add(NodeRole.DECLARATION, visit(ctx.singleExpression()));
		return declaration;
	}

	@Override
	public Node visitExportAllDeclaration(JavaScriptParser.ExportAllDeclarationContext ctx)
	{
		Node declaration = node(NodeKind.EXPORT_ALL_DECLARATION, ctx);
		declaration.add(NodeRole.SOURCE, literal(ctx.StringLiteral().getSymbol()));
		return declaration;
	}

	@Override
	public Node visitExportNamedSpecifiers(JavaScriptParser.ExportNamedSpecifiersContext ctx)
	{
		Node declaration = node(NodeKind.EXPORT_NAMED_DECLARATION, ctx);
		for (JavaScriptParser.ExportSpecifierContext named : ctx.exportClause().exportSpecifier())
		{
			Node specifier = node(NodeKind.EXPORT_SPECIFIER, named);
			Node local = identifierNamed(named.identifierName(0));
			specifier.add(NodeRole.LOCAL, local);
			specifier.add(NodeRole.EXPORTED, named.identifierName().size() > 1 ? identifierNamed(named.identifierName(1)) : local);
			declaration.add(NodeRole.SPECIFIERS, specifier);
		}
		TerminalNode source = ctx.StringLiteral();
		if (source != null)
		{
			declaration.add(NodeRole.SOURCE, literal(source.getSymbol()));
		}
		return declaration;
	}

	@Override
	public Node visitExportNamedDeclaration(JavaScriptParser.ExportNamedDeclarationContext ctx)
	{
		Node declaration = node(NodeKind.EXPORT_NAMED_DECLARATION, ctx);
		declaration.add(NodeRole.DECLARATION, visit(ctx.getChild(1)));
		return declaration;
	}

	// --- Functions & classes ---

	@Override
	public Node visitFunctionDeclaration(JavaScriptParser.FunctionDeclarationContext ctx)
	{
		return function(NodeKind.FUNCTION_DECLARATION, ctx, ctx.identifier(), ctx.formalParameterList(), ctx.functionBody());
	}

	@Override
	public Node visitFormalParameter(JavaScriptParser.FormalParameterContext ctx)
	{
		return visit(ctx.bindingElement());
	}

	@Override
	public Node visitRestParameter(JavaScriptParser.RestParameterContext ctx)
	{
		Node rest = node(NodeKind.REST_ELEMENT, ctx);
		rest.add(NodeRole.ARGUMENT, visit(ctx.bindingTarget()));
		return rest;
	}

	@Override
	public Node visitFunctionBody(JavaScriptParser.FunctionBodyContext ctx)
	{
		Node body = node(NodeKind.BLOCK_STATEMENT, ctx);
		addStatements(body, ctx.statementList());
		return body;
	}

	@Override
	public Node visitClassDeclaration(JavaScriptParser.ClassDeclarationContext ctx)
	{
		return classNode(NodeKind.CLASS_DECLARATION, ctx, ctx.identifier(), ctx.classTail());
	}

	@Override
	public Node visitGetterMethod(JavaScriptParser.GetterMethodContext ctx)
	{
		return member(NodeKind.METHOD_DEFINITION, ctx, ctx.propertyName(), "get", accessor(ctx, null, ctx.functionBody()));
	}

	@Override
	public Node visitSetterMethod(JavaScriptParser.SetterMethodContext ctx)
	{
		return member(NodeKind.METHOD_DEFINITION, ctx, ctx.propertyName(), "set", accessor(ctx, ctx.formalParameter(), ctx.functionBody()));
	}

	@Override
	public Node visitPlainMethod(JavaScriptParser.PlainMethodContext ctx)
	{
		Node function = function(NodeKind.FUNCTION_EXPRESSION, ctx, null, ctx.formalParameterList(), ctx.functionBody());
		Node method = member(NodeKind.METHOD_DEFINITION, ctx, ctx.propertyName(), "method", function);
		Node key = method.get(NodeRole.KEY);
		if (!method.isComputed() && "constructor".equals(key.getName()))
		{
			method.setVariant("constructor");
		}
		return method;
	}

	// --- Binding patterns ---

	@Override
	public Node visitBindingTarget(JavaScriptParser.BindingTargetContext ctx)
	{
		return visit(ctx.getChild(0));
	}

	@Override
	public Node visitObjectBindingPattern(JavaScriptParser.ObjectBindingPatternContext ctx)
	{
		Node pattern = node(NodeKind.OBJECT_PATTERN, ctx);
		for (JavaScriptParser.BindingPropertyContext property : ctx.bindingProperty())
		{
			pattern.add(NodeRole.PROPERTIES, visit(property));
		}
		return pattern;
	}

	@Override
	public Node visitKeyedBindingProperty(JavaScriptParser.KeyedBindingPropertyContext ctx)
	{
		Node property = node(NodeKind.PROPERTY, ctx);
		property.setVariant("init");
		addKey(property, ctx.propertyName());
		property.add(NodeRole.VALUE, visit(ctx.bindingElement()));
		return property;
	}

	@Override
	public Node visitShorthandBindingProperty(JavaScriptParser.ShorthandBindingPropertyContext ctx)
	{
		return shorthand(ctx, ctx.identifier(), ctx.singleExpression());
	}

	private Node shorthand(ParserRuleContext ctx, JavaScriptParser.IdentifierContext id, JavaScriptParser.SingleExpressionContext defaultValue)
	{
		Node property = node(NodeKind.PROPERTY, ctx);
		property.setVariant("init");
		property.setShorthand(true);
		Node key = visit(id);
		property.add(NodeRole.KEY, key);
		Node value = copyIdentifier(key);
		if (defaultValue != null)
		{
			Node assignment = node(NodeKind.ASSIGNMENT_PATTERN, ctx);
			assignment.add(NodeRole.LEFT, value);
			assignment.add(NodeRole.RIGHT, visit(defaultValue));
			value = assignment;
		}
		property.add(NodeRole.VALUE, value);
		return property;
	}

	@Override
	public Node visitArrayBindingPattern(JavaScriptParser.ArrayBindingPatternContext ctx)
	{
		Node pattern = node(NodeKind.ARRAY_PATTERN, ctx);
		List<JavaScriptParser.BindingSlotContext> slots = ctx.bindingSlot();
		int count = slots.size();
		// A trailing comma does not add a hole
		if (slots.get(count - 1).getChildCount() == 0)
		{
			count--;
		}
		for (int i = 0; i < count; i++)
		{
			JavaScriptParser.BindingSlotContext slot = slots.get(i);
			pattern.add(NodeRole.ELEMENTS, slot.getChildCount() == 0 ? null : visit(slot.getChild(0)));
		}
		return pattern;
	}

	@Override
	public Node visitBindingElement(JavaScriptParser.BindingElementContext ctx)
	{
		Node target = visit(ctx.bindingTarget());
		if (ctx.singleExpression() == null)
		{
			return target;
		}
		Node assignment = node(NodeKind.ASSIGNMENT_PATTERN, ctx);
		assignment.add(NodeRole.LEFT, target);
		assignment.add(NodeRole.RIGHT, visit(ctx.singleExpression()));
		return assignment;
	}

	@Override
	public Node visitBindingRestElement(JavaScriptParser.BindingRestElementContext ctx)
	{
		Node rest = node(NodeKind.REST_ELEMENT, ctx);
		rest.add(NodeRole.ARGUMENT, visit(ctx.bindingTarget()));
		return rest;
	}

	// --- Expressions ---

	@Override
	public Node visitExpressionSequence(JavaScriptParser.ExpressionSequenceContext ctx)
	{
		if (ctx.singleExpression().size() == 1)
		{
			return visit(ctx.singleExpression(0));
		}
		Node sequence = node(NodeKind.SEQUENCE_EXPRESSION, ctx);
		for (JavaScriptParser.SingleExpressionContext expression : ctx.singleExpression())
		{
			sequence.add(NodeRole.EXPRESSIONS, visit(expression));
		}
		return sequence;
	}

	@Override
	public Node visitFunctionExpression(JavaScriptParser.FunctionExpressionContext ctx)
	{
		return function(NodeKind.FUNCTION_EXPRESSION, ctx, ctx.identifier(), ctx.formalParameterList(), ctx.functionBody());
	}

	@Override
	public Node visitArrowFunctionExpression(JavaScriptParser.ArrowFunctionExpressionContext ctx)
	{
		Node arrow = node(NodeKind.ARROW_FUNCTION_EXPRESSION, ctx);
		JavaScriptParser.ArrowParametersContext parameters = ctx.arrowParameters();
		if (parameters.identifier() != null)
		{
			arrow.add(NodeRole.PARAMS, visit(parameters.identifier()));
		}
		else
		{
			addParameters(arrow, parameters.formalParameterList());
		}
		JavaScriptParser.ArrowBodyContext body = ctx.arrowBody();
		arrow.add(NodeRole.BODY, body.functionBody() != null ? visit(body.functionBody()) : visit(body.singleExpression()));
		return arrow;
	}

	@Override
	public Node visitClassExpression(JavaScriptParser.ClassExpressionContext ctx)
	{
		return classNode(NodeKind.CLASS_EXPRESSION, ctx, ctx.identifier(), ctx.classTail());
	}

	@Override
	public Node visitMemberIndexExpression(JavaScriptParser.MemberIndexExpressionContext ctx)
	{
		Node member = node(NodeKind.MEMBER_EXPRESSION, ctx);
		member.setComputed(true);
		member.add(NodeRole.OBJECT, visit(ctx.singleExpression()));
		member.add(NodeRole.PROPERTY, visit(ctx.expressionSequence()));
		return member;
	}

	@Override
	public Node visitMemberDotExpression(JavaScriptParser.MemberDotExpressionContext ctx)
	{
		Node member = node(NodeKind.MEMBER_EXPRESSION, ctx);
		member.add(NodeRole.OBJECT, visit(ctx.singleExpression()));
		member.add(NodeRole.PROPERTY, identifierNamed(ctx.identifierName()));
		return member;
	}

	@Override
	public Node visitNewExpression(JavaScriptParser.NewExpressionContext ctx)
	{
		Node expression = node(NodeKind.NEW_EXPRESSION, ctx);
		expression.add(NodeRole.CALLEE, visit(ctx.singleExpression()));
		addArguments(expression, ctx.arguments());
		return expression;
	}

	@Override
	public Node visitCallExpression(JavaScriptParser.CallExpressionContext ctx)
	{
		Node expression = node(NodeKind.CALL_EXPRESSION, ctx);
		expression.add(NodeRole.CALLEE, visit(ctx.singleExpression()));
		addArguments(expression, ctx.arguments());
		return expression;
	}

	@Override
	public Node visitPostIncrementExpression(JavaScriptParser.PostIncrementExpressionContext ctx)
	{
		return unary(NodeKind.UPDATE_EXPRESSION, ctx, "++", ctx.singleExpression(), false);
	}

	@Override
	public Node visitPostDecreaseExpression(JavaScriptParser.PostDecreaseExpressionContext ctx)
	{
		return unary(NodeKind.UPDATE_EXPRESSION, ctx, "--", ctx.singleExpression(), false);
	}

	@Override
	public Node visitPreIncrementExpression(JavaScriptParser.PreIncrementExpressionContext ctx)
	{
		return unary(NodeKind.UPDATE_EXPRESSION, ctx, "++", ctx.singleExpression(), true);
	}

	@Override
	public Node visitPreDecreaseExpression(JavaScriptParser.PreDecreaseExpressionContext ctx)
	{
		return unary(NodeKind.UPDATE_EXPRESSION, ctx, "--", ctx.singleExpression(), true);
	}

	@Override
	public Node visitDeleteExpression(JavaScriptParser.DeleteExpressionContext ctx)
	{
		return unary(NodeKind.UNARY_EXPRESSION, ctx, "delete", ctx.singleExpression(), true);
	}

	@Override
	public Node visitVoidExpression(JavaScriptParser.VoidExpressionContext ctx)
	{
		return unary(NodeKind.UNARY_EXPRESSION, ctx, "void", ctx.singleExpression(), true);
	}

	@Override
	public Node visitTypeofExpression(JavaScriptParser.TypeofExpressionContext ctx)
	{
		return unary(NodeKind.UNARY_EXPRESSION, ctx, "typeof", ctx.singleExpression(), true);
	}

	@Override
	public Node visitUnaryPlusExpression(JavaScriptParser.UnaryPlusExpressionContext ctx)
	{
		return unary(NodeKind.UNARY_EXPRESSION, ctx, "+", ctx.singleExpression(), true);
	}

	@Override
	public Node visitUnaryMinusExpression(JavaScriptParser.UnaryMinusExpressionContext ctx)
	{
		return unary(NodeKind.UNARY_EXPRESSION, ctx, "-", ctx.singleExpression(), true);
	}

	@Override
	public Node visitBitNotExpression(JavaScriptParser.BitNotExpressionContext ctx)
	{
		return unary(NodeKind.UNARY_EXPRESSION, ctx, "~", ctx.singleExpression(), true);
	}

	@Override
	public Node visitNotExpression(JavaScriptParser.NotExpressionContext ctx)
	{
		return unary(NodeKind.UNARY_EXPRESSION, ctx, "!", ctx.singleExpression(), true);
	}

	@Override
	public Node visitPowerExpression(JavaScriptParser.PowerExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitMultiplicativeExpression(JavaScriptParser.MultiplicativeExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitAdditiveExpression(JavaScriptParser.AdditiveExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitBitShiftExpression(JavaScriptParser.BitShiftExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitRelationalExpression(JavaScriptParser.RelationalExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitInstanceofExpression(JavaScriptParser.InstanceofExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitInExpression(JavaScriptParser.InExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitEqualityExpression(JavaScriptParser.EqualityExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitBitAndExpression(JavaScriptParser.BitAndExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitBitXOrExpression(JavaScriptParser.BitXOrExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitBitOrExpression(JavaScriptParser.BitOrExpressionContext ctx)
	{
		return binary(NodeKind.BINARY_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitLogicalAndExpression(JavaScriptParser.LogicalAndExpressionContext ctx)
	{
		return binary(NodeKind.LOGICAL_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitLogicalOrExpression(JavaScriptParser.LogicalOrExpressionContext ctx)
	{
		return binary(NodeKind.LOGICAL_EXPRESSION, ctx, ctx.singleExpression());
	}

	@Override
	public Node visitTernaryExpression(JavaScriptParser.TernaryExpressionContext ctx)
	{
		Node conditional = node(NodeKind.CONDITIONAL_EXPRESSION, ctx);
		conditional.add(NodeRole.TEST, visit(ctx.singleExpression(0)));
		conditional.add(NodeRole.CONSEQUENT, visit(ctx.singleExpression(1)));
		conditional.add(NodeRole.ALTERNATE, visit(ctx.singleExpression(2)));
		return conditional;
	}

	@Override
	public Node visitAssignmentExpression(JavaScriptParser.AssignmentExpressionContext ctx)
	{
		Node assignment = node(NodeKind.ASSIGNMENT_EXPRESSION, ctx);
		assignment.setOperator("=");
		Node target = toPattern(visit(ctx.singleExpression(0)));
		if (target.is(NodeKind.REST_ELEMENT))
		{
			throw new AstBuildException("Invalid assignment target", target);
		}
		assignment.add(NodeRole.LEFT, target);
		assignment.add(NodeRole.RIGHT, visit(ctx.singleExpression(1)));
		return assignment;
	}

	@Override
	public Node visitAssignmentOperatorExpression(JavaScriptParser.AssignmentOperatorExpressionContext ctx)
	{
		Node assignment = node(NodeKind.ASSIGNMENT_EXPRESSION, ctx);
		assignment.setOperator(ctx.assignmentOperator().getText());
		Node target = visit(ctx.singleExpression(0));
		if (!target.is(NodeKind.IDENTIFIER) && !target.is(NodeKind.MEMBER_EXPRESSION))
		{
			throw new AstBuildException("Invalid left-hand side in assignment", target);
		}
		assignment.add(NodeRole.LEFT, target);
		assignment.add(NodeRole.RIGHT, visit(ctx.singleExpression(1)));
		return assignment;
	}

	@Override
	public Node visitThisExpression(JavaScriptParser.ThisExpressionContext ctx)
	{
		return node(NodeKind.THIS_EXPRESSION, ctx);
	}

	@Override
	public Node visitSuperExpression(JavaScriptParser.SuperExpressionContext ctx)
	{
		return node(NodeKind.SUPER, ctx);
	}

	@Override
	public Node visitIdentifierExpression(JavaScriptParser.IdentifierExpressionContext ctx)
	{
		return visit(ctx.identifier());
	}

	@Override
	public Node visitLiteralExpression(JavaScriptParser.LiteralExpressionContext ctx)
	{
		return literal(ctx.getStart());
	}

	@Override
	public Node visitArrayLiteralExpression(JavaScriptParser.ArrayLiteralExpressionContext ctx)
	{
		return visit(ctx.arrayLiteral());
	}

	@Override
	public Node visitObjectLiteralExpression(JavaScriptParser.ObjectLiteralExpressionContext ctx)
	{
		return visit(ctx.objectLiteral());
	}

	@Override
	public Node visitParenthesizedExpression(JavaScriptParser.ParenthesizedExpressionContext ctx)
	{
		return visit(ctx.expressionSequence());
	}

	@Override
	public Node visitArrayLiteral(JavaScriptParser.ArrayLiteralContext ctx)
	{
		Node array = node(NodeKind.ARRAY_EXPRESSION, ctx);
		List<JavaScriptParser.ArrayElementContext> elements = ctx.arrayElement();
		int count = elements.size();
		if (elements.get(count - 1).singleExpression() == null)
		{
			count--;
		}
		for (int i = 0; i < count; i++)
		{
			JavaScriptParser.ArrayElementContext element = elements.get(i);
			if (element.singleExpression() == null)
			{
				array.add(NodeRole.ELEMENTS, null);
				continue;
			}
			Node value = visit(element.singleExpression());
			if (element.Ellipsis() != null)
			{
				Node spread = node(NodeKind.SPREAD_ELEMENT, element);
				spread.add(NodeRole.ARGUMENT, value);
				value = spread;
			}
			array.add(NodeRole.ELEMENTS, value);
		}
		return array;
	}

	@Override
	public Node visitObjectLiteral(JavaScriptParser.ObjectLiteralContext ctx)
	{
		Node object = node(NodeKind.OBJECT_EXPRESSION, ctx);
		for (JavaScriptParser.PropertyAssignmentContext property : ctx.propertyAssignment())
		{
			object.add(NodeRole.PROPERTIES, visit(property));
		}
		return object;
	}

	@Override
	public Node visitPropertyExpressionAssignment(JavaScriptParser.PropertyExpressionAssignmentContext ctx)
	{
		Node property = node(NodeKind.PROPERTY, ctx);
		property.setVariant("init");
		addKey(property, ctx.propertyName());
		property.add(NodeRole.VALUE, visit(ctx.singleExpression()));
		return property;
	}

	@Override
	public Node visitPropertyGetter(JavaScriptParser.PropertyGetterContext ctx)
	{
		return member(NodeKind.PROPERTY, ctx, ctx.propertyName(), "get", accessor(ctx, null, ctx.functionBody()));
	}

	@Override
	public Node visitPropertySetter(JavaScriptParser.PropertySetterContext ctx)
	{
		return member(NodeKind.PROPERTY, ctx, ctx.propertyName(), "set", accessor(ctx, ctx.formalParameter(), ctx.functionBody()));
	}

	@Override
	public Node visitMethodProperty(JavaScriptParser.MethodPropertyContext ctx)
	{
		Node function = function(NodeKind.FUNCTION_EXPRESSION, ctx, null, ctx.formalParameterList(), ctx.functionBody());
		return member(NodeKind.PROPERTY, ctx, ctx.propertyName(), "method", function);
	}

	@Override
	public Node visitPropertyShorthand(JavaScriptParser.PropertyShorthandContext ctx)
	{
		return shorthand(ctx, ctx.identifier(), ctx.singleExpression());
	}

	@Override
	public Node visitIdentifier(JavaScriptParser.IdentifierContext ctx)
	{
		return identifierNamed(ctx);
	}
}
