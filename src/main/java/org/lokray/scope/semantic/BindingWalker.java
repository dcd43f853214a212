// File: src/main/java/org/lokray/scope/semantic/BindingWalker.java
package org.lokray.scope.semantic;

import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeKind;
import org.lokray.scope.ast.NodeRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Walks one program, opening a scope for every construct that introduces one, defining declared names
 * and recording references. Each scope resolves its references when the walk leaves its node.
 */
final class BindingWalker
{
	private final AnalysisOptions options;
	private final List<Scope> scopes = new ArrayList<>();
	private Scope current;
	private boolean innerMethodDefinition;

	BindingWalker(AnalysisOptions options)
	{
		this.options = options;
	}

	ScopeGraph walk(Node program)
	{
		visit(program);

		GlobalScope global = (GlobalScope) scopes.get(0);
		for (Scope scope : scopes)
		{
			for (Reference reference : scope.getReferences())
			{
				Variable resolved = reference.getResolved();
				reference.bindTo(resolved != null ? resolved.getScope() : declaringScope(reference, global));
			}
		}
		return new ScopeGraph(program, options, scopes);
	}

	/**
	 * The innermost scope around the reference whose declaration of the name it could see.
	 * Only dynamic scopes leave such references unresolved.
	 */
	private static Scope declaringScope(Reference reference, GlobalScope global)
	{
		for (Scope scope = reference.getFrom(); scope != null; scope = scope.getUpper())
		{
			Optional<Variable> variable = scope.getVariable(reference.getName());
			if (variable.isPresent() && scope.isValidResolution(reference, variable.get()))
			{
				return scope;
			}
		}
		return global;
	}

	// --- Scope stack ---

	private <T extends Scope> T nest(T scope)
	{
		scopes.add(scope);
		current = scope;
		return scope;
	}

	private Scope nest(ScopeType type, Node block)
	{
		return nest(new Scope(scopes.size(), type, current, block, false));
	}

	private void close(Node node)
	{
		while (current != null && current.getBlock() == node)
		{
			current = current.close(options.optimistic());
		}
	}

	// --- Dispatch ---

	private void visit(Node node)
	{
		if (node == null)
		{
			return;
		}
		switch (node.getKind())
		{
			case PROGRAM -> visitProgram(node);
			case IDENTIFIER -> current.referencing(node);
			case FUNCTION_DECLARATION, FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> visitFunction(node);
			case CLASS_DECLARATION, CLASS_EXPRESSION -> visitClass(node);
			case PROPERTY, METHOD_DEFINITION -> visitProperty(node);
			case VARIABLE_DECLARATION -> visitVariableDeclaration(node);
			case ASSIGNMENT_EXPRESSION -> visitAssignment(node);
			case UPDATE_EXPRESSION -> visitUpdate(node);
			case MEMBER_EXPRESSION -> visitMember(node);
			case CALL_EXPRESSION -> visitCall(node);
			case THIS_EXPRESSION -> current.getVariableScope().detectThis();
			case BLOCK_STATEMENT -> visitBlock(node);
			case WITH_STATEMENT -> visitWith(node);
			case SWITCH_STATEMENT -> visitSwitch(node);
			case CATCH_CLAUSE -> visitCatch(node);
			case FOR_STATEMENT -> visitFor(node);
			case FOR_IN_STATEMENT, FOR_OF_STATEMENT -> visitForIn(node);
			case IMPORT_DECLARATION -> visitImport(node);
			case EXPORT_NAMED_DECLARATION, EXPORT_DEFAULT_DECLARATION, EXPORT_ALL_DECLARATION -> visitExport(node);
			case EXPORT_SPECIFIER -> visit(node.get(NodeRole.LOCAL));
			case LABELED_STATEMENT -> visit(node.get(NodeRole.BODY));
			case BREAK_STATEMENT, CONTINUE_STATEMENT ->
			{
				// labels are not bindings
			}
			default -> visitChildren(node);
		}
	}

	private void visitChildren(Node node)
	{
		for (Node child : node.getChildren())
		{
			visit(child);
		}
	}

	private void visitPattern(Node pattern, boolean processRightHandNodes, BiConsumer<Node, PatternWalker.PatternInfo> callback)
	{
		PatternWalker walker = new PatternWalker(pattern, callback);
		walker.walk(pattern);
		if (processRightHandNodes)
		{
			for (Node rightHand : walker.getRightHandNodes())
			{
				visit(rightHand);
			}
		}
	}

	/**
	 * Records the write each enclosing default performs on {@code pattern}.
	 */
	private void referencingDefaultValue(Node pattern, List<Node> assignments, Reference.ImplicitGlobalCandidate candidate, boolean init)
	{
		for (Node assignment : assignments)
		{
			current.referencing(pattern, ReferenceFlag.WRITE, assignment.get(NodeRole.RIGHT), candidate,
					pattern != assignment.get(NodeRole.LEFT), init);
		}
	}

	private Reference.ImplicitGlobalCandidate implicitGlobalCandidate(Node pattern, Node node)
	{
		return current.isStrict() ? null : new Reference.ImplicitGlobalCandidate(pattern, node);
	}

	// --- Scope-introducing nodes ---

	private void visitProgram(Node node)
	{
		nest(new GlobalScope(scopes.size(), node));
		if (options.treatAsHostedModule())
		{
			// The wrapper function, not the global scope, holds the program's own strictness
			current.setStrict(false);
			nest(new FunctionScope(scopes.size(), current, node, false));
		}
		if (options.isEs6() && options.isModule())
		{
			nest(ScopeType.MODULE, node);
		}
		visitChildren(node);
		close(node);
	}

	private void visitFunction(Node node)
	{
		Node id = node.get(NodeRole.ID);
		if (node.is(NodeKind.FUNCTION_DECLARATION))
		{
			current.define(id, new Definition(DefinitionType.FUNCTION_NAME, id, node));
		}
		if (node.is(NodeKind.FUNCTION_EXPRESSION) && id != null)
		{
			nest(ScopeType.FUNCTION_EXPRESSION_NAME, node).define(id, new Definition(DefinitionType.FUNCTION_NAME, id, node));
		}
		nest(new FunctionScope(scopes.size(), current, node, innerMethodDefinition));

		for (Node parameter : node.getAll(NodeRole.PARAMS))
		{
			visitPattern(parameter, true, (pattern, info) ->
			{
				current.define(pattern, new Definition(DefinitionType.PARAMETER, pattern, node));
				referencingDefaultValue(pattern, info.assignments(), null, true);
			});
		}

		Node body = node.get(NodeRole.BODY);
		if (body.is(NodeKind.BLOCK_STATEMENT))
		{
			visitChildren(body);
		}
		else
		{
			visit(body);
		}
		close(node);
	}

	private void visitClass(Node node)
	{
		Node id = node.get(NodeRole.ID);
		if (node.is(NodeKind.CLASS_DECLARATION))
		{
			current.define(id, new Definition(DefinitionType.CLASS_NAME, id, node));
		}
		visit(node.get(NodeRole.SUPER_CLASS));

		nest(ScopeType.CLASS, node);
		if (id != null)
		{
			current.define(id, new Definition(DefinitionType.CLASS_NAME, id, node));
		}
		visit(node.get(NodeRole.BODY));
		close(node);
	}

	private void visitBlock(Node node)
	{
		if (options.isEs6())
		{
			nest(ScopeType.BLOCK, node);
		}
		visitChildren(node);
		close(node);
	}

	private void visitWith(Node node)
	{
		if (current.isStrict())
		{
			throw new ScopeGraphBuildException("'with' statements are not allowed in strict mode code", node);
		}
		visit(node.get(NodeRole.OBJECT));
		nest(new WithScope(scopes.size(), current, node));
		visit(node.get(NodeRole.BODY));
		close(node);
	}

	private void visitSwitch(Node node)
	{
		visit(node.get(NodeRole.DISCRIMINANT));
		if (options.isEs6())
		{
			nest(ScopeType.SWITCH, node);
		}
		for (Node switchCase : node.getAll(NodeRole.CASES))
		{
			visit(switchCase);
		}
		close(node);
	}

	private void visitCatch(Node node)
	{
		nest(ScopeType.CATCH, node);
		visitPattern(node.get(NodeRole.PARAM), true, (pattern, info) ->
		{
			current.define(pattern, new Definition(DefinitionType.CATCH_CLAUSE, pattern, node));
			referencingDefaultValue(pattern, info.assignments(), null, true);
		});
		visit(node.get(NodeRole.BODY));
		close(node);
	}

	private void visitFor(Node node)
	{
		Node init = node.get(NodeRole.INIT);
		if (init != null && init.is(NodeKind.VARIABLE_DECLARATION) && !"var".equals(init.getVariant()))
		{
			nest(ScopeType.FOR, node);
		}
		visitChildren(node);
		close(node);
	}

	private void visitForIn(Node node)
	{
		Node left = node.get(NodeRole.LEFT);
		Node right = node.get(NodeRole.RIGHT);
		if (left.is(NodeKind.VARIABLE_DECLARATION) && !"var".equals(left.getVariant()))
		{
			nest(ScopeType.FOR, node);
		}

		if (left.is(NodeKind.VARIABLE_DECLARATION))
		{
			visit(left);
			Node target = left.getAll(NodeRole.DECLARATIONS).get(0).get(NodeRole.ID);
			visitPattern(target, false, (pattern, info) ->
					current.referencing(pattern, ReferenceFlag.WRITE, right, null, true, true));
		}
		else
		{
			visitPattern(left, true, (pattern, info) ->
			{
				Reference.ImplicitGlobalCandidate candidate = implicitGlobalCandidate(pattern, node);
				referencingDefaultValue(pattern, info.assignments(), candidate, false);
				current.referencing(pattern, ReferenceFlag.WRITE, right, candidate, true, false);
			});
		}
		visit(right);
		visit(node.get(NodeRole.BODY));
		close(node);
	}

	// --- Declarations ---

	private void visitVariableDeclaration(Node node)
	{
		String kind = node.getVariant();
		Scope target = "var".equals(kind) ? current.getVariableScope() : current;
		for (Node declarator : node.getAll(NodeRole.DECLARATIONS))
		{
			Node init = declarator.get(NodeRole.INIT);
			visitPattern(declarator.get(NodeRole.ID), true, (pattern, info) ->
			{
				target.define(pattern, new Definition(DefinitionType.VARIABLE, pattern, declarator, node, kind));
				referencingDefaultValue(pattern, info.assignments(), null, true);
				if (init != null)
				{
					current.referencing(pattern, ReferenceFlag.WRITE, init, null, !info.topLevel(), true);
				}
			});
			visit(init);
		}
	}

	private void visitImport(Node node)
	{
		if (!options.isEs6() || !options.isModule())
		{
			throw new ScopeGraphBuildException("'import' declarations may only appear in module code", node);
		}
		if (current.getType() != ScopeType.MODULE)
		{
			throw new ScopeGraphBuildException("'import' declarations may only appear at the top level of a module", node);
		}
		for (Node specifier : node.getAll(NodeRole.SPECIFIERS))
		{
			visitPattern(specifier.get(NodeRole.LOCAL), false, (pattern, info) ->
					current.define(pattern, new Definition(DefinitionType.IMPORT_BINDING, pattern, specifier, node, null)));
		}
	}

	private void visitExport(Node node)
	{
		if (!options.isEs6() || !options.isModule())
		{
			throw new ScopeGraphBuildException("'export' declarations may only appear in module code", node);
		}
		if (current.getType() != ScopeType.MODULE)
		{
			throw new ScopeGraphBuildException("'export' declarations may only appear at the top level of a module", node);
		}
		// Re-exports name bindings of another module
		if (node.get(NodeRole.SOURCE) != null)
		{
			return;
		}
		Node declaration = node.get(NodeRole.DECLARATION);
		if (declaration != null)
		{
			visit(declaration);
			return;
		}
		visitChildren(node);
	}

	// --- Expressions ---

	private void visitProperty(Node node)
	{
		if (node.isComputed())
		{
			visit(node.get(NodeRole.KEY));
		}
		boolean methodDefinition = node.is(NodeKind.METHOD_DEFINITION);
		boolean previous = innerMethodDefinition;
		if (methodDefinition)
		{
			innerMethodDefinition = true;
		}
		visit(node.get(NodeRole.VALUE));
		if (methodDefinition)
		{
			innerMethodDefinition = previous;
		}
	}

	private void visitAssignment(Node node)
	{
		Node left = node.get(NodeRole.LEFT);
		Node right = node.get(NodeRole.RIGHT);
		if (left.getKind().isPattern())
		{
			if ("=".equals(node.getOperator()))
			{
				visitPattern(left, true, (pattern, info) ->
				{
					Reference.ImplicitGlobalCandidate candidate = implicitGlobalCandidate(pattern, node);
					referencingDefaultValue(pattern, info.assignments(), candidate, false);
					current.referencing(pattern, ReferenceFlag.WRITE, right, candidate, !info.topLevel(), false);
				});
			}
			else
			{
				current.referencing(left, ReferenceFlag.READ_WRITE, right, null, false, false);
			}
		}
		else
		{
			visit(left);
		}
		visit(right);
	}

	private void visitUpdate(Node node)
	{
		Node argument = node.get(NodeRole.ARGUMENT);
		if (argument.getKind().isPattern())
		{
			current.referencing(argument, ReferenceFlag.READ_WRITE, null, null, false, false);
		}
		else
		{
			visitChildren(node);
		}
	}

	private void visitMember(Node node)
	{
		visit(node.get(NodeRole.OBJECT));
		if (node.isComputed())
		{
			visit(node.get(NodeRole.PROPERTY));
		}
	}

	private void visitCall(Node node)
	{
		Node callee = node.get(NodeRole.CALLEE);
		if (callee.is(NodeKind.IDENTIFIER) && "eval".equals(callee.getName()))
		{
			current.getVariableScope().detectEval();
		}
		visitChildren(node);
	}
}
