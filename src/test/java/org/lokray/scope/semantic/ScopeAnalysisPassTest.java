package org.lokray.scope.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.NodeKind;
import org.lokray.scope.ast.NodeRole;
import org.lokray.scope.ast.NodeTraverser;
import org.lokray.scope.ast.SourceParser;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeAnalysisPassTest
{
	private static Node parse(String src)
	{
		Node program = SourceParser.parse(src);
		assertNotNull(program);
		return program;
	}

	private static List<Node> identifiers(Node root)
	{
		List<Node> found = new ArrayList<>();
		NodeTraverser.traverse(root, (node, parent) ->
		{
			if (node.is(NodeKind.IDENTIFIER))
			{
				found.add(node);
			}
		});
		return found;
	}

	@Test
	void every_identifier_gets_a_scope()
	{
		Node program = parse("var a = 1; function f(b) { let c = a + b; return { c }; } f(a).c;");
		ScopeAnalysisResult result = new ScopeAnalysisPass(TargetEnvironment.BROWSER).run(program);

		List<Node> identifiers = identifiers(program);
		assertEquals(identifiers.size(), result.attachments().size());
		for (Node identifier : identifiers)
		{
			assertTrue(result.attachments().isResolved(identifier), identifier.toString());
		}
		assertSame(program, result.root());
		assertNotNull(result.graph());
	}

	@Test
	void closure_use_is_attached_to_outer_scope()
	{
		Node program = parse("let y = 1; function g() { return y; }");
		ScopeAnalysisResult result = new ScopeAnalysisPass(TargetEnvironment.BROWSER).run(program);

		Node use = identifiers(program).get(2);
		assertEquals("y", use.getName());
		assertSame(result.graph().getGlobalScope(), result.attachments().scopeOf(use).orElseThrow());
	}

	@Test
	void graph_is_built_once_per_run()
	{
		AtomicInteger builds = new AtomicInteger();
		ScopeGraphAnalyzer analyzer = new ScopeGraphAnalyzer();
		GrammarModeProber prober = new GrammarModeProber((root, options) ->
		{
			builds.incrementAndGet();
			return analyzer.build(root, options);
		});
		ScopeAnalysisPass pass = new ScopeAnalysisPass(prober, TargetEnvironment.BROWSER);

		pass.run(parse("var a; a; a; function f() { a; }"));
		assertEquals(1, builds.get());
		assertNotNull(pass.getActiveGraph());
	}

	@Test
	void subtree_without_program_attaches_nothing()
	{
		Node program = parse("var a; a;");
		Node statement = program.getAll(NodeRole.BODY).get(1);
		ScopeAnalysisPass pass = new ScopeAnalysisPass(TargetEnvironment.BROWSER);

		ScopeAnalysisResult result = pass.run(statement);
		assertNull(result.graph());
		assertEquals(0, result.attachments().size());
	}

	@Test
	void graph_construction_failure_propagates()
	{
		Node program = parse("import x from 'm'; with (x) { }");
		ScopeAnalysisPass pass = new ScopeAnalysisPass(TargetEnvironment.BROWSER);

		assertThrows(GraphConstructionException.class, () -> pass.run(program));
	}

	@Test
	void node_target_analyzes_as_hosted_module()
	{
		Node program = parse("var a; a;");
		ScopeAnalysisResult result = new ScopeAnalysisPass(TargetEnvironment.NODE).run(program);

		Scope scope = result.attachments().scopeOf(identifiers(program).get(1)).orElseThrow();
		assertEquals(ScopeType.FUNCTION, scope.getType());
		assertTrue(result.graph().getOptions().treatAsHostedModule());
	}

	@Test
	void a_new_run_replaces_previous_state()
	{
		ScopeAnalysisPass pass = new ScopeAnalysisPass(TargetEnvironment.BROWSER_NO_EVAL);
		Node first = parse("var a;");
		Node second = parse("var b; b;");

		pass.run(first);
		ScopeAnalysisResult result = pass.run(second);

		assertTrue(result.graph().isBuiltFor(second));
		assertFalse(result.attachments().isResolved(identifiers(first).get(0)));
		assertEquals(2, result.attachments().size());
	}
}
