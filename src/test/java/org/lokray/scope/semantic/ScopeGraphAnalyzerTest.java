package org.lokray.scope.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.SourceParser;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeGraphAnalyzerTest
{
	private static ScopeGraph analyze(String src, AnalysisOptions options)
	{
		Node program = SourceParser.parse(src);
		assertNotNull(program);
		return new ScopeGraphAnalyzer().build(program, options);
	}

	private static ScopeGraph script(String src)
	{
		return analyze(src, AnalysisOptions.defaults());
	}

	private static ScopeGraph module(String src)
	{
		return analyze(src, AnalysisOptions.defaults().withGrammarMode(GrammarMode.MODULE));
	}

	private static Scope first(ScopeGraph graph, ScopeType type)
	{
		return graph.getScopes().stream()
				.filter(scope -> scope.getType() == type)
				.findFirst()
				.orElseThrow(() -> new AssertionError("no " + type + " scope"));
	}

	private static List<String> names(Scope scope)
	{
		return scope.getVariables().stream().map(Variable::getName).toList();
	}

	private static Reference reference(Scope scope, String name)
	{
		return scope.getReferences().stream()
				.filter(reference -> reference.getName().equals(name))
				.findFirst()
				.orElseThrow(() -> new AssertionError("no reference to " + name));
	}

	@Test
	void var_hoists_to_enclosing_function_scope()
	{
		ScopeGraph graph = script("function f() { { var a = 1; } }");
		assertEquals(List.of("arguments", "a"), names(first(graph, ScopeType.FUNCTION)));
		assertTrue(first(graph, ScopeType.BLOCK).getVariables().isEmpty());
		assertEquals(List.of("f"), names(graph.getGlobalScope()));
	}

	@Test
	void let_and_const_stay_in_their_block()
	{
		ScopeGraph graph = script("{ let b = 1; const c = 2; }");
		assertEquals(List.of("b", "c"), names(first(graph, ScopeType.BLOCK)));
		assertTrue(graph.getGlobalScope().getVariables().isEmpty());
	}

	@Test
	void function_bodies_do_not_open_block_scopes()
	{
		ScopeGraph graph = script("function f() { let x; }");
		assertEquals(2, graph.getScopes().size());
		assertEquals(List.of("arguments", "x"), names(first(graph, ScopeType.FUNCTION)));
	}

	@Test
	void arrow_functions_have_no_arguments_binding()
	{
		ScopeGraph graph = script("var g = (a) => a;");
		assertEquals(List.of("a"), names(first(graph, ScopeType.FUNCTION)));
	}

	@Test
	void reference_resolves_through_to_outer_declaration()
	{
		ScopeGraph graph = script("let y = 1; function g() { return y; }");
		Scope g = first(graph, ScopeType.FUNCTION);
		Reference y = reference(g, "y");

		assertSame(g, y.getFrom());
		assertSame(graph.getGlobalScope(), y.getResolved().getScope());
		assertSame(graph.getGlobalScope(), y.getBindingScope());
		assertTrue(g.getThrough().contains(y));
		assertTrue(y.getResolved().isCaptured());
	}

	@Test
	void unresolved_reference_is_bound_to_global_scope()
	{
		ScopeGraph graph = script("foo();");
		Reference foo = reference(graph.getGlobalScope(), "foo");
		assertFalse(foo.isResolved());
		assertSame(graph.getGlobalScope(), foo.getBindingScope());
		assertTrue(graph.getGlobalScope().getThrough().contains(foo));
	}

	@Test
	void sloppy_assignment_creates_implicit_global()
	{
		ScopeGraph sloppy = script("x = 1; function f() { y = 2; }");
		List<String> implicit = sloppy.getGlobalScope().getImplicitVariables().stream().map(Variable::getName).toList();
		assertEquals(List.of("x", "y"), implicit);

		ScopeGraph strict = script("'use strict'; x = 1;");
		assertTrue(strict.getGlobalScope().isStrict());
		assertTrue(strict.getGlobalScope().getImplicitVariables().isEmpty());
	}

	@Test
	void write_references_record_flags()
	{
		ScopeGraph graph = script("var a = 1; a += 2; a++; a;");
		List<Reference> refs = graph.getGlobalScope().getReferences();
		assertEquals(4, refs.size());
		assertTrue(refs.get(0).isWriteOnly());
		assertTrue(refs.get(0).isInit());
		assertTrue(refs.get(1).isReadWrite());
		assertTrue(refs.get(2).isReadWrite());
		assertTrue(refs.get(3).isReadOnly());
		refs.forEach(reference -> assertTrue(reference.isResolved()));
	}

	@Test
	void write_reference_keeps_assigned_expression()
	{
		ScopeGraph graph = script("var a; a = b;");
		Reference write = graph.getGlobalScope().getReferences().get(0);
		assertTrue(write.isWrite());
		assertFalse(write.isRead());
		assertEquals("b", write.getWriteExpression().getName());
		assertNull(graph.getGlobalScope().getReferences().get(1).getWriteExpression());
	}

	@Test
	void this_is_detected_in_the_enclosing_function()
	{
		ScopeGraph graph = script("function f() { { this.x = 1; } } function g() {}");
		assertTrue(graph.getScopes().get(1).isThisFound());
		assertFalse(graph.getScopes().get(3).isThisFound());
		assertFalse(graph.getGlobalScope().isThisFound());
	}

	@Test
	void default_parameter_cannot_see_body_declarations()
	{
		ScopeGraph graph = script("function f(a = b) { var b; }");
		Scope f = first(graph, ScopeType.FUNCTION);
		Reference b = reference(f, "b");
		assertFalse(b.isResolved());
		assertTrue(f.getThrough().contains(b));
		assertSame(graph.getGlobalScope(), b.getBindingScope());
	}

	@Test
	void default_parameter_sees_earlier_parameter()
	{
		ScopeGraph graph = script("function f(a, b = a) {}");
		Scope f = first(graph, ScopeType.FUNCTION);
		Reference a = f.getReferences().stream()
				.filter(reference -> reference.getName().equals("a") && reference.isReadOnly())
				.findFirst()
				.orElseThrow();
		assertSame(f, a.getBindingScope());
	}

	@Test
	void destructuring_declaration_binds_every_target()
	{
		ScopeGraph graph = script("var {a, b: [c, ...d], e = f} = o;");
		assertEquals(List.of("a", "c", "d", "e"), names(graph.getGlobalScope()));

		Reference f = reference(graph.getGlobalScope(), "f");
		assertTrue(f.isReadOnly());
		Reference c = reference(graph.getGlobalScope(), "c");
		assertTrue(c.isPartial());
	}

	@Test
	void catch_clause_opens_catch_scope()
	{
		ScopeGraph graph = script("try {} catch (e) { e; }");
		Scope catchScope = first(graph, ScopeType.CATCH);
		assertEquals(List.of("e"), names(catchScope));
		Reference e = reference(catchScope.getChildScopes().get(0), "e");
		assertSame(catchScope, e.getBindingScope());
	}

	@Test
	void class_name_is_bound_outside_and_inside_class_scope()
	{
		ScopeGraph graph = script("class A { m() { return A; } }");
		Scope classScope = first(graph, ScopeType.CLASS);
		assertEquals(List.of("A"), names(graph.getGlobalScope()));
		assertEquals(List.of("A"), names(classScope));
		assertTrue(classScope.isStrict());

		Reference a = reference(first(graph, ScopeType.FUNCTION), "A");
		assertSame(classScope, a.getBindingScope());
	}

	@Test
	void named_function_expression_gets_name_scope()
	{
		ScopeGraph graph = script("var f = function g() { g(); };");
		Scope nameScope = first(graph, ScopeType.FUNCTION_EXPRESSION_NAME);
		assertTrue(nameScope.isFunctionExpressionScope());
		assertEquals(List.of("g"), names(nameScope));

		Scope function = first(graph, ScopeType.FUNCTION);
		assertSame(nameScope, function.getUpper());
		assertSame(nameScope, reference(function, "g").getBindingScope());
		assertEquals(List.of(function, nameScope), graph.acquireAll(nameScope.getBlock()));
	}

	@Test
	void lexical_for_loop_opens_for_scope()
	{
		ScopeGraph graph = script("for (let i = 0; i < 1; i++) {} for (var j = 0; ; ) {}");
		assertEquals(List.of("i"), names(first(graph, ScopeType.FOR)));
		assertEquals(List.of("j"), names(graph.getGlobalScope()));
		assertEquals(1, graph.getScopes().stream().filter(scope -> scope.getType() == ScopeType.FOR).count());
	}

	@Test
	void switch_opens_switch_scope()
	{
		ScopeGraph graph = script("switch (x) { case 1: let y = 1; }");
		assertEquals(List.of("y"), names(first(graph, ScopeType.SWITCH)));
	}

	@Test
	void import_is_rejected_in_script_mode()
	{
		ScopeGraphBuildException e = assertThrows(ScopeGraphBuildException.class, () -> script("import x from 'm';"));
		assertNotNull(e.getNode());
		assertThrows(ScopeGraphBuildException.class, () -> script("export var a = 1;"));
	}

	@Test
	void import_defines_binding_in_module_scope()
	{
		ScopeGraph graph = module("import x, {y as z} from 'm'; x(z);");
		Scope moduleScope = first(graph, ScopeType.MODULE);
		assertEquals(List.of("x", "z"), names(moduleScope));
		assertTrue(moduleScope.isStrict());
		assertEquals(DefinitionType.IMPORT_BINDING, moduleScope.getVariable("z").orElseThrow().getDefinitions().get(0).type());
		assertSame(moduleScope, reference(moduleScope, "x").getBindingScope());
	}

	@Test
	void export_declaration_binds_in_module_scope()
	{
		ScopeGraph graph = module("export const a = 1; export default function f() {} export {a as b};");
		assertEquals(List.of("a", "f"), names(first(graph, ScopeType.MODULE)));
	}

	@Test
	void with_is_rejected_in_strict_code()
	{
		assertThrows(ScopeGraphBuildException.class, () -> script("'use strict'; with (o) {}"));
		assertThrows(ScopeGraphBuildException.class, () -> module("with (o) {}"));
		assertEquals(ScopeType.WITH, script("with (o) {}").getScopes().get(1).getType());
	}

	@Test
	void hosted_module_wraps_program_in_function_scope()
	{
		ScopeGraph graph = analyze("'use strict'; var a; a;", AnalysisOptions.defaults().withHostedModule(true));
		GlobalScope global = graph.getGlobalScope();
		Scope wrapper = first(graph, ScopeType.FUNCTION);

		assertFalse(global.isStrict());
		assertTrue(wrapper.isStrict());
		assertTrue(global.getVariables().isEmpty());
		assertEquals(List.of("arguments", "a"), names(wrapper));
		assertSame(graph.getRoot(), wrapper.getBlock());
		assertEquals(List.of(wrapper, global), graph.acquireAll(graph.getRoot()));
	}

	@Test
	void direct_eval_makes_scope_chain_dynamic()
	{
		ScopeGraph graph = script("function f() { function g() { eval('x'); } }");
		Scope g = graph.getScopes().get(2);
		Scope f = graph.getScopes().get(1);
		assertTrue(g.hasDirectCallToEval());
		assertTrue(g.isDynamic());
		assertTrue(f.isDynamic());
		assertFalse(f.hasDirectCallToEval());
	}

	@Test
	void with_taints_references_unless_optimistic()
	{
		String src = "var a; with (o) { a; }";

		ScopeGraph optimistic = script(src);
		Reference resolved = reference(optimistic.getScopes().get(2), "a");
		assertTrue(resolved.isResolved());
		assertFalse(resolved.isTainted());

		ScopeGraph pessimistic = analyze(src, AnalysisOptions.defaults().withOptimistic(false));
		Reference tainted = reference(pessimistic.getScopes().get(2), "a");
		assertTrue(tainted.isTainted());
		assertFalse(tainted.isResolved());
		assertSame(pessimistic.getGlobalScope(), tainted.getBindingScope());
	}

	@Test
	void dynamic_scope_references_bind_to_declaring_scope()
	{
		ScopeGraph graph = analyze("function f(a = b) { var b; eval(''); b; a; }", AnalysisOptions.defaults().withOptimistic(false));
		Scope f = first(graph, ScopeType.FUNCTION);
		List<Reference> refs = f.getReferences();

		refs.forEach(reference -> assertFalse(reference.isResolved()));
		Reference defaultB = refs.stream().filter(r -> r.getName().equals("b")).findFirst().orElseThrow();
		Reference bodyB = refs.stream().filter(r -> r.getName().equals("b")).reduce((x, y) -> y).orElseThrow();
		assertNotSame(defaultB, bodyB);
		assertSame(graph.getGlobalScope(), defaultB.getBindingScope());
		assertSame(f, bodyB.getBindingScope());
		assertSame(graph.getGlobalScope(), reference(f, "eval").getBindingScope());
	}

	@Test
	void lexical_globals_resolve_even_when_not_optimistic()
	{
		ScopeGraph graph = analyze("let a; a;", AnalysisOptions.defaults().withOptimistic(false));
		assertTrue(graph.getGlobalScope().getReferences().get(1).isResolved());
	}

	@Test
	void ecma5_has_no_block_scopes()
	{
		ScopeGraph graph = analyze("{ var a; }", AnalysisOptions.defaults().withEcmaVersion(5));
		assertEquals(1, graph.getScopes().size());
		assertThrows(ScopeGraphBuildException.class,
				() -> analyze("var a;", AnalysisOptions.defaults().withEcmaVersion(5).withGrammarMode(GrammarMode.MODULE)));
	}

	@Test
	void graph_exposes_read_only_views()
	{
		ScopeGraph graph = script("var a; a;");
		assertThrows(UnsupportedOperationException.class, () -> graph.getScopes().clear());
		assertThrows(UnsupportedOperationException.class, () -> graph.getGlobalScope().getVariables().clear());
		assertThrows(UnsupportedOperationException.class, () -> graph.getGlobalScope().getReferences().clear());
		graph.getScopes().forEach(scope -> assertTrue(scope.isClosed()));
	}
}
