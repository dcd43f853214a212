package org.lokray.scope.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.junit.jupiter.api.Test;
import org.lokray.scope.ast.Node;
import org.lokray.scope.ast.SourceParser;
import org.lokray.scope.dto.IdentifierDTO;
import org.lokray.scope.dto.ScopeDTO;
import org.lokray.scope.dto.ScopeReportDTO;
import org.lokray.scope.semantic.ScopeAnalysisPass;
import org.lokray.scope.semantic.ScopeAnalysisResult;
import org.lokray.scope.semantic.TargetEnvironment;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScopeReportConverterTest
{
	private static ScopeReportDTO report(String src, TargetEnvironment target)
	{
		Node program = SourceParser.parse(src);
		assertNotNull(program);
		ScopeAnalysisResult result = new ScopeAnalysisPass(target).run(program);
		return ScopeReportConverter.toReport("test.js", result);
	}

	@Test
	void scopes_and_identifiers_are_reported()
	{
		ScopeReportDTO report = report("let y = 1;\nfunction g() { return y; }", TargetEnvironment.BROWSER);

		assertEquals("test.js", report.source);
		assertEquals("script", report.grammarMode);
		assertFalse(report.hostedModule);
		assertEquals(2, report.scopes.size());

		ScopeDTO global = report.scopes.get(0);
		assertEquals("global", global.type);
		assertNull(global.upper);
		assertEquals(List.of("y", "g"), global.variables.stream().map(v -> v.name).toList());
		assertTrue(global.variables.get(0).captured);
		assertEquals(List.of("variable"), global.variables.get(0).definitions);

		ScopeDTO function = report.scopes.get(1);
		assertEquals("function", function.type);
		assertEquals(Integer.valueOf(0), function.upper);
		assertEquals(List.of("y"), function.through);

		List<IdentifierDTO> ids = report.identifiers;
		assertEquals(List.of("y", "g", "y"), ids.stream().map(id -> id.name).toList());
		assertEquals(List.of("declaration", "declaration", "reference"), ids.stream().map(id -> id.role).toList());
		assertEquals(List.of(0, 0, 0), ids.stream().map(id -> id.scope).toList());
		assertEquals(2, ids.get(2).line);
		assertEquals(23, ids.get(2).column);
	}

	@Test
	void non_binding_identifiers_are_reported_as_other()
	{
		ScopeReportDTO report = report("var o = {}; o.p;", TargetEnvironment.BROWSER);
		IdentifierDTO property = report.identifiers.get(2);
		assertEquals("p", property.name);
		assertEquals("other", property.role);
	}

	@Test
	void implicit_globals_are_listed()
	{
		ScopeReportDTO report = report("leak = 1;", TargetEnvironment.BROWSER);
		assertEquals(List.of("leak"), report.implicitGlobals);
		assertEquals(List.of("leak"), report.scopes.get(0).through);
	}

	@Test
	void hosted_report_serializes_with_gson()
	{
		ScopeReportDTO report = report("var a; a;", TargetEnvironment.NODE);
		assertTrue(report.hostedModule);

		Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
		String json = gson.toJson(report);
		assertTrue(json.contains("\"type\": \"function\""), json);
		assertTrue(json.contains("\"upper\": null"), json);

		ScopeReportDTO back = gson.fromJson(json, ScopeReportDTO.class);
		assertEquals(report.scopes.size(), back.scopes.size());
		assertEquals(1, back.identifiers.get(0).scope);
	}
}
