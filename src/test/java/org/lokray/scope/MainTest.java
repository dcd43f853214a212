package org.lokray.scope;

import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.scope.dto.ScopeReportDTO;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest
{
	@TempDir
	Path tempDir;

	@Test
	void writes_report_next_to_input() throws IOException
	{
		Path input = tempDir.resolve("app.js");
		Files.writeString(input, "import x from 'm';\nexport function f() { return x; }\n");

		assertEquals(0, Main.run(new String[]{input.toString()}));

		Path output = tempDir.resolve("app.js.scope.json");
		assertTrue(Files.exists(output));
		ScopeReportDTO report = new Gson().fromJson(Files.readString(output), ScopeReportDTO.class);
		assertEquals("module", report.grammarMode);
		assertEquals("module", report.scopes.get(1).type);
	}

	@Test
	void writes_report_to_explicit_output() throws IOException
	{
		Path input = tempDir.resolve("lib.js");
		Path output = tempDir.resolve("out/lib.json");
		Files.writeString(input, "var a = 1;");

		assertEquals(0, Main.run(new String[]{"-t", "node", "-o", output.toString(), input.toString()}));
		assertTrue(Files.exists(output));
	}

	@Test
	void check_only_writes_nothing() throws IOException
	{
		Path input = tempDir.resolve("check.js");
		Files.writeString(input, "var a = 1;");

		assertEquals(0, Main.run(new String[]{"-k", input.toString()}));
		assertFalse(Files.exists(tempDir.resolve("check.js.scope.json")));
	}

	@Test
	void syntax_error_fails() throws IOException
	{
		Path input = tempDir.resolve("broken.js");
		Files.writeString(input, "var = ;");

		assertEquals(1, Main.run(new String[]{input.toString()}));
		assertFalse(Files.exists(tempDir.resolve("broken.js.scope.json")));
	}

	@Test
	void missing_input_file_fails()
	{
		assertEquals(1, Main.run(new String[]{tempDir.resolve("missing.js").toString()}));
	}

	@Test
	void graph_construction_failure_is_reported() throws IOException
	{
		Path input = tempDir.resolve("bad.js");
		Files.writeString(input, "import x from 'm';\nwith (x) { }\n");

		assertEquals(1, Main.run(new String[]{input.toString()}));
	}

	@Test
	void bad_arguments_show_help()
	{
		assertEquals(0, Main.run(new String[]{"--help"}));
		assertEquals(2, Main.run(new String[]{"-k"}));
	}
}
