package org.cnext;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest
{
	@Test
	void successfulBuildWritesOutputs(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("motor.cnx");
		Files.writeString(source, "u8 speed <- 0;\nvoid stop() {\n    speed <- 0;\n}\n");
		Path out = dir.resolve("gen");

		int code = Main.run(new String[]{"-o", out.toString(), "--emit-symbols", source.toString()});

		assertEquals(0, code);
		assertTrue(Files.exists(out.resolve("motor.c")));
		assertTrue(Files.exists(out.resolve("motor.h")));
		assertTrue(Files.readString(out.resolve("symbols.json")).contains("\"cName\": \"stop\""));
	}

	@Test
	void checkOnlyWritesNothing(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("motor.cnx");
		Files.writeString(source, "u8 speed <- 0;\n");
		Path out = dir.resolve("gen");

		assertEquals(0, Main.run(new String[]{"-k", "-o", out.toString(), source.toString()}));
		assertFalse(Files.exists(out.resolve("motor.c")));
	}

	@Test
	void failedFileGivesExitCodeOneAndDiagnostics(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("broken.cnx");
		Files.writeString(source, "void f() {\n    u8 x <- 1;\n    if (x) { }\n}\n");
		Path out = dir.resolve("gen");

		int code = Main.run(new String[]{"--emit-diagnostics", "-o", out.toString(), source.toString()});

		assertEquals(1, code);
		assertFalse(Files.exists(out.resolve("broken.c")));
		assertTrue(Files.readString(out.resolve("diagnostics.json")).contains("E0701"));
	}

	@Test
	void missingInputIsUsageError(@TempDir Path dir)
	{
		assertEquals(2, Main.run(new String[]{dir.resolve("absent.cnx").toString()}));
		assertEquals(2, Main.run(new String[]{"--frobnicate", "a.cnx"}));
		assertEquals(2, Main.run(new String[0]));
		assertEquals(0, Main.run(new String[]{"--help"}));
	}
}
