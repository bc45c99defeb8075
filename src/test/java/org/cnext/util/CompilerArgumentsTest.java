package org.cnext.util;

import org.cnext.codegen.helpers.OverflowMode;
import org.cnext.pipeline.TranspilerOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CompilerArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void noArgumentsShowsHelp()
	{
		assertTrue(CompilerArguments.parse(new String[0]).isHelpFlag());
	}

	@Test
	void defaultsForPlainInputs()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"motor.cnx", "app.cnx"});

		assertFalse(args.isHelpFlag());
		assertEquals(List.of(Paths.get("motor.cnx"), Paths.get("app.cnx")), args.getInputFiles());
		assertFalse(args.isCppMode());
		assertEquals(OverflowMode.CLAMP, args.getOverflowMode());
		assertEquals(TranspilerOptions.HeaderLayout.FULL, args.getHeaderLayout());
		assertNull(args.getOutputPath());
		assertEquals(1, args.getJobs());
		assertEquals("main", args.toOptions().getEntryPoint());
	}

	@Test
	void allOptionsAreParsed()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{
				"-v", "--cpp", "-k", "--emit-symbols", "--emit-diagnostics",
				"-e", "app_main", "-o", "build/gen", "-j", "4",
				"--type-header", "UartHandle=hal/uart.h",
				"--overflow=panic", "--header-layout=forward",
				"motor.cnx"
		});

		assertFalse(args.isHelpFlag());
		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
		assertTrue(args.isCppMode());
		assertTrue(args.isCheckOnly());
		assertTrue(args.isEmitSymbols());
		assertTrue(args.isEmitDiagnostics());
		assertEquals("app_main", args.getEntryPoint());
		assertEquals(Paths.get("build/gen"), args.getOutputPath());
		assertEquals(4, args.getJobs());
		assertEquals("hal/uart.h", args.getTypeHeaders().get("UartHandle"));
		assertEquals(OverflowMode.PANIC, args.getOverflowMode());
		assertEquals(TranspilerOptions.HeaderLayout.FORWARD, args.getHeaderLayout());
		assertEquals(List.of(Paths.get("motor.cnx")), args.getInputFiles());
	}

	@Test
	void optionsCarryIntoTranspilerSettings()
	{
		TranspilerOptions options = CompilerArguments.parse(new String[]{"--cpp", "--debug-mode", "-e", "boot", "a.cnx"}).toOptions();

		assertTrue(options.isCppMode());
		assertEquals(OverflowMode.PANIC, options.getOverflowMode());
		assertEquals("boot", options.getEntryPoint());
		assertEquals(".cpp", options.getImplementationExtension());
		assertEquals(".hpp", options.getHeaderExtension());
	}

	@Test
	void unknownOptionShowsHelp()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"--frobnicate", "a.cnx"});

		assertTrue(args.isHelpFlag());
		assertTrue(args.isUsageError());
		assertFalse(CompilerArguments.parse(new String[]{"--help"}).isUsageError());
	}

	@Test
	void invalidValuesShowHelp()
	{
		assertTrue(CompilerArguments.parse(new String[]{"--overflow=saturate", "a.cnx"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"--header-layout=inline", "a.cnx"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"-j", "zero", "a.cnx"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"-j", "0", "a.cnx"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"--type-header", "NoHeader", "a.cnx"}).isHelpFlag());
	}

	@Test
	void missingFlagArgumentShowsHelp()
	{
		assertTrue(CompilerArguments.parse(new String[]{"a.cnx", "-o"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"-e", "--cpp", "a.cnx"}).isHelpFlag());
	}

	@Test
	void versionFlagStopsParsing()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"--version", "--frobnicate"});

		assertTrue(args.isVersionFlag());
		assertFalse(args.isHelpFlag());
	}
}
