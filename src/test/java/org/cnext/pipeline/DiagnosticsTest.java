package org.cnext.pipeline;

import org.cnext.util.Diagnostic;
import org.cnext.util.ErrorHandler;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiagnosticsTest
{
	private final ErrorHandler errorHandler = new ErrorHandler();

	private TranspileResult transpile(String... namesAndSources)
	{
		Map<String, String> sources = new LinkedHashMap<>();
		for (int i = 0; i < namesAndSources.length; i += 2)
		{
			sources.put(namesAndSources[i], namesAndSources[i + 1]);
		}
		return new Transpiler(TranspilerOptions.defaults(), errorHandler).transpileSources(sources);
	}

	/**
	 * Transpiles one file that must fail and returns its single diagnostic.
	 */
	private Diagnostic expectFailure(String source)
	{
		TranspileResult result = transpile("test.cnx", source);
		assertFalse(result.isSuccess());
		assertTrue(result.getOutput("test.c").isEmpty());
		List<Diagnostic> diagnostics = errorHandler.getDiagnostics();
		assertEquals(1, diagnostics.size(), diagnostics.toString());
		assertEquals("test.cnx", diagnostics.get(0).file);
		return diagnostics.get(0);
	}

	@Test
	void syntaxErrorIsReported()
	{
		TranspileResult result = transpile("test.cnx", "u8 x <- ;\n");

		assertEquals(List.of("test.cnx"), List.copyOf(result.getFailedFiles()));
		Diagnostic d = errorHandler.getDiagnostics().get(0);
		assertEquals("E0001", d.code);
		assertEquals(1, d.line);
	}

	@Test
	void privateScopeMemberIsNotVisibleOutside()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"scope Motor {",
				"    u8 speed <- 0;",
				"}",
				"void run() {",
				"    u8 s <- Motor.speed;",
				"}",
				""));
		assertEquals("E0402", d.code);
		assertTrue(d.message.contains("'speed'"), d.message);
		assertEquals(5, d.line);
	}

	@Test
	void bareScopeMemberNeedsThis()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"scope Motor {",
				"    u8 speed <- 0;",
				"    void stop() {",
				"        speed <- 0;",
				"    }",
				"}",
				""));
		assertEquals("E0401", d.code);
		assertTrue(d.hint.contains("this.speed"), d.hint);
	}

	@Test
	void ambiguousEnumMemberListsCandidates()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"enum Light { RED, OFF }",
				"enum Color { RED, GREEN }",
				"void paint() {",
				"    u8 level <- RED;",
				"}",
				""));
		assertEquals("E0424", d.code);
		assertEquals("'RED' is ambiguous: it could be Color.RED, Light.RED", d.message);
	}

	@Test
	void uniqueEnumMemberResolvesBare()
	{
		TranspileResult result = transpile("test.cnx", String.join("\n",
				"enum Color { RED, GREEN }",
				"Color paint <- GREEN;",
				""));
		assertTrue(result.isSuccess(), errorHandler.getDiagnostics().toString());
		assertTrue(result.getOutput("test.c").orElseThrow().getContent().contains("Color paint = Color_GREEN;"));
	}

	@Test
	void conditionMustBeBoolean()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void check() {",
				"    u8 x <- 1;",
				"    if (x) {",
				"        x <- 2;",
				"    }",
				"}",
				""));
		assertEquals("E0701", d.code);
	}

	@Test
	void conditionMustNotCallFunctions()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"bool ready() {",
				"    return true;",
				"}",
				"void check() {",
				"    while (ready()) { }",
				"}",
				""));
		assertEquals("E0702", d.code);
		assertTrue(d.hint.contains("store the result"), d.hint);
	}

	@Test
	void returnInsideCriticalIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"u8 shared <- 0;",
				"void update() {",
				"    critical {",
				"        shared <- 1;",
				"        return;",
				"    }",
				"}",
				""));
		assertEquals("E0853", d.code);
	}

	@Test
	void defineWithValueIsRejected()
	{
		Diagnostic d = expectFailure("#define LIMIT 10\n");
		assertEquals("E0502", d.code);
		assertTrue(d.hint.contains("const u32 LIMIT <- 10;"), d.hint);
	}

	@Test
	void functionMacroIsRejected()
	{
		Diagnostic d = expectFailure("#define SQUARE(x) ((x) * (x))\n");
		assertEquals("E0501", d.code);
	}

	@Test
	void flagDefinePassesThrough()
	{
		TranspileResult result = transpile("test.cnx", "#define FEATURE_X\nu8 level <- 0;\n");
		assertTrue(result.isSuccess(), errorHandler.getDiagnostics().toString());
		assertTrue(result.getOutput("test.c").orElseThrow().getContent().contains("#define FEATURE_X"));
	}

	@Test
	void implementationIncludeIsRejected()
	{
		Diagnostic d = expectFailure("#include \"driver.c\"\nu8 level <- 0;\n");
		assertEquals("E0503", d.code);
	}

	@Test
	void duplicateAcrossFilesFailsOnlyTheLaterFile()
	{
		TranspileResult result = transpile(
				"first.cnx", "u8 counter <- 0;\n",
				"second.cnx", "u8 other <- 0;\nu8 counter <- 1;\n");

		assertEquals(List.of("second.cnx"), List.copyOf(result.getFailedFiles()));
		assertTrue(result.getOutput("first.c").isPresent());
		assertTrue(result.getOutput("second.c").isEmpty());
		Diagnostic d = errorHandler.getDiagnostics().get(0);
		assertEquals("E0101", d.code);
		assertEquals("second.cnx", d.file);
		assertTrue(d.hint.contains("first.cnx"), d.hint);
		// The failed file's other symbols are rolled back
		assertTrue(result.getRegistry().findVariable("other").isEmpty());
	}

	@Test
	void duplicateLocalIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f() {",
				"    u8 a <- 0;",
				"    u8 a <- 1;",
				"}",
				""));
		assertEquals("E0101", d.code);
	}

	@Test
	void duplicateCaseLabelIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f(u8 code) {",
				"    switch (code) {",
				"        case 1 { }",
				"        case 0x1 || 1 { }",
				"    }",
				"}",
				""));
		assertEquals("E0101", d.code);
	}

	@Test
	void defaultCountMustMatchUnhandledMembers()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"enum Mode { OFF, SLOW, FAST }",
				"Mode mode <- Mode.OFF;",
				"void f() {",
				"    switch (mode) {",
				"        case OFF { }",
				"        default(1) { }",
				"    }",
				"}",
				""));
		assertEquals("E0104", d.code);
	}

	@Test
	void readOnlyRegisterMemberCannotBeWritten()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"register GPIO @ 0x40000000 {",
				"    DATA: u32 rw @ 0x00,",
				"    STATUS: u32 ro @ 0x04,",
				"}",
				"void f() {",
				"    GPIO.STATUS <- 1;",
				"}",
				""));
		assertEquals("E0403", d.code);
	}

	@Test
	void bitmapWidthsMustFillBackingType()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"bitmap8 Flags {",
				"    ready,",
				"    mode[3],",
				"}",
				""));
		assertEquals("E0405", d.code);
	}

	@Test
	void unknownTypeIsReported()
	{
		Diagnostic d = expectFailure("Widget w;\n");
		assertEquals("E0102", d.code);
	}

	@Test
	void diagnosticsDoNotLeakAcrossHealthyFiles()
	{
		TranspileResult result = transpile(
				"good.cnx", "u8 level <- 0;\n",
				"bad.cnx", "void f() {\n    u8 x <- 1;\n    if (x) { }\n}\n");

		assertTrue(result.getOutput("good.c").isPresent());
		assertFalse(errorHandler.hasErrors("good.cnx"));
		assertTrue(errorHandler.hasErrors("bad.cnx"));
	}

	@Test
	void divisionByLiteralZeroIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f(u32 a) {",
				"    u32 r <- a / 0;",
				"}",
				""));
		assertEquals("E0800", d.code);
		assertEquals("Division by zero", d.message);
		assertEquals(2, d.line);
		assertTrue(d.hint.contains("safe_div()"), d.hint);
	}

	@Test
	void moduloByConstantZeroIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f(u32 a) {",
				"    const u32 ZERO <- 0;",
				"    u32 r <- a % ZERO;",
				"}",
				""));
		assertEquals("E0802", d.code);
		assertEquals(3, d.line);
	}

	@Test
	void compoundDivisionByZeroIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f() {",
				"    u32 r <- 10;",
				"    r /<- 0x0;",
				"}",
				""));
		assertEquals("E0800", d.code);
		assertEquals(3, d.line);
	}

	@Test
	void nonZeroConstantDivisorPasses()
	{
		TranspileResult result = transpile("test.cnx", String.join("\n",
				"void f(u32 a) {",
				"    const u32 STEP <- 4;",
				"    u32 r <- a / STEP;",
				"}",
				""));
		assertTrue(result.isSuccess(), errorHandler.getDiagnostics().toString());
	}

	@Test
	void floatModuloIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f(f32 a) {",
				"    f32 r <- a % 2.0;",
				"}",
				""));
		assertEquals("E0804", d.code);
		assertEquals(2, d.line);
		assertTrue(d.hint.contains("fmod()"), d.hint);
	}

	@Test
	void floatModuloAssignmentIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f() {",
				"    f64 total <- 10.0;",
				"    total %<- 3;",
				"}",
				""));
		assertEquals("E0804", d.code);
		assertEquals(3, d.line);
	}

	@Test
	void readBeforeAssignmentIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f() {",
				"    u32 x;",
				"    u32 y <- x + 1;",
				"}",
				""));
		assertEquals("E0381", d.code);
		assertEquals("use of uninitialized variable 'x'", d.message);
		assertEquals(3, d.line);
	}

	@Test
	void assignmentInOnlyOneBranchIsNotEnough()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f(bool flag) {",
				"    u32 x;",
				"    if (flag) { x <- 1; }",
				"    u32 y <- x;",
				"}",
				""));
		assertEquals("E0381", d.code);
		assertEquals(4, d.line);
	}

	@Test
	void assignmentInBothBranchesInitializes()
	{
		TranspileResult result = transpile("test.cnx", String.join("\n",
				"void f(bool flag) {",
				"    u32 x;",
				"    if (flag) { x <- 1; } else { x <- 2; }",
				"    u32 y <- x;",
				"}",
				""));
		assertTrue(result.isSuccess(), errorHandler.getDiagnostics().toString());
	}

	@Test
	void variablePassedToCallCountsAsAssigned()
	{
		TranspileResult result = transpile("test.cnx", String.join("\n",
				"void fill(u32 target) {",
				"    target <- 5;",
				"}",
				"void f() {",
				"    u32 x;",
				"    fill(x);",
				"    u32 y <- x;",
				"}",
				""));
		assertTrue(result.isSuccess(), errorHandler.getDiagnostics().toString());
	}

	@Test
	void structFieldsAreTrackedSeparately()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"struct Point { i32 x; i32 y; }",
				"void f() {",
				"    Point p;",
				"    p.x <- 1;",
				"    i32 a <- p.x;",
				"    i32 b <- p.y;",
				"}",
				""));
		assertEquals("E0381", d.code);
		assertEquals("use of uninitialized variable 'p.y'", d.message);
		assertEquals(6, d.line);
	}

	@Test
	void countedLoopInitializesArray()
	{
		TranspileResult result = transpile("test.cnx", String.join("\n",
				"void f() {",
				"    u8 buf[4];",
				"    for (u8 i <- 0; i < 4; i +<- 1) {",
				"        buf[i] <- 0;",
				"    }",
				"    u8 first <- buf[0];",
				"}",
				""));
		assertTrue(result.isSuccess(), errorHandler.getDiagnostics().toString());
	}

	@Test
	void whileLoopMayNotInitialize()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f(bool run) {",
				"    u8 level;",
				"    while (run) {",
				"        level <- 3;",
				"    }",
				"    u8 copy <- level;",
				"}",
				""));
		assertEquals("E0381", d.code);
		assertEquals(6, d.line);
	}

	@Test
	void fillInitializerNeedsSizedArray()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"void f() {",
				"    u8 buf[] <- [0*];",
				"}",
				""));
		assertEquals("E0104", d.code);
		assertTrue(d.message.contains("constant size"), d.message);
	}

	@Test
	void unknownQualifiedCaseLabelIsRejected()
	{
		Diagnostic d = expectFailure(String.join("\n",
				"enum Mode { SLOW, FAST }",
				"void f(Mode mode) {",
				"    switch (mode) {",
				"        case Mode.TURBO { }",
				"        default { }",
				"    }",
				"}",
				""));
		assertEquals("E0401", d.code);
		assertTrue(d.message.contains("'TURBO' is not a member of Mode"), d.message);
		assertEquals(4, d.line);
	}
}
