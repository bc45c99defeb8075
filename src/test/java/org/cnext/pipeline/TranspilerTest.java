package org.cnext.pipeline;

import org.cnext.util.ErrorHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TranspilerTest
{
	private static final String MOTOR = String.join("\n",
			"scope Motor {",
			"    public enum State { IDLE, RUNNING }",
			"    public u8 speed <- 0;",
			"    public void start() {",
			"        this.speed <- 10;",
			"    }",
			"    void stop() {",
			"        this.speed <- 0;",
			"    }",
			"}",
			"",
			"Motor.State current <- Motor.State.IDLE;",
			"");

	private static TranspileResult transpile(TranspilerOptions options, String... namesAndSources)
	{
		Map<String, String> sources = new LinkedHashMap<>();
		for (int i = 0; i < namesAndSources.length; i += 2)
		{
			sources.put(namesAndSources[i], namesAndSources[i + 1]);
		}
		return new Transpiler(options, new ErrorHandler()).transpileSources(sources);
	}

	private static String output(TranspileResult result, String fileName)
	{
		return result.getOutput(fileName).orElseThrow(() -> new AssertionError("no output " + fileName)).getContent();
	}

	@Test
	void qualifiedEnumMemberIsMangled()
	{
		TranspileResult result = transpile(TranspilerOptions.defaults(), "motor.cnx", MOTOR);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "motor.c");
		assertTrue(c.contains("Motor_State current = Motor_State_IDLE;"), c);
		assertTrue(c.contains("#include \"motor.h\""), c);
	}

	@Test
	void scopeMembersAreFlattenedAndPrivateOnesAreStatic()
	{
		TranspileResult result = transpile(TranspilerOptions.defaults(), "motor.cnx", MOTOR);
		String c = output(result, "motor.c");

		assertTrue(c.contains("void Motor_start(void) {"), c);
		assertTrue(c.contains("static void Motor_stop(void) {"), c);
		assertTrue(c.contains("Motor_speed = 10;"), c);
		assertTrue(c.contains("uint8_t Motor_speed = 0;"), c);
	}

	@Test
	void negativeBinaryCaseLabelBecomesHex()
	{
		String source = String.join("\n",
				"i32 classify(i32 code) {",
				"    i32 result <- 0;",
				"    switch (code) {",
				"        case -0b1111 { result <- 1; }",
				"        case 0x10 || 3 { result <- 2; }",
				"        default { result <- 3; }",
				"    }",
				"    return result;",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "classify.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "classify.c");
		assertTrue(c.contains("switch (code) {"), c);
		assertTrue(c.contains("case -0xF: {"), c);
		assertTrue(c.contains("case 0x10:"), c);
		assertTrue(c.contains("case 3: {"), c);
		assertTrue(c.contains("default: {"), c);
		assertTrue(c.contains("break;"), c);
	}

	@Test
	void enumSwitchUsesBareMemberLabels()
	{
		String source = MOTOR + String.join("\n",
				"void report() {",
				"    switch (current) {",
				"        case IDLE { }",
				"        default(1) { }",
				"    }",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "motor.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		assertTrue(output(result, "motor.c").contains("case Motor_State_IDLE: {"));
	}

	@Test
	void compoundAssignmentClampsUnlessVariableWraps()
	{
		String source = String.join("\n",
				"u8 count <- 0;",
				"wrap u8 ticks <- 0;",
				"void tick() {",
				"    count +<- 1;",
				"    ticks +<- 1;",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "tick.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "tick.c");
		assertTrue(c.contains("count = cnx_clamp_add_u8(count, 1);"), c);
		assertTrue(c.contains("ticks += 1;"), c);
		assertTrue(c.contains("#include \"cnx_helpers.h\""), c);

		String helpers = output(result, "cnx_helpers.h");
		assertTrue(helpers.contains("cnx_clamp_add_u8"), helpers);
		assertFalse(helpers.contains("cnx_safe_div"), helpers);
	}

	@Test
	void noHelperHeaderWithoutDemand()
	{
		TranspileResult result = transpile(TranspilerOptions.defaults(), "motor.cnx", MOTOR);

		assertTrue(result.getOutput("cnx_helpers.h").isEmpty());
		assertFalse(output(result, "motor.c").contains("cnx_helpers.h"));
	}

	@Test
	void safeDivisionCallsTypedHelper()
	{
		String source = String.join("\n",
				"u32 ratio(u32 n, u32 d) {",
				"    u32 out <- 0;",
				"    safe_div(out, n, d, 0);",
				"    return out;",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "ratio.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "ratio.c");
		assertTrue(c.contains("uint32_t ratio(uint32_t n, uint32_t d) {"), c);
		assertTrue(c.contains("cnx_safe_div_u32(&out, n, d, 0);"), c);
		assertTrue(output(result, "cnx_helpers.h").contains("static inline bool cnx_safe_div_u32("));
	}

	@Test
	void writtenScalarParameterIsPassedByPointer()
	{
		String source = String.join("\n",
				"void bump(u8 value) {",
				"    value +<- 1;",
				"}",
				"u8 peek(u8 value) {",
				"    return value;",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "bump.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "bump.c");
		assertTrue(c.contains("void bump(uint8_t* value) {"), c);
		assertTrue(c.contains("uint8_t peek(uint8_t value) {"), c);
		assertTrue(output(result, "bump.h").contains("void bump(uint8_t* value);"));
	}

	@Test
	void entryPointKeepsBareNameAndHasNoPrototype()
	{
		String source = String.join("\n",
				"scope App {",
				"    public void init() { }",
				"}",
				"i32 main() {",
				"    App.init();",
				"    return 0;",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "app.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		assertTrue(output(result, "app.c").contains("int32_t main(void) {"));
		assertTrue(output(result, "app.c").contains("App_init();"));
		String header = output(result, "app.h");
		assertTrue(header.contains("void App_init(void);"), header);
		assertFalse(header.contains("main("), header);
	}

	@Test
	void cppModeUsesCppExtensions()
	{
		TranspilerOptions options = TranspilerOptions.builder().cppMode(true).build();
		TranspileResult result = transpile(options, "motor.cnx", MOTOR);

		assertTrue(result.getOutput("motor.cpp").isPresent());
		assertTrue(result.getOutput("motor.hpp").isPresent());
		assertTrue(result.getOutput("motor.c").isEmpty());
		assertTrue(output(result, "motor.cpp").contains("#include \"motor.hpp\""));
	}

	@Test
	void outputIsDeterministic()
	{
		String tick = "u8 count <- 0;\nvoid tick() {\n    count +<- 1;\n}\n";
		List<OutputFile> first = transpile(TranspilerOptions.defaults(), "motor.cnx", MOTOR, "tick.cnx", tick).getOutputs();
		List<OutputFile> second = transpile(TranspilerOptions.defaults(), "motor.cnx", MOTOR, "tick.cnx", tick).getOutputs();

		assertEquals(first.size(), second.size());
		for (int i = 0; i < first.size(); i++)
		{
			assertEquals(first.get(i).getFileName(), second.get(i).getFileName());
			assertEquals(first.get(i).getContent(), second.get(i).getContent());
		}
	}

	@Test
	void parallelGenerationMatchesSequential()
	{
		String[] sources = {
				"motor.cnx", MOTOR,
				"tick.cnx", "u16 count <- 0;\nvoid tick() {\n    count -<- 1;\n}\n",
				"scale.cnx", "i32 level <- 0;\nvoid scale(i32 factor) {\n    level *<- factor;\n}\n",
				"ratio.cnx", "u8 ratio(u8 n, u8 d) {\n    u8 out <- 0;\n    safe_mod(out, n, d, 1);\n    return out;\n}\n"
		};
		TranspileResult sequential = transpile(TranspilerOptions.defaults(), sources);
		TranspileResult parallel = transpile(TranspilerOptions.builder().jobs(4).build(), sources);

		assertTrue(sequential.isSuccess());
		assertEquals(sequential.getOutputs().size(), parallel.getOutputs().size());
		for (int i = 0; i < sequential.getOutputs().size(); i++)
		{
			assertEquals(sequential.getOutputs().get(i).getFileName(), parallel.getOutputs().get(i).getFileName());
			assertEquals(sequential.getOutputs().get(i).getContent(), parallel.getOutputs().get(i).getContent());
		}

		String helpers = output(parallel, "cnx_helpers.h");
		assertTrue(helpers.contains("cnx_clamp_sub_u16"));
		assertTrue(helpers.contains("cnx_clamp_mul_i32"));
		assertTrue(helpers.contains("cnx_safe_mod_u8"));
	}

	@Test
	void failedFileProducesNoOutputButOthersAreWritten(@TempDir Path dir) throws Exception
	{
		Path good = dir.resolve("good.cnx");
		Path bad = dir.resolve("bad.cnx");
		Files.writeString(good, "u8 level <- 3;\n");
		Files.writeString(bad, "u8 broken <- ;\n");
		Path out = dir.resolve("out");

		TranspileResult result = new Transpiler(TranspilerOptions.defaults(), new ErrorHandler()).transpile(List.of(good, bad));
		result.write(out);

		assertFalse(result.isSuccess());
		assertTrue(result.getFailedFiles().contains(bad.toString()));
		assertTrue(Files.exists(out.resolve("good.c")), "expected good.c to be generated");
		assertTrue(Files.exists(out.resolve("good.h")), "expected good.h to be generated");
		assertFalse(Files.exists(out.resolve("bad.c")));
		assertFalse(Files.exists(out.resolve("bad.h")));
	}

	@Test
	void outputsGoNextToSourcesWithoutOutputDirectory(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("tick.cnx");
		Files.writeString(source, "u8 count <- 0;\nvoid tick() {\n    count +<- 1;\n}\n");

		TranspileResult result = new Transpiler(TranspilerOptions.defaults(), new ErrorHandler()).transpile(List.of(source));
		result.write(null);

		assertTrue(Files.exists(dir.resolve("tick.c")));
		assertTrue(Files.exists(dir.resolve("tick.h")));
		assertTrue(Files.exists(dir.resolve("cnx_helpers.h")));
	}

	@Test
	void qualifiedEnumCaseLabelIsMangled()
	{
		String source = MOTOR + String.join("\n",
				"void report() {",
				"    switch (current) {",
				"        case Motor.State.RUNNING { }",
				"        default(1) { }",
				"    }",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "motor.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		assertTrue(output(result, "motor.c").contains("case Motor_State_RUNNING: {"));
	}

	@Test
	void fillInitializerRepeatsValueAndCollapsesZero()
	{
		String source = String.join("\n",
				"void f() {",
				"    u8 zeros[4] <- [0*];",
				"    u8 sevens[3] <- [7*];",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "fill.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "fill.c");
		assertTrue(c.contains("zeros[4] = {0};"), c);
		assertTrue(c.contains("sevens[3] = {7, 7, 7};"), c);
	}

	@Test
	void inferredArraySizeComesFromEachOwnInitializer()
	{
		String source = String.join("\n",
				"void f() {",
				"    u8 first[] <- [1, 2, 3];",
				"    u8 second[] <- [4, 5];",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "sizes.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "sizes.c");
		assertTrue(c.contains("first[3] = {1, 2, 3};"), c);
		assertTrue(c.contains("second[2] = {4, 5};"), c);
	}

	@Test
	void repeatedStringLengthInDeclarationIsComputedOnce()
	{
		String source = String.join("\n",
				"u32 twice(string<16> name) {",
				"    u32 n <- name.length + name.length;",
				"    return n;",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "twice.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "twice.c");
		assertTrue(c.contains("size_t n_name_len = strlen(name);"), c);
		assertEquals(1, occurrences(c, "strlen("), c);
	}

	@Test
	void repeatedStringLengthInAssignmentIsComputedOnce()
	{
		String source = String.join("\n",
				"u32 total <- 0;",
				"void measure(string<16> name) {",
				"    total <- name.length * name.length;",
				"}",
				"");
		TranspileResult result = transpile(TranspilerOptions.defaults(), "measure.cnx", source);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());

		String c = output(result, "measure.c");
		assertTrue(c.contains("size_t name_len = strlen(name);"), c);
		assertEquals(1, occurrences(c, "strlen("), c);
	}

	private static int occurrences(String text, String fragment)
	{
		return text.split(Pattern.quote(fragment), -1).length - 1;
	}
}
