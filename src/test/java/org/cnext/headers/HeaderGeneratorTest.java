package org.cnext.headers;

import org.cnext.pipeline.TranspileResult;
import org.cnext.pipeline.Transpiler;
import org.cnext.pipeline.TranspilerOptions;
import org.cnext.util.ErrorHandler;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HeaderGeneratorTest
{
	private static final String MOTOR = String.join("\n",
			"scope Motor {",
			"    public enum State { IDLE, RUNNING }",
			"    public u8 speed <- 0;",
			"    u8 hidden <- 0;",
			"    public void start() { }",
			"    void stop() { }",
			"}",
			"",
			"struct Point { i32 x; i32 y; }",
			"",
			"Motor.State current <- Motor.State.IDLE;",
			"",
			"i32 distance(Point p) {",
			"    return p.x;",
			"}",
			"");

	private static String header(TranspilerOptions options, String name, String source, String headerName)
	{
		Map<String, String> sources = new LinkedHashMap<>();
		sources.put(name, source);
		TranspileResult result = new Transpiler(options, new ErrorHandler()).transpileSources(sources);
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());
		return result.getOutput(headerName).orElseThrow(() -> new AssertionError("no output " + headerName)).getContent();
	}

	@Test
	void headerDeclaresOnlyExportedSymbols()
	{
		String h = header(TranspilerOptions.defaults(), "motor.cnx", MOTOR, "motor.h");

		assertTrue(h.startsWith("/**\n * Generated by cnext-transpiler from motor.cnx\n */"), h);
		assertTrue(h.contains("#ifndef MOTOR_H\n#define MOTOR_H"), h);
		assertTrue(h.contains("#include <stdint.h>\n#include <stdbool.h>"), h);
		assertTrue(h.contains("extern uint8_t Motor_speed;"), h);
		assertTrue(h.contains("extern Motor_State current;"), h);
		assertTrue(h.contains("void Motor_start(void);"), h);
		assertFalse(h.contains("Motor_stop"), h);
		assertFalse(h.contains("Motor_hidden"), h);
		assertTrue(h.trim().endsWith("#endif /* MOTOR_H */"), h);
	}

	@Test
	void sectionsAppearInOrder()
	{
		String h = header(TranspilerOptions.defaults(), "motor.cnx", MOTOR, "motor.h");

		int enums = h.indexOf("/* Enumerations */");
		int forwards = h.indexOf("/* Forward declarations */");
		int types = h.indexOf("/* Type definitions */");
		int variables = h.indexOf("/* External variables */");
		int prototypes = h.indexOf("/* Function prototypes */");
		assertTrue(enums > 0 && enums < forwards && forwards < types && types < variables && variables < prototypes, h);
		assertTrue(h.contains("Motor_State_IDLE = 0"), h);
		assertTrue(h.contains("typedef struct Point Point;"), h);
		// No callbacks, externals or ISR: those sections are omitted
		assertFalse(h.contains("/* Callback typedefs */"), h);
		assertFalse(h.contains("/* External type dependencies"), h);
	}

	@Test
	void cHeaderWrapsDeclarationsForCppCallers()
	{
		String h = header(TranspilerOptions.defaults(), "motor.cnx", MOTOR, "motor.h");

		assertTrue(h.contains("#ifdef __cplusplus\nextern \"C\" {\n#endif"), h);
		assertTrue(h.contains("#ifdef __cplusplus\n}\n#endif"), h);
	}

	@Test
	void cppHeaderHasNoExternCBlock()
	{
		TranspilerOptions options = TranspilerOptions.builder().cppMode(true).build();
		String h = header(options, "motor.cnx", MOTOR, "motor.hpp");

		assertTrue(h.contains("#ifndef MOTOR_HPP"), h);
		assertFalse(h.contains("extern \"C\""), h);
		assertTrue(h.contains("void Motor_start(void);"), h);
	}

	@Test
	void prototypesMatchDefinitions()
	{
		Map<String, String> sources = new LinkedHashMap<>();
		sources.put("motor.cnx", MOTOR);
		TranspileResult result = new Transpiler(TranspilerOptions.defaults(), new ErrorHandler()).transpileSources(sources);
		String c = result.getOutput("motor.c").orElseThrow().getContent();
		String h = result.getOutput("motor.h").orElseThrow().getContent();

		for (String signature : new String[]{"void Motor_start(void)", "int32_t distance(const Point* p)"})
		{
			assertTrue(h.contains(signature + ";"), h);
			assertTrue(c.contains(signature + " {"), c);
		}
	}

	@Test
	void fileWithoutExportsGetsNoHeader()
	{
		String source = String.join("\n",
				"scope Local {",
				"    u8 counter <- 0;",
				"    void step() {",
				"        this.counter <- 1;",
				"    }",
				"}",
				"");
		Map<String, String> sources = new LinkedHashMap<>();
		sources.put("local.cnx", source);
		TranspileResult result = new Transpiler(TranspilerOptions.defaults(), new ErrorHandler()).transpileSources(sources);

		assertTrue(result.isSuccess());
		assertTrue(result.getOutput("local.c").isPresent());
		assertTrue(result.getOutput("local.h").isEmpty());
		assertFalse(result.getOutput("local.c").orElseThrow().getContent().contains("#include \"local.h\""));
	}

	@Test
	void unmappedExternalTypeIsForwardDeclared()
	{
		String source = String.join("\n",
				"#include \"hal.h\"",
				"",
				"void configure(UartHandle handle) { }",
				"");
		String h = header(TranspilerOptions.defaults(), "uart.cnx", source, "uart.h");

		assertTrue(h.contains("#include \"hal.h\""), h);
		assertTrue(h.contains("/* External type dependencies - include appropriate headers */\ntypedef struct UartHandle UartHandle;"), h);
		assertTrue(h.contains("void configure(UartHandle* handle);"), h);
	}

	@Test
	void mappedExternalTypeIncludesItsHeader()
	{
		TranspilerOptions options = TranspilerOptions.builder().typeHeader("UartHandle", "drivers/uart.h").build();
		String h = header(options, "uart.cnx", "void configure(UartHandle handle) { }\n", "uart.h");

		assertTrue(h.contains("#include \"drivers/uart.h\""), h);
		assertFalse(h.contains("typedef struct UartHandle UartHandle;"), h);
	}

	@Test
	void cnextIncludesUseHeaderExtension()
	{
		String source = "#include \"motor.cnx\"\n\nu8 level <- 0;\n";
		Map<String, String> sources = new LinkedHashMap<>();
		sources.put("motor.cnx", MOTOR);
		sources.put("panel.cnx", source);

		TranspileResult c = new Transpiler(TranspilerOptions.defaults(), new ErrorHandler()).transpileSources(sources);
		assertTrue(c.getOutput("panel.h").orElseThrow().getContent().contains("#include \"motor.h\""));

		TranspilerOptions cpp = TranspilerOptions.builder().cppMode(true).build();
		TranspileResult hpp = new Transpiler(cpp, new ErrorHandler()).transpileSources(sources);
		assertTrue(hpp.getOutput("panel.hpp").orElseThrow().getContent().contains("#include \"motor.hpp\""));
	}

	@Test
	void guardNameIsDerivedFromBaseName()
	{
		String h = header(TranspilerOptions.defaults(), "motor-control.cnx", "u8 level <- 0;\n", "motor-control.h");

		assertTrue(h.contains("#ifndef MOTOR_CONTROL_H\n#define MOTOR_CONTROL_H"), h);
		assertTrue(h.contains("extern uint8_t level;"), h);
	}
}
