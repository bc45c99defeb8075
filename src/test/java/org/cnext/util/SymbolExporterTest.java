package org.cnext.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.cnext.dto.FunctionDTO;
import org.cnext.dto.ScopeDTO;
import org.cnext.dto.SymbolTableDTO;
import org.cnext.dto.TypeDTO;
import org.cnext.pipeline.TranspileResult;
import org.cnext.pipeline.Transpiler;
import org.cnext.pipeline.TranspilerOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SymbolExporterTest
{
	private static final String SOURCE = String.join("\n",
			"scope Motor {",
			"    public enum State : u8 { IDLE, RUNNING <- 4 }",
			"    public u8 speed <- 0;",
			"    public void setSpeed(u8 value, u8 previous) {",
			"        previous <- this.speed;",
			"        this.speed <- value;",
			"    }",
			"}",
			"bitmap8 Flags { ready, fault, mode[6] }",
			"");

	private static TranspileResult build()
	{
		TranspileResult result = new Transpiler(TranspilerOptions.defaults(), new ErrorHandler()).transpileSources(Map.of("motor.cnx", SOURCE));
		assertTrue(result.isSuccess(), result.getFailedFiles().toString());
		return result;
	}

	private static ScopeDTO child(ScopeDTO scope, String name)
	{
		return scope.scopes.stream().filter(s -> s.name.equals(name)).findFirst().orElseThrow(() -> new AssertionError("no scope " + name));
	}

	@Test
	void scopesNestUnderGlobal()
	{
		TranspileResult result = build();
		SymbolTableDTO dto = new SymbolExporter(result.getRegistry(), result.getMutationTable()).toDTO();

		assertEquals("main", dto.entryPoint);
		assertEquals(List.of("motor.cnx"), dto.sourceFiles);
		ScopeDTO motor = child(dto.global, "Motor");
		assertEquals("Motor", motor.path);
		assertEquals("Motor_speed", motor.variables.get(0).cName);
		assertTrue(motor.variables.get(0).isPublic);
		assertEquals("clamp", motor.variables.get(0).overflow);
	}

	@Test
	void parametersRecordMutation()
	{
		TranspileResult result = build();
		ScopeDTO motor = child(new SymbolExporter(result.getRegistry(), result.getMutationTable()).toDTO().global, "Motor");

		FunctionDTO setSpeed = motor.functions.get(0);
		assertEquals("Motor_setSpeed", setSpeed.cName);
		assertEquals(2, setSpeed.parameters.size());
		assertFalse(setSpeed.parameters.get(0).isMutated);
		assertTrue(setSpeed.parameters.get(1).isMutated);
	}

	@Test
	void typesCarryTheirMembers()
	{
		TranspileResult result = build();
		SymbolTableDTO dto = new SymbolExporter(result.getRegistry(), result.getMutationTable()).toDTO();

		TypeDTO state = child(dto.global, "Motor").types.get(0);
		assertEquals("enum", state.kind);
		assertEquals("Motor_State", state.cName);
		assertEquals("u8", state.backingType);
		assertEquals(4L, state.members.get(1).value);

		TypeDTO flags = dto.global.types.stream().filter(t -> t.name.equals("Flags")).findFirst().orElseThrow();
		assertEquals("bitmap", flags.kind);
		assertEquals(3, flags.members.size());
		assertEquals(2, flags.members.get(2).offset);
		assertEquals(6, flags.members.get(2).width);
	}

	@Test
	void writesPrettyJson(@TempDir Path dir) throws Exception
	{
		TranspileResult result = build();
		Path out = dir.resolve("reports").resolve("symbols.json");

		new SymbolExporter(result.getRegistry(), result.getMutationTable()).write(out);

		JsonObject json = JsonParser.parseString(Files.readString(out)).getAsJsonObject();
		assertEquals("main", json.get("entryPoint").getAsString());
		JsonArray scopes = json.getAsJsonObject("global").getAsJsonArray("scopes");
		assertEquals("Motor", scopes.get(0).getAsJsonObject().get("name").getAsString());
		assertTrue(Files.readString(out).contains("\n  \""));
	}

	@Test
	void writesDiagnostics(@TempDir Path dir) throws Exception
	{
		Path out = dir.resolve("diagnostics.json");
		SymbolExporter.writeDiagnostics(List.of(new Diagnostic("E0402", "a.cnx", 3, 7, "Cannot access private member", "declare it 'public'")), out);

		JsonArray json = JsonParser.parseString(Files.readString(out)).getAsJsonArray();
		assertEquals(1, json.size());
		JsonObject first = json.get(0).getAsJsonObject();
		assertEquals("E0402", first.get("code").getAsString());
		assertEquals(3, first.get("line").getAsInt());
		assertEquals("declare it 'public'", first.get("hint").getAsString());
	}
}
