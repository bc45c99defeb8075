package org.cnext.semantic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class NameManglerTest
{
	@Test
	void scopeMembersAreJoinedWithUnderscores()
	{
		assertEquals("Motor_Control_start", NameMangler.forMember("Motor.Control", "start"));
		assertEquals("Motor_speed", NameMangler.forMember("Motor", "speed"));
	}

	@Test
	void globalNamesStayBare()
	{
		assertEquals("counter", NameMangler.forMember("", "counter"));
		assertEquals("counter", NameMangler.forMember(null, "counter"));
	}

	@Test
	void entryPointKeepsItsName()
	{
		assertEquals("main", NameMangler.forFunction("App", "main"));
		assertEquals("App_main", NameMangler.forFunction("App", "main", "app_entry"));
		assertEquals("app_entry", NameMangler.forFunction("App", "app_entry", "app_entry"));
	}

	@Test
	void qualifiedReferencesFlatten()
	{
		assertEquals("Motor_State_IDLE", NameMangler.joinQualified(List.of("Motor", "State", "IDLE")));
	}
}
