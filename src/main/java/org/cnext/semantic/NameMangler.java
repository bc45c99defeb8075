package org.cnext.semantic;

/**
 * Flattens scope paths into C identifiers. Every method is a pure function of
 * its arguments so mangled names do not depend on registration order.
 */
public final class NameMangler
{
	public static final String DEFAULT_ENTRY_POINT = "main";

	private NameMangler()
	{
	}

	/**
	 * {@code ("Motor.Control", "start") -> "Motor_Control_start"}; global names are bare.
	 */
	public static String forMember(String scopePath, String name)
	{
		if (scopePath == null || scopePath.isEmpty())
		{
			return name;
		}
		return scopePath.replace('.', '_') + "_" + name;
	}

	/**
	 * Same as {@link #forMember} except that the entry point keeps its bare name
	 * wherever it is declared.
	 */
	public static String forFunction(String scopePath, String name, String entryPoint)
	{
		if (name.equals(entryPoint))
		{
			return name;
		}
		return forMember(scopePath, name);
	}

	public static String forFunction(String scopePath, String name)
	{
		return forFunction(scopePath, name, DEFAULT_ENTRY_POINT);
	}

	/**
	 * Joins dotted parts of a qualified reference: {@code Motor.State.IDLE -> Motor_State_IDLE}.
	 */
	public static String joinQualified(Iterable<String> parts)
	{
		return String.join("_", parts);
	}
}
