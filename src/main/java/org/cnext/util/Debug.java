package org.cnext.util;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set by -v/--verbose. Gates logDebug only.
	public static boolean ENABLE_DEBUG = false;

	public static void log(String log)
	{
		System.out.println(log);
	}

	public static void logInfo(String log)
	{
		System.out.println(ANSI_GREEN + log + ANSI_RESET);
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			System.out.println(log);
		}
	}

	public static void logWarning(String log)
	{
		System.out.println(ANSI_YELLOW + log + ANSI_RESET);
	}

	public static void logError(String log)
	{
		System.err.println(ANSI_RED + log + ANSI_RESET);
	}
}
