package org.cnext.semantic.symbol;

public enum Visibility
{
	PUBLIC,
	PRIVATE;

	public static Visibility fromKeyword(String keyword)
	{
		return "public".equals(keyword) ? PUBLIC : PRIVATE;
	}
}
