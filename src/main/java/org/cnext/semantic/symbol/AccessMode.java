package org.cnext.semantic.symbol;

/**
 * Hardware access mode of a register member.
 */
public enum AccessMode
{
	RW,
	RO,
	WO,
	W1C,
	W1S;

	public boolean isReadable()
	{
		return this == RW || this == RO;
	}

	public boolean isWritable()
	{
		return this != RO;
	}

	public static AccessMode fromKeyword(String keyword)
	{
		return valueOf(keyword.toUpperCase());
	}
}
