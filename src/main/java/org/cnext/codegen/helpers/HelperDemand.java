package org.cnext.codegen.helpers;

import org.cnext.semantic.type.PrimitiveType;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The helper functions a file (or, once merged, a whole build) needs. Keys are
 * {@code op_type}, e.g. {@code add_u8} or {@code div_i32}; sorted sets make the
 * emission order independent of demand order.
 */
public class HelperDemand
{
	private final SortedSet<String> overflow = new TreeSet<>();
	private final SortedSet<String> safeDiv = new TreeSet<>();

	public static String key(String op, PrimitiveType type)
	{
		return op + "_" + type.getKeyword();
	}

	public void requireOverflow(String op, PrimitiveType type)
	{
		overflow.add(key(op, type));
	}

	public void requireSafeDiv(String op, PrimitiveType type)
	{
		safeDiv.add(key(op, type));
	}

	public void merge(HelperDemand other)
	{
		overflow.addAll(other.overflow);
		safeDiv.addAll(other.safeDiv);
	}

	public SortedSet<String> getOverflowKeys()
	{
		return Collections.unmodifiableSortedSet(overflow);
	}

	public SortedSet<String> getSafeDivKeys()
	{
		return Collections.unmodifiableSortedSet(safeDiv);
	}

	public boolean isEmpty()
	{
		return overflow.isEmpty() && safeDiv.isEmpty();
	}

	static String opOf(String key)
	{
		return key.substring(0, key.indexOf('_'));
	}

	static PrimitiveType typeOf(String key)
	{
		return PrimitiveType.fromKeyword(key.substring(key.indexOf('_') + 1)).orElseThrow();
	}

	@Override
	public String toString()
	{
		return "overflow=" + overflow + ", safeDiv=" + safeDiv;
	}
}
