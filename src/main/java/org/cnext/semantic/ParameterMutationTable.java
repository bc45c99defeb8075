package org.cnext.semantic;

import org.cnext.semantic.symbol.FunctionSymbol;

import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;

/**
 * Which parameters each function writes through. A mutated parameter is passed by
 * pointer; every other struct, array or string parameter becomes a const pointer.
 * <p>
 * Filled in declaration order before generation and read-only afterwards, so
 * call sites and signatures in every file agree.
 */
public class ParameterMutationTable
{
	private final Map<Integer, BitSet> mutated = new HashMap<>();

	void record(FunctionSymbol fn, BitSet parameters)
	{
		mutated.put(fn.getId(), (BitSet) parameters.clone());
	}

	public boolean isAnalyzed(FunctionSymbol fn)
	{
		return mutated.containsKey(fn.getId());
	}

	/**
	 * Functions that were never analyzed count as mutating every parameter.
	 */
	public boolean isMutated(FunctionSymbol fn, int index)
	{
		BitSet bits = mutated.get(fn.getId());
		return bits == null || bits.get(index);
	}
}
