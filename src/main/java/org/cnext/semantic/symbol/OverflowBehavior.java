package org.cnext.semantic.symbol;

/**
 * Per-variable overflow modifier. Integer variables without a modifier clamp.
 */
public enum OverflowBehavior
{
	CLAMP,
	WRAP
}
