package org.cnext.codegen.helpers;

/**
 * What an overflow helper does when the exact result does not fit.
 */
public enum OverflowMode
{
	/** Saturate to the type's limit. */
	CLAMP,
	/** Print a message and abort. */
	PANIC
}
