package org.cnext.semantic;

import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.Optional;

/**
 * What the resolvers need to know about the code position being resolved.
 */
public interface ResolutionContext
{
	ScopeSymbol getCurrentScope();

	/**
	 * Type of a local variable or parameter visible at this position.
	 */
	Optional<TypeDescriptor> lookupLocalType(String name);
}
