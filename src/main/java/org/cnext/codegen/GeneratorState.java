package org.cnext.codegen;

import org.cnext.semantic.ResolutionContext;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the per-file generation state. Generators read it; only the
 * orchestrator changes it, by applying {@link GenerationEffect}s.
 */
public interface GeneratorState extends ResolutionContext
{
	Optional<ParameterBinding> getParameter(String name);

	boolean isLocal(String name);

	boolean isLocalArray(String name);

	Optional<Long> getLocalConst(String name);

	/**
	 * True for locals declared {@code wrap}.
	 */
	boolean isWrappingLocal(String name);

	/**
	 * The type the enclosing construct expects, used to qualify bare enum members.
	 */
	Optional<TypeDescriptor> getExpectedType();

	boolean isInFunctionBody();

	Optional<FunctionSymbol> getCurrentFunction();

	/**
	 * Names of float variables that already have a bit-access shadow in this function.
	 */
	Set<String> getFloatShadows();

	/**
	 * Integer type of a bit-access shadow registered in this function.
	 */
	Optional<TypeDescriptor> getRegisteredType(String name);

	/**
	 * A cached length variable for a string, if the enclosing statement set one up.
	 */
	Optional<String> getCachedLength(String stringCName);

	long getArrayInitCount();

	/**
	 * Callback type of a struct field, keyed {@code StructCName.field}.
	 */
	Optional<String> getCallbackFieldType(String structField);
}
