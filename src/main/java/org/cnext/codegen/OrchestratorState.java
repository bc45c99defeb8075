// File: src/main/java/org/cnext/codegen/OrchestratorState.java
package org.cnext.codegen;

import org.cnext.codegen.helpers.HelperDemand;
import org.cnext.semantic.SymbolRegistry;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.*;

/**
 * Mutable generation state of one file. Owned by the {@link CodeGenerator}; every
 * write goes through {@link CodeGenerator#applyEffects}.
 */
public class OrchestratorState implements GeneratorState
{
	private final SymbolRegistry registry;

	private final Deque<ScopeSymbol> scopes = new ArrayDeque<>();
	private Map<String, ParameterBinding> parameters = Map.of();
	private final Map<String, TypeDescriptor> locals = new HashMap<>();
	private final Set<String> localArrays = new HashSet<>();
	private final Set<String> wrappingLocals = new HashSet<>();
	private final Map<String, Long> localConsts = new HashMap<>();
	private final Map<String, TypeDescriptor> registeredTypes = new HashMap<>();
	private final Set<String> floatShadows = new LinkedHashSet<>();
	private final Map<String, String> lengthCache = new HashMap<>();
	private final Map<String, String> callbackFields = new HashMap<>();
	private TypeDescriptor expectedType;
	private FunctionSymbol currentFunction;
	private boolean inFunctionBody;
	private long arrayInitCount;

	// File-level demand
	private final SortedSet<String> includes = new TreeSet<>();
	private final HelperDemand helperDemand = new HelperDemand();
	private boolean needsIsrTypedef;
	private boolean needsIrqWrappers;

	public OrchestratorState(SymbolRegistry registry)
	{
		this.registry = registry;
		scopes.push(registry.getGlobalScope());
	}

	// --- GeneratorState ---

	@Override
	public ScopeSymbol getCurrentScope()
	{
		return scopes.peek();
	}

	@Override
	public Optional<TypeDescriptor> lookupLocalType(String name)
	{
		if (locals.containsKey(name))
		{
			return Optional.of(locals.get(name));
		}
		return Optional.ofNullable(parameters.get(name)).map(ParameterBinding::getType);
	}

	@Override
	public Optional<ParameterBinding> getParameter(String name)
	{
		if (locals.containsKey(name))
		{
			return Optional.empty();
		}
		return Optional.ofNullable(parameters.get(name));
	}

	@Override
	public boolean isLocal(String name)
	{
		return locals.containsKey(name);
	}

	@Override
	public boolean isLocalArray(String name)
	{
		return localArrays.contains(name);
	}

	@Override
	public Optional<Long> getLocalConst(String name)
	{
		return Optional.ofNullable(localConsts.get(name));
	}

	@Override
	public boolean isWrappingLocal(String name)
	{
		return wrappingLocals.contains(name);
	}

	@Override
	public Optional<TypeDescriptor> getExpectedType()
	{
		return Optional.ofNullable(expectedType);
	}

	@Override
	public boolean isInFunctionBody()
	{
		return inFunctionBody;
	}

	@Override
	public Optional<FunctionSymbol> getCurrentFunction()
	{
		return Optional.ofNullable(currentFunction);
	}

	@Override
	public Set<String> getFloatShadows()
	{
		return Collections.unmodifiableSet(floatShadows);
	}

	@Override
	public Optional<String> getCachedLength(String stringCName)
	{
		return Optional.ofNullable(lengthCache.get(stringCName));
	}

	@Override
	public long getArrayInitCount()
	{
		return arrayInitCount;
	}

	@Override
	public Optional<String> getCallbackFieldType(String structField)
	{
		return Optional.ofNullable(callbackFields.get(structField));
	}

	// --- Mutators, called by CodeGenerator only ---

	void addInclude(String header)
	{
		includes.add(header);
	}

	void requireIsrTypedef()
	{
		needsIsrTypedef = true;
	}

	void requireIrqWrappers()
	{
		needsIrqWrappers = true;
	}

	HelperDemand getHelperDemand()
	{
		return helperDemand;
	}

	void registerType(String name, TypeDescriptor type)
	{
		registeredTypes.put(name, type);
		floatShadows.add(name);
	}

	void registerLocal(String name, TypeDescriptor type, boolean isArray, boolean wraps)
	{
		locals.put(name, type);
		if (isArray)
		{
			localArrays.add(name);
		}
		if (wraps)
		{
			wrappingLocals.add(name);
		}
	}

	void registerConst(String name, long value)
	{
		localConsts.put(name, value);
	}

	void pushScope(String path)
	{
		scopes.push(path.isEmpty() ? registry.getGlobalScope() : registry.findScope(path).orElseThrow());
	}

	void popScope()
	{
		if (scopes.size() > 1)
		{
			scopes.pop();
		}
	}

	void enterFunctionBody(String functionCName)
	{
		inFunctionBody = true;
		currentFunction = registry.findFunction(functionCName).orElse(null);
		locals.clear();
		localArrays.clear();
		wrappingLocals.clear();
		localConsts.clear();
		registeredTypes.clear();
		floatShadows.clear();
		lengthCache.clear();
	}

	void exitFunctionBody()
	{
		inFunctionBody = false;
		currentFunction = null;
		locals.clear();
		localArrays.clear();
		wrappingLocals.clear();
		localConsts.clear();
		registeredTypes.clear();
		floatShadows.clear();
		lengthCache.clear();
	}

	void setParameters(Map<String, ParameterBinding> value)
	{
		parameters = value;
	}

	void clearParameters()
	{
		parameters = Map.of();
	}

	void registerCallbackField(String structField, String callbackType)
	{
		callbackFields.put(structField, callbackType);
	}

	void setArrayInitCount(long count)
	{
		arrayInitCount = count;
	}

	TypeDescriptor swapExpectedType(TypeDescriptor type)
	{
		TypeDescriptor previous = expectedType;
		expectedType = type;
		return previous;
	}

	void cacheLength(String stringCName, String variable)
	{
		lengthCache.put(stringCName, variable);
	}

	void clearLengthCache()
	{
		lengthCache.clear();
	}

	// --- File-level results ---

	public SortedSet<String> getIncludes()
	{
		return Collections.unmodifiableSortedSet(includes);
	}

	public boolean needsIsrTypedef()
	{
		return needsIsrTypedef;
	}

	public boolean needsIrqWrappers()
	{
		return needsIrqWrappers;
	}

	@Override
	public Optional<TypeDescriptor> getRegisteredType(String name)
	{
		return Optional.ofNullable(registeredTypes.get(name));
	}
}
