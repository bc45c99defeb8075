// File: src/main/java/org/cnext/semantic/SymbolRegistry.java
package org.cnext.semantic;

import org.antlr.v4.runtime.Token;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.*;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.Debug;

import java.util.*;

/**
 * The persistent, cross-file store of scopes and symbols.
 * <p>
 * Scopes and functions live in arenas and are addressed by id. A symbol records the
 * id of its owning scope instead of holding a reference to it. The registry is built
 * by the declaration pass, then {@link #freeze() frozen}; from that point on it is
 * read-only and may be shared by concurrent generation of separate files.
 */
public class SymbolRegistry
{
	public static final int GLOBAL_SCOPE_ID = 0;

	private final List<ScopeSymbol> scopes = new ArrayList<>();
	private final Map<String, Integer> scopeIdsByPath = new HashMap<>();
	private final List<FunctionSymbol> functions = new ArrayList<>();
	private final Map<String, Symbol> symbolsByCName = new HashMap<>();
	private final Map<String, List<Symbol>> symbolsByFile = new LinkedHashMap<>();
	private final String entryPoint;
	private volatile boolean frozen = false;

	public SymbolRegistry()
	{
		this(NameMangler.DEFAULT_ENTRY_POINT);
	}

	public SymbolRegistry(String entryPoint)
	{
		this.entryPoint = entryPoint;
		// The global scope is its own parent
		ScopeSymbol global = new ScopeSymbol(GLOBAL_SCOPE_ID, "", GLOBAL_SCOPE_ID);
		scopes.add(global);
		scopeIdsByPath.put("", GLOBAL_SCOPE_ID);
	}

	public String getEntryPoint()
	{
		return entryPoint;
	}

	// --- Scopes ---

	/**
	 * Returns the scope for a dotted path, creating it and any missing ancestors.
	 * The same path always yields the same object.
	 */
	public synchronized ScopeSymbol getOrCreateScope(String path)
	{
		Integer existing = scopeIdsByPath.get(path);
		if (existing != null)
		{
			return scopes.get(existing);
		}
		checkMutable();

		int parentId = GLOBAL_SCOPE_ID;
		int lastDot = path.lastIndexOf('.');
		if (lastDot > 0)
		{
			parentId = getOrCreateScope(path.substring(0, lastDot)).getId();
		}

		ScopeSymbol parent = scopes.get(parentId);
		ScopeSymbol scope = new ScopeSymbol(scopes.size(), path, parentId);
		Optional<Symbol> clash = parent.resolveLocally(scope.getName());
		if (clash.isPresent())
		{
			throw new DuplicateSymbolException(scope.getName(), parent.getPath(), 0, clash.get().getSourceFile(), clash.get().getSourceLine());
		}
		parent.define(scope, Visibility.PUBLIC);
		scopes.add(scope);
		scopeIdsByPath.put(path, scope.getId());
		Debug.logDebug("Created scope '" + path + "' (id " + scope.getId() + ")");
		return scope;
	}

	public ScopeSymbol getGlobalScope()
	{
		return scopes.get(GLOBAL_SCOPE_ID);
	}

	public ScopeSymbol getScope(int id)
	{
		return scopes.get(id);
	}

	public Optional<ScopeSymbol> findScope(String path)
	{
		Integer id = scopeIdsByPath.get(path);
		return id == null ? Optional.empty() : Optional.of(scopes.get(id));
	}

	public ScopeSymbol getParent(ScopeSymbol scope)
	{
		return scopes.get(scope.getParentId());
	}

	public List<ScopeSymbol> getScopes()
	{
		return Collections.unmodifiableList(scopes);
	}

	// --- Registration ---

	public FunctionSymbol registerFunction(ScopeSymbol scope, String name, TypeDescriptor returnType, List<ParameterSymbol> parameters,
										   Visibility visibility, CNextParser.FunctionDeclarationContext body, String sourceFile, int sourceLine)
	{
		checkMutable();
		String cName = NameMangler.forFunction(scope.getPath(), name, entryPoint);
		checkDuplicate(scope, name, cName, sourceLine);

		FunctionSymbol fn = new FunctionSymbol(functions.size(), name, cName, scope.getId(), returnType, parameters, visibility, body, sourceFile, sourceLine);
		functions.add(fn);
		define(scope, fn, cName, visibility);
		return fn;
	}

	public void registerVariable(ScopeSymbol scope, VariableSymbol variable)
	{
		register(scope, variable, variable.getCName(), variable.getVisibility());
	}

	public void registerStruct(ScopeSymbol scope, StructSymbol struct)
	{
		register(scope, struct, struct.getCName(), struct.getVisibility());
	}

	public void registerEnum(ScopeSymbol scope, EnumSymbol enumSymbol)
	{
		register(scope, enumSymbol, enumSymbol.getCName(), enumSymbol.getVisibility());
	}

	public void registerBitmap(ScopeSymbol scope, BitmapSymbol bitmap)
	{
		register(scope, bitmap, bitmap.getCName(), bitmap.getVisibility());
	}

	public void registerRegister(ScopeSymbol scope, RegisterSymbol register)
	{
		register(scope, register, register.getCName(), register.getVisibility());
	}

	/**
	 * Registers a type that is defined by an included C or C++ header. Such a type
	 * has no layout and is usable only by pointer.
	 */
	public StructSymbol registerExternalType(String name, SourceLanguage language, String sourceFile)
	{
		Symbol existing = symbolsByCName.get(name);
		if (existing instanceof StructSymbol struct)
		{
			return struct;
		}
		StructSymbol external = new StructSymbol(name, name, GLOBAL_SCOPE_ID, Visibility.PUBLIC, sourceFile, 0, language);
		register(getGlobalScope(), external, name, Visibility.PUBLIC);
		return external;
	}

	private void register(ScopeSymbol scope, Symbol symbol, String cName, Visibility visibility)
	{
		checkMutable();
		checkDuplicate(scope, symbol.getName(), cName, symbol.getSourceLine());
		define(scope, symbol, cName, visibility);
	}

	private void checkDuplicate(ScopeSymbol scope, String name, String cName, int line)
	{
		Optional<Symbol> local = scope.resolveLocally(name);
		Symbol clash = local.orElse(symbolsByCName.get(cName));
		if (clash != null)
		{
			throw new DuplicateSymbolException(name, scope.getPath(), line, clash.getSourceFile(), clash.getSourceLine());
		}
	}

	private void define(ScopeSymbol scope, Symbol symbol, String cName, Visibility visibility)
	{
		scope.define(symbol, visibility);
		symbolsByCName.put(cName, symbol);
		symbol.setExported(scope.isGlobal() || visibility == Visibility.PUBLIC);
		if (symbol.getSourceFile() != null)
		{
			symbolsByFile.computeIfAbsent(symbol.getSourceFile(), f -> new ArrayList<>()).add(symbol);
		}
	}

	/**
	 * Removes every symbol a file registered. Scopes it created stay, empty.
	 */
	public synchronized void rollbackFile(String sourceFile)
	{
		checkMutable();
		List<Symbol> registered = symbolsByFile.remove(sourceFile);
		if (registered == null)
		{
			return;
		}
		for (Symbol symbol : registered)
		{
			scopes.get(symbol.getScopeId()).undefine(symbol.getName());
			symbolsByCName.values().remove(symbol);
		}
		Debug.logDebug("Rolled back " + registered.size() + " symbol(s) from " + sourceFile);
	}

	public void freeze()
	{
		frozen = true;
	}

	public boolean isFrozen()
	{
		return frozen;
	}

	private void checkMutable()
	{
		if (frozen)
		{
			throw new IllegalStateException("Symbol registry is read-only after the declaration pass");
		}
	}

	// --- Resolution ---

	/**
	 * Resolves a function reference written as {@code fn}, {@code this.fn},
	 * {@code Scope.fn}, {@code global.fn} or {@code global.Scope.fn}.
	 *
	 * @throws VisibilityException if the function exists but is private to another scope
	 */
	public Optional<FunctionSymbol> resolveFunction(String reference, ScopeSymbol fromScope)
	{
		return resolveFunction(reference, fromScope, null);
	}

	public Optional<FunctionSymbol> resolveFunction(String reference, ScopeSymbol fromScope, Token at)
	{
		return resolveScopeMember(reference, fromScope, at)
				.filter(FunctionSymbol.class::isInstance)
				.map(FunctionSymbol.class::cast);
	}

	/**
	 * Resolves any scope member by reference. Inside scope S, and through {@code this.},
	 * every member of S is visible. Through a scope name, only public members are.
	 */
	public Optional<Symbol> resolveScopeMember(String reference, ScopeSymbol fromScope, Token at)
	{
		List<String> parts = new ArrayList<>(Arrays.asList(reference.split("\\.")));
		String head = parts.get(0);

		if (head.equals("this"))
		{
			if (fromScope.isGlobal() || parts.size() != 2)
			{
				return Optional.empty();
			}
			return fromScope.resolveLocally(parts.get(1));
		}

		if (head.equals("global"))
		{
			parts.remove(0);
			if (parts.isEmpty())
			{
				return Optional.empty();
			}
		}

		if (parts.size() == 1)
		{
			return getGlobalScope().resolveLocally(parts.get(0));
		}

		String member = parts.remove(parts.size() - 1);
		Optional<ScopeSymbol> target = findScope(String.join(".", parts));
		if (target.isEmpty())
		{
			return Optional.empty();
		}
		Optional<Symbol> symbol = target.get().resolveLocally(member);
		if (symbol.isPresent() && target.get().getVisibility(member) != Visibility.PUBLIC)
		{
			throw new VisibilityException(member, target.get().getPath(), target.get() == fromScope, at);
		}
		return symbol;
	}

	/**
	 * Whether {@code member} of {@code owner} may be named from {@code fromScope}.
	 * Members of the global scope are always visible; through {@code this} every
	 * member of the current scope is.
	 */
	public boolean isVisible(ScopeSymbol owner, String member, ScopeSymbol fromScope, boolean viaSelf)
	{
		return owner.isGlobal() || viaSelf && owner == fromScope || owner.getVisibility(member) == Visibility.PUBLIC;
	}

	// --- Lookups by mangled name ---

	public Optional<Symbol> findByCName(String cName)
	{
		return Optional.ofNullable(symbolsByCName.get(cName));
	}

	public Optional<TypeSymbol> findType(String cName)
	{
		return findByCName(cName).filter(TypeSymbol.class::isInstance).map(TypeSymbol.class::cast);
	}

	public Optional<EnumSymbol> findEnum(String cName)
	{
		return findByCName(cName).filter(EnumSymbol.class::isInstance).map(EnumSymbol.class::cast);
	}

	public Optional<StructSymbol> findStruct(String cName)
	{
		return findByCName(cName).filter(StructSymbol.class::isInstance).map(StructSymbol.class::cast);
	}

	public Optional<BitmapSymbol> findBitmap(String cName)
	{
		return findByCName(cName).filter(BitmapSymbol.class::isInstance).map(BitmapSymbol.class::cast);
	}

	public Optional<RegisterSymbol> findRegister(String cName)
	{
		return findByCName(cName).filter(RegisterSymbol.class::isInstance).map(RegisterSymbol.class::cast);
	}

	public Optional<FunctionSymbol> findFunction(String cName)
	{
		return findByCName(cName).filter(FunctionSymbol.class::isInstance).map(FunctionSymbol.class::cast);
	}

	public Optional<VariableSymbol> findVariable(String cName)
	{
		return findByCName(cName).filter(VariableSymbol.class::isInstance).map(VariableSymbol.class::cast);
	}

	public FunctionSymbol getFunction(int id)
	{
		return functions.get(id);
	}

	/**
	 * All enums declaring a member with this name, ordered by C name.
	 */
	public List<EnumSymbol> findEnumsWithMember(String member)
	{
		List<EnumSymbol> result = new ArrayList<>();
		for (Symbol symbol : symbolsByCName.values())
		{
			if (symbol instanceof EnumSymbol enumSymbol && enumSymbol.getMember(member).isPresent())
			{
				result.add(enumSymbol);
			}
		}
		result.sort(Comparator.comparing(EnumSymbol::getCName));
		return result;
	}

	/**
	 * Symbols a file declared, in declaration order.
	 */
	public List<Symbol> getSymbolsForFile(String sourceFile)
	{
		return Collections.unmodifiableList(symbolsByFile.getOrDefault(sourceFile, List.of()));
	}

	public Set<String> getSourceFiles()
	{
		return Collections.unmodifiableSet(symbolsByFile.keySet());
	}
}
