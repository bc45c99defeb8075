// File: src/main/java/org/cnext/semantic/symbol/ScopeSymbol.java
package org.cnext.semantic.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A namespace node identified by its dotted path. The global scope has the empty
 * path and is its own parent.
 */
public class ScopeSymbol extends Symbol
{
	private final int id;
	private final String path;
	private final Map<String, Symbol> members = new LinkedHashMap<>();
	private final List<String> memberNames = new ArrayList<>();
	private final List<Integer> functionIds = new ArrayList<>();
	private final List<String> variableNames = new ArrayList<>();
	private final Map<String, Visibility> visibility = new LinkedHashMap<>();

	public ScopeSymbol(int id, String path, int parentId)
	{
		super(path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path, parentId, null, 0, SourceLanguage.CNEXT);
		this.id = id;
		this.path = path;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.SCOPE;
	}

	public int getId()
	{
		return id;
	}

	public String getPath()
	{
		return path;
	}

	public boolean isGlobal()
	{
		return path.isEmpty();
	}

	public int getParentId()
	{
		return getScopeId();
	}

	public Optional<Symbol> resolveLocally(String name)
	{
		return Optional.ofNullable(members.get(name));
	}

	public List<String> getMemberNames()
	{
		return Collections.unmodifiableList(memberNames);
	}

	public List<Integer> getFunctionIds()
	{
		return Collections.unmodifiableList(functionIds);
	}

	public List<String> getVariableNames()
	{
		return Collections.unmodifiableList(variableNames);
	}

	public Visibility getVisibility(String member)
	{
		return visibility.getOrDefault(member, isGlobal() ? Visibility.PUBLIC : Visibility.PRIVATE);
	}

	public Map<String, Symbol> getMembers()
	{
		return Collections.unmodifiableMap(members);
	}

	// Only SymbolRegistry should call the two mutators below.

	public void define(Symbol symbol, Visibility memberVisibility)
	{
		members.put(symbol.getName(), symbol);
		memberNames.add(symbol.getName());
		visibility.put(symbol.getName(), memberVisibility);
		if (symbol instanceof FunctionSymbol fn)
		{
			functionIds.add(fn.getId());
		}
		else if (symbol instanceof VariableSymbol)
		{
			variableNames.add(symbol.getName());
		}
	}

	public void undefine(String name)
	{
		Symbol removed = members.remove(name);
		memberNames.remove(name);
		visibility.remove(name);
		if (removed instanceof FunctionSymbol fn)
		{
			functionIds.remove(Integer.valueOf(fn.getId()));
		}
		variableNames.remove(name);
	}
}
