// File: src/main/java/org/cnext/semantic/symbol/FunctionSymbol.java
package org.cnext.semantic.symbol;

import org.cnext.parser.CNextParser;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.List;

public class FunctionSymbol extends Symbol
{
	private final int id;
	private final String cName;
	private final TypeDescriptor returnType;
	private final List<ParameterSymbol> parameters;
	private final Visibility visibility;
	private final CNextParser.FunctionDeclarationContext body;

	public FunctionSymbol(int id, String name, String cName, int scopeId, TypeDescriptor returnType, List<ParameterSymbol> parameters,
						  Visibility visibility, CNextParser.FunctionDeclarationContext body, String sourceFile, int sourceLine)
	{
		super(name, scopeId, sourceFile, sourceLine, SourceLanguage.CNEXT);
		this.id = id;
		this.cName = cName;
		this.returnType = returnType;
		this.parameters = List.copyOf(parameters);
		this.visibility = visibility;
		this.body = body;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.FUNCTION;
	}

	/**
	 * Index into the registry's function arena.
	 */
	public int getId()
	{
		return id;
	}

	public String getCName()
	{
		return cName;
	}

	public TypeDescriptor getReturnType()
	{
		return returnType;
	}

	public List<ParameterSymbol> getParameters()
	{
		return parameters;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}

	public CNextParser.FunctionDeclarationContext getBody()
	{
		return body;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(returnType + " " + cName + "(");
		for (int i = 0; i < parameters.size(); i++)
		{
			if (i > 0)
			{
				sb.append(", ");
			}
			sb.append(parameters.get(i).getType()).append(' ').append(parameters.get(i).getName());
		}
		return sb.append(')').toString();
	}
}
