// File: src/main/java/org/cnext/util/SymbolExporter.java
package org.cnext.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.cnext.dto.FunctionDTO;
import org.cnext.dto.MemberDTO;
import org.cnext.dto.ParameterDTO;
import org.cnext.dto.ScopeDTO;
import org.cnext.dto.SymbolTableDTO;
import org.cnext.dto.TypeDTO;
import org.cnext.dto.VariableDTO;
import org.cnext.semantic.ParameterMutationTable;
import org.cnext.semantic.SymbolRegistry;
import org.cnext.semantic.symbol.BitmapFieldSymbol;
import org.cnext.semantic.symbol.BitmapSymbol;
import org.cnext.semantic.symbol.EnumMemberSymbol;
import org.cnext.semantic.symbol.EnumSymbol;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.symbol.RegisterMemberSymbol;
import org.cnext.semantic.symbol.RegisterSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.symbol.StructSymbol;
import org.cnext.semantic.symbol.Symbol;
import org.cnext.semantic.symbol.TypeSymbol;
import org.cnext.semantic.symbol.VariableSymbol;
import org.cnext.semantic.symbol.Visibility;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;

/**
 * Converts the frozen registry to DTOs and writes them as JSON.
 */
public class SymbolExporter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	private final SymbolRegistry registry;
	private final ParameterMutationTable mutationTable;

	public SymbolExporter(SymbolRegistry registry, ParameterMutationTable mutationTable)
	{
		this.registry = registry;
		this.mutationTable = mutationTable;
	}

	public SymbolTableDTO toDTO()
	{
		SymbolTableDTO dto = new SymbolTableDTO();
		dto.entryPoint = registry.getEntryPoint();
		dto.sourceFiles.addAll(new TreeSet<>(registry.getSourceFiles()));
		dto.global = scopeToDTO(registry.getGlobalScope());
		return dto;
	}

	public String toJson()
	{
		return GSON.toJson(toDTO());
	}

	public void write(Path outPath) throws IOException
	{
		FileUtils.writeString(outPath, toJson());
		Debug.logInfo("Wrote symbol table to: " + outPath);
	}

	/**
	 * Diagnostics are already plain public-field records.
	 */
	public static void writeDiagnostics(List<Diagnostic> diagnostics, Path outPath) throws IOException
	{
		FileUtils.writeString(outPath, GSON.toJson(diagnostics));
		Debug.logInfo("Wrote " + diagnostics.size() + " diagnostic(s) to: " + outPath);
	}

	private ScopeDTO scopeToDTO(ScopeSymbol scope)
	{
		ScopeDTO dto = new ScopeDTO();
		dto.name = scope.getName();
		dto.path = scope.getPath();
		for (ScopeSymbol child : registry.getScopes())
		{
			if (child != scope && child.getParentId() == scope.getId())
			{
				dto.scopes.add(scopeToDTO(child));
			}
		}
		for (Symbol symbol : scope.getMembers().values())
		{
			boolean isPublic = scope.getVisibility(symbol.getName()) == Visibility.PUBLIC;
			if (symbol instanceof FunctionSymbol fn)
			{
				dto.functions.add(functionToDTO(fn, isPublic));
			}
			else if (symbol instanceof VariableSymbol variable)
			{
				dto.variables.add(variableToDTO(variable, isPublic));
			}
			else if (symbol instanceof TypeSymbol type)
			{
				dto.types.add(typeToDTO(type, isPublic));
			}
		}
		return dto;
	}

	private FunctionDTO functionToDTO(FunctionSymbol fn, boolean isPublic)
	{
		FunctionDTO dto = new FunctionDTO();
		dto.name = fn.getName();
		dto.cName = fn.getCName();
		dto.returnType = fn.getReturnType().toString();
		dto.isPublic = isPublic;
		dto.sourceFile = fn.getSourceFile();
		dto.line = fn.getSourceLine();
		for (ParameterSymbol parameter : fn.getParameters())
		{
			ParameterDTO pd = new ParameterDTO();
			pd.name = parameter.getName();
			pd.type = parameter.getType().toString();
			pd.isConst = parameter.isDeclaredConst();
			pd.isMutated = mutationTable != null && mutationTable.isMutated(fn, parameter.getIndex());
			dto.parameters.add(pd);
		}
		return dto;
	}

	private VariableDTO variableToDTO(VariableSymbol variable, boolean isPublic)
	{
		VariableDTO dto = new VariableDTO();
		dto.name = variable.getName();
		dto.cName = variable.getCName();
		dto.type = variable.getType().toString();
		dto.isPublic = isPublic;
		dto.isConst = variable.isConst();
		dto.isVolatile = variable.isVolatile();
		dto.overflow = variable.getOverflow().name().toLowerCase();
		dto.constValue = variable.getConstValue();
		return dto;
	}

	private TypeDTO typeToDTO(TypeSymbol type, boolean isPublic)
	{
		TypeDTO dto = new TypeDTO();
		dto.kind = type.getKind().name().toLowerCase();
		dto.name = type.getName();
		dto.cName = type.getCName();
		dto.isPublic = isPublic;
		dto.language = type.getLanguage().name();
		if (type instanceof StructSymbol struct)
		{
			for (StructSymbol.Field field : struct.getFields().values())
			{
				MemberDTO md = new MemberDTO();
				md.name = field.getName();
				md.type = field.getType().toString();
				md.offset = field.getOffset();
				dto.members.add(md);
			}
		}
		else if (type instanceof EnumSymbol enumSymbol)
		{
			dto.backingType = enumSymbol.getBackingType() != null ? enumSymbol.getBackingType().getKeyword() : null;
			for (EnumMemberSymbol member : enumSymbol.getMembers().values())
			{
				MemberDTO md = new MemberDTO();
				md.name = member.getName();
				md.value = member.getValue();
				dto.members.add(md);
			}
		}
		else if (type instanceof BitmapSymbol bitmap)
		{
			dto.backingType = bitmap.getBackingType().getKeyword();
			for (BitmapFieldSymbol field : bitmap.getFields().values())
			{
				MemberDTO md = new MemberDTO();
				md.name = field.getName();
				md.offset = field.getOffset();
				md.width = field.getWidth();
				dto.members.add(md);
			}
		}
		else if (type instanceof RegisterSymbol register)
		{
			dto.baseAddress = register.getBaseAddress();
			for (RegisterMemberSymbol member : register.getMembers().values())
			{
				MemberDTO md = new MemberDTO();
				md.name = member.getName();
				md.type = member.getType().toString();
				md.access = member.getAccess().name().toLowerCase();
				md.address = member.getOffset();
				dto.members.add(md);
			}
		}
		return dto;
	}
}
