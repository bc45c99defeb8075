// File: src/main/java/org/cnext/codegen/SignatureBuilder.java
package org.cnext.codegen;

import org.cnext.semantic.ParameterMutationTable;
import org.cnext.semantic.TypeResolver;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.symbol.Visibility;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders function signatures. Implementation files and both header variants go
 * through this class, so a prototype and its definition always match.
 * <p>
 * Passing rules: scalars by value unless the function writes them (then {@code T*});
 * structs by pointer, const unless written; arrays and strings as arrays or
 * {@code char*}, const unless written; external types by pointer.
 */
public class SignatureBuilder
{
	private final TypeResolver typeResolver;
	private final ParameterMutationTable mutationTable;

	public SignatureBuilder(TypeResolver typeResolver, ParameterMutationTable mutationTable)
	{
		this.typeResolver = typeResolver;
		this.mutationTable = mutationTable;
	}

	public ParameterBinding bind(FunctionSymbol fn, ParameterSymbol parameter)
	{
		TypeDescriptor type = parameter.getType();
		boolean mutated = mutationTable.isMutated(fn, parameter.getIndex());
		boolean constQualified = parameter.isDeclaredConst() || !mutated;

		if (type.isArray() || type.isString())
		{
			return new ParameterBinding(parameter, ParameterBinding.Passing.ARRAY, constQualified);
		}
		if (typeResolver.isStructType(type))
		{
			return new ParameterBinding(parameter, ParameterBinding.Passing.STRUCT_POINTER, constQualified);
		}
		if (typeResolver.isOpaqueType(type))
		{
			return new ParameterBinding(parameter, ParameterBinding.Passing.OPAQUE_POINTER, parameter.isDeclaredConst());
		}
		if (mutated && !parameter.isDeclaredConst())
		{
			return new ParameterBinding(parameter, ParameterBinding.Passing.SCALAR_POINTER, false);
		}
		return new ParameterBinding(parameter, ParameterBinding.Passing.VALUE, parameter.isDeclaredConst());
	}

	public Map<String, ParameterBinding> bindAll(FunctionSymbol fn)
	{
		Map<String, ParameterBinding> bindings = new LinkedHashMap<>();
		for (ParameterSymbol parameter : fn.getParameters())
		{
			bindings.put(parameter.getName(), bind(fn, parameter));
		}
		return bindings;
	}

	public String renderParameter(FunctionSymbol fn, ParameterSymbol parameter)
	{
		ParameterBinding binding = bind(fn, parameter);
		TypeDescriptor type = parameter.getType();
		String constPrefix = binding.isConstQualified() ? "const " : "";
		String name = parameter.getName();

		return switch (binding.getPassing())
		{
			case VALUE -> constPrefix + typeResolver.toCType(type) + " " + name;
			case SCALAR_POINTER, STRUCT_POINTER, OPAQUE_POINTER -> constPrefix + typeResolver.toCType(type) + "* " + name;
			case ARRAY ->
			{
				if (type.isString() && !type.isArray())
				{
					yield constPrefix + "char* " + name;
				}
				yield constPrefix + typeResolver.toCType(type) + " " + name + type.getCArraySuffix();
			}
		};
	}

	public String renderParameterList(FunctionSymbol fn)
	{
		if (fn.getParameters().isEmpty())
		{
			return "void";
		}
		List<String> parts = new ArrayList<>();
		for (ParameterSymbol parameter : fn.getParameters())
		{
			parts.add(renderParameter(fn, parameter));
		}
		return String.join(", ", parts);
	}

	public String renderReturnType(FunctionSymbol fn)
	{
		return typeResolver.toCType(fn.getReturnType());
	}

	/**
	 * {@code uint8_t Motor_speed(const Point* p, uint8_t* count)}
	 */
	public String renderSignature(FunctionSymbol fn)
	{
		return renderReturnType(fn) + " " + fn.getCName() + "(" + renderParameterList(fn) + ")";
	}

	/**
	 * The signature as written above a definition. Private scope functions are
	 * {@code static} to their file.
	 */
	public String renderDefinitionHead(FunctionSymbol fn)
	{
		return (isFileLocal(fn) ? "static " : "") + renderSignature(fn);
	}

	public String renderPrototype(FunctionSymbol fn)
	{
		return renderSignature(fn) + ";";
	}

	/**
	 * {@code typedef void (*Motor_onDone_fp)(uint8_t code);}
	 */
	public String renderCallbackTypedef(FunctionSymbol fn)
	{
		return "typedef " + renderReturnType(fn) + " (*" + fn.getCName() + "_fp)(" + renderParameterList(fn) + ");";
	}

	public boolean isFileLocal(FunctionSymbol fn)
	{
		return fn.getVisibility() == Visibility.PRIVATE;
	}
}
