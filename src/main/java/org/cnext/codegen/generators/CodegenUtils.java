package org.cnext.codegen.generators;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.SignatureBuilder;
import org.cnext.semantic.TypeResolver;
import org.cnext.semantic.symbol.EnumMemberSymbol;
import org.cnext.semantic.symbol.EnumSymbol;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.symbol.VariableSymbol;
import org.cnext.semantic.symbol.Visibility;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Small text helpers shared by the generator packages.
 */
public final class CodegenUtils
{
	private static final BigInteger MAX_U32 = new BigInteger("4294967295");

	private CodegenUtils()
	{
	}

	/**
	 * {@code uint8_t buf[16]}, {@code char name[9]}, {@code Motor_onDone_fp cb}
	 */
	public static String declarator(TypeDescriptor type, String name, TypeResolver typeResolver)
	{
		return typeResolver.toCType(type) + " " + name + type.getCArraySuffix();
	}

	/**
	 * The value an uninitialized variable of this type starts with.
	 */
	public static String zeroValue(TypeDescriptor type, GeneratorInput input)
	{
		TypeResolver types = input.getTypeResolver();
		if (type.isArray())
		{
			return "{0}";
		}
		if (type.isString())
		{
			return "\"\"";
		}
		if (type.isBool())
		{
			return "false";
		}
		if (type.isFloat())
		{
			return type.isPrimitive(PrimitiveType.F32) ? "0.0f" : "0.0";
		}
		if (type.isInteger() || types.isBitmapType(type))
		{
			return "0";
		}
		if (types.isCallbackType(type) || types.isIsrType(type))
		{
			return "NULL";
		}
		if (types.isEnumType(type))
		{
			EnumSymbol enumSymbol = input.getRegistry().findEnum(type.getUserTypeName()).orElseThrow();
			Optional<EnumMemberSymbol> zero = enumSymbol.getMembers().values().stream().filter(m -> m.getValue() == 0).findFirst();
			return zero.map(EnumMemberSymbol::getCName).orElse("(" + enumSymbol.getCName() + ")0");
		}
		return "{0}";
	}

	/**
	 * A private scalar constant of a scope is replaced by its value at every use
	 * and never emitted.
	 */
	public static boolean isInlinedConstant(VariableSymbol variable, ScopeSymbol owner)
	{
		return owner != null && !owner.isGlobal()
				&& variable.getVisibility() == Visibility.PRIVATE
				&& variable.getConstValue() != null
				&& !variable.getType().isArray();
	}

	/**
	 * Constant lookup for folding: function-local constants first, then globals and
	 * the current scope.
	 */
	public static Function<String, Optional<Long>> constants(GeneratorState state, TypeResolver typeResolver)
	{
		return name ->
		{
			Optional<Long> local = state.getLocalConst(name);
			if (local.isPresent() || state.lookupLocalType(name).isPresent())
			{
				return local;
			}
			return typeResolver.lookupConstant(name, state.getCurrentScope());
		};
	}

	/**
	 * A function stored in a callback slot must have the C signature of the
	 * callback's prototype, parameter passing included.
	 */
	public static void checkCallbackCompatible(FunctionSymbol function, String callbackType, GeneratorInput input, ParserRuleContext at)
	{
		FunctionSymbol prototype = input.getRegistry().findFunction(callbackType).orElse(null);
		if (prototype == null || prototype == function)
		{
			return;
		}
		SignatureBuilder signatures = input.getSignatureBuilder();
		boolean sameReturn = signatures.renderReturnType(prototype).equals(signatures.renderReturnType(function));
		boolean sameParameters = stripNames(prototype, signatures).equals(stripNames(function, signatures));
		if (!sameReturn || !sameParameters)
		{
			throw new CompileException(ErrorCode.UNKNOWN_TYPE, at,
					"Function '" + function.getName() + "' does not match callback type '" + prototype.getName() + "'",
					"expected " + signatures.renderSignature(prototype));
		}
	}

	private static List<String> stripNames(FunctionSymbol fn, SignatureBuilder signatures)
	{
		List<String> types = new ArrayList<>();
		for (ParameterSymbol parameter : fn.getParameters())
		{
			String text = signatures.renderParameter(fn, parameter);
			types.add(text.replaceFirst(" " + Pattern.quote(parameter.getName()) + "(?=\\[|$)", ""));
		}
		return types;
	}

	/**
	 * Rewrites a C-Next binary literal as C hex: {@code 0b1010 -> 0xA}. C has no
	 * binary literals before C23.
	 */
	public static String binaryToHex(String binaryText)
	{
		BigInteger value = new BigInteger(binaryText.substring(2), 2);
		return hexLiteral(value);
	}

	public static String hexLiteral(BigInteger value)
	{
		return "0x" + value.toString(16).toUpperCase() + wideSuffix(value);
	}

	/**
	 * {@code ULL} for values that do not fit 32 bits, else nothing.
	 */
	public static String wideSuffix(BigInteger value)
	{
		return value.abs().compareTo(MAX_U32) > 0 ? "ULL" : "";
	}

	/**
	 * Bit mask of the given width as a C literal: {@code 4 -> 0xF}.
	 */
	public static String mask(int width, boolean wide)
	{
		BigInteger value = BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
		return "0x" + value.toString(16).toUpperCase() + (wide ? "ULL" : "U");
	}

	public static String one(boolean wide)
	{
		return wide ? "1ULL" : "1U";
	}

	/**
	 * Identifier-safe form of an lvalue, for generated helper variable names.
	 */
	public static String sanitize(String code)
	{
		String cleaned = code.replaceAll("[^A-Za-z0-9_]+", "_");
		cleaned = cleaned.replaceAll("^_+|_+$", "");
		return cleaned.isEmpty() ? "v" : cleaned;
	}

	public static String floatShadowName(String code)
	{
		return "__bits_" + sanitize(code);
	}

	public static String lengthCacheName(String stringCName)
	{
		return sanitize(stringCName) + "_len";
	}
}
