// File: src/main/java/org/cnext/codegen/generators/expressions/AccessChainRenderer.java
package org.cnext.codegen.generators.expressions;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.ParameterBinding;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.AccessStep;
import org.cnext.semantic.ConstantEvaluator;
import org.cnext.semantic.ExpressionUnwrapper;
import org.cnext.semantic.TypeResolver;
import org.cnext.semantic.symbol.*;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns the resolved steps of a postfix chain into C. Shared by expression reads
 * and assignment targets; collects the effects the chain needs (headers, helpers,
 * float shadows) for the calling generator to return.
 */
public class AccessChainRenderer
{
	public static final String SAFE_DIV = "safe_div";
	public static final String SAFE_MOD = "safe_mod";

	private final GeneratorInput input;
	private final GeneratorState state;
	private final CodeGenerator orchestrator;
	private final TypeResolver types;
	private final List<GenerationEffect> effects = new ArrayList<>();

	private String separator = ".";

	public AccessChainRenderer(GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		this.input = input;
		this.state = state;
		this.orchestrator = orchestrator;
		this.types = input.getTypeResolver();
	}

	public List<GenerationEffect> getEffects()
	{
		return effects;
	}

	/**
	 * Renders {@code steps[0, end)}.
	 *
	 * @param writeTarget true when the last rendered step is written rather than read
	 * @return the C expression, or null when the prefix names a scope or type
	 */
	public String render(List<AccessStep> steps, int end, boolean writeTarget)
	{
		String code = null;
		separator = ".";
		for (int i = 0; i < end; i++)
		{
			AccessStep step = steps.get(i);
			AccessStep next = i + 1 < steps.size() ? steps.get(i + 1) : null;
			boolean wholeChain = i == steps.size() - 1;
			boolean written = writeTarget && i == end - 1;
			if (i == 0)
			{
				code = renderFirst(step, next, wholeChain);
			}
			else
			{
				String sep = separator;
				separator = ".";
				code = renderNext(step, steps.get(i - 1), code, sep, written);
			}
		}
		return code;
	}

	private String renderFirst(AccessStep step, AccessStep next, boolean wholeChain)
	{
		return switch (step.getKind())
		{
			case LOCAL ->
			{
				Optional<ParameterBinding> parameter = state.getParameter(step.getName());
				if (parameter.isEmpty())
				{
					yield step.getName();
				}
				ParameterBinding binding = parameter.get();
				separator = binding.memberSeparator();
				if (binding.getPassing() == ParameterBinding.Passing.STRUCT_POINTER && wholeChain)
				{
					yield "(*" + binding.getName() + ")";
				}
				yield binding.valueExpression();
			}
			case VARIABLE -> variableCode((VariableSymbol) step.getSymbol(), step.getScope());
			case FUNCTION -> ((FunctionSymbol) step.getSymbol()).getCName();
			case SCOPE, TYPE -> null;
			case EXPRESSION ->
			{
				CNextParser.PrimaryExpressionContext primary = (CNextParser.PrimaryExpressionContext) step.getNode();
				yield wholeChain ? orchestrator.generate(primary) : orchestrator.generateUntyped(primary);
			}
			case UNKNOWN -> unknownIdentifier(step, next);
			default -> throw new IllegalStateException("Unexpected first step " + step);
		};
	}

	private String renderNext(AccessStep step, AccessStep previous, String code, String sep, boolean written)
	{
		return switch (step.getKind())
		{
			case VARIABLE -> variableCode((VariableSymbol) step.getSymbol(), step.getScope());
			case FUNCTION -> ((FunctionSymbol) step.getSymbol()).getCName();
			case SCOPE, TYPE -> null;
			case ENUM_MEMBER -> ((EnumMemberSymbol) step.getSymbol()).getCName();
			case REGISTER_MEMBER ->
			{
				RegisterSymbol register = (RegisterSymbol) previous.getSymbol();
				RegisterMemberSymbol member = (RegisterMemberSymbol) step.getSymbol();
				if (!written && !member.getAccess().isReadable())
				{
					throw new CompileException(ErrorCode.WRITE_ONLY_REGISTER, step.getNode(),
							"Cannot read write-only register member '" + register.getName() + "." + member.getName() + "'");
				}
				yield register.getMemberCName(member.getName());
			}
			case FIELD -> code + sep + step.getName();
			case BITMAP_FIELD -> bitmapRead(code, (BitmapFieldSymbol) step.getSymbol());
			case STRING_LENGTH -> stringLength(code);
			case ARRAY_LENGTH -> step.getName().isEmpty()
					? "(sizeof(" + code + ") / sizeof((" + code + ")[0]))"
					: step.getName();
			case INDEX -> code + "[" + orchestrator.generateUntyped(indexExpression(step, 0)) + "]";
			case BIT -> bitRead(code, previous.getType(), step);
			case BIT_RANGE -> rangeRead(code, previous.getType(), step);
			case CALL -> renderCall(step, previous, code);
			case UNKNOWN -> code == null ? step.getName() : code + sep + step.getName();
			default -> throw new IllegalStateException("Unexpected step " + step);
		};
	}

	private String variableCode(VariableSymbol variable, ScopeSymbol owner)
	{
		if (CodegenUtils.isInlinedConstant(variable, owner))
		{
			return String.valueOf(variable.getConstValue());
		}
		return variable.getCName();
	}

	/**
	 * A name found neither locally nor globally: a bare enum member, a C symbol
	 * from an included header, or an error.
	 */
	private String unknownIdentifier(AccessStep step, AccessStep next)
	{
		String name = step.getName();
		if (next != null && next.getKind() == AccessStep.Kind.CALL)
		{
			return name;
		}

		Optional<TypeDescriptor> expected = state.getExpectedType();
		if (expected.isPresent() && types.isEnumType(expected.get()))
		{
			EnumSymbol enumSymbol = input.getRegistry().findEnum(expected.get().getUserTypeName()).orElseThrow();
			Optional<EnumMemberSymbol> member = enumSymbol.getMember(name);
			if (member.isPresent())
			{
				return member.get().getCName();
			}
		}
		List<EnumSymbol> candidates = input.getRegistry().findEnumsWithMember(name);
		if (candidates.size() == 1)
		{
			return candidates.get(0).getMember(name).orElseThrow().getCName();
		}
		if (candidates.size() > 1)
		{
			String options = candidates.stream().map(e -> e.getName() + "." + name).collect(Collectors.joining(", "));
			throw new CompileException(ErrorCode.AMBIGUOUS_SYMBOL, step.getNode(),
					"'" + name + "' is ambiguous: it could be " + options, "qualify it with the enum name");
		}

		ScopeSymbol scope = state.getCurrentScope();
		if (!scope.isGlobal() && scope.resolveLocally(name).isPresent())
		{
			throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, step.getNode(),
					"'" + name + "' is not declared here", "use 'this." + name + "' to refer to the scope member");
		}
		if (input.isExternalSymbolsAllowed())
		{
			return name;
		}
		throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, step.getNode(), "'" + name + "' is not declared");
	}

	// --- Bit access ---

	private String bitRead(String code, TypeDescriptor type, AccessStep step)
	{
		String index = orchestrator.generateUntyped(indexExpression(step, 0));
		if (type.isFloat())
		{
			String shadow = floatShadow(code, type);
			return "(memcpy(&" + shadow + ", &" + code + ", sizeof(" + code + ")), ((" + shadow + " >> " + index + ") & 1))";
		}
		return "((" + code + " >> " + index + ") & 1)";
	}

	private String rangeRead(String code, TypeDescriptor type, AccessStep step)
	{
		PrimitiveType view = types.integerView(type).orElseThrow();
		String start = orchestrator.generateUntyped(indexExpression(step, 0));
		String mask = rangeMask(indexExpression(step, 1), view.getBits() == 64);
		if (type.isFloat())
		{
			String shadow = floatShadow(code, type);
			return "(memcpy(&" + shadow + ", &" + code + ", sizeof(" + code + ")), ((" + shadow + " >> " + start + ") & " + mask + "))";
		}
		return "((" + code + " >> " + start + ") & " + mask + ")";
	}

	/**
	 * Mask for a bit range width: a literal when the width is constant, else computed.
	 */
	public String rangeMask(CNextParser.ExpressionContext widthExpr, boolean wide)
	{
		Optional<Long> width = ConstantEvaluator.evaluate(widthExpr, constants());
		if (width.isPresent() && width.get() > 0 && width.get() <= 64)
		{
			return CodegenUtils.mask(width.get().intValue(), wide);
		}
		return "((" + CodegenUtils.one(wide) + " << " + orchestrator.generateUntyped(widthExpr) + ") - 1)";
	}

	private String bitmapRead(String code, BitmapFieldSymbol field)
	{
		if (field.getWidth() == 1)
		{
			return "((" + code + " >> " + field.getOffset() + ") & 1)";
		}
		return "((" + code + " >> " + field.getOffset() + ") & " + CodegenUtils.mask(field.getWidth(), false) + ")";
	}

	/**
	 * Declares (once per function) the integer shadow used to address the bits of a float.
	 */
	public String floatShadow(String code, TypeDescriptor floatType)
	{
		String shadow = CodegenUtils.floatShadowName(code);
		TypeDescriptor shadowType = TypeDescriptor.of(floatType.isPrimitive(PrimitiveType.F64) ? PrimitiveType.U64 : PrimitiveType.U32);
		if (!state.getFloatShadows().contains(shadow))
		{
			effects.add(GenerationEffect.registerType(shadow, shadowType));
		}
		effects.add(GenerationEffect.include("<string.h>"));
		return shadow;
	}

	private String stringLength(String code)
	{
		Optional<String> cached = state.getCachedLength(code);
		if (cached.isPresent())
		{
			return cached.get();
		}
		effects.add(GenerationEffect.include("<string.h>"));
		return "strlen(" + code + ")";
	}

	// --- Calls ---

	private String renderCall(AccessStep call, AccessStep callee, String code)
	{
		CNextParser.PostfixOpContext op = (CNextParser.PostfixOpContext) call.getNode();
		List<CNextParser.ExpressionContext> args = op.argumentList() == null ? List.of() : op.argumentList().expression();

		if (callee.getKind() == AccessStep.Kind.UNKNOWN && (SAFE_DIV.equals(callee.getName()) || SAFE_MOD.equals(callee.getName())))
		{
			return safeDivision(callee.getName(), args, op);
		}

		List<String> rendered = new ArrayList<>();
		FunctionSymbol fn = (FunctionSymbol) call.getSymbol();
		if (fn != null && fn.getLanguage() == SourceLanguage.CNEXT)
		{
			if (args.size() != fn.getParameters().size())
			{
				throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, op,
						String.format("'%s' expects %d argument(s) but got %d", fn.getName(), fn.getParameters().size(), args.size()));
			}
			for (int i = 0; i < args.size(); i++)
			{
				rendered.add(argument(fn, fn.getParameters().get(i), args.get(i)));
			}
		}
		else
		{
			for (CNextParser.ExpressionContext arg : args)
			{
				rendered.add(orchestrator.generateUntyped(arg));
			}
		}
		return code + "(" + String.join(", ", rendered) + ")";
	}

	private String argument(FunctionSymbol fn, ParameterSymbol parameter, CNextParser.ExpressionContext arg)
	{
		ParameterBinding binding = input.getSignatureBuilder().bind(fn, parameter);
		if (binding.getPassing() == ParameterBinding.Passing.VALUE || binding.getPassing() == ParameterBinding.Passing.ARRAY)
		{
			return orchestrator.generateWithExpectedType(arg, parameter.getType());
		}

		Optional<String> simple = ExpressionUnwrapper.getSimpleIdentifier(arg);
		if (simple.isPresent())
		{
			Optional<ParameterBinding> own = state.getParameter(simple.get());
			if (own.isPresent() && own.get().isPointer())
			{
				return simple.get();
			}
			checkConstArgument(simple.get(), fn, binding, arg);
		}

		String value = orchestrator.generateWithExpectedType(arg, parameter.getType());
		Optional<CNextParser.PostfixExpressionContext> postfix = ExpressionUnwrapper.unwrapToPostfix(arg);
		if (postfix.isPresent() && isAddressable(postfix.get()))
		{
			return "&" + value;
		}
		if (postfix.isPresent() && postfix.get().postfixOp().isEmpty() && postfix.get().primaryExpression().structInitializer() != null)
		{
			return "&" + value;
		}
		// Not an lvalue: pass the address of a temporary
		return "&(" + types.toCType(parameter.getType()) + "){" + value + "}";
	}

	private boolean isAddressable(CNextParser.PostfixExpressionContext postfix)
	{
		List<AccessStep> steps = types.resolveChain(postfix, state);
		AccessStep last = steps.get(steps.size() - 1);
		switch (last.getKind())
		{
			case LOCAL, FIELD, INDEX:
				return true;
			case VARIABLE:
				return !CodegenUtils.isInlinedConstant((VariableSymbol) last.getSymbol(), last.getScope());
			default:
				return false;
		}
	}

	private void checkConstArgument(String name, FunctionSymbol fn, ParameterBinding binding, CNextParser.ExpressionContext arg)
	{
		if (binding.isConstQualified())
		{
			return;
		}
		boolean isConst = state.lookupLocalType(name).map(TypeDescriptor::isConst)
				.orElseGet(() -> input.getRegistry().getGlobalScope().resolveLocally(name)
						.filter(VariableSymbol.class::isInstance)
						.map(s -> ((VariableSymbol) s).isConst())
						.orElse(false));
		if (isConst)
		{
			throw new CompileException(ErrorCode.INVALID_MODIFIER, arg,
					"Cannot pass const '" + name + "' to non-const parameter '" + binding.getName() + "' of '" + fn.getName() + "'");
		}
	}

	/**
	 * {@code safe_div(out, n, d, fallback)} becomes a call to the typed helper,
	 * which stores the fallback when the divisor is zero.
	 */
	private String safeDivision(String name, List<CNextParser.ExpressionContext> args, CNextParser.PostfixOpContext op)
	{
		if (args.size() != 4)
		{
			throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, op,
					"'" + name + "' expects 4 arguments (output, numerator, divisor, default) but got " + args.size());
		}
		CNextParser.ExpressionContext output = args.get(0);
		TypeDescriptor type = types.resolveExpressionType(output, state)
				.filter(TypeDescriptor::isInteger)
				.orElseThrow(() -> new CompileException(ErrorCode.UNKNOWN_TYPE, output,
						"'" + name + "' needs an integer variable as its output argument"));

		String operation = SAFE_DIV.equals(name) ? "div" : "mod";
		effects.add(GenerationEffect.safeDivHelper(operation, type.getPrimitive()));

		Optional<String> simple = ExpressionUnwrapper.getSimpleIdentifier(output);
		String target = simple.flatMap(state::getParameter).filter(ParameterBinding::isPointer).isPresent()
				? simple.get()
				: "&" + orchestrator.generateUntyped(output);
		TypeDescriptor operandType = type.withConst(false);
		return "cnx_safe_" + operation + "_" + type.getPrimitive().getKeyword() + "("
				+ target + ", "
				+ orchestrator.generateWithExpectedType(args.get(1), operandType) + ", "
				+ orchestrator.generateWithExpectedType(args.get(2), operandType) + ", "
				+ orchestrator.generateWithExpectedType(args.get(3), operandType) + ")";
	}

	// --- Helpers ---

	public static CNextParser.ExpressionContext indexExpression(AccessStep step, int i)
	{
		ParserRuleContext node = step.getNode();
		if (node instanceof CNextParser.PostfixOpContext op)
		{
			return op.expression(i);
		}
		return ((CNextParser.TargetSuffixContext) node).expression(i);
	}

	public Function<String, Optional<Long>> constants()
	{
		return CodegenUtils.constants(state, types);
	}
}
