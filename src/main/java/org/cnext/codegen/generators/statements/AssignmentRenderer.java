// File: src/main/java/org/cnext/codegen/generators/statements/AssignmentRenderer.java
package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.codegen.generators.expressions.AccessChainRenderer;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.AccessStep;
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

/**
 * Renders {@code target op value} as one or more C expression statements
 * (without semicolons). Used by assignment statements and by the init and update
 * clauses of {@code for}.
 * <p>
 * Integer {@code +<- -<- *<-} go through the clamp helpers unless the target is
 * declared {@code wrap}. Bit, bit-range and bitmap-field targets become
 * read-modify-write expressions; float bits go through an integer shadow.
 */
public class AssignmentRenderer
{
	private final GeneratorInput input;
	private final GeneratorState state;
	private final CodeGenerator orchestrator;
	private final TypeResolver types;
	private final AccessChainRenderer chain;
	private final List<GenerationEffect> effects = new ArrayList<>();
	private boolean atomic;

	public AssignmentRenderer(GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		this.input = input;
		this.state = state;
		this.orchestrator = orchestrator;
		this.types = input.getTypeResolver();
		this.chain = new AccessChainRenderer(input, state, orchestrator);
	}

	public List<GenerationEffect> getEffects()
	{
		List<GenerationEffect> all = new ArrayList<>(chain.getEffects());
		all.addAll(effects);
		return all;
	}

	/**
	 * True when the last rendered assignment was a read-modify-write of an
	 * {@code atomic} variable and must run with interrupts disabled.
	 */
	public boolean isAtomic()
	{
		return atomic;
	}

	public List<String> render(CNextParser.AssignmentTargetContext target, CNextParser.AssignmentOperatorContext operator,
							   CNextParser.ExpressionContext value)
	{
		List<AccessStep> steps = types.resolveTarget(target, state);
		AccessStep last = steps.get(steps.size() - 1);
		String op = operator.getText();
		String arith = op.substring(0, op.length() - 2);

		checkNotConstant(steps, target);
		atomic = !arith.isEmpty() && isAtomicRoot(steps);

		switch (last.getKind())
		{
			case BIT:
				requirePlain(arith, operator, "a single bit");
				return bitWrite(steps, value, target);
			case BIT_RANGE:
				requirePlain(arith, operator, "a bit range");
				return rangeWrite(steps, value, target);
			case BITMAP_FIELD:
				requirePlain(arith, operator, "a bitmap field");
				return bitmapWrite(steps, value);
			case REGISTER_MEMBER:
				return registerWrite(steps, arith, value, target);
			default:
				break;
		}
		if (last.getType() != null && last.getType().isString() && !last.getType().isArray())
		{
			return stringWrite(steps, arith, value, operator);
		}
		return plainWrite(steps, arith, value);
	}

	// --- Plain targets ---

	private List<String> plainWrite(List<AccessStep> steps, String arith, CNextParser.ExpressionContext value)
	{
		AccessStep last = steps.get(steps.size() - 1);
		String lhs = chain.render(steps, steps.size(), true);
		if (lhs == null)
		{
			throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, last.getNode(), "'" + last.getName() + "' cannot be assigned");
		}
		TypeDescriptor type = last.getType();
		if (type != null && types.isCallbackType(type))
		{
			checkCallbackValue(value, type.getUserTypeName());
		}
		String rhs = type != null
				? orchestrator.generateWithExpectedType(value, type.withConst(false))
				: orchestrator.generateUntyped(value);

		if (arith.isEmpty())
		{
			return List.of(lhs + " = " + rhs);
		}
		String helperOp = overflowOperation(arith);
		if (helperOp != null && type != null && type.isInteger() && !wraps(steps))
		{
			PrimitiveType primitive = type.getPrimitive();
			effects.add(GenerationEffect.overflowHelper(helperOp, primitive));
			return List.of(lhs + " = cnx_clamp_" + helperOp + "_" + primitive.getKeyword() + "(" + lhs + ", " + rhs + ")");
		}
		return List.of(lhs + " " + arith + "= " + rhs);
	}

	private static String overflowOperation(String arith)
	{
		return switch (arith)
		{
			case "+" -> "add";
			case "-" -> "sub";
			case "*" -> "mul";
			default -> null;
		};
	}

	private boolean wraps(List<AccessStep> steps)
	{
		AccessStep last = steps.get(steps.size() - 1);
		if (last.getKind() == AccessStep.Kind.VARIABLE)
		{
			return ((VariableSymbol) last.getSymbol()).getOverflow() == OverflowBehavior.WRAP;
		}
		return last.getKind() == AccessStep.Kind.LOCAL && state.isWrappingLocal(last.getName());
	}

	private void checkCallbackValue(CNextParser.ExpressionContext value, String callbackType)
	{
		Optional<CNextParser.PostfixExpressionContext> postfix = ExpressionUnwrapper.unwrapToPostfix(value);
		if (postfix.isEmpty())
		{
			return;
		}
		List<AccessStep> steps = types.resolveChain(postfix.get(), state);
		AccessStep last = steps.get(steps.size() - 1);
		if (last.getKind() == AccessStep.Kind.FUNCTION)
		{
			CodegenUtils.checkCallbackCompatible((FunctionSymbol) last.getSymbol(), callbackType, input, value);
		}
	}

	// --- Bits ---

	private List<String> bitWrite(List<AccessStep> steps, CNextParser.ExpressionContext value, CNextParser.AssignmentTargetContext target)
	{
		AccessStep bit = steps.get(steps.size() - 1);
		AccessStep owner = steps.get(steps.size() - 2);
		boolean direct = isDirectRegisterWrite(owner, target);
		String base = chain.render(steps, steps.size() - 1, direct);
		TypeDescriptor ownerType = owner.getType();
		boolean wide = types.integerView(ownerType).map(p -> p.getBits() == 64).orElse(false);
		String index = orchestrator.generateUntyped(AccessChainRenderer.indexExpression(bit, 0));
		String one = CodegenUtils.one(wide);

		Optional<Boolean> literal = booleanLiteral(value);
		String bitValue = literal.isPresent()
				? (literal.get() ? "(" + one + " << " + index + ")" : null)
				: bitExpression(orchestrator.generateUntyped(value), wide) + " << " + index + ")";

		if (direct)
		{
			return List.of(base + " = " + (bitValue != null ? bitValue : "0"));
		}
		if (ownerType.isFloat())
		{
			String shadow = chain.floatShadow(base, ownerType);
			return floatUpdate(base, shadow, clearAndSet(shadow, "(" + one + " << " + index + ")", bitValue));
		}
		return List.of(base + " = " + clearAndSet(base, "(" + one + " << " + index + ")", bitValue));
	}

	private List<String> rangeWrite(List<AccessStep> steps, CNextParser.ExpressionContext value, CNextParser.AssignmentTargetContext target)
	{
		AccessStep range = steps.get(steps.size() - 1);
		AccessStep owner = steps.get(steps.size() - 2);
		boolean direct = isDirectRegisterWrite(owner, target);
		String base = chain.render(steps, steps.size() - 1, direct);
		TypeDescriptor ownerType = owner.getType();
		boolean wide = types.integerView(ownerType).map(p -> p.getBits() == 64).orElse(false);
		String start = orchestrator.generateUntyped(AccessChainRenderer.indexExpression(range, 0));
		String mask = chain.rangeMask(AccessChainRenderer.indexExpression(range, 1), wide);
		String rhs = orchestrator.generateUntyped(value);
		String inserted = "((" + (wide ? "(uint64_t)" : "") + rhs + " & " + mask + ") << " + start + ")";

		if (direct)
		{
			return List.of(base + " = " + inserted);
		}
		String field = "(" + mask + " << " + start + ")";
		if (ownerType.isFloat())
		{
			String shadow = chain.floatShadow(base, ownerType);
			return floatUpdate(base, shadow, clearAndSet(shadow, field, inserted));
		}
		return List.of(base + " = " + clearAndSet(base, field, inserted));
	}

	private List<String> bitmapWrite(List<AccessStep> steps, CNextParser.ExpressionContext value)
	{
		BitmapFieldSymbol field = (BitmapFieldSymbol) steps.get(steps.size() - 1).getSymbol();
		String base = chain.render(steps, steps.size() - 1, false);
		int offset = field.getOffset();
		if (field.getWidth() == 1)
		{
			Optional<Boolean> literal = booleanLiteral(value);
			String bitValue = literal.isPresent()
					? (literal.get() ? "(1U << " + offset + ")" : null)
					: bitExpression(orchestrator.generateUntyped(value), false) + " << " + offset + ")";
			return List.of(base + " = " + clearAndSet(base, "(1U << " + offset + ")", bitValue));
		}
		String mask = CodegenUtils.mask(field.getWidth(), false);
		String inserted = "((" + orchestrator.generateUntyped(value) + " & " + mask + ") << " + offset + ")";
		return List.of(base + " = " + clearAndSet(base, "(" + mask + " << " + offset + ")", inserted));
	}

	/**
	 * {@code (x & ~field) | value}, or only the clear when the value is a literal zero.
	 */
	private static String clearAndSet(String base, String field, String value)
	{
		String cleared = "(" + base + " & ~" + field + ")";
		return value == null ? cleared : cleared + " | " + value;
	}

	/**
	 * Opening half of {@code ((v ? 1U : 0U) << n)}; the caller appends the shift.
	 */
	private static String bitExpression(String value, boolean wide)
	{
		return wide ? "((uint64_t)" + value : "((" + value + " ? 1U : 0U)";
	}

	private List<String> floatUpdate(String target, String shadow, String update)
	{
		return List.of(
				"memcpy(&" + shadow + ", &" + target + ", sizeof(" + target + "))",
				shadow + " = " + update,
				"memcpy(&" + target + ", &" + shadow + ", sizeof(" + target + "))");
	}

	private static Optional<Boolean> booleanLiteral(CNextParser.ExpressionContext value)
	{
		return ExpressionUnwrapper.getLiteral(value)
				.filter(l -> l.TRUE() != null || l.FALSE() != null)
				.map(l -> l.TRUE() != null);
	}

	// --- Registers ---

	/**
	 * Write-only and write-1 members cannot be read back, so their bits are
	 * written directly instead of read-modify-write.
	 */
	private boolean isDirectRegisterWrite(AccessStep owner, CNextParser.AssignmentTargetContext target)
	{
		if (owner.getKind() != AccessStep.Kind.REGISTER_MEMBER)
		{
			return false;
		}
		RegisterMemberSymbol member = (RegisterMemberSymbol) owner.getSymbol();
		if (!member.getAccess().isWritable())
		{
			throw readOnly(member, target);
		}
		return !member.getAccess().isReadable();
	}

	private List<String> registerWrite(List<AccessStep> steps, String arith, CNextParser.ExpressionContext value,
									   CNextParser.AssignmentTargetContext target)
	{
		RegisterMemberSymbol member = (RegisterMemberSymbol) steps.get(steps.size() - 1).getSymbol();
		if (!member.getAccess().isWritable())
		{
			throw readOnly(member, target);
		}
		if (!arith.isEmpty() && !member.getAccess().isReadable())
		{
			throw new CompileException(ErrorCode.WRITE_ONLY_REGISTER, target,
					"Compound assignment reads register member '" + member.getName() + "', which is " + member.getAccess().name().toLowerCase(),
					"use '<-' to write it");
		}
		String lhs = chain.render(steps, steps.size(), true);
		String rhs = orchestrator.generateWithExpectedType(value, member.getType());
		return List.of(arith.isEmpty() ? lhs + " = " + rhs : lhs + " " + arith + "= " + rhs);
	}

	private static CompileException readOnly(RegisterMemberSymbol member, CNextParser.AssignmentTargetContext target)
	{
		return new CompileException(ErrorCode.READ_ONLY_REGISTER, target, "Cannot write read-only register member '" + member.getName() + "'");
	}

	// --- Strings ---

	private List<String> stringWrite(List<AccessStep> steps, String arith, CNextParser.ExpressionContext value,
									 CNextParser.AssignmentOperatorContext operator)
	{
		TypeDescriptor type = steps.get(steps.size() - 1).getType();
		int capacity = type.getStringCapacity();
		String lhs = chain.render(steps, steps.size(), true);
		String rhs = orchestrator.generateUntyped(value);
		effects.add(GenerationEffect.include("<string.h>"));

		Optional<CNextParser.LiteralContext> literal = ExpressionUnwrapper.getLiteral(value).filter(l -> l.STRING_LITERAL() != null);
		if (literal.isPresent() && arith.isEmpty() && literal.get().getText().length() - 2 > capacity)
		{
			throw new CompileException(ErrorCode.INVALID_CONSTANT, value,
					String.format("String literal of length %d does not fit string<%d>", literal.get().getText().length() - 2, capacity));
		}
		if (arith.isEmpty())
		{
			return List.of("strncpy(" + lhs + ", " + rhs + ", " + capacity + ")", lhs + "[" + capacity + "] = '\\0'");
		}
		if ("+".equals(arith))
		{
			return List.of("strncat(" + lhs + ", " + rhs + ", " + capacity + " - strlen(" + lhs + "))");
		}
		throw new CompileException(ErrorCode.INVALID_MODIFIER, operator, "'" + operator.getText() + "' cannot be applied to a string");
	}

	// --- Checks ---

	private void requirePlain(String arith, CNextParser.AssignmentOperatorContext operator, String what)
	{
		if (!arith.isEmpty())
		{
			throw new CompileException(ErrorCode.INVALID_MODIFIER, operator, "Only '<-' can assign " + what);
		}
	}

	private void checkNotConstant(List<AccessStep> steps, CNextParser.AssignmentTargetContext target)
	{
		for (AccessStep step : steps)
		{
			boolean named = step.getKind() == AccessStep.Kind.LOCAL || step.getKind() == AccessStep.Kind.VARIABLE;
			if (named && step.getType() != null && step.getType().isConst())
			{
				throw new CompileException(ErrorCode.INVALID_MODIFIER, target, "Cannot assign to constant '" + step.getName() + "'");
			}
		}
	}

	private static boolean isAtomicRoot(List<AccessStep> steps)
	{
		for (AccessStep step : steps)
		{
			if (step.getKind() == AccessStep.Kind.VARIABLE || step.getKind() == AccessStep.Kind.LOCAL)
			{
				return step.getType() != null && step.getType().isAtomic();
			}
		}
		return false;
	}
}
