// File: src/main/java/org/cnext/codegen/helpers/OverflowHelperTemplates.java
package org.cnext.codegen.helpers;

import org.cnext.semantic.type.PrimitiveType;

import java.util.ArrayList;
import java.util.List;

/**
 * C text of the {@code cnx_clamp_<op>_<type>} helpers.
 * <p>
 * Three families: unsigned types check the wide operand and then use the
 * {@code __builtin_*_overflow} intrinsics; signed types below 64 bits compute in
 * a wider type and clamp; {@code i64} has no wider type and checks boundary
 * inequalities before computing. In {@link OverflowMode#PANIC} the same checks
 * print a message and abort instead of saturating. The function name is the same
 * in both modes.
 */
final class OverflowHelperTemplates
{
	private static final String INDENT = "    ";

	private OverflowHelperTemplates()
	{
	}

	static String render(String op, PrimitiveType type, OverflowMode mode)
	{
		if (!type.isInteger())
		{
			throw new IllegalArgumentException("No overflow helper for " + type.getKeyword());
		}
		if (!type.isSigned())
		{
			return unsigned(op, type, mode);
		}
		return type.hasWiderType() ? signedWider(op, type, mode) : signedWidest(op, type, mode);
	}

	static String name(String op, PrimitiveType type)
	{
		return "cnx_clamp_" + op + "_" + type.getKeyword();
	}

	private static String signature(String op, PrimitiveType type, String operandB)
	{
		return "static inline " + type.getCType() + " " + name(op, type) + "(" + type.getCType() + " a, " + operandB + " b) {";
	}

	private static String unsigned(String op, PrimitiveType type, OverflowMode mode)
	{
		String t = type.getCType();
		String w = type.getWiderCType();
		String max = type.getMaxMacro();
		String message = "Integer " + ("sub".equals(op) ? "underflow" : "overflow") + " in " + type.getKeyword() + " " + operationName(op);

		String precheck;
		String builtin;
		String limit;
		switch (op)
		{
			case "add" ->
			{
				precheck = "b > (" + w + ")(" + max + " - a)";
				builtin = "__builtin_add_overflow";
				limit = max;
			}
			case "sub" ->
			{
				precheck = "b > (" + w + ")a";
				builtin = "__builtin_sub_overflow";
				limit = "0";
			}
			case "mul" ->
			{
				precheck = "b != 0 && a > " + max + " / b";
				builtin = "__builtin_mul_overflow";
				limit = max;
			}
			default -> throw unknown(op);
		}

		List<String> lines = new ArrayList<>();
		lines.add(signature(op, type, w));
		lines.addAll(guard(precheck, limit, message, mode, 1));
		lines.add(INDENT + t + " result;");
		lines.addAll(guard(builtin + "(a, (" + t + ")b, &result)", limit, message, mode, 1));
		lines.add(INDENT + "return result;");
		lines.add("}");
		return String.join("\n", lines);
	}

	private static String signedWider(String op, PrimitiveType type, OverflowMode mode)
	{
		String t = type.getCType();
		String w = type.getWiderCType();
		String max = type.getMaxMacro();
		String min = type.getMinMacro();
		String message = "Integer overflow in " + type.getKeyword() + " " + operationName(op);

		List<String> lines = new ArrayList<>();
		lines.add(signature(op, type, w));
		lines.add(INDENT + w + " result = (" + w + ")a " + symbol(op) + " b;");
		if (mode == OverflowMode.CLAMP)
		{
			lines.addAll(guard("result > " + max, max, message, mode, 1));
			lines.addAll(guard("result < " + min, min, message, mode, 1));
		}
		else
		{
			lines.addAll(guard("result > " + max + " || result < " + min, null, message, mode, 1));
		}
		lines.add(INDENT + "return (" + t + ")result;");
		lines.add("}");
		return String.join("\n", lines);
	}

	private static String signedWidest(String op, PrimitiveType type, OverflowMode mode)
	{
		String max = type.getMaxMacro();
		String min = type.getMinMacro();
		String message = "Integer overflow in " + type.getKeyword() + " " + operationName(op);

		List<String> lines = new ArrayList<>();
		lines.add(signature(op, type, type.getCType()));
		switch (op)
		{
			case "add" -> boundaryChecks(lines, mode, message, max, min,
					"b > 0 && a > " + max + " - b",
					"b < 0 && a < " + min + " - b");
			case "sub" -> boundaryChecks(lines, mode, message, max, min,
					"b < 0 && a > " + max + " + b",
					"b > 0 && a < " + min + " + b");
			case "mul" ->
			{
				String[] positive = {
						"a > 0 && b > 0 && a > " + max + " / b",
						"a < 0 && b < 0 && a < " + max + " / b"
				};
				String[] negative = {
						"a > 0 && b < 0 && b < " + min + " / a",
						"a < 0 && b > 0 && a < " + min + " / b"
				};
				if (mode == OverflowMode.CLAMP)
				{
					lines.add(INDENT + "if (a == 0 || b == 0) return 0;");
					for (String condition : positive)
					{
						lines.addAll(guard(condition, max, message, mode, 1));
					}
					for (String condition : negative)
					{
						lines.addAll(guard(condition, min, message, mode, 1));
					}
				}
				else
				{
					lines.add(INDENT + "if (a != 0 && b != 0) {");
					String any = "(" + positive[0] + ") ||\n" + INDENT.repeat(3) + "(" + positive[1] + ") ||\n"
							+ INDENT.repeat(3) + "(" + negative[0] + ") ||\n" + INDENT.repeat(3) + "(" + negative[1] + ")";
					lines.addAll(guard(any, null, message, mode, 2));
					lines.add(INDENT + "}");
				}
			}
			default -> throw unknown(op);
		}
		lines.add(INDENT + "return a " + symbol(op) + " b;");
		lines.add("}");
		return String.join("\n", lines);
	}

	private static void boundaryChecks(List<String> lines, OverflowMode mode, String message, String max, String min,
									   String aboveMax, String belowMin)
	{
		if (mode == OverflowMode.CLAMP)
		{
			lines.addAll(guard(aboveMax, max, message, mode, 1));
			lines.addAll(guard(belowMin, min, message, mode, 1));
		}
		else
		{
			lines.addAll(guard("(" + aboveMax + ") || (" + belowMin + ")", null, message, mode, 1));
		}
	}

	/**
	 * Clamp: {@code if (cond) return limit;}. Panic: the condition guards an
	 * {@code fprintf} and {@code abort()}.
	 */
	private static List<String> guard(String condition, String limit, String message, OverflowMode mode, int depth)
	{
		String pad = INDENT.repeat(depth);
		if (mode == OverflowMode.CLAMP)
		{
			return List.of(pad + "if (" + condition + ") return " + limit + ";");
		}
		return List.of(
				pad + "if (" + condition + ") {",
				pad + INDENT + "fprintf(stderr, \"PANIC: " + message + "\\n\");",
				pad + INDENT + "abort();",
				pad + "}");
	}

	private static String operationName(String op)
	{
		return switch (op)
		{
			case "add" -> "addition";
			case "sub" -> "subtraction";
			case "mul" -> "multiplication";
			default -> throw unknown(op);
		};
	}

	private static String symbol(String op)
	{
		return switch (op)
		{
			case "add" -> "+";
			case "sub" -> "-";
			case "mul" -> "*";
			default -> throw unknown(op);
		};
	}

	private static IllegalArgumentException unknown(String op)
	{
		return new IllegalArgumentException("Unknown overflow operation '" + op + "'");
	}
}
