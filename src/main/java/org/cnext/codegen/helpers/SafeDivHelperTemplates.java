package org.cnext.codegen.helpers;

import org.cnext.semantic.type.PrimitiveType;

/**
 * {@code cnx_safe_div_<type>} and {@code cnx_safe_mod_<type>}: a zero divisor
 * stores the default value and returns {@code true}; otherwise the quotient (or
 * remainder) is stored and the result is {@code false}.
 */
final class SafeDivHelperTemplates
{
	private SafeDivHelperTemplates()
	{
	}

	static String render(String op, PrimitiveType type)
	{
		String operator = switch (op)
		{
			case "div" -> "/";
			case "mod" -> "%";
			default -> throw new IllegalArgumentException("Unknown safe division operation '" + op + "'");
		};
		String t = type.getCType();
		return String.join("\n",
				"static inline bool cnx_safe_" + op + "_" + type.getKeyword() + "(" + t + "* output, " + t + " numerator, " + t + " divisor, " + t + " defaultValue) {",
				"    if (divisor == 0) {",
				"        *output = defaultValue;",
				"        return true;",
				"    }",
				"    *output = numerator " + operator + " divisor;",
				"    return false;",
				"}");
	}
}
