package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags and conditional compilation pass through. Macros with parameters or
 * values are rejected in favor of functions and typed constants.
 */
public class PreprocessorGenerator implements Generator<CNextParser.PreprocessorDirectiveContext>
{
	private static final Pattern DEFINE = Pattern.compile("#\\s*define\\s+(\\w+)\\s*(.*)");

	@Override
	public GeneratorOutput generate(CNextParser.PreprocessorDirectiveContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		CNextParser.DefineDirectiveContext define = node.defineDirective();
		if (define != null && define.DEFINE_FUNCTION() != null)
		{
			throw new CompileException(ErrorCode.FUNCTION_MACRO, node,
					"Function-like macro '" + macroName(define) + "' is not allowed", "declare a function instead");
		}
		if (define != null && define.DEFINE_WITH_VALUE() != null)
		{
			Matcher matcher = DEFINE.matcher(define.getText().trim());
			String name = matcher.matches() ? matcher.group(1) : macroName(define);
			String value = matcher.matches() ? matcher.group(2).trim() : "value";
			throw new CompileException(ErrorCode.DEFINE_WITH_VALUE, node,
					"#define with a value is not allowed: '" + name + "'", "use a constant: const u32 " + name + " <- " + value + ";");
		}
		return GeneratorOutput.of(node.getText().trim());
	}

	private static String macroName(CNextParser.DefineDirectiveContext define)
	{
		Matcher matcher = Pattern.compile("#\\s*define\\s+(\\w+)").matcher(define.getText());
		return matcher.find() ? matcher.group(1) : define.getText();
	}
}
