// File: src/main/java/org/cnext/codegen/CodeGenerator.java
package org.cnext.codegen;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.CompilationUnit;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.Debug;
import org.cnext.util.FileUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generates the implementation file of one compilation unit.
 * <p>
 * Dispatches every node to the generator registered for its class and applies the
 * returned effects immediately, in order, so the next sibling sees them. One
 * instance per file; the registry it reads is shared and frozen.
 */
public class CodeGenerator
{
	public static final String INDENT = "    ";

	private static final String ISR_TYPEDEF = String.join("\n",
			"#ifndef CNX_ISR_TYPEDEF",
			"#define CNX_ISR_TYPEDEF",
			"typedef void (*ISR)(void);",
			"#endif");

	private static final String IRQ_WRAPPERS = String.join("\n",
			"static inline void __cnx_disable_irq(void) { __disable_irq(); }",
			"static inline uint32_t __cnx_get_PRIMASK(void) { return __get_PRIMASK(); }",
			"static inline void __cnx_set_PRIMASK(uint32_t mask) { __set_PRIMASK(mask); }");

	private final GeneratorRegistry generators;
	private final GeneratorInput input;
	private final OrchestratorState state;

	public CodeGenerator(GeneratorInput input, GeneratorRegistry generators)
	{
		this.input = input;
		this.generators = generators;
		this.state = new OrchestratorState(input.getRegistry());
	}

	// --- Dispatch ---

	/**
	 * Generates a node and applies its effects before returning its code.
	 */
	public String generate(ParserRuleContext node)
	{
		Class<? extends ParserRuleContext> nodeType = node.getClass();
		Optional<Generator<ParserRuleContext>> generator = generators.lookup(nodeType);
		if (generator.isEmpty())
		{
			// Wrapper rules with a single rule child (statement, declaration, ...)
			ParserRuleContext only = singleRuleChild(node);
			if (only == null)
			{
				throw new IllegalStateException("No generator registered for " + nodeType.getSimpleName());
			}
			return generate(only);
		}
		GeneratorOutput output = generator.get().generate(node, input, state, this);
		applyEffects(output.getEffects());
		return output.getCode();
	}

	/**
	 * Generates a node with the expected type set, for enum member inference and
	 * array initializers. The previous expected type is restored afterwards.
	 * An array expectation clears the element count, so it reflects only this
	 * node's initializer.
	 */
	public String generateWithExpectedType(ParserRuleContext node, TypeDescriptor expectedType)
	{
		if (expectedType != null && expectedType.isArray())
		{
			state.setArrayInitCount(0);
		}
		TypeDescriptor previous = state.swapExpectedType(expectedType);
		try
		{
			return generate(node);
		}
		finally
		{
			state.swapExpectedType(previous);
		}
	}

	/**
	 * Generates a node with no expected type, so an outer expectation does not
	 * leak into sub-expressions of a different type.
	 */
	public String generateUntyped(ParserRuleContext node)
	{
		return generateWithExpectedType(node, null);
	}

	private static ParserRuleContext singleRuleChild(ParserRuleContext node)
	{
		ParserRuleContext found = null;
		for (ParseTree child : node.children == null ? List.<ParseTree>of() : node.children)
		{
			if (child instanceof ParserRuleContext rule)
			{
				if (found != null)
				{
					return null;
				}
				found = rule;
			}
		}
		return found;
	}

	// --- Effects ---

	public void applyEffects(List<GenerationEffect> effects)
	{
		for (GenerationEffect effect : effects)
		{
			apply(effect);
		}
	}

	private void apply(GenerationEffect effect)
	{
		switch (effect.getKind())
		{
			case INCLUDE -> state.addInclude(effect.getName());
			case ISR_TYPEDEF -> state.requireIsrTypedef();
			case IRQ_WRAPPERS ->
			{
				state.requireIrqWrappers();
				state.addInclude("<cmsis_gcc.h>");
			}
			case OVERFLOW_HELPER -> state.getHelperDemand().requireOverflow(effect.getName(), effect.getPrimitive());
			case SAFE_DIV_HELPER -> state.getHelperDemand().requireSafeDiv(effect.getName(), effect.getPrimitive());
			case REGISTER_TYPE -> state.registerType(effect.getName(), effect.getType());
			case REGISTER_LOCAL -> state.registerLocal(effect.getName(), effect.getType(), effect.isArray(), GenerationEffect.WRAP.equals(effect.getValue()));
			case REGISTER_CONST -> state.registerConst(effect.getName(), effect.getCount());
			case PUSH_SCOPE -> state.pushScope(effect.getName());
			case POP_SCOPE -> state.popScope();
			case ENTER_FUNCTION_BODY -> state.enterFunctionBody(effect.getName());
			case EXIT_FUNCTION_BODY -> state.exitFunctionBody();
			case SET_PARAMETERS -> state.setParameters(effect.getParameters());
			case CLEAR_PARAMETERS -> state.clearParameters();
			case REGISTER_CALLBACK_FIELD -> state.registerCallbackField(effect.getName(), effect.getValue());
			case SET_ARRAY_INIT_COUNT -> state.setArrayInitCount(effect.getCount());
		}
	}

	// --- String length cache ---

	/**
	 * Declares cached lengths for strings whose {@code .length} a statement reads
	 * more than once, and makes them visible to the expression generators.
	 *
	 * @param lengthVariables string C name to the cache variable name
	 * @return the declarations to place before the statement
	 */
	public String setupLengthCache(Map<String, String> lengthVariables)
	{
		StringBuilder declarations = new StringBuilder();
		for (Map.Entry<String, String> entry : lengthVariables.entrySet())
		{
			declarations.append("size_t ").append(entry.getValue()).append(" = strlen(").append(entry.getKey()).append(");\n");
			state.cacheLength(entry.getKey(), entry.getValue());
		}
		if (!lengthVariables.isEmpty())
		{
			state.addInclude("<string.h>");
		}
		return declarations.toString();
	}

	public void clearLengthCache()
	{
		state.clearLengthCache();
	}

	// --- Files ---

	public GeneratedFile generateFile(CompilationUnit unit)
	{
		String baseName = FileUtils.getBaseName(unit.getFile());
		Debug.logDebug("Generating " + baseName + input.getOptions().getImplementationExtension());

		List<IncludeLine> includes = new ArrayList<>();
		List<String> body = new ArrayList<>();
		for (ParseTree child : unit.getTree().children)
		{
			if (child instanceof CNextParser.IncludeDirectiveContext include)
			{
				generate(include);
				includes.add(IncludeLine.parse(include.getText()));
			}
			else if (child instanceof ParserRuleContext rule)
			{
				String code = generate(rule);
				if (!code.isBlank())
				{
					body.add(code);
				}
			}
		}

		StringBuilder out = new StringBuilder();
		out.append("/**\n");
		out.append(" * Generated by cnext-transpiler from ").append(FileUtils.fileName(unit.getFile())).append('\n');
		out.append(" */\n\n");

		String headerExtension = input.getOptions().getHeaderExtension();
		if (exportsAnything(unit))
		{
			out.append("#include \"").append(baseName).append(headerExtension).append("\"\n");
		}
		for (IncludeLine include : includes)
		{
			out.append(include.render(headerExtension)).append('\n');
		}
		out.append("#include <stdint.h>\n");
		out.append("#include <stdbool.h>\n");
		for (String header : state.getIncludes())
		{
			out.append("#include ").append(header).append('\n');
		}
		if (!state.getHelperDemand().isEmpty())
		{
			out.append("#include \"").append(input.getOptions().getHelperHeaderName()).append("\"\n");
		}
		out.append('\n');

		if (state.needsIsrTypedef())
		{
			out.append(ISR_TYPEDEF).append("\n\n");
		}
		if (state.needsIrqWrappers())
		{
			out.append(IRQ_WRAPPERS).append("\n\n");
		}
		// Callback typedefs of exported functions are in the header
		for (String callbackType : input.getCallbackTypes().stream().sorted().toList())
		{
			input.getRegistry().findFunction(callbackType)
					.filter(fn -> unit.getFile().equals(fn.getSourceFile()) && !fn.isExported())
					.ifPresent(fn -> out.append(input.getSignatureBuilder().renderCallbackTypedef(fn)).append("\n\n"));
		}
		for (String code : body)
		{
			out.append(code);
			if (!code.endsWith("\n"))
			{
				out.append('\n');
			}
			out.append('\n');
		}

		return new GeneratedFile(unit.getFile(), baseName, out.toString().stripTrailing() + "\n", includes, state.getHelperDemand(), state.needsIsrTypedef());
	}

	private boolean exportsAnything(CompilationUnit unit)
	{
		return input.getRegistry().getSymbolsForFile(unit.getFile()).stream().anyMatch(s -> s.isExported());
	}

	// --- Text utilities for generators ---

	/**
	 * Indents every non-empty line by one level.
	 */
	public static String indent(String code)
	{
		StringBuilder sb = new StringBuilder();
		String[] lines = code.split("\n", -1);
		for (int i = 0; i < lines.length; i++)
		{
			if (!lines[i].isEmpty())
			{
				sb.append(INDENT).append(lines[i]);
			}
			if (i < lines.length - 1)
			{
				sb.append('\n');
			}
		}
		return sb.toString();
	}

	/**
	 * The statements of a generated block without its enclosing braces.
	 */
	public static String blockContents(String blockCode)
	{
		String trimmed = blockCode.trim();
		if (trimmed.startsWith("{") && trimmed.endsWith("}"))
		{
			trimmed = trimmed.substring(1, trimmed.length() - 1);
		}
		StringBuilder sb = new StringBuilder();
		for (String line : trimmed.split("\n"))
		{
			if (line.isBlank())
			{
				continue;
			}
			sb.append(line.startsWith(INDENT) ? line.substring(INDENT.length()) : line).append('\n');
		}
		return sb.toString();
	}
}
