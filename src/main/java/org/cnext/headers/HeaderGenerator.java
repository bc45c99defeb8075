// File: src/main/java/org/cnext/headers/HeaderGenerator.java
package org.cnext.headers;

import org.cnext.codegen.IncludeLine;
import org.cnext.codegen.SignatureBuilder;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.codegen.generators.declarations.TypeBodyRenderer;
import org.cnext.pipeline.TranspilerOptions;
import org.cnext.semantic.ParameterMutationTable;
import org.cnext.semantic.SymbolRegistry;
import org.cnext.semantic.TypeResolver;
import org.cnext.semantic.symbol.BitmapSymbol;
import org.cnext.semantic.symbol.EnumSymbol;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ParameterSymbol;
import org.cnext.semantic.symbol.RegisterSymbol;
import org.cnext.semantic.symbol.StructSymbol;
import org.cnext.semantic.symbol.Symbol;
import org.cnext.semantic.symbol.VariableSymbol;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.Debug;
import org.cnext.util.FileUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds the public header of one source file from the frozen registry.
 * <p>
 * Subclasses choose the type-body spelling and whether the declarations are
 * wrapped for C linkage. Everything else, section order included, lives here so
 * the two variants cannot drift apart.
 */
public abstract class HeaderGenerator
{
	private static final String ISR_TYPEDEF = String.join("\n",
			"#ifndef CNX_ISR_TYPEDEF",
			"#define CNX_ISR_TYPEDEF",
			"typedef void (*ISR)(void);",
			"#endif");

	protected final SymbolRegistry registry;
	protected final TypeResolver typeResolver;
	protected final SignatureBuilder signatures;
	protected final TranspilerOptions options;
	private final Set<String> callbackTypes;
	private final TypeBodyRenderer types;

	protected HeaderGenerator(TypeResolver typeResolver, ParameterMutationTable mutationTable, TranspilerOptions options, Set<String> callbackTypes)
	{
		this.registry = typeResolver.getRegistry();
		this.typeResolver = typeResolver;
		this.signatures = new SignatureBuilder(typeResolver, mutationTable);
		this.options = options;
		this.callbackTypes = Set.copyOf(callbackTypes);
		this.types = new TypeBodyRenderer(typeResolver, isCppSpelling());
	}

	/**
	 * True when type bodies use the C++ spelling ({@code struct X { ... };}).
	 */
	protected abstract boolean isCppSpelling();

	/**
	 * True when the declarations are wrapped in {@code extern "C"} for C++ callers.
	 */
	protected abstract boolean wrapsExternC();

	/**
	 * {@code .h} or {@code .hpp}, also used for rewritten C-Next includes.
	 */
	public abstract String getExtension();

	/**
	 * True when the file declares anything another file can use.
	 */
	public boolean hasExports(String sourceFile)
	{
		return registry.getSymbolsForFile(sourceFile).stream().anyMatch(Symbol::isExported);
	}

	public String guardName(String baseName)
	{
		String suffix = getExtension().substring(1).toUpperCase(Locale.ROOT);
		return baseName.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_") + "_" + suffix;
	}

	/**
	 * @param sourceFile the file whose exported symbols the header declares
	 * @param includes   the file's own include directives, in source order
	 */
	public String generate(String sourceFile, List<IncludeLine> includes)
	{
		String baseName = FileUtils.getBaseName(sourceFile);
		Debug.logDebug("Generating header " + baseName + getExtension());
		Exports exports = collectExports(sourceFile);
		String guard = guardName(baseName);

		List<String> sections = new ArrayList<>();
		sections.add("#ifndef " + guard + "\n#define " + guard);
		sections.add(renderIncludes(includes, exports));
		if (wrapsExternC())
		{
			sections.add("#ifdef __cplusplus\nextern \"C\" {\n#endif");
		}

		addSection(sections, "/* External type dependencies - include appropriate headers */", renderExternalTypes(exports));
		if (exports.usesIsr)
		{
			sections.add(ISR_TYPEDEF);
		}

		List<String> enums = new ArrayList<>();
		for (EnumSymbol enumSymbol : exports.enums)
		{
			enums.add(types.renderEnum(enumSymbol));
		}
		addSection(sections, "/* Enumerations */", String.join("\n\n", enums));

		List<String> forwards = new ArrayList<>();
		for (StructSymbol struct : exports.structs)
		{
			forwards.add(types.renderStructForward(struct));
		}
		addSection(sections, "/* Forward declarations */", String.join("\n", forwards));

		List<String> callbacks = new ArrayList<>();
		for (FunctionSymbol fn : exports.functions)
		{
			if (callbackTypes.contains(fn.getCName()))
			{
				callbacks.add(signatures.renderCallbackTypedef(fn));
			}
		}
		addSection(sections, "/* Callback typedefs */", String.join("\n", callbacks));

		List<String> definitions = new ArrayList<>();
		if (options.getHeaderLayout() == TranspilerOptions.HeaderLayout.FULL)
		{
			for (StructSymbol struct : exports.structs)
			{
				definitions.add(types.renderStructLayout(struct));
			}
		}
		for (BitmapSymbol bitmap : exports.bitmaps)
		{
			definitions.add(types.renderBitmap(bitmap));
		}
		for (RegisterSymbol register : exports.registers)
		{
			definitions.add(types.renderRegister(register));
		}
		addSection(sections, "/* Type definitions */", String.join("\n\n", definitions));

		List<String> variables = new ArrayList<>();
		for (VariableSymbol variable : exports.variables)
		{
			variables.add(renderExternVariable(variable));
		}
		addSection(sections, "/* External variables */", String.join("\n", variables));

		List<String> prototypes = new ArrayList<>();
		for (FunctionSymbol fn : exports.functions)
		{
			if (!isEntryPoint(fn))
			{
				prototypes.add(signatures.renderPrototype(fn));
			}
		}
		addSection(sections, "/* Function prototypes */", String.join("\n", prototypes));

		if (wrapsExternC())
		{
			sections.add("#ifdef __cplusplus\n}\n#endif");
		}
		sections.add("#endif /* " + guard + " */");

		StringBuilder out = new StringBuilder();
		out.append("/**\n * Generated by cnext-transpiler from ").append(FileUtils.fileName(sourceFile)).append("\n */\n\n");
		out.append(String.join("\n\n", sections)).append('\n');
		return out.toString();
	}

	private static void addSection(List<String> sections, String title, String body)
	{
		if (!body.isBlank())
		{
			sections.add(title + "\n" + body);
		}
	}

	// --- Sections ---

	private String renderIncludes(List<IncludeLine> includes, Exports exports)
	{
		Set<String> lines = new LinkedHashSet<>();
		lines.add("#include <stdint.h>");
		lines.add("#include <stdbool.h>");
		for (IncludeLine include : includes)
		{
			lines.add(include.render(getExtension()));
		}
		for (String type : exports.referencedTypes)
		{
			String header = options.getTypeHeaders().get(type);
			if (header != null)
			{
				lines.add(header.startsWith("<") ? "#include " + header : "#include \"" + header + "\"");
			}
		}
		return String.join("\n", lines);
	}

	/**
	 * Opaque forward declarations for types that come from an unnamed C header.
	 * Mapped types get their header included instead; templated, namespaced and
	 * dotted names cannot be forward-declared this way.
	 */
	private String renderExternalTypes(Exports exports)
	{
		List<String> lines = new ArrayList<>();
		for (String type : exports.referencedTypes)
		{
			if (options.getTypeHeaders().containsKey(type) || type.contains("::") || type.contains("<") || type.contains("."))
			{
				continue;
			}
			if (typeResolver.isOpaqueType(TypeDescriptor.user(type)))
			{
				lines.add("typedef struct " + type + " " + type + ";");
			}
		}
		return String.join("\n", lines);
	}

	private String renderExternVariable(VariableSymbol variable)
	{
		TypeDescriptor type = variable.getType();
		StringBuilder sb = new StringBuilder("extern ");
		if (variable.isConst())
		{
			sb.append("const ");
		}
		if (variable.isVolatile() || type.isAtomic())
		{
			sb.append("volatile ");
		}
		sb.append(CodegenUtils.declarator(type.withConst(false), variable.getCName(), typeResolver)).append(';');
		return sb.toString();
	}

	private boolean isEntryPoint(FunctionSymbol fn)
	{
		return fn.getName().equals(registry.getEntryPoint()) && fn.getCName().equals(fn.getName());
	}

	// --- Export collection ---

	private Exports collectExports(String sourceFile)
	{
		Exports exports = new Exports();
		for (Symbol symbol : registry.getSymbolsForFile(sourceFile))
		{
			if (!symbol.isExported())
			{
				continue;
			}
			if (symbol instanceof EnumSymbol enumSymbol)
			{
				exports.enums.add(enumSymbol);
			}
			else if (symbol instanceof StructSymbol struct)
			{
				exports.structs.add(struct);
				for (StructSymbol.Field field : struct.getFields().values())
				{
					exports.reference(field.getType(), typeResolver);
				}
			}
			else if (symbol instanceof BitmapSymbol bitmap)
			{
				exports.bitmaps.add(bitmap);
			}
			else if (symbol instanceof RegisterSymbol register)
			{
				exports.registers.add(register);
			}
			else if (symbol instanceof VariableSymbol variable)
			{
				if (!CodegenUtils.isInlinedConstant(variable, registry.getScope(variable.getScopeId())))
				{
					exports.variables.add(variable);
					exports.reference(variable.getType(), typeResolver);
				}
			}
			else if (symbol instanceof FunctionSymbol fn)
			{
				exports.functions.add(fn);
				exports.reference(fn.getReturnType(), typeResolver);
				for (ParameterSymbol parameter : fn.getParameters())
				{
					exports.reference(parameter.getType(), typeResolver);
				}
			}
		}
		return exports;
	}

	private static final class Exports
	{
		final List<EnumSymbol> enums = new ArrayList<>();
		final List<StructSymbol> structs = new ArrayList<>();
		final List<BitmapSymbol> bitmaps = new ArrayList<>();
		final List<RegisterSymbol> registers = new ArrayList<>();
		final List<VariableSymbol> variables = new ArrayList<>();
		final List<FunctionSymbol> functions = new ArrayList<>();
		final Set<String> referencedTypes = new TreeSet<>();
		boolean usesIsr;

		void reference(TypeDescriptor type, TypeResolver typeResolver)
		{
			if (type == null || !type.isUserType())
			{
				return;
			}
			if (typeResolver.isIsrType(type))
			{
				usesIsr = true;
				return;
			}
			referencedTypes.add(type.getUserTypeName());
		}
	}
}
