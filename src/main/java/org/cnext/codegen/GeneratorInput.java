package org.cnext.codegen;

import org.cnext.pipeline.TranspilerOptions;
import org.cnext.semantic.EnumTypeResolver;
import org.cnext.semantic.ParameterMutationTable;
import org.cnext.semantic.SymbolRegistry;
import org.cnext.semantic.TypeResolver;

import java.util.Set;

/**
 * Read-only context shared by every generator of one file.
 */
public final class GeneratorInput
{
	private final SymbolRegistry registry;
	private final TypeResolver typeResolver;
	private final EnumTypeResolver enumResolver;
	private final ParameterMutationTable mutationTable;
	private final SignatureBuilder signatureBuilder;
	private final TranspilerOptions options;
	private final String sourceFile;
	private final Set<String> callbackTypes;
	private final boolean externalSymbolsAllowed;

	public GeneratorInput(SymbolRegistry registry, TypeResolver typeResolver, ParameterMutationTable mutationTable,
						  TranspilerOptions options, String sourceFile, Set<String> callbackTypes, boolean externalSymbolsAllowed)
	{
		this.registry = registry;
		this.typeResolver = typeResolver;
		this.enumResolver = new EnumTypeResolver(typeResolver);
		this.mutationTable = mutationTable;
		this.signatureBuilder = new SignatureBuilder(typeResolver, mutationTable);
		this.options = options;
		this.sourceFile = sourceFile;
		this.callbackTypes = Set.copyOf(callbackTypes);
		this.externalSymbolsAllowed = externalSymbolsAllowed;
	}

	public SymbolRegistry getRegistry()
	{
		return registry;
	}

	public TypeResolver getTypeResolver()
	{
		return typeResolver;
	}

	public EnumTypeResolver getEnumResolver()
	{
		return enumResolver;
	}

	public ParameterMutationTable getMutationTable()
	{
		return mutationTable;
	}

	public SignatureBuilder getSignatureBuilder()
	{
		return signatureBuilder;
	}

	public TranspilerOptions getOptions()
	{
		return options;
	}

	public String getSourceFile()
	{
		return sourceFile;
	}

	/**
	 * Mangled names of functions used as a type anywhere in the build.
	 */
	public Set<String> getCallbackTypes()
	{
		return callbackTypes;
	}

	/**
	 * True when the file includes a header, so unresolved names may be C symbols.
	 */
	public boolean isExternalSymbolsAllowed()
	{
		return externalSymbolsAllowed;
	}
}
