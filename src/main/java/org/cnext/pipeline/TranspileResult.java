package org.cnext.pipeline;

import org.cnext.semantic.ParameterMutationTable;
import org.cnext.semantic.SymbolRegistry;
import org.cnext.util.Debug;
import org.cnext.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Everything a build produced. Only files that generated without errors have
 * outputs here; a failed file contributes nothing.
 */
public class TranspileResult
{
	private final SymbolRegistry registry;
	private final ParameterMutationTable mutationTable;
	private final List<OutputFile> outputs;
	private final Set<String> failedFiles;

	public TranspileResult(SymbolRegistry registry, ParameterMutationTable mutationTable, List<OutputFile> outputs, Set<String> failedFiles)
	{
		this.registry = registry;
		this.mutationTable = mutationTable;
		this.outputs = List.copyOf(outputs);
		this.failedFiles = Collections.unmodifiableSet(failedFiles);
	}

	public SymbolRegistry getRegistry()
	{
		return registry;
	}

	public ParameterMutationTable getMutationTable()
	{
		return mutationTable;
	}

	public List<OutputFile> getOutputs()
	{
		return outputs;
	}

	public Optional<OutputFile> getOutput(String fileName)
	{
		return outputs.stream().filter(o -> o.getFileName().equals(fileName)).findFirst();
	}

	public Set<String> getFailedFiles()
	{
		return failedFiles;
	}

	public boolean isSuccess()
	{
		return failedFiles.isEmpty();
	}

	/**
	 * Writes every output. Without an output directory each file goes next to its
	 * source, and the helper header next to the first source.
	 */
	public void write(Path outputDirectory) throws IOException
	{
		Path helperDirectory = outputDirectory;
		for (OutputFile output : outputs)
		{
			if (output.getSourceFile() != null && helperDirectory == null)
			{
				helperDirectory = parentOf(output.getSourceFile());
			}
		}
		for (OutputFile output : outputs)
		{
			Path directory;
			if (outputDirectory != null)
			{
				directory = outputDirectory;
			}
			else if (output.getSourceFile() != null)
			{
				directory = parentOf(output.getSourceFile());
			}
			else
			{
				directory = helperDirectory != null ? helperDirectory : Paths.get(".");
			}
			Path target = directory.resolve(output.getFileName());
			FileUtils.writeString(target, output.getContent());
			Debug.logDebug("Wrote " + target);
		}
	}

	private static Path parentOf(String sourceFile)
	{
		Path parent = Paths.get(sourceFile).toAbsolutePath().getParent();
		return parent != null ? parent : Paths.get(".");
	}
}
