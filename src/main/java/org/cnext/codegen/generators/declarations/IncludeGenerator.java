package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.IncludeLine;
import org.cnext.parser.CNextParser;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;
import org.cnext.util.FileUtils;

import java.util.Set;

/**
 * Validates an include. The orchestrator renders includes itself, at the top of
 * the file, so this returns no code.
 */
public class IncludeGenerator implements Generator<CNextParser.IncludeDirectiveContext>
{
	private static final Set<String> IMPLEMENTATION_EXTENSIONS = Set.of(".c", ".cpp", ".cc", ".cxx");

	@Override
	public GeneratorOutput generate(CNextParser.IncludeDirectiveContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		IncludeLine include = IncludeLine.parse(node.getText());
		if (IMPLEMENTATION_EXTENSIONS.contains(FileUtils.getFileExtension(include.getTarget())))
		{
			throw new CompileException(ErrorCode.IMPLEMENTATION_INCLUDE, node,
					"Cannot include implementation file '" + include.getTarget() + "'",
					"include its header, or the .cnx source it was generated from");
		}
		return GeneratorOutput.of("");
	}
}
