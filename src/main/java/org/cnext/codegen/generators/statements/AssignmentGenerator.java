package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.LengthCache;
import org.cnext.parser.CNextParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@code target op value;}. Read-modify-write of an atomic variable runs inside
 * a PRIMASK critical section. Repeated string lengths in the value are computed
 * once, in a block around the assignment.
 */
public class AssignmentGenerator implements Generator<CNextParser.AssignmentStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.AssignmentStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		AssignmentRenderer renderer = new AssignmentRenderer(input, state, orchestrator);
		Map<String, String> cached = LengthCache.repeatedLengths(node.expression(), "", input, state, orchestrator);
		String declarations = orchestrator.setupLengthCache(cached);
		String code;
		try
		{
			List<String> statements = renderer.render(node.assignmentTarget(), node.assignmentOperator(), node.expression());
			code = statements.stream().map(s -> s + ";").collect(Collectors.joining("\n"));
		}
		finally
		{
			orchestrator.clearLengthCache();
		}
		if (!cached.isEmpty())
		{
			code = "{\n" + CodeGenerator.indent(declarations + code) + "\n}";
		}

		List<GenerationEffect> effects = new ArrayList<>(renderer.getEffects());
		if (renderer.isAtomic())
		{
			code = CriticalGenerator.wrap(code);
			effects.add(GenerationEffect.irqWrappers());
		}
		return new GeneratorOutput(code, effects);
	}
}
