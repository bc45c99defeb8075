package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.type.TypeDescriptor;

import java.util.List;

/**
 * {@code for (init; cond; update) body}. A loop variable is registered as a
 * local before the condition is generated. Multi-statement assignments (string
 * copies, float bit writes) are joined with the comma operator.
 */
public class ForGenerator implements Generator<CNextParser.ForStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.ForStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		String init = "";
		if (node.forInit() != null)
		{
			init = node.forInit().forVarDecl() != null
					? declaration(node.forInit().forVarDecl(), input, state, orchestrator)
					: clause(node.forInit().forAssignment().assignmentTarget(), node.forInit().forAssignment().assignmentOperator(),
							node.forInit().forAssignment().expression(), input, state, orchestrator);
		}

		String condition = "";
		if (node.expression() != null)
		{
			Conditions.check(node.expression(), "for", input, state);
			condition = orchestrator.generateUntyped(node.expression());
		}

		String update = "";
		if (node.forUpdate() != null)
		{
			CNextParser.ForUpdateContext u = node.forUpdate();
			update = clause(u.assignmentTarget(), u.assignmentOperator(), u.expression(), input, state, orchestrator);
		}

		String body = BlockGenerator.braced(node.statement(), orchestrator);
		return GeneratorOutput.of("for (" + init + "; " + condition + "; " + update + ") " + body);
	}

	private static String declaration(CNextParser.ForVarDeclContext decl, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		TypeDescriptor type = input.getTypeResolver().resolveType(decl.type(), state.getCurrentScope());
		String name = decl.IDENTIFIER().getText();
		String value = decl.expression() != null
				? orchestrator.generateWithExpectedType(decl.expression(), type)
				: CodegenUtils.zeroValue(type, input);
		orchestrator.applyEffects(List.of(GenerationEffect.registerLocal(name, type, false)));
		return CodegenUtils.declarator(type, name, input.getTypeResolver()) + " = " + value;
	}

	private static String clause(CNextParser.AssignmentTargetContext target, CNextParser.AssignmentOperatorContext operator,
								 CNextParser.ExpressionContext value, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		AssignmentRenderer renderer = new AssignmentRenderer(input, state, orchestrator);
		List<String> parts = renderer.render(target, operator, value);
		orchestrator.applyEffects(renderer.getEffects());
		return String.join(", ", parts);
	}
}
