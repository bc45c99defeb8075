package org.cnext.codegen.generators.declarations;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;

import java.util.ArrayList;
import java.util.List;

/**
 * A scope has no C counterpart: its members are emitted at file level under
 * mangled names, with the scope pushed while they generate.
 */
public class ScopeGenerator implements Generator<CNextParser.ScopeDeclarationContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.ScopeDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		String name = node.IDENTIFIER().getText();
		orchestrator.applyEffects(List.of(GenerationEffect.pushScope(name)));

		List<String> members = new ArrayList<>();
		for (CNextParser.ScopeMemberContext member : node.scopeMember())
		{
			String code = orchestrator.generate(declarationOf(member));
			if (!code.isBlank())
			{
				members.add(code);
			}
		}

		if (members.isEmpty())
		{
			return GeneratorOutput.of("", GenerationEffect.popScope());
		}
		String code = "/* Scope: " + name + " */\n" + String.join("\n\n", members);
		return GeneratorOutput.of(code, GenerationEffect.popScope());
	}

	private static ParserRuleContext declarationOf(CNextParser.ScopeMemberContext member)
	{
		return member.getRuleContext(ParserRuleContext.class, member.visibilityModifier() != null ? 1 : 0);
	}
}
