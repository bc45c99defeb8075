package org.cnext.codegen.generators.statements;

import org.antlr.v4.runtime.tree.TerminalNode;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.NameMangler;
import org.cnext.semantic.SymbolRegistry;
import org.cnext.semantic.symbol.EnumMemberSymbol;
import org.cnext.semantic.symbol.EnumSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.symbol.Symbol;
import org.cnext.semantic.symbol.VariableSymbol;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code switch}. Every case body is braced and ends in {@code break;}; C-Next
 * has no fallthrough. {@code A || B} labels become stacked C labels.
 * <p>
 * Bare labels are members of the switched enum when it has one. On an enum
 * switch, {@code default(n)} states how many members the default covers, and
 * the count is checked.
 */
public class SwitchGenerator implements Generator<CNextParser.SwitchStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.SwitchStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		String subject = orchestrator.generateUntyped(node.expression());
		Optional<EnumSymbol> enumType = input.getEnumResolver().resolve(node.expression(), state)
				.flatMap(name -> input.getRegistry().findEnum(name));

		Set<String> seen = new HashSet<>();
		List<String> cases = new ArrayList<>();
		for (CNextParser.SwitchCaseContext switchCase : node.switchCase())
		{
			List<String> labels = new ArrayList<>();
			for (CNextParser.CaseLabelContext label : switchCase.caseLabel())
			{
				String rendered = renderLabel(label, enumType, input, state);
				if (!seen.add(rendered))
				{
					throw new CompileException(ErrorCode.DUPLICATE_SYMBOL, label, "Duplicate case label '" + label.getText() + "'");
				}
				labels.add("case " + rendered + ":");
			}
			cases.add(caseBody(String.join("\n", labels), switchCase.block(), orchestrator));
		}

		CNextParser.DefaultCaseContext defaultCase = node.defaultCase();
		if (defaultCase != null)
		{
			if (defaultCase.INTEGER_LITERAL() != null && enumType.isPresent())
			{
				checkDefaultCount(defaultCase, enumType.get(), seen);
			}
			cases.add(caseBody("default:", defaultCase.block(), orchestrator));
		}

		String code = "switch (" + subject + ") {\n" + CodeGenerator.indent(String.join("\n", cases)) + "\n}";
		return GeneratorOutput.of(code);
	}

	private static String caseBody(String labels, CNextParser.BlockContext block, CodeGenerator orchestrator)
	{
		String body = CodeGenerator.blockContents(orchestrator.generate(block));
		return labels + " {\n" + CodeGenerator.indent(body + "break;") + "\n}";
	}

	private static void checkDefaultCount(CNextParser.DefaultCaseContext defaultCase, EnumSymbol enumSymbol, Set<String> covered)
	{
		long remaining = enumSymbol.getMembers().values().stream()
				.map(EnumMemberSymbol::getCName)
				.filter(cName -> !covered.contains(cName))
				.count();
		long declared = Long.parseLong(defaultCase.INTEGER_LITERAL().getText());
		if (declared != remaining)
		{
			throw new CompileException(ErrorCode.INVALID_CONSTANT, defaultCase,
					String.format("default(%d) does not match the %d unhandled members of %s", declared, remaining, enumSymbol.getName()));
		}
	}

	private String renderLabel(CNextParser.CaseLabelContext label, Optional<EnumSymbol> enumType, GeneratorInput input, GeneratorState state)
	{
		if (label.qualifiedType() != null)
		{
			return qualifiedLabel(label.qualifiedType(), input, state);
		}
		if (label.IDENTIFIER() != null)
		{
			return identifierLabel(label.IDENTIFIER().getText(), label, enumType, input, state);
		}
		if (label.CHAR_LITERAL() != null)
		{
			return label.CHAR_LITERAL().getText();
		}
		String sign = label.MINUS() != null ? "-" : "";
		if (label.BINARY_LITERAL() != null)
		{
			return sign + CodegenUtils.binaryToHex(label.BINARY_LITERAL().getText());
		}
		TerminalNode number = label.HEX_LITERAL() != null ? label.HEX_LITERAL() : label.INTEGER_LITERAL();
		String text = number.getText();
		BigInteger value = label.HEX_LITERAL() != null ? new BigInteger(text.substring(2), 16) : new BigInteger(text);
		return sign + text + CodegenUtils.wideSuffix(value);
	}

	private String qualifiedLabel(CNextParser.QualifiedTypeContext qualified, GeneratorInput input, GeneratorState state)
	{
		List<String> parts = qualified.IDENTIFIER().stream().map(TerminalNode::getText).toList();
		String member = parts.get(parts.size() - 1);
		String owner = NameMangler.joinQualified(parts.subList(0, parts.size() - 1));
		SymbolRegistry registry = input.getRegistry();

		Optional<EnumSymbol> enumSymbol = registry.findEnum(owner);
		ScopeSymbol scope = state.getCurrentScope();
		if (enumSymbol.isEmpty() && scope != null && !scope.isGlobal())
		{
			enumSymbol = registry.findEnum(NameMangler.forMember(scope.getPath(), owner));
		}
		if (enumSymbol.isPresent())
		{
			EnumSymbol found = enumSymbol.get();
			return found.getMember(member)
					.map(EnumMemberSymbol::getCName)
					.orElseThrow(() -> new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, qualified,
							"'" + member + "' is not a member of " + found.getName()));
		}
		Optional<VariableSymbol> constant = registry.findVariable(NameMangler.joinQualified(parts));
		if (constant.isPresent())
		{
			return constant.get().getCName();
		}
		throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, qualified, "Unknown case label '" + qualified.getText() + "'");
	}

	private String identifierLabel(String name, CNextParser.CaseLabelContext label, Optional<EnumSymbol> enumType,
								   GeneratorInput input, GeneratorState state)
	{
		if (enumType.isPresent())
		{
			Optional<EnumMemberSymbol> member = enumType.get().getMember(name);
			if (member.isPresent())
			{
				return member.get().getCName();
			}
		}
		if (state.isLocal(name))
		{
			return name;
		}
		ScopeSymbol scope = state.getCurrentScope();
		if (scope != null)
		{
			Optional<Symbol> scoped = scope.resolveLocally(name);
			if (scoped.isPresent() && scoped.get() instanceof VariableSymbol variable)
			{
				return CodegenUtils.isInlinedConstant(variable, scope) ? String.valueOf(variable.getConstValue()) : variable.getCName();
			}
		}
		Optional<Symbol> global = input.getRegistry().getGlobalScope().resolveLocally(name);
		if (global.isPresent() && global.get() instanceof VariableSymbol variable)
		{
			return variable.getCName();
		}
		if (input.isExternalSymbolsAllowed())
		{
			return name;
		}
		throw new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, label, "Unknown case label '" + name + "'");
	}
}
