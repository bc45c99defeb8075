package org.cnext.codegen.generators.expressions;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.ParameterBinding;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.ExpressionUnwrapper;
import org.cnext.semantic.symbol.Symbol;
import org.cnext.semantic.symbol.VariableSymbol;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.Optional;

/**
 * {@code sizeof(type)} and {@code sizeof(value)}. A bare name parses as a type,
 * so names that denote variables are treated as values.
 */
public class SizeofGenerator implements Generator<CNextParser.SizeofExpressionContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.SizeofExpressionContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		if (node.expression() != null)
		{
			CNextParser.ExpressionContext expr = node.expression();
			if (ExpressionUnwrapper.containsFunctionCall(expr))
			{
				throw new CompileException(ErrorCode.SIZEOF_SIDE_EFFECT, expr, "sizeof operand must not contain a function call");
			}
			Optional<String> name = ExpressionUnwrapper.getSimpleIdentifier(expr);
			if (name.isPresent() && state.getParameter(name.get()).isPresent())
			{
				return GeneratorOutput.of(sizeofParameter(state.getParameter(name.get()).get(), node));
			}
			return GeneratorOutput.of("sizeof(" + orchestrator.generateUntyped(expr) + ")");
		}

		CNextParser.TypeContext type = node.type();
		if (type.userType() != null)
		{
			String name = type.userType().IDENTIFIER().getText();
			Optional<ParameterBinding> parameter = state.getParameter(name);
			if (parameter.isPresent())
			{
				return GeneratorOutput.of(sizeofParameter(parameter.get(), node));
			}
			if (state.isLocal(name))
			{
				return GeneratorOutput.of("sizeof(" + name + ")");
			}
			Optional<Symbol> global = input.getRegistry().getGlobalScope().resolveLocally(name);
			if (global.isPresent() && global.get() instanceof VariableSymbol variable)
			{
				return GeneratorOutput.of("sizeof(" + variable.getCName() + ")");
			}
		}
		if (type.scopedType() != null && !state.getCurrentScope().isGlobal())
		{
			Optional<Symbol> member = state.getCurrentScope().resolveLocally(type.scopedType().IDENTIFIER().getText());
			if (member.isPresent() && member.get() instanceof VariableSymbol variable)
			{
				return GeneratorOutput.of("sizeof(" + variable.getCName() + ")");
			}
		}

		TypeDescriptor resolved = input.getTypeResolver().resolveType(type, state.getCurrentScope());
		return GeneratorOutput.of("sizeof(" + input.getTypeResolver().toCType(resolved) + resolved.getCArraySuffix() + ")");
	}

	private static String sizeofParameter(ParameterBinding parameter, CNextParser.SizeofExpressionContext node)
	{
		return switch (parameter.getPassing())
		{
			case ARRAY -> throw new CompileException(ErrorCode.SIZEOF_ARRAY_PARAMETER, node,
					"sizeof on array parameter '" + parameter.getName() + "' gives the size of a pointer",
					"use '" + parameter.getName() + ".length' or pass the size explicitly");
			case VALUE -> "sizeof(" + parameter.getName() + ")";
			default -> "sizeof(*" + parameter.getName() + ")";
		};
	}
}
