package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.GenerationEffect;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.codegen.generators.LengthCache;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.AccessStep;
import org.cnext.semantic.ConstantEvaluator;
import org.cnext.semantic.ExpressionUnwrapper;
import org.cnext.semantic.TypeResolver;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.symbol.Symbol;
import org.cnext.semantic.symbol.VariableSymbol;
import org.cnext.semantic.symbol.Visibility;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Variable declarations, global and local. Variables without an initializer
 * are zero-initialized. {@code u8 buf[] <- [1, 2, 3]} takes its size from the
 * initializer.
 * <p>
 * Globals: private scope members are {@code static}; private scalar constants
 * of a scope are inlined at their uses and not emitted. Locals are registered
 * with the orchestrator as they are declared. A string length a local's
 * initializer reads more than once is computed once, just before it.
 */
public class VariableGenerator implements Generator<CNextParser.VariableDeclarationContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.VariableDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		if (state.isInFunctionBody())
		{
			return local(node, input, state, orchestrator);
		}
		return global(node, input, state, orchestrator);
	}

	private GeneratorOutput global(CNextParser.VariableDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		ScopeSymbol scope = state.getCurrentScope();
		Symbol symbol = scope.resolveLocally(node.IDENTIFIER().getText()).orElseThrow();
		VariableSymbol variable = (VariableSymbol) symbol;
		if (CodegenUtils.isInlinedConstant(variable, scope))
		{
			return GeneratorOutput.of("");
		}

		List<GenerationEffect> effects = new ArrayList<>();
		StringBuilder prefix = new StringBuilder();
		if (!scope.isGlobal() && variable.getVisibility() == Visibility.PRIVATE)
		{
			prefix.append("static ");
		}
		else if (variable.isConst() && input.getOptions().isCppMode())
		{
			// namespace-scope const has internal linkage in C++
			prefix.append("extern ");
		}
		String declaration = declaration(node, variable.getType(), variable.getCName(), variable.isVolatile(), input, state, orchestrator, effects);
		return new GeneratorOutput(prefix + declaration, effects);
	}

	private GeneratorOutput local(CNextParser.VariableDeclarationContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		TypeResolver types = input.getTypeResolver();
		String name = node.IDENTIFIER().getText();
		if (state.lookupLocalType(name).isPresent())
		{
			throw new CompileException(ErrorCode.DUPLICATE_SYMBOL, node, "'" + name + "' is already declared in this function");
		}
		TypeDescriptor type = types.resolveType(node.type(), state.getCurrentScope(), node.arrayDimension())
				.withConst(node.constModifier() != null)
				.withAtomic(node.atomicModifier() != null);
		if (type.isPrimitive(PrimitiveType.VOID))
		{
			throw new CompileException(ErrorCode.INVALID_MODIFIER, node, "Variable '" + name + "' cannot have type void");
		}
		if (node.constModifier() != null && node.expression() == null)
		{
			throw new CompileException(ErrorCode.INVALID_CONSTANT, node, "Constant '" + name + "' needs an initializer", "add '<- value'");
		}
		boolean wraps = node.overflowModifier() != null && node.overflowModifier().WRAP() != null;
		if (node.overflowModifier() != null && !type.isInteger())
		{
			throw new CompileException(ErrorCode.INVALID_MODIFIER, node, "'" + node.overflowModifier().getText() + "' applies to integer variables only");
		}

		List<GenerationEffect> effects = new ArrayList<>();
		// Cache names carry the variable name, so two declarations never collide
		Map<String, String> cached = node.expression() == null ? Map.of()
				: LengthCache.repeatedLengths(node.expression(), name + "_", input, state, orchestrator);
		String lengths = orchestrator.setupLengthCache(cached);
		String declaration;
		try
		{
			declaration = lengths + declaration(node, type, name, node.volatileModifier() != null, input, state, orchestrator, effects);
		}
		finally
		{
			orchestrator.clearLengthCache();
		}

		TypeDescriptor declared = withInferredSize(type, state);
		effects.add(GenerationEffect.registerLocal(name, declared, declared.isArray(), wraps));
		if (type.isConst() && !type.isArray() && (type.isInteger() || types.isEnumType(type)))
		{
			ConstantEvaluator.evaluate(node.expression(), CodegenUtils.constants(state, types))
					.ifPresent(value -> effects.add(GenerationEffect.registerConst(name, value)));
		}
		return new GeneratorOutput(declaration, effects);
	}

	/**
	 * {@code [const ][volatile ]T name[N] = value;}
	 */
	private String declaration(CNextParser.VariableDeclarationContext node, TypeDescriptor type, String cName, boolean isVolatile,
							   GeneratorInput input, GeneratorState state, CodeGenerator orchestrator, List<GenerationEffect> effects)
	{
		TypeResolver types = input.getTypeResolver();
		if (types.isIsrType(type))
		{
			effects.add(GenerationEffect.isrTypedef());
		}

		String value;
		TypeDescriptor declared = type;
		if (node.expression() != null)
		{
			checkInitializer(node.expression(), type, input, state);
			value = orchestrator.generateWithExpectedType(node.expression(), type.withConst(false));
			declared = withInferredSize(type, state);
		}
		else
		{
			value = CodegenUtils.zeroValue(type, input);
			if ("NULL".equals(value))
			{
				effects.add(GenerationEffect.include("<stddef.h>"));
			}
			if (type.getDimensions().contains(""))
			{
				throw new CompileException(ErrorCode.INVALID_CONSTANT, node,
						"Array '" + node.IDENTIFIER().getText() + "' has no size and no initializer", "give the size or an initializer");
			}
		}

		StringBuilder sb = new StringBuilder();
		if (type.isConst())
		{
			sb.append("const ");
		}
		if (isVolatile || type.isAtomic())
		{
			sb.append("volatile ");
		}
		sb.append(CodegenUtils.declarator(declared, cName, types)).append(" = ").append(value).append(';');
		return sb.toString();
	}

	private static TypeDescriptor withInferredSize(TypeDescriptor type, GeneratorState state)
	{
		if (!type.isArray() || !type.getDimensions().get(0).isEmpty() || state.getArrayInitCount() == 0)
		{
			return type;
		}
		List<String> dims = new ArrayList<>(type.getDimensions());
		dims.set(0, String.valueOf(state.getArrayInitCount()));
		return type.withDimensions(dims);
	}

	private void checkInitializer(CNextParser.ExpressionContext value, TypeDescriptor type, GeneratorInput input, GeneratorState state)
	{
		TypeResolver types = input.getTypeResolver();
		if (type.isString() && !type.isArray())
		{
			Optional<CNextParser.LiteralContext> literal = ExpressionUnwrapper.getLiteral(value).filter(l -> l.STRING_LITERAL() != null);
			if (literal.isPresent() && literal.get().getText().length() - 2 > type.getStringCapacity())
			{
				throw new CompileException(ErrorCode.INVALID_CONSTANT, value,
						String.format("String literal of length %d does not fit string<%d>", literal.get().getText().length() - 2, type.getStringCapacity()));
			}
		}
		if (types.isCallbackType(type))
		{
			Optional<CNextParser.PostfixExpressionContext> postfix = ExpressionUnwrapper.unwrapToPostfix(value);
			if (postfix.isPresent())
			{
				List<AccessStep> steps = types.resolveChain(postfix.get(), state);
				AccessStep last = steps.get(steps.size() - 1);
				if (last.getKind() == AccessStep.Kind.FUNCTION)
				{
					CodegenUtils.checkCallbackCompatible((FunctionSymbol) last.getSymbol(), type.getUserTypeName(), input, value);
				}
			}
		}
	}
}
