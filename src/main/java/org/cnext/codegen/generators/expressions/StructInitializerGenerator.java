package org.cnext.codegen.generators.expressions;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.AccessStep;
import org.cnext.semantic.ExpressionUnwrapper;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.symbol.StructSymbol;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@code Point { x: 1, y: 2 }} becomes {@code { .x = 1, .y = 2 }} where it
 * initializes a declaration and the compound literal {@code (Point){ .x = 1, .y = 2 }}
 * elsewhere.
 */
public class StructInitializerGenerator implements Generator<CNextParser.StructInitializerContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.StructInitializerContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		String name = node.IDENTIFIER().getText();
		TypeDescriptor type = input.getTypeResolver().resolveStructName(name, state.getCurrentScope());
		StructSymbol struct = input.getRegistry().findStruct(type.getUserTypeName())
				.orElseThrow(() -> new CompileException(ErrorCode.UNKNOWN_TYPE, node, "Unknown struct '" + name + "'"));

		List<String> fields = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		List<CNextParser.FieldInitializerContext> initializers = node.fieldInitializerList() == null
				? List.of() : node.fieldInitializerList().fieldInitializer();
		for (CNextParser.FieldInitializerContext init : initializers)
		{
			String fieldName = init.IDENTIFIER().getText();
			StructSymbol.Field field = struct.getField(fieldName).orElseThrow(() ->
					new CompileException(ErrorCode.UNKNOWN_IDENTIFIER, init, "struct '" + struct.getName() + "' has no field '" + fieldName + "'"));
			if (!seen.add(fieldName))
			{
				throw new CompileException(ErrorCode.DUPLICATE_SYMBOL, init, "Field '" + fieldName + "' is initialized twice");
			}
			state.getCallbackFieldType(struct.getCName() + "." + fieldName)
					.or(() -> Optional.of(field.getType()).filter(input.getTypeResolver()::isCallbackType).map(TypeDescriptor::getUserTypeName))
					.ifPresent(callback -> checkCallbackValue(init.expression(), callback, input, state));
			fields.add("." + fieldName + " = " + orchestrator.generateWithExpectedType(init.expression(), field.getType()));
		}

		String body = fields.isEmpty() ? "{0}" : "{ " + String.join(", ", fields) + " }";
		if (initializesDeclaration(node))
		{
			return GeneratorOutput.of(body);
		}
		return GeneratorOutput.of("(" + struct.getCName() + ")" + body);
	}

	private static void checkCallbackValue(CNextParser.ExpressionContext value, String callback, GeneratorInput input, GeneratorState state)
	{
		Optional<CNextParser.PostfixExpressionContext> postfix = ExpressionUnwrapper.unwrapToPostfix(value);
		if (postfix.isEmpty())
		{
			return;
		}
		List<AccessStep> steps = input.getTypeResolver().resolveChain(postfix.get(), state);
		AccessStep last = steps.get(steps.size() - 1);
		if (last.getKind() == AccessStep.Kind.FUNCTION)
		{
			CodegenUtils.checkCallbackCompatible((FunctionSymbol) last.getSymbol(), callback, input, value);
		}
	}

	/**
	 * True when the initializer is the whole value of a declaration, an array
	 * element or an enclosing field, where plain braces are valid C.
	 */
	private static boolean initializesDeclaration(CNextParser.StructInitializerContext node)
	{
		if (node.getParent() instanceof CNextParser.ArrayInitializerElementContext)
		{
			return true;
		}
		ParserRuleContext current = node;
		while (!(current instanceof CNextParser.ExpressionContext))
		{
			ParserRuleContext parent = current.getParent();
			if (parent == null || parent.getChildCount() != 1)
			{
				return false;
			}
			current = parent;
		}
		ParserRuleContext owner = current.getParent();
		return owner instanceof CNextParser.VariableDeclarationContext
				|| owner instanceof CNextParser.FieldInitializerContext
				|| owner instanceof CNextParser.ArrayInitializerElementContext
				|| owner instanceof CNextParser.ForVarDeclContext;
	}
}
