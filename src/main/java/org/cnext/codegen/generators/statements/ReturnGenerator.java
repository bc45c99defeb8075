package org.cnext.codegen.generators.statements;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.Generator;
import org.cnext.codegen.GeneratorInput;
import org.cnext.codegen.GeneratorOutput;
import org.cnext.codegen.GeneratorState;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.ExpressionUnwrapper;
import org.cnext.semantic.symbol.FunctionSymbol;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.ErrorCode;

public class ReturnGenerator implements Generator<CNextParser.ReturnStatementContext>
{
	@Override
	public GeneratorOutput generate(CNextParser.ReturnStatementContext node, GeneratorInput input, GeneratorState state, CodeGenerator orchestrator)
	{
		if (ExpressionUnwrapper.findAncestor(node, CNextParser.CriticalStatementContext.class) != null)
		{
			throw new CompileException(ErrorCode.RETURN_IN_CRITICAL, node,
					"'return' inside a critical section", "set a flag and return after the critical block");
		}
		TypeDescriptor returnType = state.getCurrentFunction().map(FunctionSymbol::getReturnType).orElse(TypeDescriptor.VOID);
		boolean isVoid = returnType.isPrimitive(PrimitiveType.VOID);
		if (node.expression() == null)
		{
			if (!isVoid)
			{
				throw new CompileException(ErrorCode.INVALID_MODIFIER, node, "Missing return value of type " + returnType);
			}
			return GeneratorOutput.of("return;");
		}
		if (isVoid)
		{
			throw new CompileException(ErrorCode.INVALID_MODIFIER, node.expression(), "A void function cannot return a value");
		}
		return GeneratorOutput.of("return " + orchestrator.generateWithExpectedType(node.expression(), returnType) + ";");
	}
}
