// File: src/main/java/org/cnext/semantic/EnumTypeResolver.java
package org.cnext.semantic;

import org.cnext.parser.CNextParser;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.CompileException;
import org.cnext.util.Debug;

import java.util.List;
import java.util.Optional;

/**
 * Finds the enum type an expression evaluates to, if any.
 * <p>
 * Forms are tried in a fixed order: calls, bare identifiers, {@code Enum.MEMBER}
 * (optionally prefixed by a scope or {@code global.}), {@code this.} forms, and
 * finally struct field chains.
 */
public class EnumTypeResolver
{
	private final TypeResolver typeResolver;

	public EnumTypeResolver(TypeResolver typeResolver)
	{
		this.typeResolver = typeResolver;
	}

	/**
	 * @return the mangled enum name, or empty when the expression is not simple
	 * or is not of an enum type
	 */
	public Optional<String> resolve(CNextParser.ExpressionContext expr, ResolutionContext state)
	{
		Optional<CNextParser.PostfixExpressionContext> postfix = ExpressionUnwrapper.unwrapToPostfix(expr);
		if (postfix.isEmpty())
		{
			return Optional.empty();
		}
		return resolve(postfix.get(), state);
	}

	public Optional<String> resolve(CNextParser.PostfixExpressionContext postfix, ResolutionContext state)
	{
		CNextParser.PrimaryExpressionContext primary = postfix.primaryExpression();
		List<CNextParser.PostfixOpContext> ops = postfix.postfixOp();

		// 1. fn(), this.fn(), Scope.fn(), global.fn(), global.Scope.fn()
		if (!ops.isEmpty() && ops.get(ops.size() - 1).LPAREN() != null)
		{
			return resolveChainType(postfix, state);
		}

		// 2. A local, parameter or global variable
		if (primary.IDENTIFIER() != null && ops.isEmpty())
		{
			Optional<TypeDescriptor> local = state.lookupLocalType(primary.IDENTIFIER().getText());
			if (local.isPresent())
			{
				return enumName(local.get());
			}
			return resolveChainType(postfix, state);
		}

		// 3. Enum.MEMBER, Scope.Enum.MEMBER, global.Enum.MEMBER
		if ((primary.IDENTIFIER() != null || primary.GLOBAL() != null) && allDots(ops))
		{
			Optional<AccessStep> last = lastStep(postfix, state);
			if (last.isPresent() && last.get().getKind() == AccessStep.Kind.ENUM_MEMBER)
			{
				return enumName(last.get().getType());
			}
		}

		// 4. this.x, this.Enum.MEMBER
		if (primary.THIS() != null && state.getCurrentScope().isGlobal())
		{
			return Optional.empty();
		}

		// 5. Struct field chains and whatever else the chain walk can type
		return lastStep(postfix, state).flatMap(step -> enumName(step.getType()));
	}

	/**
	 * The last step of the access chain, or empty when the chain cannot be typed.
	 * Visibility violations are still raised.
	 */
	private Optional<AccessStep> lastStep(CNextParser.PostfixExpressionContext postfix, ResolutionContext state)
	{
		try
		{
			List<AccessStep> steps = typeResolver.resolveChain(postfix, state);
			return Optional.of(steps.get(steps.size() - 1));
		}
		catch (VisibilityException e)
		{
			throw e;
		}
		catch (CompileException e)
		{
			// Rendering the same chain reports the error at its real position
			Debug.logDebug("No enum type for '" + postfix.getText() + "': " + e.getMessage());
			return Optional.empty();
		}
	}

	private Optional<String> resolveChainType(CNextParser.PostfixExpressionContext postfix, ResolutionContext state)
	{
		List<AccessStep> steps = typeResolver.resolveChain(postfix, state);
		return enumName(steps.get(steps.size() - 1).getType());
	}

	private Optional<String> enumName(TypeDescriptor type)
	{
		if (type == null || type.isArray() || !typeResolver.isEnumType(type))
		{
			return Optional.empty();
		}
		return Optional.of(type.getUserTypeName());
	}

	private static boolean allDots(List<CNextParser.PostfixOpContext> ops)
	{
		return ops.stream().allMatch(op -> op.DOT() != null);
	}
}
