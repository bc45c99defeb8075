package org.cnext.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.semantic.symbol.ScopeSymbol;
import org.cnext.semantic.symbol.Symbol;
import org.cnext.semantic.type.TypeDescriptor;

/**
 * What one prefix of a postfix chain denotes. For {@code this.cfg.speed} the steps are
 * SCOPE (this), VARIABLE (cfg), FIELD (speed).
 */
public final class AccessStep
{
	public enum Kind
	{
		LOCAL,
		VARIABLE,
		SCOPE,
		TYPE,
		FUNCTION,
		CALL,
		FIELD,
		ENUM_MEMBER,
		REGISTER_MEMBER,
		BITMAP_FIELD,
		STRING_LENGTH,
		ARRAY_LENGTH,
		INDEX,
		BIT,
		BIT_RANGE,
		EXPRESSION,
		UNKNOWN
	}

	private final Kind kind;
	private final String name;
	private final TypeDescriptor type;
	private final Symbol symbol;
	private final ScopeSymbol scope;
	private final ParserRuleContext node;

	public AccessStep(Kind kind, String name, TypeDescriptor type, Symbol symbol, ScopeSymbol scope, ParserRuleContext node)
	{
		this.kind = kind;
		this.name = name;
		this.type = type;
		this.symbol = symbol;
		this.scope = scope;
		this.node = node;
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Value type of this prefix, or null when it is not a value or is unknown.
	 */
	public TypeDescriptor getType()
	{
		return type;
	}

	public Symbol getSymbol()
	{
		return symbol;
	}

	/**
	 * For SCOPE steps, the scope named; for members, the scope they were reached through.
	 */
	public ScopeSymbol getScope()
	{
		return scope;
	}

	/**
	 * The primary expression for the first step, the postfix operator for the rest.
	 */
	public ParserRuleContext getNode()
	{
		return node;
	}

	@Override
	public String toString()
	{
		return kind + "(" + name + (type != null ? ": " + type : "") + ")";
	}
}
