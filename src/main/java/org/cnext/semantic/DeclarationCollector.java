// File: src/main/java/org/cnext/semantic/DeclarationCollector.java
package org.cnext.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.cnext.parser.CNextBaseVisitor;
import org.cnext.parser.CNextParser;
import org.cnext.semantic.symbol.*;
import org.cnext.semantic.type.PrimitiveType;
import org.cnext.semantic.type.TypeDescriptor;
import org.cnext.util.Debug;
import org.cnext.util.ErrorCode;

import java.util.*;

/**
 * Registers the declarations of one file.
 * <p>
 * Runs twice over every file. The discovery run ({@code discoveryOnly}) registers
 * scopes and the names of all types, so the second run can resolve any type
 * reference regardless of file order. The second run registers struct fields,
 * register members, functions and variables.
 */
public class DeclarationCollector extends CNextBaseVisitor<Void>
{
	private final SymbolRegistry registry;
	private final TypeResolver typeResolver;
	private final String file;
	private final Set<String> headerTypes;
	private final boolean discoveryOnly;
	private final List<TypeReference> typeReferences = new ArrayList<>();
	private ScopeSymbol currentScope;
	private boolean allowExternalTypes;

	public DeclarationCollector(SymbolRegistry registry, TypeResolver typeResolver, String file, Set<String> headerTypes, boolean discoveryOnly)
	{
		this.registry = registry;
		this.typeResolver = typeResolver;
		this.file = file;
		this.headerTypes = headerTypes;
		this.discoveryOnly = discoveryOnly;
		this.currentScope = registry.getGlobalScope();
	}

	@Override
	public Void visitProgram(CNextParser.ProgramContext ctx)
	{
		allowExternalTypes = !ctx.includeDirective().isEmpty();
		for (CNextParser.DeclarationContext declaration : ctx.declaration())
		{
			visit(declaration);
		}
		return null;
	}

	@Override
	public Void visitScopeDeclaration(CNextParser.ScopeDeclarationContext ctx)
	{
		ScopeSymbol previous = currentScope;
		String path = previous.isGlobal() ? ctx.IDENTIFIER().getText() : previous.getPath() + "." + ctx.IDENTIFIER().getText();
		currentScope = registry.getOrCreateScope(path);
		try
		{
			for (CNextParser.ScopeMemberContext member : ctx.scopeMember())
			{
				visit(member);
			}
		}
		finally
		{
			currentScope = previous;
		}
		return null;
	}

	// --- Discovery: types ---

	@Override
	public Void visitStructDeclaration(CNextParser.StructDeclarationContext ctx)
	{
		String name = ctx.IDENTIFIER().getText();
		String cName = NameMangler.forMember(currentScope.getPath(), name);
		if (discoveryOnly)
		{
			registry.registerStruct(currentScope, new StructSymbol(name, cName, currentScope.getId(), visibilityOf(ctx), file, line(ctx), SourceLanguage.CNEXT));
			return null;
		}

		StructSymbol struct = registry.findStruct(cName).orElseThrow();
		for (CNextParser.StructMemberContext member : ctx.structMember())
		{
			String fieldName = member.IDENTIFIER().getText();
			if (struct.getField(fieldName).isPresent())
			{
				throw new DeclarationException(ErrorCode.DUPLICATE_SYMBOL, line(member), column(member),
						"Field '" + fieldName + "' is declared twice in struct '" + name + "'", null);
			}
			TypeDescriptor fieldType = resolve(member.type(), member.arrayDimension());
			struct.addField(fieldName, fieldType);
		}
		return null;
	}

	@Override
	public Void visitEnumDeclaration(CNextParser.EnumDeclarationContext ctx)
	{
		if (!discoveryOnly)
		{
			return null;
		}
		String name = ctx.IDENTIFIER().getText();
		String cName = NameMangler.forMember(currentScope.getPath(), name);
		PrimitiveType backing = ctx.primitiveType() != null ? PrimitiveType.fromKeyword(ctx.primitiveType().getText()).orElseThrow() : null;
		EnumSymbol enumSymbol = new EnumSymbol(name, cName, currentScope.getId(), visibilityOf(ctx), backing, file, line(ctx), SourceLanguage.CNEXT);

		long next = 0;
		for (CNextParser.EnumMemberContext member : ctx.enumMember())
		{
			String memberName = member.IDENTIFIER().getText();
			if (enumSymbol.getMember(memberName).isPresent())
			{
				throw new DeclarationException(ErrorCode.DUPLICATE_SYMBOL, line(member), column(member),
						"Enum member '" + memberName + "' is declared twice in '" + name + "'", null);
			}
			if (member.expression() != null)
			{
				next = ConstantEvaluator.evaluate(member.expression(), ref ->
						enumSymbol.getMember(ref).map(EnumMemberSymbol::getValue).or(() -> typeResolver.lookupConstant(ref, currentScope))
				).orElseThrow(() -> new DeclarationException(ErrorCode.INVALID_CONSTANT, line(member), column(member),
						"Value of enum member '" + memberName + "' is not a constant integer expression", null));
			}
			enumSymbol.addMember(new EnumMemberSymbol(memberName, cName, next, currentScope.getId(), file, line(member)));
			next++;
		}
		registry.registerEnum(currentScope, enumSymbol);
		Debug.logDebug("Registered enum " + cName + " with " + enumSymbol.getMembers().size() + " member(s)");
		return null;
	}

	@Override
	public Void visitBitmapDeclaration(CNextParser.BitmapDeclarationContext ctx)
	{
		if (!discoveryOnly)
		{
			return null;
		}
		String name = ctx.IDENTIFIER().getText();
		String cName = NameMangler.forMember(currentScope.getPath(), name);
		int width = Integer.parseInt(ctx.bitmapType().getText().substring("bitmap".length()));
		BitmapSymbol bitmap = new BitmapSymbol(name, cName, currentScope.getId(), visibilityOf(ctx), width, file, line(ctx));

		int offset = 0;
		for (CNextParser.BitmapMemberContext member : ctx.bitmapMember())
		{
			String fieldName = member.IDENTIFIER().getText();
			int fieldWidth = member.INTEGER_LITERAL() != null ? Integer.parseInt(member.INTEGER_LITERAL().getText()) : 1;
			if (bitmap.getField(fieldName).isPresent())
			{
				throw new DeclarationException(ErrorCode.DUPLICATE_SYMBOL, line(member), column(member),
						"Field '" + fieldName + "' is declared twice in bitmap '" + name + "'", null);
			}
			bitmap.addField(new BitmapFieldSymbol(fieldName, offset, fieldWidth, currentScope.getId(), file, line(member)));
			offset += fieldWidth;
		}
		if (offset != width)
		{
			throw new DeclarationException(ErrorCode.BITMAP_WIDTH, line(ctx), column(ctx),
					String.format("Bitmap '%s' fields use %d bit(s) but %s has %d", name, offset, ctx.bitmapType().getText(), width),
					offset < width ? "add a reserved field of " + (width - offset) + " bit(s)" : "remove " + (offset - width) + " bit(s)");
		}
		registry.registerBitmap(currentScope, bitmap);
		return null;
	}

	@Override
	public Void visitRegisterDeclaration(CNextParser.RegisterDeclarationContext ctx)
	{
		String name = ctx.IDENTIFIER().getText();
		String cName = NameMangler.forMember(currentScope.getPath(), name);
		if (discoveryOnly)
		{
			String base = ctx.expression().getText();
			registry.registerRegister(currentScope, new RegisterSymbol(name, cName, currentScope.getId(), visibilityOf(ctx), base, file, line(ctx)));
			return null;
		}

		RegisterSymbol register = registry.findRegister(cName).orElseThrow();
		for (CNextParser.RegisterMemberContext member : ctx.registerMember())
		{
			String memberName = member.IDENTIFIER().getText();
			if (register.getMember(memberName).isPresent())
			{
				throw new DeclarationException(ErrorCode.DUPLICATE_SYMBOL, line(member), column(member),
						"Member '" + memberName + "' is declared twice in register '" + name + "'", null);
			}
			TypeDescriptor type = resolve(member.type(), List.of());
			if (!type.isInteger())
			{
				throw new DeclarationException(ErrorCode.INVALID_MODIFIER, line(member), column(member),
						"Register member '" + memberName + "' must have an unsigned or signed integer type", null);
			}
			AccessMode access = AccessMode.fromKeyword(member.accessModifier().getText());
			register.addMember(new RegisterMemberSymbol(memberName, type, access, member.expression().getText(), currentScope.getId(), file, line(member)));
		}
		return null;
	}

	// --- Second run: functions and variables ---

	@Override
	public Void visitFunctionDeclaration(CNextParser.FunctionDeclarationContext ctx)
	{
		if (discoveryOnly)
		{
			return null;
		}
		String name = ctx.IDENTIFIER().getText();
		TypeDescriptor returnType = resolve(ctx.type(), List.of());
		List<ParameterSymbol> parameters = new ArrayList<>();
		if (ctx.parameterList() != null)
		{
			Set<String> seen = new HashSet<>();
			for (CNextParser.ParameterContext param : ctx.parameterList().parameter())
			{
				String paramName = param.IDENTIFIER().getText();
				if (!seen.add(paramName))
				{
					throw new DeclarationException(ErrorCode.DUPLICATE_SYMBOL, line(param), column(param),
							"Parameter '" + paramName + "' is declared twice in '" + name + "'", null);
				}
				TypeDescriptor type = resolve(param.type(), param.arrayDimension()).withConst(param.constModifier() != null);
				parameters.add(new ParameterSymbol(paramName, type, parameters.size()));
			}
		}
		FunctionSymbol fn = registry.registerFunction(currentScope, name, returnType, parameters, visibilityOf(ctx), ctx, file, line(ctx));
		Debug.logDebug("Registered function " + fn.getCName() + " (" + parameters.size() + " parameter(s))");
		return null;
	}

	@Override
	public Void visitVariableDeclaration(CNextParser.VariableDeclarationContext ctx)
	{
		if (discoveryOnly)
		{
			return null;
		}
		String name = ctx.IDENTIFIER().getText();
		boolean isConst = ctx.constModifier() != null;
		TypeDescriptor type = resolve(ctx.type(), ctx.arrayDimension())
				.withConst(isConst)
				.withAtomic(ctx.atomicModifier() != null);
		if (type.isPrimitive(PrimitiveType.VOID))
		{
			throw new DeclarationException(ErrorCode.INVALID_MODIFIER, line(ctx), column(ctx), "Variable '" + name + "' cannot have type void", null);
		}
		if (isConst && ctx.expression() == null)
		{
			throw new DeclarationException(ErrorCode.INVALID_CONSTANT, line(ctx), column(ctx), "Constant '" + name + "' needs an initializer", "add '<- value'");
		}
		OverflowBehavior overflow = ctx.overflowModifier() != null && ctx.overflowModifier().WRAP() != null ? OverflowBehavior.WRAP : OverflowBehavior.CLAMP;
		if (ctx.overflowModifier() != null && !type.isInteger())
		{
			throw new DeclarationException(ErrorCode.INVALID_MODIFIER, line(ctx), column(ctx),
					"'" + ctx.overflowModifier().getText() + "' applies to integer variables only", null);
		}

		Long constValue = null;
		if (isConst && !type.isArray() && (type.isInteger() || typeResolver.isEnumType(type)))
		{
			constValue = ConstantEvaluator.evaluate(ctx.expression(), ref -> typeResolver.lookupConstant(ref, currentScope)).orElse(null);
		}
		String cName = NameMangler.forMember(currentScope.getPath(), name);
		VariableSymbol variable = new VariableSymbol(name, cName, currentScope.getId(), type, visibilityOf(ctx),
				ctx.volatileModifier() != null, overflow, ctx.expression(), constValue, file, line(ctx));
		registry.registerVariable(currentScope, variable);
		return null;
	}

	// --- Type references ---

	private TypeDescriptor resolve(CNextParser.TypeContext typeCtx, List<CNextParser.ArrayDimensionContext> dims)
	{
		TypeDescriptor type = typeResolver.resolveType(typeCtx, currentScope, dims);
		if (type.isUserType())
		{
			typeReferences.add(new TypeReference(type.getUserTypeName(), typeCtx));
		}
		return type;
	}

	/**
	 * Checks every user type this file referenced. Runs once all files completed the
	 * second run, so types and callback functions from any file are known.
	 * Unknown names become opaque external types when the file includes a header
	 * or the name is mapped to a header.
	 */
	public void validateTypeReferences()
	{
		for (TypeReference ref : typeReferences)
		{
			String name = ref.name;
			if (registry.findType(name).isPresent() || registry.findFunction(name).isPresent() || TypeResolver.ISR_TYPE.equals(name))
			{
				continue;
			}
			boolean plainName = ref.ctx.userType() != null;
			if (plainName && (allowExternalTypes || headerTypes.contains(name)))
			{
				registry.registerExternalType(name, SourceLanguage.C, null);
				Debug.logDebug("Treating '" + name + "' as an external type in " + file);
				continue;
			}
			throw new DeclarationException(ErrorCode.UNKNOWN_TYPE, line(ref.ctx), column(ref.ctx),
					"Unknown type '" + ref.ctx.getText() + "'",
					plainName ? "declare it, or #include the header that defines it" : null);
		}
	}

	private Visibility visibilityOf(ParserRuleContext decl)
	{
		if (decl.getParent() instanceof CNextParser.ScopeMemberContext member && member.visibilityModifier() != null)
		{
			return Visibility.fromKeyword(member.visibilityModifier().getText());
		}
		return currentScope.isGlobal() ? Visibility.PUBLIC : Visibility.PRIVATE;
	}

	private static int line(ParserRuleContext ctx)
	{
		return ctx.getStart().getLine();
	}

	private static int column(ParserRuleContext ctx)
	{
		return ctx.getStart().getCharPositionInLine();
	}

	private static class TypeReference
	{
		final String name;
		final CNextParser.TypeContext ctx;

		TypeReference(String name, CNextParser.TypeContext ctx)
		{
			this.name = name;
			this.ctx = ctx;
		}
	}
}
