// File: src/main/java/org/cnext/codegen/generators/declarations/TypeBodyRenderer.java
package org.cnext.codegen.generators.declarations;

import org.cnext.codegen.CodeGenerator;
import org.cnext.codegen.generators.CodegenUtils;
import org.cnext.semantic.TypeResolver;
import org.cnext.semantic.symbol.BitmapFieldSymbol;
import org.cnext.semantic.symbol.BitmapSymbol;
import org.cnext.semantic.symbol.EnumMemberSymbol;
import org.cnext.semantic.symbol.EnumSymbol;
import org.cnext.semantic.symbol.RegisterMemberSymbol;
import org.cnext.semantic.symbol.RegisterSymbol;
import org.cnext.semantic.symbol.StructSymbol;

import java.util.ArrayList;
import java.util.List;

/**
 * C text for type definitions. Implementation files and both header variants
 * render types through this class; {@code cpp} selects the C++ spelling.
 */
public class TypeBodyRenderer
{
	private final TypeResolver typeResolver;
	private final boolean cpp;

	public TypeBodyRenderer(TypeResolver typeResolver, boolean cpp)
	{
		this.typeResolver = typeResolver;
		this.cpp = cpp;
	}

	/**
	 * C: {@code typedef enum { Color_RED = 0, ... } Color;}<br>
	 * C++: {@code enum Color : uint8_t { ... };} when the enum declares a backing type.
	 */
	public String renderEnum(EnumSymbol enumSymbol)
	{
		List<String> members = new ArrayList<>();
		for (EnumMemberSymbol member : enumSymbol.getMembers().values())
		{
			members.add(member.getCName() + " = " + member.getValue());
		}
		String body = CodeGenerator.indent(String.join(",\n", members));
		if (cpp)
		{
			String backing = enumSymbol.getBackingType() != null ? " : " + enumSymbol.getBackingType().getCType() : "";
			return "enum " + enumSymbol.getCName() + backing + " {\n" + body + "\n};";
		}
		return "typedef enum {\n" + body + "\n} " + enumSymbol.getCName() + ";";
	}

	/**
	 * The complete definition, typedef included in C.
	 */
	public String renderStruct(StructSymbol struct)
	{
		String fields = fields(struct);
		if (cpp)
		{
			return "struct " + struct.getCName() + " {\n" + fields + "\n};";
		}
		return "typedef struct " + struct.getCName() + " {\n" + fields + "\n} " + struct.getCName() + ";";
	}

	/**
	 * The layout alone, for a struct whose typedef a forward-declaring header
	 * already provides.
	 */
	public String renderStructLayout(StructSymbol struct)
	{
		return "struct " + struct.getCName() + " {\n" + fields(struct) + "\n};";
	}

	public String renderStructForward(StructSymbol struct)
	{
		if (cpp)
		{
			return "struct " + struct.getCName() + ";";
		}
		return "typedef struct " + struct.getCName() + " " + struct.getCName() + ";";
	}

	private String fields(StructSymbol struct)
	{
		List<String> lines = new ArrayList<>();
		for (StructSymbol.Field field : struct.getFields().values())
		{
			lines.add(CodegenUtils.declarator(field.getType(), field.getName(), typeResolver) + ";");
		}
		return CodeGenerator.indent(String.join("\n", lines));
	}

	/**
	 * A bitmap is its backing integer; the typedef names it and the comment
	 * records the field layout.
	 */
	public String renderBitmap(BitmapSymbol bitmap)
	{
		StringBuilder sb = new StringBuilder();
		sb.append("/* Bitmap: ").append(bitmap.getName()).append(" (bitmap").append(bitmap.getWidth()).append(")\n");
		for (BitmapFieldSymbol field : bitmap.getFields().values())
		{
			sb.append(" *   ").append(field.getName()).append(": ");
			if (field.getWidth() == 1)
			{
				sb.append("bit ").append(field.getOffset());
			}
			else
			{
				sb.append("bits ").append(field.getOffset()).append('-').append(field.getOffset() + field.getWidth() - 1);
			}
			sb.append('\n');
		}
		sb.append(" */\n");
		sb.append("typedef ").append(bitmap.getBackingType().getCType()).append(' ').append(bitmap.getCName()).append(';');
		return sb.toString();
	}

	/**
	 * One volatile pointer macro per member. Read-only members point to const.
	 */
	public String renderRegister(RegisterSymbol register)
	{
		StringBuilder sb = new StringBuilder();
		sb.append("/* Register: ").append(register.getName()).append(" @ ").append(register.getBaseAddress()).append(" */");
		for (RegisterMemberSymbol member : register.getMembers().values())
		{
			String pointee = "volatile " + member.getType().getBaseCType() + (member.getAccess().isWritable() ? "*" : " const *");
			sb.append("\n#define ").append(register.getMemberCName(member.getName()))
					.append(" (*(").append(pointee).append(")(").append(register.getBaseAddress())
					.append(" + ").append(member.getOffset()).append("))");
		}
		return sb.toString();
	}
}
