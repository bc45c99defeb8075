// File: src/main/java/org/cnext/codegen/helpers/HelperSynthesizer.java
package org.cnext.codegen.helpers;

import org.cnext.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the shared helper header from the demand merged over all files of a
 * build. Each helper appears once, in key order, so the output depends only on
 * the set of helpers demanded.
 */
public class HelperSynthesizer
{
	private final OverflowMode mode;

	public HelperSynthesizer(OverflowMode mode)
	{
		this.mode = mode;
	}

	/**
	 * @param headerName file name of the helper header, e.g. {@code cnx_helpers.h}
	 * @return the header text, or an empty string when nothing was demanded
	 */
	public String synthesize(HelperDemand demand, String headerName)
	{
		if (demand.isEmpty())
		{
			return "";
		}
		Debug.logDebug("Synthesizing helpers: " + demand);
		String guard = guardName(headerName);

		List<String> lines = new ArrayList<>();
		lines.add("/**");
		lines.add(" * Generated by cnext-transpiler: overflow-safe arithmetic and safe division helpers");
		lines.add(" */");
		lines.add("");
		lines.add("#ifndef " + guard);
		lines.add("#define " + guard);
		lines.add("");
		lines.add("#include <stdint.h>");
		lines.add("#include <stdbool.h>");
		if (!demand.getOverflowKeys().isEmpty())
		{
			lines.add("#include <limits.h>");
			if (mode == OverflowMode.PANIC)
			{
				lines.add("#include <stdio.h>");
				lines.add("#include <stdlib.h>");
			}
		}
		lines.add("");

		if (!demand.getOverflowKeys().isEmpty())
		{
			lines.add(mode == OverflowMode.PANIC ? "/* Overflow helpers (panic on overflow) */" : "/* Overflow helpers (clamp on overflow) */");
			for (String key : demand.getOverflowKeys())
			{
				lines.add(OverflowHelperTemplates.render(HelperDemand.opOf(key), HelperDemand.typeOf(key), mode));
				lines.add("");
			}
		}
		if (!demand.getSafeDivKeys().isEmpty())
		{
			lines.add("/* Safe division helpers */");
			for (String key : demand.getSafeDivKeys())
			{
				lines.add(SafeDivHelperTemplates.render(HelperDemand.opOf(key), HelperDemand.typeOf(key)));
				lines.add("");
			}
		}

		lines.add("#endif /* " + guard + " */");
		return String.join("\n", lines) + "\n";
	}

	static String guardName(String headerName)
	{
		return headerName.toUpperCase().replaceAll("[^A-Z0-9]", "_");
	}
}
