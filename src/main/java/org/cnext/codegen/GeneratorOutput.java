package org.cnext.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a generator produced: C text plus the effects to apply afterwards.
 */
public final class GeneratorOutput
{
	private final String code;
	private final List<GenerationEffect> effects;

	public GeneratorOutput(String code, List<GenerationEffect> effects)
	{
		this.code = code;
		this.effects = Collections.unmodifiableList(new ArrayList<>(effects));
	}

	public static GeneratorOutput of(String code)
	{
		return new GeneratorOutput(code, List.of());
	}

	public static GeneratorOutput of(String code, GenerationEffect... effects)
	{
		return new GeneratorOutput(code, List.of(effects));
	}

	public String getCode()
	{
		return code;
	}

	public List<GenerationEffect> getEffects()
	{
		return effects;
	}

	@Override
	public String toString()
	{
		return code + " " + effects;
	}
}
