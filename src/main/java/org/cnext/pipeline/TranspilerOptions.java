package org.cnext.pipeline;

import org.cnext.codegen.helpers.OverflowMode;
import org.cnext.semantic.NameMangler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable settings for one transpiler run.
 */
public class TranspilerOptions
{
	public enum HeaderLayout
	{
		/** Headers carry complete struct and bitmap definitions. */
		FULL,
		/** Headers carry forward declarations; layouts are defined in the implementation file. */
		FORWARD
	}

	public static final String DEFAULT_HELPER_HEADER = "cnx_helpers.h";

	private final boolean cppMode;
	private final OverflowMode overflowMode;
	private final String entryPoint;
	private final HeaderLayout headerLayout;
	private final Map<String, String> typeHeaders;
	private final int jobs;
	private final String helperHeaderName;

	private TranspilerOptions(Builder builder)
	{
		this.cppMode = builder.cppMode;
		this.overflowMode = builder.overflowMode;
		this.entryPoint = builder.entryPoint;
		this.headerLayout = builder.headerLayout;
		this.typeHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.typeHeaders));
		this.jobs = builder.jobs;
		this.helperHeaderName = builder.helperHeaderName;
	}

	public static TranspilerOptions defaults()
	{
		return builder().build();
	}

	public static Builder builder()
	{
		return new Builder();
	}

	public boolean isCppMode()
	{
		return cppMode;
	}

	public OverflowMode getOverflowMode()
	{
		return overflowMode;
	}

	public String getEntryPoint()
	{
		return entryPoint;
	}

	public HeaderLayout getHeaderLayout()
	{
		return headerLayout;
	}

	/**
	 * External type name to the header that declares it.
	 */
	public Map<String, String> getTypeHeaders()
	{
		return typeHeaders;
	}

	public int getJobs()
	{
		return jobs;
	}

	public String getHelperHeaderName()
	{
		return helperHeaderName;
	}

	public String getImplementationExtension()
	{
		return cppMode ? ".cpp" : ".c";
	}

	public String getHeaderExtension()
	{
		return cppMode ? ".hpp" : ".h";
	}

	public static class Builder
	{
		private boolean cppMode = false;
		private OverflowMode overflowMode = OverflowMode.CLAMP;
		private String entryPoint = NameMangler.DEFAULT_ENTRY_POINT;
		private HeaderLayout headerLayout = HeaderLayout.FULL;
		private final Map<String, String> typeHeaders = new LinkedHashMap<>();
		private int jobs = 1;
		private String helperHeaderName = DEFAULT_HELPER_HEADER;

		public Builder cppMode(boolean value)
		{
			this.cppMode = value;
			return this;
		}

		public Builder overflowMode(OverflowMode value)
		{
			this.overflowMode = value;
			return this;
		}

		public Builder entryPoint(String value)
		{
			this.entryPoint = value;
			return this;
		}

		public Builder headerLayout(HeaderLayout value)
		{
			this.headerLayout = value;
			return this;
		}

		public Builder typeHeader(String typeName, String header)
		{
			this.typeHeaders.put(typeName, header);
			return this;
		}

		public Builder typeHeaders(Map<String, String> value)
		{
			this.typeHeaders.putAll(value);
			return this;
		}

		public Builder jobs(int value)
		{
			if (value < 1)
			{
				throw new IllegalArgumentException("jobs must be at least 1, got " + value);
			}
			this.jobs = value;
			return this;
		}

		public Builder helperHeaderName(String value)
		{
			this.helperHeaderName = value;
			return this;
		}

		public TranspilerOptions build()
		{
			return new TranspilerOptions(this);
		}
	}
}
