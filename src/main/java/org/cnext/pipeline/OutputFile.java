package org.cnext.pipeline;

/**
 * One file the build writes. {@code sourceFile} is the input it was generated
 * from, or null for the shared helper header.
 */
public final class OutputFile
{
	private final String sourceFile;
	private final String fileName;
	private final String content;

	public OutputFile(String sourceFile, String fileName, String content)
	{
		this.sourceFile = sourceFile;
		this.fileName = fileName;
		this.content = content;
	}

	public String getSourceFile()
	{
		return sourceFile;
	}

	public String getFileName()
	{
		return fileName;
	}

	public String getContent()
	{
		return content;
	}

	@Override
	public String toString()
	{
		return fileName;
	}
}
