package org.cnext.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

public class FileUtils
{
	public static String getFileExtension(Path path)
	{
		return getFileExtension(path.getFileName().toString());
	}

	public static String getFileExtension(String fileName)
	{
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	/**
	 * Strips the directory and the extension: {@code src/motor.cnx -> motor}.
	 */
	public static String getBaseName(String fileName)
	{
		return fileName(fileName).replaceFirst("[.][^.]+$", "");
	}

	public static String fileName(String path)
	{
		String name = path.replace('\\', '/');
		return name.substring(name.lastIndexOf('/') + 1);
	}

	public static String replaceExtension(String fileName, String newExtension)
	{
		return fileName.replaceFirst("[.][^.]+$", "") + newExtension;
	}

	public static void writeString(Path outPath, String content) throws IOException
	{
		if (outPath.getParent() != null)
		{
			Files.createDirectories(outPath.getParent());
		}
		Files.writeString(outPath, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
	}
}
