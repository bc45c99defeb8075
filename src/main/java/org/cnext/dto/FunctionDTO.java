package org.cnext.dto;

import java.util.ArrayList;
import java.util.List;

public class FunctionDTO
{
	public String name;
	public String cName;
	public String returnType;
	public boolean isPublic = false;
	public String sourceFile;
	public int line;
	public List<ParameterDTO> parameters = new ArrayList<>();
}
