package org.cnext.dto;

public class ParameterDTO
{
	public String name;
	public String type;
	public boolean isConst = false;
	public boolean isMutated = false;
}
