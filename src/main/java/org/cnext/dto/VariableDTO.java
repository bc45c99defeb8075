package org.cnext.dto;

public class VariableDTO
{
	public String name;
	public String cName;
	public String type;
	public boolean isPublic = false;
	public boolean isConst = false;
	public boolean isVolatile = false;
	public String overflow;
	public Long constValue;
}
