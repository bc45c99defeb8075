package org.cnext.dto;

import java.util.ArrayList;
import java.util.List;

public class ScopeDTO
{
	public String name;
	public String path;
	public List<ScopeDTO> scopes = new ArrayList<>();
	public List<FunctionDTO> functions = new ArrayList<>();
	public List<VariableDTO> variables = new ArrayList<>();
	public List<TypeDTO> types = new ArrayList<>();
}
