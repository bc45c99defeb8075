package org.cnext.dto;

import java.util.ArrayList;
import java.util.List;

public class SymbolTableDTO
{
	public String entryPoint;
	public List<String> sourceFiles = new ArrayList<>();
	public ScopeDTO global;
}
