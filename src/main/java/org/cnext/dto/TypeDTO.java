package org.cnext.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * A struct, enum, bitmap or register. {@code kind} says which; members use the
 * fields of {@link MemberDTO} that apply to that kind.
 */
public class TypeDTO
{
	public String kind;
	public String name;
	public String cName;
	public boolean isPublic = false;
	public String language;
	public String backingType;
	public String baseAddress;
	public List<MemberDTO> members = new ArrayList<>();
}
