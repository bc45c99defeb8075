package org.cnext.dto;

public class MemberDTO
{
	public String name;
	public String type;
	public Long value;
	public Integer offset;
	public Integer width;
	public String access;
	public String address;
}
