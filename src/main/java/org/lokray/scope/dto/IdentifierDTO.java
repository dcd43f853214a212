package org.lokray.scope.dto;

public class IdentifierDTO
{
	public String name;
	public int line;
	public int column;
	public int scope;
	public String role; // "declaration", "reference" or "other"
}
