package org.lokray.scope.dto;

import java.util.List;

public class ScopeDTO
{
	public int id;
	public String type;
	public String node;
	public int line;
	public Integer upper; // null for the global scope
	public boolean strict;
	public boolean dynamic;
	public List<VariableDTO> variables;
	public int references;
	public List<String> through;
}
