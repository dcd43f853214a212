package org.lokray.scope.dto;

import java.util.List;

public class VariableDTO
{
	public String name;
	public List<String> definitions;
	public List<Integer> declaredAt;
	public int references;
	public boolean captured;
}
