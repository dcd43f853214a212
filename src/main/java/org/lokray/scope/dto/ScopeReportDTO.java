package org.lokray.scope.dto;

import java.util.List;

public class ScopeReportDTO
{
	public String source;
	public String grammarMode;
	public boolean hostedModule;
	public int ecmaVersion;
	public List<ScopeDTO> scopes;
	public List<String> implicitGlobals;
	public List<IdentifierDTO> identifiers;
}
