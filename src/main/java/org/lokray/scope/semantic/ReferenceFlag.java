// File: src/main/java/org/lokray/scope/semantic/ReferenceFlag.java
package org.lokray.scope.semantic;

public enum ReferenceFlag
{
	READ,
	WRITE,
	READ_WRITE;

	public boolean isRead()
	{
		return this != WRITE;
	}

	public boolean isWrite()
	{
		return this != READ;
	}
}
