// File: src/main/java/org/lokray/scope/semantic/TargetEnvironment.java
package org.lokray.scope.semantic;

import java.util.Arrays;
import java.util.Optional;

/**
 * The environment the analyzed program will run in.
 */
public enum TargetEnvironment
{
	BROWSER("browser", false),
	BROWSER_NO_EVAL("browser-no-eval", false),
	NODE("node", true);

	private final String optionName;
	private final boolean hostedModule;

	TargetEnvironment(String optionName, boolean hostedModule)
	{
		this.optionName = optionName;
		this.hostedModule = hostedModule;
	}

	public static Optional<TargetEnvironment> fromOptionName(String name)
	{
		return Arrays.stream(values())
				.filter(target -> target.optionName.equals(name))
				.findFirst();
	}

	public String getOptionName()
	{
		return optionName;
	}

	/**
	 * Node.js runs each file inside an implicit function, so top-level declarations are not globals.
	 */
	public boolean isHostedModule()
	{
		return hostedModule;
	}
}
