package org.lokray.lumen.interpreter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The values computed during one run, by variable name.
 * Written by assignments and by the first read of a variable that had not been assigned yet.
 */
public class Environment
{
	private final Map<String, Value> values = new LinkedHashMap<>();

	/**
	 * @return The current value of {@code name}, or null if it has none yet.
	 */
	public Value get(String name)
	{
		return values.get(name);
	}

	public void define(String name, Value value)
	{
		values.put(name, value);
	}

	@Override
	public String toString()
	{
		return values.toString();
	}
}
