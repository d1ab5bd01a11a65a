package org.lokray.lumen.util;

public class Debug
{
	/**
	 * Master switch for all debug logging. Off unless the {@code debug} property is set.
	 */
	private static volatile boolean enabled = false;

	// Per thread, since independent requests may run concurrently.
	private static final ThreadLocal<Integer> indentLevel = ThreadLocal.withInitial(() -> 0);

	public static void setEnabled(boolean value)
	{
		enabled = value;
	}

	/**
	 * Logs a formatted message if debugging is enabled.
	 *
	 * @param format The message format string (e.g., "Found var: %s").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (enabled)
		{
			String indent = "  ".repeat(indentLevel.get());
			System.out.println("[DEBUG] " + indent + String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public static void indent()
	{
		if (enabled)
		{
			indentLevel.set(indentLevel.get() + 1);
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public static void dedent()
	{
		if (enabled)
		{
			indentLevel.set(Math.max(0, indentLevel.get() - 1));
		}
	}
}
