package org.lokray.lumen.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Holds configuration settings for the Lumen interpreter, loaded from properties.
 * Provides sensible defaults if settings are not specified.
 */
public class InterpreterConfig
{
	public static final String CLASSPATH_RESOURCE = "lumen.properties";

	private final boolean debug;
	private final long maxLoopIterations;
	private final boolean reportEachUndeclaredUse;

	public InterpreterConfig(Properties props)
	{
		this.debug = Boolean.parseBoolean(props.getProperty("debug", "false").trim());
		// 0 or negative means loops are not capped
		this.maxLoopIterations = parseLong(props.getProperty("interpreter.max_loop_iterations"), 0L);
		this.reportEachUndeclaredUse = Boolean.parseBoolean(props.getProperty("semantic.report_each_undeclared_use", "false").trim());
	}

	/**
	 * @return A configuration with every setting at its default.
	 */
	public static InterpreterConfig defaults()
	{
		return new InterpreterConfig(new Properties());
	}

	/**
	 * Loads the bundled {@value #CLASSPATH_RESOURCE} and overlays the user file
	 * {@code ~/.config/lumen/lumen.conf} when it exists.
	 * Unreadable sources are skipped with a warning and the remaining settings are used.
	 */
	public static InterpreterConfig load()
	{
		Properties props = new Properties();

		try (InputStream input = InterpreterConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE))
		{
			if (input != null)
			{
				props.load(input);
			}
		}
		catch (IOException e)
		{
			System.err.println("Warning: Could not read " + CLASSPATH_RESOURCE + " from the classpath. Using default settings.");
		}

		Path userConfig = Paths.get(System.getProperty("user.home"), ".config", "lumen", "lumen.conf");
		if (Files.exists(userConfig))
		{
			try (InputStream input = Files.newInputStream(userConfig))
			{
				props.load(input);
				Debug.log("Loaded configuration from: %s", userConfig);
			}
			catch (IOException e)
			{
				System.err.println("Warning: Could not read config file at " + userConfig + ". Using bundled settings.");
			}
		}
		return new InterpreterConfig(props);
	}

	private static long parseLong(String value, long fallback)
	{
		if (value == null || value.isBlank())
		{
			return fallback;
		}
		try
		{
			return Long.parseLong(value.trim());
		}
		catch (NumberFormatException e)
		{
			System.err.println("Warning: Invalid number '" + value + "' in configuration. Using " + fallback + ".");
			return fallback;
		}
	}

	public boolean isDebug()
	{
		return debug;
	}

	public long getMaxLoopIterations()
	{
		return maxLoopIterations;
	}

	public boolean isReportEachUndeclaredUse()
	{
		return reportEachUndeclaredUse;
	}
}
