package com.juanpa.cplus.transpiler.util;

import java.util.Properties;

/**
 * Holds configuration settings for the C+ transpiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final String DEFAULT_OUTPUT_EXTENSION = ".cpp";

	private final String outputExtension;
	private final boolean debugEnabled;

	public CompilerConfig(Properties props)
	{
		String extension = props.getProperty("output.extension", DEFAULT_OUTPUT_EXTENSION).trim();
		if (extension.isEmpty())
		{
			extension = DEFAULT_OUTPUT_EXTENSION;
		}
		// Accept "cpp" as well as ".cpp"
		this.outputExtension = extension.startsWith(".") ? extension : "." + extension;
		this.debugEnabled = Boolean.parseBoolean(props.getProperty("debug.enabled", "false").trim());
	}

	/**
	 * A configuration with every setting at its default.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	public String getOutputExtension()
	{
		return outputExtension;
	}

	public boolean isDebugEnabled()
	{
		return debugEnabled;
	}
}
