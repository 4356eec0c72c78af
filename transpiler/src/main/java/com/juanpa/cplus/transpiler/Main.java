// File: src/main/java/com/juanpa/cplus/transpiler/Main.java

package com.juanpa.cplus.transpiler;

import com.juanpa.cplus.transpiler.util.CompilerConfig;
import com.juanpa.cplus.transpiler.util.Debug;
import com.juanpa.cplus.transpiler.util.ErrorReporter;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Properties;

/**
 * Entry point for the C+ transpiler.
 * Every argument is a C+ source file; each one is translated to a sibling C++ file.
 */
public class Main
{
	public static void main(String[] args)
	{
		CompilerConfig config = loadConfiguration();
		System.exit(run(args, config));
	}

	/**
	 * Runs the transpiler and returns the process exit status instead of exiting.
	 */
	public static int run(String[] args, CompilerConfig config)
	{
		if (args.length == 0)
		{
			System.err.println("Usage: cplus <file1.cp> [file2.cp ...]");
			return TranspileReport.EXIT_FILE_ERRORS;
		}
		Debug.setEnabled(config.isDebugEnabled());

		ErrorReporter errorReporter = new ErrorReporter();
		BatchTranspiler batch = new BatchTranspiler(config, errorReporter);
		TranspileReport report = batch.transpileAll(Arrays.asList(args));

		if (!report.getFailed().isEmpty())
		{
			System.err.println(report.getFailed().size() + " of " + args.length + " file(s) failed.");
		}
		return report.getExitStatus();
	}

	private static CompilerConfig loadConfiguration()
	{
		Properties props = new Properties();
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "cplus", "cplus.conf");

		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
				System.out.println("--- Loaded configuration from: " + configPath + " ---");
			}
			catch (IOException e)
			{
				System.err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return new CompilerConfig(props);
	}
}
