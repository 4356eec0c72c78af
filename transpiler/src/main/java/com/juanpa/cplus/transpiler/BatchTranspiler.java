// File: src/main/java/com/juanpa/cplus/transpiler/BatchTranspiler.java
package com.juanpa.cplus.transpiler;

import com.juanpa.cplus.transpiler.lexer.ForbiddenOperatorException;
import com.juanpa.cplus.transpiler.semantics.KnownTypes;
import com.juanpa.cplus.transpiler.util.CompilerConfig;
import com.juanpa.cplus.transpiler.util.ErrorReporter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Runs the transpiler over a list of input files in order, writing each result next to its input.
 * Type names declared in earlier files stay known for later ones. An unreadable input or unwritable
 * output only fails that file; a forbidden '->' stops the whole run.
 */
public class BatchTranspiler
{
	private final CompilerConfig config;
	private final ErrorReporter errorReporter;
	private final KnownTypes knownTypes;

	public BatchTranspiler(CompilerConfig config, ErrorReporter errorReporter, KnownTypes knownTypes)
	{
		this.config = config;
		this.errorReporter = errorReporter;
		this.knownTypes = knownTypes;
	}

	public BatchTranspiler(CompilerConfig config, ErrorReporter errorReporter)
	{
		this(config, errorReporter, new KnownTypes());
	}

	public TranspileReport transpileAll(List<String> inputPaths)
	{
		TranspileReport report = new TranspileReport();
		Transpiler transpiler = new Transpiler(knownTypes, errorReporter);

		for (String inputPath : inputPaths)
		{
			String source;
			try
			{
				source = readSource(inputPath);
			}
			catch (IOException | InvalidPathException e)
			{
				errorReporter.reportFileError("cannot read: " + inputPath);
				report.recordFailure(inputPath);
				continue;
			}

			String output;
			try
			{
				output = transpiler.transpile(source);
			}
			catch (ForbiddenOperatorException e)
			{
				System.err.println("Stopping: '->' found in " + inputPath + " at line " + e.getLine()
						+ ", column " + e.getColumn() + ".");
				report.recordFatal(inputPath, e);
				return report;
			}

			String outputPath = deriveOutputPath(inputPath, config.getOutputExtension());
			try
			{
				Files.write(Paths.get(outputPath), output.getBytes(StandardCharsets.UTF_8));
			}
			catch (IOException | InvalidPathException e)
			{
				errorReporter.reportFileError("cannot write: " + outputPath);
				report.recordFailure(inputPath);
				continue;
			}
			System.err.println("Wrote " + outputPath);
			report.recordWritten(outputPath);
		}
		return report;
	}

	private static String readSource(String inputPath) throws IOException
	{
		Path path = Paths.get(inputPath);
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}

	/**
	 * Replaces the extension of the last path component with {@code extension}, or appends it
	 * when that component has none. Both '/' and '\' count as separators.
	 */
	public static String deriveOutputPath(String inputPath, String extension)
	{
		int separator = Math.max(inputPath.lastIndexOf('/'), inputPath.lastIndexOf('\\'));
		int dot = inputPath.lastIndexOf('.');
		if (dot == -1 || dot < separator)
		{
			return inputPath + extension;
		}
		return inputPath.substring(0, dot) + extension;
	}

	public KnownTypes getKnownTypes()
	{
		return knownTypes;
	}
}
