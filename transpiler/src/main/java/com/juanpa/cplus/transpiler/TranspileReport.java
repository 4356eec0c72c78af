package com.juanpa.cplus.transpiler;

import com.juanpa.cplus.transpiler.lexer.ForbiddenOperatorException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one run over a list of input files.
 */
public class TranspileReport
{
	public static final int EXIT_OK = 0;
	public static final int EXIT_FILE_ERRORS = 1;
	public static final int EXIT_FORBIDDEN_OPERATOR = 2;

	private final List<String> written = new ArrayList<>();
	private final List<String> failed = new ArrayList<>();
	private String fatalPath;
	private ForbiddenOperatorException fatalError;

	void recordWritten(String outputPath)
	{
		written.add(outputPath);
	}

	void recordFailure(String path)
	{
		failed.add(path);
	}

	void recordFatal(String path, ForbiddenOperatorException error)
	{
		this.fatalPath = path;
		this.fatalError = error;
	}

	/**
	 * Output files written, in order.
	 */
	public List<String> getWritten()
	{
		return Collections.unmodifiableList(written);
	}

	/**
	 * Paths that could not be read, or whose output could not be written.
	 */
	public List<String> getFailed()
	{
		return Collections.unmodifiableList(failed);
	}

	public boolean isAborted()
	{
		return fatalError != null;
	}

	/**
	 * @return the input that stopped the run, or null if the run was not aborted.
	 */
	public String getFatalPath()
	{
		return fatalPath;
	}

	public ForbiddenOperatorException getFatalError()
	{
		return fatalError;
	}

	/**
	 * 2 if the run was aborted by a forbidden operator, 1 if any file failed, 0 otherwise.
	 */
	public int getExitStatus()
	{
		if (isAborted())
		{
			return EXIT_FORBIDDEN_OPERATOR;
		}
		return failed.isEmpty() ? EXIT_OK : EXIT_FILE_ERRORS;
	}
}
