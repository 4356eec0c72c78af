package com.juanpa.cplus.transpiler.util;

/**
 * Collects transpilation errors and prints them to the error stream as they arrive.
 */
public class ErrorReporter
{
	private boolean hasErrors = false; // Flag to indicate if any errors have been reported
	private int errorCount = 0;

	/**
	 * Reports an error located in the source text.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		System.err.println("[Error] Line " + line + ", Column " + column + ": " + message);
		hasErrors = true;
		errorCount++;
	}

	/**
	 * Reports an error that is not tied to a source position (unreadable input, unwritable output).
	 *
	 * @param message The error message.
	 */
	public void reportFileError(String message)
	{
		System.err.println("Error: " + message);
		hasErrors = true;
		errorCount++;
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	/**
	 * Resets the error flag.
	 */
	public void reset()
	{
		hasErrors = false;
		errorCount = 0;
	}
}
