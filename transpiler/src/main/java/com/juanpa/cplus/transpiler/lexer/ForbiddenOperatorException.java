package com.juanpa.cplus.transpiler.lexer;

/**
 * Thrown when the target language's pointer-member operator {@code ->} shows up in C+ input.
 * This is the only error that stops a whole multi-file run.
 */
public class ForbiddenOperatorException extends RuntimeException
{
	private final int line;
	private final int column;

	public ForbiddenOperatorException(int line, int column)
	{
		super("'->' is not allowed (line " + line + ", col " + column + "). Pointers use '.' in C+.");
		this.line = line;
		this.column = column;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}
}
