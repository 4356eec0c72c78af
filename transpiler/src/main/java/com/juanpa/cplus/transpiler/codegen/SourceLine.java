package com.juanpa.cplus.transpiler.codegen;

import com.juanpa.cplus.transpiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The tokens that started on one physical source line. The line is analyzed in the scope of its
 * first token.
 */
public class SourceLine
{
	private final int lineNumber;
	private final int scopeId;
	private final List<Token> tokens;

	public SourceLine(int lineNumber, int scopeId, List<Token> tokens)
	{
		this.lineNumber = lineNumber;
		this.scopeId = scopeId;
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
	}

	/**
	 * Groups tokens by their original line number. Lines without tokens do not appear.
	 */
	public static List<SourceLine> split(List<Token> tokens)
	{
		List<SourceLine> lines = new ArrayList<>();
		List<Token> current = new ArrayList<>();
		for (Token token : tokens)
		{
			if (!current.isEmpty() && token.getLine() != current.get(0).getLine())
			{
				lines.add(of(current));
				current = new ArrayList<>();
			}
			current.add(token);
		}
		if (!current.isEmpty())
		{
			lines.add(of(current));
		}
		return lines;
	}

	private static SourceLine of(List<Token> tokens)
	{
		Token first = tokens.get(0);
		return new SourceLine(first.getLine(), first.getScopeId(), tokens);
	}

	public int getLineNumber()
	{
		return lineNumber;
	}

	public int getScopeId()
	{
		return scopeId;
	}

	public List<Token> getTokens()
	{
		return tokens;
	}
}
