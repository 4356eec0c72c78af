package com.juanpa.cplus.transpiler.codegen;

import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.lexer.TokenType;

import java.util.List;
import java.util.Set;

/**
 * Serializes one line of tokens back to text.
 * Tokens are separated by a single space, except where punctuation sticks to its neighbour:
 * nothing before , ) ] ; . or ->, nothing after ( [ . or ->, calls and subscripts stick to their
 * base, and prefix operators stick to their operand.
 */
public class CppEmitter
{
	private static final Set<String> NO_SPACE_BEFORE = Set.of(",", ")", "]", ";", ".");
	private static final Set<String> NO_SPACE_AFTER = Set.of("(", "[", ".");
	private static final Set<String> PREFIX_OPERATORS = Set.of("*", "&", "-", "+", "!", "~", "++", "--");
	private static final Set<String> PREFIX_CONTEXT_PUNCTUATION = Set.of("(", "[", ",", "{", "}", ";");

	/**
	 * Appends the line followed by a newline. A preprocessor token always stands on a line of its own
	 * and ends the line.
	 */
	public void emitLine(List<Token> line, StringBuilder out)
	{
		Token beforePrevious = null;
		Token previous = null;
		for (Token token : line)
		{
			if (token.getType() == TokenType.PREPROCESSOR)
			{
				if (previous != null)
				{
					out.append('\n');
				}
				out.append(token.getLexeme()).append('\n');
				return;
			}
			if (previous != null && needsSpace(beforePrevious, previous, token))
			{
				out.append(' ');
			}
			out.append(token.getLexeme());
			beforePrevious = previous;
			previous = token;
		}
		out.append('\n');
	}

	public String emit(List<List<Token>> lines)
	{
		StringBuilder out = new StringBuilder();
		for (List<Token> line : lines)
		{
			emitLine(line, out);
		}
		return out.toString();
	}

	static boolean needsSpace(Token beforePrevious, Token previous, Token token)
	{
		if (token.getType() == TokenType.PUNCTUATION && NO_SPACE_BEFORE.contains(token.getLexeme()))
		{
			return false;
		}
		if (token.isOperator("->") || previous.isOperator("->"))
		{
			return false;
		}
		if (previous.getType() == TokenType.PUNCTUATION && NO_SPACE_AFTER.contains(previous.getLexeme()))
		{
			return false;
		}
		// f(x), a[i], f(x)(y), a[i][j]
		if ((token.isPunct("(") || token.isPunct("[")) && isExpressionEnd(previous))
		{
			return false;
		}
		// i++, a[i]--
		if ((token.isOperator("++") || token.isOperator("--")) && isExpressionEnd(previous))
		{
			return false;
		}
		return !isPrefixOperator(beforePrevious, previous);
	}

	private static boolean isExpressionEnd(Token token)
	{
		return token.isIdentifier() || token.isPunct(")") || token.isPunct("]");
	}

	/**
	 * An operator from the prefix set is unary when nothing that could end an operand precedes it.
	 */
	private static boolean isPrefixOperator(Token beforeOperator, Token operator)
	{
		if (operator.getType() != TokenType.OPERATOR || !PREFIX_OPERATORS.contains(operator.getLexeme()))
		{
			return false;
		}
		if (beforeOperator == null)
		{
			return true;
		}
		switch (beforeOperator.getType())
		{
			case OPERATOR:
			case KEYWORD:
				return true;
			case PUNCTUATION:
				return PREFIX_CONTEXT_PUNCTUATION.contains(beforeOperator.getLexeme());
			default:
				return false;
		}
	}
}
