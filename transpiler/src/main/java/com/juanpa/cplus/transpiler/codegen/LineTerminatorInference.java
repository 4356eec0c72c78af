package com.juanpa.cplus.transpiler.codegen;

import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.lexer.TokenType;
import com.juanpa.cplus.transpiler.semantics.ScopeKind;
import com.juanpa.cplus.transpiler.semantics.ScopeTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Infers the ';' that C+ lets a line leave out. Lines inside enum bodies are never touched.
 */
public class LineTerminatorInference
{
	private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "for", "while", "switch");

	// Statements that consist of a bare keyword still need their terminator
	private static final Set<String> STATEMENT_KEYWORDS = Set.of("break", "continue", "return");

	private final ScopeTree scopes;

	public LineTerminatorInference(ScopeTree scopes)
	{
		this.scopes = scopes;
	}

	/**
	 * Applies the mid-line rule and then, if needed, appends a terminator to the line.
	 */
	public List<Token> apply(List<Token> tokens, ScopeKind lineKind)
	{
		if (lineKind == ScopeKind.ENUM)
		{
			return tokens;
		}
		List<Token> result = insertBeforeClosingBraces(tokens);
		if (needsTerminator(result, lineKind))
		{
			Token last = result.get(result.size() - 1);
			result.add(Token.synthesized(TokenType.PUNCTUATION, ";", last));
		}
		return result;
	}

	/**
	 * Inserts ';' before a '}' that is not the first token of the line when the statement before it
	 * was left open. Braces closing an enum body or an initializer list ({@code = { 1, 2 }}) are skipped.
	 */
	public List<Token> insertBeforeClosingBraces(List<Token> tokens)
	{
		List<Token> result = new ArrayList<>(tokens.size() + 2);
		Deque<Boolean> openInitializers = new ArrayDeque<>();

		for (int i = 0; i < tokens.size(); i++)
		{
			Token token = tokens.get(i);
			if (token.isPunct("{"))
			{
				openInitializers.push(opensInitializer(tokens, i, openInitializers));
			}
			else if (token.isPunct("}") && i > 0)
			{
				boolean closesInitializer = !openInitializers.isEmpty() && openInitializers.pop();
				boolean closesEnum = scopes.kindOf(token.getScopeId()) == ScopeKind.ENUM;
				Token previous = result.get(result.size() - 1);
				if (!closesInitializer && !closesEnum && leavesStatementOpen(previous))
				{
					result.add(Token.synthesized(TokenType.PUNCTUATION, ";", previous));
				}
			}
			result.add(token);
		}
		return result;
	}

	/**
	 * Whole-line rule.
	 */
	public boolean needsTerminator(List<Token> tokens, ScopeKind lineKind)
	{
		if (tokens.isEmpty() || lineKind == ScopeKind.ENUM)
		{
			return false;
		}
		Token first = tokens.get(0);
		Token last = tokens.get(tokens.size() - 1);
		if (first.getType() == TokenType.PREPROCESSOR)
		{
			return false;
		}

		if (last.isPunct("}"))
		{
			// "x = { ... }" on one line is a statement; any other trailing '}' closes a block
			for (int i = 1; i + 1 < tokens.size(); i++)
			{
				if (tokens.get(i).isPunct("{") && tokens.get(i - 1).isOperator("="))
				{
					return true;
				}
			}
			return false;
		}
		if (last.isPunct("{") || last.isPunct(";"))
		{
			return false;
		}
		if (last.isPunct(")") && isControlHeader(tokens))
		{
			return false;
		}
		if (last.isValueLike())
		{
			return true;
		}
		if (last.getType() == TokenType.KEYWORD && STATEMENT_KEYWORDS.contains(last.getLexeme()))
		{
			return true;
		}
		// x++ / x--
		return (last.isOperator("++") || last.isOperator("--"))
				&& tokens.size() >= 2
				&& tokens.get(tokens.size() - 2).isValueLike();
	}

	/**
	 * A line with if/for/while/switch ending in ')' is a control header, except the tail of a
	 * do-while ({@code } while (x)}), which is a complete statement.
	 */
	private static boolean isControlHeader(List<Token> tokens)
	{
		boolean hasControl = false;
		for (Token token : tokens)
		{
			if (token.getType() == TokenType.KEYWORD && CONTROL_KEYWORDS.contains(token.getLexeme()))
			{
				hasControl = true;
				break;
			}
		}
		boolean doWhileTail = tokens.size() >= 2 && tokens.get(0).isPunct("}") && tokens.get(1).isKeyword("while");
		return hasControl && !doWhileTail;
	}

	private static boolean leavesStatementOpen(Token previous)
	{
		if (previous.isPunct(";") || previous.isPunct("{"))
		{
			return false;
		}
		return previous.isValueLike()
				|| previous.getType() == TokenType.OPERATOR
				|| (previous.getType() == TokenType.KEYWORD && STATEMENT_KEYWORDS.contains(previous.getLexeme()));
	}

	private static boolean opensInitializer(List<Token> tokens, int braceIndex, Deque<Boolean> openInitializers)
	{
		if (braceIndex == 0)
		{
			return false;
		}
		Token previous = tokens.get(braceIndex - 1);
		if (previous.isOperator("="))
		{
			return true;
		}
		// Nested aggregate inside an initializer: "{ {1, 2}, {3, 4} }"
		boolean insideInitializer = !openInitializers.isEmpty() && openInitializers.peek();
		return insideInitializer && (previous.isPunct("{") || previous.isPunct(","));
	}
}
