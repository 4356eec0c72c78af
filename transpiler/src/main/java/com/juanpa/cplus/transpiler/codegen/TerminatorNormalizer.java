package com.juanpa.cplus.transpiler.codegen;

import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.lexer.TokenType;
import com.juanpa.cplus.transpiler.semantics.ScopeKind;
import com.juanpa.cplus.transpiler.semantics.ScopeTree;
import com.juanpa.cplus.transpiler.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Scope-aware terminator passes that run before the per-line rewrite.
 */
public class TerminatorNormalizer
{
	private final ScopeTree scopes;

	public TerminatorNormalizer(ScopeTree scopes)
	{
		this.scopes = scopes;
	}

	public List<Token> normalize(List<Token> tokens)
	{
		return addTerminatorsAfterTypeBodies(removeTerminatorsInsideEnums(tokens));
	}

	/**
	 * Enumerators are separated by commas, so any ';' inside an enum body is dropped.
	 * The ';' after the enum's '}' belongs to the enclosing scope and survives.
	 */
	public List<Token> removeTerminatorsInsideEnums(List<Token> tokens)
	{
		List<Token> result = new ArrayList<>(tokens.size());
		for (Token token : tokens)
		{
			if (token.isPunct(";") && scopes.kindOf(token.getScopeId()) == ScopeKind.ENUM)
			{
				Debug.log("Dropped ';' inside enum at line %d", token.getLine());
				continue;
			}
			result.add(token);
		}
		return result;
	}

	/**
	 * Adds ';' after the '}' of a struct, union or enum body unless a declarator or a ';' follows.
	 * Preprocessor lines between the brace and the next token are looked through.
	 */
	public List<Token> addTerminatorsAfterTypeBodies(List<Token> tokens)
	{
		List<Token> result = new ArrayList<>(tokens.size() + 8);
		for (int i = 0; i < tokens.size(); i++)
		{
			Token token = tokens.get(i);
			result.add(token);
			if (!token.isPunct("}") || !scopes.kindOf(token.getScopeId()).isTypeBody())
			{
				continue;
			}

			int j = i + 1;
			while (j < tokens.size() && tokens.get(j).getType() == TokenType.PREPROCESSOR)
			{
				j++;
			}
			if (j < tokens.size() && continuesTypeStatement(tokens.get(j)))
			{
				continue;
			}
			// The terminator belongs to the scope around the type body
			Token terminator = Token.synthesized(TokenType.PUNCTUATION, ";", token);
			terminator.setScopeId(scopes.get(token.getScopeId()).getParentId());
			result.add(terminator);
			Debug.log("Added ';' after type body closed at line %d", token.getLine());
		}
		return result;
	}

	/**
	 * Alias or variable name, pointer/function/array declarator, or a terminator already present.
	 */
	private static boolean continuesTypeStatement(Token next)
	{
		return next.isIdentifier()
				|| next.isOperator("*")
				|| next.isPunct("(")
				|| next.isPunct("[")
				|| next.isPunct(";");
	}
}
