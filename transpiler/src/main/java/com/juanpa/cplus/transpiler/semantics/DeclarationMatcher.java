package com.juanpa.cplus.transpiler.semantics;

import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recognizes declaration shapes in a flat token list without a grammar.
 * Shapes are tried in a fixed order at each position: function signature, strict declaration
 * (type name known), relaxed declaration (type name unknown). Anything else is not a declaration,
 * and that is not an error.
 */
public class DeclarationMatcher
{
	private final List<Token> tokens;
	private final KnownTypes knownTypes;

	public DeclarationMatcher(List<Token> tokens, KnownTypes knownTypes)
	{
		this.tokens = tokens;
		this.knownTypes = knownTypes;
	}

	/**
	 * Classifies the token at {@code index}.
	 */
	public DeclarationMatch classify(int index)
	{
		if (knownTypes.isTypeStart(tokens.get(index)))
		{
			FunctionSignature signature = matchFunctionSignature(index);
			if (signature != null)
			{
				return DeclarationMatch.function(signature);
			}
			List<Declarator> declarators = matchStrictDeclaration(index);
			if (!declarators.isEmpty())
			{
				return DeclarationMatch.strict(declarators);
			}
		}
		Declarator relaxed = matchRelaxedDeclaration(index);
		if (relaxed != null)
		{
			return DeclarationMatch.relaxed(relaxed);
		}
		return DeclarationMatch.none();
	}

	/**
	 * Type start, optional qualifiers/'*'/'&', a name, a balanced parameter list, then optional
	 * trailing qualifiers. The signature has a body when a '{' comes next.
	 *
	 * @return the signature, or null if the tokens do not have that shape or the ')' is the last token.
	 */
	public FunctionSignature matchFunctionSignature(int typeIndex)
	{
		int n = tokens.size();
		int i = typeIndex + 1;
		while (i < n && (tokens.get(i).getType() == TokenType.KEYWORD || isStarOrAmpersand(i)))
		{
			i++;
		}
		if (i >= n || !tokens.get(i).isIdentifier())
		{
			return null;
		}
		int nameIndex = i;
		if (i + 1 >= n || !tokens.get(i + 1).isPunct("("))
		{
			return null;
		}

		int openParen = i + 1;
		int closeParen = findClosing(openParen, "(", ")", n);
		if (closeParen == -1 || closeParen + 1 >= n)
		{
			return null;
		}

		int j = closeParen + 1;
		while (j < n && (tokens.get(j).getType() == TokenType.KEYWORD
				|| tokens.get(j).isIdentifier()
				|| isStarOrAmpersand(j)))
		{
			j++;
		}
		int body = (j < n && tokens.get(j).isPunct("{")) ? j : FunctionSignature.NO_BODY;
		List<ParameterRecord> parameters = parseParameters(openParen, closeParen);
		return new FunctionSignature(tokens.get(nameIndex).getLexeme(), body, parameters);
	}

	/**
	 * Parses the parameters between {@code openParen} and {@code closeParen}.
	 * Commas split parameters regardless of nesting; anything that does not start with a type
	 * or has no name is skipped.
	 */
	public List<ParameterRecord> parseParameters(int openParen, int closeParen)
	{
		List<ParameterRecord> parameters = new ArrayList<>();
		int i = openParen + 1;
		while (i < closeParen)
		{
			Token token = tokens.get(i);
			if (token.isPunct(","))
			{
				i++;
				continue;
			}
			if (!knownTypes.isTypeStart(token))
			{
				i++;
				continue;
			}

			int j;
			if (token.isTagKeyword())
			{
				if (i + 1 < closeParen && tokens.get(i + 1).isIdentifier())
				{
					j = i + 2;
				}
				else
				{
					i++;
					continue;
				}
			}
			else
			{
				j = typeNameRunEnd(i, closeParen, false);
			}

			int stars = 0;
			while (j < closeParen && tokens.get(j).isOperator("*"))
			{
				stars++;
				j++;
			}
			if (j >= closeParen || !tokens.get(j).isIdentifier())
			{
				i = j;
				continue;
			}
			parameters.add(new ParameterRecord(tokens.get(j).getLexeme(), stars));
			j++;

			// Array suffixes do not change what the parameter records
			while (j < closeParen && tokens.get(j).isPunct("["))
			{
				while (j < closeParen && !tokens.get(j).isPunct("]"))
				{
					j++;
				}
				if (j < closeParen)
				{
					j++;
				}
			}
			while (j < closeParen && !tokens.get(j).isPunct(","))
			{
				j++;
			}
			i = j;
		}
		return parameters;
	}

	/**
	 * After a known type name: a comma-separated list of declarators, each
	 * {@code *... name [..]...}. The first declarator has to start on the type's line.
	 *
	 * @return the declarators found, empty if none.
	 */
	public List<Declarator> matchStrictDeclaration(int typeIndex)
	{
		int n = tokens.size();
		List<Declarator> declarators = new ArrayList<>();
		Token typeToken = tokens.get(typeIndex);

		int j = typeIndex;
		if (typeToken.isTagKeyword())
		{
			if (j + 1 < n && tokens.get(j + 1).isIdentifier())
			{
				j += 2;
			}
		}
		else
		{
			j = typeNameRunEnd(typeIndex, n, true);
		}
		if (j >= n || tokens.get(j).getLine() != typeToken.getLine())
		{
			return declarators;
		}

		while (j < n)
		{
			int stars = 0;
			while (j < n && tokens.get(j).isOperator("*"))
			{
				stars++;
				j++;
			}
			if (j >= n || !tokens.get(j).isIdentifier())
			{
				break;
			}
			String name = tokens.get(j).getLexeme();
			j++;

			int arrays = 0;
			while (j < n && tokens.get(j).isPunct("["))
			{
				while (j < n && !tokens.get(j).isPunct("]"))
				{
					j++;
				}
				if (j < n)
				{
					j++;
				}
				arrays++;
			}
			declarators.add(new Declarator(name, stars, arrays));

			if (j < n && tokens.get(j).isPunct(","))
			{
				j++;
				continue;
			}
			break;
		}
		return declarators;
	}

	/**
	 * Declaration whose type name is not known: {@code Head [words...] *... name [..]...}, head through name
	 * on one line, accepted only when followed by ';', ',', '[', '=' or '{'. The guard keeps ordinary
	 * expression statements ({@code n * g} at the end of a line) from being read as declarations.
	 *
	 * @return the declarator, or null if the shape does not match.
	 */
	public Declarator matchRelaxedDeclaration(int index)
	{
		int n = tokens.size();
		Token head = tokens.get(index);
		int line = head.getLine();
		int j = index;

		if (head.isTagKeyword())
		{
			if (j + 1 < n && tokens.get(j + 1).isIdentifier())
			{
				j += 2;
			}
			else
			{
				return null;
			}
		}
		else if (head.isIdentifier())
		{
			j++;
		}
		else
		{
			return null;
		}

		while (j < n && onLine(j, line)
				&& (tokens.get(j).getType() == TokenType.KEYWORD || tokens.get(j).isIdentifier()))
		{
			j++;
		}

		int stars = 0;
		while (j < n && onLine(j, line) && tokens.get(j).isOperator("*"))
		{
			stars++;
			j++;
		}

		if (j >= n || !onLine(j, line) || !tokens.get(j).isIdentifier())
		{
			return null;
		}
		String name = tokens.get(j).getLexeme();
		j++;

		int arrays = 0;
		while (j < n && tokens.get(j).isPunct("["))
		{
			int k = j + 1;
			while (k < n && !tokens.get(k).isPunct("]"))
			{
				k++;
			}
			if (k == n)
			{
				break;
			}
			j = k + 1;
			arrays++;
		}

		if (j >= n)
		{
			return null;
		}
		Token next = tokens.get(j);
		if (next.isPunct(";") || next.isPunct(",") || next.isPunct("[") || next.isOperator("=") || next.isPunct("{"))
		{
			return new Declarator(name, stars, arrays);
		}
		return null;
	}

	/**
	 * End of the keyword/identifier run that spells a type name, starting at {@code start}.
	 * When the run ends in an identifier and no '*' follows, that identifier is the declared name
	 * rather than part of the type, so it is given back ({@code int x}, {@code Vec2 v}).
	 */
	private int typeNameRunEnd(int start, int limit, boolean sameLine)
	{
		int line = tokens.get(start).getLine();
		int j = start;
		while (j < limit && (!sameLine || onLine(j, line))
				&& (tokens.get(j).getType() == TokenType.KEYWORD || tokens.get(j).isIdentifier()))
		{
			j++;
		}
		boolean starFollows = j < limit && tokens.get(j).isOperator("*") && (!sameLine || onLine(j, line));
		if (j - start >= 2 && tokens.get(j - 1).isIdentifier() && !starFollows)
		{
			j--;
		}
		return j;
	}

	/**
	 * Index of the token closing the group opened at {@code open}, or -1 if it never closes.
	 */
	private int findClosing(int open, String openText, String closeText, int limit)
	{
		int depth = 0;
		for (int k = open; k < limit; k++)
		{
			Token token = tokens.get(k);
			if (token.isPunct(openText))
			{
				depth++;
			}
			else if (token.isPunct(closeText))
			{
				depth--;
				if (depth == 0)
				{
					return k;
				}
			}
		}
		return -1;
	}

	private boolean isStarOrAmpersand(int index)
	{
		Token token = tokens.get(index);
		return token.isOperator("*") || token.isOperator("&");
	}

	private boolean onLine(int index, int line)
	{
		return tokens.get(index).getLine() == line;
	}
}
