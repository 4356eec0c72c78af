// File: src/main/java/com/juanpa/cplus/transpiler/codegen/MemberChainRewriter.java
package com.juanpa.cplus.transpiler.codegen;

import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.lexer.TokenType;
import com.juanpa.cplus.transpiler.semantics.ScopeTree;
import com.juanpa.cplus.transpiler.semantics.VariableRecord;
import com.juanpa.cplus.transpiler.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites dotted member access into pointer access where the base is a pointer.
 * <p>
 * For each declared identifier on a line, postfix '[...]' groups consume one array dimension
 * (or, once those run out, one pointer level), and call groups '(...)' leave the depth alone.
 * Then every {@code .member} is resolved against the remaining depth:
 * <ul>
 *     <li>depth 1: {@code p.x} becomes {@code p->x}</li>
 *     <li>depth above 1: {@code pp.x} becomes {@code (*pp)->x}, one level per dot</li>
 *     <li>depth 0: left alone</li>
 * </ul>
 * Identifiers no visible scope declares are never treated as member-access bases.
 */
public class MemberChainRewriter
{
	private final ScopeTree scopes;

	public MemberChainRewriter(ScopeTree scopes)
	{
		this.scopes = scopes;
	}

	public List<Token> rewrite(SourceLine line)
	{
		List<Token> in = line.getTokens();
		List<Token> out = new ArrayList<>(in.size() + 4);
		int n = in.size();
		int i = 0;

		while (i < n)
		{
			Token base = in.get(i);
			if (!base.isIdentifier())
			{
				out.add(base);
				i++;
				continue;
			}

			VariableRecord record = scopes.resolve(line.getScopeId(), base.getLexeme());
			if (record.isUnknown())
			{
				out.add(base);
				i++;
				continue;
			}

			int depth = record.getEffectivePointerDepth();
			int rank = record.getArrayRank();
			int baseStart = out.size();
			out.add(base);
			int j = i + 1;

			// Postfix subscripts and calls
			while (j < n)
			{
				Token next = in.get(j);
				if (next.isPunct("["))
				{
					int close = findClosing(in, j, "[", "]");
					if (close == -1)
					{
						break;
					}
					if (rank > 0)
					{
						rank--;
					}
					else if (depth > 0)
					{
						depth--;
					}
					out.addAll(in.subList(j, close + 1));
					j = close + 1;
				}
				else if (next.isPunct("("))
				{
					int close = findClosing(in, j, "(", ")");
					if (close == -1)
					{
						break;
					}
					out.addAll(in.subList(j, close + 1));
					j = close + 1;
				}
				else
				{
					break;
				}
			}

			// Member chain
			while (j + 1 < n && in.get(j).isPunct(".") && in.get(j + 1).isIdentifier())
			{
				Token dot = in.get(j);
				if (depth == 1)
				{
					out.add(Token.synthesized(TokenType.OPERATOR, "->", dot));
				}
				else if (depth > 1)
				{
					out.add(baseStart, Token.synthesized(TokenType.PUNCTUATION, "(", base));
					out.add(baseStart + 1, Token.synthesized(TokenType.OPERATOR, "*", base));
					out.add(Token.synthesized(TokenType.PUNCTUATION, ")", dot));
					out.add(Token.synthesized(TokenType.OPERATOR, "->", dot));
					depth--;
				}
				else
				{
					out.add(dot);
				}
				out.add(in.get(j + 1));
				j += 2;
			}

			if (j > i + 1)
			{
				Debug.log("Line %d: base '%s' (%s) rewritten up to token %d", line.getLineNumber(),
						base.getLexeme(), record, j);
			}
			i = j;
		}
		return out;
	}

	private static int findClosing(List<Token> tokens, int open, String openText, String closeText)
	{
		int depth = 0;
		for (int k = open; k < tokens.size(); k++)
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
}
