package com.juanpa.cplus.transpiler.semantics;

import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.lexer.TokenType;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The set of names known to denote types. It starts with the builtin scalar types and only grows:
 * typedef aliases and struct/union/enum tags are added as they are found.
 * One instance is shared by every file of a run, so a type declared in an earlier file is
 * recognized in later ones.
 */
public class KnownTypes
{
	public static final Set<String> BUILTIN_TYPES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"void", "char", "short", "int", "long", "float", "double", "signed", "unsigned", "bool")));

	private final Set<String> names = new LinkedHashSet<>(BUILTIN_TYPES);

	public boolean contains(String name)
	{
		return names.contains(name);
	}

	/**
	 * @return true if the name was not known before.
	 */
	public boolean add(String name)
	{
		return names.add(name);
	}

	/**
	 * Whether a declaration or signature can begin at this token: a known type name,
	 * a builtin type keyword, or struct/union/enum.
	 */
	public boolean isTypeStart(Token token)
	{
		if (token.getType() == TokenType.IDENTIFIER)
		{
			return names.contains(token.getLexeme());
		}
		if (token.getType() == TokenType.KEYWORD)
		{
			return BUILTIN_TYPES.contains(token.getLexeme()) || token.isTagKeyword();
		}
		return false;
	}
}
