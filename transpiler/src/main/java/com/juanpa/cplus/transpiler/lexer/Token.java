// File: src/main/java/com/juanpa/cplus/transpiler/lexer/Token.java
package com.juanpa.cplus.transpiler.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the C+ Lexer.
 * Each token carries its kind, its text and its position in the source file.
 * The owning scope id is filled in once by the scope analyzer; everything else is fixed.
 */
public class Token
{
	public static final int NO_SCOPE = -1;

	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, OPERATOR)
	private final String lexeme;     // The actual text of the token (e.g., "myVariable", "123", "+=")
	private final int line;          // The line number in the source file where the token starts
	private final int column;        // The column number in the source file where the token starts
	private int scopeId = NO_SCOPE;

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type   The TokenType of this token.
	 * @param lexeme The raw string value of the token from the source code.
	 * @param line   The line number where this token begins.
	 * @param column The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.line = line;
		this.column = column;
	}

	/**
	 * Creates a token that does not come from the input, positioned (and scoped) like {@code origin}.
	 */
	public static Token synthesized(TokenType type, String lexeme, Token origin)
	{
		Token token = new Token(type, lexeme, origin.line, origin.column);
		token.scopeId = origin.scopeId;
		return token;
	}

	// --- Getters for Token properties ---

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public int getScopeId()
	{
		return scopeId;
	}

	/**
	 * Back-fills the enclosing scope. Set by the scope analyzer, and for synthesized tokens that
	 * belong to a different scope than the token they were created from.
	 */
	public void setScopeId(int scopeId)
	{
		this.scopeId = scopeId;
	}

	// --- Shape checks used by the analysis passes ---

	public boolean is(TokenType type, String text)
	{
		return this.type == type && lexeme.equals(text);
	}

	public boolean isPunct(String text)
	{
		return is(TokenType.PUNCTUATION, text);
	}

	public boolean isOperator(String text)
	{
		return is(TokenType.OPERATOR, text);
	}

	public boolean isKeyword(String text)
	{
		return is(TokenType.KEYWORD, text);
	}

	public boolean isIdentifier()
	{
		return type == TokenType.IDENTIFIER;
	}

	/**
	 * True for {@code struct}, {@code union} and {@code enum}.
	 */
	public boolean isTagKeyword()
	{
		return isKeyword("struct") || isKeyword("union") || isKeyword("enum");
	}

	/**
	 * Identifiers, numbers, strings and closing parens/brackets: tokens that can end an expression.
	 */
	public boolean isValueLike()
	{
		return type == TokenType.IDENTIFIER
				|| type == TokenType.NUMBER
				|| type == TokenType.STRING_LITERAL
				|| isPunct(")")
				|| isPunct("]");
	}

	/**
	 * Format: "TokenType 'lexeme' (Line:Column)"
	 */
	@Override
	public String toString()
	{
		return type + " '" + lexeme + "' (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Compares kind and text only. Position and scope are not part of a token's identity,
	 * so a synthesized terminator equals one read from the input.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;
		return type == token.type && lexeme.equals(token.lexeme);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, lexeme);
	}
}
