// File: src/main/java/com/juanpa/cplus/transpiler/lexer/Lexer.java

package com.juanpa.cplus.transpiler.lexer;

import com.juanpa.cplus.transpiler.util.ErrorReporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads normalized C+ source text and converts it into a flat list of Tokens.
 * Comments are dropped, preprocessor lines are kept verbatim as single tokens,
 * and the pointer-member operator '->' is rejected outright.
 */
public class Lexer
{
	/**
	 * Reserved words of the dialect. Everything else matching the identifier grammar is an IDENTIFIER.
	 */
	public static final Set<String> KEYWORDS;

	// Two-character operators, tried before their one-character prefixes
	private static final Set<String> TWO_CHAR_OPERATORS;

	private static final String OPERATOR_CHARS = "+-*/%=&|!<>^~?:";
	private static final String PUNCTUATION_CHARS = "(){}[];,.";

	static
	{
		Set<String> keywords = new HashSet<>();
		Collections.addAll(keywords,
				"auto", "break", "case", "char", "const", "continue", "default", "do",
				"double", "else", "enum", "extern", "float", "for", "goto", "if",
				"inline", "int", "long", "register", "return", "short", "signed", "sizeof",
				"static", "struct", "switch", "typedef", "union", "unsigned", "void", "volatile",
				"while", "bool");
		KEYWORDS = Collections.unmodifiableSet(keywords);

		Set<String> twoChar = new HashSet<>();
		Collections.addAll(twoChar,
				"++", "--", "==", "!=", ">=", "<=", "+=", "-=", "*=", "/=",
				"&&", "||", "&=", "|=", "^=", "<<", ">>");
		TWO_CHAR_OPERATORS = Collections.unmodifiableSet(twoChar);
	}

	private final String source; // Normalized source text
	private final List<Token> tokens = new ArrayList<>();
	private final ErrorReporter errorReporter;

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;

	/**
	 * Constructs a Lexer.
	 *
	 * @param source        Source text, already passed through {@link SourceNormalizer}.
	 * @param errorReporter Receives the diagnostic for a forbidden '->' before the exception is thrown.
	 */
	public Lexer(String source, ErrorReporter errorReporter)
	{
		this.source = source;
		this.errorReporter = errorReporter;
	}

	/**
	 * Scans the entire source and returns the tokens in order.
	 *
	 * @throws ForbiddenOperatorException if '->' appears anywhere outside comments and string literals.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd())
		{
			start = current;
			startLine = line;
			startColumn = column;

			scanToken();
		}
		return tokens;
	}

	private void scanToken()
	{
		char c = advance();

		switch (c)
		{
			case ' ':
			case '\t':
			case '\f':
			case '\u000B':
			case '\r':
			case '\n':
				break;
			case '#':
				// Preprocessor directive: keep the rest of the physical line untouched
				while (peek() != '\n' && !isAtEnd())
				{
					advance();
				}
				addToken(TokenType.PREPROCESSOR);
				break;
			case '"':
				scanStringLiteral();
				break;
			case '/':
				if (match('/'))
				{
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
				}
				else if (match('*'))
				{
					skipBlockComment();
				}
				else
				{
					scanOperator(c);
				}
				break;
			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (isIdentifierStart(c))
				{
					scanIdentifier();
				}
				else if (OPERATOR_CHARS.indexOf(c) >= 0)
				{
					scanOperator(c);
				}
				else if (PUNCTUATION_CHARS.indexOf(c) >= 0)
				{
					addToken(TokenType.PUNCTUATION);
				}
				else
				{
					addToken(TokenType.UNKNOWN);
				}
				break;
		}
	}

	private void scanOperator(char first)
	{
		if (first == '-' && peek() == '>')
		{
			String message = "'->' is not allowed. Pointers use '.' in C+.";
			errorReporter.report(startLine, startColumn, message);
			throw new ForbiddenOperatorException(startLine, startColumn);
		}
		if (!isAtEnd() && TWO_CHAR_OPERATORS.contains("" + first + peek()))
		{
			advance();
		}
		addToken(TokenType.OPERATOR);
	}

	/**
	 * Consumes a block comment body up to and including the closing delimiter.
	 * An unterminated comment swallows the rest of the input.
	 */
	private void skipBlockComment()
	{
		while (!isAtEnd())
		{
			if (peek() == '*' && peekNext() == '/')
			{
				advance();
				advance();
				return;
			}
			advance();
		}
	}

	/**
	 * Scans a string literal. The token keeps the quotes and escapes exactly as written;
	 * a backslash always takes the following character with it. A literal spanning several lines
	 * is placed on the line where it ends, together with the tokens that follow it.
	 */
	private void scanStringLiteral()
	{
		while (!isAtEnd())
		{
			char c = advance();
			if (c == '\\')
			{
				if (!isAtEnd())
				{
					advance();
				}
			}
			else if (c == '"')
			{
				break;
			}
		}
		String text = source.substring(start, current);
		tokens.add(new Token(TokenType.STRING_LITERAL, text, line, startColumn));
	}

	/**
	 * Digits with at most one '.', which may also come last ({@code 2.}). Exponents and suffixes
	 * are not part of the number.
	 */
	private void scanNumber()
	{
		boolean seenDot = false;
		while (isDigit(peek()) || (peek() == '.' && !seenDot))
		{
			if (advance() == '.')
			{
				seenDot = true;
			}
		}
		addToken(TokenType.NUMBER);
	}

	private void scanIdentifier()
	{
		while (isIdentifierPart(peek()))
		{
			advance();
		}
		String text = source.substring(start, current);
		addToken(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER);
	}

	/**
	 * Consumes the current character and returns it, also updates line/column.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
		return c;
	}

	private void addToken(TokenType type)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, startLine, startColumn));
	}

	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		advance();
		return true;
	}

	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierPart(char c)
	{
		return isIdentifierStart(c) || isDigit(c);
	}
}
