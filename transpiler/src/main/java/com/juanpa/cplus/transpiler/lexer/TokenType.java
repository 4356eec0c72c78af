// File: src/main/java/com/juanpa/cplus/transpiler/lexer/TokenType.java
package com.juanpa.cplus.transpiler.lexer;

/**
 * Defines the kinds of tokens recognized by the C+ Lexer.
 * The dialect is scanned without a grammar, so the kinds stay coarse: the exact
 * operator or punctuation is carried by the token text.
 */
public enum TokenType
{
	IDENTIFIER,
	NUMBER,
	STRING_LITERAL,
	KEYWORD,
	OPERATOR,      // + - * / % = & | ! < > ^ ~ ? : and their two-character forms
	PUNCTUATION,   // ( ) { } [ ] ; , .
	PREPROCESSOR,  // a whole '#' line, kept verbatim
	UNKNOWN        // passed through untouched
}
