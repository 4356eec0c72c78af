package com.juanpa.cplus.transpiler.codegen;

import com.juanpa.cplus.transpiler.lexer.Lexer;
import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.semantics.ScopeKind;
import com.juanpa.cplus.transpiler.semantics.ScopeTree;
import com.juanpa.cplus.transpiler.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LineTerminatorInferenceTest
{
	private final LineTerminatorInference inference = new LineTerminatorInference(new ScopeTree());

	private static List<Token> lex(String source)
	{
		return new Lexer(source, new ErrorReporter()).scanTokens();
	}

	private boolean needs(String line)
	{
		return inference.needsTerminator(lex(line), ScopeKind.FUNCTION);
	}

	private String apply(String line)
	{
		return inference.apply(lex(line), ScopeKind.FUNCTION).stream()
				.map(Token::getLexeme)
				.collect(Collectors.joining(" "));
	}

	@Test
	void statementsEndingInValuesNeedTerminator()
	{
		assertTrue(needs("x = 1"));
		assertTrue(needs("x = foo(1, 2)"));
		assertTrue(needs("s = \"text\""));
		assertTrue(needs("a[i]"));
		assertTrue(needs("i++"));
	}

	@Test
	void bareStatementKeywordsNeedTerminator()
	{
		assertTrue(needs("return"));
		assertTrue(needs("break"));
		assertTrue(needs("continue"));
	}

	@Test
	void controlHeadersAndBlocksDoNot()
	{
		assertFalse(needs("if (x)"));
		assertFalse(needs("while (i < n)"));
		assertFalse(needs("for (i = 0; i < n; i++)"));
		assertFalse(needs("switch (mode)"));
		assertFalse(needs("int main() {"));
		assertFalse(needs("}"));
		assertFalse(needs("else"));
		assertFalse(needs("case 1:"));
		assertFalse(needs("x = 1;"));
	}

	@Test
	void doWhileTailIsAStatement()
	{
		assertTrue(needs("} while (x)"));
	}

	@Test
	void initializerOnOneLineNeedsTerminator()
	{
		assertTrue(needs("int a[2] = { 1, 2 }"));
		assertFalse(needs("if (a) { b = 1; }"));
	}

	@Test
	void preprocessorAndEnumLinesAreLeftAlone()
	{
		assertFalse(needs("#include <stdio.h>"));
		assertFalse(inference.needsTerminator(lex("RED"), ScopeKind.ENUM));
		assertEquals(lex("RED").size(), inference.apply(lex("RED"), ScopeKind.ENUM).size());
	}

	@Test
	void terminatesStatementBeforeClosingBrace()
	{
		assertEquals("while ( i < 3 ) { i ++ ; }", apply("while (i < 3) { i++ }"));
		assertEquals("if ( a ) { return ; }", apply("if (a) { return }"));
		assertEquals("{ x = 1 ; }", apply("{ x = 1 }"));
	}

	@Test
	void leavesCompleteBlocksAndInitializersAlone()
	{
		assertEquals("if ( a ) { b = 1 ; }", apply("if (a) { b = 1; }"));
		assertEquals("int a [ 2 ] = { 1 , 2 } ;", apply("int a[2] = { 1, 2 }"));
		assertEquals("int m [ 2 ] [ 2 ] = { { 1 , 2 } , { 3 , 4 } } ;", apply("int m[2][2] = { {1, 2}, {3, 4} }"));
		assertEquals("void f ( ) { }", apply("void f() { }"));
	}

	@Test
	void leadingBraceIsNotTerminated()
	{
		assertEquals("}", apply("}"));
	}
}
