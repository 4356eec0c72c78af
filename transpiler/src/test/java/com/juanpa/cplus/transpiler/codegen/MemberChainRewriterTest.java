package com.juanpa.cplus.transpiler.codegen;

import com.juanpa.cplus.transpiler.lexer.Lexer;
import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.semantics.Scope;
import com.juanpa.cplus.transpiler.semantics.ScopeKind;
import com.juanpa.cplus.transpiler.semantics.ScopeTree;
import com.juanpa.cplus.transpiler.util.ErrorReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class MemberChainRewriterTest
{
	private ScopeTree scopes;
	private MemberChainRewriter rewriter;

	@BeforeEach
	void setUp()
	{
		scopes = new ScopeTree();
		Scope global = scopes.getGlobal();
		global.declare("v").mergeDeclaration(0, 0);
		global.declare("p").mergeDeclaration(1, 0);
		global.declare("pp").mergeDeclaration(2, 0);
		global.declare("ppp").mergeDeclaration(3, 0);
		global.declare("buf").mergeDeclaration(1, 1);
		global.declare("grid").mergeDeclaration(0, 2);

		Scope function = scopes.open(ScopeTree.GLOBAL_SCOPE_ID, ScopeKind.FUNCTION, "f");
		function.declare("p").mergeDeclaration(0, 0);

		rewriter = new MemberChainRewriter(scopes);
	}

	private String rewrite(String source)
	{
		return rewrite(source, ScopeTree.GLOBAL_SCOPE_ID);
	}

	private String rewrite(String source, int scopeId)
	{
		List<Token> tokens = new Lexer(source, new ErrorReporter()).scanTokens();
		List<Token> out = rewriter.rewrite(new SourceLine(1, scopeId, tokens));
		return out.stream().map(Token::getLexeme).collect(Collectors.joining(" "));
	}

	@Test
	void pointerMemberUsesArrow()
	{
		assertEquals("p -> x = 1", rewrite("p.x = 1"));
	}

	@Test
	void spentPointerKeepsArrowForRestOfChain()
	{
		assertEquals("p -> next -> value", rewrite("p.next.value"));
	}

	@Test
	void doublePointerIsDereferencedFirst()
	{
		assertEquals("( * pp ) -> a", rewrite("pp.a"));
		assertEquals("( * pp ) -> a -> b", rewrite("pp.a.b"));
	}

	@Test
	void eachExtraLevelWrapsTheChainSoFar()
	{
		assertEquals("( * ( * ppp ) -> a ) -> b -> c", rewrite("ppp.a.b.c"));
	}

	@Test
	void subscriptConsumesArrayDimensionBeforePointerLevel()
	{
		assertEquals("buf [ 8 ] -> dx = 7", rewrite("buf[8].dx = 7"));
		assertEquals("p [ 0 ] . x", rewrite("p[0].x"));
		assertEquals("grid [ 1 ] [ 2 ] . cell", rewrite("grid[1][2].cell"));
	}

	@Test
	void valuesAndUnknownNamesAreLeftAlone()
	{
		assertEquals("v . a = 1", rewrite("v.a = 1"));
		assertEquals("w . a = 1", rewrite("w.a = 1"));
		assertEquals("make ( ) . x", rewrite("make().x"));
	}

	@Test
	void callGroupKeepsDepth()
	{
		assertEquals("p ( 1 ) -> x", rewrite("p(1).x"));
	}

	@Test
	void innerScopeDeclarationWins()
	{
		assertEquals("p . x", rewrite("p.x", 1));
	}

	@Test
	void severalBasesOnOneLine()
	{
		assertEquals("p -> x = v . y + ( * pp ) -> z", rewrite("p.x = v.y + pp.z"));
	}
}
