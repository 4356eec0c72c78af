package com.juanpa.cplus.transpiler.semantics;

import com.juanpa.cplus.transpiler.lexer.Lexer;
import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ScopeAnalyzerTest
{
	private List<Token> tokens;

	private ScopeTree analyze(String source)
	{
		return analyze(source, new KnownTypes());
	}

	private ScopeTree analyze(String source, KnownTypes knownTypes)
	{
		tokens = new Lexer(source, new ErrorReporter()).scanTokens();
		return new ScopeAnalyzer(knownTypes).analyze(tokens);
	}

	private Token find(String lexeme, int occurrence)
	{
		int seen = 0;
		for (Token token : tokens)
		{
			if (token.getLexeme().equals(lexeme) && seen++ == occurrence)
			{
				return token;
			}
		}
		throw new AssertionError("No occurrence " + occurrence + " of " + lexeme);
	}

	@Test
	void buildsScopeTreeWithKindsAndNames()
	{
		ScopeTree tree = analyze("struct S { int x; };\nvoid f(struct S *p) {\n  if (p) {\n  }\n}\n");

		assertEquals(4, tree.size());
		assertEquals(ScopeKind.GLOBAL, tree.get(0).getKind());
		assertTrue(tree.get(0).isRoot());

		assertEquals(ScopeKind.STRUCT, tree.get(1).getKind());
		assertEquals("S", tree.get(1).getName());
		assertEquals(0, tree.get(1).getParentId());

		// The 'struct' in the parameter list does not turn the body into a struct scope
		assertEquals(ScopeKind.FUNCTION, tree.get(2).getKind());
		assertEquals("f", tree.get(2).getName());

		assertEquals(ScopeKind.BLOCK, tree.get(3).getKind());
		assertNull(tree.get(3).getName());
		assertEquals(2, tree.get(3).getParentId());
	}

	@Test
	void openingBraceBelongsOutsideClosingBraceInside()
	{
		analyze("void f() {\n  x = 1;\n}\n");

		assertEquals(ScopeTree.GLOBAL_SCOPE_ID, find("{", 0).getScopeId());
		assertEquals(1, find("x", 0).getScopeId());
		assertEquals(1, find("}", 0).getScopeId());
	}

	@Test
	void parametersAreBoundToFunctionScope()
	{
		KnownTypes types = new KnownTypes();
		types.add("V");
		ScopeTree tree = analyze("void move(V *v, int n, char **argv) {\n}\n", types);

		Scope body = tree.get(1);
		assertEquals(1, body.lookupLocal("v").getPointerDepth());
		assertEquals(0, body.lookupLocal("n").getPointerDepth());
		assertEquals(2, body.lookupLocal("argv").getPointerDepth());
	}

	@Test
	void repeatedDeclarationsKeepShallowestDepthAndWidestRank()
	{
		ScopeTree tree = analyze("int **x;\nint *x;\nint *a[2][3];\nint *a;\n");

		VariableRecord x = tree.getGlobal().lookupLocal("x");
		assertEquals(1, x.getPointerDepth());
		assertEquals(0, x.getArrayRank());

		VariableRecord a = tree.getGlobal().lookupLocal("a");
		assertEquals(1, a.getPointerDepth());
		assertEquals(2, a.getArrayRank());
	}

	@Test
	void plainValueDeclarationsAreRecorded()
	{
		ScopeTree tree = analyze("int x;\nunsigned long count;\n");

		assertEquals(0, tree.getGlobal().lookupLocal("x").getPointerDepth());
		assertEquals(0, tree.getGlobal().lookupLocal("count").getPointerDepth());
		assertNull(tree.getGlobal().lookupLocal("unsigned"));
	}

	@Test
	void strictDeclarationRecordsEveryDeclarator()
	{
		ScopeTree tree = analyze("int a, *b, **c[4];\n");

		assertEquals(0, tree.getGlobal().lookupLocal("a").getPointerDepth());
		assertEquals(1, tree.getGlobal().lookupLocal("b").getPointerDepth());
		assertEquals(2, tree.getGlobal().lookupLocal("c").getPointerDepth());
		assertEquals(1, tree.getGlobal().lookupLocal("c").getArrayRank());
	}

	@Test
	void unknownTypeUsesRelaxedShape()
	{
		ScopeTree tree = analyze("Vec2 *p = q;\nThing *t;\n");

		assertEquals(1, tree.getGlobal().lookupLocal("p").getPointerDepth());
		assertEquals(1, tree.getGlobal().lookupLocal("t").getPointerDepth());
	}

	@Test
	void expressionStatementsAreNotDeclarations()
	{
		ScopeTree tree = analyze("foo(bar);\nx = y;\na b(c);\n");

		assertTrue(tree.getGlobal().getVariables().isEmpty());
	}

	@Test
	void typedefAliasAndTagsBecomeKnownTypes()
	{
		KnownTypes types = new KnownTypes();
		ScopeTree tree = analyze("typedef unsigned long Size;\nstruct Node;\nSize *s;\n", types);

		assertTrue(types.contains("Size"));
		assertTrue(types.contains("Node"));
		assertEquals(1, tree.getGlobal().lookupLocal("s").getPointerDepth());
	}

	@Test
	void knownTypesCarryOverBetweenAnalyses()
	{
		KnownTypes types = new KnownTypes();
		analyze("typedef int Handle;\n", types);
		ScopeTree second = analyze("Handle *h, *k\n", types);

		assertEquals(1, second.getGlobal().lookupLocal("h").getPointerDepth());
		assertEquals(1, second.getGlobal().lookupLocal("k").getPointerDepth());
	}

	@Test
	void innerDeclarationShadowsOuter()
	{
		ScopeTree tree = analyze("struct S *p;\nvoid f() {\n  struct S p;\n}\n");

		assertEquals(1, tree.resolve(0, "p").getPointerDepth());
		assertEquals(0, tree.resolve(1, "p").getPointerDepth());
	}

	@Test
	void unmatchedClosingBraceStaysAtRoot()
	{
		ScopeTree tree = analyze("}\nint *p;\n");

		assertEquals(1, tree.size());
		assertEquals(ScopeTree.GLOBAL_SCOPE_ID, find("}", 0).getScopeId());
		assertEquals(1, tree.getGlobal().lookupLocal("p").getPointerDepth());
	}

	@Test
	void unresolvedNameIsUnknown()
	{
		ScopeTree tree = analyze("int x;\n");

		VariableRecord record = tree.resolve(0, "nope");
		assertTrue(record.isUnknown());
		assertFalse(record.isPointerDepthObserved());
		assertEquals(0, record.getEffectivePointerDepth());
	}

	@Test
	void enumBodyIsEnumScope()
	{
		ScopeTree tree = analyze("enum Color { RED, GREEN };\n");

		assertEquals(ScopeKind.ENUM, tree.get(1).getKind());
		assertEquals("Color", tree.get(1).getName());
		assertEquals(1, find("RED", 0).getScopeId());
	}
}
