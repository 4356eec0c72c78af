package com.juanpa.cplus.transpiler.semantics;

import com.juanpa.cplus.transpiler.lexer.Lexer;
import com.juanpa.cplus.transpiler.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DeclarationMatcherTest
{
	private static DeclarationMatcher matcher(String source)
	{
		return new DeclarationMatcher(new Lexer(source, new ErrorReporter()).scanTokens(), new KnownTypes());
	}

	@Test
	void functionDefinitionHasBody()
	{
		DeclarationMatch match = matcher("int *make(int a, char **b) {").classify(0);

		assertEquals(DeclarationShape.FUNCTION_SIGNATURE, match.getShape());
		FunctionSignature signature = match.getSignature();
		assertEquals("make", signature.getName());
		assertTrue(signature.hasBody());
		assertEquals(12, signature.getBodyBraceIndex());

		List<ParameterRecord> parameters = signature.getParameters();
		assertEquals(2, parameters.size());
		assertEquals("a", parameters.get(0).getName());
		assertEquals(0, parameters.get(0).getStars());
		assertEquals("b", parameters.get(1).getName());
		assertEquals(2, parameters.get(1).getStars());
	}

	@Test
	void prototypeHasNoBody()
	{
		DeclarationMatch match = matcher("void run(void);").classify(0);

		assertEquals(DeclarationShape.FUNCTION_SIGNATURE, match.getShape());
		assertFalse(match.getSignature().hasBody());
		assertTrue(match.getSignature().getParameters().isEmpty());
	}

	@Test
	void trailingQualifiersBeforeBodyAreSkipped()
	{
		DeclarationMatch match = matcher("int get(void) const {").classify(0);

		assertTrue(match.getSignature().hasBody());
	}

	@Test
	void signatureEndingTheInputIsNotAFunction()
	{
		assertNull(matcher("int f(int a)").matchFunctionSignature(0));
	}

	@Test
	void strictDeclarationListsDeclarators()
	{
		DeclarationMatch match = matcher("int x, *y[4];").classify(0);

		assertEquals(DeclarationShape.STRICT_DECLARATION, match.getShape());
		List<Declarator> declarators = match.getDeclarators();
		assertEquals(2, declarators.size());
		assertEquals("x", declarators.get(0).getName());
		assertEquals(0, declarators.get(0).getStars());
		assertEquals("y", declarators.get(1).getName());
		assertEquals(1, declarators.get(1).getStars());
		assertEquals(1, declarators.get(1).getArrayRank());
	}

	@Test
	void strictDeclaratorMustStartOnTypeLine()
	{
		assertTrue(matcher("int\nx;").matchStrictDeclaration(0).isEmpty());
	}

	@Test
	void tagDeclaration()
	{
		DeclarationMatch match = matcher("struct Node **head;").classify(0);

		assertEquals(DeclarationShape.STRICT_DECLARATION, match.getShape());
		assertEquals("head", match.getDeclarators().get(0).getName());
		assertEquals(2, match.getDeclarators().get(0).getStars());
	}

	@Test
	void relaxedDeclarationWithUnknownType()
	{
		DeclarationMatch match = matcher("Thing *t = 0;").classify(0);

		assertEquals(DeclarationShape.RELAXED_DECLARATION, match.getShape());
		assertEquals("t", match.getDeclarators().get(0).getName());
		assertEquals(1, match.getDeclarators().get(0).getStars());
	}

	@Test
	void relaxedDeclarationNeedsGuardToken()
	{
		Declarator declarator = matcher("Thing **grid[3];").matchRelaxedDeclaration(0);

		assertEquals("grid", declarator.getName());
		assertEquals(2, declarator.getStars());
		assertEquals(1, declarator.getArrayRank());
		assertNull(matcher("Thing **grid\nnext").matchRelaxedDeclaration(0));
		assertNull(matcher("n * g").matchRelaxedDeclaration(0));
	}

	@Test
	void callIsNotADeclaration()
	{
		assertEquals(DeclarationShape.NOT_A_DECLARATION, matcher("f(x);").classify(0).getShape());
		assertEquals(DeclarationShape.NOT_A_DECLARATION, matcher("a * b + c;").classify(0).getShape());
	}
}
