package com.juanpa.cplus.transpiler.semantics;

/**
 * What the analyzer recognized at a token position, in the order the shapes are tried.
 */
public enum DeclarationShape
{
	FUNCTION_SIGNATURE,
	STRICT_DECLARATION,
	RELAXED_DECLARATION,
	NOT_A_DECLARATION
}
