package com.juanpa.cplus.transpiler.semantics;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of classifying one token position. Only the field matching the shape is populated.
 */
public class DeclarationMatch
{
	private static final DeclarationMatch NONE =
			new DeclarationMatch(DeclarationShape.NOT_A_DECLARATION, Collections.emptyList(), null);

	private final DeclarationShape shape;
	private final List<Declarator> declarators;
	private final FunctionSignature signature;

	private DeclarationMatch(DeclarationShape shape, List<Declarator> declarators, FunctionSignature signature)
	{
		this.shape = shape;
		this.declarators = declarators;
		this.signature = signature;
	}

	public static DeclarationMatch none()
	{
		return NONE;
	}

	public static DeclarationMatch function(FunctionSignature signature)
	{
		return new DeclarationMatch(DeclarationShape.FUNCTION_SIGNATURE, Collections.emptyList(), signature);
	}

	public static DeclarationMatch strict(List<Declarator> declarators)
	{
		return new DeclarationMatch(DeclarationShape.STRICT_DECLARATION, List.copyOf(declarators), null);
	}

	public static DeclarationMatch relaxed(Declarator declarator)
	{
		return new DeclarationMatch(DeclarationShape.RELAXED_DECLARATION, List.of(declarator), null);
	}

	public DeclarationShape getShape()
	{
		return shape;
	}

	public List<Declarator> getDeclarators()
	{
		return declarators;
	}

	/**
	 * @return the signature for FUNCTION_SIGNATURE matches, null otherwise.
	 */
	public FunctionSignature getSignature()
	{
		return signature;
	}

	@Override
	public String toString()
	{
		switch (shape)
		{
			case FUNCTION_SIGNATURE:
				return shape + " " + signature;
			case STRICT_DECLARATION:
			case RELAXED_DECLARATION:
				return shape + " " + declarators;
			default:
				return shape.toString();
		}
	}
}
