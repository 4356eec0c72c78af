package com.juanpa.cplus.transpiler.semantics;

import java.util.List;

/**
 * A recognized function signature: its name, parameters and the index of its body brace. {@code bodyBraceIndex} is -1 for a prototype.
 */
public class FunctionSignature
{
	public static final int NO_BODY = -1;

	private final int bodyBraceIndex;
	private final String name;
	private final List<ParameterRecord> parameters;

	public FunctionSignature(String name, int bodyBraceIndex, List<ParameterRecord> parameters)
	{
		this.name = name;
		this.bodyBraceIndex = bodyBraceIndex;
		this.parameters = List.copyOf(parameters);
	}

	public String getName()
	{
		return name;
	}

	public int getBodyBraceIndex()
	{
		return bodyBraceIndex;
	}

	public boolean hasBody()
	{
		return bodyBraceIndex != NO_BODY;
	}

	public List<ParameterRecord> getParameters()
	{
		return parameters;
	}

	@Override
	public String toString()
	{
		return name + parameters + (hasBody() ? " {...}" : ";");
	}
}
