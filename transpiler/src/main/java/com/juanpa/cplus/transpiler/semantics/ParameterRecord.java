package com.juanpa.cplus.transpiler.semantics;

/**
 * A function parameter as parsed from a signature: its name and the number of '*' before it.
 */
public class ParameterRecord
{
	private final String name;
	private final int stars;

	public ParameterRecord(String name, int stars)
	{
		this.name = name;
		this.stars = stars;
	}

	public String getName()
	{
		return name;
	}

	public int getStars()
	{
		return stars;
	}

	@Override
	public String toString()
	{
		return "*".repeat(stars) + name;
	}
}
