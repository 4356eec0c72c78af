package com.juanpa.cplus.transpiler.semantics;

/**
 * A single declared name with the '*' count before it and the number of '[...]' suffixes after it.
 */
public class Declarator
{
	private final String name;
	private final int stars;
	private final int arrayRank;

	public Declarator(String name, int stars, int arrayRank)
	{
		this.name = name;
		this.stars = stars;
		this.arrayRank = arrayRank;
	}

	public String getName()
	{
		return name;
	}

	public int getStars()
	{
		return stars;
	}

	public int getArrayRank()
	{
		return arrayRank;
	}

	@Override
	public String toString()
	{
		return "*".repeat(stars) + name + "[]".repeat(arrayRank);
	}
}
