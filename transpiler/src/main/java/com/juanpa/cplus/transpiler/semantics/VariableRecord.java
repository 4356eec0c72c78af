package com.juanpa.cplus.transpiler.semantics;

/**
 * What the analyzer has inferred about one variable name within one scope:
 * how many levels of indirection it carries and how many array dimensions it was declared with.
 * Repeated declarations merge: pointer depth keeps the minimum, array rank the maximum.
 */
public class VariableRecord
{
	/**
	 * Pointer depth of a name that was never seen declared.
	 */
	public static final int UNOBSERVED = Integer.MAX_VALUE;

	private int pointerDepth = UNOBSERVED;
	private int arrayRank = 0;

	/**
	 * Folds one more declarator of this name into the record.
	 */
	public void mergeDeclaration(int stars, int arrays)
	{
		mergePointerDepth(stars);
		if (arrays > arrayRank)
		{
			arrayRank = arrays;
		}
	}

	/**
	 * Parameters only contribute pointer depth; array suffixes on parameters are ignored.
	 */
	public void mergePointerDepth(int stars)
	{
		if (stars < pointerDepth)
		{
			pointerDepth = stars;
		}
	}

	public int getPointerDepth()
	{
		return pointerDepth;
	}

	public int getArrayRank()
	{
		return arrayRank;
	}

	public boolean isPointerDepthObserved()
	{
		return pointerDepth != UNOBSERVED;
	}

	/**
	 * True when neither a depth nor an array rank was ever recorded: the name is unknown.
	 */
	public boolean isUnknown()
	{
		return !isPointerDepthObserved() && arrayRank == 0;
	}

	/**
	 * Depth to start a member chain from; an unobserved depth counts as a plain value.
	 */
	public int getEffectivePointerDepth()
	{
		return isPointerDepthObserved() ? pointerDepth : 0;
	}

	@Override
	public String toString()
	{
		String depth = isPointerDepthObserved() ? String.valueOf(pointerDepth) : "?";
		return "VariableRecord(depth=" + depth + ", rank=" + arrayRank + ")";
	}
}
