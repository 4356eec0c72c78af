package com.juanpa.cplus.transpiler.semantics;

/**
 * The structural role of a brace-delimited region of C+ source.
 */
public enum ScopeKind
{
	GLOBAL("Global"),
	FUNCTION("Function"),
	STRUCT("Struct"),
	UNION("Union"),
	ENUM("Enum"),
	BLOCK("Block");

	private final String displayName;

	ScopeKind(String displayName)
	{
		this.displayName = displayName;
	}

	/**
	 * Struct, union and enum bodies define types; their closing brace may need a terminator.
	 */
	public boolean isTypeBody()
	{
		return this == STRUCT || this == UNION || this == ENUM;
	}

	/**
	 * Maps a tag keyword to the kind of scope its body opens.
	 *
	 * @return the kind, or null if {@code keyword} is not struct, union or enum.
	 */
	public static ScopeKind forTagKeyword(String keyword)
	{
		switch (keyword)
		{
			case "struct":
				return STRUCT;
			case "union":
				return UNION;
			case "enum":
				return ENUM;
			default:
				return null;
		}
	}

	@Override
	public String toString()
	{
		return displayName;
	}
}
