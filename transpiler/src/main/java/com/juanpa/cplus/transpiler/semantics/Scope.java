package com.juanpa.cplus.transpiler.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One node of the scope tree. Scopes refer to their parent by id; the tree itself
 * is owned by {@link ScopeTree}.
 */
public class Scope
{
	public static final int NO_PARENT = -1;

	private final int id;
	private final int parentId;
	private final ScopeKind kind;
	private final String name; // Tag or function name, null for anonymous scopes
	private final Map<String, VariableRecord> variables = new LinkedHashMap<>();

	Scope(int id, int parentId, ScopeKind kind, String name)
	{
		this.id = id;
		this.parentId = parentId;
		this.kind = kind;
		this.name = name;
	}

	/**
	 * Returns the record for {@code name} in this scope, creating an empty one if needed.
	 */
	public VariableRecord declare(String name)
	{
		return variables.computeIfAbsent(name, key -> new VariableRecord());
	}

	/**
	 * Looks up a name only in this scope.
	 *
	 * @return the record, or null if this scope never declared the name.
	 */
	public VariableRecord lookupLocal(String name)
	{
		return variables.get(name);
	}

	public int getId()
	{
		return id;
	}

	public int getParentId()
	{
		return parentId;
	}

	public boolean isRoot()
	{
		return parentId == NO_PARENT;
	}

	public ScopeKind getKind()
	{
		return kind;
	}

	public String getName()
	{
		return name;
	}

	public Map<String, VariableRecord> getVariables()
	{
		return Collections.unmodifiableMap(variables);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Scope #").append(id).append(' ').append(kind);
		if (name != null)
		{
			sb.append(" '").append(name).append('\'');
		}
		sb.append(" (parent ").append(parentId).append("):\n");
		for (Map.Entry<String, VariableRecord> entry : variables.entrySet())
		{
			sb.append("  ").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
		}
		return sb.toString();
	}
}
