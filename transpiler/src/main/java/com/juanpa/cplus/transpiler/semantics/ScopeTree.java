package com.juanpa.cplus.transpiler.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arena of all scopes found in one file, indexed by id in creation order.
 * Id 0 is always the Global scope. Name resolution walks parent ids toward the root.
 */
public class ScopeTree
{
	public static final int GLOBAL_SCOPE_ID = 0;

	private final List<Scope> scopes = new ArrayList<>();

	public ScopeTree()
	{
		scopes.add(new Scope(GLOBAL_SCOPE_ID, Scope.NO_PARENT, ScopeKind.GLOBAL, null));
	}

	/**
	 * Creates a child of {@code parentId}. The new scope gets the next free id.
	 */
	public Scope open(int parentId, ScopeKind kind, String name)
	{
		if (parentId < 0 || parentId >= scopes.size())
		{
			throw new IllegalArgumentException("No scope with id " + parentId + " to nest under.");
		}
		Scope scope = new Scope(scopes.size(), parentId, kind, name);
		scopes.add(scope);
		return scope;
	}

	public Scope get(int id)
	{
		return scopes.get(id);
	}

	public Scope getGlobal()
	{
		return scopes.get(GLOBAL_SCOPE_ID);
	}

	/**
	 * The kind of scope {@code id}; ids outside the tree are treated as Global.
	 */
	public ScopeKind kindOf(int id)
	{
		if (id < 0 || id >= scopes.size())
		{
			return ScopeKind.GLOBAL;
		}
		return scopes.get(id).getKind();
	}

	/**
	 * Finds the record that governs {@code name} when seen from scope {@code scopeId}:
	 * the first declaring scope on the way up to Global wins.
	 *
	 * @return the governing record, or an unknown record (unobserved depth, rank 0) if no scope declares it.
	 */
	public VariableRecord resolve(int scopeId, String name)
	{
		int current = scopeId;
		while (current != Scope.NO_PARENT && current < scopes.size())
		{
			Scope scope = scopes.get(current);
			VariableRecord record = scope.lookupLocal(name);
			if (record != null)
			{
				return record;
			}
			current = scope.getParentId();
		}
		return new VariableRecord();
	}

	public int size()
	{
		return scopes.size();
	}

	public List<Scope> getScopes()
	{
		return Collections.unmodifiableList(scopes);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Scope scope : scopes)
		{
			sb.append(scope);
		}
		return sb.toString();
	}
}
