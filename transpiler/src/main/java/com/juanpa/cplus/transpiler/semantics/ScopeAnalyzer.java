// File: src/main/java/com/juanpa/cplus/transpiler/semantics/ScopeAnalyzer.java
package com.juanpa.cplus.transpiler.semantics;

import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.util.Debug;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the scope tree of one file in a single forward pass over its tokens.
 * Every token is stamped with the scope it appears in, variables are recorded with their inferred
 * pointer depth and array rank, and new type names are added to the shared {@link KnownTypes}.
 * <p>
 * A token is stamped before it takes effect, so a '{' belongs to the scope around it while a
 * '}' belongs to the scope it closes.
 */
public class ScopeAnalyzer
{
	private final KnownTypes knownTypes;

	private ScopeTree tree;
	private int currentScopeId;
	private ScopeKind pendingKind; // Set by struct/union/enum or a function signature, consumed by the next '{'
	private String pendingName;
	private final Map<Integer, FunctionSignature> functionBodies = new HashMap<>(); // Keyed by body '{' index

	/**
	 * @param knownTypes Type names known so far in this run. Updated in place as typedefs and tags are found.
	 */
	public ScopeAnalyzer(KnownTypes knownTypes)
	{
		this.knownTypes = knownTypes;
	}

	/**
	 * Analyzes one file's tokens. The tokens' scope ids are filled in as a side effect.
	 */
	public ScopeTree analyze(List<Token> tokens)
	{
		tree = new ScopeTree();
		currentScopeId = ScopeTree.GLOBAL_SCOPE_ID;
		clearPending();
		functionBodies.clear();

		DeclarationMatcher matcher = new DeclarationMatcher(tokens, knownTypes);

		for (int i = 0; i < tokens.size(); i++)
		{
			Token token = tokens.get(i);
			token.setScopeId(currentScopeId);

			if (token.isKeyword("typedef"))
			{
				registerTypedefAlias(tokens, i);
			}
			if (token.isTagKeyword())
			{
				registerTag(tokens, i);
			}

			DeclarationMatch match = matcher.classify(i);
			switch (match.getShape())
			{
				case FUNCTION_SIGNATURE:
					FunctionSignature signature = match.getSignature();
					if (signature.hasBody())
					{
						pendingKind = ScopeKind.FUNCTION;
						pendingName = signature.getName();
						functionBodies.put(signature.getBodyBraceIndex(), signature);
						Debug.log("Function '%s' with parameters %s", signature.getName(), signature.getParameters());
					}
					break;
				case STRICT_DECLARATION:
				case RELAXED_DECLARATION:
					for (Declarator declarator : match.getDeclarators())
					{
						tree.get(currentScopeId).declare(declarator.getName())
								.mergeDeclaration(declarator.getStars(), declarator.getArrayRank());
						Debug.log("%s '%s' in scope #%d (line %d)", match.getShape(), declarator,
								currentScopeId, token.getLine());
					}
					break;
				case NOT_A_DECLARATION:
				default:
					break;
			}

			if (token.isPunct("{"))
			{
				openScope(i);
			}
			else if (token.isPunct("}"))
			{
				closeScope();
			}
		}
		return tree;
	}

	/**
	 * The last identifier before the next ';' or '}' names the alias. Statements declaring several
	 * aliases at once only register the last one.
	 */
	private void registerTypedefAlias(List<Token> tokens, int typedefIndex)
	{
		String alias = null;
		for (int j = typedefIndex + 1; j < tokens.size(); j++)
		{
			Token token = tokens.get(j);
			if (token.isPunct(";") || token.isPunct("}"))
			{
				break;
			}
			if (token.isIdentifier())
			{
				alias = token.getLexeme();
			}
		}
		if (alias != null && knownTypes.add(alias))
		{
			Debug.log("Type alias '%s'", alias);
		}
	}

	private void registerTag(List<Token> tokens, int tagIndex)
	{
		Token keyword = tokens.get(tagIndex);
		String tag = null;
		if (tagIndex + 1 < tokens.size() && tokens.get(tagIndex + 1).isIdentifier())
		{
			tag = tokens.get(tagIndex + 1).getLexeme();
			if (knownTypes.add(tag))
			{
				Debug.log("Tag type '%s %s'", keyword.getLexeme(), tag);
			}
		}
		pendingKind = ScopeKind.forTagKeyword(keyword.getLexeme());
		pendingName = tag;
	}

	/**
	 * A function body always opens a Function scope, even when a struct/union/enum keyword in the
	 * parameter list overwrote the pending slot after the signature was seen.
	 */
	private void openScope(int braceIndex)
	{
		FunctionSignature function = functionBodies.get(braceIndex);
		ScopeKind kind;
		String name;
		if (function != null)
		{
			kind = ScopeKind.FUNCTION;
			name = function.getName();
		}
		else
		{
			kind = pendingKind != null ? pendingKind : ScopeKind.BLOCK;
			name = pendingName;
		}
		Scope scope = tree.open(currentScopeId, kind, name);
		currentScopeId = scope.getId();

		if (function != null)
		{
			for (ParameterRecord parameter : function.getParameters())
			{
				scope.declare(parameter.getName()).mergePointerDepth(parameter.getStars());
			}
		}
		Debug.log("Open scope #%d %s%s", scope.getId(), kind, name != null ? " '" + name + "'" : "");
		Debug.indent();
		clearPending();
	}

	/**
	 * An unmatched '}' at Global leaves the cursor at Global.
	 */
	private void closeScope()
	{
		Scope scope = tree.get(currentScopeId);
		if (!scope.isRoot())
		{
			currentScopeId = scope.getParentId();
			Debug.dedent();
			Debug.log("Close scope #%d", scope.getId());
		}
		clearPending();
	}

	private void clearPending()
	{
		pendingKind = null;
		pendingName = null;
	}
}
