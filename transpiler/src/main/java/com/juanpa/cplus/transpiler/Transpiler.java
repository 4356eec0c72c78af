package com.juanpa.cplus.transpiler;

import com.juanpa.cplus.transpiler.codegen.CppGenerator;
import com.juanpa.cplus.transpiler.lexer.ForbiddenOperatorException;
import com.juanpa.cplus.transpiler.lexer.Lexer;
import com.juanpa.cplus.transpiler.lexer.SourceNormalizer;
import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.semantics.KnownTypes;
import com.juanpa.cplus.transpiler.semantics.ScopeAnalyzer;
import com.juanpa.cplus.transpiler.semantics.ScopeTree;
import com.juanpa.cplus.transpiler.util.Debug;
import com.juanpa.cplus.transpiler.util.ErrorReporter;

import java.util.List;

/**
 * Translates one C+ source text to C++. Each stage finishes before the next one starts:
 * normalize, lex, analyze scopes and declarations, then generate.
 * <p>
 * The {@link KnownTypes} passed in is updated with every type name the file declares, so a
 * Transpiler (or several sharing one KnownTypes) carries type names from file to file.
 */
public class Transpiler
{
	private final KnownTypes knownTypes;
	private final ErrorReporter errorReporter;

	public Transpiler(KnownTypes knownTypes, ErrorReporter errorReporter)
	{
		this.knownTypes = knownTypes;
		this.errorReporter = errorReporter;
	}

	/**
	 * A transpiler with its own fresh set of known types.
	 */
	public Transpiler()
	{
		this(new KnownTypes(), new ErrorReporter());
	}

	/**
	 * @param rawSource File contents as read, before line-ending normalization.
	 * @return The C++ text, one output line per non-empty source line.
	 * @throws ForbiddenOperatorException if the source contains '->'.
	 */
	public String transpile(String rawSource)
	{
		String source = SourceNormalizer.normalize(rawSource);
		List<Token> tokens = new Lexer(source, errorReporter).scanTokens();
		Debug.log("Lexed %d tokens", tokens.size());

		ScopeTree scopes = new ScopeAnalyzer(knownTypes).analyze(tokens);
		if (Debug.isEnabled())
		{
			Debug.log("Scopes:\n%s", scopes);
		}
		return new CppGenerator(scopes).generate(tokens);
	}

	public KnownTypes getKnownTypes()
	{
		return knownTypes;
	}
}
