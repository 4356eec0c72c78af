// File: src/main/java/com/juanpa/cplus/transpiler/codegen/CppGenerator.java
package com.juanpa.cplus.transpiler.codegen;

import com.juanpa.cplus.transpiler.lexer.Token;
import com.juanpa.cplus.transpiler.semantics.ScopeKind;
import com.juanpa.cplus.transpiler.semantics.ScopeTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns analyzed C+ tokens into C++ text: the terminator passes run over the whole file,
 * then each physical line is rewritten, completed with its terminator and emitted.
 */
public class CppGenerator
{
	private final ScopeTree scopes;
	private final TerminatorNormalizer normalizer;
	private final MemberChainRewriter rewriter;
	private final LineTerminatorInference terminators;
	private final CppEmitter emitter = new CppEmitter();

	public CppGenerator(ScopeTree scopes)
	{
		this.scopes = scopes;
		this.normalizer = new TerminatorNormalizer(scopes);
		this.rewriter = new MemberChainRewriter(scopes);
		this.terminators = new LineTerminatorInference(scopes);
	}

	/**
	 * @param tokens The file's tokens, already stamped with scope ids by the analyzer that built {@code scopes}.
	 */
	public String generate(List<Token> tokens)
	{
		return emitter.emit(generateLines(tokens));
	}

	/**
	 * The rewritten lines before serialization.
	 */
	public List<List<Token>> generateLines(List<Token> tokens)
	{
		List<Token> normalized = normalizer.normalize(tokens);
		List<List<Token>> lines = new ArrayList<>();
		for (SourceLine line : SourceLine.split(normalized))
		{
			ScopeKind kind = scopes.kindOf(line.getScopeId());
			List<Token> rewritten = rewriter.rewrite(line);
			lines.add(terminators.apply(rewritten, kind));
		}
		return lines;
	}
}
