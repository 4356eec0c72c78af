package com.juanpa.cplus.transpiler.lexer;

/**
 * Prepares raw file text for the Lexer: line endings become '\n' and
 * backslash-newline splices are removed so continued lines join.
 */
public final class SourceNormalizer
{
	private SourceNormalizer()
	{
	}

	public static String normalize(String raw)
	{
		return spliceContinuations(normalizeLineEndings(raw));
	}

	/**
	 * CRLF and lone CR both become LF.
	 */
	static String normalizeLineEndings(String raw)
	{
		StringBuilder sb = new StringBuilder(raw.length());
		for (int i = 0; i < raw.length(); i++)
		{
			char c = raw.charAt(i);
			if (c == '\r')
			{
				if (i + 1 < raw.length() && raw.charAt(i + 1) == '\n')
				{
					continue; // the '\n' is copied on the next iteration
				}
				sb.append('\n');
			}
			else
			{
				sb.append(c);
			}
		}
		return sb.toString();
	}

	static String spliceContinuations(String text)
	{
		StringBuilder sb = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) == '\n')
			{
				i++;
				continue;
			}
			sb.append(c);
		}
		return sb.toString();
	}
}
