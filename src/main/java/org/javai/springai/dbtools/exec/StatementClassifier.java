package org.javai.springai.dbtools.exec;

import java.util.Locale;
import org.javai.springai.dbtools.api.Mutability;

/**
 * Lexical read/write classification of SQL text.
 *
 * <p>The statement is trimmed and its leading word, the run of ASCII letters it starts
 * with, compared ignoring case with {@code SELECT}; a word that runs on into a
 * non-ASCII letter matches nothing. Anything else is {@link Mutability#MUTATING}.
 * The text is never parsed: a write behind a {@code WITH} clause is mutating because
 * its first word is {@code WITH}, and a batch such as {@code SELECT 1; DROP TABLE t}
 * is a read because its first word is {@code SELECT}.</p>
 */
public final class StatementClassifier {

	private static final String READ_KEYWORD = "SELECT";

	private StatementClassifier() {
	}

	public static Mutability classify(String sql) {
		if (sql == null) {
			return Mutability.MUTATING;
		}
		String trimmed = sql.strip();
		return READ_KEYWORD.equals(leadingWord(trimmed).toUpperCase(Locale.ROOT))
				? Mutability.READ_ONLY
				: Mutability.MUTATING;
	}

	public static boolean isRead(String sql) {
		return classify(sql) == Mutability.READ_ONLY;
	}

	private static String leadingWord(String text) {
		int end = 0;
		while (end < text.length() && isAsciiLetter(text.charAt(end))) {
			end++;
		}
		if (end < text.length() && Character.isLetter(text.charAt(end))) {
			// a word running on into a non-ASCII letter is no keyword
			return "";
		}
		return text.substring(0, end);
	}

	private static boolean isAsciiLetter(char c) {
		return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
	}
}
