package org.abif.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the preference part of a voteline into candidates, ratings and delimiters.
 *
 * <pre>
 *   Memph/5 > "New Nashville"/3 = [Chat, TN]/3 , Knox
 * </pre>
 *
 * Candidates are bare tokens of letters, digits, "_" and "-", or any text in double quotes or square brackets.
 * A rating "/n" may follow a candidate. Delimiters are ">" (strictly preferred), "=" (tie)
 * and "," (list of ratings).
 *
 * The tokenizer is lenient. It never throws. An unterminated quote or bracket turns the rest of the
 * string into the last candidate. Any other unexpected character stops tokenizing.
 */
public class PrefTokenizer {

	public static final char RANK_DELIM = '>';
	public static final char TIE_DELIM = '=';
	public static final char LIST_DELIM = ',';

	private PrefTokenizer() {}

	public static PrefExpression tokenize(String prefstr) {
		if (prefstr == null) prefstr = "";
		List<PrefToken> tokens = new ArrayList<>();
		boolean truncated = false;
		boolean malformed = false;
		String unparsed = null;

		final int len = prefstr.length();
		int pos = skipWhitespace(prefstr, 0);
		while (pos < len) {
			char c = prefstr.charAt(pos);
			String cand;
			boolean quoted = false;
			if (c == '"' || c == '[') {
				char closing = c == '"' ? '"' : ']';
				int end = prefstr.indexOf(closing, pos + 1);
				quoted = true;
				if (end < 0) {
					cand = prefstr.substring(pos + 1).trim();
					truncated = true;
					pos = len;
				} else {
					cand = prefstr.substring(pos + 1, end);
					pos = end + 1;
				}
			} else if (isBareChar(c)) {
				int start = pos;
				while (pos < len && isBareChar(prefstr.charAt(pos))) pos++;
				cand = prefstr.substring(start, pos);
			} else {
				malformed = true;
				unparsed = prefstr.substring(pos);
				break;
			}

			// optional rating
			Integer rating = null;
			pos = skipWhitespace(prefstr, pos);
			if (pos < len && prefstr.charAt(pos) == '/') {
				int start = pos + 1;
				int end = start;
				while (end < len && Character.isDigit(prefstr.charAt(end))) end++;
				if (end == start || end - start > 9) {   // no digits, or more than fits into an int
					malformed = true;
					unparsed = prefstr.substring(pos);
					addToken(tokens, cand, null, null, quoted);
					break;
				}
				rating = Integer.valueOf(prefstr.substring(start, end));
				pos = skipWhitespace(prefstr, end);
			}

			// optional delimiter
			String delim = null;
			if (pos < len && isDelimiter(prefstr.charAt(pos))) {
				delim = String.valueOf(prefstr.charAt(pos));
				pos = skipWhitespace(prefstr, pos + 1);
			}
			addToken(tokens, cand, rating, delim, quoted);
		}

		PrefExprType type = classify(prefstr);
		if (type == PrefExprType.SINGLE && tokens.isEmpty()) type = PrefExprType.EMPTY;
		return new PrefExpression(prefstr, type, tokens, truncated, malformed, unparsed);
	}

	/**
	 * Classify a preference string by the first delimiter that is not inside quotes or brackets.
	 * @param prefstr preference part of a voteline
	 * @return RANKED for ">" or "=", RATED for ",", SINGLE without any delimiter, EMPTY for blank strings
	 */
	public static PrefExprType classify(String prefstr) {
		if (prefstr == null || prefstr.isBlank()) return PrefExprType.EMPTY;
		String masked = maskQuoted(prefstr);
		for (int i = 0; i < masked.length(); i++) {
			char c = masked.charAt(i);
			if (c == RANK_DELIM || c == TIE_DELIM) return PrefExprType.RANKED;
			if (c == LIST_DELIM) return PrefExprType.RATED;
		}
		return PrefExprType.SINGLE;
	}

	/**
	 * Replace everything between quotes or square brackets (inclusive) with underscores,
	 * so that delimiters inside candidate names are not found. An unterminated span is masked until the end.
	 * Inside double quotes a backslash escapes the next character, e.g. the quoted metadata value "say \"hi\"".
	 */
	static String maskQuoted(String str) {
		StringBuilder sb = new StringBuilder(str.length());
		char closing = 0;
		for (int i = 0; i < str.length(); i++) {
			char c = str.charAt(i);
			if (closing != 0) {
				sb.append('_');
				if (closing == '"' && c == '\\' && i + 1 < str.length()) {
					sb.append('_');
					i++;
				} else if (c == closing) {
					closing = 0;
				}
			} else if (c == '"' || c == '[') {
				closing = c == '"' ? '"' : ']';
				sb.append('_');
			} else {
				sb.append(c);
			}
		}
		return sb.toString();
	}

	/**
	 * Find the start of a line comment, ie. the first "#" that is not inside quotes or brackets.
	 * @return index of the "#" or -1
	 */
	public static int indexOfComment(String line) {
		String masked = maskQuoted(line);
		return masked.indexOf('#');
	}

	/** Bare candidate tokens. Letters and digits of any script are tolerated. */
	static boolean isBareChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '-';
	}

	static boolean isDelimiter(char c) {
		return c == RANK_DELIM || c == TIE_DELIM || c == LIST_DELIM;
	}

	private static int skipWhitespace(String str, int pos) {
		while (pos < str.length() && Character.isWhitespace(str.charAt(pos))) pos++;
		return pos;
	}

	private static void addToken(List<PrefToken> tokens, String cand, Integer rating, String delim, boolean quoted) {
		if (cand.isEmpty()) return;
		tokens.add(new PrefToken(cand, rating, delim, quoted));
	}
}
