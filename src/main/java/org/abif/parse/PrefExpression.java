package org.abif.parse;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of tokenizing one preference string. The tokenizer never throws.
 * Broken input is reported with the {@link #isTruncated()} and {@link #isMalformed()} flags instead.
 */
@Getter
public class PrefExpression {

	final String prefstr;

	final PrefExprType type;

	final List<PrefToken> tokens;

	/** an opening quote or bracket was never closed. The rest of the line became the last candidate. */
	final boolean truncated;

	/** tokenizing stopped at an unexpected character. Everything from there is in {@link #unparsed} */
	final boolean malformed;

	final String unparsed;

	PrefExpression(String prefstr, PrefExprType type, List<PrefToken> tokens, boolean truncated, boolean malformed, String unparsed) {
		this.prefstr = prefstr;
		this.type = type;
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		this.truncated = truncated;
		this.malformed = malformed;
		this.unparsed = unparsed;
	}

	public boolean isEmpty() {
		return tokens.isEmpty();
	}

	public boolean hasAnyRating() {
		return tokens.stream().anyMatch(PrefToken::hasRating);
	}

	@Override
	public String toString() {
		return "PrefExpression[" + type + ", tokens=" + tokens +
				(truncated ? ", truncated" : "") +
				(malformed ? ", malformed at '" + unparsed + "'" : "") + "]";
	}
}
