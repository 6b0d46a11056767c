package org.abif.parse;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * One candidate in a preference string, with its optional rating and the delimiter that follows it.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
public class PrefToken {

	/** candidate token, without quotes or brackets */
	String cand;

	/** rating from a "/n" suffix or null */
	Integer rating;

	/** ">", "=", "," or null when this is the last candidate (or only whitespace follows) */
	String delim;

	/** true if the candidate was written as "..." or [...] */
	boolean quoted;

	public boolean hasRating() {
		return rating != null;
	}

	@Override
	public String toString() {
		return cand + (rating != null ? "/" + rating : "") + (delim != null ? delim : "");
	}
}
