package org.abif.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One line of ballots: <b>qty</b> identical ballots with the same preferences.
 *
 * A voteline is created once while parsing (or by a conversion) and owned by exactly one
 * {@link BallotModel}. Only annotations, e.g. synthesized ratings, are added later.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"qty", "prefs", "prefstr", "comment", "voterid"})
public class Voteline {

	/** number of identical ballots */
	long qty;

	/** candidate token -> preference, in the order of the original preference string */
	LinkedHashMap<String, Preference> prefs = new LinkedHashMap<>();

	/** (optional) the preference string as found in the input */
	String prefstr;

	/** (optional) comment at the end of the line */
	String comment;

	/** (optional) voter id from a "##VID:" comment */
	String voterid;

	public Voteline(long qty) {
		this.qty = qty;
	}

	public Voteline(long qty, Map<String, Preference> prefs) {
		this.qty = qty;
		this.prefs = new LinkedHashMap<>(prefs);
	}

	/** A blank ballot has no preference for any candidate */
	@JsonIgnore
	public boolean isBlank() {
		return prefs.isEmpty();
	}

	@JsonIgnore
	public boolean hasAnyRating() {
		return prefs.values().stream().anyMatch(Preference::hasRating);
	}

	@JsonIgnore
	public boolean hasAllRatings() {
		return !prefs.isEmpty() && prefs.values().stream().allMatch(Preference::hasRating);
	}

	/** True when the preference string used rank delimiters, ie. ">" or "=" */
	@JsonIgnore
	public boolean isRankDelimited() {
		return prefs.values().stream().anyMatch(p -> ">".equals(p.getNextDelim()) || "=".equals(p.getNextDelim()));
	}

	/**
	 * Candidate tokens from most to least preferred. Ties keep their order from the preference string.
	 * Candidates without a rank are at the end.
	 */
	@JsonIgnore
	public List<String> getRanklist() {
		List<String> ranklist = new ArrayList<>(prefs.keySet());
		ranklist.sort(Comparator.comparingInt(cand -> prefs.get(cand).getRankOrMax()));
		return ranklist;
	}

	/**
	 * Deep copy of this voteline. Preferences are immutable and can be shared.
	 */
	public Voteline copy() {
		Voteline copy = new Voteline(qty, prefs);
		copy.prefstr = prefstr;
		copy.comment = comment;
		copy.voterid = voterid;
		return copy;
	}
}
