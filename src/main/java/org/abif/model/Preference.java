package org.abif.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * What one ballot says about one candidate: its rank, its rating or both.
 * Preferences are immutable. Use {@link #withRating(int)} and {@link #withRank(int)} to annotate.
 */
@Getter
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"rank", "rating", "nextdelim"})
public class Preference {

	/** What the voter actually expressed for this candidate */
	public enum Kind {
		RANK_ONLY,          // e.g. A>B
		RATING_ONLY,        // e.g. A/5,B/3   The rank is derived from the ratings.
		RANK_AND_RATING     // e.g. A/5>B/3
	}

	/** 1 is most preferred. Candidates in a tie share their rank. */
	Integer rank;

	Integer rating;

	/** delimiter to the next candidate in the original preference string: ">", "=" or "," */
	@JsonProperty("nextdelim")
	String nextDelim;

	@JsonIgnore
	@EqualsAndHashCode.Exclude
	Kind kind;

	private Preference(Integer rank, Integer rating, String nextDelim, Kind kind) {
		this.rank = rank;
		this.rating = rating;
		this.nextDelim = nextDelim;
		this.kind = kind;
	}

	public static Preference ranked(int rank, String nextDelim) {
		return new Preference(rank, null, nextDelim, Kind.RANK_ONLY);
	}

	public static Preference rankedAndRated(int rank, int rating, String nextDelim) {
		return new Preference(rank, rating, nextDelim, Kind.RANK_AND_RATING);
	}

	/**
	 * A rating without an expressed rank. The rank may still be unknown (null) until
	 * it is derived from the ratings of the whole ballot.
	 */
	public static Preference rated(int rating, Integer derivedRank, String nextDelim) {
		return new Preference(derivedRank, rating, nextDelim, Kind.RATING_ONLY);
	}

	@JsonCreator
	static Preference fromJson(@JsonProperty("rank") Integer rank,
	                           @JsonProperty("rating") Integer rating,
	                           @JsonProperty("nextdelim") String nextDelim) {
		Kind kind;
		if (rating == null) {
			kind = Kind.RANK_ONLY;
		} else if (rank == null) {
			kind = Kind.RATING_ONLY;
		} else {
			kind = Kind.RANK_AND_RATING;
		}
		return new Preference(rank, rating, nextDelim, kind);
	}

	@JsonIgnore
	public boolean hasRating() {
		return rating != null;
	}

	@JsonIgnore
	public boolean hasRank() {
		return rank != null;
	}

	/** Rank for comparisons. Candidates without a rank are effectively ranked infinitely low. */
	@JsonIgnore
	public int getRankOrMax() {
		return rank == null ? Integer.MAX_VALUE : rank;
	}

	/** Annotate a (synthesized) rating. A rank only preference becomes RANK_AND_RATING. */
	public Preference withRating(int newRating) {
		Kind newKind = kind == Kind.RANK_ONLY ? Kind.RANK_AND_RATING : kind;
		return new Preference(rank, newRating, nextDelim, newKind);
	}

	/** Set the rank that was derived from ratings. The kind stays as it was expressed. */
	public Preference withRank(int newRank) {
		return new Preference(newRank, rating, nextDelim, kind);
	}

	@Override
	public String toString() {
		return "Preference[rank=" + rank + ", rating=" + rating + ", nextdelim=" + nextDelim + ", " + kind + "]";
	}
}
