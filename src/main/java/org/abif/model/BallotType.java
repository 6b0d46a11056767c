package org.abif.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * The kind of ballots in an election. Tallies and conversions depend on it.
 */
public enum BallotType {
	CHOOSE_ONE("choose_one"),       // single choice, e.g. FPTP ballots
	CHOOSE_MANY("choose_many"),     // multiple choice, ie. approval ballots
	RANKED("ranked"),
	RATED("rated"),                 // score and STAR ballots
	UNKNOWN("unknown");             // no (non-blank) ballots at all

	final String label;

	BallotType(String label) {
		this.label = label;
	}

	@JsonValue
	public String getLabel() {
		return label;
	}

	/**
	 * Parse the value of an explicit "ballot_type" metadata line.
	 * @param label e.g. "ranked" or "choose_many". Case and surrounding whitespace do not matter.
	 * @return the matching ballot type or Optional.empty() if the label is not known
	 */
	public static Optional<BallotType> fromLabel(Object label) {
		if (label == null) return Optional.empty();
		String str = label.toString().trim().toLowerCase();
		for (BallotType type : values()) {
			if (type.label.equals(str)) return Optional.of(type);
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		return label;
	}
}
