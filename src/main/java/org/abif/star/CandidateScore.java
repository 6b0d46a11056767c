package org.abif.star;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Total score of one candidate
 */
@Data
@NoArgsConstructor
public class CandidateScore {
	String candname;

	/** sum of rating * qty */
	long score;

	/** number of ballots that rate this candidate above 0 */
	long votercount;

	/** 1 is the highest score. Equal scores share their rank. */
	int rank;

	public CandidateScore(String candname) {
		this.candname = candname;
	}
}
