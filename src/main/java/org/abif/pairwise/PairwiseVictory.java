package org.abif.pairwise;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One head-to-head matchup. For a tie, winner and loser are null and tiedCandidates is set.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PairwiseVictory {
	String winner;
	String loser;
	List<String> tiedCandidates;
	long winnerVotes;
	long loserVotes;
	long victorySize;
	long totalVotes;

	public boolean isTie() {
		return tiedCandidates != null;
	}
}
