package org.abif.irv;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.abif.model.Notice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of an instant runoff (IRV) tally: all rounds and a summary of the final round
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IrvResult {

	List<String> winners = new ArrayList<>();

	/** token -> display name of the winners */
	Map<String, String> winnerNames = new LinkedHashMap<>();

	List<IrvRound> rounds = new ArrayList<>();

	/** a tie-break decided an elimination or there is more than one winner */
	boolean hasTie;

	String tieBreakPolicy;

	/** candidates eliminated by the tie-break strategy, in order */
	List<String> tieBreakLosers = new ArrayList<>();

	long totalBallots;

	long finalRoundCounted;

	long finalRoundExhausted;

	/** votes needed for a majority of all ballots */
	long majorityThreshold;

	long winnerVotes;

	double winnerPct;

	String runnerUp;

	long runnerUpVotes;

	double runnerUpPct;

	int numRounds;

	List<Notice> notices = new ArrayList<>();

	@JsonIgnore
	public IrvRound getFinalRound() {
		return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
	}
}
