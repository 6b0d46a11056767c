package org.abif.irv;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.abif.pairwise.PairwiseMatrix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bookkeeping of one IRV round.
 * startingQty == countedQty + exhaustedQty + overvoteQty in every round.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IrvRound {

	public static final String EXHAUSTED = "exhausted";

	int roundNum;

	List<String> startingCands = new ArrayList<>();

	long startingQty;

	/** ballots without any remaining candidate */
	long exhaustedQty;

	/** ballots with several candidates tied at their top rank. They are not counted anymore. */
	long overvoteQty;

	long countedQty;

	/** candidate -> votes, most votes first */
	LinkedHashMap<String, Long> counts = new LinkedHashMap<>();

	long bottomVotesPercand;

	long penultimateVotesPercand;

	long leadingVotesPercand;

	/** candidates tied for last place. Null if there is no tie. */
	List<String> bottomTie;

	/** all candidates tied for last place were eliminated at once */
	boolean batchElim;

	/** one of the tied candidates was eliminated by the tie-break strategy */
	boolean tieBreakElim;

	/** that tie-break was a random choice */
	boolean randomElim;

	Set<String> eliminated = new LinkedHashSet<>();

	/** eliminated in this and all previous rounds */
	Set<String> allEliminated = new LinkedHashSet<>();

	/** only set in the final round */
	List<String> winners;

	/** eliminated candidate -> (next candidate or "exhausted") -> votes transferred */
	Map<String, Map<String, Long>> transfers = new LinkedHashMap<>();

	/** only with extras: remaining candidate -> where its votes would go if it were eliminated instead */
	Map<String, Map<String, Long>> nextChoices;

	/** only with extras: duel matrix of the remaining candidates on the ballots of the eliminated candidates */
	PairwiseMatrix elimcandSupporterPairwiseResults;

	public IrvRound(int roundNum, List<String> startingCands) {
		this.roundNum = roundNum;
		this.startingCands = new ArrayList<>(startingCands);
	}

	public boolean isFinalRound() {
		return winners != null;
	}
}
