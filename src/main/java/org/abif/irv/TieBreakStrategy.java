package org.abif.irv;

import java.util.List;

/**
 * Chooses which of the candidates tied for last place is eliminated in an IRV round.
 */
public interface TieBreakStrategy {

	/**
	 * @param tiedCandidates at least two candidates with the same lowest number of votes, in registry order
	 * @param roundNum the current round
	 * @return the one candidate to eliminate. Must be one of tiedCandidates.
	 */
	String chooseLoser(List<String> tiedCandidates, int roundNum);

	/** Is the outcome of this strategy left to chance? */
	boolean isRandom();

	String getName();
}
