package org.abif.irv;

import java.util.Comparator;
import java.util.List;

/**
 * Deterministic tie-break: the tied candidate whose token comes first in natural String order is eliminated.
 */
public class TokenOrderTieBreak implements TieBreakStrategy {

	@Override
	public String chooseLoser(List<String> tiedCandidates, int roundNum) {
		return tiedCandidates.stream().min(Comparator.naturalOrder())
				.orElseThrow(() -> new IllegalArgumentException("No tied candidates in round " + roundNum));
	}

	@Override
	public boolean isRandom() {
		return false;
	}

	@Override
	public String getName() {
		return "token";
	}
}
