package org.abif.irv;

import java.util.List;
import java.util.Random;

/**
 * Eliminate one of the tied candidates at random. With a seed, the choice can be reproduced.
 */
public class RandomTieBreak implements TieBreakStrategy {

	private final Random random;

	public RandomTieBreak() {
		this.random = new Random();
	}

	public RandomTieBreak(long seed) {
		this.random = new Random(seed);
	}

	@Override
	public String chooseLoser(List<String> tiedCandidates, int roundNum) {
		return tiedCandidates.get(random.nextInt(tiedCandidates.size()));
	}

	@Override
	public boolean isRandom() {
		return true;
	}

	@Override
	public String getName() {
		return "random";
	}
}
