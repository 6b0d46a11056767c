package org.abif.irv;

import java.util.ArrayList;
import java.util.List;

/**
 * Follows a given path of tie-break choices. This is used to walk through all possible
 * outcomes of an election with ties for last place.
 *
 * The n-th tie-break picks the tied candidate at index script[n]. When the script is exhausted,
 * the first tied candidate is chosen. Every decision is recorded, so that the caller can
 * branch into the alternatives that were not taken.
 */
public class ScriptedTieBreak implements TieBreakStrategy {

	private final List<Integer> script;

	/** index chosen in each decision */
	private final List<Integer> choices = new ArrayList<>();

	/** number of tied candidates in each decision */
	private final List<Integer> optionCounts = new ArrayList<>();

	private final List<String> losers = new ArrayList<>();

	public ScriptedTieBreak(List<Integer> script) {
		this.script = new ArrayList<>(script);
	}

	@Override
	public String chooseLoser(List<String> tiedCandidates, int roundNum) {
		int decision = choices.size();
		int index = decision < script.size() ? script.get(decision) : 0;
		if (index >= tiedCandidates.size())
			throw new IllegalStateException("Tie-break path " + script + " does not fit the ties in round " + roundNum);
		choices.add(index);
		optionCounts.add(tiedCandidates.size());
		String loser = tiedCandidates.get(index);
		losers.add(loser);
		return loser;
	}

	public List<Integer> getScript() {
		return script;
	}

	public List<Integer> getChoices() {
		return choices;
	}

	public List<Integer> getOptionCounts() {
		return optionCounts;
	}

	public List<String> getLosers() {
		return losers;
	}

	@Override
	public boolean isRandom() {
		return false;
	}

	@Override
	public String getName() {
		return "exhaustive";
	}
}
