package org.abif.irv;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.BallotType;
import org.abif.model.Notice;
import org.abif.model.Preference;
import org.abif.model.Voteline;
import org.abif.pairwise.PairwiseService;
import org.abif.parse.BallotTypeDetector;
import org.abif.util.AbifConfig;
import org.abif.util.Diagnostics;
import org.abif.util.Lson;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Instant runoff voting (IRV).
 *
 * In every round each ballot counts for its top remaining candidate. A candidate with more than half of
 * the counted votes wins. Otherwise the last placed candidate is eliminated and the next round starts.
 *
 * <ul>
 *   <li>Ballots with several candidates tied at their top rank are overvotes. They are not counted from that round on.</li>
 *   <li>When all remaining candidates have the same number of votes, they are all winners.</li>
 *   <li>Several candidates tied for last place are eliminated together, if all their votes combined
 *       are not more than the votes of one candidate on the next higher place.
 *       Otherwise the {@link TieBreakStrategy} eliminates one of them.</li>
 * </ul>
 *
 * Every round eliminates at least one candidate. So there are at most as many rounds as candidates.
 *
 * With extras (abif.irv.include-extras) every round also records where the ballots of each remaining candidate
 * would go if it were eliminated instead ("next choices"), and how the supporters of the eliminated candidates
 * compare the remaining candidates pairwise.
 */
@Slf4j
@ApplicationScoped
public class IrvService {

	@Inject
	AbifConfig config;

	@Inject
	Diagnostics diagnostics;

	@Inject
	PairwiseService pairwiseService;

	/**
	 * Tally with the tie-break policy from the configuration (abif.irv.tie-break)
	 * @param model ballot model
	 * @return IRV result with all rounds
	 */
	public IrvResult tally(BallotModel model) {
		return tally(model, createTieBreak());
	}

	/**
	 * Create a new tie-break strategy as configured. Random tie-breaks are seeded with abif.irv.random-seed if set.
	 */
	public TieBreakStrategy createTieBreak() {
		if (config.irv().tieBreak() == TieBreakPolicy.TOKEN) return new TokenOrderTieBreak();
		return config.irv().randomSeed()
				.map(RandomTieBreak::new)
				.orElseGet(RandomTieBreak::new);
	}

	/**
	 * Run all IRV rounds. Per-round extras are included when abif.irv.include-extras is enabled.
	 * @param model ballot model. It is not modified.
	 * @param tieBreak decides which one of the tied last placed candidates is eliminated
	 * @return IRV result with all rounds
	 */
	public IrvResult tally(BallotModel model, TieBreakStrategy tieBreak) {
		return tally(model, tieBreak, config.irv().includeExtras());
	}

	/**
	 * Run all IRV rounds
	 * @param model ballot model. It is not modified.
	 * @param tieBreak decides which one of the tied last placed candidates is eliminated
	 * @param includeExtras also compute next choices and the pairwise preferences of the eliminated candidates' supporters
	 * @return IRV result with all rounds
	 */
	public IrvResult tally(BallotModel model, TieBreakStrategy tieBreak, boolean includeExtras) {
		long start = diagnostics.start();
		IrvResult result = new IrvResult();
		result.tieBreakPolicy = tieBreak.getName();
		result.totalBallots = model.getBallotcount();

		List<String> cands = model.allCandidateTokens();
		List<Voteline> ballots = model.getVotelines();
		Set<String> allEliminated = new LinkedHashSet<>();
		int roundNum = 1;

		while (true) {
			long roundStart = diagnostics.start();
			IrvRound round = new IrvRound(roundNum, cands);
			round.startingQty = ballots.stream().mapToLong(Voteline::getQty).sum();
			result.rounds.add(round);

			//----- discard overvotes
			List<Voteline> pruned = new ArrayList<>();
			for (Voteline vl : ballots) {
				if (isTopRankOvervote(vl)) {
					round.overvoteQty += vl.getQty();
				} else {
					pruned.add(vl);
				}
			}

			//----- count top choices
			Map<String, Long> counts = new LinkedHashMap<>();
			cands.forEach(c -> counts.put(c, 0L));
			for (Voteline vl : pruned) {
				String top = topChoiceSkippingTies(vl);
				if (top != null && counts.containsKey(top)) {
					counts.merge(top, vl.getQty(), Long::sum);
				} else {
					round.exhaustedQty += vl.getQty();
				}
			}
			round.countedQty = counts.values().stream().mapToLong(Long::longValue).sum();
			round.counts = sortByVotesDesc(counts);

			long minVotes = counts.values().stream().mapToLong(Long::longValue).min().orElse(0);
			long maxVotes = counts.values().stream().mapToLong(Long::longValue).max().orElse(0);
			round.bottomVotesPercand = minVotes;
			round.leadingVotesPercand = maxVotes;
			round.penultimateVotesPercand = minVotes == maxVotes ? maxVotes
					: counts.values().stream().mapToLong(Long::longValue).filter(v -> v > minVotes).min().orElse(maxVotes);

			//----- terminal states
			List<String> winners = null;
			if (round.countedQty == 0) {
				winners = new ArrayList<>();          // no votes, no winner
			} else if (minVotes == maxVotes) {
				winners = new ArrayList<>(cands);     // everybody is tied
			} else if (2 * maxVotes > round.countedQty) {
				winners = candsWithVotes(counts, maxVotes);
			}
			if (winners != null) {
				round.winners = winners;
				round.eliminated = cands.stream().filter(c -> !round.winners.contains(c)).collect(Collectors.toCollection(LinkedHashSet::new));
				allEliminated.addAll(round.eliminated);
				round.allEliminated = new LinkedHashSet<>(allEliminated);
				if (includeExtras) addExtras(model, round, pruned, cands, Set.of());
				diagnostics.elapsed("IRV round " + roundNum, roundStart);
				break;
			}

			//----- elimination
			List<String> bottom = candsWithVotes(counts, minVotes);
			List<String> eliminated;
			if (bottom.size() > 1) {
				round.bottomTie = bottom;
				long bottomTotal = minVotes * bottom.size();
				if (bottomTotal <= round.penultimateVotesPercand) {
					round.batchElim = true;
					eliminated = bottom;
				} else {
					String loser = tieBreak.chooseLoser(bottom, roundNum);
					round.tieBreakElim = true;
					round.randomElim = tieBreak.isRandom();
					result.tieBreakLosers.add(loser);
					log.info("IRV round {}: {} tied for last place. Tie-break '{}' eliminates {}", roundNum, bottom, tieBreak.getName(), loser);
					eliminated = List.of(loser);
				}
			} else {
				eliminated = bottom;
			}
			round.eliminated = new LinkedHashSet<>(eliminated);
			allEliminated.addAll(eliminated);
			round.allEliminated = new LinkedHashSet<>(allEliminated);
			round.transfers = transfers(pruned, round.eliminated);
			if (includeExtras) addExtras(model, round, pruned, cands, round.eliminated);

			ballots = eliminate(pruned, round.eliminated);
			cands = cands.stream().filter(c -> !round.eliminated.contains(c)).collect(Collectors.toList());
			diagnostics.trace("IRV round {}: counts={} eliminated={}", roundNum, round.counts, round.eliminated);
			diagnostics.elapsed("IRV round " + roundNum, roundStart);
			roundNum++;
		}

		summarize(model, result);
		diagnostics.elapsed("IRV tally", start);
		return result;
	}

	/**
	 * Compute the result for every possible outcome of the tie-breaks. Each result follows one distinct
	 * path of tie-break decisions. Without any tie-break there is exactly one result.
	 * @param model ballot model
	 * @return one result per tie-break path, at most abif.irv.max-branches of them
	 */
	public List<IrvResult> tallyAllOutcomes(BallotModel model) {
		int maxBranches = config.irv().maxBranches();
		List<IrvResult> results = new ArrayList<>();
		Deque<List<Integer>> todo = new ArrayDeque<>();
		todo.push(new ArrayList<>());
		while (!todo.isEmpty() && results.size() < maxBranches) {
			List<Integer> script = todo.pop();
			ScriptedTieBreak tieBreak = new ScriptedTieBreak(script);
			IrvResult result = tally(model, tieBreak);
			results.add(result);

			// branch into every alternative of the decisions that were not prescribed by the script
			List<Integer> choices = tieBreak.getChoices();
			for (int d = choices.size() - 1; d >= script.size(); d--) {
				for (int alt = tieBreak.getOptionCounts().get(d) - 1; alt >= 1; alt--) {
					List<Integer> branch = new ArrayList<>(choices.subList(0, d));
					branch.add(alt);
					todo.push(branch);
				}
			}
		}
		if (!todo.isEmpty())
			log.warn("IRV: more than {} possible tie-break outcomes. Only the first {} were computed.", maxBranches, results.size());
		return results;
	}

	/** Does this ballot have more than one candidate at its best rank? */
	static boolean isTopRankOvervote(Voteline vl) {
		int minRank = Integer.MAX_VALUE;
		int count = 0;
		for (Preference pref : vl.getPrefs().values()) {
			int rank = pref.getRankOrMax();
			if (rank < minRank) {
				minRank = rank;
				count = 1;
			} else if (rank == minRank) {
				count++;
			}
		}
		return count > 1;
	}

	/**
	 * The single best ranked candidate of a ballot. Tied tiers are skipped.
	 * @return candidate token or null if the ballot is exhausted
	 */
	static String topChoiceSkippingTies(Voteline vl) {
		Map<Integer, List<String>> tiers = new TreeMap<>();
		for (Map.Entry<String, Preference> entry : vl.getPrefs().entrySet()) {
			tiers.computeIfAbsent(entry.getValue().getRankOrMax(), k -> new ArrayList<>()).add(entry.getKey());
		}
		for (List<String> tier : tiers.values()) {
			if (tier.size() == 1) return tier.get(0);
		}
		return null;
	}

	/** New list of ballots without the given candidates. Untouched votelines are reused. */
	static List<Voteline> eliminate(List<Voteline> ballots, Set<String> eliminated) {
		List<Voteline> result = new ArrayList<>(ballots.size());
		for (Voteline vl : ballots) {
			if (vl.getPrefs().keySet().stream().noneMatch(eliminated::contains)) {
				result.add(vl);
				continue;
			}
			Map<String, Preference> remaining = new LinkedHashMap<>();
			vl.getPrefs().forEach((cand, pref) -> {
				if (!eliminated.contains(cand)) remaining.put(cand, pref);
			});
			result.add(new Voteline(vl.getQty(), remaining));
		}
		return result;
	}

	/**
	 * Where do the votes of the eliminated candidates go in the next round?
	 */
	static Map<String, Map<String, Long>> transfers(List<Voteline> pruned, Set<String> eliminated) {
		Map<String, Map<String, Long>> transfers = new LinkedHashMap<>();
		for (String cand : eliminated) transfers.put(cand, whereVotesGo(pruned, cand, eliminated));
		return transfers;
	}

	/**
	 * Where would the votes of every remaining candidate go, if it were eliminated instead?
	 * Candidates without any top choice are left out.
	 * @param pruned the counted ballots of this round
	 * @param roundCands candidates of this round
	 * @param eliminated candidates that were actually eliminated in this round
	 * @return remaining candidate -> (next candidate or "exhausted") -> votes
	 */
	static Map<String, Map<String, Long>> nextChoices(List<Voteline> pruned, List<String> roundCands, Set<String> eliminated) {
		Map<String, Map<String, Long>> nextChoices = new LinkedHashMap<>();
		for (String cand : roundCands) {
			if (eliminated.contains(cand)) continue;
			Map<String, Long> destinations = whereVotesGo(pruned, cand, Set.of(cand));
			if (!destinations.isEmpty()) nextChoices.put(cand, destinations);
		}
		return nextChoices;
	}

	/**
	 * Next top choice of every ballot that currently counts for one candidate
	 * @param pruned ballots without overvotes
	 * @param from the candidate whose ballots are followed
	 * @param removed candidates that are taken off these ballots, including from
	 * @return next candidate (or "exhausted") -> votes
	 */
	static Map<String, Long> whereVotesGo(List<Voteline> pruned, String from, Set<String> removed) {
		Map<String, Long> destinations = new LinkedHashMap<>();
		for (Voteline vl : pruned) {
			if (!from.equals(topChoiceSkippingTies(vl))) continue;
			Voteline next = eliminate(List.of(vl), removed).get(0);
			String to = isTopRankOvervote(next) ? null : topChoiceSkippingTies(next);
			destinations.merge(to == null ? IrvRound.EXHAUSTED : to, vl.getQty(), Long::sum);
		}
		return destinations;
	}

	/**
	 * Next choices of every remaining candidate, and the duel matrix of the candidates that stay in the race,
	 * counted only on the ballots of the eliminated candidates' supporters.
	 */
	void addExtras(BallotModel model, IrvRound round, List<Voteline> pruned, List<String> roundCands, Set<String> eliminated) {
		round.nextChoices = nextChoices(pruned, roundCands, eliminated);
		if (eliminated.isEmpty()) return;
		BallotModel supporters = new BallotModel();
		roundCands.stream()
				.filter(c -> !eliminated.contains(c))
				.forEach(c -> supporters.getCandidates().put(c, model.getCandidateName(c)));
		List<Voteline> elimBallots = pruned.stream()
				.filter(vl -> eliminated.contains(topChoiceSkippingTies(vl)))
				.collect(Collectors.toList());
		supporters.getVotelines().addAll(eliminate(elimBallots, eliminated));
		round.elimcandSupporterPairwiseResults = pairwiseService.calcDuelMatrix(supporters);
	}

	static List<String> candsWithVotes(Map<String, Long> counts, long votes) {
		return counts.entrySet().stream()
				.filter(e -> e.getValue() == votes)
				.map(Map.Entry::getKey)
				.collect(Collectors.toList());
	}

	static LinkedHashMap<String, Long> sortByVotesDesc(Map<String, Long> counts) {
		LinkedHashMap<String, Long> sorted = new LinkedHashMap<>();
		counts.entrySet().stream()
				.sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
				.forEach(e -> sorted.put(e.getKey(), e.getValue()));
		return sorted;
	}

	/** Fill the summary fields from the final round */
	void summarize(BallotModel model, IrvResult result) {
		IrvRound last = result.getFinalRound();
		result.winners = last.winners;
		result.winners.forEach(w -> result.winnerNames.put(w, model.getCandidateName(w)));
		result.numRounds = result.rounds.size();
		result.finalRoundCounted = last.countedQty;
		result.finalRoundExhausted = last.exhaustedQty;
		result.majorityThreshold = result.totalBallots / 2 + 1;
		result.hasTie = result.winners.size() > 1 || !result.tieBreakLosers.isEmpty();

		List<Map.Entry<String, Long>> finalCounts = new ArrayList<>(last.counts.entrySet());
		if (!result.winners.isEmpty()) {
			result.winnerVotes = last.counts.getOrDefault(result.winners.get(0), 0L);
			result.winnerPct = percent(result.winnerVotes, last.countedQty);
		}
		finalCounts.stream()
				.filter(e -> !result.winners.contains(e.getKey()))
				.findFirst()
				.ifPresent(e -> {
					result.runnerUp = e.getKey();
					result.runnerUpVotes = e.getValue();
					result.runnerUpPct = percent(e.getValue(), last.countedQty);
				});

		BallotType type = BallotTypeDetector.detect(model);
		if (type != BallotType.RANKED && type != BallotType.UNKNOWN) {
			result.notices.add(Notice.note("IRV run on ballot_type=" + type));
		}
		if (!result.tieBreakLosers.isEmpty()) {
			Notice notice = Notice.note("Tie for last place was broken with the '" + result.tieBreakPolicy + "' tie-break",
					"Candidates tied for last place could not all be eliminated at once. " +
					"The tie-break eliminated " + String.join(", ", result.tieBreakLosers) + ". A different tie-break may lead to a different winner.");
			notice.setParameters(Lson.builder().put("tie_break", result.tieBreakPolicy).put("eliminated", result.tieBreakLosers));
			result.notices.add(notice);
		}
		log.info("IRV winner(s) {} after {} rounds", result.winners, result.numRounds);
	}

	private static double percent(long part, long total) {
		return total > 0 ? 100.0 * part / total : 0.0;
	}
}
