package org.abif.pairwise;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.Notice;
import org.abif.model.Preference;
import org.abif.model.Voteline;
import org.abif.util.Diagnostics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Pairwise comparison of all candidates (Condorcet) and the Copeland method.
 *
 * For every pair of candidates A and B count the ballots that rank A strictly before B.
 * A candidate that is not ranked on a ballot is considered to be ranked below all others on that ballot.
 */
@Slf4j
@ApplicationScoped
public class PairwiseService {

	@Inject
	Diagnostics diagnostics;

	/**
	 * Full pairwise tally: duel matrix, win/loss/tie records, Copeland scores and winners
	 * @param model ballot model
	 * @return pairwise result
	 */
	public PairwiseResult tally(BallotModel model) {
		long start = diagnostics.start();
		PairwiseResult res = new PairwiseResult();
		PairwiseMatrix matrix = calcDuelMatrix(model);
		res.pairwiseMatrix = matrix;
		res.winlosstie = calcWinLossTie(matrix);
		res.winlosstie.forEach((cand, wlt) -> res.copelandScores.put(cand, wlt.getCopelandScore()));
		res.copelandWinners = copelandWinners(res.winlosstie);
		res.condorcetWinner = res.winlosstie.entrySet().stream()
				.filter(e -> e.getValue().getWins() == matrix.size() - 1)
				.map(Map.Entry::getKey)
				.findFirst().orElse(null);
		res.hasTiesOrCycles = hasTiesOrCycles(matrix, res.winlosstie);
		if (res.hasTiesOrCycles) {
			res.notices.add(Notice.note("Condorcet cycle or Copeland tie",
					"\"Victories\" and \"losses\" sometimes aren't displayed in the expected location when there are ties " +
					"and/or cycles in the results, but the numbers provided should be accurate."));
		}
		log.debug("Copeland winner(s) {}", res.copelandWinners);
		diagnostics.elapsed("pairwise tally", start);
		return res;
	}

	/**
	 * Count for every ordered pair of candidates (a, b) the ballots that rank a strictly better than b.
	 * @param model ballot model
	 * @return the duel matrix
	 */
	public PairwiseMatrix calcDuelMatrix(BallotModel model) {
		List<String> cands = model.allCandidateTokens();
		PairwiseMatrix matrix = new PairwiseMatrix(cands);
		int n = cands.size();
		int[] ranks = new int[n];
		for (Voteline vl : model.getVotelines()) {
			if (vl.isBlank()) continue;
			for (int i = 0; i < n; i++) {
				Preference pref = vl.getPrefs().get(cands.get(i));
				ranks[i] = pref == null ? Integer.MAX_VALUE : pref.getRankOrMax();
			}
			for (int i = 0; i < n; i++) {
				for (int j = 0; j < n; j++) {
					if (i != j && ranks[i] < ranks[j]) matrix.add(i, j, vl.getQty());
				}
			}
		}
		return matrix;
	}

	/**
	 * Compare both directions of every pair. Wins + losses + ties == number of candidates - 1 for everybody.
	 * @return candidate -> record, sorted by number of wins
	 */
	public LinkedHashMap<String, WinLossTie> calcWinLossTie(PairwiseMatrix matrix) {
		List<String> cands = matrix.getCandidates();
		Map<String, WinLossTie> wlt = new LinkedHashMap<>();
		cands.forEach(c -> wlt.put(c, new WinLossTie()));
		for (int i = 0; i < cands.size(); i++) {
			for (int j = i + 1; j < cands.size(); j++) {
				long a2b = matrix.get(i, j);
				long b2a = matrix.get(j, i);
				WinLossTie a = wlt.get(cands.get(i));
				WinLossTie b = wlt.get(cands.get(j));
				if (a2b > b2a) {
					a.wins++;
					b.losses++;
				} else if (a2b < b2a) {
					b.wins++;
					a.losses++;
				} else {
					a.ties++;
					b.ties++;
				}
			}
		}
		LinkedHashMap<String, WinLossTie> sorted = new LinkedHashMap<>();
		wlt.entrySet().stream()
				.sorted(Comparator.comparingInt((Map.Entry<String, WinLossTie> e) -> e.getValue().getWins()).reversed())
				.forEach(e -> sorted.put(e.getKey(), e.getValue()));
		return sorted;
	}

	/** All candidates with the maximum Copeland score */
	public List<String> copelandWinners(Map<String, WinLossTie> wlt) {
		double max = wlt.values().stream().mapToDouble(WinLossTie::getCopelandScore).max().orElse(0);
		return wlt.entrySet().stream()
				.filter(e -> e.getValue().getCopelandScore() == max)
				.map(Map.Entry::getKey)
				.collect(Collectors.toList());
	}

	/**
	 * Is there any pairwise tie, or does a candidate with fewer wins beat a candidate with more wins?
	 */
	boolean hasTiesOrCycles(PairwiseMatrix matrix, LinkedHashMap<String, WinLossTie> sortedWlt) {
		List<String> cands = matrix.getCandidates();
		for (String a : cands) {
			for (String b : cands) {
				if (!a.equals(b) && matrix.get(a, b) == matrix.get(b, a)) return true;
			}
		}
		List<String> sorted = new ArrayList<>(sortedWlt.keySet());
		for (int i = 0; i < sorted.size(); i++) {
			for (int j = 0; j < i; j++) {
				if (matrix.get(sorted.get(i), sorted.get(j)) > matrix.get(sorted.get(j), sorted.get(i))) return true;
			}
		}
		return false;
	}

	/**
	 * Size of every pairwise victory, largest first. Each tied pair is listed once.
	 * @param matrix duel matrix
	 * @param method WINNING_VOTES or MARGINS
	 * @return list of victories and ties
	 */
	public List<PairwiseVictory> calcVictorySizes(PairwiseMatrix matrix, VictoryMethod method) {
		List<String> cands = matrix.getCandidates();
		List<PairwiseVictory> victories = new ArrayList<>();
		for (int i = 0; i < cands.size(); i++) {
			for (int j = 0; j < cands.size(); j++) {
				if (i == j) continue;
				long winnerVotes = matrix.get(i, j);
				long loserVotes = matrix.get(j, i);
				PairwiseVictory v = new PairwiseVictory();
				v.winnerVotes = winnerVotes;
				v.loserVotes = loserVotes;
				v.totalVotes = winnerVotes + loserVotes;
				if (winnerVotes > loserVotes) {
					v.winner = cands.get(i);
					v.loser = cands.get(j);
					v.victorySize = method == VictoryMethod.MARGINS ? winnerVotes - loserVotes : winnerVotes;
					victories.add(v);
				} else if (winnerVotes == loserVotes && i < j) {
					v.tiedCandidates = List.of(cands.get(i), cands.get(j));
					v.victorySize = 0;
					victories.add(v);
				}
			}
		}
		victories.sort(Comparator.comparingLong(PairwiseVictory::getVictorySize).reversed());
		return victories;
	}
}
