package org.abif.star;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.Notice;
import org.abif.model.Preference;
import org.abif.model.Voteline;
import org.abif.util.AbifException;
import org.abif.util.Diagnostics;
import org.abif.util.Lson;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Score voting and STAR voting (Score Then Automatic Runoff).
 * Both need rated ballots. Ranked ballots can be tallied after their ratings were synthesized while parsing.
 */
@Slf4j
@ApplicationScoped
public class ScoreStarService {

	@Inject
	Diagnostics diagnostics;

	/**
	 * Sum up the ratings of every candidate. Candidates are ranked by descending score, equal scores share a rank.
	 * @param model ballot model with ratings
	 * @return scores of all candidates
	 * @throws AbifException UNSUPPORTED_BALLOT_TYPE when the ballots do not have any ratings
	 */
	public ScoreResult scoreResult(BallotModel model) throws AbifException {
		checkHasRatings(model);
		ScoreResult res = new ScoreResult();
		Map<String, CandidateScore> scores = new LinkedHashMap<>();
		for (String cand : model.allCandidateTokens()) {
			scores.put(cand, new CandidateScore(model.getCandidateName(cand)));
		}
		for (Voteline vl : model.getVotelines()) {
			for (Map.Entry<String, Preference> entry : vl.getPrefs().entrySet()) {
				Preference pref = entry.getValue();
				if (!pref.hasRating()) continue;
				CandidateScore cs = scores.get(entry.getKey());
				cs.score += (long) pref.getRating() * vl.getQty();
				if (pref.getRating() > 0) cs.votercount += vl.getQty();
			}
		}

		List<String> ranklist = new ArrayList<>(scores.keySet());
		ranklist.sort(Comparator.comparingLong((String cand) -> scores.get(cand).score).reversed());
		int rank = 0;
		Long prevScore = null;
		for (String cand : ranklist) {
			CandidateScore cs = scores.get(cand);
			if (prevScore == null || cs.score < prevScore) {
				rank++;
				prevScore = cs.score;
			}
			cs.rank = rank;
			res.scores.put(cand, cs);
		}
		res.ranklist = ranklist;
		res.totalAllScores = scores.values().stream().mapToLong(CandidateScore::getScore).sum();
		res.totalvoters = model.getBallotcount();
		if (!ranklist.isEmpty() && res.scores.get(ranklist.get(0)).score > 0) {
			long top = res.scores.get(ranklist.get(0)).score;
			ranklist.stream().filter(c -> res.scores.get(c).score == top).forEach(res.winners::add);
		}
		addRatingNotice(model, res.notices);
		return res;
	}

	/**
	 * STAR: the two candidates with the highest scores are the finalists. Each ballot supports the finalist
	 * it ranks better, or if both have the same rank the one it rates higher. Ballots that do not prefer
	 * one of the finalists abstain. The finalist with more support wins. Equal support is a tie.
	 * @param model ballot model with ratings
	 * @return STAR result
	 * @throws AbifException UNSUPPORTED_BALLOT_TYPE when the ballots do not have any ratings
	 */
	public StarResult starResult(BallotModel model) throws AbifException {
		long start = diagnostics.start();
		StarResult res = new StarResult();
		ScoreResult scoreResult = scoreResult(model);
		res.scoreResult = scoreResult;
		res.notices.addAll(scoreResult.notices);
		long ballotcount = scoreResult.totalvoters;
		List<String> ranklist = scoreResult.ranklist;

		if (ranklist.isEmpty()) {
			res.finalAbstentions = ballotcount;
		} else if (ranklist.size() == 1) {
			res.fin1 = ranklist.get(0);
			res.fin1n = model.getCandidateName(res.fin1);
			res.finalists.add(res.fin1);
			for (Voteline vl : model.getVotelines()) {
				Preference pref = vl.getPrefs().get(res.fin1);
				if (pref != null && pref.hasRating() && pref.getRating() > 0) res.fin1votes += vl.getQty();
			}
			res.finalAbstentions = ballotcount - res.fin1votes;
			res.winners.add(res.fin1);
		} else {
			res.fin1 = ranklist.get(0);
			res.fin2 = ranklist.get(1);
			res.fin1n = model.getCandidateName(res.fin1);
			res.fin2n = model.getCandidateName(res.fin2);
			res.finalists.add(res.fin1);
			res.finalists.add(res.fin2);
			for (Voteline vl : model.getVotelines()) {
				int pref = compareFinalists(vl.getPrefs().get(res.fin1), vl.getPrefs().get(res.fin2));
				if (pref > 0) res.fin1votes += vl.getQty();
				if (pref < 0) res.fin2votes += vl.getQty();
			}
			res.finalAbstentions = ballotcount - res.fin1votes - res.fin2votes;
			if (res.fin1votes > res.fin2votes) {
				res.winners.add(res.fin1);
			} else if (res.fin2votes > res.fin1votes) {
				res.winners.add(res.fin2);
			} else {
				res.winners.add(res.fin1);
				res.winners.add(res.fin2);
				res.tie = true;
				log.info("STAR runoff is a tie between {} and {}", res.fin1, res.fin2);
			}
		}
		diagnostics.elapsed("STAR tally", start);
		return res;
	}

	/**
	 * Which finalist does one ballot prefer?
	 * @return positive for the first, negative for the second, 0 for no preference
	 */
	static int compareFinalists(Preference a, Preference b) {
		int rankA = a == null ? Integer.MAX_VALUE : a.getRankOrMax();
		int rankB = b == null ? Integer.MAX_VALUE : b.getRankOrMax();
		if (rankA != rankB) return rankA < rankB ? 1 : -1;
		if (a != null && b != null && a.hasRating() && b.hasRating()) {
			return Integer.compare(a.getRating(), b.getRating());
		}
		return 0;
	}

	/**
	 * Scores scaled so that all scores add up to targetScale, e.g. for charts.
	 * @param model ballot model with ratings
	 * @param targetScale sum of all scaled scores, e.g. 100
	 * @return Lson with scale_factor, total_all_scores, scaled_total and per candidate "canddict.&lt;token&gt;"
	 * @throws AbifException UNSUPPORTED_BALLOT_TYPE when the ballots do not have any ratings
	 */
	public Lson scaledScores(BallotModel model, double targetScale) throws AbifException {
		ScoreResult scores = scoreResult(model);
		double scale = scores.totalAllScores > 0 ? targetScale / scores.totalAllScores : 0;
		Lson res = Lson.builder()
				.putIfNotNull("max_rating", model.getMetadata().get("max_rating"))
				.put("total_all_scores", scores.totalAllScores)
				.put("scale_factor", scale);
		double scaledTotal = 0;
		Lson canddict = new Lson();
		for (Map.Entry<String, CandidateScore> entry : scores.scores.entrySet()) {
			double scaled = entry.getValue().score * scale;
			scaledTotal += scaled;
			canddict.put(entry.getKey(), Lson.builder()
					.put("candname", entry.getValue().candname)
					.put("scaled_score", scaled)
					.put("score", entry.getValue().score));
		}
		return res.put("scaled_total", scaledTotal).put("canddict", canddict);
	}

	void checkHasRatings(BallotModel model) throws AbifException {
		boolean anyBallot = model.getVotelines().stream().anyMatch(vl -> !vl.isBlank());
		boolean anyRating = model.getVotelines().stream().anyMatch(Voteline::hasAnyRating);
		if (anyBallot && !anyRating)
			throw AbifException.supplyAndLog(AbifException.Errors.UNSUPPORTED_BALLOT_TYPE,
					"Score and STAR need rated ballots. Parse ranked ballots with ratings added.").get();
	}

	void addRatingNotice(BallotModel model, List<Notice> notices) {
		if (!model.isRankingToRating()) return;
		notices.add(Notice.note("Ratings were derived from rankings",
				"These ballots only contain rankings. Every candidate got (number of candidates - rank) stars, " +
				"so the results show how Score or STAR might have turned out with similar rated ballots."));
	}
}
