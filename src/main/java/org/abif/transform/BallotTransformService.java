package org.abif.transform;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.fptp.FptpResult;
import org.abif.fptp.FptpService;
import org.abif.model.BallotModel;
import org.abif.model.BallotType;
import org.abif.model.ConversionMeta;
import org.abif.model.Preference;
import org.abif.model.Voteline;
import org.abif.parse.AbifWriter;
import org.abif.parse.BallotTypeDetector;
import org.abif.util.AbifConfig;
import org.abif.util.AbifException;
import org.abif.util.Lson;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conversions between ballot types, e.g. ranked ballots to approval ballots.
 *
 * Every conversion returns a new {@link BallotModel} and never modifies its input. The new model carries
 * a {@link ConversionMeta}, so that tallies can tell their users how the ballots were converted.
 * Ballots that cannot be converted stay in the new model as blank ballots, so that the number of ballots does not change.
 */
@Slf4j
@ApplicationScoped
public class BallotTransformService {

	@Inject
	AbifConfig config;

	@Inject
	FptpService fptpService;

	/**
	 * Ranked (or rated) ballots to approval ballots with the "favorite viable half" heuristic.
	 *
	 * <ol>
	 *   <li>Count the first choices (FPTP) to find the frontrunner.</li>
	 *   <li>Find the smallest number of seats (starting at two) for which the frontrunner would exceed
	 *       the Hare quota: frontrunner &gt; floor(valid votes / seats). That many candidates are viable.
	 *       If there is no such number, up to abif.approval.max-viable-fallback candidates are viable.</li>
	 *   <li>Every voter approves up to half (rounded up) of the viable candidates, in the order of the ballot,
	 *       and every candidate ranked at or above the last of them.</li>
	 * </ol>
	 * Ballots with several candidates tied at the top rank are overvotes and do not approve anybody.
	 *
	 * @param model ranked or rated ballots
	 * @return a new model with approval ballots
	 */
	public BallotModel favoriteViableHalf(BallotModel model) {
		BallotType originalType = BallotTypeDetector.detect(model);
		FptpResult fptp = fptpService.tally(model, false);
		List<Map.Entry<String, Long>> byFirstChoices = new ArrayList<>(fptp.getToppicks().entrySet());
		byFirstChoices.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));

		List<String> viable = new ArrayList<>();
		if (!byFirstChoices.isEmpty()) {
			int numViable = numberOfViableCandidates(byFirstChoices.get(0).getValue(), fptp.getTotalVotesRecounted(),
					byFirstChoices.size(), config.approval().maxViableFallback());
			for (int i = 0; i < Math.min(numViable, byFirstChoices.size()); i++) {
				viable.add(byFirstChoices.get(i).getKey());
			}
		}
		int viableMax = viableCandidateMaximum(viable.size());

		BallotModel approval = newConvertedModel(model, BallotType.CHOOSE_MANY);
		for (Voteline vl : model.getVotelines()) {
			List<String> ranked = vl.getPrefs().entrySet().stream()
					.filter(e -> e.getValue().hasRank())
					.sorted(Comparator.comparingInt(e -> e.getValue().getRank()))
					.map(Map.Entry::getKey)
					.collect(Collectors.toList());
			List<String> approved = new ArrayList<>();
			if (!ranked.isEmpty() && !isTopTied(vl, ranked)) {
				String cutoff = null;
				int viableSeen = 0;
				for (String cand : ranked) {
					if (viable.contains(cand)) {
						cutoff = cand;
						if (++viableSeen == viableMax) break;
					}
				}
				if (cutoff != null) {
					int cutoffRank = vl.getPrefs().get(cutoff).getRank();
					for (String cand : ranked) {
						if (vl.getPrefs().get(cand).getRank() <= cutoffRank) approved.add(cand);
					}
				}
			}
			approval.getVotelines().add(approvalVoteline(vl.getQty(), approved));
		}

		ConversionMeta meta = new ConversionMeta(ConversionMeta.FAVORITE_VIABLE_HALF, originalType);
		meta.setViableCandidates(viable);
		meta.setViableCandidateMaximum(viableMax);
		meta.setTotalBallots(model.sumOfQty());
		meta.setCandidateNames(new LinkedHashMap<>(model.getCandidates()));
		approval.setConversionMeta(meta);
		log.debug("favorite_viable_half: viable={} viable_max={}", viable, viableMax);
		return approval;
	}

	/**
	 * The smallest number of seats, starting at 2, for which the frontrunner exceeds the Hare quota.
	 * @param frontrunnerVotes first choices of the frontrunner
	 * @param totalValidVotes all valid first choices
	 * @param numCandidates number of candidates
	 * @param fallback number of viable candidates (at most numCandidates) when there is no such number of seats
	 * @return number of viable candidates
	 */
	static int numberOfViableCandidates(long frontrunnerVotes, long totalValidVotes, int numCandidates, int fallback) {
		for (int seats = 2; seats <= numCandidates + 1; seats++) {
			if (frontrunnerVotes > totalValidVotes / seats) return seats;
		}
		return Math.min(numCandidates, fallback);
	}

	/** Half of the viable candidates, rounded up */
	public static int viableCandidateMaximum(int numViable) {
		return (numViable + 1) / 2;
	}

	/**
	 * Every ranked candidate is approved
	 * @param model ranked ballots
	 * @return a new model with approval ballots
	 */
	public BallotModel allRankedApproved(BallotModel model) {
		BallotType originalType = BallotTypeDetector.detect(model);
		if (originalType == BallotType.CHOOSE_MANY) return model.deepCopy();
		BallotModel approval = newConvertedModel(model, BallotType.CHOOSE_MANY);
		for (Voteline vl : model.getVotelines()) {
			List<String> approved = vl.getPrefs().entrySet().stream()
					.filter(e -> e.getValue().hasRank())
					.map(Map.Entry::getKey)
					.collect(Collectors.toList());
			approval.getVotelines().add(approvalVoteline(vl.getQty(), approved));
		}
		ConversionMeta meta = new ConversionMeta(ConversionMeta.ALL_RANKED_APPROVED, originalType);
		meta.setTotalBallots(model.sumOfQty());
		meta.setCandidateNames(new LinkedHashMap<>(model.getCandidates()));
		approval.setConversionMeta(meta);
		return approval;
	}

	/**
	 * Approval ballots to ranked ballots. All candidates are ordered by ascending number of approvals
	 * (ties by token) and each ballot ranks its approved candidates in that order.
	 * Ranked ballots are first converted with {@link #favoriteViableHalf(BallotModel)} to count the approvals.
	 * @param model approval, choose-one or ranked ballots
	 * @return a new model with ranked ballots
	 * @throws AbifException UNSUPPORTED_BALLOT_TYPE for rated ballots
	 */
	public BallotModel leastApprovalFirst(BallotModel model) throws AbifException {
		BallotType originalType = BallotTypeDetector.detect(model);
		List<String> order = leastApprovalFirstOrder(model);

		BallotModel ranked = newConvertedModel(model, BallotType.RANKED);
		for (Voteline vl : model.getVotelines()) {
			List<String> ordered = order.stream().filter(cand -> isApproved(vl.getPrefs().get(cand))).collect(Collectors.toList());
			LinkedHashMap<String, Preference> prefs = new LinkedHashMap<>();
			for (int i = 0; i < ordered.size(); i++) {
				prefs.put(ordered.get(i), Preference.ranked(i + 1, i < ordered.size() - 1 ? ">" : null));
			}
			Voteline rankedVl = new Voteline(vl.getQty(), prefs);
			if (!ordered.isEmpty()) rankedVl.setPrefstr(AbifWriter.toPrefstr(rankedVl));
			ranked.getVotelines().add(rankedVl);
		}
		ConversionMeta meta = new ConversionMeta(ConversionMeta.LEAST_APPROVAL_FIRST, originalType);
		meta.setTotalBallots(model.sumOfQty());
		meta.setParameters(Lson.builder()
				.put("basis", "ascending_total_approvals")
				.put("tie_breaker", "token"));
		ranked.setConversionMeta(meta);
		return ranked;
	}

	/**
	 * Global order of all candidates by ascending number of approvals, ties broken by token
	 * @throws AbifException UNSUPPORTED_BALLOT_TYPE for rated ballots
	 */
	public List<String> leastApprovalFirstOrder(BallotModel model) throws AbifException {
		BallotType type = BallotTypeDetector.detect(model);
		BallotModel approvals;
		if (type == BallotType.RANKED) {
			approvals = favoriteViableHalf(model);
		} else if (type == BallotType.CHOOSE_MANY || type == BallotType.CHOOSE_ONE) {
			approvals = model;
		} else {
			throw new AbifException(AbifException.Errors.UNSUPPORTED_BALLOT_TYPE, "Cannot order candidates by approvals for ballot_type=" + type);
		}
		Map<String, Long> counts = countApprovals(approvals);
		return counts.entrySet().stream()
				.sorted(Comparator.comparing((Map.Entry<String, Long> e) -> e.getValue()).thenComparing(Map.Entry::getKey))
				.map(Map.Entry::getKey)
				.collect(Collectors.toList());
	}

	/**
	 * Number of approvals per candidate. A candidate is approved with a rating of 1,
	 * or without any rating, when it is ranked first.
	 */
	public static LinkedHashMap<String, Long> countApprovals(BallotModel model) {
		LinkedHashMap<String, Long> counts = new LinkedHashMap<>();
		model.allCandidateTokens().forEach(c -> counts.put(c, 0L));
		for (Voteline vl : model.getVotelines()) {
			for (Map.Entry<String, Preference> entry : vl.getPrefs().entrySet()) {
				if (isApproved(entry.getValue())) counts.merge(entry.getKey(), vl.getQty(), Long::sum);
			}
		}
		return counts;
	}

	public static boolean isApproved(Preference pref) {
		if (pref == null) return false;
		if (pref.hasRating()) return pref.getRating() == 1;
		return pref.hasRank() && pref.getRank() == 1;
	}

	private static boolean isTopTied(Voteline vl, List<String> rankedCands) {
		int topRank = vl.getPrefs().get(rankedCands.get(0)).getRank();
		return rankedCands.stream().filter(c -> vl.getPrefs().get(c).getRank() == topRank).count() > 1;
	}

	/** Copy of the model without votelines. The metadata declares the new ballot type. */
	private static BallotModel newConvertedModel(BallotModel model, BallotType newType) {
		BallotModel converted = model.deepCopy();
		converted.getVotelines().clear();
		converted.getMetadata().put(BallotModel.BALLOT_TYPE, newType.getLabel());
		converted.getMetadata().remove(BallotModel.IS_RANKING_TO_RATING);
		return converted;
	}

	private static Voteline approvalVoteline(long qty, List<String> approved) {
		LinkedHashMap<String, Preference> prefs = new LinkedHashMap<>();
		for (int i = 0; i < approved.size(); i++) {
			prefs.put(approved.get(i), Preference.rankedAndRated(1, 1, i < approved.size() - 1 ? "=" : null));
		}
		Voteline vl = new Voteline(qty, prefs);
		if (!approved.isEmpty()) vl.setPrefstr(AbifWriter.toPrefstr(vl));
		return vl;
	}
}
