package org.abif.approval;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.BallotType;
import org.abif.model.ConversionMeta;
import org.abif.model.Notice;
import org.abif.parse.BallotTypeDetector;
import org.abif.transform.BallotTransformService;
import org.abif.util.Diagnostics;
import org.abif.util.Lson;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Approval voting: every voter may approve any number of candidates. The candidate with the most approvals wins.
 *
 * Ranked and rated ballots are first converted to approval ballots with the "favorite viable half" heuristic,
 * see {@link BallotTransformService#favoriteViableHalf(BallotModel)}. The result then contains a notice that
 * explains the conversion.
 */
@Slf4j
@ApplicationScoped
public class ApprovalService {

	@Inject
	BallotTransformService transformService;

	@Inject
	Diagnostics diagnostics;

	/**
	 * Tally approval votes
	 * @param model ballot model of any ballot type
	 * @return approval counts and winners
	 */
	public ApprovalResult tally(BallotModel model) {
		long start = diagnostics.start();
		BallotType type = BallotTypeDetector.detect(model);
		ApprovalResult res;
		switch (type) {
			case RANKED:
			case RATED:
				res = count(transformService.favoriteViableHalf(model));
				break;
			case CHOOSE_ONE:
				res = count(model);
				res.notices.add(Notice.note("Approvals inferred from choose_one ballots",
						"Approval results are derived by treating each voter's single top choice as their only approval. " +
						"Lower preferences are not available on choose_one ballots."));
				break;
			default:
				res = count(model);
		}
		log.debug("Approval winner(s) {} with {} approvals", res.winners, res.topQty);
		diagnostics.elapsed("approval tally", start);
		return res;
	}

	/**
	 * Count the approvals of pure approval ballots
	 * @param model approval ballots, possibly converted
	 * @return approval result with notices for the conversion, if there was one
	 */
	ApprovalResult count(BallotModel model) {
		ApprovalResult res = new ApprovalResult();
		LinkedHashMap<String, Long> counts = BallotTransformService.countApprovals(model);
		res.approvalCounts = counts;
		res.totalVotes = model.getBallotcount();
		res.totalApprovals = counts.values().stream().mapToLong(Long::longValue).sum();
		res.topQty = counts.values().stream().mapToLong(Long::longValue).max().orElse(0);
		if (res.topQty > 0) {
			res.winners = counts.entrySet().stream()
					.filter(e -> e.getValue() == res.topQty)
					.map(e -> e.getKey())
					.collect(Collectors.toList());
		}
		res.topPct = res.totalVotes > 0 ? 100.0 * res.topQty / res.totalVotes : 0;

		ConversionMeta meta = model.getConversionMeta();
		if (meta != null) {
			res.ballotType = meta.getOriginalBallotType();
			res.conversion = meta;
			res.notices.addAll(conversionNotices(meta));
		} else {
			res.ballotType = BallotTypeDetector.detect(model);
		}
		return res;
	}

	/**
	 * Explain to the reader how approvals were estimated from other ballots
	 * @param meta conversion meta data of the approval ballots
	 * @return one notice per known conversion method
	 */
	List<Notice> conversionNotices(ConversionMeta meta) {
		String originalType = meta.getOriginalBallotType() == null ? "unknown" : meta.getOriginalBallotType().getLabel();
		String totalBallots = String.format("%,d", meta.getTotalBallots());
		if (ConversionMeta.FAVORITE_VIABLE_HALF.equals(meta.getMethod())) {
			List<String> viableNames = meta.getViableCandidates().stream()
					.map(c -> meta.getCandidateNames().getOrDefault(c, c))
					.collect(Collectors.toList());
			int viableCount = viableNames.size();
			int viableMax = meta.getViableCandidateMaximum();
			String halfNote = viableCount % 2 == 0
					? "(half of " + viableCount + "). "
					: "(half of " + viableCount + ", rounded up). ";
			Notice notice = Notice.note(
					"Approval counts estimated from " + totalBallots + " " + originalType + " ballots using favorite_viable_half method",
					"The 'favorite_viable_half' conversion algorithm: find the candidate with the most first preferences, " +
					"and then determine the minimum number of figurative seats that would need to be open in order for the " +
					"candidate to exceed the Hare quota with the given first-prefs. " +
					"We use this to estimate how many candidates are likely to be viable candidates.\n\n" +
					"Using first-choice vote totals as a rough guide, approximately " + viableCount + " candidates appear viable: " +
					joinWithAnd(viableNames) + ". " +
					"The approximation then assumes each voter approves up to " + viableMax + " of their top-ranked viable candidates " +
					halfNote +
					"All candidates ranked at or above the lowest-ranked of each ballot's top viable candidates receive approval " +
					"(considering up to " + viableMax + " viable candidates per ballot).");
			notice.setMethod(meta.getMethod());
			notice.setParameters(Lson.builder()
					.put("viable_candidates", meta.getViableCandidates())
					.put("viable_candidate_maximum", viableMax)
					.put("total_ballots", meta.getTotalBallots()));
			return List.of(notice);
		}
		if (ConversionMeta.ALL_RANKED_APPROVED.equals(meta.getMethod())) {
			Notice notice = Notice.note(
					"Approval counts derived from " + totalBallots + " " + originalType + " ballots by treating all ranked candidates as approved",
					"Each ballot approves every candidate that appears with any rank on the ballot; candidates not ranked are not approved. " +
					"This avoids modeling strategic behavior, but may over-approve compared to real approval voting preferences.");
			notice.setMethod(meta.getMethod());
			return List.of(notice);
		}
		return List.of();
	}

	/** "A", "A and B", "A, B, and C" */
	static String joinWithAnd(List<String> names) {
		if (names.isEmpty()) return "";
		if (names.size() == 1) return names.get(0);
		if (names.size() == 2) return names.get(0) + " and " + names.get(1);
		return String.join(", ", names.subList(0, names.size() - 1)) + ", and " + names.get(names.size() - 1);
	}
}
