package org.abif.fptp;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.BallotType;
import org.abif.model.Notice;
import org.abif.model.Preference;
import org.abif.model.Voteline;
import org.abif.parse.BallotTypeDetector;
import org.abif.util.AbifConfig;
import org.abif.util.Diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plurality voting, also known as "first past the post" (FPTP).
 * Every ballot counts for its single top choice. The candidate(s) with the most top choices win.
 */
@Slf4j
@ApplicationScoped
public class FptpService {

	@Inject
	AbifConfig config;

	@Inject
	Diagnostics diagnostics;

	/**
	 * Tally with abif.fptp.count-invalid from the configuration
	 * @param model ballot model
	 * @return the plurality result
	 */
	public FptpResult tally(BallotModel model) {
		return tally(model, config.fptp().countInvalid());
	}

	/**
	 * Count the top choice of every ballot.
	 *
	 * The top choice is the candidate with the lowest rank on a ballot. When several candidates share
	 * the lowest rank, the ballot is an overvote and counts for nobody. Ties are not resolved here.
	 * If there are no valid votes at all, then there is no winner.
	 *
	 * @param model ballot model
	 * @param countInvalid report overvoted and blank ballots in the "none" bucket
	 * @return the plurality result
	 */
	public FptpResult tally(BallotModel model, boolean countInvalid) {
		long start = diagnostics.start();
		FptpResult res = new FptpResult();
		for (String cand : model.getCandidates().keySet()) {
			res.toppicks.put(cand, 0L);
		}

		for (Voteline vl : model.getVotelines()) {
			if (vl.isBlank()) {
				res.blankBallots += vl.getQty();
				continue;
			}
			Optional<String> top = topChoice(vl);
			if (top.isPresent()) {
				res.toppicks.merge(top.get(), vl.getQty(), Long::sum);
			} else {
				res.overvoteBallots += vl.getQty();
			}
		}

		res.totalVotesRecounted = res.toppicks.values().stream().mapToLong(Long::longValue).sum();
		res.totalVotes = model.getBallotcount();
		res.topQty = res.toppicks.values().stream().mapToLong(Long::longValue).max().orElse(0);
		if (res.topQty > 0) {
			for (Map.Entry<String, Long> entry : res.toppicks.entrySet()) {
				if (entry.getValue() == res.topQty) res.winners.add(entry.getKey());
			}
		}
		res.topPct = res.totalVotes > 0 ? 100.0 * res.topQty / res.totalVotes : 0.0;
		if (countInvalid) res.noneQty = res.totalVotes - res.totalVotesRecounted;

		res.ballotType = BallotTypeDetector.detect(model);
		res.notices.addAll(noticesFor(res));

		if (res.isTie()) log.info("FPTP tie between {}", res.winners);
		diagnostics.elapsed("FPTP tally", start);
		return res;
	}

	/**
	 * The single candidate with the lowest rank on this ballot
	 * @param vl a voteline
	 * @return the top choice or Optional.empty() if the ballot is blank or has several top choices
	 */
	public static Optional<String> topChoice(Voteline vl) {
		String top = null;
		int topRank = Integer.MAX_VALUE;
		boolean tied = false;
		for (Map.Entry<String, Preference> entry : vl.getPrefs().entrySet()) {
			int rank = entry.getValue().getRankOrMax();
			if (rank < topRank) {
				top = entry.getKey();
				topRank = rank;
				tied = false;
			} else if (rank == topRank) {
				tied = true;
			}
		}
		return tied ? Optional.empty() : Optional.ofNullable(top);
	}

	List<Notice> noticesFor(FptpResult res) {
		List<Notice> notices = new ArrayList<>();
		BallotType type = res.ballotType;
		if (type == BallotType.RANKED) {
			notices.add(Notice.note("Only using first-choices on ranked ballots"));
		} else if (type == BallotType.CHOOSE_MANY) {
			if (res.overvoteBallots > 0 || res.blankBallots > 0) {
				String longText = "This election used approval/choose-many ballots. " +
						"For FPTP, each ballot must select exactly one first-choice candidate. " +
						"Ballots with multiple top choices are treated as overvotes and do not count for any candidate; " +
						"they are reported under Overvotes and included in the 'None' total.";
				if (res.blankBallots > 0) longText += " Blank ballots (with no top choice) are also included in 'None'.";
				notices.add(Notice.note("Overvotes from approval/choose-many ballots not counted in FPTP", longText));
			}
		} else if (type != BallotType.CHOOSE_ONE) {
			notices.add(Notice.note("FPTP run on ballot_type=" + type));
		}
		return notices;
	}
}
