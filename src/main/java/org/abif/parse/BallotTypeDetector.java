package org.abif.parse;

import org.abif.model.BallotModel;
import org.abif.model.BallotType;
import org.abif.model.Preference;
import org.abif.model.Voteline;

import java.util.Optional;

/**
 * Find out which kind of ballots a model contains.
 *
 * An explicit "ballot_type" in the metadata always wins. Otherwise, looking at all non-blank ballots:
 * <ol>
 *   <li>any rating other than 0 or 1 means RATED</li>
 *   <li>only ratings of 0 and 1 mean CHOOSE_MANY (approval)</li>
 *   <li>ballots with ">" or "=" and more than one candidate mean RANKED</li>
 *   <li>everything else is CHOOSE_ONE</li>
 * </ol>
 * A model without any non-blank ballot is UNKNOWN.
 *
 * Ratings that were synthesized from ranks ("is_ranking_to_rating") are ignored, so such models are
 * still RANKED (or CHOOSE_ONE) ballots. With two candidates their ratings would otherwise look like approvals.
 */
public class BallotTypeDetector {

	private BallotTypeDetector() {}

	public static BallotType detect(BallotModel model) {
		Optional<BallotType> declared = BallotType.fromLabel(model.getMetadata().get(BallotModel.BALLOT_TYPE));
		if (declared.isPresent()) return declared.get();

		boolean anyBallot = false;
		boolean rated = false;
		boolean approval = false;
		boolean ranked = false;
		boolean synthesizedRatings = model.isRankingToRating();
		for (Voteline vl : model.getVotelines()) {
			if (vl.isBlank()) continue;
			anyBallot = true;
			for (Preference pref : vl.getPrefs().values()) {
				if (synthesizedRatings || !pref.hasRating()) continue;
				if (pref.getRating() == 0 || pref.getRating() == 1) {
					approval = true;
				} else {
					rated = true;
				}
			}
			if (vl.isRankDelimited() && vl.getPrefs().size() > 1) ranked = true;
		}

		if (!anyBallot) return BallotType.UNKNOWN;
		if (rated) return BallotType.RATED;
		if (approval) return BallotType.CHOOSE_MANY;
		if (ranked) return BallotType.RANKED;
		return BallotType.CHOOSE_ONE;
	}
}
