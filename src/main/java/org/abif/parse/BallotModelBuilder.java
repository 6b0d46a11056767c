package org.abif.parse;

import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.Preference;
import org.abif.model.Voteline;
import org.abif.util.AbifException;
import org.abif.util.Diagnostics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Folds classified lines into a {@link BallotModel}.
 *
 * A builder is used for exactly one input. Call {@link #addLine(AbifLine)} for every line
 * and then {@link #build(boolean, boolean)} once.
 */
@Slf4j
public class BallotModelBuilder {

	private final Diagnostics diagnostics;
	private final boolean strictQuoting;
	private final boolean keepComments;

	private final BallotModel model = new BallotModel();
	private final List<List<Object>> comments = new ArrayList<>();
	private long ballotcount = 0;
	private int numVotelines = 0;

	public BallotModelBuilder(Diagnostics diagnostics, boolean strictQuoting, boolean keepComments) {
		this.diagnostics = diagnostics;
		this.strictQuoting = strictQuoting;
		this.keepComments = keepComments;
		model.getMetadata().put(BallotModel.BALLOTCOUNT, 0L);
	}

	/**
	 * Add one classified line to the model
	 * @param line a line from {@link LineClassifier}
	 * @throws AbifException UNTERMINATED_QUOTE when strict quoting is enabled and a voteline has an unclosed quote or bracket
	 */
	public void addLine(AbifLine line) throws AbifException {
		if (keepComments && line.hasComment()) {
			comments.add(List.of(line.getLineNum(), line.getComment()));
		}
		switch (line.getType()) {
			case CANDIDATE:
				model.getCandidates().put(line.getCandToken(), line.getCandName());
				break;
			case METADATA:
				addMetadata(line.getKey(), line.getValue());
				break;
			case VOTELINE:
				addVoteline(line);
				break;
			case UNRECOGNIZED:
				log.debug("Ignoring unrecognized line {}: '{}'", line.getLineNum(), line.getContent());
				break;
			default:
				// blank lines and comments
		}
	}

	void addMetadata(String key, Object value) {
		// The ballotcount is always computed from the votelines. A declared one is only kept for reference.
		if (BallotModel.BALLOTCOUNT.equals(key)) key = BallotModel.BALLOTCOUNT_DECLARED;
		model.getMetadata().put(key, value);
	}

	/**
	 * Parse the preferences of one voteline and add it to the model.
	 * Ranks advance with every ">". Ballots that only list ratings ("A/5,B/3") get ranks derived from the ratings.
	 */
	void addVoteline(AbifLine line) throws AbifException {
		PrefExpression expr = PrefTokenizer.tokenize(line.getPrefstr());
		if (expr.isTruncated() && strictQuoting)
			throw new AbifException(AbifException.Errors.UNTERMINATED_QUOTE, "Unterminated quote or bracket in line " + line.getLineNum(), line.getContent());
		if (expr.isTruncated() || expr.isMalformed())
			log.warn("Voteline {} could only be parsed partially: {}", line.getLineNum(), expr);
		diagnostics.trace("line {}: {}", line.getLineNum(), expr);

		LinkedHashMap<String, Preference> prefs = prefsOf(expr);

		for (String cand : prefs.keySet()) {
			model.getCandidates().putIfAbsent(cand, cand);
		}

		Voteline vl = new Voteline(line.getQty(), prefs);
		vl.setPrefstr(line.getPrefstr());
		vl.setComment(line.getComment());
		vl.setVoterid(line.getVoterid());
		model.getVotelines().add(vl);
		ballotcount += line.getQty();
		numVotelines++;
	}

	/**
	 * Preferences of one tokenized preference string. Lists of ratings get their ranks from the ratings.
	 * @throws AbifException RANK_INFERENCE_FAILED when derived ranks contradict the ratings
	 */
	static LinkedHashMap<String, Preference> prefsOf(PrefExpression expr) throws AbifException {
		return expr.getType() == PrefExprType.RATED && expr.hasAnyRating()
				? prefsFromRatings(expr.getTokens())
				: prefsFromRanks(expr.getTokens());
	}

	static LinkedHashMap<String, Preference> prefsFromRanks(List<PrefToken> tokens) {
		LinkedHashMap<String, Preference> prefs = new LinkedHashMap<>();
		int rank = 1;
		for (PrefToken tok : tokens) {
			if (prefs.containsKey(tok.getCand())) {
				log.debug("Candidate {} listed twice on one ballot. Keeping the first one.", tok.getCand());
			} else {
				prefs.put(tok.getCand(), tok.hasRating()
						? Preference.rankedAndRated(rank, tok.getRating(), tok.getDelim())
						: Preference.ranked(rank, tok.getDelim()));
			}
			if (String.valueOf(PrefTokenizer.RANK_DELIM).equals(tok.getDelim())) rank++;
		}
		return prefs;
	}

	/**
	 * Derive ranks from ratings. The highest rating gets rank 1. Equal ratings share their rank
	 * and the next lower rating gets the next rank. Unrated candidates rank below all rated ones.
	 */
	static LinkedHashMap<String, Preference> prefsFromRatings(List<PrefToken> tokens) throws AbifException {
		TreeSet<Integer> distinctRatings = new TreeSet<>(Comparator.reverseOrder());
		for (PrefToken tok : tokens) {
			if (tok.hasRating()) distinctRatings.add(tok.getRating());
		}
		List<Integer> ratingsDesc = new ArrayList<>(distinctRatings);
		int unratedRank = ratingsDesc.size() + 1;

		LinkedHashMap<String, Preference> prefs = new LinkedHashMap<>();
		for (PrefToken tok : tokens) {
			if (prefs.containsKey(tok.getCand())) continue;
			if (tok.hasRating()) {
				int rank = ratingsDesc.indexOf(tok.getRating()) + 1;
				prefs.put(tok.getCand(), Preference.rated(tok.getRating(), rank, tok.getDelim()));
			} else {
				prefs.put(tok.getCand(), Preference.ranked(unratedRank, tok.getDelim()));
			}
		}
		checkRanksMatchRatings(prefs);
		return prefs;
	}

	/** A higher rating must never get a worse rank. */
	static void checkRanksMatchRatings(Map<String, Preference> prefs) throws AbifException {
		for (Map.Entry<String, Preference> a : prefs.entrySet()) {
			for (Map.Entry<String, Preference> b : prefs.entrySet()) {
				Preference pa = a.getValue();
				Preference pb = b.getValue();
				if (!pa.hasRating() || !pb.hasRating()) continue;
				if (pa.getRating() > pb.getRating() && pa.getRankOrMax() >= pb.getRankOrMax())
					throw AbifException.supplyAndLog(AbifException.Errors.RANK_INFERENCE_FAILED,
							"Rank of " + a.getKey() + " (rating " + pa.getRating() + ") is not better than rank of " + b.getKey() + " (rating " + pb.getRating() + ")").get();
			}
		}
	}

	/**
	 * Finish the model
	 * @param addRatings synthesize ratings from ranks
	 * @param sortVotelines sort votelines by descending qty. Only for nicer output, tallies do not depend on it.
	 * @return the ballot model
	 * @throws AbifException NO_VOTELINES if not a single voteline was added
	 */
	public BallotModel build(boolean addRatings, boolean sortVotelines) throws AbifException {
		if (numVotelines == 0)
			throw new AbifException(AbifException.Errors.NO_VOTELINES, "ABIF input does not contain any votelines");
		model.getMetadata().put(BallotModel.BALLOTCOUNT, ballotcount);
		if (keepComments && !comments.isEmpty()) model.getMetadata().put(BallotModel.COMMENTS, comments);
		if (addRatings) addRatings(model);
		if (sortVotelines) model.getVotelines().sort(Comparator.comparingLong(Voteline::getQty).reversed());
		return model;
	}

	/**
	 * Rating synthesis. If no voteline at all has ratings, every ranked candidate gets
	 * (number of candidates - rank) as its rating and the model is marked "is_ranking_to_rating".
	 * If only some votelines have ratings, then missing ratings become 0.
	 */
	static void addRatings(BallotModel model) {
		boolean anyRating = model.getVotelines().stream().anyMatch(Voteline::hasAnyRating);
		int candCount = model.getCandidates().size();
		for (Voteline vl : model.getVotelines()) {
			LinkedHashMap<String, Preference> annotated = new LinkedHashMap<>();
			for (Map.Entry<String, Preference> entry : vl.getPrefs().entrySet()) {
				Preference pref = entry.getValue();
				if (!pref.hasRating()) {
					int rating = anyRating || !pref.hasRank() ? 0 : Math.max(candCount - pref.getRank(), 0);
					pref = pref.withRating(rating);
				}
				annotated.put(entry.getKey(), pref);
			}
			vl.setPrefs(annotated);
		}
		if (!anyRating) model.getMetadata().put(BallotModel.IS_RANKING_TO_RATING, true);
	}
}
