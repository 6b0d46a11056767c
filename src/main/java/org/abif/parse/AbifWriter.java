package org.abif.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.Preference;
import org.abif.model.Voteline;
import org.abif.util.AbifException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Write a {@link BallotModel} back to ABIF text.
 * Parsing the output again gives the same candidates and the same ranks and ratings on every ballot.
 */
@Slf4j
public class AbifWriter {

	static final Pattern BARE_TOKEN = Pattern.compile("^[A-Za-z0-9_\\-]+$");
	static final Pattern METADATA_KEY = Pattern.compile("^[\\w\\-]+(\\s+[\\w\\-]+)*$");

	private static final ObjectMapper mapper = new ObjectMapper();

	private AbifWriter() {}

	public static String toAbif(BallotModel model) {
		StringBuilder sb = new StringBuilder();
		sb.append("#------- metadata -------\n");
		for (Map.Entry<String, Object> entry : model.getMetadata().entrySet()) {
			String key = entry.getKey();
			Object value = entry.getValue();
			if (BallotModel.BALLOTCOUNT.equals(key) || BallotModel.COMMENTS.equals(key)) continue;   // recomputed when parsing
			if (!isScalar(value) || !METADATA_KEY.matcher(key).matches()) {
				log.debug("Metadata '{}' cannot be written as ABIF", key);
				continue;
			}
			sb.append('{').append(key).append(": ").append(toJsonValue(value)).append("}\n");
		}

		sb.append("#------ candlines ------\n");
		for (Map.Entry<String, String> cand : model.getCandidates().entrySet()) {
			sb.append('=').append(quoteToken(cand.getKey())).append(':');
			String name = cand.getValue() == null ? cand.getKey() : cand.getValue();
			if (name.contains("]")) {
				sb.append('"').append(name).append('"');
			} else {
				sb.append('[').append(name).append(']');
			}
			sb.append('\n');
		}

		sb.append("#------- votelines ------\n");
		for (Voteline vl : model.getVotelines()) {
			sb.append(toVoteline(vl)).append('\n');
		}
		return sb.toString();
	}

	public static String toVoteline(Voteline vl) {
		StringBuilder sb = new StringBuilder();
		sb.append(vl.getQty()).append(':').append(toPrefstr(vl));
		if (vl.getComment() != null && !vl.getComment().isEmpty()) {
			sb.append(' ').append(vl.getComment());
		} else if (vl.getVoterid() != null) {
			sb.append(" ##VID:").append(vl.getVoterid());
		}
		return sb.toString();
	}

	/**
	 * Preference string of one voteline.
	 * Preferences are written in their original order with their own delimiters, as long as that string
	 * parses back to the same ranks, ratings and delimiters. Otherwise ballots with ">" or "=" are written
	 * ordered by rank, and lists of ratings (and single choices) in their original order separated by ",".
	 */
	public static String toPrefstr(Voteline vl) {
		String asWritten = withOwnDelimiters(vl);
		if (asWritten != null && parsesBackTo(asWritten, vl.getPrefs())) return asWritten;
		return rebuildDelimiters(vl);
	}

	/**
	 * @return the preferences in their original order joined by their own delimiters,
	 *         or null if a delimiter is missing
	 */
	static String withOwnDelimiters(Voteline vl) {
		List<Map.Entry<String, Preference>> entries = new ArrayList<>(vl.getPrefs().entrySet());
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < entries.size(); i++) {
			Preference pref = entries.get(i).getValue();
			sb.append(quoteToken(entries.get(i).getKey()));
			if (pref.hasRating()) sb.append('/').append(pref.getRating());
			if (i < entries.size() - 1) {
				if (pref.getNextDelim() == null) return null;
				sb.append(pref.getNextDelim());
			} else if (pref.getNextDelim() != null) {
				return null;
			}
		}
		return sb.toString();
	}

	static boolean parsesBackTo(String prefstr, Map<String, Preference> prefs) {
		try {
			return BallotModelBuilder.prefsOf(PrefTokenizer.tokenize(prefstr)).equals(prefs);
		} catch (AbifException e) {
			log.debug("'{}' does not parse back to the same preferences: {}", prefstr, e.getMessage());
			return false;
		}
	}

	static String rebuildDelimiters(Voteline vl) {
		Map<String, Preference> prefs = vl.getPrefs();
		List<String> order = vl.isRankDelimited() ? vl.getRanklist() : new ArrayList<>(prefs.keySet());
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < order.size(); i++) {
			String cand = order.get(i);
			Preference pref = prefs.get(cand);
			sb.append(quoteToken(cand));
			if (pref.hasRating()) sb.append('/').append(pref.getRating());
			if (i < order.size() - 1) {
				if (vl.isRankDelimited()) {
					Preference next = prefs.get(order.get(i + 1));
					sb.append(next.getRankOrMax() > pref.getRankOrMax() ? PrefTokenizer.RANK_DELIM : PrefTokenizer.TIE_DELIM);
				} else {
					sb.append(PrefTokenizer.LIST_DELIM);
				}
			}
		}
		return sb.toString();
	}

	/** Bare tokens are written as they are, everything else in square brackets (or quotes if it contains a "]"). */
	public static String quoteToken(String token) {
		if (BARE_TOKEN.matcher(token).matches()) return token;
		if (token.contains("]")) return "\"" + token + "\"";
		return "[" + token + "]";
	}

	private static boolean isScalar(Object value) {
		return value instanceof String || value instanceof Number || value instanceof Boolean;
	}

	private static String toJsonValue(Object value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot write metadata value " + value, e);
		}
	}
}
