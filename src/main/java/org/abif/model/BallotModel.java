package org.abif.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * The canonical ballot model ("jabmod"): candidates, metadata and votelines of one election.
 *
 * This is the only thing that is passed from the parser to the tallies. Tallies only read it.
 * Conversions (e.g. ranked to approval) return a {@link #deepCopy()} and never change their input.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"metadata", "candidates", "votelines", "conversion_meta"})
public class BallotModel {

	public static final String BALLOTCOUNT = "ballotcount";
	public static final String BALLOTCOUNT_DECLARED = "ballotcount_declared";
	public static final String BALLOT_TYPE = "ballot_type";
	public static final String IS_RANKING_TO_RATING = "is_ranking_to_rating";
	public static final String COMMENTS = "comments";
	public static final String TITLE = "title";

	/** candidate token -> display name */
	LinkedHashMap<String, String> candidates = new LinkedHashMap<>();

	LinkedHashMap<String, Object> metadata = new LinkedHashMap<>();

	List<Voteline> votelines = new ArrayList<>();

	/** Only set when this model was converted from another ballot type */
	@JsonProperty("conversion_meta")
	ConversionMeta conversionMeta;

	/**
	 * Number of ballots in this election.
	 * @return metadata.ballotcount or the sum of all voteline quantities if it is not set
	 */
	@JsonIgnore
	public long getBallotcount() {
		Object count = metadata.get(BALLOTCOUNT);
		if (count instanceof Number) return ((Number)count).longValue();
		return sumOfQty();
	}

	public long sumOfQty() {
		return votelines.stream().mapToLong(Voteline::getQty).sum();
	}

	/**
	 * Display name of a candidate.
	 * @param token candidate token
	 * @return the name from the candidate registry or the token itself
	 */
	public String getCandidateName(String token) {
		String name = candidates.get(token);
		return name != null ? name : token;
	}

	@JsonIgnore
	public List<String> getCandidateTokens() {
		return new ArrayList<>(candidates.keySet());
	}

	/**
	 * Candidates from the registry followed by any candidate that only appears on ballots
	 */
	public List<String> allCandidateTokens() {
		LinkedHashSet<String> tokens = new LinkedHashSet<>(candidates.keySet());
		for (Voteline vl : votelines) tokens.addAll(vl.getPrefs().keySet());
		return new ArrayList<>(tokens);
	}

	@JsonIgnore
	public boolean isRankingToRating() {
		return Boolean.TRUE.equals(metadata.get(IS_RANKING_TO_RATING));
	}

	/**
	 * Copy everything. Metadata values are copied shallowly, except for nested lists and maps.
	 */
	public BallotModel deepCopy() {
		BallotModel copy = new BallotModel();
		copy.candidates = new LinkedHashMap<>(candidates);
		for (Map.Entry<String, Object> entry : metadata.entrySet()) {
			copy.metadata.put(entry.getKey(), copyValue(entry.getValue()));
		}
		for (Voteline vl : votelines) {
			copy.votelines.add(vl.copy());
		}
		copy.conversionMeta = conversionMeta;
		return copy;
	}

	private static Object copyValue(Object value) {
		if (value instanceof List) {
			List<Object> list = new ArrayList<>();
			for (Object elem : (List<?>)value) list.add(copyValue(elem));
			return list;
		}
		if (value instanceof Map) {
			Map<Object, Object> map = new LinkedHashMap<>();
			for (Map.Entry<?, ?> e : ((Map<?, ?>)value).entrySet()) map.put(e.getKey(), copyValue(e.getValue()));
			return map;
		}
		return value;
	}

	@Override
	public String toString() {
		return "BallotModel[candidates=" + candidates.size() + ", votelines=" + votelines.size() + ", ballotcount=" + getBallotcount() + "]";
	}
}
