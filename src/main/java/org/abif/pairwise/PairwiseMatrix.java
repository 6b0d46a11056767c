package org.abif.pairwise;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The duel matrix of an election: get(a, b) is the number of ballots that rank candidate a strictly before b.
 * As JSON this is a nested map winner -> loser -> votes, with null on the diagonal.
 */
public class PairwiseMatrix {

	private final List<String> cands;
	private final Map<String, Integer> index = new LinkedHashMap<>();
	private final long[][] votes;

	public PairwiseMatrix(List<String> cands) {
		this.cands = Collections.unmodifiableList(new ArrayList<>(cands));
		for (int i = 0; i < cands.size(); i++) index.put(cands.get(i), i);
		this.votes = new long[cands.size()][cands.size()];
	}

	public List<String> getCandidates() {
		return cands;
	}

	public int size() {
		return cands.size();
	}

	public long get(String a, String b) {
		return votes[indexOf(a)][indexOf(b)];
	}

	public long get(int i, int j) {
		return votes[i][j];
	}

	void add(int i, int j, long qty) {
		votes[i][j] += qty;
	}

	private int indexOf(String cand) {
		Integer i = index.get(cand);
		if (i == null) throw new IllegalArgumentException("Unknown candidate " + cand);
		return i;
	}

	@JsonValue
	public Map<String, Map<String, Long>> toNestedMap() {
		Map<String, Map<String, Long>> map = new LinkedHashMap<>();
		for (int i = 0; i < cands.size(); i++) {
			Map<String, Long> row = new LinkedHashMap<>();
			for (int j = 0; j < cands.size(); j++) {
				row.put(cands.get(j), i == j ? null : votes[i][j]);
			}
			map.put(cands.get(i), row);
		}
		return map;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("PairwiseMatrix[");
		for (int i = 0; i < cands.size(); i++) {
			if (i > 0) sb.append(", ");
			sb.append(cands.get(i)).append('=');
			for (int j = 0; j < cands.size(); j++) {
				sb.append(j == 0 ? "[" : ",").append(i == j ? "-" : String.valueOf(votes[i][j]));
			}
			sb.append(']');
		}
		return sb.append(']').toString();
	}
}
