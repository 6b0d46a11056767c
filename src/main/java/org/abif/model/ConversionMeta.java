package org.abif.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.abif.util.Lson;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provenance of a ballot model that was converted from another ballot type.
 * Tallies turn this into {@link Notice}s.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ConversionMeta {

	public static final String FAVORITE_VIABLE_HALF = "favorite_viable_half";
	public static final String ALL_RANKED_APPROVED  = "all_ranked_approved";
	public static final String LEAST_APPROVAL_FIRST = "least_approval_first";

	String method;

	@JsonProperty("original_ballot_type")
	BallotType originalBallotType;

	@JsonProperty("viable_candidates")
	List<String> viableCandidates = new ArrayList<>();

	@JsonProperty("viable_candidate_maximum")
	int viableCandidateMaximum;

	@JsonProperty("total_ballots")
	long totalBallots;

	@JsonProperty("candidate_names")
	Map<String, String> candidateNames = new LinkedHashMap<>();

	/** further method specific parameters */
	Lson parameters = new Lson();

	public ConversionMeta(String method, BallotType originalBallotType) {
		this.method = method;
		this.originalBallotType = originalBallotType;
	}
}
