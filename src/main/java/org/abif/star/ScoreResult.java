package org.abif.star;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.abif.model.Notice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Result of a score voting tally
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScoreResult {

	/** candidate token -> score, highest score first */
	LinkedHashMap<String, CandidateScore> scores = new LinkedHashMap<>();

	/** candidate tokens, highest score first */
	List<String> ranklist = new ArrayList<>();

	long totalAllScores;

	/** number of ballots */
	long totalvoters;

	/** candidates with the highest score. Empty when nobody got any points. */
	List<String> winners = new ArrayList<>();

	List<Notice> notices = new ArrayList<>();
}
