package org.abif.pairwise;

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
 * Result of a pairwise (Condorcet) tally with Copeland winners
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PairwiseResult {

	PairwiseMatrix pairwiseMatrix;

	/** candidate -> wins/losses/ties, most wins first */
	LinkedHashMap<String, WinLossTie> winlosstie = new LinkedHashMap<>();

	LinkedHashMap<String, Double> copelandScores = new LinkedHashMap<>();

	List<String> copelandWinners = new ArrayList<>();

	/** candidate that beats every other candidate, or null */
	String condorcetWinner;

	boolean hasTiesOrCycles;

	List<Notice> notices = new ArrayList<>();
}
