package org.abif.fptp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.abif.model.BallotType;
import org.abif.model.Notice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Result of a plurality (first past the post) tally
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FptpResult {

	/** candidate token -> number of ballots with this candidate as the single top choice */
	LinkedHashMap<String, Long> toppicks = new LinkedHashMap<>();

	/** overvoted and blank ballots that count for nobody. Null when invalid ballots are not counted. */
	Long noneQty;

	List<String> winners = new ArrayList<>();

	long topQty;

	/** topQty as percentage of all ballots */
	double topPct;

	/** sum of all valid top choices */
	long totalVotesRecounted;

	/** number of ballots */
	long totalVotes;

	long overvoteBallots;

	long blankBallots;

	BallotType ballotType;

	List<Notice> notices = new ArrayList<>();

	public boolean isTie() {
		return winners.size() > 1;
	}
}
