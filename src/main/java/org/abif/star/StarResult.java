package org.abif.star;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.abif.model.Notice;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a STAR tally (Score Then Automatic Runoff): the scoring round and the runoff between the two finalists
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StarResult {

	ScoreResult scoreResult;

	/** the (up to) two candidates with the highest scores */
	List<String> finalists = new ArrayList<>();

	String fin1;
	String fin2;
	String fin1n;
	String fin2n;

	/** ballots that prefer fin1 over fin2 */
	long fin1votes;

	/** ballots that prefer fin2 over fin1 */
	long fin2votes;

	/** ballots without a preference between the finalists */
	long finalAbstentions;

	/** the runoff winner, or both finalists on a tie. Empty without candidates. */
	List<String> winners = new ArrayList<>();

	boolean tie;

	List<Notice> notices = new ArrayList<>();
}
