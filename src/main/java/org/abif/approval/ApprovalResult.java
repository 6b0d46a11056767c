package org.abif.approval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.abif.model.BallotType;
import org.abif.model.ConversionMeta;
import org.abif.model.Notice;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Result of an approval voting tally
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApprovalResult {

	/** candidate token -> number of approvals */
	LinkedHashMap<String, Long> approvalCounts = new LinkedHashMap<>();

	/** candidates with the most approvals. Empty when nobody was approved. */
	List<String> winners = new ArrayList<>();

	long topQty;

	/** topQty as percentage of all ballots */
	double topPct;

	long totalApprovals;

	/** number of ballots */
	long totalVotes;

	long invalidBallots;

	/** type of the ballots before any conversion */
	BallotType ballotType;

	/** how the ballots were converted to approval ballots, if they were */
	ConversionMeta conversion;

	List<Notice> notices = new ArrayList<>();
}
