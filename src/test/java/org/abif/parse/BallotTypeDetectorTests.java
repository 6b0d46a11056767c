package org.abif.parse;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.BallotType;
import org.abif.util.AbifException;
import org.junit.jupiter.api.Test;

import static org.abif.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
@QuarkusTest
public class BallotTypeDetectorTests {

	@Inject
	AbifParser parser;

	@Test
	public void detectFromBallots() throws AbifException {
		assertEquals(BallotType.RANKED, BallotTypeDetector.detect(parser.parse(readTestdata(TENNESSEE))));
		assertEquals(BallotType.CHOOSE_MANY, BallotTypeDetector.detect(parser.parse(readTestdata(TENNESSEE_APPROVAL))));
		assertEquals(BallotType.RATED, BallotTypeDetector.detect(parser.parse(readTestdata(STAR_SIMPLE))));
		assertEquals(BallotType.CHOOSE_ONE, BallotTypeDetector.detect(parser.parse("5:A\n3:B\n1:")));
	}

	@Test
	public void ratingsOtherThanZeroOrOne_ShouldWinOverApproval() throws AbifException {
		BallotModel model = parser.parse("5:A/1,B/0\n3:A/0,B/4");
		assertEquals(BallotType.RATED, BallotTypeDetector.detect(model));
	}

	@Test
	public void singleCandidateWithRankDelimiter_ShouldNotBeRanked() throws AbifException {
		BallotModel model = parser.parse("5:A>\n3:B");
		assertEquals(BallotType.CHOOSE_ONE, BallotTypeDetector.detect(model));
	}

	@Test
	public void synthesizedRatings_ShouldStillBeRanked() throws AbifException {
		// two candidates get the synthesized ratings 1 and 0, which look like approvals
		BallotModel twoCands = parser.parse("6:A>B\n4:B>A", true);
		assertTrue(twoCands.isRankingToRating());
		assertEquals(BallotType.RANKED, BallotTypeDetector.detect(twoCands));
		assertEquals(BallotType.RANKED, BallotTypeDetector.detect(parser.parse(readTestdata(TENNESSEE), true)));
	}

	@Test
	public void onlyBlankBallots_ShouldBeUnknown() throws AbifException {
		assertEquals(BallotType.UNKNOWN, BallotTypeDetector.detect(parser.parse("3:\n2:")));
	}

	@Test
	public void declaredBallotType_ShouldOverrideDetection() throws AbifException {
		BallotModel model = parser.parse("{ballot_type: \"choose_many\"}\n3:A>B");
		assertEquals(BallotType.CHOOSE_MANY, BallotTypeDetector.detect(model));
	}
}
