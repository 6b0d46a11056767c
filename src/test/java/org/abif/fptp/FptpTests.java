package org.abif.fptp;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.BallotType;
import org.abif.parse.AbifParser;
import org.abif.util.AbifException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;

import java.util.List;

import static org.abif.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@QuarkusTest
public class FptpTests {

	@Inject
	AbifParser parser;

	@Inject
	FptpService fptpService;

	@BeforeEach
	public void beforeEachTest(TestInfo testInfo) {
		log.info("==========> Starting: " + testInfo.getDisplayName());
	}

	@AfterEach
	public void afterEachTest(TestInfo testInfo) {
		log.info("<========== Finished: " + testInfo.getDisplayName());
	}

	@Test
	public void tennessee_MemphisShouldWinWithPlurality() throws AbifException {
		// GIVEN the Tennessee example
		BallotModel model = parser.parse(readTestdata(TENNESSEE));

		// WHEN counting first choices
		FptpResult res = fptpService.tally(model);

		// THEN Memphis wins with 42 of 100 votes, although that is no majority
		assertEquals(List.of(MEMPH), res.getWinners());
		assertEquals(42, res.getTopQty());
		assertEquals(42.0, res.getTopPct(), 0.0001);
		assertEquals(26, res.getToppicks().get(NASH));
		assertEquals(17, res.getToppicks().get(CHAT));
		assertEquals(15, res.getToppicks().get(KNOX));
		assertEquals(100, res.getTotalVotes());
		assertEquals(100, res.getTotalVotesRecounted());
		assertEquals(0, res.getNoneQty());
		assertEquals(BallotType.RANKED, res.getBallotType());
		assertFalse(res.isTie());
		assertEquals("Only using first-choices on ranked ballots", res.getNotices().get(0).getShortText());
	}

	@Test
	public void overvotesAndBlankBallots_ShouldNotCount() throws AbifException {
		// GIVEN ballots with a tie at the top and blank ballots
		BallotModel model = parser.parse("5:A>B\n4:B\n3:A=B\n2:");

		// WHEN counting first choices
		FptpResult res = fptpService.tally(model);

		// THEN overvotes and blank ballots count for nobody, but are reported
		assertEquals(List.of("A"), res.getWinners());
		assertEquals(3, res.getOvervoteBallots());
		assertEquals(2, res.getBlankBallots());
		assertEquals(9, res.getTotalVotesRecounted());
		assertEquals(14, res.getTotalVotes());
		assertEquals(5, res.getNoneQty());
		assertEquals(100.0 * 5 / 14, res.getTopPct(), 0.0001);
	}

	@Test
	public void withoutCountingInvalid_NoneShouldNotBeReported() throws AbifException {
		FptpResult res = fptpService.tally(parser.parse("5:A\n2:"), false);
		assertNull(res.getNoneQty());
		assertEquals(2, res.getBlankBallots());
	}

	@Test
	public void equalTopCounts_ShouldBeATie() throws AbifException {
		FptpResult res = fptpService.tally(parser.parse("5:A\n5:B\n1:C"));
		assertTrue(res.isTie());
		assertEquals(List.of("A", "B"), res.getWinners());
		assertTrue(res.getNotices().isEmpty(), "choose_one ballots need no notice");
	}

	@Test
	public void noValidVotes_ShouldHaveNoWinner() throws AbifException {
		FptpResult res = fptpService.tally(parser.parse("3:A=B\n2:"));
		assertTrue(res.getWinners().isEmpty());
		assertEquals(0, res.getTopQty());
		assertEquals(0.0, res.getTopPct());
	}

	@Test
	public void approvalBallotsWithSeveralTopChoices_ShouldGetNotice() throws AbifException {
		BallotModel model = parser.parse(readTestdata(TENNESSEE_APPROVAL));
		FptpResult res = fptpService.tally(model);
		assertEquals(BallotType.CHOOSE_MANY, res.getBallotType());
		assertEquals(List.of(MEMPH), res.getWinners(), "Only the 40 Memphis ballots have exactly one approval");
		assertEquals(60, res.getOvervoteBallots());
		assertEquals("Overvotes from approval/choose-many ballots not counted in FPTP", res.getNotices().get(0).getShortText());
	}
}
