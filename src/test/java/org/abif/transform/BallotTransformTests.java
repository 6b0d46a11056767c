package org.abif.transform;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.BallotType;
import org.abif.model.ConversionMeta;
import org.abif.model.Voteline;
import org.abif.parse.AbifParser;
import org.abif.parse.BallotTypeDetector;
import org.abif.util.AbifException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.abif.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@QuarkusTest
public class BallotTransformTests {

	@Inject
	AbifParser parser;

	@Inject
	BallotTransformService transformService;

	@Test
	public void viableCandidateMaximum_ShouldBeHalfRoundedUp() {
		for (int n = 1; n <= 12; n++) {
			int viableMax = BallotTransformService.viableCandidateMaximum(n);
			assertEquals((int) Math.ceil(n / 2.0), viableMax);
			assertTrue(viableMax >= 1);
		}
	}

	@Test
	public void numberOfViableCandidates_ShouldProbeHareQuota() {
		// 60 of 100 first choices exceed the quota for 2 seats
		assertEquals(2, BallotTransformService.numberOfViableCandidates(60, 100, 4, 10));
		// 42 of 100 only exceed the quota for 3 seats
		assertEquals(3, BallotTransformService.numberOfViableCandidates(42, 100, 4, 10));
		// 21 of 100 need 5 seats
		assertEquals(5, BallotTransformService.numberOfViableCandidates(21, 100, 6, 10));
		// a frontrunner that never clears a quota: fall back, but never more than there are candidates
		assertEquals(4, BallotTransformService.numberOfViableCandidates(10, 100, 4, 10));
		assertEquals(10, BallotTransformService.numberOfViableCandidates(1, 1000, 20, 10));
	}

	@Test
	public void favoriteViableHalf_ShouldNotModifyInput() throws AbifException {
		// GIVEN ranked ballots
		BallotModel model = parser.parse(readTestdata(TENNESSEE));
		BallotModel copy = model.deepCopy();

		// WHEN converting to approval ballots
		BallotModel approval = transformService.favoriteViableHalf(model);

		// THEN the input is unchanged and the output are approval ballots
		assertEquals(copy, model);
		assertEquals(BallotType.CHOOSE_MANY, BallotTypeDetector.detect(approval));
		assertEquals(model.getBallotcount(), approval.getBallotcount());
		assertEquals(model.getVotelines().size(), approval.getVotelines().size());

		Voteline memphFirst = approval.getVotelines().get(0);
		assertEquals(42, memphFirst.getQty());
		assertEquals(List.of(MEMPH, NASH), List.copyOf(memphFirst.getPrefs().keySet()));
		assertEquals(1, memphFirst.getPrefs().get(MEMPH).getRating());
		assertEquals("Memph/1=Nash/1", memphFirst.getPrefstr());

		ConversionMeta meta = approval.getConversionMeta();
		assertEquals(BallotType.RANKED, meta.getOriginalBallotType());
		assertEquals(100, meta.getTotalBallots());
		assertEquals("Knoxville, TN", meta.getCandidateNames().get(KNOX));
	}

	@Test
	public void favoriteViableHalf_OvervotesBecomeBlankBallots() throws AbifException {
		BallotModel approval = transformService.favoriteViableHalf(parser.parse("6:A>B\n3:A=B"));
		Voteline overvote = approval.getVotelines().get(1);
		assertEquals(3, overvote.getQty());
		assertTrue(overvote.isBlank());
	}

	@Test
	public void countApprovals() throws AbifException {
		Map<String, Long> counts = BallotTransformService.countApprovals(parser.parse(readTestdata(TENNESSEE_APPROVAL)));
		assertEquals(Map.of(MEMPH, 40L, NASH, 50L, CHAT, 36L, KNOX, 34L), counts);
	}

	@Test
	public void leastApprovalFirst_ShouldOrderByAscendingApprovals() throws AbifException {
		// GIVEN approval ballots
		BallotModel model = parser.parse(readTestdata(TENNESSEE_APPROVAL));

		// WHEN ordering all candidates by their approvals
		List<String> order = transformService.leastApprovalFirstOrder(model);

		// THEN the least approved candidate comes first
		assertEquals(List.of(KNOX, CHAT, MEMPH, NASH), order);

		// AND every ballot ranks its approved candidates in that order
		BallotModel ranked = transformService.leastApprovalFirst(model);
		assertEquals(BallotType.RANKED, BallotTypeDetector.detect(ranked));
		Voteline nashChat = ranked.getVotelines().get(1);
		assertEquals(26, nashChat.getQty());
		assertEquals(List.of(CHAT, NASH), nashChat.getRanklist());
		assertEquals("Chat>Nash", nashChat.getPrefstr());
		assertEquals(ConversionMeta.LEAST_APPROVAL_FIRST, ranked.getConversionMeta().getMethod());
		assertEquals("token", ranked.getConversionMeta().getParameters().get("tie_breaker"));
	}

	@Test
	public void equalApprovals_ShouldBeOrderedByToken() throws AbifException {
		List<String> order = transformService.leastApprovalFirstOrder(parser.parse("2:B/1,A/1,C/0\n1:C/1,A/0,B/0"));
		assertEquals(List.of("C", "A", "B"), order);
	}

	@Test
	public void leastApprovalFirstOfRatedBallots_ShouldBeRejected() throws AbifException {
		BallotModel rated = parser.parse(readTestdata(STAR_SIMPLE));
		AbifException ex = assertThrows(AbifException.class, () -> transformService.leastApprovalFirst(rated));
		assertEquals(AbifException.Errors.UNSUPPORTED_BALLOT_TYPE, ex.getError());
	}

	@Test
	public void allRankedApproved() throws AbifException {
		BallotModel approval = transformService.allRankedApproved(parser.parse(readTestdata(TENNESSEE)));
		Map<String, Long> counts = BallotTransformService.countApprovals(approval);
		counts.values().forEach(count -> assertEquals(100, count, "Every candidate is ranked on every ballot"));
		assertEquals(ConversionMeta.ALL_RANKED_APPROVED, approval.getConversionMeta().getMethod());
	}
}
