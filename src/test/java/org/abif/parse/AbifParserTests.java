package org.abif.parse;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.Preference;
import org.abif.model.Voteline;
import org.abif.util.AbifException;
import org.abif.util.Diagnostics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

import static org.abif.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@QuarkusTest
public class AbifParserTests {

	@Inject
	AbifParser parser;

	@BeforeEach
	public void beforeEachTest(TestInfo testInfo) {
		log.info("==========> Starting: " + testInfo.getDisplayName());
	}

	@AfterEach
	public void afterEachTest(TestInfo testInfo) {
		log.info("<========== Finished: " + testInfo.getDisplayName());
	}

	@Test
	public void parseTennessee() throws AbifException {
		// GIVEN the Tennessee example
		String abif = readTestdata(TENNESSEE);

		// WHEN parsing it
		BallotModel model = parser.parse(abif);

		// THEN all candidates, metadata and votelines are found
		assertEquals(List.of(MEMPH, NASH, CHAT, KNOX), model.getCandidateTokens());
		assertEquals("Nashville, TN", model.getCandidateName(NASH));
		assertEquals("Tennessee capital", model.getMetadata().get(BallotModel.TITLE));
		assertEquals(4, model.getVotelines().size());
		assertEquals(100L, model.getMetadata().get(BallotModel.BALLOTCOUNT));

		Voteline first = model.getVotelines().get(0);
		assertEquals(42, first.getQty());
		assertEquals(List.of(MEMPH, NASH, CHAT, KNOX), first.getRanklist());
		assertEquals(Preference.ranked(4, null), first.getPrefs().get(KNOX));
		assertFalse(first.hasAnyRating(), "Ranked ballots should not have ratings unless they are added");
	}

	@Test
	public void ballotcount_ShouldAlwaysBeSumOfQty() throws AbifException {
		// GIVEN an ABIF with a wrong declared ballotcount
		String abif = readTestdata(MIXED_FEATURES);

		// WHEN parsing it
		BallotModel model = parser.parse(abif);

		// THEN the ballotcount is computed and the declared one is kept for reference
		long sumOfQty = model.getVotelines().stream().mapToLong(Voteline::getQty).sum();
		assertEquals(10, sumOfQty);
		assertEquals(sumOfQty, model.getMetadata().get(BallotModel.BALLOTCOUNT));
		assertEquals(999, model.getMetadata().get(BallotModel.BALLOTCOUNT_DECLARED));
		assertEquals(sumOfQty, model.getBallotcount());
	}

	@Test
	public void quotedTokensTiesAndComments() throws AbifException {
		BallotModel model = parser.parse(readTestdata(MIXED_FEATURES));

		assertEquals("San Jose, CA", model.getCandidateName("San Jose"));
		assertEquals("Boston [MA]", model.getCandidateName("Bos"));

		// votelines are sorted by descending qty
		List<Voteline> votelines = model.getVotelines();
		assertEquals(List.of(4L, 3L, 2L, 1L), votelines.stream().map(Voteline::getQty).collect(Collectors.toList()));

		assertTrue(votelines.get(0).isBlank(), "'4:' is a blank ballot");

		Voteline tie = votelines.get(1);
		assertEquals(1, tie.getPrefs().get("NY").getRank());
		assertEquals(2, tie.getPrefs().get("San Jose").getRank());
		assertEquals(2, tie.getPrefs().get("Bos").getRank(), "Candidates after '=' share their rank");
		assertEquals("# a comment with a > inside", tie.getComment());

		assertEquals("voter-17", votelines.get(2).getVoterid());
	}

	@Test
	public void unknownCandidates_ShouldBeAddedToRegistry() throws AbifException {
		BallotModel model = parser.parse("3:A>B\n2:C");
		assertEquals(List.of("A", "B", "C"), model.getCandidateTokens());
		assertEquals("C", model.getCandidateName("C"));
	}

	@Test
	public void ranksFromRatings() throws AbifException {
		// GIVEN a list of ratings with an unrated candidate
		BallotModel model = parser.parse("1:A/3,B/5,C/3,D");

		// THEN the highest rating gets rank 1, equal ratings share a rank, unrated candidates come last
		Voteline vl = model.getVotelines().get(0);
		assertEquals(1, vl.getPrefs().get("B").getRank());
		assertEquals(2, vl.getPrefs().get("A").getRank());
		assertEquals(2, vl.getPrefs().get("C").getRank());
		assertEquals(3, vl.getPrefs().get("D").getRank());
		assertEquals(Preference.Kind.RATING_ONLY, vl.getPrefs().get("B").getKind());
	}

	@Test
	public void addRatings_ShouldSynthesizeRatingsFromRanks() throws AbifException {
		// WHEN parsing ranked ballots with ratings added
		BallotModel model = parser.parse(readTestdata(TENNESSEE), true);

		// THEN every candidate gets (number of candidates - rank) stars
		assertTrue(model.isRankingToRating());
		Voteline first = model.getVotelines().get(0);
		assertEquals(3, first.getPrefs().get(MEMPH).getRating());
		assertEquals(2, first.getPrefs().get(NASH).getRating());
		assertEquals(1, first.getPrefs().get(CHAT).getRating());
		assertEquals(0, first.getPrefs().get(KNOX).getRating());
		assertEquals(Preference.Kind.RANK_AND_RATING, first.getPrefs().get(MEMPH).getKind());
	}

	@Test
	public void addRatings_ShouldFillMissingRatingsWithZero() throws AbifException {
		BallotModel model = parser.parse("2:A/5>B/3\n1:A>B", true);
		assertFalse(model.isRankingToRating());
		Voteline unrated = model.getVotelines().get(1);
		assertEquals(0, unrated.getPrefs().get("A").getRating());
		assertEquals(0, unrated.getPrefs().get("B").getRating());
	}

	@Test
	public void emptyInput_ShouldThrow() {
		AbifException ex = assertThrows(AbifException.class, () -> parser.parse("  \n "));
		assertEquals(AbifException.Errors.EMPTY_INPUT, ex.getError());
		ex = assertThrows(AbifException.class, () -> parser.parse(null));
		assertEquals(AbifException.Errors.EMPTY_INPUT, ex.getError());
	}

	@Test
	public void inputWithoutVotelines_ShouldThrow() {
		AbifException ex = assertThrows(AbifException.class, () -> parser.parse("# nothing to vote\n{title: \"No votes\"}\n=A:[Alice]\n"));
		assertEquals(AbifException.Errors.NO_VOTELINES, ex.getError());
		assertEquals(2, ex.getErrorCodeAsInt());
	}

	@Test
	public void unterminatedQuote_ShouldBeTolerated() throws AbifException {
		BallotModel model = parser.parse("3:A>\"New York");
		assertEquals(List.of("A", "New York"), model.getCandidateTokens());
		assertEquals(3, model.getBallotcount());
	}

	@Test
	public void strictQuoting_ShouldRejectUnterminatedQuote() {
		BallotModelBuilder builder = new BallotModelBuilder(Diagnostics.disabled(), true, false);
		AbifException ex = assertThrows(AbifException.class,
				() -> builder.addLine(LineClassifier.classify(7, "3:A>\"New York")));
		assertEquals(AbifException.Errors.UNTERMINATED_QUOTE, ex.getError());
		assertEquals("3:A>\"New York", ex.getOffendingValue());
	}

	@Test
	public void keepComments_ShouldCollectCommentsWithLineNumbers() throws AbifException {
		BallotModelBuilder builder = new BallotModelBuilder(Diagnostics.disabled(), false, true);
		builder.addLine(LineClassifier.classify(1, "# first"));
		builder.addLine(LineClassifier.classify(2, "5:A>B # second"));
		BallotModel model = builder.build(false, true);
		assertEquals(List.of(List.of(1, "# first"), List.of(2, "# second")), model.getMetadata().get(BallotModel.COMMENTS));
	}

	@Test
	public void contradictingRanks_ShouldFailRankInference() {
		LinkedHashMap<String, Preference> prefs = new LinkedHashMap<>();
		prefs.put("A", Preference.rated(5, 2, ","));
		prefs.put("B", Preference.rated(3, 1, null));
		AbifException ex = assertThrows(AbifException.class, () -> BallotModelBuilder.checkRanksMatchRatings(prefs));
		assertEquals(AbifException.Errors.RANK_INFERENCE_FAILED, ex.getError());
		assertTrue(ex.getError().isInternal());
	}
}
