package org.abif.parse;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.fptp.FptpResult;
import org.abif.fptp.FptpService;
import org.abif.model.BallotModel;
import org.abif.model.Preference;
import org.abif.util.AbifException;
import org.junit.jupiter.api.Test;

import static org.abif.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@QuarkusTest
public class JabmodMapperTests {

	@Inject
	AbifParser parser;

	@Inject
	JabmodMapper jabmodMapper;

	@Inject
	FptpService fptpService;

	@Test
	public void toJsonAndBack_ShouldGiveSameModel() throws AbifException {
		// GIVEN a parsed model
		BallotModel model = parser.parse(readTestdata(MIXED_FEATURES));

		// WHEN it is written as JSON and read again
		String json = jabmodMapper.toJson(model);
		log.debug("jabmod:\n{}", json);
		BallotModel fromJson = jabmodMapper.fromJson(json);

		// THEN nothing is lost
		assertEquals(model.getCandidates(), fromJson.getCandidates());
		assertEquals(model.getVotelines(), fromJson.getVotelines());
		assertEquals(model.getBallotcount(), fromJson.getBallotcount());
		assertEquals(model.getMetadata().get(BallotModel.TITLE), fromJson.getMetadata().get(BallotModel.TITLE));
	}

	@Test
	public void jsonFieldNames() throws AbifException {
		BallotModel model = parser.parse("3:A>B");
		String json = jabmodMapper.toJson(model);
		assertTrue(json.contains("\"nextdelim\" : \">\""), "Preferences should have a 'nextdelim'");
		assertTrue(json.contains("\"ballotcount\" : 3"));
		assertFalse(json.contains("kind"), "The kind of a preference is derived and not serialized");
	}

	@Test
	public void fromJson_ShouldRegisterCandidatesAndRecountBallots() throws AbifException {
		String json = "{ \"candidates\": {\"A\": \"Alice\"}, \"metadata\": {\"ballotcount\": 77}, \"votelines\": [" +
				"{\"qty\": 5, \"prefs\": {\"A\": {\"rank\": 1, \"nextdelim\": \">\"}, \"B\": {\"rank\": 2}}}," +
				"{\"qty\": 2, \"prefs\": {\"B\": {\"rating\": 4}}}" +
				"] }";
		BallotModel model = jabmodMapper.fromJson(json);
		assertEquals("Alice", model.getCandidateName("A"));
		assertEquals("B", model.getCandidateName("B"));
		assertEquals(7, model.getBallotcount());
		assertEquals(Preference.Kind.RATING_ONLY, model.getVotelines().get(1).getPrefs().get("B").getKind());
	}

	@Test
	public void invalidJson_ShouldThrow() {
		AbifException ex = assertThrows(AbifException.class, () -> jabmodMapper.fromJson("{ not json"));
		assertEquals(AbifException.Errors.INVALID_JABMOD, ex.getError());
		assertNotNull(ex.getCause());

		ex = assertThrows(AbifException.class, () -> jabmodMapper.fromJson("{\"candidates\": {}, \"votelines\": []}"));
		assertEquals(AbifException.Errors.INVALID_JABMOD, ex.getError());

		ex = assertThrows(AbifException.class, () -> jabmodMapper.fromJson(""));
		assertEquals(AbifException.Errors.EMPTY_INPUT, ex.getError());
	}

	@Test
	public void resultToJson_ShouldUseSnakeCase() throws AbifException {
		FptpResult result = fptpService.tally(parser.parse(readTestdata(TENNESSEE)));
		String json = jabmodMapper.resultToJson(result);
		assertTrue(json.contains("\"top_qty\" : 42"), json);
		assertTrue(json.contains("\"ballot_type\" : \"ranked\""), json);
		assertTrue(json.contains("\"notice_type\" : \"note\""), json);
	}
}
