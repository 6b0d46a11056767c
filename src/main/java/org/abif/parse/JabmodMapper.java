package org.abif.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.model.Voteline;
import org.abif.util.AbifException;

/**
 * Read and write the ballot model as JSON ("jabmod").
 */
@Slf4j
@ApplicationScoped
public class JabmodMapper {

	@Inject
	ObjectMapper mapper;

	public String toJson(BallotModel model) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(model);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize " + model, e);
		}
	}

	/**
	 * Serialize any tally result (or other POJO) to pretty JSON
	 */
	public String resultToJson(Object result) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize " + result.getClass().getSimpleName(), e);
		}
	}

	/**
	 * Read a ballot model from JSON.
	 * Candidates that are only used in votelines are added to the candidate registry
	 * and metadata.ballotcount is recomputed, just like when parsing ABIF.
	 * @param json a jabmod
	 * @return the ballot model
	 * @throws AbifException INVALID_JABMOD when the JSON cannot be read or has no votelines
	 */
	public BallotModel fromJson(String json) throws AbifException {
		if (json == null || json.isBlank())
			throw new AbifException(AbifException.Errors.EMPTY_INPUT, "Cannot read empty JSON");
		BallotModel model;
		try {
			model = mapper.readValue(json, BallotModel.class);
		} catch (JsonProcessingException e) {
			throw new AbifException(AbifException.Errors.INVALID_JABMOD, "Cannot read ballot model from JSON: " + e.getOriginalMessage(), e);
		}
		if (model.getVotelines() == null || model.getVotelines().isEmpty())
			throw new AbifException(AbifException.Errors.INVALID_JABMOD, "JSON ballot model has no votelines");
		for (Voteline vl : model.getVotelines()) {
			if (vl == null || vl.getPrefs() == null || vl.getQty() < 0)
				throw new AbifException(AbifException.Errors.INVALID_JABMOD, "Invalid voteline in JSON ballot model", String.valueOf(vl));
			vl.getPrefs().keySet().forEach(cand -> model.getCandidates().putIfAbsent(cand, cand));
		}
		model.getMetadata().put(BallotModel.BALLOTCOUNT, model.sumOfQty());
		log.debug("Read {} from JSON", model);
		return model;
	}
}
