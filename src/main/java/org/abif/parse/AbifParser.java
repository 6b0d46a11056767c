package org.abif.parse;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.model.BallotModel;
import org.abif.util.AbifConfig;
import org.abif.util.AbifException;
import org.abif.util.Diagnostics;

/**
 * Parse ABIF text into the canonical {@link BallotModel}.
 *
 * Parsing errors are thrown immediately. A half built model is never returned.
 */
@Slf4j
@ApplicationScoped
public class AbifParser {

	@Inject
	AbifConfig config;

	@Inject
	Diagnostics diagnostics;

	/**
	 * Parse ABIF text. Ratings are synthesized from ranks when abif.add-ratings is enabled.
	 * @param abifText the full ABIF input
	 * @return a new ballot model
	 * @throws AbifException EMPTY_INPUT, NO_VOTELINES or (in strict mode) UNTERMINATED_QUOTE
	 */
	public BallotModel parse(String abifText) throws AbifException {
		return parse(abifText, config.addRatings());
	}

	/**
	 * Parse ABIF text
	 * @param abifText the full ABIF input
	 * @param addRatings synthesize ratings from ranks, e.g. to tally ranked ballots with Score or STAR
	 * @return a new ballot model
	 * @throws AbifException EMPTY_INPUT, NO_VOTELINES or (in strict mode) UNTERMINATED_QUOTE
	 */
	public BallotModel parse(String abifText, boolean addRatings) throws AbifException {
		if (abifText == null || abifText.isBlank())
			throw new AbifException(AbifException.Errors.EMPTY_INPUT, "Cannot parse empty ABIF input");
		long start = diagnostics.start();

		BallotModelBuilder builder = new BallotModelBuilder(diagnostics, config.strictQuoting(), config.keepComments());
		String[] lines = abifText.split("\\R", -1);
		for (int i = 0; i < lines.length; i++) {
			builder.addLine(LineClassifier.classify(i + 1, lines[i]));
		}
		BallotModel model = builder.build(addRatings, config.sortVotelines());

		diagnostics.elapsed("parse " + lines.length + " lines", start);
		log.debug("Parsed {}", model);
		return model;
	}
}
