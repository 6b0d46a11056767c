package org.abif.util;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.abif.irv.TieBreakPolicy;

import java.util.Optional;

/**
 * ABIF parser and tally configuration from application.properties
 */
@ConfigMapping(prefix = "abif")
public interface AbifConfig {

		// log diagnostic timing and trace lines of parser and tallies
		@WithDefault("false")
		boolean debug();

		// synthesize ratings from ranks when parsing, e.g. for Score and STAR
		@WithDefault("false")
		boolean addRatings();

		// votelines sorted by descending qty. This is only for nicer output.
		@WithDefault("true")
		boolean sortVotelines();

		// collect all line comments into metadata.comments
		@WithDefault("false")
		boolean keepComments();

		// fail on an unterminated quote or bracket instead of tolerating it
		@WithDefault("false")
		boolean strictQuoting();

		Irv irv();
		interface Irv {
			@NotNull
			@WithDefault("random")
			TieBreakPolicy tieBreak();

			// (optional) seed for the random tie-break, so that a run can be reproduced
			Optional<Long> randomSeed();

			// upper bound of results returned when all tie-break outcomes are computed
			@Min(1)
			@WithDefault("64")
			int maxBranches();

			// record next choices and the pairwise preferences of eliminated candidates' supporters in every round
			@WithDefault("false")
			boolean includeExtras();
		}

		Approval approval();
		interface Approval {
			// number of viable candidates when the frontrunner does not even clear a majority quota
			@Min(1)
			@WithDefault("10")
			int maxViableFallback();
		}

		Fptp fptp();
		interface Fptp {
			// report overvoted and blank ballots in the "none" bucket
			@WithDefault("true")
			boolean countInvalid();
		}

}
