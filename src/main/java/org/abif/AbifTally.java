package org.abif;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.abif.util.AbifConfig;

@Slf4j
@ApplicationScoped
public class AbifTally {

	@Inject
	AbifConfig config;

	/**
	 * This is called when the app has started.
	 * Log the effective configuration, so that every tally can be reproduced.
	 */
	void onStart(@Observes StartupEvent ev) {
		LaunchMode launchMode = LaunchMode.current();
		log.info("============ STARTING ABIF TALLY in [{}] ============", launchMode);
		log.info("   add ratings     : {}", config.addRatings());
		log.info("   sort votelines  : {}", config.sortVotelines());
		log.info("   keep comments   : {}", config.keepComments());
		log.info("   strict quoting  : {}", config.strictQuoting());
		log.info("   IRV tie-break   : {}{}", config.irv().tieBreak(),
				config.irv().randomSeed().map(seed -> " (seed " + seed + ")").orElse(""));
		log.info("   IRV max branches: {}", config.irv().maxBranches());
		log.info("   IRV extras      : {}", config.irv().includeExtras());
		log.info("   viable fallback : {}", config.approval().maxViableFallback());
		log.info("   diagnostics     : {}", config.debug() ? "on" : "off");
		log.info("=====================================================");
	}
}
