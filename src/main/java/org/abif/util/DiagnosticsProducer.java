package org.abif.util;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Produces the one {@link Diagnostics} instance from abif.debug
 */
@ApplicationScoped
public class DiagnosticsProducer {

	@Inject
	AbifConfig config;

	@Produces
	@Singleton
	Diagnostics diagnostics() {
		return new Diagnostics(config.debug());
	}
}
