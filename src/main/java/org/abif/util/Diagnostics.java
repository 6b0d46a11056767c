package org.abif.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diagnostic trace of the parser and the tallies, e.g. timings of IRV rounds.
 *
 * This is not a global flag. One Diagnostics instance is produced from the configuration
 * (see {@link DiagnosticsProducer}) and injected into the services.
 * Tests may simply create their own with <pre>new Diagnostics(true)</pre>
 */
public class Diagnostics {

	public static final String LOGGER_NAME = "org.abif.diagnostics";

	private final boolean enabled;

	private final Logger logger;

	public Diagnostics(boolean enabled) {
		this(enabled, LoggerFactory.getLogger(LOGGER_NAME));
	}

	public Diagnostics(boolean enabled, Logger logger) {
		this.enabled = enabled;
		this.logger = logger;
	}

	public static Diagnostics disabled() {
		return new Diagnostics(false);
	}

	public boolean isEnabled() {
		return enabled;
	}

	public void trace(String format, Object... args) {
		if (enabled) logger.info(format, args);
	}

	/**
	 * Start a stopwatch. Pass the result to {@link #elapsed(String, long)}
	 * @return the current time in nanos, or 0 when diagnostics are disabled
	 */
	public long start() {
		return enabled ? System.nanoTime() : 0;
	}

	public void elapsed(String what, long startNanos) {
		if (!enabled) return;
		double secs = (System.nanoTime() - startNanos) / 1_000_000_000.0;
		logger.info("{}: {}s", what, String.format("%.4f", secs));
	}
}
