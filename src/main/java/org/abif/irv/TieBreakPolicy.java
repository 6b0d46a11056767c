package org.abif.irv;

/**
 * How IRV eliminates one of several candidates tied for last place,
 * when they cannot all be eliminated at once.
 */
public enum TieBreakPolicy {
	/** eliminate one of them at random (optionally seeded) */
	RANDOM,
	/** eliminate the candidate whose token sorts first */
	TOKEN
}
