package org.abif.parse;

/**
 * Type of a whole preference string, decided by the first delimiter outside of quotes and brackets.
 */
public enum PrefExprType {
	RANKED,   // first delimiter is ">" or "="
	RATED,    // first delimiter is ","
	SINGLE,   // one candidate without any delimiter
	EMPTY     // nothing at all, ie. a blank ballot
}
