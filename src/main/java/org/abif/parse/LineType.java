package org.abif.parse;

public enum LineType {
	BLANK,          // empty or only whitespace
	COMMENT,        // nothing but a comment
	METADATA,       // {key: value}
	CANDIDATE,      // =token:[Display Name]
	VOTELINE,       // qty:prefs
	UNRECOGNIZED    // anything else. Ignored, but logged.
}
