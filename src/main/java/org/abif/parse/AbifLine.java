package org.abif.parse;

import lombok.Builder;
import lombok.Getter;

/**
 * One classified line of ABIF input. Only the fields that belong to its {@link LineType} are set.
 */
@Getter
@Builder
public class AbifLine {

	/** 1-based line number in the input */
	int lineNum;

	LineType type;

	/** the line without its comment, trimmed */
	String content;

	/** (optional) the comment including its leading "#" */
	String comment;

	/** (optional) voter id from a "##VID:" comment */
	String voterid;

	// METADATA
	String key;
	Object value;

	// CANDIDATE
	String candToken;
	String candName;

	// VOTELINE
	long qty;
	String prefstr;

	public boolean hasComment() {
		return comment != null && !comment.isEmpty();
	}

	@Override
	public String toString() {
		return "AbifLine[" + lineNum + ", " + type + ", '" + content + "'" + (hasComment() ? ", comment='" + comment + "'" : "") + "]";
	}
}
