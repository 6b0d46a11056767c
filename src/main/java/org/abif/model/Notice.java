package org.abif.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.abif.util.Lson;

/**
 * A human-readable note attached to a tally result.
 * Every lossy conversion of the ballots (e.g. ranked to approval) must be reported with a notice.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Notice {

	public static final String NOTE = "note";

	@JsonProperty("notice_type")
	String noticeType = NOTE;

	@JsonProperty("short")
	String shortText;

	@JsonProperty("long")
	String longText;

	/** (optional) name of the conversion method, e.g. "favorite_viable_half" */
	String method;

	/** (optional) parameters of that method */
	Lson parameters;

	public static Notice note(String shortText) {
		return new Notice(NOTE, shortText, null, null, null);
	}

	public static Notice note(String shortText, String longText) {
		return new Notice(NOTE, shortText, longText, null, null);
	}
}
