package org.abif.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies single lines of ABIF input.
 *
 * <pre>
 * # a comment
 * {title: "Tennessee capital"}
 * =Memph:[Memphis, TN]
 * 42:Memph>Nash>Chat>Knox   # a voteline with a comment
 * </pre>
 */
@Slf4j
public class LineClassifier {

	static final Pattern METADATA_REGEX  = Pattern.compile("^\\{\\s*[\"']?([\\w\\s\\-]+?)[\"']?\\s*:\\s*(.*?)\\s*}$");
	static final Pattern CANDLINE_REGEX  = Pattern.compile("^=\\s*(?:\"([^\"]*)\"|\\[([^\\]]*)]|([^:\\s]+))\\s*:\\s*(?:\\[([^\\]]*)]?|\"([^\"]*)\"?|(.*))$");
	static final Pattern VOTELINE_REGEX  = Pattern.compile("^(\\d{1,18})\\s*:(.*)$");
	static final Pattern VOTERID_REGEX   = Pattern.compile("##VID:(\\S+)");
	static final Pattern INTEGER_REGEX   = Pattern.compile("^-?\\d{1,18}$");
	static final Pattern DECIMAL_REGEX   = Pattern.compile("^-?\\d+\\.\\d+$");

	private static final ObjectMapper mapper = new ObjectMapper();

	private LineClassifier() {}

	/**
	 * Classify one line
	 * @param lineNum 1-based line number, only for reporting
	 * @param rawLine the line as read from the input
	 * @return the classified line
	 */
	public static AbifLine classify(int lineNum, String rawLine) {
		String line = rawLine == null ? "" : rawLine.strip();

		//----- split off the comment
		String comment = null;
		String voterid = null;
		int hash = PrefTokenizer.indexOfComment(line);
		if (hash >= 0) {
			comment = line.substring(hash).strip();
			line = line.substring(0, hash).strip();
			Matcher vid = VOTERID_REGEX.matcher(comment);
			if (vid.find()) voterid = vid.group(1);
		}

		AbifLine.AbifLineBuilder builder = AbifLine.builder()
				.lineNum(lineNum)
				.content(line)
				.comment(comment)
				.voterid(voterid);

		if (line.isEmpty()) {
			return builder.type(comment != null ? LineType.COMMENT : LineType.BLANK).build();
		}

		Matcher m;
		if ((m = CANDLINE_REGEX.matcher(line)).matches()) {
			String token = firstNonNull(m.group(1), m.group(2), m.group(3)).strip();
			String name = firstNonNull(m.group(4), m.group(5), m.group(6)).strip();
			if (name.isEmpty()) name = token;
			return builder.type(LineType.CANDIDATE).candToken(token).candName(name).build();
		}
		if ((m = METADATA_REGEX.matcher(line)).matches()) {
			return builder.type(LineType.METADATA)
					.key(m.group(1).strip())
					.value(parseMetadataValue(m.group(2)))
					.build();
		}
		if ((m = VOTELINE_REGEX.matcher(line)).matches()) {
			return builder.type(LineType.VOTELINE)
					.qty(Long.parseLong(m.group(1)))
					.prefstr(m.group(2).strip())
					.build();
		}
		return builder.type(LineType.UNRECOGNIZED).build();
	}

	/**
	 * Metadata values may be JSON-like: quoted strings (with JSON escapes), numbers and booleans. Anything else stays a plain string.
	 */
	static Object parseMetadataValue(String raw) {
		String val = raw.strip();
		if (val.length() >= 2) {
			char first = val.charAt(0);
			char last = val.charAt(val.length() - 1);
			if (first == '"' && last == '"') {
				try {
					return mapper.readValue(val, String.class);
				} catch (JsonProcessingException e) {
					log.debug("Metadata value {} is not a JSON string: {}", val, e.getOriginalMessage());
				}
			}
			if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
				return val.substring(1, val.length() - 1)
						.replace("\\" + first, String.valueOf(first))
						.replace("\\\\", "\\");
			}
		}
		if (val.equals("true")) return Boolean.TRUE;
		if (val.equals("false")) return Boolean.FALSE;
		if (INTEGER_REGEX.matcher(val).matches()) {
			long l = Long.parseLong(val);
			if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return (int) l;
			return l;
		}
		if (DECIMAL_REGEX.matcher(val).matches()) return Double.valueOf(val);
		return val;
	}

	private static String firstNonNull(String... values) {
		for (String v : values) {
			if (v != null) return v;
		}
		return "";
	}
}
