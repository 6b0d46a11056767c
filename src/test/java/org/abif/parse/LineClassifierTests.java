package org.abif.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LineClassifierTests {

	@Test
	public void metadataLine() {
		AbifLine line = LineClassifier.classify(1, "{title: \"Tennessee capital\"}");
		assertEquals(LineType.METADATA, line.getType());
		assertEquals("title", line.getKey());
		assertEquals("Tennessee capital", line.getValue());
	}

	@Test
	public void metadataValues_ShouldBeTyped() {
		assertEquals(100, LineClassifier.classify(1, "{ballotcount: 100}").getValue());
		assertEquals(Boolean.TRUE, LineClassifier.parseMetadataValue("true"));
		assertEquals(3.5, LineClassifier.parseMetadataValue("3.5"));
		assertEquals(99999999999L, LineClassifier.parseMetadataValue("99999999999"));
		assertEquals("some text", LineClassifier.parseMetadataValue("some text"));
		assertEquals("it's", LineClassifier.parseMetadataValue("'it\\'s'"));
	}

	@Test
	public void escapedQuoteInMetadata_ShouldNotEndTheValue() {
		AbifLine line = LineClassifier.classify(1, "{title: \"He said \\\"hi # there\"}  # real comment");
		assertEquals(LineType.METADATA, line.getType());
		assertEquals("He said \"hi # there", line.getValue());
		assertEquals("# real comment", line.getComment());
	}

	@Test
	public void candidateLines() {
		AbifLine line = LineClassifier.classify(2, "=Memph:[Memphis, TN]");
		assertEquals(LineType.CANDIDATE, line.getType());
		assertEquals("Memph", line.getCandToken());
		assertEquals("Memphis, TN", line.getCandName());

		line = LineClassifier.classify(3, "=\"San Jose\":\"Boston [MA]\"");
		assertEquals("San Jose", line.getCandToken());
		assertEquals("Boston [MA]", line.getCandName());

		line = LineClassifier.classify(4, "=Knox:");
		assertEquals("Knox", line.getCandName(), "A candidate without name should be named by its token");
	}

	@Test
	public void votelineWithComment() {
		AbifLine line = LineClassifier.classify(5, "  42 : Memph>Nash   # Memphis first");
		assertEquals(LineType.VOTELINE, line.getType());
		assertEquals(42, line.getQty());
		assertEquals("Memph>Nash", line.getPrefstr());
		assertEquals("# Memphis first", line.getComment());
		assertNull(line.getVoterid());
	}

	@Test
	public void votelineWithVoterId() {
		AbifLine line = LineClassifier.classify(6, "1:A>B ##VID:voter-17");
		assertEquals(LineType.VOTELINE, line.getType());
		assertEquals("voter-17", line.getVoterid());
	}

	@Test
	public void blankCommentAndGarbage() {
		assertEquals(LineType.BLANK, LineClassifier.classify(1, "   ").getType());
		assertEquals(LineType.BLANK, LineClassifier.classify(1, null).getType());
		assertEquals(LineType.COMMENT, LineClassifier.classify(1, "# just a comment").getType());
		assertEquals(LineType.UNRECOGNIZED, LineClassifier.classify(1, "this is not ABIF").getType());
		assertEquals(LineType.UNRECOGNIZED, LineClassifier.classify(1, "-3:A>B").getType());
	}
}
