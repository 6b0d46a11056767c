package org.abif.parse;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrefTokenizerTests {

	@Test
	public void rankedExpression() {
		PrefExpression expr = PrefTokenizer.tokenize("A > B=C");
		assertEquals(PrefExprType.RANKED, expr.getType());
		assertEquals(List.of(
				new PrefToken("A", null, ">", false),
				new PrefToken("B", null, "=", false),
				new PrefToken("C", null, null, false)), expr.getTokens());
		assertFalse(expr.isTruncated());
		assertFalse(expr.isMalformed());
	}

	@Test
	public void ratedExpression() {
		PrefExpression expr = PrefTokenizer.tokenize("A/5, B/3 ,C/0");
		assertEquals(PrefExprType.RATED, expr.getType());
		assertEquals(3, expr.getTokens().size());
		assertEquals(5, expr.getTokens().get(0).getRating());
		assertEquals(3, expr.getTokens().get(1).getRating());
		assertEquals(0, expr.getTokens().get(2).getRating());
		assertTrue(expr.hasAnyRating());
	}

	@Test
	public void singleCandidate() {
		PrefExpression expr = PrefTokenizer.tokenize("Memph");
		assertEquals(PrefExprType.SINGLE, expr.getType());
		assertEquals("Memph", expr.getTokens().get(0).getCand());
		assertNull(expr.getTokens().get(0).getDelim());
	}

	@Test
	public void emptyExpression() {
		assertEquals(PrefExprType.EMPTY, PrefTokenizer.tokenize("").getType());
		assertEquals(PrefExprType.EMPTY, PrefTokenizer.tokenize("   ").getType());
		assertTrue(PrefTokenizer.tokenize(null).isEmpty());
	}

	@Test
	public void delimitersInsideQuotes_ShouldBeIgnored() {
		PrefExpression expr = PrefTokenizer.tokenize("[New York, NY]>\"A=B\"/3");
		assertEquals(PrefExprType.RANKED, expr.getType());
		assertEquals("New York, NY", expr.getTokens().get(0).getCand());
		assertTrue(expr.getTokens().get(0).isQuoted());
		assertEquals("A=B", expr.getTokens().get(1).getCand());
		assertEquals(3, expr.getTokens().get(1).getRating());
	}

	@Test
	public void unicodeTokens_ShouldBeTolerated() {
		PrefExpression expr = PrefTokenizer.tokenize("Zürich>Genève");
		assertEquals(2, expr.getTokens().size());
		assertEquals("Zürich", expr.getTokens().get(0).getCand());
	}

	@Test
	public void unterminatedQuote_ShouldTruncateAndNotThrow() {
		PrefExpression expr = PrefTokenizer.tokenize("A>\"Unclosed > name");
		assertTrue(expr.isTruncated());
		assertEquals(2, expr.getTokens().size());
		assertEquals("Unclosed > name", expr.getTokens().get(1).getCand());
	}

	@Test
	public void unexpectedCharacter_ShouldStopTokenizing() {
		PrefExpression expr = PrefTokenizer.tokenize("A>B;C");
		assertTrue(expr.isMalformed());
		assertEquals(";C", expr.getUnparsed());
		assertEquals(2, expr.getTokens().size());
	}

	@Test
	public void ratingWithoutDigits_ShouldBeMalformed() {
		PrefExpression expr = PrefTokenizer.tokenize("A/x,B/2");
		assertTrue(expr.isMalformed());
		assertEquals(1, expr.getTokens().size());
		assertNull(expr.getTokens().get(0).getRating());
	}

	@Test
	public void classifyByFirstDelimiter() {
		assertEquals(PrefExprType.RATED, PrefTokenizer.classify("A/1,B/0>C"));
		assertEquals(PrefExprType.RANKED, PrefTokenizer.classify("A=B,C"));
		assertEquals(PrefExprType.SINGLE, PrefTokenizer.classify("[A,B]"));
	}

	@Test
	public void commentOutsideOfQuotes() {
		String line = "1:[A#1]>B # comment";
		assertEquals(line.indexOf(" # ") + 1, PrefTokenizer.indexOfComment(line));
		assertEquals(-1, PrefTokenizer.indexOfComment("1:\"#hashtag\""));
	}
}
