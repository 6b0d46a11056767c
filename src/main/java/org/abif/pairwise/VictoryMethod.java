package org.abif.pairwise;

/** How the size of a pairwise victory is measured */
public enum VictoryMethod {
	WINNING_VOTES,   // votes of the winner
	MARGINS          // winner's votes minus loser's votes
}
