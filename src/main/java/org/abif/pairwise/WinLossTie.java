package org.abif.pairwise;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pairwise record of one candidate against all others
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WinLossTie {
	int wins;
	int losses;
	int ties;

	/** Copeland score: one point per win and half a point per tie */
	public double getCopelandScore() {
		return wins + 0.5 * ties;
	}

	@Override
	public String toString() {
		return wins + "-" + losses + "-" + ties;
	}
}
