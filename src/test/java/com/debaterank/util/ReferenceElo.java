package com.debaterank.util;

/**
 * Test-scoped re-statement of the rating formula, written independently of
 * production code. Tests compare production output against it.
 *
 *   E  = 1 / (1 + 10^((Rb - Ra) / 400))
 *   d   = sign(K * (S - E)) * round(|K * (S - E)|)
 *   Ra' = Ra + d,  Rb' = Rb - d
 */
public final class ReferenceElo {

    private ReferenceElo() {}

    /** Ratings after A scores {@code scoreA} against B: {newA, newB}. */
    public static int[] play(int ratingA, int ratingB, double scoreA, int k) {
        double expectedA = 1.0 / (1.0 + Math.pow(10.0, (ratingB - ratingA) / 400.0));
        double raw = k * (scoreA - expectedA);
        int deltaA = (int) (Math.signum(raw) * Math.round(Math.abs(raw)));
        return new int[]{ratingA + deltaA, ratingB - deltaA};
    }
}
