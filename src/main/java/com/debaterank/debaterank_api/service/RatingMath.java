package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.model.DebateOutcome;

/**
 * Pure Elo calculation utility. Stateless, no dependencies.
 *
 * Formula:
 *   Expected score:  E = 1 / (1 + 10^((opponentRating - rating) / 400))
 *   New rating:      R' = R + sign(K * (S - E)) * round(|K * (S - E)|)
 *
 * The change is rounded by magnitude, so a .5 change moves both sides by the
 * same amount whichever seat an entrant takes.
 *
 * K is a single process-wide constant (debaterank.rating.k-factor). There is
 * no rating floor: a floor would break zero-sum conservation.
 */
public final class RatingMath {

    private RatingMath() {}

    // =========================================================================
    // Expected Score
    // =========================================================================

    /**
     * Expected score (probability of winning) for a rating against an opponent.
     * Strictly between 0.0 and 1.0 for realistic rating gaps.
     */
    public static double expectedScore(int rating, int opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - rating) / 400.0));
    }

    // =========================================================================
    // Rating Calculation
    // =========================================================================

    /**
     * @param actualScore 1 for a win, 0.5 for a draw, 0 for a loss
     */
    public static int newRating(int rating, int opponentRating, double actualScore, int kFactor) {
        requireScore(actualScore);
        requireK(kFactor);
        return rating + roundedChange(kFactor * (actualScore - expectedScore(rating, opponentRating)));
    }

    public static int delta(int rating, int opponentRating, double actualScore, int kFactor) {
        return newRating(rating, opponentRating, actualScore, kFactor) - rating;
    }

    /**
     * Both sides of one debate. B's change is the exact negation of A's, so
     * the pair is zero-sum even where two separate roundings would drift.
     */
    public static RatingChange computeOutcome(int ratingA, int ratingB, DebateOutcome outcome, int kFactor) {
        int deltaA = delta(ratingA, ratingB, outcome.scoreForA(), kFactor);
        return new RatingChange(ratingA, ratingA + deltaA, ratingB, ratingB - deltaA);
    }

    private static int roundedChange(double raw) {
        int magnitude = (int) Math.round(Math.abs(raw));
        return raw < 0 ? -magnitude : magnitude;
    }

    private static void requireScore(double actualScore) {
        if (actualScore != 0.0 && actualScore != 0.5 && actualScore != 1.0) {
            throw new IllegalArgumentException("Actual score must be 0, 0.5 or 1 but was " + actualScore);
        }
    }

    private static void requireK(int kFactor) {
        if (kFactor <= 0) {
            throw new IllegalArgumentException("K-factor must be positive but was " + kFactor);
        }
    }

    // =========================================================================
    // Result DTO
    // =========================================================================

    public record RatingChange(int ratingABefore, int ratingAAfter, int ratingBBefore, int ratingBAfter) {
        public int deltaA() { return ratingAAfter - ratingABefore; }
        public int deltaB() { return ratingBAfter - ratingBBefore; }
    }
}
