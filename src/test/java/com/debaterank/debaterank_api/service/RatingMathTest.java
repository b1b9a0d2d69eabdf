package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.model.DebateOutcome;
import com.debaterank.util.ReferenceElo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.debaterank.util.TestFixtures.BASELINE;
import static com.debaterank.util.TestFixtures.K;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the pure rating formula. No Spring, no DB.
 */
class RatingMathTest {

    private static final int[] RATINGS = {800, 1100, 1400, 1500, 1516, 1650, 1900, 2400};

    // =========================================================================
    // Expected score
    // =========================================================================

    @Nested
    @DisplayName("Expected score")
    class ExpectedScore {

        @Test
        @DisplayName("equalRatings_giveEvenOdds")
        void equalRatings_giveEvenOdds() {
            assertEquals(0.5, RatingMath.expectedScore(BASELINE, BASELINE), 1e-12);
        }

        @Test
        @DisplayName("fourHundredPointGap_givesTenToOne")
        void fourHundredPointGap_givesTenToOne() {
            assertEquals(10.0 / 11.0, RatingMath.expectedScore(1900, 1500), 1e-12);
            assertEquals(1.0 / 11.0, RatingMath.expectedScore(1500, 1900), 1e-12);
        }

        @Test
        @DisplayName("bothSides_sumToOne")
        void bothSides_sumToOne() {
            for (int a : RATINGS) {
                for (int b : RATINGS) {
                    double sum = RatingMath.expectedScore(a, b) + RatingMath.expectedScore(b, a);
                    assertEquals(1.0, sum, 1e-12, a + " vs " + b);
                }
            }
        }
    }

    // =========================================================================
    // Single-side rating
    // =========================================================================

    @Nested
    @DisplayName("New rating")
    class NewRating {

        @Test
        @DisplayName("winBetweenEquals_movesHalfOfK")
        void winBetweenEquals_movesHalfOfK() {
            assertEquals(BASELINE + K / 2, RatingMath.newRating(BASELINE, BASELINE, 1.0, K));
            assertEquals(BASELINE - K / 2, RatingMath.newRating(BASELINE, BASELINE, 0.0, K));
            assertEquals(BASELINE, RatingMath.newRating(BASELINE, BASELINE, 0.5, K));
        }

        @Test
        @DisplayName("delta_isNewRatingMinusOld")
        void delta_isNewRatingMinusOld() {
            int after = RatingMath.newRating(1516, 1484, 1.0, K);
            assertEquals(after - 1516, RatingMath.delta(1516, 1484, 1.0, K));
        }

        @Test
        @DisplayName("noRatingFloor_lowRatingsKeepFalling")
        void noRatingFloor_lowRatingsKeepFalling() {
            assertTrue(RatingMath.newRating(50, 60, 0.0, K) < 50);
        }

        @Test
        @DisplayName("scoreOutsideWinDrawLoss_isRejected")
        void scoreOutsideWinDrawLoss_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> RatingMath.newRating(BASELINE, BASELINE, 0.7, K));
        }

        @Test
        @DisplayName("nonPositiveK_isRejected")
        void nonPositiveK_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> RatingMath.newRating(BASELINE, BASELINE, 1.0, 0));
        }
    }

    // =========================================================================
    // Both sides of a debate
    // =========================================================================

    @Nested
    @DisplayName("Debate outcome")
    class Outcome {

        @Test
        @DisplayName("freshPair_thenRepeatWin_matchesWorkedExample")
        void freshPair_thenRepeatWin_matchesWorkedExample() {
            RatingMath.RatingChange first = RatingMath.computeOutcome(1500, 1500, DebateOutcome.A_WINS, 32);
            assertEquals(1516, first.ratingAAfter());
            assertEquals(1484, first.ratingBAfter());

            RatingMath.RatingChange second = RatingMath.computeOutcome(
                    first.ratingAAfter(), first.ratingBAfter(), DebateOutcome.A_WINS, 32);
            assertEquals(1531, second.ratingAAfter());
            assertEquals(1469, second.ratingBAfter());
        }

        @Test
        @DisplayName("everyOutcome_isZeroSumAndBoundedByK")
        void everyOutcome_isZeroSumAndBoundedByK() {
            for (int a : RATINGS) {
                for (int b : RATINGS) {
                    for (DebateOutcome outcome : DebateOutcome.values()) {
                        RatingMath.RatingChange change = RatingMath.computeOutcome(a, b, outcome, K);
                        String label = a + " vs " + b + " " + outcome;
                        assertEquals(0, change.deltaA() + change.deltaB(), label);
                        assertTrue(Math.abs(change.deltaA()) <= K, label);
                        assertTrue(Math.abs(change.deltaB()) <= K, label);
                    }
                }
            }
        }

        @Test
        @DisplayName("bWins_mirrorsAWinsWithSidesSwapped")
        void bWins_mirrorsAWinsWithSidesSwapped() {
            RatingMath.RatingChange bWins = RatingMath.computeOutcome(1650, 1400, DebateOutcome.B_WINS, K);
            int[] reference = ReferenceElo.play(1650, 1400, 0.0, K);

            assertEquals(reference[0], bWins.ratingAAfter());
            assertEquals(reference[1], bWins.ratingBAfter());
            assertTrue(bWins.deltaB() > K / 2, "upset win should pay more than an even one");
        }

        @Test
        @DisplayName("oddK_halfPointChange_isTheSameInEitherSeat")
        void oddK_halfPointChange_isTheSameInEitherSeat() {
            int oddK = 33;
            RatingMath.RatingChange winnerSeatedA = RatingMath.computeOutcome(BASELINE, BASELINE, DebateOutcome.A_WINS, oddK);
            RatingMath.RatingChange winnerSeatedB = RatingMath.computeOutcome(BASELINE, BASELINE, DebateOutcome.B_WINS, oddK);

            assertEquals(17, winnerSeatedA.deltaA());
            assertEquals(winnerSeatedA.deltaA(), winnerSeatedB.deltaB());
            assertEquals(winnerSeatedA.deltaB(), winnerSeatedB.deltaA());
            assertEquals(RatingMath.newRating(BASELINE, BASELINE, 1.0, oddK), winnerSeatedB.ratingBAfter());
            assertEquals(RatingMath.newRating(BASELINE, BASELINE, 0.0, oddK), winnerSeatedA.ratingBAfter());
        }

        @Test
        @DisplayName("anyPairing_swappingSeatsMirrorsTheChange")
        void anyPairing_swappingSeatsMirrorsTheChange() {
            for (int k : new int[]{K, 33, 25}) {
                for (int a : RATINGS) {
                    for (int b : RATINGS) {
                        RatingMath.RatingChange forward = RatingMath.computeOutcome(a, b, DebateOutcome.A_WINS, k);
                        RatingMath.RatingChange swapped = RatingMath.computeOutcome(b, a, DebateOutcome.B_WINS, k);
                        String label = a + " vs " + b + " k=" + k;
                        assertEquals(forward.deltaA(), swapped.deltaB(), label);
                        assertEquals(forward.deltaB(), swapped.deltaA(), label);
                    }
                }
            }
        }

        @Test
        @DisplayName("drawBetweenUnequals_favoursTheUnderdog")
        void drawBetweenUnequals_favoursTheUnderdog() {
            RatingMath.RatingChange draw = RatingMath.computeOutcome(1900, 1500, DebateOutcome.DRAW, K);

            assertTrue(draw.deltaA() < 0);
            assertTrue(draw.deltaB() > 0);
        }

        @Test
        @DisplayName("sameInputs_giveSameOutput")
        void sameInputs_giveSameOutput() {
            RatingMath.RatingChange first = RatingMath.computeOutcome(1516, 1484, DebateOutcome.DRAW, K);
            RatingMath.RatingChange second = RatingMath.computeOutcome(1516, 1484, DebateOutcome.DRAW, K);
            assertEquals(first, second);
        }
    }
}
