package com.debaterank.debaterank_api.model;

/**
 * Result of a finalized debate, expressed from the point of view of the
 * ordered pair (entrant A, entrant B) it was reported with.
 */
public enum DebateOutcome {
    A_WINS,
    B_WINS,
    DRAW;

    /** Actual score for entrant A: 1, 0 or 0.5. */
    public double scoreForA() {
        return switch (this) {
            case A_WINS -> 1.0;
            case B_WINS -> 0.0;
            case DRAW -> 0.5;
        };
    }

    public MatchResult resultForA() {
        return switch (this) {
            case A_WINS -> MatchResult.WIN;
            case B_WINS -> MatchResult.LOSS;
            case DRAW -> MatchResult.DRAW;
        };
    }

    public MatchResult resultForB() {
        return resultForA().opposite();
    }
}
