package com.debaterank.debaterank_api.model;

public enum RatingEventKind {
    /** Scores a finalized debate. At most one per debate id. */
    RESULT,
    /** Compensates an earlier RESULT event. At most one per reversed event. */
    REVERSAL
}
