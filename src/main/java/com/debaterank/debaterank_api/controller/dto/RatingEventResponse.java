package com.debaterank.debaterank_api.controller.dto;

import com.debaterank.debaterank_api.model.DebateOutcome;
import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.model.RatingEventKind;

import java.time.Instant;

public record RatingEventResponse(
        Long id,
        String debateId,
        RatingEventKind kind,
        Long reversesEventId,
        Long entrantAId,
        Long entrantBId,
        DebateOutcome outcome,
        int ratingABefore, int ratingAAfter, int deltaA,
        int ratingBBefore, int ratingBAfter, int deltaB,
        int kFactor,
        Instant recordedAt
) {
    public static RatingEventResponse from(RatingEvent e) {
        return new RatingEventResponse(
                e.getId(), e.getDebateId(), e.getKind(), e.getReversesEventId(),
                e.getEntrantAId(), e.getEntrantBId(), e.getOutcome(),
                e.getRatingABefore(), e.getRatingAAfter(), e.getDeltaA(),
                e.getRatingBBefore(), e.getRatingBAfter(), e.getDeltaB(),
                e.getKFactor(), e.getRecordedAt());
    }
}
