package com.debaterank.debaterank_api.controller.dto;

import com.debaterank.debaterank_api.model.RatingSnapshot;

import java.time.Instant;

public record RatingSnapshotResponse(
        Long entrantId,
        int rating,
        int peakRating,
        int wins,
        int losses,
        int draws,
        int totalDebates,
        String recentForm,
        Long lastEventId,
        Instant lastEventAt
) {
    public static RatingSnapshotResponse from(RatingSnapshot s) {
        return new RatingSnapshotResponse(
                s.getEntrantId(), s.getRating(), s.getPeakRating(),
                s.getWins(), s.getLosses(), s.getDraws(), s.getTotalDebates(),
                s.getRecentForm(), s.getLastEventId(), s.getLastEventAt());
    }
}
