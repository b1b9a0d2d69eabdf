package com.debaterank.debaterank_api.model;

import com.debaterank.debaterank_api.exception.InvariantViolationException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Current-rating projection for one entrant. Always equal to the fold of the
 * ledger events touching the entrant, so it can be thrown away and rebuilt.
 *
 * The recent-form window is stored as "eventId:W,eventId:L,..." oldest first.
 */
@Getter
@Entity
@Table(name = "rating_snapshots")
public class RatingSnapshot {

    @Id
    @Column(name = "entrant_id")
    private Long entrantId;

    @Column(nullable = false)
    private int rating;

    @Column(name = "peak_rating", nullable = false)
    private int peakRating;

    @Column(nullable = false)
    private int wins = 0;

    @Column(nullable = false)
    private int losses = 0;

    @Column(nullable = false)
    private int draws = 0;

    @Getter(AccessLevel.NONE)
    @Column(name = "recent_outcomes", nullable = false, columnDefinition = "text")
    private String recentOutcomeLog = "";

    @Column(name = "last_event_id")
    private Long lastEventId;

    @Column(name = "last_event_at")
    private Instant lastEventAt;

    protected RatingSnapshot() {}

    private RatingSnapshot(Long entrantId, int baselineRating) {
        this.entrantId = entrantId;
        reset(baselineRating);
    }

    public static RatingSnapshot baseline(Long entrantId, int baselineRating) {
        return new RatingSnapshot(entrantId, baselineRating);
    }

    /** Back to the state of an entrant with no events. */
    public void reset(int baselineRating) {
        this.rating = baselineRating;
        this.peakRating = baselineRating;
        this.wins = 0;
        this.losses = 0;
        this.draws = 0;
        this.recentOutcomeLog = "";
        this.lastEventId = null;
        this.lastEventAt = null;
    }

    public int getTotalDebates() { return wins + losses + draws; }
    public int getDecidedDebates() { return wins + losses; }

    // =========================================================================
    // Fold
    // =========================================================================

    /**
     * Folds one ledger event into this snapshot. Events must arrive exactly
     * once and in ledger order, and must start from the rating held here.
     *
     * @param windowSize capacity of the recent-form window
     */
    public void apply(RatingEvent event, int windowSize) {
        if (!event.involves(entrantId)) {
            throw new IllegalArgumentException(
                    "Event " + event.getId() + " does not involve entrant " + entrantId);
        }
        if (event.getId() == null) {
            throw new InvariantViolationException("Cannot apply an unsaved event to entrant " + entrantId);
        }
        if (lastEventId != null && event.getId() <= lastEventId) {
            throw new InvariantViolationException(String.format(
                    "Event %d is not newer than event %d already applied to entrant %d",
                    event.getId(), lastEventId, entrantId));
        }
        if (lastEventAt != null && event.getRecordedAt().isBefore(lastEventAt)) {
            throw new InvariantViolationException(String.format(
                    "Event %d at %s precedes the last event applied to entrant %d at %s",
                    event.getId(), event.getRecordedAt(), entrantId, lastEventAt));
        }
        int before = event.ratingBeforeFor(entrantId);
        if (before != rating) {
            throw new InvariantViolationException(String.format(
                    "Event %d starts entrant %d at %d but the snapshot holds %d",
                    event.getId(), entrantId, before, rating));
        }

        this.rating = event.ratingAfterFor(entrantId);
        this.peakRating = Math.max(peakRating, rating);

        MatchResult result = event.resultFor(entrantId);
        if (event.isReversal()) {
            withdraw(result, event);
            removeOutcome(event.getReversesEventId());
        } else {
            record(result);
            pushOutcome(new RecentOutcome(event.getId(), result), windowSize);
        }

        this.lastEventId = event.getId();
        this.lastEventAt = event.getRecordedAt();
    }

    private void record(MatchResult result) {
        switch (result) {
            case WIN -> wins++;
            case LOSS -> losses++;
            case DRAW -> draws++;
        }
    }

    private void withdraw(MatchResult result, RatingEvent reversal) {
        int remaining = switch (result) {
            case WIN -> --wins;
            case LOSS -> --losses;
            case DRAW -> --draws;
        };
        if (remaining < 0) {
            throw new InvariantViolationException(String.format(
                    "Reversal %d withdraws a %s entrant %d never had",
                    reversal.getId(), result, entrantId));
        }
    }

    // =========================================================================
    // Recent-form window
    // =========================================================================

    /** Window contents, oldest first. */
    public List<RecentOutcome> getRecentOutcomes() {
        List<RecentOutcome> outcomes = new ArrayList<>();
        if (recentOutcomeLog.isEmpty()) {
            return outcomes;
        }
        for (String token : recentOutcomeLog.split(",")) {
            outcomes.add(RecentOutcome.parse(token));
        }
        return outcomes;
    }

    /** Recent form as result letters, oldest first, e.g. "WWLDW". */
    public String getRecentForm() {
        return getRecentOutcomes().stream()
                .map(o -> String.valueOf(o.result().code()))
                .collect(Collectors.joining());
    }

    private void pushOutcome(RecentOutcome outcome, int windowSize) {
        List<RecentOutcome> outcomes = getRecentOutcomes();
        outcomes.add(outcome);
        while (outcomes.size() > windowSize) {
            outcomes.remove(0);
        }
        storeOutcomes(outcomes);
    }

    private void removeOutcome(Long eventId) {
        List<RecentOutcome> outcomes = getRecentOutcomes();
        if (outcomes.removeIf(o -> o.eventId().equals(eventId))) {
            storeOutcomes(outcomes);
        }
    }

    private void storeOutcomes(List<RecentOutcome> outcomes) {
        this.recentOutcomeLog = outcomes.stream()
                .map(RecentOutcome::encode)
                .collect(Collectors.joining(","));
    }
}
