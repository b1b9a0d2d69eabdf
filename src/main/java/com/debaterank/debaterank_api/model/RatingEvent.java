package com.debaterank.debaterank_api.model;

import com.debaterank.debaterank_api.exception.InvariantViolationException;
import com.debaterank.debaterank_api.service.RatingMath;
import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Ledger entry. One RESULT row per scored debate, plus one REVERSAL row for
 * each neutralized result. Rows are written once and never updated.
 */
@Getter
@Entity
@Immutable
@Table(name = "rating_events",
        uniqueConstraints = @UniqueConstraint(columnNames = {"debate_id", "kind"}))
public class RatingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "debate_id", nullable = false, length = 64, updatable = false)
    private String debateId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private RatingEventKind kind;

    @Column(name = "reverses_event_id", unique = true, updatable = false)
    private Long reversesEventId;

    @Column(name = "entrant_a_id", nullable = false, updatable = false)
    private Long entrantAId;

    @Column(name = "entrant_b_id", nullable = false, updatable = false)
    private Long entrantBId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16, updatable = false)
    private DebateOutcome outcome;

    @Column(name = "rating_a_before", nullable = false, updatable = false)
    private int ratingABefore;

    @Column(name = "rating_a_after", nullable = false, updatable = false)
    private int ratingAAfter;

    @Column(name = "rating_b_before", nullable = false, updatable = false)
    private int ratingBBefore;

    @Column(name = "rating_b_after", nullable = false, updatable = false)
    private int ratingBAfter;

    @Column(name = "k_factor", nullable = false, updatable = false)
    private int kFactor;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    protected RatingEvent() {}

    private RatingEvent(String debateId, RatingEventKind kind, Long reversesEventId,
                        Long entrantAId, Long entrantBId, DebateOutcome outcome,
                        int ratingABefore, int ratingAAfter, int ratingBBefore, int ratingBAfter,
                        int kFactor, Instant recordedAt) {
        this.debateId = debateId;
        this.kind = kind;
        this.reversesEventId = reversesEventId;
        this.entrantAId = entrantAId;
        this.entrantBId = entrantBId;
        this.outcome = outcome;
        this.ratingABefore = ratingABefore;
        this.ratingAAfter = ratingAAfter;
        this.ratingBBefore = ratingBBefore;
        this.ratingBAfter = ratingBAfter;
        this.kFactor = kFactor;
        this.recordedAt = recordedAt;
    }

    // =========================================================================
    // Factories
    // =========================================================================

    public static RatingEvent result(String debateId, Long entrantAId, Long entrantBId,
                                     DebateOutcome outcome, RatingMath.RatingChange change,
                                     int kFactor, Instant recordedAt) {
        return new RatingEvent(debateId, RatingEventKind.RESULT, null,
                entrantAId, entrantBId, outcome,
                change.ratingABefore(), change.ratingAAfter(),
                change.ratingBBefore(), change.ratingBAfter(),
                kFactor, recordedAt);
    }

    /**
     * Compensating event for {@code original}: same pair, same outcome, deltas
     * negated and applied on top of the entrants' current ratings.
     */
    public static RatingEvent reversal(RatingEvent original, int currentRatingA, int currentRatingB,
                                       Instant recordedAt) {
        return new RatingEvent(original.debateId, RatingEventKind.REVERSAL, original.id,
                original.entrantAId, original.entrantBId, original.outcome,
                currentRatingA, currentRatingA - original.getDeltaA(),
                currentRatingB, currentRatingB - original.getDeltaB(),
                original.kFactor, recordedAt);
    }

    // =========================================================================
    // Per-entrant views
    // =========================================================================

    public boolean isReversal() {
        return kind == RatingEventKind.REVERSAL;
    }

    public int getDeltaA() { return ratingAAfter - ratingABefore; }
    public int getDeltaB() { return ratingBAfter - ratingBBefore; }

    public boolean involves(Long entrantId) {
        return entrantAId.equals(entrantId) || entrantBId.equals(entrantId);
    }

    public Long opponentOf(Long entrantId) {
        return isSideA(entrantId) ? entrantBId : entrantAId;
    }

    public int ratingBeforeFor(Long entrantId) {
        return isSideA(entrantId) ? ratingABefore : ratingBBefore;
    }

    public int ratingAfterFor(Long entrantId) {
        return isSideA(entrantId) ? ratingAAfter : ratingBAfter;
    }

    public int deltaFor(Long entrantId) {
        return ratingAfterFor(entrantId) - ratingBeforeFor(entrantId);
    }

    /** Debate result for the entrant. For a reversal, the result being withdrawn. */
    public MatchResult resultFor(Long entrantId) {
        return isSideA(entrantId) ? outcome.resultForA() : outcome.resultForB();
    }

    private boolean isSideA(Long entrantId) {
        if (entrantAId.equals(entrantId)) return true;
        if (entrantBId.equals(entrantId)) return false;
        throw new IllegalArgumentException(
                "Entrant " + entrantId + " did not take part in event " + id);
    }

    // =========================================================================
    // Invariants
    // =========================================================================

    /**
     * Checks the numeric invariants every ledger row must hold before it is
     * persisted. Violations are never clamped.
     */
    public void verifyInvariants() {
        if (entrantAId.equals(entrantBId)) {
            throw new InvariantViolationException(
                    "Debate " + debateId + " pairs entrant " + entrantAId + " with itself");
        }
        if (getDeltaA() + getDeltaB() != 0) {
            throw new InvariantViolationException(String.format(
                    "Debate %s is not zero-sum: deltaA=%d deltaB=%d", debateId, getDeltaA(), getDeltaB()));
        }
        if (Math.abs(getDeltaA()) > kFactor || Math.abs(getDeltaB()) > kFactor) {
            throw new InvariantViolationException(String.format(
                    "Debate %s moves a rating by more than K=%d: deltaA=%d deltaB=%d",
                    debateId, kFactor, getDeltaA(), getDeltaB()));
        }
    }
}
