package com.debaterank.debaterank_api.repository;

import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.model.RatingEventKind;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RatingEventRepository extends JpaRepository<RatingEvent, Long> {

    // =========================================================================
    // Basic lookups
    // =========================================================================

    Optional<RatingEvent> findByDebateIdAndKind(String debateId, RatingEventKind kind);

    boolean existsByReversesEventId(Long reversedEventId);

    /** Highest event id written so far, 0 for an empty ledger. */
    @Query("SELECT COALESCE(MAX(e.id), 0) FROM RatingEvent e")
    long findHeadEventId();

    // =========================================================================
    // Keyset pages in ledger order (recordedAt, id)
    // =========================================================================

    /**
     * Next page of events touching an entrant, strictly after the
     * (afterTime, afterId) position and no newer than the head id.
     */
    @Query("""
        SELECT e FROM RatingEvent e
        WHERE (e.entrantAId = :entrantId OR e.entrantBId = :entrantId)
        AND e.id <= :headId
        AND (e.recordedAt > :afterTime OR (e.recordedAt = :afterTime AND e.id > :afterId))
        ORDER BY e.recordedAt ASC, e.id ASC
        """)
    List<RatingEvent> findPageForEntrant(@Param("entrantId") Long entrantId,
                                         @Param("headId") long headId,
                                         @Param("afterTime") Instant afterTime,
                                         @Param("afterId") long afterId,
                                         Pageable pageable);

    /** Next page of the whole ledger. */
    @Query("""
        SELECT e FROM RatingEvent e
        WHERE e.id <= :headId
        AND (e.recordedAt > :afterTime OR (e.recordedAt = :afterTime AND e.id > :afterId))
        ORDER BY e.recordedAt ASC, e.id ASC
        """)
    List<RatingEvent> findPage(@Param("headId") long headId,
                               @Param("afterTime") Instant afterTime,
                               @Param("afterId") long afterId,
                               Pageable pageable);

    // =========================================================================
    // Derived views
    // =========================================================================

    /** Most recent events touching an entrant, newest first. */
    @Query("""
        SELECT e FROM RatingEvent e
        WHERE e.entrantAId = :entrantId OR e.entrantBId = :entrantId
        ORDER BY e.recordedAt DESC, e.id DESC
        """)
    List<RatingEvent> findLatestForEntrant(@Param("entrantId") Long entrantId, Pageable pageable);

    /** Every event between two entrants, in either seating, ledger order. */
    @Query("""
        SELECT e FROM RatingEvent e
        WHERE (e.entrantAId = :a AND e.entrantBId = :b)
        OR (e.entrantAId = :b AND e.entrantBId = :a)
        ORDER BY e.recordedAt ASC, e.id ASC
        """)
    List<RatingEvent> findBetween(@Param("a") Long entrantA, @Param("b") Long entrantB);

    @Query("""
        SELECT e FROM RatingEvent e
        WHERE e.entrantAId = :entrantId OR e.entrantBId = :entrantId
        ORDER BY e.recordedAt ASC, e.id ASC
        """)
    List<RatingEvent> findAllForEntrant(@Param("entrantId") Long entrantId);
}
