package com.debaterank.debaterank_api.repository;

import com.debaterank.debaterank_api.model.RatingSnapshot;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RatingSnapshotRepository extends JpaRepository<RatingSnapshot, Long> {

    // =========================================================================
    // Pessimistic locking for rating updates
    // =========================================================================

    /**
     * Load snapshots by entrant IDs with pessimistic write lock, ordered by ID ASC.
     * CRITICAL: Always pass IDs in ascending order to prevent deadlocks.
     */
    @Query("SELECT s FROM RatingSnapshot s WHERE s.entrantId IN :ids ORDER BY s.entrantId ASC")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000")})
    List<RatingSnapshot> findAllByIdWithLock(@Param("ids") List<Long> ids);

    /**
     * Every snapshot row, write-locked in ID order. Held for the whole rebuild
     * so no append can interleave with the re-fold.
     */
    @Query("SELECT s FROM RatingSnapshot s ORDER BY s.entrantId ASC")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "30000")})
    List<RatingSnapshot> findAllWithLock();
}
