package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.config.RatingProperties;
import com.debaterank.debaterank_api.exception.InvariantViolationException;
import com.debaterank.debaterank_api.exception.RebuildInProgressException;
import com.debaterank.debaterank_api.exception.StandingsUnavailableException;
import com.debaterank.debaterank_api.exception.UnknownEntrantException;
import com.debaterank.debaterank_api.model.Entrant;
import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.model.RatingSnapshot;
import com.debaterank.debaterank_api.repository.EntrantRepository;
import com.debaterank.debaterank_api.repository.RatingEventRepository;
import com.debaterank.debaterank_api.repository.RatingSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Current-rating projection over the ledger.
 *
 * Flow for a new event (called inside the ledger's append transaction):
 * 1. Lock both snapshot rows (ordered by ID; a no-op when the caller holds them).
 * 2. Fold the event into each snapshot, which checks order and starting rating.
 * 3. JPA dirty checking writes the rows on commit.
 */
@Service
public class RatingStoreService {

    private static final Logger log = LoggerFactory.getLogger(RatingStoreService.class);

    private final RatingSnapshotRepository snapshotRepository;
    private final EntrantRepository entrantRepository;
    private final RatingEventRepository eventRepository;
    private final RatingProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final StandingsCache standingsCache;

    private final AtomicBoolean rebuilding = new AtomicBoolean(false);

    public RatingStoreService(RatingSnapshotRepository snapshotRepository,
                              EntrantRepository entrantRepository,
                              RatingEventRepository eventRepository,
                              RatingProperties properties,
                              TransactionTemplate transactionTemplate,
                              StandingsCache standingsCache) {
        this.snapshotRepository = snapshotRepository;
        this.entrantRepository = entrantRepository;
        this.eventRepository = eventRepository;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.standingsCache = standingsCache;
    }

    // =========================================================================
    // Reads
    // =========================================================================

    /**
     * Snapshot for an entrant; a baseline snapshot when nothing has been
     * recorded for it yet.
     */
    @Transactional(readOnly = true)
    public RatingSnapshot getCurrent(Long entrantId) {
        return snapshotRepository.findById(entrantId).orElseGet(() -> {
            if (!entrantRepository.existsById(entrantId)) {
                throw new UnknownEntrantException(entrantId);
            }
            return RatingSnapshot.baseline(entrantId, properties.getBaselineRating());
        });
    }

    public boolean isRebuilding() {
        return rebuilding.get();
    }

    /** Fails fast while a rebuild holds the projection. */
    public void assertAvailable() {
        if (rebuilding.get()) {
            throw new StandingsUnavailableException();
        }
    }

    // =========================================================================
    // Core: Apply one ledger event
    // =========================================================================

    @Transactional
    public void applyEvent(RatingEvent event) {
        List<Long> orderedIds = Stream.of(event.getEntrantAId(), event.getEntrantBId()).sorted().toList();
        List<RatingSnapshot> locked = snapshotRepository.findAllByIdWithLock(orderedIds);
        if (locked.size() != 2) {
            throw new InvariantViolationException(
                    "Missing rating snapshot for event " + event.getId() + " entrants " + orderedIds);
        }
        for (RatingSnapshot snapshot : locked) {
            snapshot.apply(event, properties.getRecentFormSize());
        }
        // JPA dirty checking handles the save
    }

    // =========================================================================
    // Rebuild & audit
    // =========================================================================

    /**
     * Resets every snapshot to baseline and re-folds the whole ledger. Each
     * event is replayed with the ratings and K it was recorded with, so a
     * changed k-factor only applies to events recorded after it. All
     * snapshot rows stay write-locked until commit, so ingestion waits; local
     * standings queries fail with StandingsUnavailable until it finishes.
     */
    public RebuildReport rebuildFromLedger() {
        if (!rebuilding.compareAndSet(false, true)) {
            throw new RebuildInProgressException();
        }
        long started = System.currentTimeMillis();
        try {
            RebuildReport report = Objects.requireNonNull(transactionTemplate.execute(status -> {
                Map<Long, RatingSnapshot> snapshots = new LinkedHashMap<>();
                for (RatingSnapshot snapshot : snapshotRepository.findAllWithLock()) {
                    snapshot.reset(properties.getBaselineRating());
                    snapshots.put(snapshot.getEntrantId(), snapshot);
                }
                for (Entrant entrant : entrantRepository.findAll()) {
                    snapshots.computeIfAbsent(entrant.getId(),
                            id -> RatingSnapshot.baseline(id, properties.getBaselineRating()));
                }

                long events = fold(snapshots);
                snapshotRepository.saveAll(snapshots.values());
                return new RebuildReport(snapshots.size(), events, System.currentTimeMillis() - started);
            }));
            log.info("Rebuilt {} rating snapshots from {} ledger events in {} ms",
                    report.entrants(), report.events(), report.durationMs());
            return report;
        } finally {
            standingsCache.evictAll();
            rebuilding.set(false);
        }
    }

    /**
     * Re-folds the ledger in memory and compares the result with the stored
     * snapshots without changing anything. The ledger pages and the snapshot
     * read share one database snapshot, so events committed mid-audit are
     * invisible to both.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public AuditReport audit() {
        Map<Long, RatingSnapshot> expected = new LinkedHashMap<>();
        for (Entrant entrant : entrantRepository.findAll()) {
            expected.put(entrant.getId(), RatingSnapshot.baseline(entrant.getId(), properties.getBaselineRating()));
        }
        long events = fold(expected);

        List<SnapshotDivergence> divergences = new ArrayList<>();
        Map<Long, RatingSnapshot> stored = new LinkedHashMap<>();
        snapshotRepository.findAll().forEach(s -> stored.put(s.getEntrantId(), s));

        for (RatingSnapshot want : expected.values()) {
            RatingSnapshot have = stored.get(want.getEntrantId());
            if (have == null) {
                divergences.add(new SnapshotDivergence(want.getEntrantId(), "snapshot", "present", "missing"));
                continue;
            }
            compare(divergences, want.getEntrantId(), "rating", want.getRating(), have.getRating());
            compare(divergences, want.getEntrantId(), "wins", want.getWins(), have.getWins());
            compare(divergences, want.getEntrantId(), "losses", want.getLosses(), have.getLosses());
            compare(divergences, want.getEntrantId(), "draws", want.getDraws(), have.getDraws());
            compare(divergences, want.getEntrantId(), "peakRating", want.getPeakRating(), have.getPeakRating());
            compare(divergences, want.getEntrantId(), "recentOutcomes", want.getRecentOutcomes(), have.getRecentOutcomes());
            compare(divergences, want.getEntrantId(), "lastEventId", want.getLastEventId(), have.getLastEventId());
        }

        if (!divergences.isEmpty()) {
            log.warn("Rating audit found {} divergences across {} entrants", divergences.size(), expected.size());
        }
        return new AuditReport(expected.size(), events, divergences);
    }

    private long fold(Map<Long, RatingSnapshot> snapshots) {
        long count = 0;
        for (RatingEvent event : LedgerCursor.all(eventRepository, properties.getLedgerPageSize())) {
            snapshotFor(snapshots, event.getEntrantAId()).apply(event, properties.getRecentFormSize());
            snapshotFor(snapshots, event.getEntrantBId()).apply(event, properties.getRecentFormSize());
            count++;
        }
        return count;
    }

    private RatingSnapshot snapshotFor(Map<Long, RatingSnapshot> snapshots, Long entrantId) {
        RatingSnapshot snapshot = snapshots.get(entrantId);
        if (snapshot == null) {
            throw new InvariantViolationException("Ledger references unregistered entrant " + entrantId);
        }
        return snapshot;
    }

    private void compare(List<SnapshotDivergence> out, Long entrantId, String field, Object expected, Object actual) {
        if (!Objects.equals(expected, actual)) {
            out.add(new SnapshotDivergence(entrantId, field, String.valueOf(expected), String.valueOf(actual)));
        }
    }

    // =========================================================================
    // Result DTOs
    // =========================================================================

    public record RebuildReport(int entrants, long events, long durationMs) {}

    public record SnapshotDivergence(Long entrantId, String field, String expected, String actual) {}

    public record AuditReport(int entrants, long events, List<SnapshotDivergence> divergences) {
        public boolean consistent() {
            return divergences.isEmpty();
        }
    }
}
