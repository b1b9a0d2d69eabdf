package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.config.RatingProperties;
import com.debaterank.debaterank_api.exception.AlreadyReversedException;
import com.debaterank.debaterank_api.exception.DuplicateEventException;
import com.debaterank.debaterank_api.exception.EventNotReversibleException;
import com.debaterank.debaterank_api.exception.InvariantViolationException;
import com.debaterank.debaterank_api.exception.RatingEventNotFoundException;
import com.debaterank.debaterank_api.exception.UnknownEntrantException;
import com.debaterank.debaterank_api.model.DebateOutcome;
import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.model.RatingEventKind;
import com.debaterank.debaterank_api.model.RatingSnapshot;
import com.debaterank.debaterank_api.repository.EntrantRepository;
import com.debaterank.debaterank_api.repository.RatingEventRepository;
import com.debaterank.debaterank_api.repository.RatingSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only rating ledger.
 *
 * Flow for a finalized debate:
 * 1. Validate input and both entrants.
 * 2. Pessimistic lock both snapshot rows (ordered by ID to prevent deadlock).
 * 3. Reject a debate that already has a RESULT event.
 * 4. Compute before/after ratings with RatingMath and check the invariants.
 * 5. Insert the event and fold it into the snapshots, all in one transaction.
 * 6. Publish RatingEventRecorded for after-commit listeners.
 *
 * The transaction is driven through TransactionTemplate so a unique-key race
 * lost at insert time can be answered after rollback with the winning event.
 */
@Service
public class RatingLedgerService {

    private static final Logger log = LoggerFactory.getLogger(RatingLedgerService.class);

    private final EntrantRepository entrantRepository;
    private final RatingSnapshotRepository snapshotRepository;
    private final RatingEventRepository eventRepository;
    private final RatingStoreService ratingStore;
    private final RatingProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public RatingLedgerService(EntrantRepository entrantRepository,
                               RatingSnapshotRepository snapshotRepository,
                               RatingEventRepository eventRepository,
                               RatingStoreService ratingStore,
                               RatingProperties properties,
                               TransactionTemplate transactionTemplate,
                               ApplicationEventPublisher eventPublisher,
                               Clock clock) {
        this.entrantRepository = entrantRepository;
        this.snapshotRepository = snapshotRepository;
        this.eventRepository = eventRepository;
        this.ratingStore = ratingStore;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    // =========================================================================
    // Core: Record a finalized debate
    // =========================================================================

    public RatingEvent appendEvent(String debateId, Long entrantAId, Long entrantBId, DebateOutcome outcome) {
        validate(debateId, entrantAId, entrantBId, outcome);
        try {
            return transactionTemplate.execute(status -> doAppend(debateId, entrantAId, entrantBId, outcome));
        } catch (DataIntegrityViolationException e) {
            // Lost a race on uq (debate_id, kind); the winner is committed by now
            RatingEvent existing = eventRepository.findByDebateIdAndKind(debateId, RatingEventKind.RESULT)
                    .orElseThrow(() -> e);
            log.warn("Debate {} recorded concurrently as event {}", debateId, existing.getId());
            throw new DuplicateEventException(existing);
        }
    }

    private RatingEvent doAppend(String debateId, Long entrantAId, Long entrantBId, DebateOutcome outcome) {
        requireEntrants(entrantAId, entrantBId);

        LockedPair pair = lockSnapshots(entrantAId, entrantBId);

        eventRepository.findByDebateIdAndKind(debateId, RatingEventKind.RESULT).ifPresent(existing -> {
            log.warn("Duplicate result for debate {} ignored, already event {}", debateId, existing.getId());
            throw new DuplicateEventException(existing);
        });

        int k = properties.getKFactor();
        RatingMath.RatingChange change = RatingMath.computeOutcome(
                pair.a().getRating(), pair.b().getRating(), outcome, k);

        RatingEvent event = RatingEvent.result(debateId, entrantAId, entrantBId, outcome, change, k,
                nextTimestamp(pair));

        RatingEvent saved = persist(event);

        log.info("Recorded debate {} as event {}: entrant {} {} -> {}, entrant {} {} -> {}",
                debateId, saved.getId(),
                entrantAId, saved.getRatingABefore(), saved.getRatingAAfter(),
                entrantBId, saved.getRatingBBefore(), saved.getRatingBAfter());
        return saved;
    }

    // =========================================================================
    // Core: Neutralize a recorded result
    // =========================================================================

    /**
     * Appends a REVERSAL that undoes the original event's deltas on top of the
     * entrants' current ratings. The reversed debate cannot be scored again.
     */
    public RatingEvent reverseEvent(Long eventId) {
        try {
            return transactionTemplate.execute(status -> doReverse(eventId));
        } catch (DataIntegrityViolationException e) {
            // Lost a race on uq reverses_event_id
            log.warn("Event {} reversed concurrently", eventId);
            throw new AlreadyReversedException(eventId);
        }
    }

    private RatingEvent doReverse(Long eventId) {
        RatingEvent original = eventRepository.findById(eventId)
                .orElseThrow(() -> new RatingEventNotFoundException(eventId));
        if (original.isReversal()) {
            throw new EventNotReversibleException(eventId);
        }

        LockedPair pair = lockSnapshots(original.getEntrantAId(), original.getEntrantBId());

        if (eventRepository.existsByReversesEventId(eventId)) {
            throw new AlreadyReversedException(eventId);
        }

        RatingEvent reversal = RatingEvent.reversal(original,
                pair.a().getRating(), pair.b().getRating(), nextTimestamp(pair));

        RatingEvent saved = persist(reversal);

        log.info("Reversed event {} (debate {}) with event {}: entrant {} {} -> {}, entrant {} {} -> {}",
                eventId, original.getDebateId(), saved.getId(),
                saved.getEntrantAId(), saved.getRatingABefore(), saved.getRatingAAfter(),
                saved.getEntrantBId(), saved.getRatingBBefore(), saved.getRatingBAfter());
        return saved;
    }

    // =========================================================================
    // Reads
    // =========================================================================

    /**
     * Events touching an entrant in ledger order, optionally from
     * {@code since} on. Bounded by the ledger head at call time.
     */
    public Iterable<RatingEvent> listEvents(Long entrantId, Instant since) {
        if (!entrantRepository.existsById(entrantId)) {
            throw new UnknownEntrantException(entrantId);
        }
        return LedgerCursor.forEntrant(eventRepository, entrantId, since, properties.getLedgerPageSize());
    }

    @Transactional(readOnly = true)
    public RatingEvent getEvent(Long eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new RatingEventNotFoundException(eventId));
    }

    @Transactional(readOnly = true)
    public RatingEvent findByDebateId(String debateId) {
        return eventRepository.findByDebateIdAndKind(debateId, RatingEventKind.RESULT)
                .orElseThrow(() -> new RatingEventNotFoundException(debateId));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private void validate(String debateId, Long entrantAId, Long entrantBId, DebateOutcome outcome) {
        if (debateId == null || debateId.isBlank()) {
            throw new IllegalArgumentException("Debate id must not be blank");
        }
        if (entrantAId == null || entrantBId == null) {
            throw new IllegalArgumentException("Both entrant ids are required");
        }
        if (entrantAId.equals(entrantBId)) {
            throw new IllegalArgumentException("An entrant cannot debate itself: " + entrantAId);
        }
        if (outcome == null) {
            throw new IllegalArgumentException("Outcome is required");
        }
    }

    private void requireEntrants(Long entrantAId, Long entrantBId) {
        for (Long id : List.of(entrantAId, entrantBId)) {
            if (!entrantRepository.existsById(id)) {
                throw new UnknownEntrantException(id);
            }
        }
    }

    private LockedPair lockSnapshots(Long entrantAId, Long entrantBId) {
        List<Long> orderedIds = Stream.of(entrantAId, entrantBId).sorted().toList();
        List<RatingSnapshot> locked = snapshotRepository.findAllByIdWithLock(orderedIds);

        RatingSnapshot a = locked.stream()
                .filter(s -> s.getEntrantId().equals(entrantAId)).findFirst()
                .orElseThrow(() -> new InvariantViolationException("No rating snapshot for entrant " + entrantAId));
        RatingSnapshot b = locked.stream()
                .filter(s -> s.getEntrantId().equals(entrantBId)).findFirst()
                .orElseThrow(() -> new InvariantViolationException("No rating snapshot for entrant " + entrantBId));
        return new LockedPair(a, b);
    }

    /**
     * Clock time at microsecond precision (what the database keeps), never
     * earlier than either entrant's last event.
     */
    private Instant nextTimestamp(LockedPair pair) {
        Instant at = clock.instant().truncatedTo(ChronoUnit.MICROS);
        for (RatingSnapshot snapshot : List.of(pair.a(), pair.b())) {
            Instant last = snapshot.getLastEventAt();
            if (last != null && last.isAfter(at)) {
                at = last;
            }
        }
        return at;
    }

    private RatingEvent persist(RatingEvent event) {
        try {
            event.verifyInvariants();
        } catch (InvariantViolationException e) {
            log.error("Refusing to record debate {}: {}", event.getDebateId(), e.getMessage());
            throw e;
        }
        RatingEvent saved = eventRepository.save(event);
        ratingStore.applyEvent(saved);
        eventPublisher.publishEvent(new RatingEventRecorded(saved));
        return saved;
    }

    private record LockedPair(RatingSnapshot a, RatingSnapshot b) {}
}
