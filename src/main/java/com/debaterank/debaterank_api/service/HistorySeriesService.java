package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.config.RatingProperties;
import com.debaterank.debaterank_api.exception.UnknownEntrantException;
import com.debaterank.debaterank_api.model.Entrant;
import com.debaterank.debaterank_api.model.MatchResult;
import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.model.RatingSnapshot;
import com.debaterank.debaterank_api.repository.EntrantRepository;
import com.debaterank.debaterank_api.repository.RatingEventRepository;
import com.debaterank.debaterank_api.repository.RatingSnapshotRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Rating-over-time series for charts.
 */
@Service
public class HistorySeriesService {

    private final EntrantRepository entrantRepository;
    private final RatingSnapshotRepository snapshotRepository;
    private final RatingEventRepository eventRepository;
    private final RatingProperties properties;

    public HistorySeriesService(EntrantRepository entrantRepository,
                                RatingSnapshotRepository snapshotRepository,
                                RatingEventRepository eventRepository,
                                RatingProperties properties) {
        this.entrantRepository = entrantRepository;
        this.snapshotRepository = snapshotRepository;
        this.eventRepository = eventRepository;
        this.properties = properties;
    }

    /**
     * Baseline point at registration, then the entrant's rating after each of
     * its ledger events. Lazy and restartable; ends at the ledger head as of
     * this call.
     */
    public Iterable<RatingPoint> series(Long entrantId) {
        Entrant entrant = entrantRepository.findById(entrantId)
                .orElseThrow(() -> new UnknownEntrantException(entrantId));
        return seriesOf(entrant, () -> {
            Map<Long, String> names = new HashMap<>();
            return id -> names.computeIfAbsent(id,
                    key -> entrantRepository.findById(key).map(Entrant::getName).orElse(null));
        });
    }

    /** Materialized series of every active entrant that has played at least once. */
    public List<EntrantSeries> allSeries() {
        List<Entrant> active = entrantRepository.findByActiveTrueOrderByIdAsc();
        Map<Long, RatingSnapshot> snapshots = snapshotRepository
                .findAllById(active.stream().map(Entrant::getId).toList()).stream()
                .collect(Collectors.toMap(RatingSnapshot::getEntrantId, Function.identity()));
        Map<Long, String> names = entrantRepository.findAll().stream()
                .collect(Collectors.toMap(Entrant::getId, Entrant::getName));

        List<EntrantSeries> result = new ArrayList<>();
        for (Entrant entrant : active) {
            RatingSnapshot snapshot = snapshots.get(entrant.getId());
            if (snapshot == null || snapshot.getLastEventId() == null) {
                continue;
            }
            List<RatingPoint> points = new ArrayList<>();
            seriesOf(entrant, () -> names::get).forEach(points::add);
            result.add(new EntrantSeries(entrant.getId(), entrant.getName(), entrant.getSlug(), points));
        }
        return result;
    }

    /** Each pass gets a fresh name lookup from {@code opponentNames}. */
    private Iterable<RatingPoint> seriesOf(Entrant entrant, Supplier<Function<Long, String>> opponentNames) {
        Long entrantId = entrant.getId();
        RatingPoint baseline = RatingPoint.baseline(entrant.getCreatedAt(), properties.getBaselineRating());
        LedgerCursor events = LedgerCursor.forEntrant(eventRepository, entrantId, null, properties.getLedgerPageSize());

        return () -> {
            Function<Long, String> names = opponentNames.get();
            return Stream.concat(
                    Stream.of(baseline),
                    StreamSupport.stream(events.spliterator(), false).map(e -> pointAfter(e, entrantId, names)))
                    .iterator();
        };
    }

    private static RatingPoint pointAfter(RatingEvent event, Long entrantId, Function<Long, String> names) {
        Long opponentId = event.opponentOf(entrantId);
        return new RatingPoint(event.getRecordedAt(), event.ratingAfterFor(entrantId),
                event.getDebateId(),
                event.isReversal() ? null : event.resultFor(entrantId),
                opponentId, names.apply(opponentId));
    }

    /**
     * One chart point. The baseline point has no debate; a reversal point
     * carries the reversed debate's id and a null result.
     */
    public record RatingPoint(Instant timestamp, int rating,
                              String debateId, MatchResult result,
                              Long opponentId, String opponentName) {

        static RatingPoint baseline(Instant registeredAt, int rating) {
            return new RatingPoint(registeredAt, rating, null, null, null, null);
        }
    }

    public record EntrantSeries(Long entrantId, String name, String slug, List<RatingPoint> points) {}
}
