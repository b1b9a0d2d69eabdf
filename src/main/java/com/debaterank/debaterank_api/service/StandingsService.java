package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.config.RatingProperties;
import com.debaterank.debaterank_api.exception.UnknownEntrantException;
import com.debaterank.debaterank_api.model.Entrant;
import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.model.RatingSnapshot;
import com.debaterank.debaterank_api.repository.EntrantRepository;
import com.debaterank.debaterank_api.repository.RatingEventRepository;
import com.debaterank.debaterank_api.repository.RatingSnapshotRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-side views over the snapshots and the ledger: ranked standings,
 * trends, head-to-head records and matchup odds. Every query runs in one
 * read-only REPEATABLE_READ transaction, so it sees whole events or nothing.
 */
@Service
public class StandingsService {

    /** Rating desc, then fewer debates, then lower entrant id. */
    static final Comparator<RatingSnapshot> RANKING = Comparator
            .comparingInt(RatingSnapshot::getRating).reversed()
            .thenComparingInt(RatingSnapshot::getTotalDebates)
            .thenComparing(RatingSnapshot::getEntrantId);

    private static final Comparator<HeadToHeadRecord> RECORD_ORDER = Comparator
            .comparingInt(HeadToHeadRecord::totalGames).reversed()
            .thenComparing(Comparator.comparingDouble(HeadToHeadRecord::winRate).reversed())
            .thenComparing(HeadToHeadRecord::opponentId);

    private final EntrantRepository entrantRepository;
    private final RatingSnapshotRepository snapshotRepository;
    private final RatingEventRepository eventRepository;
    private final RatingStoreService ratingStore;
    private final StandingsCache standingsCache;
    private final RatingProperties properties;

    public StandingsService(EntrantRepository entrantRepository,
                            RatingSnapshotRepository snapshotRepository,
                            RatingEventRepository eventRepository,
                            RatingStoreService ratingStore,
                            StandingsCache standingsCache,
                            RatingProperties properties) {
        this.entrantRepository = entrantRepository;
        this.snapshotRepository = snapshotRepository;
        this.eventRepository = eventRepository;
        this.ratingStore = ratingStore;
        this.standingsCache = standingsCache;
        this.properties = properties;
    }

    // =========================================================================
    // Ranked standings
    // =========================================================================

    /**
     * All active entrants, best first. Ranks are 1..n with no shared places.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<Standing> rankedStandings() {
        ratingStore.assertAvailable();

        String version = dataVersion();
        Optional<List<Standing>> cached = standingsCache.get(version);
        if (cached.isPresent()) {
            return cached.get();
        }

        List<Standing> standings = computeStandings();
        standingsCache.put(version, standings);
        return standings;
    }

    /**
     * "head:eventCount:maxEntrantId:inactiveCount". Event ids are assigned at
     * insert, not commit, so the head alone can stand still while a lower id
     * commits late; the count read in the same snapshot moves with it.
     * Entrants are only ever added or deactivated, so the last two parts only
     * grow.
     */
    String dataVersion() {
        return eventRepository.findHeadEventId() + ":"
                + eventRepository.count() + ":"
                + entrantRepository.findMaxId() + ":"
                + entrantRepository.countByActiveFalse();
    }

    private List<Standing> computeStandings() {
        List<Entrant> active = entrantRepository.findByActiveTrueOrderByIdAsc();
        Map<Long, Entrant> entrantsById = active.stream()
                .collect(Collectors.toMap(Entrant::getId, Function.identity()));
        Map<Long, RatingSnapshot> snapshotsById = snapshotRepository.findAllById(entrantsById.keySet()).stream()
                .collect(Collectors.toMap(RatingSnapshot::getEntrantId, Function.identity()));

        List<RatingSnapshot> ordered = active.stream()
                .map(e -> snapshotsById.getOrDefault(e.getId(),
                        RatingSnapshot.baseline(e.getId(), properties.getBaselineRating())))
                .sorted(RANKING)
                .toList();

        List<Standing> standings = new ArrayList<>(ordered.size());
        int rank = 1;
        for (RatingSnapshot snapshot : ordered) {
            Entrant entrant = entrantsById.get(snapshot.getEntrantId());
            standings.add(new Standing(
                    rank++,
                    entrant.getId(), entrant.getName(), entrant.getProvider(), entrant.getSlug(),
                    snapshot.getRating(), snapshot.getPeakRating(),
                    snapshot.getWins(), snapshot.getLosses(), snapshot.getDraws(), snapshot.getTotalDebates(),
                    winRatePercent(snapshot),
                    snapshot.getRecentForm(),
                    sumLatestDeltas(entrant.getId(), properties.getTrendWindow()),
                    snapshot.getLastEventAt()));
        }
        return standings;
    }

    /** Win percentage to one decimal, null with no decided debates. */
    static Double winRatePercent(RatingSnapshot snapshot) {
        int decided = snapshot.getDecidedDebates();
        if (decided == 0) {
            return null;
        }
        return Math.round(snapshot.getWins() * 1000.0 / decided) / 10.0;
    }

    // =========================================================================
    // Trend
    // =========================================================================

    /**
     * Net rating change over the entrant's last {@code windowSize} ledger
     * events. Shorter histories are summed as they are; none gives 0.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public int trend(Long entrantId, int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Trend window must be positive but was " + windowSize);
        }
        requireEntrant(entrantId);
        return sumLatestDeltas(entrantId, windowSize);
    }

    private int sumLatestDeltas(Long entrantId, int windowSize) {
        return eventRepository.findLatestForEntrant(entrantId, PageRequest.of(0, windowSize)).stream()
                .mapToInt(e -> e.deltaFor(entrantId))
                .sum();
    }

    // =========================================================================
    // Head-to-head
    // =========================================================================

    /**
     * Record of {@code entrantId} against {@code opponentId}. Reversed results
     * and their reversals are left out.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public HeadToHeadRecord headToHead(Long entrantId, Long opponentId) {
        if (entrantId.equals(opponentId)) {
            throw new IllegalArgumentException("Head-to-head needs two different entrants");
        }
        requireEntrant(entrantId);
        Entrant opponent = requireEntrant(opponentId);
        int opponentRating = ratingStore.getCurrent(opponentId).getRating();
        return tally(entrantId, opponent, opponentRating,
                standingResults(eventRepository.findBetween(entrantId, opponentId)));
    }

    /**
     * One record per opponent faced: most games first, then best win rate,
     * then opponent id.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<HeadToHeadRecord> headToHeadRecords(Long entrantId) {
        requireEntrant(entrantId);

        Map<Long, List<RatingEvent>> byOpponent = new LinkedHashMap<>();
        for (RatingEvent event : standingResults(eventRepository.findAllForEntrant(entrantId))) {
            byOpponent.computeIfAbsent(event.opponentOf(entrantId), id -> new ArrayList<>()).add(event);
        }

        Map<Long, Entrant> opponents = entrantRepository.findAllById(byOpponent.keySet()).stream()
                .collect(Collectors.toMap(Entrant::getId, Function.identity()));
        Map<Long, Integer> opponentRatings = snapshotRepository.findAllById(byOpponent.keySet()).stream()
                .collect(Collectors.toMap(RatingSnapshot::getEntrantId, RatingSnapshot::getRating));

        return byOpponent.entrySet().stream()
                .map(entry -> tally(entrantId, opponents.get(entry.getKey()),
                        opponentRatings.getOrDefault(entry.getKey(), properties.getBaselineRating()),
                        entry.getValue()))
                .sorted(RECORD_ORDER)
                .toList();
    }

    /** RESULT events that have not been reversed. */
    static List<RatingEvent> standingResults(List<RatingEvent> events) {
        Set<Long> reversed = events.stream()
                .filter(RatingEvent::isReversal)
                .map(RatingEvent::getReversesEventId)
                .collect(Collectors.toSet());
        return events.stream()
                .filter(e -> !e.isReversal() && !reversed.contains(e.getId()))
                .toList();
    }

    private HeadToHeadRecord tally(Long entrantId, Entrant opponent, int opponentRating, List<RatingEvent> events) {
        int wins = 0, losses = 0, draws = 0, net = 0;
        for (RatingEvent event : events) {
            switch (event.resultFor(entrantId)) {
                case WIN -> wins++;
                case LOSS -> losses++;
                case DRAW -> draws++;
            }
            net += event.deltaFor(entrantId);
        }
        int decided = wins + losses;
        double winRate = decided == 0 ? 0.0 : (double) wins / decided;
        return new HeadToHeadRecord(entrantId,
                opponent.getId(), opponent.getName(), opponent.getProvider(), opponent.getSlug(), opponentRating,
                wins, losses, draws, wins + losses + draws, winRate, net);
    }

    // =========================================================================
    // Matchup
    // =========================================================================

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Matchup matchup(Long entrantAId, Long entrantBId) {
        if (entrantAId.equals(entrantBId)) {
            throw new IllegalArgumentException("A matchup needs two different entrants");
        }
        int ratingA = ratingStore.getCurrent(entrantAId).getRating();
        int ratingB = ratingStore.getCurrent(entrantBId).getRating();
        return new Matchup(entrantAId, entrantBId, ratingA, ratingB,
                RatingMath.expectedScore(ratingA, ratingB),
                RatingMath.expectedScore(ratingB, ratingA));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private Entrant requireEntrant(Long entrantId) {
        return entrantRepository.findById(entrantId)
                .orElseThrow(() -> new UnknownEntrantException(entrantId));
    }

    // =========================================================================
    // Result DTOs
    // =========================================================================

    public record Standing(
            int rank,
            Long entrantId, String name, String provider, String slug,
            int rating, int peakRating,
            int wins, int losses, int draws, int totalDebates,
            Double winRatePercent,
            String recentForm,
            int trend,
            Instant lastEventAt
    ) {}

    /**
     * From {@code entrantId}'s side. winRate is wins / (wins + losses), draws
     * left out. opponentRating is the opponent's current rating.
     */
    public record HeadToHeadRecord(
            Long entrantId,
            Long opponentId, String opponentName, String opponentProvider, String opponentSlug,
            int opponentRating,
            int wins, int losses, int draws, int totalGames,
            double winRate,
            int netRatingChange
    ) {}

    public record Matchup(
            Long entrantAId, Long entrantBId,
            int ratingA, int ratingB,
            double winProbabilityA, double winProbabilityB
    ) {}
}
