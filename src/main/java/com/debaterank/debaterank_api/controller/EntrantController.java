package com.debaterank.debaterank_api.controller;

import com.debaterank.debaterank_api.config.RatingProperties;
import com.debaterank.debaterank_api.controller.dto.EntrantResponse;
import com.debaterank.debaterank_api.controller.dto.RatingEventResponse;
import com.debaterank.debaterank_api.controller.dto.RatingSnapshotResponse;
import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.service.EntrantService;
import com.debaterank.debaterank_api.service.HistorySeriesService;
import com.debaterank.debaterank_api.service.RatingLedgerService;
import com.debaterank.debaterank_api.service.RatingStoreService;
import com.debaterank.debaterank_api.service.StandingsService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api/entrants")
public class EntrantController {

    private final EntrantService entrantService;
    private final RatingStoreService ratingStore;
    private final RatingLedgerService ledgerService;
    private final StandingsService standingsService;
    private final HistorySeriesService historySeriesService;
    private final RatingProperties properties;

    public EntrantController(EntrantService entrantService,
                             RatingStoreService ratingStore,
                             RatingLedgerService ledgerService,
                             StandingsService standingsService,
                             HistorySeriesService historySeriesService,
                             RatingProperties properties) {
        this.entrantService = entrantService;
        this.ratingStore = ratingStore;
        this.ledgerService = ledgerService;
        this.standingsService = standingsService;
        this.historySeriesService = historySeriesService;
        this.properties = properties;
    }

    // =========================================================================
    // Profile
    // =========================================================================

    @GetMapping("/{id}")
    public ResponseEntity<EntrantResponse> getEntrant(@PathVariable Long id) {
        return ResponseEntity.ok(EntrantResponse.from(entrantService.getEntrant(id)));
    }

    @GetMapping("/by-slug/{slug}")
    public ResponseEntity<EntrantResponse> getEntrantBySlug(@PathVariable String slug) {
        return ResponseEntity.ok(EntrantResponse.from(entrantService.getBySlug(slug)));
    }

    @GetMapping("/{id}/rating")
    public ResponseEntity<RatingSnapshotResponse> getRating(@PathVariable Long id) {
        return ResponseEntity.ok(RatingSnapshotResponse.from(ratingStore.getCurrent(id)));
    }

    /**
     * GET /api/entrants/{id}/trend?window=10
     */
    @GetMapping("/{id}/trend")
    public ResponseEntity<TrendResponse> getTrend(
            @PathVariable Long id,
            @RequestParam(required = false) Integer window) {
        int size = window != null ? window : properties.getTrendWindow();
        return ResponseEntity.ok(new TrendResponse(id, size, standingsService.trend(id, size)));
    }

    // =========================================================================
    // History
    // =========================================================================

    @GetMapping("/{id}/history")
    public ResponseEntity<List<HistorySeriesService.RatingPoint>> getHistory(@PathVariable Long id) {
        List<HistorySeriesService.RatingPoint> points = new ArrayList<>();
        historySeriesService.series(id).forEach(points::add);
        return ResponseEntity.ok(points);
    }

    /**
     * GET /api/entrants/{id}/events?since=2025-01-01T00:00:00Z
     */
    @GetMapping("/{id}/events")
    public ResponseEntity<List<RatingEventResponse>> getEvents(
            @PathVariable Long id,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        List<RatingEventResponse> events = new ArrayList<>();
        for (RatingEvent event : ledgerService.listEvents(id, since)) {
            events.add(RatingEventResponse.from(event));
        }
        return ResponseEntity.ok(events);
    }

    @GetMapping("/{id}/head-to-head")
    public ResponseEntity<List<StandingsService.HeadToHeadRecord>> getHeadToHeadRecords(@PathVariable Long id) {
        return ResponseEntity.ok(standingsService.headToHeadRecords(id));
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record TrendResponse(Long entrantId, int window, int trend) {}
}
