package com.debaterank.debaterank_api.controller;

import com.debaterank.debaterank_api.service.HistorySeriesService;
import com.debaterank.debaterank_api.service.StandingsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class StandingsController {

    private final StandingsService standingsService;
    private final HistorySeriesService historySeriesService;

    public StandingsController(StandingsService standingsService,
                               HistorySeriesService historySeriesService) {
        this.standingsService = standingsService;
        this.historySeriesService = historySeriesService;
    }

    // =========================================================================
    // Leaderboard
    // =========================================================================

    /**
     * GET /api/standings?limit=100
     */
    @GetMapping("/standings")
    public ResponseEntity<StandingsResponse> getStandings(
            @RequestParam(defaultValue = "100") int limit) {

        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        List<StandingsService.Standing> all = standingsService.rankedStandings();
        List<StandingsService.Standing> page = all.subList(0, Math.min(limit, all.size()));
        return ResponseEntity.ok(new StandingsResponse(page, all.size()));
    }

    /**
     * GET /api/standings/history
     * Rating series of every active entrant that has debated, for the standings chart.
     */
    @GetMapping("/standings/history")
    public ResponseEntity<List<HistorySeriesService.EntrantSeries>> getStandingsHistory() {
        return ResponseEntity.ok(historySeriesService.allSeries());
    }

    // =========================================================================
    // Pairwise views
    // =========================================================================

    /**
     * GET /api/head-to-head?a=1&b=2
     */
    @GetMapping("/head-to-head")
    public ResponseEntity<StandingsService.HeadToHeadRecord> getHeadToHead(
            @RequestParam Long a, @RequestParam Long b) {
        return ResponseEntity.ok(standingsService.headToHead(a, b));
    }

    /**
     * GET /api/matchup?a=1&b=2
     */
    @GetMapping("/matchup")
    public ResponseEntity<StandingsService.Matchup> getMatchup(
            @RequestParam Long a, @RequestParam Long b) {
        return ResponseEntity.ok(standingsService.matchup(a, b));
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record StandingsResponse(List<StandingsService.Standing> standings, int totalEntrants) {}
}
