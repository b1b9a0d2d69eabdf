package com.debaterank.debaterank_api.controller;

import com.debaterank.debaterank_api.controller.dto.EntrantResponse;
import com.debaterank.debaterank_api.controller.dto.RatingEventResponse;
import com.debaterank.debaterank_api.service.EntrantService;
import com.debaterank.debaterank_api.service.RatingLedgerService;
import com.debaterank.debaterank_api.service.RatingStoreService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final EntrantService entrantService;
    private final RatingLedgerService ledgerService;
    private final RatingStoreService ratingStore;

    public AdminController(EntrantService entrantService,
                           RatingLedgerService ledgerService,
                           RatingStoreService ratingStore) {
        this.entrantService = entrantService;
        this.ledgerService = ledgerService;
        this.ratingStore = ratingStore;
    }

    // =========================================================================
    // Entrants
    // =========================================================================

    @PostMapping("/entrants")
    public ResponseEntity<EntrantResponse> registerEntrant(@Valid @RequestBody RegisterEntrantRequest request) {
        EntrantResponse created = EntrantResponse.from(entrantService.register(request.name(), request.provider()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/entrants/{id}/deactivate")
    public ResponseEntity<EntrantResponse> deactivateEntrant(@PathVariable Long id) {
        return ResponseEntity.ok(EntrantResponse.from(entrantService.deactivate(id)));
    }

    // =========================================================================
    // Ledger maintenance
    // =========================================================================

    /**
     * POST /api/admin/events/{id}/reverse
     * Neutralizes a mistaken result with a compensating event.
     */
    @PostMapping("/events/{id}/reverse")
    public ResponseEntity<RatingEventResponse> reverseEvent(@PathVariable Long id) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RatingEventResponse.from(ledgerService.reverseEvent(id)));
    }

    @PostMapping("/ratings/rebuild")
    public ResponseEntity<RatingStoreService.RebuildReport> rebuildRatings() {
        return ResponseEntity.ok(ratingStore.rebuildFromLedger());
    }

    @GetMapping("/ratings/audit")
    public ResponseEntity<RatingStoreService.AuditReport> auditRatings() {
        return ResponseEntity.ok(ratingStore.audit());
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record RegisterEntrantRequest(
            @NotBlank @Size(max = 100) String name,
            @NotBlank @Size(max = 50) String provider
    ) {}
}
