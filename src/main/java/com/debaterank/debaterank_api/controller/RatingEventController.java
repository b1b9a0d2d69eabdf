package com.debaterank.debaterank_api.controller;

import com.debaterank.debaterank_api.controller.dto.RatingEventResponse;
import com.debaterank.debaterank_api.exception.DuplicateEventException;
import com.debaterank.debaterank_api.model.DebateOutcome;
import com.debaterank.debaterank_api.model.RatingEvent;
import com.debaterank.debaterank_api.service.RatingLedgerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Intake for finalized debates. Delivery is at-least-once on the caller's
 * side, so a repeated debate id is answered with the event recorded the
 * first time instead of an error.
 */
@RestController
@RequestMapping("/api/ratings")
public class RatingEventController {

    private final RatingLedgerService ledgerService;

    public RatingEventController(RatingLedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    /**
     * POST /api/ratings/events
     * 201 with the new event, or 200 with duplicate=true and the existing one.
     */
    @PostMapping("/events")
    public ResponseEntity<RecordResultResponse> recordResult(@Valid @RequestBody RecordResultRequest request) {
        try {
            RatingEvent event = ledgerService.appendEvent(
                    request.debateId(), request.entrantAId(), request.entrantBId(), request.outcome());
            return ResponseEntity.status(HttpStatus.CREATED)
                    .body(new RecordResultResponse(RatingEventResponse.from(event), false));
        } catch (DuplicateEventException e) {
            return ResponseEntity.ok(new RecordResultResponse(RatingEventResponse.from(e.getExistingEvent()), true));
        }
    }

    @GetMapping("/events/{eventId}")
    public ResponseEntity<RatingEventResponse> getEvent(@PathVariable Long eventId) {
        return ResponseEntity.ok(RatingEventResponse.from(ledgerService.getEvent(eventId)));
    }

    @GetMapping("/debates/{debateId}")
    public ResponseEntity<RatingEventResponse> getEventForDebate(@PathVariable String debateId) {
        return ResponseEntity.ok(RatingEventResponse.from(ledgerService.findByDebateId(debateId)));
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record RecordResultRequest(
            @NotBlank @Size(max = 64) String debateId,
            @NotNull Long entrantAId,
            @NotNull Long entrantBId,
            @NotNull DebateOutcome outcome
    ) {}

    public record RecordResultResponse(RatingEventResponse event, boolean duplicate) {}
}
