package com.debaterank.debaterank_api.exception;

import com.debaterank.debaterank_api.controller.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps the rating engine's exceptions onto HTTP statuses with a uniform body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownEntrantException.class)
    public ResponseEntity<ApiError> handleUnknownEntrant(UnknownEntrantException e, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "UNKNOWN_ENTRANT", e.getMessage(), request);
    }

    @ExceptionHandler(RatingEventNotFoundException.class)
    public ResponseEntity<ApiError> handleEventNotFound(RatingEventNotFoundException e, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "EVENT_NOT_FOUND", e.getMessage(), request);
    }

    @ExceptionHandler(DuplicateEventException.class)
    public ResponseEntity<ApiError> handleDuplicate(DuplicateEventException e, HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "DUPLICATE_EVENT", e.getMessage(), request);
    }

    @ExceptionHandler(AlreadyReversedException.class)
    public ResponseEntity<ApiError> handleAlreadyReversed(AlreadyReversedException e, HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "ALREADY_REVERSED", e.getMessage(), request);
    }

    @ExceptionHandler(EventNotReversibleException.class)
    public ResponseEntity<ApiError> handleNotReversible(EventNotReversibleException e, HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "EVENT_NOT_REVERSIBLE", e.getMessage(), request);
    }

    @ExceptionHandler(RebuildInProgressException.class)
    public ResponseEntity<ApiError> handleRebuildInProgress(RebuildInProgressException e, HttpServletRequest request) {
        return error(HttpStatus.CONFLICT, "REBUILD_IN_PROGRESS", e.getMessage(), request);
    }

    @ExceptionHandler(StandingsUnavailableException.class)
    public ResponseEntity<ApiError> handleUnavailable(StandingsUnavailableException e, HttpServletRequest request) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STANDINGS_UNAVAILABLE", e.getMessage(), request);
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ApiError> handleInvariantViolation(InvariantViolationException e, HttpServletRequest request) {
        log.error("Invariant violation on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INVARIANT_VIOLATION", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e, HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message, request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParam(MissingServletRequestParameterException e, HttpServletRequest request) {
        String message = String.format("Missing required parameter: %s", e.getParameterName());
        return error(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER", message, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e, HttpServletRequest request) {
        String message = String.format("Invalid value for parameter '%s': %s", e.getName(), e.getValue());
        return error(HttpStatus.BAD_REQUEST, "INVALID_PARAMETER", message, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage(), request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Void> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.notFound().build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneral(Exception e, HttpServletRequest request) {
        log.error("Unexpected error on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", request);
    }

    private ResponseEntity<ApiError> error(HttpStatus status, String code, String message, HttpServletRequest request) {
        return ResponseEntity.status(status).body(new ApiError(code, message, request.getRequestURI()));
    }
}
