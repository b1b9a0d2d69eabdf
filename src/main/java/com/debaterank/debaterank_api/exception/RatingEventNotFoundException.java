package com.debaterank.debaterank_api.exception;

public class RatingEventNotFoundException extends RuntimeException {

    public RatingEventNotFoundException(Long eventId) {
        super("Rating event not found: " + eventId);
    }

    public RatingEventNotFoundException(String debateId) {
        super("No rating event for debate: " + debateId);
    }
}
