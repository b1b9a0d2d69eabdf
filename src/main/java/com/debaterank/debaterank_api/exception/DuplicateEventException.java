package com.debaterank.debaterank_api.exception;

import com.debaterank.debaterank_api.model.RatingEvent;

/**
 * The debate has already been scored. Carries the event recorded the first
 * time so repeat deliveries can be answered with it.
 */
public class DuplicateEventException extends RuntimeException {

    private final RatingEvent existingEvent;

    public DuplicateEventException(RatingEvent existingEvent) {
        super("Debate already recorded: " + existingEvent.getDebateId()
                + " (event " + existingEvent.getId() + ")");
        this.existingEvent = existingEvent;
    }

    public RatingEvent getExistingEvent() {
        return existingEvent;
    }
}
