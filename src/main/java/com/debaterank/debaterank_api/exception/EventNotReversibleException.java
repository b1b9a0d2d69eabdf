package com.debaterank.debaterank_api.exception;

public class EventNotReversibleException extends RuntimeException {

    public EventNotReversibleException(Long eventId) {
        super("Rating event " + eventId + " is a reversal and cannot itself be reversed");
    }
}
