package com.debaterank.debaterank_api.exception;

public class AlreadyReversedException extends RuntimeException {

    public AlreadyReversedException(Long eventId) {
        super("Rating event already reversed: " + eventId);
    }
}
