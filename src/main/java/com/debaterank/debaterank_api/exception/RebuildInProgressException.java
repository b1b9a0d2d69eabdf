package com.debaterank.debaterank_api.exception;

public class RebuildInProgressException extends RuntimeException {

    public RebuildInProgressException() {
        super("A rebuild is already running");
    }
}
