package com.debaterank.debaterank_api.exception;

/**
 * A ledger or projection invariant would be broken. Always aborts the
 * surrounding transaction.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
