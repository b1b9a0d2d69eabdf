package com.debaterank.debaterank_api.exception;

public class StandingsUnavailableException extends RuntimeException {

    public StandingsUnavailableException() {
        super("Ratings are being rebuilt from the ledger, try again shortly");
    }
}
