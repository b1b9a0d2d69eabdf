package com.debaterank.debaterank_api.exception;

public class UnknownEntrantException extends RuntimeException {

    private final Long entrantId;

    public UnknownEntrantException(Long entrantId) {
        super("Entrant not found: " + entrantId);
        this.entrantId = entrantId;
    }

    public UnknownEntrantException(String slug) {
        super("Entrant not found: " + slug);
        this.entrantId = null;
    }

    public Long getEntrantId() {
        return entrantId;
    }
}
