package com.debaterank.debaterank_api.model;

/**
 * One entrant's result in a single debate. The single-letter code is what the
 * recent-form window stores and what the standings show ("WWLDW").
 */
public enum MatchResult {
    WIN('W'),
    LOSS('L'),
    DRAW('D');

    private final char code;

    MatchResult(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    public MatchResult opposite() {
        return switch (this) {
            case WIN -> LOSS;
            case LOSS -> WIN;
            case DRAW -> DRAW;
        };
    }

    public static MatchResult fromCode(char code) {
        for (MatchResult result : values()) {
            if (result.code == code) {
                return result;
            }
        }
        throw new IllegalArgumentException("Unknown result code: " + code);
    }
}
