package com.debaterank.debaterank_api.model;

/** One slot of an entrant's recent-form window. */
public record RecentOutcome(Long eventId, MatchResult result) {

    static RecentOutcome parse(String token) {
        int sep = token.indexOf(':');
        if (sep <= 0 || sep != token.length() - 2) {
            throw new IllegalArgumentException("Malformed recent outcome: " + token);
        }
        return new RecentOutcome(Long.parseLong(token.substring(0, sep)),
                MatchResult.fromCode(token.charAt(sep + 1)));
    }

    String encode() {
        return eventId + ":" + result.code();
    }
}
