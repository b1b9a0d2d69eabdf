package com.debaterank.debaterank_api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour over HTTP against PostgreSQL and Redis.
 *
 * Run: mvn test -Dtest="*IntegrationTest"
 */
class RatingEngineIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private ResponseEntity<String> submitResult(String debateId, long a, long b, String outcome) {
        return httpPost("/api/ratings/events",
                Map.of("debateId", debateId, "entrantAId", a, "entrantBId", b, "outcome", outcome),
                ingestToken());
    }

    private JsonNode json(ResponseEntity<String> response) throws Exception {
        return objectMapper.readTree(response.getBody());
    }

    private JsonNode rating(long entrantId) throws Exception {
        return json(httpGet("/api/entrants/" + entrantId + "/rating"));
    }

    // =========================================================================
    // Recording results
    // =========================================================================

    @Nested
    @DisplayName("Recording results")
    class Recording {

        @Test
        @DisplayName("twoWins_followTheWorkedExample")
        void twoWins_followTheWorkedExample() throws Exception {
            long claude = registerEntrant("Claude Opus 4.5", "Anthropic");
            long gpt = registerEntrant("GPT-4o", "OpenAI");

            assertEquals(HttpStatus.CREATED, submitResult("debate-1", claude, gpt, "A_WINS").getStatusCode());
            JsonNode second = json(submitResult("debate-2", claude, gpt, "A_WINS")).get("event");

            assertEquals(1516, second.get("ratingABefore").asInt());
            assertEquals(1531, second.get("ratingAAfter").asInt());
            assertEquals(1469, second.get("ratingBAfter").asInt());
            assertEquals(1531, rating(claude).get("rating").asInt());
            assertEquals("LL", rating(gpt).get("recentForm").asText());

            JsonNode standings = json(httpGet("/api/standings")).get("standings");
            assertEquals(claude, standings.get(0).get("entrantId").asLong());
            assertEquals(1, standings.get(0).get("rank").asInt());
            assertEquals(100.0, standings.get(0).get("winRatePercent").asDouble());
            assertEquals(31, standings.get(0).get("trend").asInt());
        }

        @Test
        @DisplayName("repeatedDelivery_returnsOriginalEventOnce")
        void repeatedDelivery_returnsOriginalEventOnce() throws Exception {
            long a = registerEntrant("Gemini 2.5 Pro", "Google");
            long b = registerEntrant("Mistral Large", "Mistral");

            ResponseEntity<String> first = submitResult("debate-dup", a, b, "DRAW");
            ResponseEntity<String> again = submitResult("debate-dup", a, b, "A_WINS");

            assertEquals(HttpStatus.CREATED, first.getStatusCode());
            assertEquals(HttpStatus.OK, again.getStatusCode());
            assertTrue(json(again).get("duplicate").asBoolean());
            assertEquals(json(first).get("event").get("id").asLong(), json(again).get("event").get("id").asLong());
            assertEquals("DRAW", json(again).get("event").get("outcome").asText());
            assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM rating_events", Integer.class));
        }

        @Test
        @DisplayName("unknownEntrant_is404")
        void unknownEntrant_is404() throws Exception {
            long a = registerEntrant("Grok 4", "xAI");

            ResponseEntity<String> response = submitResult("debate-x", a, 999L, "A_WINS");

            assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
            assertEquals("UNKNOWN_ENTRANT", json(response).get("code").asText());
        }

        @Test
        @DisplayName("selfDebate_is400")
        void selfDebate_is400() {
            long a = registerEntrant("DeepSeek V3", "DeepSeek");

            assertEquals(HttpStatus.BAD_REQUEST, submitResult("debate-self", a, a, "DRAW").getStatusCode());
        }

        @Test
        @DisplayName("resultIsBroadcastAfterCommit")
        void resultIsBroadcastAfterCommit() throws Exception {
            long a = registerEntrant("Claude Sonnet 4.5", "Anthropic");
            long b = registerEntrant("Gemini 2.5 Flash", "Google");
            BlockingQueue<String> updates = subscribeToRatings();

            submitResult("debate-live", a, b, "B_WINS");

            String frame = updates.poll(3, TimeUnit.SECONDS);
            assertNotNull(frame, "no rating update was broadcast");
            assertEquals("debate-live", objectMapper.readTree(frame).get("debateId").asText());
        }
    }

    // =========================================================================
    // Concurrency
    // =========================================================================

    @Test
    @DisplayName("concurrentResults_sharingAnEntrant_stayZeroSumAndConsistent")
    void concurrentResults_sharingAnEntrant_stayZeroSumAndConsistent() throws Exception {
        long hub = registerEntrant("Claude Opus 4.5", "Anthropic");
        List<Long> rivals = List.of(
                registerEntrant("GPT-4o", "OpenAI"),
                registerEntrant("Grok 4", "xAI"),
                registerEntrant("Mistral Large", "Mistral"));

        int debates = 24;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ResponseEntity<String>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < debates; i++) {
                long rival = rivals.get(i % rivals.size());
                String outcome = i % 3 == 0 ? "DRAW" : (i % 2 == 0 ? "A_WINS" : "B_WINS");
                String debateId = "concurrent-" + i;
                boolean hubFirst = i % 2 == 0;
                results.add(pool.submit(() -> {
                    start.await();
                    return hubFirst ? submitResult(debateId, hub, rival, outcome) : submitResult(debateId, rival, hub, outcome);
                }));
            }
            start.countDown();
            for (Future<ResponseEntity<String>> result : results) {
                assertEquals(HttpStatus.CREATED, result.get(30, TimeUnit.SECONDS).getStatusCode());
            }
        } finally {
            pool.shutdownNow();
        }

        int total = rating(hub).get("rating").asInt();
        for (long rival : rivals) {
            total += rating(rival).get("rating").asInt();
        }
        assertEquals(4 * 1500, total);
        assertEquals(debates, rating(hub).get("totalDebates").asInt());
        JsonNode audit = json(httpGet("/api/admin/ratings/audit", adminToken()));
        assertEquals(debates, audit.get("events").asInt());
        assertTrue(audit.get("divergences").isEmpty(), audit.toString());
    }

    // =========================================================================
    // Reversal and rebuild
    // =========================================================================

    @Nested
    @DisplayName("Ledger maintenance")
    class Maintenance {

        @Test
        @DisplayName("reversal_restoresRatingsAndCannotRepeat")
        void reversal_restoresRatingsAndCannotRepeat() throws Exception {
            long a = registerEntrant("Claude Opus 4.5", "Anthropic");
            long b = registerEntrant("GPT-4o", "OpenAI");
            long eventId = json(submitResult("debate-bad", a, b, "A_WINS")).get("event").get("id").asLong();

            ResponseEntity<String> reversed = httpPost("/api/admin/events/" + eventId + "/reverse", Map.of(), adminToken());
            ResponseEntity<String> again = httpPost("/api/admin/events/" + eventId + "/reverse", Map.of(), adminToken());

            assertEquals(HttpStatus.CREATED, reversed.getStatusCode());
            assertEquals("REVERSAL", json(reversed).get("kind").asText());
            assertEquals(1500, rating(a).get("rating").asInt());
            assertEquals(0, rating(a).get("wins").asInt());
            assertEquals(HttpStatus.CONFLICT, again.getStatusCode());
            assertEquals("ALREADY_REVERSED", json(again).get("code").asText());
            assertEquals(0, json(httpGet("/api/head-to-head?a=" + a + "&b=" + b)).get("totalGames").asInt());
        }

        @Test
        @DisplayName("rebuild_reproducesTheSameStandings")
        void rebuild_reproducesTheSameStandings() throws Exception {
            long a = registerEntrant("Claude Opus 4.5", "Anthropic");
            long b = registerEntrant("GPT-4o", "OpenAI");
            long c = registerEntrant("Gemini 2.5 Pro", "Google");
            submitResult("d-1", a, b, "A_WINS");
            submitResult("d-2", b, c, "DRAW");
            submitResult("d-3", c, a, "A_WINS");
            submitResult("d-4", a, b, "B_WINS");
            JsonNode before = json(httpGet("/api/standings")).get("standings");

            jdbcTemplate.update("UPDATE rating_snapshots SET rating = 9999, wins = 0");
            ResponseEntity<String> rebuilt = httpPost("/api/admin/ratings/rebuild", Map.of(), adminToken());

            assertEquals(HttpStatus.OK, rebuilt.getStatusCode());
            assertEquals(4, json(rebuilt).get("events").asInt());
            assertEquals(before, json(httpGet("/api/standings")).get("standings"));
        }

        @Test
        @DisplayName("ledgerRows_cannotBeUpdatedOrDeleted")
        void ledgerRows_cannotBeUpdatedOrDeleted() {
            long a = registerEntrant("Grok 4", "xAI");
            long b = registerEntrant("DeepSeek V3", "DeepSeek");
            submitResult("d-locked", a, b, "DRAW");

            assertThrows(DataAccessException.class,
                    () -> jdbcTemplate.update("UPDATE rating_events SET rating_a_after = 1"));
            assertThrows(DataAccessException.class,
                    () -> jdbcTemplate.update("DELETE FROM rating_events"));
        }
    }

    // =========================================================================
    // Access control
    // =========================================================================

    @Nested
    @DisplayName("Access control")
    class Access {

        @Test
        @DisplayName("recordingWithoutToken_is401")
        void recordingWithoutToken_is401() {
            ResponseEntity<String> response = httpPost("/api/ratings/events",
                    Map.of("debateId", "d", "entrantAId", 1, "entrantBId", 2, "outcome", "DRAW"), null);

            assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        }

        @Test
        @DisplayName("adminEndpointsWithIngestToken_are403")
        void adminEndpointsWithIngestToken_are403() {
            ResponseEntity<String> response = httpPost("/api/admin/ratings/rebuild", Map.of(), ingestToken());

            assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        }

        @Test
        @DisplayName("standings_arePublic")
        void standings_arePublic() {
            assertEquals(HttpStatus.OK, httpGet("/api/standings").getStatusCode());
        }
    }
}
