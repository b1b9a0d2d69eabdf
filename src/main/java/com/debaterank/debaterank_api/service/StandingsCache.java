package com.debaterank.debaterank_api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis copy of the ranked standings, keyed by the data version they were
 * computed at (ledger head plus roster version). Any event, registration or
 * deactivation moves the version, so stale entries are never read; they
 * simply expire. Redis being down only costs a recomputation.
 */
@Component
public class StandingsCache {

    private static final Logger log = LoggerFactory.getLogger(StandingsCache.class);
    static final String KEY_PREFIX = "debaterank:standings:";
    private static final TypeReference<List<StandingsService.Standing>> STANDINGS_TYPE = new TypeReference<>() {};

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public StandingsCache(StringRedisTemplate redisTemplate,
                          ObjectMapper objectMapper,
                          @Value("${debaterank.cache.standings-ttl-seconds:300}") long ttlSeconds) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public Optional<List<StandingsService.Standing>> get(String version) {
        try {
            String json = redisTemplate.opsForValue().get(KEY_PREFIX + version);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, STANDINGS_TYPE));
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Standings cache read failed for version {}: {}", version, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String version, List<StandingsService.Standing> standings) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + version, objectMapper.writeValueAsString(standings), ttl);
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Standings cache write failed for version {}: {}", version, e.getMessage());
        }
    }

    /** Drops every cached standings entry. Used after the projection is rebuilt. */
    public void evictAll() {
        try {
            Set<String> keys = redisTemplate.keys(KEY_PREFIX + "*");
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
            }
        } catch (DataAccessException e) {
            log.warn("Standings cache eviction failed: {}", e.getMessage());
        }
    }
}
