package com.debaterank.debaterank_api.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * Service tokens for the debate platform's callers. The subject names the
 * calling service, the "roles" claim carries INGEST and/or ADMIN.
 */
@Component
public class JwtUtil {

    private static final Logger log = LoggerFactory.getLogger(JwtUtil.class);
    private static final String ROLES_CLAIM = "roles";

    private final SecretKey signingKey;
    private final long tokenExpirationMs;

    public JwtUtil(
            @Value("${debaterank.jwt.secret}") String secret,
            @Value("${debaterank.jwt.token-expiration-ms:3600000}") long tokenExpirationMs) {
        // HMAC-SHA key derived from the configured secret
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
    }

    public String generateToken(String subject, Collection<String> roles) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + tokenExpirationMs);

        return Jwts.builder()
                .subject(subject)
                .claim(ROLES_CLAIM, List.copyOf(roles))
                .issuedAt(now)
                .expiration(expiry)
                .signWith(signingKey)
                .compact();
    }

    /**
     * Parses and verifies a token. Returns null if the token is invalid,
     * expired or malformed.
     */
    public TokenClaims parse(String token) {
        Claims claims = parseClaims(token);
        if (claims == null) {
            return null;
        }
        List<String> roles = readRoles(claims.get(ROLES_CLAIM));
        return new TokenClaims(claims.getSubject(), roles);
    }

    private List<String> readRoles(Object raw) {
        if (raw instanceof Collection<?> values) {
            return values.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private Claims parseClaims(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return null;
        }
    }

    public record TokenClaims(String subject, List<String> roles) {}
}
