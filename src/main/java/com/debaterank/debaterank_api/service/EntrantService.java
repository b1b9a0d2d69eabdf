package com.debaterank.debaterank_api.service;

import com.debaterank.debaterank_api.config.RatingProperties;
import com.debaterank.debaterank_api.exception.UnknownEntrantException;
import com.debaterank.debaterank_api.model.Entrant;
import com.debaterank.debaterank_api.model.RatingSnapshot;
import com.debaterank.debaterank_api.repository.EntrantRepository;
import com.debaterank.debaterank_api.repository.RatingSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

@Service
public class EntrantService {

    private static final Logger log = LoggerFactory.getLogger(EntrantService.class);
    private static final int MAX_SLUG_BASE = 100;
    private static final int MAX_REGISTER_ATTEMPTS = 5;

    private final EntrantRepository entrantRepository;
    private final RatingSnapshotRepository snapshotRepository;
    private final RatingProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public EntrantService(EntrantRepository entrantRepository,
                          RatingSnapshotRepository snapshotRepository,
                          RatingProperties properties,
                          TransactionTemplate transactionTemplate,
                          Clock clock) {
        this.entrantRepository = entrantRepository;
        this.snapshotRepository = snapshotRepository;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Registers an entrant at the baseline rating. The slug comes from the
     * name; a taken slug gets the next free numeric suffix ("gpt-4o-2").
     * Each attempt is its own transaction: losing a concurrent registration
     * on uq_entrants_slug re-reads the taken slugs and tries the next one.
     */
    public Entrant register(String name, String provider) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entrant name must not be blank");
        }
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("Entrant provider must not be blank");
        }
        String base = slugify(name);

        for (int attempt = 1; ; attempt++) {
            try {
                Entrant entrant = transactionTemplate.execute(status -> doRegister(name.trim(), provider.trim(), base));
                log.info("Registered entrant {} '{}' ({}) as {}", entrant.getId(), entrant.getName(),
                        entrant.getProvider(), entrant.getSlug());
                return entrant;
            } catch (DataIntegrityViolationException e) {
                if (attempt >= MAX_REGISTER_ATTEMPTS) {
                    log.error("Giving up registering '{}' after {} slug collisions", name, attempt);
                    throw e;
                }
                log.warn("Slug for '{}' taken concurrently, retrying (attempt {})", name, attempt);
            }
        }
    }

    private Entrant doRegister(String name, String provider, String base) {
        String slug = nextFreeSlug(base);
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        Entrant entrant = entrantRepository.save(new Entrant(name, provider, slug, now));
        snapshotRepository.save(RatingSnapshot.baseline(entrant.getId(), properties.getBaselineRating()));
        return entrant;
    }

    /**
     * Lowercase, runs of anything but [a-z0-9] collapsed to '-', no leading
     * or trailing '-'. "Claude Opus 4.5" becomes "claude-opus-4-5".
     */
    public static String slugify(String name) {
        String slug = name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > MAX_SLUG_BASE) {
            slug = slug.substring(0, MAX_SLUG_BASE).replaceAll("-+$", "");
        }
        return slug.isEmpty() ? "entrant" : slug;
    }

    private String nextFreeSlug(String base) {
        Set<String> taken = new HashSet<>(entrantRepository.findSlugsDerivedFrom(base));
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.contains(base + "-" + suffix)) {
            suffix++;
        }
        return base + "-" + suffix;
    }

    // =========================================================================
    // Lookups
    // =========================================================================

    @Transactional(readOnly = true)
    public Entrant getEntrant(Long id) {
        return entrantRepository.findById(id)
                .orElseThrow(() -> new UnknownEntrantException(id));
    }

    @Transactional(readOnly = true)
    public Entrant getBySlug(String slug) {
        return entrantRepository.findBySlug(slug)
                .orElseThrow(() -> new UnknownEntrantException(slug));
    }

    @Transactional
    public Entrant deactivate(Long id) {
        Entrant entrant = getEntrant(id);
        if (entrant.isActive()) {
            entrant.deactivate();
            log.info("Deactivated entrant {} ({})", id, entrant.getSlug());
        }
        return entrant;
    }
}
