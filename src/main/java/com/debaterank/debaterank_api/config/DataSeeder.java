package com.debaterank.debaterank_api.config;

import com.debaterank.debaterank_api.repository.EntrantRepository;
import com.debaterank.debaterank_api.service.EntrantService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Registers the launch roster on an empty database when
 * debaterank.seed.enabled is set.
 */
@Component
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private static final List<SeedEntrant> ROSTER = List.of(
            new SeedEntrant("Claude Opus 4.5", "anthropic"),
            new SeedEntrant("Claude Sonnet 4.5", "anthropic"),
            new SeedEntrant("GPT-4o", "openai"),
            new SeedEntrant("Gemini 2.5 Pro", "google"),
            new SeedEntrant("Gemini 2.5 Flash", "google"),
            new SeedEntrant("Mistral Large", "mistral"),
            new SeedEntrant("Grok 4", "xai"),
            new SeedEntrant("DeepSeek V3", "deepseek")
    );

    private final EntrantRepository entrantRepository;
    private final EntrantService entrantService;
    private final boolean enabled;

    public DataSeeder(EntrantRepository entrantRepository,
                      EntrantService entrantService,
                      @Value("${debaterank.seed.enabled:false}") boolean enabled) {
        this.entrantRepository = entrantRepository;
        this.entrantService = entrantService;
        this.enabled = enabled;
    }

    @Override
    public void run(String... args) {
        // Only on an empty table, so restarts don't duplicate the roster
        if (!enabled || entrantRepository.count() > 0) {
            return;
        }
        ROSTER.forEach(seed -> entrantService.register(seed.name(), seed.provider()));
        log.info("Database seeded with {} entrants.", ROSTER.size());
    }

    private record SeedEntrant(String name, String provider) {}
}
