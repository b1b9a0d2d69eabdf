package com.debaterank.debaterank_api.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RatingProperties.class)
public class RatingEngineConfig {

    /** Source of ledger timestamps. Tests swap in a fixed clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
