package com.sweeper.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * Wires the engine's random source and clock.
 */
@Configuration
@Slf4j
public class EngineConfig {

    /**
     * Mine placement source. Seeded when {@code sweeper.random.seed} is set.
     */
    @Bean
    public Random boardRandom(@Value("${sweeper.random.seed:}") String seed) {
        if (seed == null || seed.isBlank()) {
            return new Random();
        }
        log.info("Using fixed board seed {}", seed);
        return new Random(Long.parseLong(seed.trim()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
