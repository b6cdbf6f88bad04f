package com.sweeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the treasure sweeper service.
 * 
 * Features:
 * - Random and fixed-layout boards with a hidden treasure
 * - REST API and STOMP updates per game session
 * - Validated test layouts
 * - Save and restore of games in progress
 * - Eviction of idle sessions
 */
@SpringBootApplication
@EnableScheduling
public class SweeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(SweeperApplication.class, args);
    }
}
