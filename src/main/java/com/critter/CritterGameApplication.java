package com.critter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the critter game engine.
 *
 * Features:
 * - Chat-driven spawns with first-claim-wins capture
 * - Turn-based battles against trainers or generated teams
 * - Two-party escrow trades
 * - Real-time events over STOMP
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class CritterGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(CritterGameApplication.class, args);
    }
}
