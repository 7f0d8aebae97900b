package com.critter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Time and randomness sources for the engines, injectable so tests can pin them.
 */
@Configuration
@EnableConfigurationProperties(GameProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Source for spawn draws and battle seeds. Battle turns never use it directly;
     * they derive their own generator from the seed stored on the battle.
     */
    @Bean
    public Random gameRandom() {
        return new SecureRandom();
    }
}
