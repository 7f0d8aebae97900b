package com.critter.config;

/**
 * @param targetSpecies species code the creature becomes
 * @param minLevel      level at which the evolution triggers
 */
public record EvolutionRule(
        String targetSpecies,
        int minLevel
) {}
