package com.critter.config;

/**
 * @param heal  hit points restored when used in battle
 * @param price shop price in coins
 */
public record ItemDefinition(
        String code,
        String name,
        int heal,
        long price
) {}
