package com.critter.config;

import com.critter.model.MoveCategory;

/**
 * @param accuracy hit chance in percent, 1..100
 */
public record MoveDefinition(
        String code,
        String name,
        String type,
        MoveCategory category,
        int power,
        int accuracy
) {}
