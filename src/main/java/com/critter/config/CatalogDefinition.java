package com.critter.config;

import java.util.List;

/**
 * Root of one catalog JSON file. Every section is optional so data can be split across files.
 *
 * @param levelThresholds experience needed to leave level 1, 2, 3 ... in order;
 *                        levels beyond the table fall back to the cubic curve
 */
public record CatalogDefinition(
        List<SpeciesDefinition> species,
        List<MoveDefinition> moves,
        List<ItemDefinition> items,
        List<Long> levelThresholds
) {}
