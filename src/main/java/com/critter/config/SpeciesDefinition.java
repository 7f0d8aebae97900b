package com.critter.config;

import com.critter.model.RarityTier;

import java.util.List;

/**
 * One species as described in the catalog JSON.
 *
 * @param code      stable key referenced by creatures and spawns, e.g. "pidgey"
 * @param name      display name
 * @param types     one or two elemental types
 * @param baseStats base stat block before level, nature and shiny modifiers
 * @param rarity    tier used by the weighted spawn draw
 * @param evolution evolution rule, or null if the species does not evolve
 * @param movePool  move codes a creature of this species can use
 * @param minLevel  lowest wild level, or null to use the configured default
 * @param maxLevel  highest wild level, or null to use the configured default
 */
public record SpeciesDefinition(
        String code,
        String name,
        List<String> types,
        BaseStats baseStats,
        RarityTier rarity,
        EvolutionRule evolution,
        List<String> movePool,
        Integer minLevel,
        Integer maxLevel
) {

    public boolean canEvolveAt(int level) {
        return evolution != null && level >= evolution.minLevel();
    }

    public String primaryType() {
        return types == null || types.isEmpty() ? "normal" : types.get(0);
    }
}
