package com.critter.service;

import com.critter.config.Catalog;
import com.critter.config.GameProperties;
import com.critter.config.SpeciesDefinition;
import com.critter.model.RarityTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Rarity-weighted species draw. Tiers without catalog species or with zero weight are skipped
 * and the remaining weights renormalised. O(tiers) per draw; reproducible for a seeded Random.
 */
@Component
@RequiredArgsConstructor
public class RarityTable {

    private final Catalog catalog;
    private final GameProperties properties;

    public SpeciesDefinition draw(Random random) {
        RarityTier tier = drawTier(random);
        List<SpeciesDefinition> candidates = catalog.speciesOfRarity(tier);
        return candidates.get(random.nextInt(candidates.size()));
    }

    RarityTier drawTier(Random random) {
        Map<RarityTier, Integer> weights = properties.spawn().rarityWeights();
        int total = 0;
        for (RarityTier tier : RarityTier.values()) {
            total += effectiveWeight(tier, weights);
        }
        if (total <= 0) {
            throw new IllegalStateException("No species available for any rarity tier with a positive weight");
        }

        int pick = random.nextInt(total);
        int cumulative = 0;
        for (RarityTier tier : RarityTier.values()) {
            cumulative += effectiveWeight(tier, weights);
            if (pick < cumulative) {
                return tier;
            }
        }
        throw new IllegalStateException("Rarity draw out of range");
    }

    private int effectiveWeight(RarityTier tier, Map<RarityTier, Integer> weights) {
        if (catalog.speciesOfRarity(tier).isEmpty()) {
            return 0;
        }
        return Math.max(0, weights.getOrDefault(tier, 0));
    }
}
