package com.critter.model;

/**
 * Rarity tiers a species can belong to. Spawn draws pick a tier first, then a species within it.
 */
public enum RarityTier {
    COMMON(10),
    UNCOMMON(20),
    RARE(35),
    EPIC(50),
    LEGENDARY(75),
    MYTHICAL(100);

    private final int catchExperience;

    RarityTier(int catchExperience) {
        this.catchExperience = catchExperience;
    }

    /**
     * Trainer experience granted for catching a creature of this tier, before the level bonus.
     */
    public int getCatchExperience() {
        return catchExperience;
    }
}
