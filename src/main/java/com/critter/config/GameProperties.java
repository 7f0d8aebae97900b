package com.critter.config;

import com.critter.model.RarityTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Game balance and timing knobs, bound from the {@code game.*} section of application.yml.
 */
@ConfigurationProperties(prefix = "game")
public record GameProperties(
        SpawnParams spawn,
        ClaimParams claim,
        BattleParams battle,
        TradeParams trade,
        ProgressionParams progression,
        EconomyParams economy,
        CoordinationParams coordination
) {
    /**
     * @param cooldown           minimum time between two spawns in one chat
     * @param expiry             how long a spawn stays claimable
     * @param messageSpawnChance probability that a chat message triggers a spawn attempt
     * @param minLevel           lowest wild level when the species has no own range
     * @param maxLevel           highest wild level when the species has no own range
     * @param shinyChance        probability that a spawn is shiny
     * @param rarityWeights      relative weight of each rarity tier in the species draw
     */
    public record SpawnParams(
            Duration cooldown,
            Duration expiry,
            double messageSpawnChance,
            int minLevel,
            int maxLevel,
            double shinyChance,
            Map<RarityTier, Integer> rarityWeights
    ) {}

    public record ClaimParams(
            Duration userCooldown,
            Duration lockTtl
    ) {}

    public record BattleParams(
            Duration lockTtl,
            Duration inactivityTimeout,
            int expPerDefeatedLevel,
            long coinRewardBase,
            long coinRewardPerMember,
            int aiTeamSizeCap,
            int aiLevelSpread
    ) {}

    public record TradeParams(
            Duration expiry,
            Duration lockTtl
    ) {}

    /**
     * @param maxRetries optimistic-concurrency attempts before an award reports contention
     */
    public record ProgressionParams(
            int maxRetries
    ) {}

    public record EconomyParams(
            long startingCoins,
            long dailyBase,
            long streakBonusStep,
            long streakBonusCap,
            Duration dailyCooldown,
            Duration streakWindow
    ) {}

    /**
     * @param type          {@code memory} for a single node, {@code redis} for shared workers
     * @param sweepInterval period of the maintenance sweep
     */
    public record CoordinationParams(
            String type,
            Duration sweepInterval
    ) {}
}
