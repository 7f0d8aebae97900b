package com.critter.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of a spawn attempt. Cooldowns are expected outcomes, not errors.
 */
@Data
@Builder
public class SpawnResult {

    public enum Outcome {
        SPAWNED,
        ON_COOLDOWN,
        ACTIVE_SPAWN_EXISTS,
        /** The per-message chance roll did not trigger a spawn attempt. */
        NOT_TRIGGERED
    }

    private Outcome outcome;
    private SpawnDTO spawn;
    private Duration cooldownRemaining;

    public boolean isSpawned() {
        return outcome == Outcome.SPAWNED;
    }

    public static SpawnResult spawned(SpawnDTO spawn) {
        return SpawnResult.builder().outcome(Outcome.SPAWNED).spawn(spawn).build();
    }

    public static SpawnResult onCooldown(Duration remaining) {
        return SpawnResult.builder().outcome(Outcome.ON_COOLDOWN).cooldownRemaining(remaining).build();
    }

    public static SpawnResult activeSpawnExists(SpawnDTO existing) {
        return SpawnResult.builder().outcome(Outcome.ACTIVE_SPAWN_EXISTS).spawn(existing).build();
    }

    public static SpawnResult notTriggered() {
        return SpawnResult.builder().outcome(Outcome.NOT_TRIGGERED).build();
    }
}
