package com.critter.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;

/**
 * Result of a claim attempt on a spawn.
 */
@Data
@Builder
public class ClaimResult {

    public enum Outcome {
        CAUGHT,
        ALREADY_CLAIMED,
        EXPIRED,
        ON_COOLDOWN
    }

    private Outcome outcome;
    private CreatureDTO creature;
    private Duration cooldownRemaining;
    private ProgressionResult trainerProgress;

    public boolean isCaught() {
        return outcome == Outcome.CAUGHT;
    }

    public static ClaimResult caught(CreatureDTO creature, ProgressionResult trainerProgress) {
        return ClaimResult.builder()
                .outcome(Outcome.CAUGHT)
                .creature(creature)
                .trainerProgress(trainerProgress)
                .build();
    }

    public static ClaimResult of(Outcome outcome) {
        return ClaimResult.builder().outcome(outcome).build();
    }

    public static ClaimResult onCooldown(Duration remaining) {
        return ClaimResult.builder().outcome(Outcome.ON_COOLDOWN).cooldownRemaining(remaining).build();
    }
}
