package com.critter.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class DailyRewardResult {

    public enum Outcome {
        CLAIMED,
        ON_COOLDOWN,
        CONTENDED
    }

    private Outcome outcome;
    private long coinsAwarded;
    private int streak;
    private Instant nextClaimAt;
}
