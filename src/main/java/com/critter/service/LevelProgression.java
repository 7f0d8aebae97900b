package com.critter.service;

import com.critter.config.ExperienceCurve;

/**
 * Carry-over levelling: while experience meets the threshold of the current level, level up
 * and subtract the threshold. Once the cap is reached, further experience is discarded.
 */
public final class LevelProgression {

    private LevelProgression() {
    }

    public record Outcome(int level, long experience, long discarded) {}

    public static Outcome apply(int level, long experience, long amount, ExperienceCurve curve, int maxLevel) {
        if (amount < 0) {
            throw new IllegalArgumentException("Experience amount must not be negative: " + amount);
        }
        if (level >= maxLevel) {
            return new Outcome(level, experience, amount);
        }

        long total = experience + amount;
        int newLevel = level;
        while (newLevel < maxLevel) {
            long threshold = curve.thresholdFor(newLevel);
            if (threshold <= 0 || total < threshold) {
                break;
            }
            total -= threshold;
            newLevel++;
        }
        return new Outcome(newLevel, total, 0);
    }
}
