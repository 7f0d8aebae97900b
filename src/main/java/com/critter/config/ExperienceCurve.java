package com.critter.config;

import java.util.List;

/**
 * Experience needed to advance from a level to the next one.
 */
@FunctionalInterface
public interface ExperienceCurve {

    long thresholdFor(int level);

    /**
     * (L+1)^3 - L^3, so total experience to reach level L is L^3.
     */
    static ExperienceCurve cubic() {
        return level -> {
            long next = (long) (level + 1) * (level + 1) * (level + 1);
            long current = (long) level * level * level;
            return next - current;
        };
    }

    static ExperienceCurve table(List<Long> thresholds) {
        List<Long> copy = List.copyOf(thresholds);
        ExperienceCurve fallback = cubic();
        return level -> level >= 1 && level <= copy.size() ? copy.get(level - 1) : fallback.thresholdFor(level);
    }
}
