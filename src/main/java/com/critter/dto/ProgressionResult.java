package com.critter.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of an experience award to a creature or a trainer.
 */
@Data
@Builder
public class ProgressionResult {

    public enum Outcome {
        APPLIED,
        /** Optimistic retries were exhausted; nothing was written. */
        CONTENDED
    }

    private Outcome outcome;
    private String subjectId;
    /** Owner of the creature at the time of the write; null for trainer awards. */
    private Long ownerId;
    private String speciesBefore;
    private int levelBefore;
    private int levelAfter;
    private long experience;
    private long discardedExperience;
    /** Species codes the creature passed through, in order, empty if it did not evolve. */
    private List<String> evolutions;

    public boolean isLevelledUp() {
        return levelAfter > levelBefore;
    }

    public boolean isEvolved() {
        return evolutions != null && !evolutions.isEmpty();
    }

    public static ProgressionResult contended(String subjectId) {
        return ProgressionResult.builder()
                .outcome(Outcome.CONTENDED)
                .subjectId(subjectId)
                .evolutions(List.of())
                .build();
    }
}
