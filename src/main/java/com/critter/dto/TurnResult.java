package com.critter.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a turn submission.
 */
@Data
@Builder
public class TurnResult {

    public enum Outcome {
        /** Action stored; the other side has not submitted yet. */
        WAITING,
        /** Both actions resolved; the battle continues. */
        RESOLVED,
        /** Both actions resolved and the battle ended. */
        BATTLE_COMPLETE,
        TURN_MISMATCH,
        ALREADY_SUBMITTED,
        NOT_IN_PROGRESS,
        /** The battle was inactive too long and has been closed. */
        TIMED_OUT,
        /** Another submission for the same battle holds the lock. */
        CONTENDED
    }

    private Outcome outcome;
    private BattleStateDTO battle;

    public static TurnResult of(Outcome outcome, BattleStateDTO battle) {
        return TurnResult.builder().outcome(outcome).battle(battle).build();
    }
}
