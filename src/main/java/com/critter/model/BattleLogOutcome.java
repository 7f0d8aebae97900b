package com.critter.model;

/**
 * What happened when a single action in the battle log was resolved.
 */
public enum BattleLogOutcome {
    HIT,
    MISS,
    FIZZLE,
    FAINTED,
    SKIPPED,
    SWITCHED,
    AUTO_SWITCH,
    HEALED,
    NO_ITEM,
    FORFEIT,
    TIMEOUT
}
