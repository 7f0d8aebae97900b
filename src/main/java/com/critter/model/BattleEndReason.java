package com.critter.model;

public enum BattleEndReason {
    KNOCKOUT,
    FORFEIT,
    TIMEOUT
}
