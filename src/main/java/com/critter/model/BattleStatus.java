package com.critter.model;

public enum BattleStatus {
    IN_PROGRESS,
    COMPLETE
}
