package com.critter.model;

public enum BattleActionType {
    ATTACK,
    SWITCH,
    ITEM;

    /**
     * Switches and items resolve before attacks regardless of speed.
     */
    public int priority() {
        return this == ATTACK ? 0 : 1;
    }
}
