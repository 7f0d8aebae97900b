package com.critter.model;

/**
 * The two sides of a battle. Side A is always the challenger.
 */
public enum BattleSide {
    A,
    B;

    public BattleSide opposite() {
        return this == A ? B : A;
    }
}
