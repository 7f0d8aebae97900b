package com.critter.model;

/**
 * Difficulty levels for generated battle opponents.
 */
public enum AiDifficulty {
    EASY,
    NORMAL,
    HARD
}
