package com.critter.model;

public enum OpponentType {
    PLAYER,
    AI
}
