package com.critter.model;

public enum MoveCategory {
    PHYSICAL,
    SPECIAL
}
