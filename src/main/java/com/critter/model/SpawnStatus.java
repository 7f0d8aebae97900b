package com.critter.model;

/**
 * Lifecycle of a wild spawn. CAUGHT and EXPIRED are terminal.
 */
public enum SpawnStatus {
    ACTIVE,
    CAUGHT,
    EXPIRED
}
