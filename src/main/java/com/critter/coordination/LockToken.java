package com.critter.coordination;

import java.util.UUID;

/**
 * Proof of lock ownership: the lock key plus the random value written under it.
 */
public record LockToken(String key, String value) {

    public static LockToken create(String key) {
        return new LockToken(key, UUID.randomUUID().toString());
    }
}
