package com.critter.coordination;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Low-latency key/value store for cooldowns and short-lived locks. Every key carries a TTL.
 * Implementations throw {@link com.critter.exception.StoreUnavailableException} when unreachable.
 */
public interface CoordinationStore {

    /**
     * Sets the key only if it is absent.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Remaining time to live, empty if the key is absent.
     */
    Optional<Duration> remainingTtl(String key);

    /**
     * Deletes the key only if it still holds {@code expectedValue}.
     *
     * @return true if the key was deleted
     */
    boolean deleteIfValue(String key, String expectedValue);

    /**
     * Drops entries whose TTL has passed. Stores that expire keys on their own do nothing.
     *
     * @return number of entries removed
     */
    default int sweepExpired() {
        return 0;
    }

    /**
     * Acquires a lock keyed by {@code key}. The returned token must be handed back to {@link #release}.
     */
    default Optional<LockToken> tryAcquire(String key, Duration ttl) {
        LockToken token = LockToken.create(key);
        return setIfAbsent(key, token.value(), ttl) ? Optional.of(token) : Optional.empty();
    }

    /**
     * Releases a lock held by {@code token}. A lock that already expired and was taken by
     * someone else is left alone.
     */
    default void release(LockToken token) {
        deleteIfValue(token.key(), token.value());
    }

    /**
     * Runs {@code task} while holding the lock.
     *
     * @return the task result, or empty if the lock is held by someone else
     */
    default <T> Optional<T> withLock(String key, Duration ttl, Supplier<T> task) {
        Optional<LockToken> token = tryAcquire(key, ttl);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(task.get());
        } finally {
            release(token.get());
        }
    }
}
