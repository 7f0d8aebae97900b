package com.critter.coordination;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Coordination store for a single node and for tests. Expired entries are treated as absent
 * on every read, so correctness does not depend on {@link #sweepExpired()} running.
 */
@Slf4j
public class InMemoryCoordinationStore implements CoordinationStore {

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCoordinationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        Entry fresh = new Entry(value, now.plus(ttl));
        boolean[] created = {false};
        entries.compute(key, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                created[0] = true;
                return fresh;
            }
            return current;
        });
        return created[0];
    }

    @Override
    public Optional<String> get(String key) {
        return live(key).map(Entry::value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        Instant now = clock.instant();
        return live(key).map(e -> Duration.between(now, e.expiresAt()));
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        boolean[] deleted = {false};
        entries.computeIfPresent(key, (k, current) -> {
            if (current.value().equals(expectedValue)) {
                deleted[0] = true;
                return null;
            }
            return current;
        });
        return deleted[0];
    }

    @Override
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Swept {} expired coordination entries", removed);
        }
        return removed;
    }

    private Optional<Entry> live(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }
}
