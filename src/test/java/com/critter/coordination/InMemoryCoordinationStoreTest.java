package com.critter.coordination;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.critter.support.MutableClock;

/**
 * Unit tests for the single-node coordination store.
 */
class InMemoryCoordinationStoreTest {

    private MutableClock clock;
    private InMemoryCoordinationStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryCoordinationStore(clock);
    }

    @Nested
    @DisplayName("TTL keys")
    class TtlKeys {

        @Test
        @DisplayName("setIfAbsent should only succeed once while the key lives")
        void shouldSetOnce() {
            assertTrue(store.setIfAbsent("k", "a", Duration.ofSeconds(10)));
            assertFalse(store.setIfAbsent("k", "b", Duration.ofSeconds(10)));
            assertEquals(Optional.of("a"), store.get("k"));
        }

        @Test
        @DisplayName("an expired key should behave as absent without a sweep")
        void shouldExpireLazily() {
            store.setIfAbsent("k", "a", Duration.ofSeconds(10));
            clock.advance(Duration.ofSeconds(10));

            assertTrue(store.get("k").isEmpty());
            assertTrue(store.remainingTtl("k").isEmpty());
            assertTrue(store.setIfAbsent("k", "b", Duration.ofSeconds(10)));
        }

        @Test
        @DisplayName("remainingTtl should count down with the clock")
        void shouldReportRemainingTtl() {
            store.set("k", "a", Duration.ofSeconds(30));
            clock.advance(Duration.ofSeconds(12));

            assertEquals(Optional.of(Duration.ofSeconds(18)), store.remainingTtl("k"));
        }

        @Test
        @DisplayName("sweepExpired should drop only dead entries")
        void shouldSweep() {
            store.set("short", "a", Duration.ofSeconds(1));
            store.set("long", "b", Duration.ofMinutes(1));
            clock.advance(Duration.ofSeconds(5));

            assertEquals(1, store.sweepExpired());
            assertTrue(store.get("long").isPresent());
        }
    }

    @Nested
    @DisplayName("Locks")
    class Locks {

        @Test
        @DisplayName("release should free the lock for the next caller")
        void shouldRelease() {
            LockToken token = store.tryAcquire("lock", Duration.ofSeconds(5)).orElseThrow();
            assertTrue(store.tryAcquire("lock", Duration.ofSeconds(5)).isEmpty());

            store.release(token);

            assertTrue(store.tryAcquire("lock", Duration.ofSeconds(5)).isPresent());
        }

        @Test
        @DisplayName("a stale holder should not release a lock someone else took after expiry")
        void shouldNotReleaseForeignLock() {
            LockToken stale = store.tryAcquire("lock", Duration.ofSeconds(5)).orElseThrow();
            clock.advance(Duration.ofSeconds(6));
            LockToken current = store.tryAcquire("lock", Duration.ofSeconds(5)).orElseThrow();

            store.release(stale);

            assertEquals(Optional.of(current.value()), store.get("lock"));
        }

        @Test
        @DisplayName("withLock should run the task and release afterwards")
        void shouldRunWithLock() {
            Optional<String> result = store.withLock("lock", Duration.ofSeconds(5), () -> "done");

            assertEquals(Optional.of("done"), result);
            assertTrue(store.get("lock").isEmpty());
        }

        @Test
        @DisplayName("only one of many concurrent callers should acquire the lock")
        void shouldGrantSingleWinner() throws InterruptedException {
            int threads = 16;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger winners = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                pool.submit(() -> {
                    try {
                        start.await();
                        if (store.tryAcquire("race", Duration.ofSeconds(5)).isPresent()) {
                            winners.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
            pool.shutdown();

            assertEquals(1, winners.get());
        }
    }
}
