package com.critter.coordination;

import com.critter.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Coordination store backed by Redis, shared by every worker.
 * Locks use {@code SET NX PX}; release is a compare-and-delete script so a worker
 * whose lock already expired cannot delete a lock taken over by someone else.
 */
@Slf4j
public class RedisCoordinationStore implements CoordinationStore {

    private static final RedisScript<Long> DELETE_IF_VALUE = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redis;

    public RedisCoordinationStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean created = call("setIfAbsent", key, () -> redis.opsForValue().setIfAbsent(key, value, ttl));
        return Boolean.TRUE.equals(created);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call("get", key, () -> redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("set", key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        Long millis = call("pttl", key, () -> redis.getExpire(key, TimeUnit.MILLISECONDS));
        // -2 means missing, -1 means no expiry; neither should happen for keys written here
        if (millis == null || millis < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        Long deleted = call("deleteIfValue", key, () -> redis.execute(DELETE_IF_VALUE, List.of(key), expectedValue));
        return deleted != null && deleted > 0;
    }

    private <T> T call(String operation, String key, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            log.error("Redis {} failed for key {}", operation, key, e);
            throw new StoreUnavailableException("Coordination store unavailable during " + operation, e);
        }
    }
}
