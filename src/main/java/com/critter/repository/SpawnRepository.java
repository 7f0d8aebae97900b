package com.critter.repository;

import com.critter.model.Spawn;
import com.critter.model.SpawnStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for Spawn entities.
 * Status changes are compare-and-set updates guarded on ACTIVE, so only one terminal transition can win.
 */
@Repository
public interface SpawnRepository extends JpaRepository<Spawn, String> {

    Optional<Spawn> findFirstByChatIdAndStatusOrderBySpawnedAtDesc(Long chatId, SpawnStatus status);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Spawn s SET s.status = :caught, s.caughtBy = :trainerId, s.caughtAt = :now, s.version = s.version + 1 "
            + "WHERE s.id = :spawnId AND s.status = :active AND s.expiresAt > :now")
    int markCaught(String spawnId, Long trainerId, Instant now, SpawnStatus active, SpawnStatus caught);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Spawn s SET s.status = :expired, s.version = s.version + 1 "
            + "WHERE s.id = :spawnId AND s.status = :active AND s.expiresAt <= :now")
    int markExpired(String spawnId, Instant now, SpawnStatus active, SpawnStatus expired);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Spawn s SET s.status = :expired, s.version = s.version + 1 "
            + "WHERE s.status = :active AND s.expiresAt <= :now")
    int expireOverdue(Instant now, SpawnStatus active, SpawnStatus expired);

    default int markCaught(String spawnId, Long trainerId, Instant now) {
        return markCaught(spawnId, trainerId, now, SpawnStatus.ACTIVE, SpawnStatus.CAUGHT);
    }

    default int markExpired(String spawnId, Instant now) {
        return markExpired(spawnId, now, SpawnStatus.ACTIVE, SpawnStatus.EXPIRED);
    }

    default int expireOverdue(Instant now) {
        return expireOverdue(now, SpawnStatus.ACTIVE, SpawnStatus.EXPIRED);
    }
}
