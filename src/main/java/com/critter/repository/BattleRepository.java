package com.critter.repository;

import com.critter.model.Battle;
import com.critter.model.BattleStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for Battle entities.
 */
@Repository
public interface BattleRepository extends JpaRepository<Battle, String> {

    List<Battle> findByStatusAndLastActivityAtLessThanEqual(BattleStatus status, Instant cutoff);

    @Query("SELECT COUNT(b) > 0 FROM Battle b WHERE b.status = :status "
            + "AND (b.challengerId = :trainerId OR b.opponentId = :trainerId)")
    boolean existsByParticipantAndStatus(Long trainerId, BattleStatus status);
}
