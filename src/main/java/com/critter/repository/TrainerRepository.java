package com.critter.repository;

import com.critter.model.Trainer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for Trainer entities.
 * Balance and counter changes are conditional bulk updates returning the affected row count.
 */
@Repository
public interface TrainerRepository extends JpaRepository<Trainer, Long> {

    List<Trainer> findTop10ByOrderByTrainerLevelDescExperienceDesc();

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trainer t SET t.coins = t.coins - :amount WHERE t.id = :trainerId AND t.coins >= :amount")
    int debitCoins(Long trainerId, long amount);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trainer t SET t.coins = t.coins + :amount WHERE t.id = :trainerId")
    int creditCoins(Long trainerId, long amount);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trainer t SET t.creaturesCaught = t.creaturesCaught + 1 WHERE t.id = :trainerId")
    int incrementCaught(Long trainerId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trainer t SET t.battlesWon = t.battlesWon + 1 WHERE t.id = :trainerId")
    int recordWin(Long trainerId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trainer t SET t.battlesLost = t.battlesLost + 1 WHERE t.id = :trainerId")
    int recordLoss(Long trainerId);

    /**
     * Records a daily claim for a trainer who has never claimed before.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trainer t SET t.lastDailyClaim = :now, t.dailyStreak = :streak, t.coins = t.coins + :reward "
            + "WHERE t.id = :trainerId AND t.lastDailyClaim IS NULL")
    int recordFirstDailyClaim(Long trainerId, Instant now, int streak, long reward);

    /**
     * Records a daily claim only if nobody else claimed since {@code previous} was read.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Trainer t SET t.lastDailyClaim = :now, t.dailyStreak = :streak, t.coins = t.coins + :reward "
            + "WHERE t.id = :trainerId AND t.lastDailyClaim = :previous")
    int recordDailyClaim(Long trainerId, Instant previous, Instant now, int streak, long reward);
}
