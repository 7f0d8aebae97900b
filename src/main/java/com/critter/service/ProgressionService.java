package com.critter.service;

import com.critter.config.GameProperties;
import com.critter.dto.ProgressionResult;
import com.critter.event.CreatureEvolvedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Service responsible for experience, level-ups and evolution of creatures and trainers.
 * Each award is one atomic versioned write, retried a bounded number of times on conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressionService {

    private final ProgressionWriter writer;
    private final GameProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Add experience to a creature, levelling and evolving it as the catalog allows.
     * Each evolution step is published to the creature's current owner.
     *
     * @throws IllegalArgumentException if the creature is unknown or the amount is negative
     */
    public ProgressionResult awardExperience(String creatureId, long amount) {
        requireNonNegative(amount);
        ProgressionResult result = withRetries(creatureId, () -> writer.applyToCreature(creatureId, amount));

        if (result.isLevelledUp()) {
            log.info("Creature {} levelled up {} -> {}", creatureId, result.getLevelBefore(), result.getLevelAfter());
        }
        if (result.isEvolved()) {
            log.info("Creature {} evolved into {}", creatureId, result.getEvolutions());
            publishEvolutions(creatureId, result);
        }
        return result;
    }

    private void publishEvolutions(String creatureId, ProgressionResult result) {
        String from = result.getSpeciesBefore();
        for (String to : result.getEvolutions()) {
            eventPublisher.publishEvent(
                    new CreatureEvolvedEvent(creatureId, result.getOwnerId(), from, to, result.getLevelAfter()));
            from = to;
        }
    }

    public ProgressionResult awardTrainerExperience(Long trainerId, long amount) {
        requireNonNegative(amount);
        ProgressionResult result = withRetries(String.valueOf(trainerId), () -> writer.applyToTrainer(trainerId, amount));
        if (result.isLevelledUp()) {
            log.info("Trainer {} reached level {}", trainerId, result.getLevelAfter());
        }
        return result;
    }

    private ProgressionResult withRetries(String subjectId, Supplier<ProgressionResult> attempt) {
        int maxRetries = Math.max(1, properties.progression().maxRetries());
        for (int i = 1; i <= maxRetries; i++) {
            try {
                return attempt.get();
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Concurrent progression update on {} (attempt {}/{})", subjectId, i, maxRetries);
            }
        }
        log.warn("Progression for {} still contended after {} attempts", subjectId, maxRetries);
        return ProgressionResult.contended(subjectId);
    }

    private void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Experience amount must not be negative: " + amount);
        }
    }
}
