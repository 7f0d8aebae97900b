package com.critter.service;

import com.critter.config.Catalog;
import com.critter.config.SpeciesDefinition;
import com.critter.dto.ProgressionResult;
import com.critter.model.Creature;
import com.critter.model.Trainer;
import com.critter.repository.CreatureRepository;
import com.critter.repository.TrainerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One optimistic attempt at applying experience. The versioned save fails with
 * {@link org.springframework.orm.ObjectOptimisticLockingFailureException} if the row changed
 * since it was read; {@link ProgressionService} retries.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional
public class ProgressionWriter {

    static final int MAX_TRAINER_LEVEL = 100;

    private final CreatureRepository creatureRepository;
    private final TrainerRepository trainerRepository;
    private final Catalog catalog;
    private final StatCalculator statCalculator;

    public ProgressionResult applyToCreature(String creatureId, long amount) {
        Creature creature = creatureRepository.findById(creatureId)
                .orElseThrow(() -> new IllegalArgumentException("Creature not found: " + creatureId));

        int levelBefore = creature.getLevel();
        String speciesBefore = creature.getSpeciesCode();
        LevelProgression.Outcome outcome = LevelProgression.apply(levelBefore, creature.getExperience(), amount,
                catalog.experienceCurve(), Creature.MAX_LEVEL);

        List<String> evolutions = new ArrayList<>();
        String speciesCode = creature.getSpeciesCode();
        if (outcome.level() > levelBefore) {
            speciesCode = evolve(speciesCode, outcome.level(), evolutions);
        }

        creature.setExperience(outcome.experience());
        if (outcome.level() != levelBefore || !evolutions.isEmpty()) {
            SpeciesDefinition species = catalog.getSpecies(speciesCode);
            creature.setLevel(outcome.level());
            creature.setSpeciesCode(speciesCode);
            creature.setStats(statCalculator.compute(species, outcome.level(), creature.getNature(), creature.isShiny()));
        }
        creatureRepository.saveAndFlush(creature);

        return ProgressionResult.builder()
                .outcome(ProgressionResult.Outcome.APPLIED)
                .subjectId(creatureId)
                .ownerId(creature.getOwnerId())
                .speciesBefore(speciesBefore)
                .levelBefore(levelBefore)
                .levelAfter(outcome.level())
                .experience(outcome.experience())
                .discardedExperience(outcome.discarded())
                .evolutions(evolutions)
                .build();
    }

    public ProgressionResult applyToTrainer(Long trainerId, long amount) {
        Trainer trainer = trainerRepository.findById(trainerId)
                .orElseThrow(() -> new IllegalArgumentException("Trainer not found: " + trainerId));

        int levelBefore = trainer.getTrainerLevel();
        LevelProgression.Outcome outcome = LevelProgression.apply(levelBefore, trainer.getExperience(), amount,
                catalog.experienceCurve(), MAX_TRAINER_LEVEL);

        trainer.setTrainerLevel(outcome.level());
        trainer.setExperience(outcome.experience());
        trainerRepository.saveAndFlush(trainer);

        return ProgressionResult.builder()
                .outcome(ProgressionResult.Outcome.APPLIED)
                .subjectId(String.valueOf(trainerId))
                .levelBefore(levelBefore)
                .levelAfter(outcome.level())
                .experience(outcome.experience())
                .discardedExperience(outcome.discarded())
                .evolutions(List.of())
                .build();
    }

    /**
     * Follows the evolution chain as far as the level allows, recording each species reached.
     */
    String evolve(String speciesCode, int level, List<String> evolutions) {
        Set<String> visited = new HashSet<>();
        visited.add(speciesCode);
        SpeciesDefinition species = catalog.getSpecies(speciesCode);
        while (species.canEvolveAt(level)) {
            String target = species.evolution().targetSpecies();
            if (!visited.add(target)) {
                log.warn("Evolution cycle detected at species '{}', stopping", target);
                break;
            }
            evolutions.add(target);
            species = catalog.getSpecies(target);
        }
        return species.code();
    }
}
