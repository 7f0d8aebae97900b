package com.critter.service;

import com.critter.config.Catalog;
import com.critter.config.SpeciesDefinition;
import com.critter.dto.ClaimResult;
import com.critter.model.Creature;
import com.critter.model.Nature;
import com.critter.model.Spawn;
import com.critter.model.SpawnStatus;
import com.critter.repository.CreatureRepository;
import com.critter.repository.SpawnRepository;
import com.critter.repository.TrainerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Random;

/**
 * The state-store half of a claim: the ACTIVE to CAUGHT transition and the creature insert
 * commit together or not at all. Runs while the caller holds the spawn lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional
public class SpawnClaimWriter {

    private final SpawnRepository spawnRepository;
    private final CreatureRepository creatureRepository;
    private final TrainerRepository trainerRepository;
    private final Catalog catalog;
    private final StatCalculator statCalculator;
    private final Random random;

    /**
     * Outcome of the write; {@code creature} is set only when caught.
     */
    public record Attempt(ClaimResult.Outcome outcome, Creature creature, Spawn spawn) {}

    public Attempt claim(String spawnId, Long trainerId, Instant now) {
        // Re-read under the lock: the status may have changed since the caller looked
        Spawn spawn = spawnRepository.findById(spawnId)
                .orElseThrow(() -> new IllegalArgumentException("Spawn not found: " + spawnId));

        if (spawn.getStatus() == SpawnStatus.CAUGHT) {
            return new Attempt(ClaimResult.Outcome.ALREADY_CLAIMED, null, spawn);
        }
        if (spawn.getStatus() == SpawnStatus.EXPIRED) {
            return new Attempt(ClaimResult.Outcome.EXPIRED, null, spawn);
        }
        if (spawn.isPastDeadline(now)) {
            spawnRepository.markExpired(spawnId, now);
            return new Attempt(ClaimResult.Outcome.EXPIRED, null, spawn);
        }

        if (spawnRepository.markCaught(spawnId, trainerId, now) == 0) {
            // Lost a race the lock did not cover (lock TTL elapsed mid-claim)
            log.debug("Conditional catch of spawn {} matched no row", spawnId);
            return new Attempt(ClaimResult.Outcome.ALREADY_CLAIMED, null, spawn);
        }

        Creature creature = creatureRepository.save(newCreature(spawn, trainerId, now));
        trainerRepository.incrementCaught(trainerId);
        return new Attempt(ClaimResult.Outcome.CAUGHT, creature, spawn);
    }

    private Creature newCreature(Spawn spawn, Long trainerId, Instant now) {
        SpeciesDefinition species = catalog.getSpecies(spawn.getSpeciesCode());
        Nature[] natures = Nature.values();
        Nature nature = natures[random.nextInt(natures.length)];
        return Creature.builder()
                .ownerId(trainerId)
                .speciesCode(species.code())
                .level(spawn.getLevel())
                .experience(0)
                .nature(nature)
                .shiny(spawn.isShiny())
                .rarity(spawn.getRarity())
                .stats(statCalculator.compute(species, spawn.getLevel(), nature, spawn.isShiny()))
                .inTeam(false)
                .originSpawnId(spawn.getId())
                .caughtInChat(spawn.getChatId())
                .createdAt(now)
                .build();
    }
}
