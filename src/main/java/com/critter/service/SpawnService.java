package com.critter.service;

import com.critter.config.GameProperties;
import com.critter.config.SpeciesDefinition;
import com.critter.coordination.CoordinationKeys;
import com.critter.coordination.CoordinationStore;
import com.critter.coordination.LockToken;
import com.critter.dto.ClaimResult;
import com.critter.dto.CreatureDTO;
import com.critter.dto.ProgressionResult;
import com.critter.dto.SpawnDTO;
import com.critter.dto.SpawnResult;
import com.critter.event.CreatureCaughtEvent;
import com.critter.event.SpawnAppearedEvent;
import com.critter.model.Spawn;
import com.critter.model.SpawnStatus;
import com.critter.repository.SpawnRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

/**
 * Service responsible for the spawn lifecycle and claim arbitration.
 * <p>
 * Cooldowns and the per-spawn lock live in the coordination store; the ACTIVE to CAUGHT
 * transition is a conditional update in the state store, so at most one claim can win.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpawnService {

    private final SpawnRepository spawnRepository;
    private final SpawnClaimWriter claimWriter;
    private final CoordinationStore coordinationStore;
    private final RarityTable rarityTable;
    private final TrainerService trainerService;
    private final ProgressionService progressionService;
    private final GameProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Random random;

    /**
     * Roll the per-message spawn chance for a chat and trigger a spawn on success.
     */
    public SpawnResult onChatMessage(Long chatId) {
        if (random.nextDouble() >= properties.spawn().messageSpawnChance()) {
            return SpawnResult.notTriggered();
        }
        return triggerSpawn(chatId);
    }

    /**
     * Spawn a creature in a chat unless the chat is on cooldown or already has a live spawn.
     */
    public SpawnResult triggerSpawn(Long chatId) {
        if (chatId == null) {
            throw new IllegalArgumentException("Chat id is required");
        }
        String cooldownKey = CoordinationKeys.chatSpawnCooldown(chatId);
        Instant now = clock.instant();

        Optional<Duration> remaining = coordinationStore.remainingTtl(cooldownKey);
        if (remaining.isPresent()) {
            log.debug("Chat {} on spawn cooldown for {}", chatId, remaining.get());
            return SpawnResult.onCooldown(remaining.get());
        }

        Optional<SpawnDTO> active = getActiveSpawn(chatId);
        if (active.isPresent()) {
            return SpawnResult.activeSpawnExists(active.get());
        }

        // setIfAbsent both checks and starts the cooldown, so concurrent triggers spawn once
        String marker = now.toString();
        Duration cooldown = properties.spawn().cooldown();
        if (!coordinationStore.setIfAbsent(cooldownKey, marker, cooldown)) {
            return SpawnResult.onCooldown(coordinationStore.remainingTtl(cooldownKey).orElse(cooldown));
        }

        Spawn spawn;
        try {
            spawn = spawnRepository.save(newSpawn(chatId, now));
        } catch (DataAccessException e) {
            coordinationStore.deleteIfValue(cooldownKey, marker);
            throw e;
        }

        SpawnDTO dto = SpawnDTO.fromSpawn(spawn);
        log.info("Spawned {} (level {}, {}{}) in chat {}", spawn.getSpeciesCode(), spawn.getLevel(),
                spawn.getRarity(), spawn.isShiny() ? ", shiny" : "", chatId);
        eventPublisher.publishEvent(new SpawnAppearedEvent(dto));
        return SpawnResult.spawned(dto);
    }

    private Spawn newSpawn(Long chatId, Instant now) {
        GameProperties.SpawnParams params = properties.spawn();
        SpeciesDefinition species = rarityTable.draw(random);
        int minLevel = species.minLevel() != null ? species.minLevel() : params.minLevel();
        int maxLevel = species.maxLevel() != null ? species.maxLevel() : params.maxLevel();
        int level = minLevel + random.nextInt(Math.max(1, maxLevel - minLevel + 1));

        return Spawn.builder()
                .chatId(chatId)
                .speciesCode(species.code())
                .level(Math.max(1, Math.min(100, level)))
                .shiny(random.nextDouble() < params.shinyChance())
                .rarity(species.rarity())
                .status(SpawnStatus.ACTIVE)
                .spawnedAt(now)
                .expiresAt(now.plus(params.expiry()))
                .build();
    }

    /**
     * Claim a spawn for a user. At most one claim per spawn returns CAUGHT.
     *
     * @throws IllegalArgumentException if the spawn does not exist
     */
    public ClaimResult claim(String spawnId, Long userId) {
        if (userId == null) {
            throw new IllegalArgumentException("User id is required");
        }
        Spawn spawn = spawnRepository.findById(spawnId)
                .orElseThrow(() -> new IllegalArgumentException("Spawn not found: " + spawnId));

        Optional<ClaimResult.Outcome> terminal = terminalOutcome(spawn, clock.instant());
        if (terminal.isPresent()) {
            return ClaimResult.of(terminal.get());
        }

        String cooldownKey = CoordinationKeys.userClaimCooldown(userId);
        Duration userCooldown = properties.claim().userCooldown();
        if (!coordinationStore.setIfAbsent(cooldownKey, spawnId, userCooldown)) {
            log.debug("User {} pressed claim again within cooldown", userId);
            return ClaimResult.onCooldown(coordinationStore.remainingTtl(cooldownKey).orElse(userCooldown));
        }

        trainerService.getOrCreateTrainer(userId, null);

        Optional<LockToken> lock = coordinationStore.tryAcquire(
                CoordinationKeys.spawnLock(spawnId), properties.claim().lockTtl());
        if (lock.isEmpty()) {
            log.debug("User {} lost the lock race for spawn {}", userId, spawnId);
            return ClaimResult.of(spawn.isPastDeadline(clock.instant())
                    ? ClaimResult.Outcome.EXPIRED
                    : ClaimResult.Outcome.ALREADY_CLAIMED);
        }

        SpawnClaimWriter.Attempt attempt;
        try {
            attempt = claimWriter.claim(spawnId, userId, clock.instant());
        } finally {
            coordinationStore.release(lock.get());
        }

        if (attempt.outcome() != ClaimResult.Outcome.CAUGHT) {
            return ClaimResult.of(attempt.outcome());
        }

        CreatureDTO creature = CreatureDTO.fromCreature(attempt.creature());
        log.info("Trainer {} caught {} (level {}) from spawn {}", userId, creature.getSpeciesCode(),
                creature.getLevel(), spawnId);

        long trainerExp = spawn.getRarity().getCatchExperience() + spawn.getLevel() / 5;
        ProgressionResult trainerProgress = progressionService.awardTrainerExperience(userId, trainerExp);

        eventPublisher.publishEvent(new CreatureCaughtEvent(spawn.getChatId(), spawnId, userId, creature));
        return ClaimResult.caught(creature, trainerProgress);
    }

    /**
     * The live spawn of a chat, applying expiry if its deadline has passed.
     */
    public Optional<SpawnDTO> getActiveSpawn(Long chatId) {
        Instant now = clock.instant();
        Optional<Spawn> active = spawnRepository.findFirstByChatIdAndStatusOrderBySpawnedAtDesc(chatId, SpawnStatus.ACTIVE);
        if (active.isEmpty()) {
            return Optional.empty();
        }
        Spawn spawn = active.get();
        if (spawn.isPastDeadline(now)) {
            expireLazily(spawn, now);
            return Optional.empty();
        }
        return Optional.of(SpawnDTO.fromSpawn(spawn));
    }

    public SpawnDTO getSpawn(String spawnId) {
        Spawn spawn = spawnRepository.findById(spawnId)
                .orElseThrow(() -> new IllegalArgumentException("Spawn not found: " + spawnId));
        Instant now = clock.instant();
        if (spawn.getStatus() == SpawnStatus.ACTIVE && spawn.isPastDeadline(now)) {
            expireLazily(spawn, now);
            spawn.setStatus(SpawnStatus.EXPIRED);
        }
        return SpawnDTO.fromSpawn(spawn);
    }

    /**
     * Sweep safety net; read paths already expire spawns on their own.
     */
    public int expireOverdueSpawns() {
        int expired = spawnRepository.expireOverdue(clock.instant());
        if (expired > 0) {
            log.info("Expired {} overdue spawn(s)", expired);
        }
        return expired;
    }

    private Optional<ClaimResult.Outcome> terminalOutcome(Spawn spawn, Instant now) {
        if (spawn.getStatus() == SpawnStatus.CAUGHT) {
            return Optional.of(ClaimResult.Outcome.ALREADY_CLAIMED);
        }
        if (spawn.getStatus() == SpawnStatus.EXPIRED) {
            return Optional.of(ClaimResult.Outcome.EXPIRED);
        }
        if (spawn.isPastDeadline(now)) {
            expireLazily(spawn, now);
            return Optional.of(ClaimResult.Outcome.EXPIRED);
        }
        return Optional.empty();
    }

    private void expireLazily(Spawn spawn, Instant now) {
        if (spawnRepository.markExpired(spawn.getId(), now) > 0) {
            log.info("Spawn {} in chat {} expired", spawn.getId(), spawn.getChatId());
        }
    }
}
