package com.critter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessResourceFailureException;

import com.critter.coordination.CoordinationKeys;
import com.critter.coordination.InMemoryCoordinationStore;
import com.critter.dto.ClaimResult;
import com.critter.dto.ProgressionResult;
import com.critter.dto.SpawnResult;
import com.critter.event.CreatureCaughtEvent;
import com.critter.event.SpawnAppearedEvent;
import com.critter.model.Creature;
import com.critter.model.Nature;
import com.critter.model.RarityTier;
import com.critter.model.Spawn;
import com.critter.model.SpawnStatus;
import com.critter.repository.SpawnRepository;
import com.critter.support.MutableClock;
import com.critter.support.TestFixtures;

/**
 * Unit tests for spawn triggering and claim arbitration.
 */
@ExtendWith(MockitoExtension.class)
class SpawnServiceTest {

    private static final Long CHAT = 100L;
    private static final Instant START = Instant.parse("2026-01-01T12:00:00Z");

    @Mock private SpawnRepository spawnRepository;
    @Mock private SpawnClaimWriter claimWriter;
    @Mock private RarityTable rarityTable;
    @Mock private TrainerService trainerService;
    @Mock private ProgressionService progressionService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private InMemoryCoordinationStore coordinationStore;
    private SpawnService spawnService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        coordinationStore = new InMemoryCoordinationStore(clock);
        spawnService = new SpawnService(spawnRepository, claimWriter, coordinationStore, rarityTable,
                trainerService, progressionService, TestFixtures.gameProperties(), eventPublisher, clock, new Random(42));
    }

    private Spawn activeSpawn() {
        return Spawn.builder()
                .id("s-1")
                .chatId(CHAT)
                .speciesCode("pidgey")
                .level(10)
                .rarity(RarityTier.COMMON)
                .status(SpawnStatus.ACTIVE)
                .spawnedAt(START)
                .expiresAt(START.plus(Duration.ofMinutes(5)))
                .build();
    }

    @Nested
    @DisplayName("triggerSpawn")
    class TriggerSpawn {

        @BeforeEach
        void stubCatalog() {
            when(spawnRepository.findFirstByChatIdAndStatusOrderBySpawnedAtDesc(CHAT, SpawnStatus.ACTIVE))
                    .thenReturn(Optional.empty());
        }

        private void stubSave() {
            when(rarityTable.draw(any(Random.class)))
                    .thenReturn(TestFixtures.species("pidgey", "normal", RarityTier.COMMON));
            when(spawnRepository.save(any(Spawn.class))).thenAnswer(inv -> {
                Spawn spawn = inv.getArgument(0);
                spawn.setId("s-new");
                return spawn;
            });
        }

        @Test
        @DisplayName("should create an active spawn and publish it")
        void shouldSpawn() {
            stubSave();

            SpawnResult result = spawnService.triggerSpawn(CHAT);

            assertEquals(SpawnResult.Outcome.SPAWNED, result.getOutcome());
            assertEquals(SpawnStatus.ACTIVE, result.getSpawn().getStatus());
            assertEquals(START.plus(Duration.ofMinutes(5)), result.getSpawn().getExpiresAt());
            assertTrue(result.getSpawn().getLevel() >= 2 && result.getSpawn().getLevel() <= 20);
            verify(eventPublisher).publishEvent(any(SpawnAppearedEvent.class));
        }

        @Test
        @DisplayName("should refuse a second spawn inside the chat cooldown")
        void shouldRespectCooldown() {
            stubSave();
            spawnService.triggerSpawn(CHAT);
            clock.advance(Duration.ofSeconds(10));

            SpawnResult second = spawnService.triggerSpawn(CHAT);

            assertEquals(SpawnResult.Outcome.ON_COOLDOWN, second.getOutcome());
            assertEquals(Duration.ofSeconds(20), second.getCooldownRemaining());
            verify(spawnRepository, times(1)).save(any(Spawn.class));
        }

        @Test
        @DisplayName("should allow a new spawn once the cooldown has elapsed")
        void shouldSpawnAfterCooldown() {
            stubSave();
            spawnService.triggerSpawn(CHAT);
            clock.advance(Duration.ofSeconds(30));

            assertEquals(SpawnResult.Outcome.SPAWNED, spawnService.triggerSpawn(CHAT).getOutcome());
        }

        @Test
        @DisplayName("should clear the cooldown when the spawn cannot be stored")
        void shouldRollBackCooldownOnStoreFailure() {
            when(rarityTable.draw(any(Random.class)))
                    .thenReturn(TestFixtures.species("pidgey", "normal", RarityTier.COMMON));
            when(spawnRepository.save(any(Spawn.class)))
                    .thenThrow(new DataAccessResourceFailureException("down"));

            assertThrows(DataAccessResourceFailureException.class, () -> spawnService.triggerSpawn(CHAT));
            assertFalse(coordinationStore.get(CoordinationKeys.chatSpawnCooldown(CHAT)).isPresent());
        }
    }

    @Test
    @DisplayName("triggerSpawn should report a live spawn instead of replacing it")
    void shouldReportActiveSpawn() {
        when(spawnRepository.findFirstByChatIdAndStatusOrderBySpawnedAtDesc(CHAT, SpawnStatus.ACTIVE))
                .thenReturn(Optional.of(activeSpawn()));

        SpawnResult result = spawnService.triggerSpawn(CHAT);

        assertEquals(SpawnResult.Outcome.ACTIVE_SPAWN_EXISTS, result.getOutcome());
        verify(spawnRepository, never()).save(any(Spawn.class));
    }

    @Nested
    @DisplayName("claim")
    class Claim {

        @Test
        @DisplayName("should catch the spawn and award trainer experience")
        void shouldCatch() {
            Spawn spawn = activeSpawn();
            Creature creature = Creature.builder()
                    .id("c-1").ownerId(7L).speciesCode("pidgey").level(10).nature(Nature.HARDY)
                    .rarity(RarityTier.COMMON).build();
            when(spawnRepository.findById("s-1")).thenReturn(Optional.of(spawn));
            when(claimWriter.claim(eq("s-1"), eq(7L), any(Instant.class)))
                    .thenReturn(new SpawnClaimWriter.Attempt(ClaimResult.Outcome.CAUGHT, creature, spawn));
            when(progressionService.awardTrainerExperience(7L, 12L))
                    .thenReturn(ProgressionResult.builder().outcome(ProgressionResult.Outcome.APPLIED).build());

            ClaimResult result = spawnService.claim("s-1", 7L);

            assertEquals(ClaimResult.Outcome.CAUGHT, result.getOutcome());
            assertEquals("c-1", result.getCreature().getId());
            verify(trainerService).getOrCreateTrainer(7L, null);
            verify(eventPublisher).publishEvent(any(CreatureCaughtEvent.class));
            assertFalse(coordinationStore.get(CoordinationKeys.spawnLock("s-1")).isPresent(), "lock released");
        }

        @Test
        @DisplayName("should return ALREADY_CLAIMED for a caught spawn without writing")
        void shouldRejectCaught() {
            Spawn spawn = activeSpawn();
            spawn.setStatus(SpawnStatus.CAUGHT);
            when(spawnRepository.findById("s-1")).thenReturn(Optional.of(spawn));

            ClaimResult result = spawnService.claim("s-1", 7L);

            assertEquals(ClaimResult.Outcome.ALREADY_CLAIMED, result.getOutcome());
            verify(claimWriter, never()).claim(any(), anyLong(), any());
        }

        @Test
        @DisplayName("should expire a spawn claimed after its deadline")
        void shouldExpireLazily() {
            when(spawnRepository.findById("s-1")).thenReturn(Optional.of(activeSpawn()));
            clock.advance(Duration.ofMinutes(5));

            ClaimResult result = spawnService.claim("s-1", 7L);

            assertEquals(ClaimResult.Outcome.EXPIRED, result.getOutcome());
            verify(spawnRepository).markExpired(eq("s-1"), any(Instant.class));
            verify(claimWriter, never()).claim(any(), anyLong(), any());
        }

        @Test
        @DisplayName("should put a repeat claim within the user cooldown on cooldown")
        void shouldApplyUserCooldown() {
            Spawn spawn = activeSpawn();
            when(spawnRepository.findById("s-1")).thenReturn(Optional.of(spawn));
            when(claimWriter.claim(eq("s-1"), eq(7L), any(Instant.class)))
                    .thenReturn(new SpawnClaimWriter.Attempt(ClaimResult.Outcome.ALREADY_CLAIMED, null, spawn));

            spawnService.claim("s-1", 7L);
            clock.advance(Duration.ofSeconds(1));
            ClaimResult second = spawnService.claim("s-1", 7L);

            assertEquals(ClaimResult.Outcome.ON_COOLDOWN, second.getOutcome());
            assertEquals(Duration.ofSeconds(2), second.getCooldownRemaining());
        }

        @Test
        @DisplayName("should report ALREADY_CLAIMED when another claimer holds the lock")
        void shouldLoseLockRace() {
            when(spawnRepository.findById("s-1")).thenReturn(Optional.of(activeSpawn()));
            coordinationStore.tryAcquire(CoordinationKeys.spawnLock("s-1"), Duration.ofSeconds(5));

            ClaimResult result = spawnService.claim("s-1", 7L);

            assertEquals(ClaimResult.Outcome.ALREADY_CLAIMED, result.getOutcome());
            verify(claimWriter, never()).claim(any(), anyLong(), any());
        }

        @Test
        @DisplayName("should pass through the writer's outcome when the spawn changed under the lock")
        void shouldPassThroughWriterOutcome() {
            Spawn spawn = activeSpawn();
            when(spawnRepository.findById("s-1")).thenReturn(Optional.of(spawn));
            when(claimWriter.claim(eq("s-1"), eq(7L), any(Instant.class)))
                    .thenReturn(new SpawnClaimWriter.Attempt(ClaimResult.Outcome.ALREADY_CLAIMED, null, spawn));

            ClaimResult result = spawnService.claim("s-1", 7L);

            assertEquals(ClaimResult.Outcome.ALREADY_CLAIMED, result.getOutcome());
            verify(progressionService, never()).awardTrainerExperience(anyLong(), anyLong());
            verify(eventPublisher, never()).publishEvent(any(Object.class));
        }

        @Test
        @DisplayName("should reject an unknown spawn")
        void shouldRejectUnknownSpawn() {
            when(spawnRepository.findById("nope")).thenReturn(Optional.empty());

            assertThrows(IllegalArgumentException.class, () -> spawnService.claim("nope", 7L));
        }
    }

    @Test
    @DisplayName("onChatMessage should not spawn when the roll misses")
    void shouldNotSpawnOnMissedRoll() {
        SpawnService unlucky = new SpawnService(spawnRepository, claimWriter, coordinationStore, rarityTable,
                trainerService, progressionService, TestFixtures.gameProperties(), eventPublisher, clock,
                new Random() {
                    @Override
                    public double nextDouble() {
                        return 0.99;
                    }
                });

        assertEquals(SpawnResult.Outcome.NOT_TRIGGERED, unlucky.onChatMessage(CHAT).getOutcome());
    }
}
