package com.critter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
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

import com.critter.coordination.CoordinationKeys;
import com.critter.coordination.InMemoryCoordinationStore;
import com.critter.dto.TurnResult;
import com.critter.event.BattleCompletedEvent;
import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleEndReason;
import com.critter.model.BattleSide;
import com.critter.model.BattleStatus;
import com.critter.model.OpponentType;
import com.critter.model.Trainer;
import com.critter.repository.BattleRepository;
import com.critter.support.MutableClock;
import com.critter.support.TestFixtures;

/**
 * Unit tests for the battle facade: start rules, locking and completion handling.
 */
@ExtendWith(MockitoExtension.class)
class BattleServiceTest {

    private static final Instant START = Instant.parse("2026-01-01T12:00:00Z");

    @Mock private BattleRepository battleRepository;
    @Mock private BattleTurnProcessor processor;
    @Mock private BattleTeamFactory teamFactory;
    @Mock private BattleRewardService rewardService;
    @Mock private TrainerService trainerService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private MutableClock clock;
    private InMemoryCoordinationStore coordinationStore;
    private BattleService battleService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        coordinationStore = new InMemoryCoordinationStore(clock);
        battleService = new BattleService(battleRepository, processor, teamFactory, rewardService, trainerService,
                coordinationStore, TestFixtures.gameProperties(), eventPublisher, clock, new Random(3));
    }

    private Battle battle(BattleStatus status) {
        return Battle.builder()
                .id("b-1")
                .status(status)
                .challengerId(1L)
                .opponentId(2L)
                .opponentType(OpponentType.PLAYER)
                .turnNumber(1)
                .combatants(new ArrayList<>(List.of(
                        TestFixtures.combatant(BattleSide.A, 0, "charmander", 100, 50, "ember"),
                        TestFixtures.combatant(BattleSide.B, 0, "squirtle", 100, 50, "water-gun"))))
                .createdAt(START)
                .lastActivityAt(START)
                .build();
    }

    @Nested
    @DisplayName("startPlayerBattle")
    class StartPlayerBattle {

        @Test
        @DisplayName("should reject battling yourself")
        void shouldRejectSelfBattle() {
            assertThrows(IllegalArgumentException.class, () -> battleService.startPlayerBattle(1L, 1L));
            verifyNoInteractions(battleRepository);
        }

        @Test
        @DisplayName("should reject a trainer who is already battling")
        void shouldRejectBusyTrainer() {
            when(trainerService.getTrainer(1L)).thenReturn(Trainer.builder().id(1L).build());
            when(trainerService.getTrainer(2L)).thenReturn(Trainer.builder().id(2L).build());
            when(battleRepository.existsByParticipantAndStatus(1L, BattleStatus.IN_PROGRESS)).thenReturn(true);

            assertThrows(IllegalStateException.class, () -> battleService.startPlayerBattle(1L, 2L));
            verify(battleRepository, never()).save(any(Battle.class));
        }

        @Test
        @DisplayName("should refuse while another start holds the opponent's start lock")
        void shouldRefuseConcurrentStart() {
            when(trainerService.getTrainer(1L)).thenReturn(Trainer.builder().id(1L).build());
            when(trainerService.getTrainer(2L)).thenReturn(Trainer.builder().id(2L).build());
            coordinationStore.setIfAbsent(CoordinationKeys.trainerBattleStartLock(2L), "other", Duration.ofSeconds(5));

            assertThrows(IllegalStateException.class, () -> battleService.startPlayerBattle(1L, 2L));
            verifyNoInteractions(battleRepository, teamFactory);
            assertTrue(coordinationStore.get(CoordinationKeys.trainerBattleStartLock(1L)).isEmpty());
        }

        @Test
        @DisplayName("should release the start locks when the start is rejected")
        void shouldReleaseStartLocks() {
            when(trainerService.getTrainer(1L)).thenReturn(Trainer.builder().id(1L).build());
            when(trainerService.getTrainer(2L)).thenReturn(Trainer.builder().id(2L).build());
            when(battleRepository.existsByParticipantAndStatus(1L, BattleStatus.IN_PROGRESS)).thenReturn(false);
            when(battleRepository.existsByParticipantAndStatus(2L, BattleStatus.IN_PROGRESS)).thenReturn(true);

            assertThrows(IllegalStateException.class, () -> battleService.startPlayerBattle(1L, 2L));
            assertTrue(coordinationStore.get(CoordinationKeys.trainerBattleStartLock(1L)).isEmpty());
            assertTrue(coordinationStore.get(CoordinationKeys.trainerBattleStartLock(2L)).isEmpty());
        }
    }

    @Nested
    @DisplayName("submitTurn")
    class SubmitTurn {

        @Test
        @DisplayName("should reject users outside the battle")
        void shouldRejectOutsider() {
            when(battleRepository.findById("b-1")).thenReturn(Optional.of(battle(BattleStatus.IN_PROGRESS)));

            assertThrows(IllegalArgumentException.class,
                    () -> battleService.submitTurn("b-1", 3L, 1, BattleAction.attack("ember")));
        }

        @Test
        @DisplayName("should report contention while another submission holds the lock")
        void shouldReportContention() {
            when(battleRepository.findById("b-1")).thenReturn(Optional.of(battle(BattleStatus.IN_PROGRESS)));
            coordinationStore.setIfAbsent(CoordinationKeys.battleLock("b-1"), "other", Duration.ofSeconds(5));

            TurnResult result = battleService.submitTurn("b-1", 1L, 1, BattleAction.attack("ember"));

            assertEquals(TurnResult.Outcome.CONTENDED, result.getOutcome());
            verifyNoInteractions(processor);
        }

        @Test
        @DisplayName("the submission that ends the battle should grant rewards and announce it")
        void shouldFinishBattle() {
            Battle ended = battle(BattleStatus.COMPLETE);
            ended.setWinnerSide(BattleSide.A);
            ended.setWinnerId(1L);
            ended.setEndReason(BattleEndReason.KNOCKOUT);
            when(battleRepository.findById("b-1")).thenReturn(Optional.of(battle(BattleStatus.IN_PROGRESS)));
            when(processor.submit(eq("b-1"), eq(BattleSide.A), eq(1L), eq(1), any(BattleAction.class), eq(START)))
                    .thenReturn(new BattleTurnProcessor.Step(TurnResult.Outcome.BATTLE_COMPLETE, ended, true));

            TurnResult result = battleService.submitTurn("b-1", 1L, 1, BattleAction.attack("ember"));

            assertEquals(TurnResult.Outcome.BATTLE_COMPLETE, result.getOutcome());
            verify(rewardService).grant(ended);
            verify(eventPublisher).publishEvent(any(BattleCompletedEvent.class));
            assertFalse(coordinationStore.get(CoordinationKeys.battleLock("b-1")).isPresent());
        }

        @Test
        @DisplayName("an ordinary turn should not grant rewards")
        void shouldNotRewardOrdinaryTurn() {
            Battle battle = battle(BattleStatus.IN_PROGRESS);
            when(battleRepository.findById("b-1")).thenReturn(Optional.of(battle));
            when(processor.submit(eq("b-1"), eq(BattleSide.B), eq(2L), anyInt(), any(BattleAction.class), any(Instant.class)))
                    .thenReturn(new BattleTurnProcessor.Step(TurnResult.Outcome.WAITING, battle, false));

            battleService.submitTurn("b-1", 2L, 1, BattleAction.attack("water-gun"));

            verifyNoInteractions(rewardService);
        }
    }

    @Test
    @DisplayName("forfeit should be refused while the battle lock is held")
    void shouldRefuseForfeitWhenBusy() {
        when(battleRepository.findById("b-1")).thenReturn(Optional.of(battle(BattleStatus.IN_PROGRESS)));
        coordinationStore.setIfAbsent(CoordinationKeys.battleLock("b-1"), "other", Duration.ofSeconds(5));

        assertThrows(IllegalStateException.class, () -> battleService.forfeit("b-1", 1L));
    }

    @Test
    @DisplayName("the sweep should close inactive battles and reward the survivor")
    void shouldSweepInactiveBattles() {
        Battle stale = battle(BattleStatus.IN_PROGRESS);
        Battle closed = battle(BattleStatus.COMPLETE);
        clock.advance(Duration.ofMinutes(6));
        when(battleRepository.findByStatusAndLastActivityAtLessThanEqual(BattleStatus.IN_PROGRESS,
                clock.instant().minus(Duration.ofMinutes(5)))).thenReturn(List.of(stale));
        when(processor.timeOut("b-1", clock.instant())).thenReturn(Optional.of(closed));

        assertEquals(1, battleService.timeOutInactiveBattles());
        verify(rewardService).grant(closed);
    }
}
