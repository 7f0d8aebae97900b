package com.critter.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleEndReason;
import com.critter.model.BattleLogEntry;
import com.critter.model.BattleLogOutcome;
import com.critter.model.BattleSide;
import com.critter.model.BattleStatus;
import com.critter.model.OpponentType;
import com.critter.support.StubCatalog;
import com.critter.support.TestFixtures;

/**
 * Unit tests for turn resolution: ordering, determinism, fainting and completion.
 */
class BattleResolverTest {

    private BattleResolver resolver;

    @BeforeEach
    void setUp() {
        StubCatalog catalog = StubCatalog.standard();
        resolver = new BattleResolver(catalog, new DamageCalculator(catalog));
    }

    private Battle battle(long seed, BattleCombatant... combatants) {
        return Battle.builder()
                .id("b-1")
                .status(BattleStatus.IN_PROGRESS)
                .challengerId(1L)
                .opponentId(2L)
                .opponentType(OpponentType.PLAYER)
                .rngSeed(seed)
                .turnNumber(1)
                .combatants(new ArrayList<>(List.of(combatants)))
                .build();
    }

    private Battle oneOnOne(long seed, int speedA, int speedB) {
        return battle(seed,
                TestFixtures.combatant(BattleSide.A, 0, "charmander", 100, speedA, "ember", "tackle"),
                TestFixtures.combatant(BattleSide.B, 0, "bulbasaur", 100, speedB, "vine-whip", "tackle"));
    }

    private void submit(Battle battle, BattleAction a, BattleAction b) {
        battle.setPendingAction(BattleSide.A, a);
        battle.setPendingAction(BattleSide.B, b);
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("same seed and actions should produce the same log")
        void shouldReplayIdentically() {
            Battle first = oneOnOne(1234L, 50, 50);
            Battle second = oneOnOne(1234L, 50, 50);

            for (int turn = 0; turn < 3; turn++) {
                submit(first, BattleAction.attack("ember"), BattleAction.attack("tackle"));
                submit(second, BattleAction.attack("ember"), BattleAction.attack("tackle"));
                resolver.resolveTurn(first);
                resolver.resolveTurn(second);
            }

            assertEquals(first.getLog(), second.getLog());
            assertEquals(first.active(BattleSide.B).getCurrentHp(), second.active(BattleSide.B).getCurrentHp());
        }

        @Test
        @DisplayName("log indexes should restart at zero each turn")
        void shouldIndexPerTurn() {
            Battle battle = oneOnOne(7L, 50, 40);
            submit(battle, BattleAction.attack("ember"), BattleAction.attack("tackle"));
            resolver.resolveTurn(battle);
            submit(battle, BattleAction.attack("ember"), BattleAction.attack("tackle"));
            resolver.resolveTurn(battle);

            List<BattleLogEntry> log = battle.getLog();
            assertEquals(4, log.size());
            assertEquals(List.of(1, 1, 2, 2), log.stream().map(BattleLogEntry::getTurn).toList());
            assertEquals(List.of(0, 1, 0, 1), log.stream().map(BattleLogEntry::getActionIndex).toList());
        }
    }

    @Nested
    @DisplayName("Action order")
    class Order {

        @Test
        @DisplayName("faster creature should act first")
        void shouldOrderBySpeed() {
            Battle battle = oneOnOne(1L, 10, 90);
            submit(battle, BattleAction.attack("ember"), BattleAction.attack("tackle"));

            resolver.resolveTurn(battle);

            assertEquals(BattleSide.B, battle.getLog().get(0).getSide());
            assertEquals(BattleSide.A, battle.getLog().get(1).getSide());
        }

        @Test
        @DisplayName("speed ties should go to side A")
        void shouldBreakTiesForChallenger() {
            Battle battle = oneOnOne(1L, 50, 50);
            submit(battle, BattleAction.attack("ember"), BattleAction.attack("tackle"));

            resolver.resolveTurn(battle);

            assertEquals(BattleSide.A, battle.getLog().get(0).getSide());
        }

        @Test
        @DisplayName("a switch should resolve before a faster attack, which then hits the new creature")
        void shouldSwitchBeforeAttack() {
            Battle battle = battle(3L,
                    TestFixtures.combatant(BattleSide.A, 0, "bulbasaur", 100, 10, "tackle"),
                    TestFixtures.combatant(BattleSide.A, 1, "squirtle", 100, 10, "tackle"),
                    TestFixtures.combatant(BattleSide.B, 0, "charmander", 100, 99, "ember"));
            submit(battle, BattleAction.switchTo(1), BattleAction.attack("ember"));

            resolver.resolveTurn(battle);

            BattleLogEntry first = battle.getLog().get(0);
            BattleLogEntry second = battle.getLog().get(1);
            assertEquals(BattleLogOutcome.SWITCHED, first.getOutcome());
            assertEquals(1, battle.getActiveSlotA());
            assertEquals(BattleLogOutcome.HIT, second.getOutcome());
            assertEquals(1, second.getTargetSlot());
            assertEquals(100, battle.combatant(BattleSide.A, 0).getCurrentHp());
            assertTrue(battle.combatant(BattleSide.A, 1).getCurrentHp() < 100);
        }
    }

    @Nested
    @DisplayName("Fainting")
    class Fainting {

        @Test
        @DisplayName("knocking out the last creature should end the battle before the other action")
        void shouldCompleteOnKnockout() {
            Battle battle = battle(5L,
                    TestFixtures.combatant(BattleSide.A, 0, "charmander", 100, 90, "ember"),
                    TestFixtures.combatant(BattleSide.B, 0, "bulbasaur", 1, 10, "vine-whip"));
            submit(battle, BattleAction.attack("ember"), BattleAction.attack("vine-whip"));

            resolver.resolveTurn(battle);

            assertEquals(BattleStatus.COMPLETE, battle.getStatus());
            assertEquals(BattleSide.A, battle.getWinnerSide());
            assertEquals(1L, battle.getWinnerId());
            assertEquals(BattleEndReason.KNOCKOUT, battle.getEndReason());
            assertEquals(List.of(BattleLogOutcome.HIT, BattleLogOutcome.FAINTED),
                    battle.getLog().stream().map(BattleLogEntry::getOutcome).toList());
            assertEquals(1, battle.getTurnNumber());
            assertNull(battle.pendingAction(BattleSide.B));
        }

        @Test
        @DisplayName("a fainted creature should skip its action and be replaced at end of turn")
        void shouldSkipAndAutoSwitch() {
            Battle battle = battle(5L,
                    TestFixtures.combatant(BattleSide.A, 0, "charmander", 100, 90, "ember"),
                    TestFixtures.combatant(BattleSide.B, 0, "bulbasaur", 1, 10, "vine-whip"),
                    TestFixtures.combatant(BattleSide.B, 1, "pidgey", 100, 10, "tackle"));
            submit(battle, BattleAction.attack("ember"), BattleAction.attack("vine-whip"));

            resolver.resolveTurn(battle);

            assertEquals(BattleStatus.IN_PROGRESS, battle.getStatus());
            assertEquals(List.of(BattleLogOutcome.HIT, BattleLogOutcome.FAINTED, BattleLogOutcome.SKIPPED,
                            BattleLogOutcome.AUTO_SWITCH),
                    battle.getLog().stream().map(BattleLogEntry::getOutcome).toList());
            assertEquals(1, battle.getActiveSlotB());
            assertEquals(2, battle.getTurnNumber());
            assertTrue(battle.combatant(BattleSide.B, 1).isParticipated());
        }

        @Test
        @DisplayName("an attack on a creature that is already down should fizzle")
        void shouldFizzle() {
            BattleCombatant downed = TestFixtures.combatant(BattleSide.B, 0, "bulbasaur", 100, 10, "vine-whip");
            downed.setCurrentHp(0);
            Battle battle = battle(5L,
                    TestFixtures.combatant(BattleSide.A, 0, "charmander", 100, 90, "ember"),
                    downed,
                    TestFixtures.combatant(BattleSide.B, 1, "pidgey", 100, 10, "tackle"));
            submit(battle, BattleAction.attack("ember"), BattleAction.attack("vine-whip"));

            resolver.resolveTurn(battle);

            BattleLogEntry fizzle = battle.getLog().get(0);
            assertEquals(BattleLogOutcome.FIZZLE, fizzle.getOutcome());
            assertEquals(0, fizzle.getAmount());
            assertEquals(100, battle.combatant(BattleSide.B, 1).getCurrentHp());
        }
    }

    @Test
    @DisplayName("a potion should heal up to the maximum")
    void shouldHealWithItem() {
        Battle battle = oneOnOne(9L, 50, 10);
        battle.active(BattleSide.A).setCurrentHp(90);
        submit(battle, BattleAction.useItem("potion"), BattleAction.attack("tackle"));

        resolver.resolveTurn(battle);

        BattleLogEntry heal = battle.getLog().get(0);
        assertEquals(BattleLogOutcome.HEALED, heal.getOutcome());
        assertEquals(10, heal.getAmount());
    }

    @Test
    @DisplayName("should refuse to resolve with a missing action")
    void shouldRequireBothActions() {
        Battle battle = oneOnOne(9L, 50, 10);
        battle.setPendingAction(BattleSide.A, BattleAction.attack("ember"));

        assertThrows(IllegalStateException.class, () -> resolver.resolveTurn(battle));
        assertFalse(battle.getLog().stream().findAny().isPresent());
    }

    @Test
    @DisplayName("per-turn generators should differ between turns and repeat for the same turn")
    void shouldDeriveTurnRandom() {
        assertEquals(BattleResolver.turnRandom(42L, 3).nextLong(), BattleResolver.turnRandom(42L, 3).nextLong());
        assertTrue(BattleResolver.turnRandom(42L, 3).nextLong() != BattleResolver.turnRandom(42L, 4).nextLong());
    }
}
