package com.critter.service;

import com.critter.config.Catalog;
import com.critter.config.ItemDefinition;
import com.critter.config.MoveDefinition;
import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleActionType;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleEndReason;
import com.critter.model.BattleLogEntry;
import com.critter.model.BattleLogOutcome;
import com.critter.model.BattleSide;
import com.critter.model.BattleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Resolves one battle turn from the two pending actions. Pure state transition over the
 * battle aggregate: the same snapshots, seed and actions always produce the same log.
 * <p>
 * Order: SWITCH and ITEM before ATTACK, then higher speed, then side A on ties.
 * Each action reads the target's current state, so an attack on a creature that fainted
 * earlier in the turn fizzles.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BattleResolver {

    private static final long TURN_SALT = 0x9E3779B97F4A7C15L;
    private static final long AI_SALT = 0xC2B2AE3D27D4EB4FL;

    private final Catalog catalog;
    private final DamageCalculator damageCalculator;

    /**
     * Generator for the damage and accuracy rolls of one turn.
     */
    public static Random turnRandom(long seed, int turn) {
        return new Random(seed ^ (turn * TURN_SALT));
    }

    /**
     * Generator for the AI opponent's choice in one turn, independent of the combat rolls.
     */
    public static Random aiRandom(long seed, int turn) {
        return new Random(seed ^ (turn * AI_SALT) ^ AI_SALT);
    }

    private record Ordered(BattleSide side, BattleAction action, int speed) {}

    public void resolveTurn(Battle battle) {
        BattleAction actionA = battle.pendingAction(BattleSide.A);
        BattleAction actionB = battle.pendingAction(BattleSide.B);
        if (actionA == null || actionB == null) {
            throw new IllegalStateException("Both sides must submit before turn " + battle.getTurnNumber() + " resolves");
        }

        int turn = battle.getTurnNumber();
        Random random = turnRandom(battle.getRngSeed(), turn);

        List<Ordered> order = new ArrayList<>(List.of(
                new Ordered(BattleSide.A, actionA, battle.active(BattleSide.A).getSpeed()),
                new Ordered(BattleSide.B, actionB, battle.active(BattleSide.B).getSpeed())));
        order.sort(Comparator.comparingInt((Ordered o) -> -o.action().getType().priority())
                .thenComparingInt(o -> -o.speed())
                .thenComparing(Ordered::side));

        for (Ordered step : order) {
            execute(battle, step.side(), step.action(), turn, random);
            if (!battle.isInProgress()) {
                break;
            }
        }

        battle.clearPendingActions();
        if (battle.isInProgress()) {
            replaceFainted(battle, BattleSide.A, turn);
            replaceFainted(battle, BattleSide.B, turn);
            battle.setTurnNumber(turn + 1);
        }
    }

    private void execute(Battle battle, BattleSide side, BattleAction action, int turn, Random random) {
        BattleCombatant actor = battle.active(side);
        if (actor.isFainted()) {
            append(battle, entry(turn, side, actor, action).outcome(BattleLogOutcome.SKIPPED));
            return;
        }

        switch (action.getType()) {
            case SWITCH -> {
                BattleCombatant incoming = battle.combatant(side, action.getSwitchSlot());
                battle.setActiveSlot(side, incoming.getSlot());
                incoming.setParticipated(true);
                append(battle, entry(turn, side, actor, action)
                        .targetSlot(incoming.getSlot())
                        .targetHpAfter(incoming.getCurrentHp())
                        .outcome(BattleLogOutcome.SWITCHED));
            }
            case ITEM -> {
                ItemDefinition item = catalog.getItem(action.getItemCode());
                int healed = actor.heal(item.heal());
                append(battle, entry(turn, side, actor, action)
                        .targetSlot(actor.getSlot())
                        .amount(healed)
                        .targetHpAfter(actor.getCurrentHp())
                        .outcome(BattleLogOutcome.HEALED));
            }
            case ATTACK -> attack(battle, side, actor, action, turn, random);
        }
    }

    private void attack(Battle battle, BattleSide side, BattleCombatant actor, BattleAction action, int turn, Random random) {
        BattleSide targetSide = side.opposite();
        BattleCombatant target = battle.active(targetSide);
        actor.setParticipated(true);

        if (target.isFainted()) {
            append(battle, entry(turn, side, actor, action)
                    .targetSlot(target.getSlot())
                    .targetHpAfter(0)
                    .outcome(BattleLogOutcome.FIZZLE));
            return;
        }

        MoveDefinition move = catalog.getMove(action.getMoveCode());
        if (!damageCalculator.rollHit(move, random)) {
            append(battle, entry(turn, side, actor, action)
                    .targetSlot(target.getSlot())
                    .targetHpAfter(target.getCurrentHp())
                    .outcome(BattleLogOutcome.MISS));
            return;
        }

        int damage = damageCalculator.rollDamage(actor, target, move, random);
        target.takeDamage(damage);
        append(battle, entry(turn, side, actor, action)
                .targetSlot(target.getSlot())
                .amount(damage)
                .targetHpAfter(target.getCurrentHp())
                .outcome(BattleLogOutcome.HIT));

        if (target.isFainted()) {
            append(battle, BattleLogEntry.builder()
                    .turn(turn)
                    .side(targetSide)
                    .actorSlot(target.getSlot())
                    .targetHpAfter(0)
                    .outcome(BattleLogOutcome.FAINTED));
            if (!battle.hasRemaining(targetSide)) {
                complete(battle, side, BattleEndReason.KNOCKOUT);
            }
        }
    }

    private void replaceFainted(Battle battle, BattleSide side, int turn) {
        BattleCombatant active = battle.active(side);
        if (!active.isFainted()) {
            return;
        }
        battle.team(side).stream()
                .filter(c -> !c.isFainted())
                .findFirst()
                .ifPresent(next -> {
                    battle.setActiveSlot(side, next.getSlot());
                    next.setParticipated(true);
                    append(battle, BattleLogEntry.builder()
                            .turn(turn)
                            .side(side)
                            .actorSlot(active.getSlot())
                            .targetSlot(next.getSlot())
                            .targetHpAfter(next.getCurrentHp())
                            .outcome(BattleLogOutcome.AUTO_SWITCH));
                });
    }

    /**
     * Ends the battle with {@code winner} as the winning side, or no winner when null.
     */
    public void complete(Battle battle, BattleSide winner, BattleEndReason reason) {
        battle.setStatus(BattleStatus.COMPLETE);
        battle.setWinnerSide(winner);
        battle.setWinnerId(winner == null ? null : battle.trainerOf(winner));
        battle.setEndReason(reason);
        battle.clearPendingActions();
        log.debug("Battle {} complete: winner side {} ({})", battle.getId(), winner, reason);
    }

    /**
     * Appends a non-action entry, such as a forfeit or timeout, to the current turn.
     */
    public void appendMarker(Battle battle, BattleSide side, BattleLogOutcome outcome) {
        append(battle, BattleLogEntry.builder()
                .turn(battle.getTurnNumber())
                .side(side)
                .outcome(outcome));
    }

    private BattleLogEntry.BattleLogEntryBuilder entry(int turn, BattleSide side, BattleCombatant actor, BattleAction action) {
        return BattleLogEntry.builder()
                .turn(turn)
                .side(side)
                .actorSlot(actor.getSlot())
                .actionType(action.getType())
                .code(action.getType() == BattleActionType.ITEM ? action.getItemCode() : action.getMoveCode());
    }

    private void append(Battle battle, BattleLogEntry.BattleLogEntryBuilder builder) {
        int index = battle.nextLogIndexForTurn(builder.build().getTurn());
        battle.getLog().add(builder.actionIndex(index).build());
    }
}
