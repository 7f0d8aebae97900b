package com.critter.service;

import com.critter.ai.BattleStrategyFactory;
import com.critter.config.Catalog;
import com.critter.config.GameProperties;
import com.critter.config.ItemDefinition;
import com.critter.dto.TurnResult;
import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleActionType;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleEndReason;
import com.critter.model.BattleLogOutcome;
import com.critter.model.BattleSide;
import com.critter.repository.BattleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Transactional state transitions of a battle. Callers hold the per-battle lock, so
 * submissions for one battle are applied one at a time and in turn order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional
public class BattleTurnProcessor {

    private final BattleRepository battleRepository;
    private final BattleResolver resolver;
    private final BattleStrategyFactory strategyFactory;
    private final InventoryService inventoryService;
    private final Catalog catalog;
    private final GameProperties properties;

    /**
     * Result of a transition; {@code completedNow} is true only for the call that ended the battle.
     */
    public record Step(TurnResult.Outcome outcome, Battle battle, boolean completedNow) {}

    public Step submit(String battleId, BattleSide side, Long userId, int turnNumber, BattleAction action, Instant now) {
        Battle battle = load(battleId);

        if (!battle.isInProgress()) {
            return new Step(TurnResult.Outcome.NOT_IN_PROGRESS, battle, false);
        }
        if (isInactive(battle, now)) {
            applyTimeout(battle, now);
            return new Step(TurnResult.Outcome.TIMED_OUT, battleRepository.save(battle), true);
        }
        if (turnNumber != battle.getTurnNumber()) {
            return new Step(TurnResult.Outcome.TURN_MISMATCH, battle, false);
        }
        if (battle.pendingAction(side) != null) {
            return new Step(TurnResult.Outcome.ALREADY_SUBMITTED, battle, false);
        }

        validateAction(battle, side, action);
        if (action.getType() == BattleActionType.ITEM
                && !inventoryService.debit(userId, action.getItemCode(), 1)) {
            throw new IllegalArgumentException("No " + action.getItemCode() + " left in your inventory");
        }

        battle.setPendingAction(side, action);
        battle.setLastActivityAt(now);

        if (battle.isAiOpponent() && side == BattleSide.A) {
            BattleAction aiAction = strategyFactory.getStrategy(battle.getAiDifficulty())
                    .chooseAction(battle, BattleSide.B, BattleResolver.aiRandom(battle.getRngSeed(), battle.getTurnNumber()));
            battle.setPendingAction(BattleSide.B, aiAction);
        }

        if (battle.pendingAction(side.opposite()) == null) {
            return new Step(TurnResult.Outcome.WAITING, battleRepository.save(battle), false);
        }

        resolver.resolveTurn(battle);
        if (!battle.isInProgress()) {
            battle.setEndedAt(now);
            log.info("Battle {} ended on turn {}, winner side {}", battle.getId(), battle.getTurnNumber(), battle.getWinnerSide());
            return new Step(TurnResult.Outcome.BATTLE_COMPLETE, battleRepository.save(battle), true);
        }
        return new Step(TurnResult.Outcome.RESOLVED, battleRepository.save(battle), false);
    }

    /**
     * @throws IllegalStateException if the battle is already complete
     */
    public Battle forfeit(String battleId, BattleSide side, Instant now) {
        Battle battle = load(battleId);
        if (!battle.isInProgress()) {
            throw new IllegalStateException("Battle is not in progress");
        }
        resolver.appendMarker(battle, side, BattleLogOutcome.FORFEIT);
        resolver.complete(battle, side.opposite(), BattleEndReason.FORFEIT);
        battle.setEndedAt(now);
        battle.setLastActivityAt(now);
        log.info("Battle {} forfeited by side {}", battleId, side);
        return battleRepository.save(battle);
    }

    /**
     * Closes the battle if it has been inactive too long.
     *
     * @return the closed battle, or empty if it was still live or already complete
     */
    public Optional<Battle> timeOut(String battleId, Instant now) {
        Battle battle = load(battleId);
        if (!battle.isInProgress() || !isInactive(battle, now)) {
            return Optional.empty();
        }
        applyTimeout(battle, now);
        return Optional.of(battleRepository.save(battle));
    }

    public boolean isInactive(Battle battle, Instant now) {
        return !now.isBefore(battle.getLastActivityAt().plus(properties.battle().inactivityTimeout()));
    }

    /**
     * The side still owing an action loses; with both sides silent there is no winner.
     */
    private void applyTimeout(Battle battle, Instant now) {
        boolean submittedA = battle.pendingAction(BattleSide.A) != null;
        boolean submittedB = battle.pendingAction(BattleSide.B) != null;
        BattleSide winner = null;
        if (submittedA && !submittedB) {
            winner = BattleSide.A;
        } else if (submittedB && !submittedA) {
            winner = BattleSide.B;
        }
        resolver.appendMarker(battle, winner == null ? null : winner.opposite(), BattleLogOutcome.TIMEOUT);
        resolver.complete(battle, winner, BattleEndReason.TIMEOUT);
        battle.setEndedAt(now);
        log.info("Battle {} timed out after inactivity, winner side {}", battle.getId(), winner);
    }

    private void validateAction(Battle battle, BattleSide side, BattleAction action) {
        if (action == null || action.getType() == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        BattleCombatant active = battle.active(side);
        switch (action.getType()) {
            case ATTACK -> {
                if (action.getMoveCode() == null || !active.getMoveCodes().contains(action.getMoveCode())) {
                    throw new IllegalArgumentException("Move " + action.getMoveCode() + " is not known by the active creature");
                }
            }
            case SWITCH -> {
                if (action.getSwitchSlot() == null) {
                    throw new IllegalArgumentException("Switch slot is required");
                }
                BattleCombatant target = battle.combatant(side, action.getSwitchSlot());
                if (target.getSlot() == active.getSlot()) {
                    throw new IllegalArgumentException("Creature in slot " + target.getSlot() + " is already active");
                }
                if (target.isFainted()) {
                    throw new IllegalArgumentException("Creature in slot " + target.getSlot() + " has fainted");
                }
            }
            case ITEM -> {
                if (action.getItemCode() == null) {
                    throw new IllegalArgumentException("Item code is required");
                }
                ItemDefinition item = catalog.getItem(action.getItemCode());
                if (item.heal() <= 0) {
                    throw new IllegalArgumentException("Item " + item.code() + " cannot be used in battle");
                }
            }
        }
    }

    private Battle load(String battleId) {
        return battleRepository.findById(battleId)
                .orElseThrow(() -> new IllegalArgumentException("Battle not found: " + battleId));
    }
}
