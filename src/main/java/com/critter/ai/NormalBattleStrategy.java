package com.critter.ai;

import com.critter.config.Catalog;
import com.critter.model.AiDifficulty;
import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleSide;
import com.critter.service.DamageCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Normal strategy - always uses the move with the highest expected damage against the
 * opposing active creature. Ties go to the alphabetically first move code.
 */
@Component
@RequiredArgsConstructor
public class NormalBattleStrategy implements BattleStrategy {

    private final Catalog catalog;
    private final DamageCalculator damageCalculator;

    @Override
    public AiDifficulty getDifficulty() {
        return AiDifficulty.NORMAL;
    }

    @Override
    public BattleAction chooseAction(Battle battle, BattleSide side, Random random) {
        BattleCombatant attacker = battle.active(side);
        BattleCombatant defender = battle.active(side.opposite());
        return BattleAction.attack(bestMove(attacker, defender));
    }

    String bestMove(BattleCombatant attacker, BattleCombatant defender) {
        String best = null;
        double bestDamage = -1;
        for (String code : attacker.getMoveCodes()) {
            double damage = expectedDamage(attacker, defender, code);
            if (damage > bestDamage || (damage == bestDamage && code.compareTo(best) < 0)) {
                best = code;
                bestDamage = damage;
            }
        }
        if (best == null) {
            throw new IllegalStateException("Creature in slot " + attacker.getSlot() + " has no moves");
        }
        return best;
    }

    double bestDamage(BattleCombatant attacker, BattleCombatant defender) {
        double best = 0;
        for (String code : attacker.getMoveCodes()) {
            best = Math.max(best, expectedDamage(attacker, defender, code));
        }
        return best;
    }

    private double expectedDamage(BattleCombatant attacker, BattleCombatant defender, String moveCode) {
        return damageCalculator.expectedDamage(attacker, defender, catalog.getMove(moveCode));
    }
}
