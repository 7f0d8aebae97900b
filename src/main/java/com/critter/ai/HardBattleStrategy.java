package com.critter.ai;

import com.critter.model.AiDifficulty;
import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleSide;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Hard strategy - greedy like {@link NormalBattleStrategy}, but switches to a bench creature
 * when that creature would hit the opposing active creature at least twice as hard.
 */
@Component
@RequiredArgsConstructor
public class HardBattleStrategy implements BattleStrategy {

    static final double SWITCH_FACTOR = 2.0;

    private final NormalBattleStrategy greedy;

    @Override
    public AiDifficulty getDifficulty() {
        return AiDifficulty.HARD;
    }

    @Override
    public BattleAction chooseAction(Battle battle, BattleSide side, Random random) {
        BattleCombatant active = battle.active(side);
        BattleCombatant target = battle.active(side.opposite());
        double current = greedy.bestDamage(active, target);

        BattleCombatant bestBench = null;
        double bestBenchDamage = current * SWITCH_FACTOR;
        for (BattleCombatant candidate : battle.team(side)) {
            if (candidate.getSlot() == active.getSlot() || candidate.isFainted()) {
                continue;
            }
            double damage = greedy.bestDamage(candidate, target);
            if (damage > bestBenchDamage) {
                bestBench = candidate;
                bestBenchDamage = damage;
            }
        }

        if (bestBench != null) {
            return BattleAction.switchTo(bestBench.getSlot());
        }
        return BattleAction.attack(greedy.bestMove(active, target));
    }
}
