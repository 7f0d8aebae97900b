package com.critter.ai;

import com.critter.model.AiDifficulty;
import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleSide;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Easy strategy - picks one of the active creature's moves at random.
 */
@Component
public class EasyBattleStrategy implements BattleStrategy {

    @Override
    public AiDifficulty getDifficulty() {
        return AiDifficulty.EASY;
    }

    @Override
    public BattleAction chooseAction(Battle battle, BattleSide side, Random random) {
        BattleCombatant active = battle.active(side);
        List<String> moves = active.getMoveCodes();
        if (moves.isEmpty()) {
            throw new IllegalStateException("Creature in slot " + active.getSlot() + " has no moves");
        }
        return BattleAction.attack(moves.get(random.nextInt(moves.size())));
    }
}
