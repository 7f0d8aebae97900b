package com.critter.ai;

import com.critter.model.AiDifficulty;
import com.critter.model.Battle;
import com.critter.model.BattleAction;
import com.critter.model.BattleSide;

import java.util.Random;

/**
 * Strategy interface for generated battle opponents.
 * Implementations must be deterministic for a given battle state and Random.
 */
public interface BattleStrategy {

    /**
     * Choose the action for {@code side} in the battle's current turn.
     */
    BattleAction chooseAction(Battle battle, BattleSide side, Random random);

    AiDifficulty getDifficulty();
}
