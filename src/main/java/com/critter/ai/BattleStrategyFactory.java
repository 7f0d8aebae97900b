package com.critter.ai;

import com.critter.model.AiDifficulty;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Factory for battle strategies based on difficulty level.
 */
@Service
@RequiredArgsConstructor
public class BattleStrategyFactory {

    private final EasyBattleStrategy easyStrategy;
    private final NormalBattleStrategy normalStrategy;
    private final HardBattleStrategy hardStrategy;

    public BattleStrategy getStrategy(AiDifficulty difficulty) {
        if (difficulty == null) {
            difficulty = AiDifficulty.NORMAL;
        }

        return switch (difficulty) {
            case EASY -> easyStrategy;
            case NORMAL -> normalStrategy;
            case HARD -> hardStrategy;
        };
    }
}
