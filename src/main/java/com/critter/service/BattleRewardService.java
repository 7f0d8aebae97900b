package com.critter.service;

import com.critter.config.GameProperties;
import com.critter.dto.ProgressionResult;
import com.critter.model.Battle;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleSide;
import com.critter.repository.TrainerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the consequences of a finished battle: win/loss counters, the winner's coins and
 * experience for the winning creatures that took part.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BattleRewardService {

    private final TrainerRepository trainerRepository;
    private final ProgressionService progressionService;
    private final GameProperties properties;

    /**
     * @return ids of winning creatures whose experience could not be written because the
     *         creature stayed contended through a second round of retries
     */
    public List<String> grant(Battle battle) {
        BattleSide winnerSide = battle.getWinnerSide();
        if (winnerSide == null) {
            log.debug("Battle {} ended without a winner, no rewards", battle.getId());
            return List.of();
        }
        Long winnerId = battle.getWinnerId();
        Long loserId = battle.trainerOf(winnerSide.opposite());

        if (loserId != null) {
            trainerRepository.recordLoss(loserId);
        }
        if (winnerId == null) {
            return List.of();
        }

        trainerRepository.recordWin(winnerId);
        long coins = coinReward(battle);
        trainerRepository.creditCoins(winnerId, coins);

        long experience = experienceReward(battle, winnerSide.opposite());
        List<String> contended = new ArrayList<>();
        for (BattleCombatant combatant : battle.team(winnerSide)) {
            if (combatant.isParticipated() && combatant.getCreatureId() != null
                    && !award(combatant.getCreatureId(), experience)) {
                contended.add(combatant.getCreatureId());
            }
        }
        // one more round once the rest of the team has been written
        List<String> unrewarded = new ArrayList<>();
        for (String creatureId : contended) {
            if (!award(creatureId, experience)) {
                log.warn("Battle {}: {} exp for creature {} not applied, still contended", battle.getId(), experience, creatureId);
                unrewarded.add(creatureId);
            }
        }
        log.info("Trainer {} won battle {}: {} coins, {} exp per participant", winnerId, battle.getId(), coins, experience);
        return unrewarded;
    }

    private boolean award(String creatureId, long experience) {
        return progressionService.awardExperience(creatureId, experience).getOutcome() != ProgressionResult.Outcome.CONTENDED;
    }

    long coinReward(Battle battle) {
        GameProperties.BattleParams params = properties.battle();
        return params.coinRewardBase() + params.coinRewardPerMember() * battle.team(BattleSide.A).size();
    }

    /**
     * Sum of the losing team's levels times the per-level factor.
     */
    long experienceReward(Battle battle, BattleSide loserSide) {
        int levels = battle.team(loserSide).stream().mapToInt(BattleCombatant::getLevel).sum();
        return (long) levels * properties.battle().expPerDefeatedLevel();
    }
}
