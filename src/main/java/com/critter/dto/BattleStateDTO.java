package com.critter.dto;

import com.critter.model.AiDifficulty;
import com.critter.model.Battle;
import com.critter.model.BattleCombatant;
import com.critter.model.BattleEndReason;
import com.critter.model.BattleLogEntry;
import com.critter.model.BattleSide;
import com.critter.model.BattleStatus;
import com.critter.model.OpponentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Battle state including both team snapshots and the full action log.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BattleStateDTO {

    private String id;
    private BattleStatus status;
    private Long challengerId;
    private Long opponentId;
    private OpponentType opponentType;
    private AiDifficulty aiDifficulty;
    private int turnNumber;
    private int activeSlotA;
    private int activeSlotB;
    private boolean awaitingA;
    private boolean awaitingB;
    private List<CombatantDTO> teamA;
    private List<CombatantDTO> teamB;
    private List<BattleLogEntry> log;
    private BattleSide winnerSide;
    private Long winnerId;
    private BattleEndReason endReason;
    private Instant lastActivityAt;
    private Instant endedAt;

    public static BattleStateDTO fromBattle(Battle battle) {
        return BattleStateDTO.builder()
                .id(battle.getId())
                .status(battle.getStatus())
                .challengerId(battle.getChallengerId())
                .opponentId(battle.getOpponentId())
                .opponentType(battle.getOpponentType())
                .aiDifficulty(battle.getAiDifficulty())
                .turnNumber(battle.getTurnNumber())
                .activeSlotA(battle.getActiveSlotA())
                .activeSlotB(battle.getActiveSlotB())
                .awaitingA(battle.isInProgress() && battle.pendingAction(BattleSide.A) == null)
                .awaitingB(battle.isInProgress() && battle.pendingAction(BattleSide.B) == null)
                .teamA(battle.team(BattleSide.A).stream().map(CombatantDTO::fromCombatant).toList())
                .teamB(battle.team(BattleSide.B).stream().map(CombatantDTO::fromCombatant).toList())
                .log(List.copyOf(battle.getLog()))
                .winnerSide(battle.getWinnerSide())
                .winnerId(battle.getWinnerId())
                .endReason(battle.getEndReason())
                .lastActivityAt(battle.getLastActivityAt())
                .endedAt(battle.getEndedAt())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CombatantDTO {
        private int slot;
        private String creatureId;
        private String speciesCode;
        private int level;
        private int maxHp;
        private int currentHp;
        private int speed;
        private List<String> moveCodes;
        private boolean fainted;

        public static CombatantDTO fromCombatant(BattleCombatant combatant) {
            return CombatantDTO.builder()
                    .slot(combatant.getSlot())
                    .creatureId(combatant.getCreatureId())
                    .speciesCode(combatant.getSpeciesCode())
                    .level(combatant.getLevel())
                    .maxHp(combatant.getMaxHp())
                    .currentHp(combatant.getCurrentHp())
                    .speed(combatant.getSpeed())
                    .moveCodes(List.copyOf(combatant.getMoveCodes()))
                    .fainted(combatant.isFainted())
                    .build();
        }
    }
}
