package com.critter.dto;

import com.critter.model.Trainer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * DTO for trainer profile representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrainerDTO {

    private Long id;
    private String displayName;
    private int trainerLevel;
    private long experience;
    private long coins;
    private int dailyStreak;
    private Instant lastDailyClaim;
    private int creaturesCaught;
    private int battlesWon;
    private int battlesLost;
    private List<String> team;

    public static TrainerDTO fromTrainer(Trainer trainer) {
        return TrainerDTO.builder()
                .id(trainer.getId())
                .displayName(trainer.getDisplayName())
                .trainerLevel(trainer.getTrainerLevel())
                .experience(trainer.getExperience())
                .coins(trainer.getCoins())
                .dailyStreak(trainer.getDailyStreak())
                .lastDailyClaim(trainer.getLastDailyClaim())
                .creaturesCaught(trainer.getCreaturesCaught())
                .battlesWon(trainer.getBattlesWon())
                .battlesLost(trainer.getBattlesLost())
                .team(List.copyOf(trainer.getTeam()))
                .build();
    }
}
