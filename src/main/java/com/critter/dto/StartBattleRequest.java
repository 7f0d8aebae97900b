package com.critter.dto;

import com.critter.model.AiDifficulty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for starting a battle. Without an opponent id the challenger fights a generated team.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StartBattleRequest {

    @NotNull(message = "Challenger id is required")
    private Long challengerId;

    private Long opponentId;

    private AiDifficulty difficulty;

    public AiDifficulty getDifficulty() {
        return difficulty != null ? difficulty : AiDifficulty.NORMAL;
    }
}
