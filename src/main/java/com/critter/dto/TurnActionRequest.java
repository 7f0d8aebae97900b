package com.critter.dto;

import com.critter.model.BattleAction;
import com.critter.model.BattleActionType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for submitting a battle action for a given turn.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnActionRequest {

    @NotNull(message = "User id is required")
    private Long userId;

    @Min(value = 1, message = "Turn number starts at 1")
    private int turnNumber;

    @NotNull(message = "Action type is required")
    private BattleActionType type;

    private String moveCode;
    private Integer switchSlot;
    private String itemCode;

    public BattleAction toAction() {
        return new BattleAction(type, moveCode, switchSlot, itemCode);
    }
}
