package com.critter.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An action chosen by one side for one turn.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BattleAction {

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private BattleActionType type;

    @Column(length = 40)
    private String moveCode;

    @Column
    private Integer switchSlot;

    @Column(length = 40)
    private String itemCode;

    public static BattleAction attack(String moveCode) {
        return new BattleAction(BattleActionType.ATTACK, moveCode, null, null);
    }

    public static BattleAction switchTo(int slot) {
        return new BattleAction(BattleActionType.SWITCH, null, slot, null);
    }

    public static BattleAction useItem(String itemCode) {
        return new BattleAction(BattleActionType.ITEM, null, null, itemCode);
    }
}
