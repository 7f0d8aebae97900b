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
 * One resolved action and its state delta. The log is append-only and ordered by
 * turn, then action index; replaying it reproduces the battle.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BattleLogEntry {

    @Column(nullable = false)
    private int turn;

    @Column(nullable = false)
    private int actionIndex;

    @Enumerated(EnumType.STRING)
    @Column(length = 1)
    private BattleSide side;

    @Column
    private Integer actorSlot;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private BattleActionType actionType;

    /** Move or item code, depending on the action type. */
    @Column(length = 40)
    private String code;

    @Column
    private Integer targetSlot;

    @Column(nullable = false)
    private int amount;

    @Column
    private Integer targetHpAfter;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BattleLogOutcome outcome;
}
