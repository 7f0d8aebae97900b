package com.critter.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of one team member taken when the battle starts. Stats are copied, not referenced,
 * so later changes to the owned creature do not affect the running battle.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BattleCombatant {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 1)
    private BattleSide side;

    @Column(nullable = false)
    private int slot;

    /** Null for generated opponents. */
    @Column(length = 36)
    private String creatureId;

    @Column
    private Long ownerId;

    @Column(nullable = false, length = 40)
    private String speciesCode;

    @Column(nullable = false)
    private int level;

    @Column(nullable = false)
    private int maxHp;

    @Column(nullable = false)
    private int currentHp;

    @Column(nullable = false)
    private int attack;

    @Column(nullable = false)
    private int defense;

    @Column(nullable = false)
    private int specialAttack;

    @Column(nullable = false)
    private int specialDefense;

    @Column(nullable = false)
    private int speed;

    @Convert(converter = StringListConverter.class)
    @Column(name = "move_codes", length = 255)
    @Builder.Default
    private List<String> moveCodes = new ArrayList<>();

    @Column(nullable = false)
    private boolean participated;

    public boolean isFainted() {
        return currentHp <= 0;
    }

    public void takeDamage(int damage) {
        currentHp = Math.max(0, currentHp - damage);
    }

    public int heal(int amount) {
        int before = currentHp;
        currentHp = Math.min(maxHp, currentHp + amount);
        return currentHp - before;
    }
}
