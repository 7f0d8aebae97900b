package com.critter.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived stats of a creature, recomputed from species base stats, level, nature and shiny flag.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatBlock {

    @Column(name = "stat_hp", nullable = false)
    private int hp;

    @Column(name = "stat_attack", nullable = false)
    private int attack;

    @Column(name = "stat_defense", nullable = false)
    private int defense;

    @Column(name = "stat_special_attack", nullable = false)
    private int specialAttack;

    @Column(name = "stat_special_defense", nullable = false)
    private int specialDefense;

    @Column(name = "stat_speed", nullable = false)
    private int speed;
}
