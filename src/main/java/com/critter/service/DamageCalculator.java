package com.critter.service;

import com.critter.config.Catalog;
import com.critter.config.MoveDefinition;
import com.critter.model.BattleCombatant;
import com.critter.model.MoveCategory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Damage formula: (attack * power / defence) * 0.4 * type effectiveness * roll, at least 1.
 * The roll is uniform in [0.85, 1.0].
 */
@Component
@RequiredArgsConstructor
public class DamageCalculator {

    static final double BASE_FACTOR = 0.4;
    static final double MIN_ROLL = 0.85;
    static final double MAX_ROLL = 1.0;

    private final Catalog catalog;

    public int rollDamage(BattleCombatant attacker, BattleCombatant defender, MoveDefinition move, Random random) {
        double roll = MIN_ROLL + (MAX_ROLL - MIN_ROLL) * random.nextDouble();
        return damage(attacker, defender, move, roll);
    }

    /**
     * Damage at the mean roll, used by AI opponents to rank moves without consuming randomness.
     */
    public double expectedDamage(BattleCombatant attacker, BattleCombatant defender, MoveDefinition move) {
        double mean = (MIN_ROLL + MAX_ROLL) / 2;
        return baseDamage(attacker, defender, move) * mean * move.accuracy() / 100.0;
    }

    public boolean rollHit(MoveDefinition move, Random random) {
        return move.accuracy() >= 100 || random.nextInt(100) < move.accuracy();
    }

    int damage(BattleCombatant attacker, BattleCombatant defender, MoveDefinition move, double roll) {
        return Math.max(1, (int) (baseDamage(attacker, defender, move) * roll));
    }

    private double baseDamage(BattleCombatant attacker, BattleCombatant defender, MoveDefinition move) {
        boolean special = move.category() == MoveCategory.SPECIAL;
        int attack = special ? attacker.getSpecialAttack() : attacker.getAttack();
        int defense = Math.max(1, special ? defender.getSpecialDefense() : defender.getDefense());
        double effectiveness = TypeChart.effectiveness(move.type(),
                catalog.getSpecies(defender.getSpeciesCode()).types());
        return ((double) attack * move.power() / defense) * BASE_FACTOR * effectiveness;
    }
}
