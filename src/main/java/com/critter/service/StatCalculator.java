package com.critter.service;

import com.critter.config.BaseStats;
import com.critter.config.SpeciesDefinition;
import com.critter.model.Nature;
import com.critter.model.Nature.StatType;
import com.critter.model.StatBlock;
import org.springframework.stereotype.Component;

/**
 * Derives a creature's stat block from species base stats, level, nature and shiny flag.
 */
@Component
public class StatCalculator {

    static final double SHINY_BONUS = 1.05;

    public StatBlock compute(SpeciesDefinition species, int level, Nature nature, boolean shiny) {
        BaseStats base = species.baseStats();
        return StatBlock.builder()
                .hp(hp(base.hp(), level))
                .attack(other(base.attack(), level, nature, StatType.ATTACK, shiny))
                .defense(other(base.defense(), level, nature, StatType.DEFENSE, shiny))
                .specialAttack(other(base.specialAttack(), level, nature, StatType.SPECIAL_ATTACK, shiny))
                .specialDefense(other(base.specialDefense(), level, nature, StatType.SPECIAL_DEFENSE, shiny))
                .speed(other(base.speed(), level, nature, StatType.SPEED, shiny))
                .build();
    }

    int hp(int base, int level) {
        return (2 * base + 31) * level / 100 + level + 10;
    }

    int other(int base, int level, Nature nature, StatType stat, boolean shiny) {
        double value = (2 * base + 31) * level / 100 + 5;
        value *= nature.modifierFor(stat);
        if (shiny) {
            value *= SHINY_BONUS;
        }
        return (int) value;
    }
}
