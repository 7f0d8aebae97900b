package com.critter.model;

/**
 * Natures nudge one stat up by 10% and another down by 10%. HARDY is neutral.
 */
public enum Nature {
    HARDY(null, null),
    ADAMANT(StatType.ATTACK, StatType.SPECIAL_ATTACK),
    MODEST(StatType.SPECIAL_ATTACK, StatType.ATTACK),
    TIMID(StatType.SPEED, StatType.ATTACK),
    JOLLY(StatType.SPEED, StatType.SPECIAL_ATTACK),
    BOLD(StatType.DEFENSE, StatType.ATTACK),
    CALM(StatType.SPECIAL_DEFENSE, StatType.ATTACK);

    private final StatType raised;
    private final StatType lowered;

    Nature(StatType raised, StatType lowered) {
        this.raised = raised;
        this.lowered = lowered;
    }

    public double modifierFor(StatType stat) {
        if (stat == raised) return 1.1;
        if (stat == lowered) return 0.9;
        return 1.0;
    }

    public enum StatType {
        HP,
        ATTACK,
        DEFENSE,
        SPECIAL_ATTACK,
        SPECIAL_DEFENSE,
        SPEED
    }
}
