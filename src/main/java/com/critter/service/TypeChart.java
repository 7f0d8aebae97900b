package com.critter.service;

import java.util.List;
import java.util.Map;

/**
 * Simplified elemental type chart. Pairs not listed are neutral.
 */
public final class TypeChart {

    private static final Map<String, Map<String, Double>> CHART = Map.of(
            "fire", Map.of("grass", 2.0, "water", 0.5, "fire", 0.5),
            "water", Map.of("fire", 2.0, "grass", 0.5, "water", 0.5),
            "grass", Map.of("water", 2.0, "fire", 0.5, "grass", 0.5),
            "electric", Map.of("water", 2.0, "grass", 0.5, "electric", 0.5, "ground", 0.0),
            "ground", Map.of("electric", 2.0, "grass", 0.5, "flying", 0.0),
            "flying", Map.of("grass", 2.0, "electric", 2.0, "ground", 0.0)
    );

    private TypeChart() {
    }

    public static double effectiveness(String attackingType, String defendingType) {
        return CHART.getOrDefault(attackingType, Map.of()).getOrDefault(defendingType, 1.0);
    }

    /**
     * Product of the multipliers against every type of the defender.
     */
    public static double effectiveness(String attackingType, List<String> defendingTypes) {
        double result = 1.0;
        for (String type : defendingTypes) {
            result *= effectiveness(attackingType, type);
        }
        return result;
    }
}
