package com.critter.config;

import com.critter.model.RarityTier;

import java.util.List;

/**
 * Read-only lookup of species, moves and items. Immutable for the process lifetime.
 */
public interface Catalog {

    /**
     * @throws IllegalArgumentException if the species code is unknown
     */
    SpeciesDefinition getSpecies(String code);

    List<SpeciesDefinition> speciesOfRarity(RarityTier rarity);

    List<SpeciesDefinition> allSpecies();

    /**
     * @throws IllegalArgumentException if the move code is unknown
     */
    MoveDefinition getMove(String code);

    /**
     * @throws IllegalArgumentException if the item code is unknown
     */
    ItemDefinition getItem(String code);

    List<ItemDefinition> allItems();

    ExperienceCurve experienceCurve();
}
