package com.critter.event;

/**
 * Published once per evolution step, so a chained evolution yields several events.
 */
public record CreatureEvolvedEvent(String creatureId, Long ownerId, String fromSpecies, String toSpecies, int level) {}
