package com.critter.dto;

import com.critter.model.Creature;
import com.critter.model.Nature;
import com.critter.model.RarityTier;
import com.critter.model.StatBlock;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for creature representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreatureDTO {

    private String id;
    private Long ownerId;
    private String speciesCode;
    private String nickname;
    private int level;
    private long experience;
    private Nature nature;
    private boolean shiny;
    private RarityTier rarity;
    private StatBlock stats;
    private boolean inTeam;
    private Instant createdAt;

    public static CreatureDTO fromCreature(Creature creature) {
        return CreatureDTO.builder()
                .id(creature.getId())
                .ownerId(creature.getOwnerId())
                .speciesCode(creature.getSpeciesCode())
                .nickname(creature.getNickname())
                .level(creature.getLevel())
                .experience(creature.getExperience())
                .nature(creature.getNature())
                .shiny(creature.isShiny())
                .rarity(creature.getRarity())
                .stats(creature.getStats())
                .inTeam(creature.isInTeam())
                .createdAt(creature.getCreatedAt())
                .build();
    }
}
