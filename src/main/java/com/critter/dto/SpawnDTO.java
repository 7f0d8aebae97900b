package com.critter.dto;

import com.critter.model.RarityTier;
import com.critter.model.Spawn;
import com.critter.model.SpawnStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * DTO for spawn representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpawnDTO {

    private String id;
    private Long chatId;
    private String speciesCode;
    private int level;
    private boolean shiny;
    private RarityTier rarity;
    private SpawnStatus status;
    private Instant spawnedAt;
    private Instant expiresAt;
    private Long caughtBy;

    public static SpawnDTO fromSpawn(Spawn spawn) {
        return SpawnDTO.builder()
                .id(spawn.getId())
                .chatId(spawn.getChatId())
                .speciesCode(spawn.getSpeciesCode())
                .level(spawn.getLevel())
                .shiny(spawn.isShiny())
                .rarity(spawn.getRarity())
                .status(spawn.getStatus())
                .spawnedAt(spawn.getSpawnedAt())
                .expiresAt(spawn.getExpiresAt())
                .caughtBy(spawn.getCaughtBy())
                .build();
    }
}
