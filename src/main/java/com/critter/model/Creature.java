package com.critter.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;

/**
 * An owned creature. Created only by a successful claim; never a wild placeholder.
 */
@Entity
@Table(name = "creatures",
        indexes = {
                @Index(name = "idx_creature_owner", columnList = "owner_id"),
                @Index(name = "idx_creature_species", columnList = "species_code")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_creature_origin_spawn", columnNames = "origin_spawn_id")
        })
@DynamicUpdate
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Creature {

    public static final int MAX_LEVEL = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "species_code", nullable = false, length = 40)
    private String speciesCode;

    @Column(length = 40)
    private String nickname;

    @Column(nullable = false)
    private int level;

    @Column(nullable = false)
    private long experience;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Nature nature;

    @Column(nullable = false)
    private boolean shiny;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RarityTier rarity;

    @Embedded
    private StatBlock stats;

    @Column(nullable = false)
    private boolean inTeam;

    /** Spawn this creature was claimed from; unique so a spawn yields at most one creature. */
    @Column(name = "origin_spawn_id", length = 36)
    private String originSpawnId;

    @Column
    private Long caughtInChat;

    @Column(nullable = false)
    private Instant createdAt;

    @Version
    private Long version;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isOwnedBy(Long trainerId) {
        return ownerId != null && ownerId.equals(trainerId);
    }

    public boolean isMaxLevel() {
        return level >= MAX_LEVEL;
    }
}
