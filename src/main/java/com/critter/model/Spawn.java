package com.critter.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A time-bounded wild appearance in a chat room.
 */
@Entity
@Table(name = "spawns", indexes = {
        @Index(name = "idx_spawn_chat_status", columnList = "chat_id, status"),
        @Index(name = "idx_spawn_expires", columnList = "expires_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Spawn {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    @Column(nullable = false, length = 40)
    private String speciesCode;

    @Column(nullable = false)
    private int level;

    @Column(nullable = false)
    private boolean shiny;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RarityTier rarity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SpawnStatus status;

    @Column(nullable = false)
    private Instant spawnedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column
    private Long caughtBy;

    @Column
    private Instant caughtAt;

    @Version
    private Long version;

    /**
     * A spawn is past its deadline from the expiry instant onwards.
     */
    public boolean isPastDeadline(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
