package com.critter.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A chat platform user taking part in the game. The id is the platform user id.
 * Coins and battle counters are only changed through conditional repository updates,
 * so entity saves write changed columns only.
 */
@Entity
@Table(name = "trainers", indexes = {
        @Index(name = "idx_trainer_level", columnList = "trainer_level")
})
@DynamicUpdate
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Trainer {

    public static final int MAX_TEAM_SIZE = 6;

    @Id
    private Long id;

    @Column(length = 64)
    private String displayName;

    @Column(name = "trainer_level", nullable = false)
    @Builder.Default
    private int trainerLevel = 1;

    @Column(nullable = false)
    @Builder.Default
    private long experience = 0;

    @Column(nullable = false)
    @Builder.Default
    private long coins = 0;

    @Column(nullable = false)
    @Builder.Default
    private int dailyStreak = 0;

    @Column
    private Instant lastDailyClaim;

    @Column(nullable = false)
    @Builder.Default
    private int creaturesCaught = 0;

    @Column(nullable = false)
    @Builder.Default
    private int battlesWon = 0;

    @Column(nullable = false)
    @Builder.Default
    private int battlesLost = 0;

    /** Ordered active team, at most {@link #MAX_TEAM_SIZE} creature ids. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trainer_team", joinColumns = @JoinColumn(name = "trainer_id"))
    @OrderColumn(name = "team_position")
    @Column(name = "creature_id", nullable = false)
    @Builder.Default
    private List<String> team = new ArrayList<>();

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

    public int getBattlesTotal() {
        return battlesWon + battlesLost;
    }
}
