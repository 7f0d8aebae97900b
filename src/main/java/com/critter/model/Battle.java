package com.critter.model;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A turn-based battle between two team snapshots.
 */
@Entity
@Table(name = "battles", indexes = {
        @Index(name = "idx_battle_status", columnList = "status"),
        @Index(name = "idx_battle_challenger", columnList = "challenger_id"),
        @Index(name = "idx_battle_opponent", columnList = "opponent_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Battle {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BattleStatus status;

    @Column(name = "challenger_id", nullable = false)
    private Long challengerId;

    /** Null when the opponent is generated. */
    @Column(name = "opponent_id")
    private Long opponentId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private OpponentType opponentType;

    @Enumerated(EnumType.STRING)
    @Column(length = 8)
    private AiDifficulty aiDifficulty;

    /** Seed for every random draw in this battle; per-turn generators derive from it. */
    @Column(nullable = false)
    private long rngSeed;

    /** The next turn to be resolved, starting at 1. */
    @Column(nullable = false)
    private int turnNumber;

    @Column(nullable = false)
    private int activeSlotA;

    @Column(nullable = false)
    private int activeSlotB;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "type", column = @Column(name = "pending_a_type", length = 8)),
            @AttributeOverride(name = "moveCode", column = @Column(name = "pending_a_move", length = 40)),
            @AttributeOverride(name = "switchSlot", column = @Column(name = "pending_a_switch")),
            @AttributeOverride(name = "itemCode", column = @Column(name = "pending_a_item", length = 40))
    })
    private BattleAction pendingActionA;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "type", column = @Column(name = "pending_b_type", length = 8)),
            @AttributeOverride(name = "moveCode", column = @Column(name = "pending_b_move", length = 40)),
            @AttributeOverride(name = "switchSlot", column = @Column(name = "pending_b_switch")),
            @AttributeOverride(name = "itemCode", column = @Column(name = "pending_b_item", length = 40))
    })
    private BattleAction pendingActionB;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "battle_combatants", joinColumns = @JoinColumn(name = "battle_id"))
    @OrderColumn(name = "combatant_index")
    @Builder.Default
    private List<BattleCombatant> combatants = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "battle_log", joinColumns = @JoinColumn(name = "battle_id"))
    @OrderColumn(name = "log_index")
    @Builder.Default
    private List<BattleLogEntry> log = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 1)
    private BattleSide winnerSide;

    @Column
    private Long winnerId;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private BattleEndReason endReason;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant lastActivityAt;

    @Column
    private Instant endedAt;

    @Version
    private Long version;

    public boolean isInProgress() {
        return status == BattleStatus.IN_PROGRESS;
    }

    public boolean isAiOpponent() {
        return opponentType == OpponentType.AI;
    }

    public Optional<BattleSide> sideOf(Long trainerId) {
        if (trainerId == null) return Optional.empty();
        if (trainerId.equals(challengerId)) return Optional.of(BattleSide.A);
        if (trainerId.equals(opponentId)) return Optional.of(BattleSide.B);
        return Optional.empty();
    }

    public Long trainerOf(BattleSide side) {
        return side == BattleSide.A ? challengerId : opponentId;
    }

    public List<BattleCombatant> team(BattleSide side) {
        return combatants.stream()
                .filter(c -> c.getSide() == side)
                .sorted(Comparator.comparingInt(BattleCombatant::getSlot))
                .toList();
    }

    public BattleCombatant combatant(BattleSide side, int slot) {
        return combatants.stream()
                .filter(c -> c.getSide() == side && c.getSlot() == slot)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No combatant in slot " + slot + " for side " + side));
    }

    public int activeSlot(BattleSide side) {
        return side == BattleSide.A ? activeSlotA : activeSlotB;
    }

    public void setActiveSlot(BattleSide side, int slot) {
        if (side == BattleSide.A) {
            activeSlotA = slot;
        } else {
            activeSlotB = slot;
        }
    }

    public BattleCombatant active(BattleSide side) {
        return combatant(side, activeSlot(side));
    }

    public boolean hasRemaining(BattleSide side) {
        return team(side).stream().anyMatch(c -> !c.isFainted());
    }

    public BattleAction pendingAction(BattleSide side) {
        BattleAction action = side == BattleSide.A ? pendingActionA : pendingActionB;
        // An embedded value with all columns null is loaded back as null or as an empty instance
        return action == null || action.getType() == null ? null : action;
    }

    public void setPendingAction(BattleSide side, BattleAction action) {
        if (side == BattleSide.A) {
            pendingActionA = action;
        } else {
            pendingActionB = action;
        }
    }

    public void clearPendingActions() {
        pendingActionA = null;
        pendingActionB = null;
    }

    public int nextLogIndexForTurn(int turn) {
        return (int) log.stream().filter(e -> e.getTurn() == turn).count();
    }
}
