package com.critter.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Two-party exchange held in escrow until both parties confirm.
 * Nothing changes owner before the transition into CONFIRMED.
 */
@Entity
@Table(name = "trades", indexes = {
        @Index(name = "idx_trade_status", columnList = "status"),
        @Index(name = "idx_trade_proposer", columnList = "proposer_id"),
        @Index(name = "idx_trade_counterparty", columnList = "counterparty_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Trade {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "proposer_id", nullable = false)
    private Long proposerId;

    @Column(name = "counterparty_id", nullable = false)
    private Long counterpartyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TradeStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_proposer_creatures", joinColumns = @JoinColumn(name = "trade_id"))
    @Column(name = "creature_id", nullable = false, length = 36)
    @Builder.Default
    private Set<String> proposerCreatureIds = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_proposer_items", joinColumns = @JoinColumn(name = "trade_id"))
    @Builder.Default
    private Set<ItemStack> proposerItems = new LinkedHashSet<>();

    @Column(nullable = false)
    private long proposerCoins;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_counterparty_creatures", joinColumns = @JoinColumn(name = "trade_id"))
    @Column(name = "creature_id", nullable = false, length = 36)
    @Builder.Default
    private Set<String> counterpartyCreatureIds = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trade_counterparty_items", joinColumns = @JoinColumn(name = "trade_id"))
    @Builder.Default
    private Set<ItemStack> counterpartyItems = new LinkedHashSet<>();

    @Column(nullable = false)
    private long counterpartyCoins;

    @Column(nullable = false)
    private boolean counterOfferSubmitted;

    @Column(nullable = false)
    private boolean proposerConfirmed;

    @Column(nullable = false)
    private boolean counterpartyConfirmed;

    @Column(length = 120)
    private String cancelReason;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column
    private Instant settledAt;

    @Version
    private Long version;

    public boolean isParty(Long trainerId) {
        return proposerId.equals(trainerId) || counterpartyId.equals(trainerId);
    }

    public boolean isProposer(Long trainerId) {
        return proposerId.equals(trainerId);
    }

    public boolean hasConfirmed(Long trainerId) {
        return isProposer(trainerId) ? proposerConfirmed : counterpartyConfirmed;
    }

    public void markConfirmed(Long trainerId) {
        if (isProposer(trainerId)) {
            proposerConfirmed = true;
        } else {
            counterpartyConfirmed = true;
        }
    }

    public boolean bothConfirmed() {
        return proposerConfirmed && counterpartyConfirmed;
    }

    public boolean isPastDeadline(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
