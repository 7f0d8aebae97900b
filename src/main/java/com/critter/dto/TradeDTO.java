package com.critter.dto;

import com.critter.model.ItemStack;
import com.critter.model.Trade;
import com.critter.model.TradeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * DTO for trade representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeDTO {

    private String id;
    private Long proposerId;
    private Long counterpartyId;
    private TradeStatus status;
    private List<String> proposerCreatureIds;
    private Map<String, Integer> proposerItems;
    private long proposerCoins;
    private List<String> counterpartyCreatureIds;
    private Map<String, Integer> counterpartyItems;
    private long counterpartyCoins;
    private boolean counterOfferSubmitted;
    private boolean proposerConfirmed;
    private boolean counterpartyConfirmed;
    private String cancelReason;
    private Instant createdAt;
    private Instant expiresAt;
    private Instant settledAt;

    public static TradeDTO fromTrade(Trade trade) {
        return TradeDTO.builder()
                .id(trade.getId())
                .proposerId(trade.getProposerId())
                .counterpartyId(trade.getCounterpartyId())
                .status(trade.getStatus())
                .proposerCreatureIds(List.copyOf(trade.getProposerCreatureIds()))
                .proposerItems(toMap(trade.getProposerItems()))
                .proposerCoins(trade.getProposerCoins())
                .counterpartyCreatureIds(List.copyOf(trade.getCounterpartyCreatureIds()))
                .counterpartyItems(toMap(trade.getCounterpartyItems()))
                .counterpartyCoins(trade.getCounterpartyCoins())
                .counterOfferSubmitted(trade.isCounterOfferSubmitted())
                .proposerConfirmed(trade.isProposerConfirmed())
                .counterpartyConfirmed(trade.isCounterpartyConfirmed())
                .cancelReason(trade.getCancelReason())
                .createdAt(trade.getCreatedAt())
                .expiresAt(trade.getExpiresAt())
                .settledAt(trade.getSettledAt())
                .build();
    }

    private static Map<String, Integer> toMap(Set<ItemStack> stacks) {
        Map<String, Integer> result = new LinkedHashMap<>();
        stacks.forEach(s -> result.put(s.getItemCode(), s.getQuantity()));
        return result;
    }
}
