package com.critter.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a trade operation.
 */
@Data
@Builder
public class TradeResult {

    public enum Outcome {
        PROPOSED,
        COUNTER_OFFERED,
        /** Confirmation recorded; waiting for the other party. */
        CONFIRMATION_RECORDED,
        ALREADY_CONFIRMED,
        /** Both parties confirmed and every transfer was applied. */
        SETTLED,
        CANCELLED,
        /** Something offered was no longer held by its offeror; nothing moved. */
        STALE_OFFER,
        EXPIRED,
        /** The trade is already in a terminal state. */
        NOT_OPEN,
        CONTENDED
    }

    private Outcome outcome;
    private TradeDTO trade;

    public static TradeResult of(Outcome outcome, TradeDTO trade) {
        return TradeResult.builder().outcome(outcome).trade(trade).build();
    }
}
