package com.critter.model;

/**
 * Trade escrow states. CONFIRMED, CANCELLED and EXPIRED are terminal.
 */
public enum TradeStatus {
    PROPOSED,
    PARTIALLY_CONFIRMED,
    CONFIRMED,
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == CANCELLED || this == EXPIRED;
    }
}
