package com.critter.event;

import com.critter.dto.TradeDTO;

/**
 * Published when a trade reaches a terminal state, successful or not.
 */
public record TradeSettledEvent(TradeDTO trade) {}
