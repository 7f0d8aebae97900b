package com.critter.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProposeTradeRequest {

    @NotNull(message = "Proposer id is required")
    private Long proposerId;

    @NotNull(message = "Counterparty id is required")
    private Long counterpartyId;

    @Valid
    @NotNull(message = "Offer is required")
    private TradeOfferRequest offer;
}
