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
public class CounterOfferRequest {

    @NotNull(message = "User id is required")
    private Long userId;

    @Valid
    private TradeOfferRequest offer;

    public TradeOfferRequest getOffer() {
        return offer != null ? offer : new TradeOfferRequest();
    }
}
