package com.critter.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One side of a trade: creatures, item quantities and coins.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeOfferRequest {

    @Builder.Default
    private Set<String> creatureIds = new LinkedHashSet<>();

    @Builder.Default
    private Map<String, @Min(1) Integer> items = new LinkedHashMap<>();

    @PositiveOrZero
    private long coins;

    public boolean isEmpty() {
        return (creatureIds == null || creatureIds.isEmpty())
                && (items == null || items.isEmpty())
                && coins == 0;
    }

    public Set<String> getCreatureIds() {
        return creatureIds != null ? creatureIds : Set.of();
    }

    public Map<String, Integer> getItems() {
        return items != null ? items : Map.of();
    }
}
