package com.critter.dto;

import com.critter.model.InventoryItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryItemDTO {

    private String itemCode;
    private int quantity;

    public static InventoryItemDTO fromItem(InventoryItem item) {
        return new InventoryItemDTO(item.getItemCode(), item.getQuantity());
    }
}
