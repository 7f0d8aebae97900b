package com.critter.service;

import com.critter.dto.InventoryItemDTO;
import com.critter.model.InventoryItem;
import com.critter.repository.InventoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Item quantities per trainer. Joins the caller's transaction so a debit can be rolled back
 * together with the rest of a battle turn or trade exchange.
 */
@Service
@RequiredArgsConstructor
@Transactional
public class InventoryService {

    private final InventoryRepository inventoryRepository;

    /**
     * @return true if the trainer held at least {@code quantity} and it was removed
     */
    public boolean debit(Long ownerId, String itemCode, int quantity) {
        return inventoryRepository.debit(ownerId, itemCode, quantity) > 0;
    }

    public void credit(Long ownerId, String itemCode, int quantity) {
        if (inventoryRepository.credit(ownerId, itemCode, quantity) == 0) {
            inventoryRepository.saveAndFlush(InventoryItem.builder()
                    .ownerId(ownerId)
                    .itemCode(itemCode)
                    .quantity(quantity)
                    .build());
        }
    }

    @Transactional(readOnly = true)
    public int quantityOf(Long ownerId, String itemCode) {
        return inventoryRepository.findByOwnerIdAndItemCode(ownerId, itemCode)
                .map(InventoryItem::getQuantity)
                .orElse(0);
    }

    @Transactional(readOnly = true)
    public List<InventoryItemDTO> getInventory(Long ownerId) {
        return inventoryRepository.findByOwnerIdOrderByItemCodeAsc(ownerId).stream()
                .filter(i -> i.getQuantity() > 0)
                .map(InventoryItemDTO::fromItem)
                .toList();
    }
}
