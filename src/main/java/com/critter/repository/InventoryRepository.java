package com.critter.repository;

import com.critter.model.InventoryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Repository for InventoryItem entities.
 */
@Repository
public interface InventoryRepository extends JpaRepository<InventoryItem, String> {

    List<InventoryItem> findByOwnerIdOrderByItemCodeAsc(Long ownerId);

    Optional<InventoryItem> findByOwnerIdAndItemCode(Long ownerId, String itemCode);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE InventoryItem i SET i.quantity = i.quantity - :quantity "
            + "WHERE i.ownerId = :ownerId AND i.itemCode = :itemCode AND i.quantity >= :quantity")
    int debit(Long ownerId, String itemCode, int quantity);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE InventoryItem i SET i.quantity = i.quantity + :quantity "
            + "WHERE i.ownerId = :ownerId AND i.itemCode = :itemCode")
    int credit(Long ownerId, String itemCode, int quantity);
}
