package com.commerce.inventory.repository;

import com.commerce.inventory.entity.InventoryItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface InventoryItemRepository extends JpaRepository<InventoryItem, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InventoryItem i WHERE i.id = :id")
    Optional<InventoryItem> findForUpdate(@Param("id") UUID id);

    /** Adds to the reserved quantity unless a tracked item lacks the available stock. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE InventoryItem i
            SET i.reservedQuantity = i.reservedQuantity + :quantity, i.version = i.version + 1, i.updatedAt = :now
            WHERE i.id = :id
              AND (i.trackInventory = false OR i.onHandQuantity - i.reservedQuantity >= :quantity)
            """)
    int hold(@Param("id") UUID id, @Param("quantity") int quantity, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE InventoryItem i
            SET i.reservedQuantity = i.reservedQuantity - :quantity, i.version = i.version + 1, i.updatedAt = :now
            WHERE i.id = :id AND i.reservedQuantity >= :quantity
            """)
    int releaseHold(@Param("id") UUID id, @Param("quantity") int quantity, @Param("now") Instant now);

    /** Turns a hold into a permanent deduction: both reserved and on-hand quantities drop. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE InventoryItem i
            SET i.reservedQuantity = i.reservedQuantity - :quantity,
                i.onHandQuantity = i.onHandQuantity - :quantity,
                i.version = i.version + 1, i.updatedAt = :now
            WHERE i.id = :id AND i.reservedQuantity >= :quantity
            """)
    int deductHold(@Param("id") UUID id, @Param("quantity") int quantity, @Param("now") Instant now);

    /** Changes on-hand stock; a tracked item may not drop below what is already reserved. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE InventoryItem i
            SET i.onHandQuantity = i.onHandQuantity + :delta, i.version = i.version + 1, i.updatedAt = :now
            WHERE i.id = :id
              AND (i.trackInventory = false OR i.onHandQuantity + :delta >= i.reservedQuantity)
            """)
    int adjustOnHand(@Param("id") UUID id, @Param("delta") int delta, @Param("now") Instant now);
}
