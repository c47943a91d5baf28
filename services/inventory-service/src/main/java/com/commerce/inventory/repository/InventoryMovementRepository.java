package com.commerce.inventory.repository;

import com.commerce.inventory.entity.InventoryMovement;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface InventoryMovementRepository extends JpaRepository<InventoryMovement, UUID> {

    boolean existsByMovementKey(String movementKey);
}
