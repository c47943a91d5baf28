package com.commerce.inventory.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Audit row for every quantity change. A non-null {@code movementKey} makes the
 * change idempotent: the unique key rejects a second application.
 */
@Entity
@Table(name = "inventory_movements")
public class InventoryMovement {

    @Id
    private UUID id;

    @Column(name = "inventory_id", nullable = false)
    private UUID inventoryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MovementType type;

    @Column(nullable = false)
    private int quantity;

    private String reason;

    private String reference;

    @Column(name = "movement_key", unique = true)
    private String movementKey;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected InventoryMovement() {}

    public InventoryMovement(UUID inventoryId, MovementType type, int quantity, String reason,
                             String reference, String movementKey, String createdBy, Instant createdAt) {
        this.id = UUID.randomUUID();
        this.inventoryId = inventoryId;
        this.type = type;
        this.quantity = quantity;
        this.reason = reason;
        this.reference = reference;
        this.movementKey = movementKey;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public UUID getInventoryId() { return inventoryId; }
    public MovementType getType() { return type; }
    public int getQuantity() { return quantity; }
    public String getReason() { return reason; }
    public String getReference() { return reference; }
    public String getMovementKey() { return movementKey; }
    public String getCreatedBy() { return createdBy; }
    public Instant getCreatedAt() { return createdAt; }
}
