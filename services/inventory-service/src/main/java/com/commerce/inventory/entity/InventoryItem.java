package com.commerce.inventory.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Stock record behind reservations. Quantities are only changed through the
 * conditional updates of {@code InventoryItemRepository}, never through setters.
 */
@Entity
@Table(name = "inventory_items")
public class InventoryItem {

    @Id
    private UUID id;

    @Column(nullable = false, unique = true)
    private String sku;

    @Column(name = "on_hand_quantity", nullable = false)
    private int onHandQuantity;

    @Column(name = "reserved_quantity", nullable = false)
    private int reservedQuantity;

    @Column(name = "track_inventory", nullable = false)
    private boolean trackInventory;

    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected InventoryItem() {}

    public InventoryItem(UUID id, String sku, int onHandQuantity, boolean trackInventory, Instant createdAt) {
        this.id = id;
        this.sku = sku;
        this.onHandQuantity = onHandQuantity;
        this.reservedQuantity = 0;
        this.trackInventory = trackInventory;
        this.version = 0;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public int getAvailableQuantity() {
        return onHandQuantity - reservedQuantity;
    }

    public UUID getId() { return id; }
    public String getSku() { return sku; }
    public int getOnHandQuantity() { return onHandQuantity; }
    public int getReservedQuantity() { return reservedQuantity; }
    public boolean isTrackInventory() { return trackInventory; }
    public long getVersion() { return version; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
