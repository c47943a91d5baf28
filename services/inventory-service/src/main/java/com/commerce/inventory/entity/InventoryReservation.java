package com.commerce.inventory.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "inventory_reservations")
public class InventoryReservation {

    @Id
    private UUID id;

    @Column(name = "reservation_key", nullable = false, unique = true)
    private String reservationKey;

    @Column(name = "inventory_id", nullable = false)
    private UUID inventoryId;

    @Column(nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReservationStatus status;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "reference_type", nullable = false)
    private ReferenceType referenceType;

    @Column(name = "reference_id", nullable = false)
    private String referenceId;

    @Column(name = "parent_reservation_id")
    private UUID parentReservationId;

    @Column(name = "status_reason")
    private String statusReason;

    @Column(name = "created_by", nullable = false)
    private String createdBy;

    @Column(name = "updated_by")
    private String updatedBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected InventoryReservation() {}

    public InventoryReservation(UUID id, String reservationKey, UUID inventoryId, int quantity, Instant expiresAt,
                                ReferenceType referenceType, String referenceId, UUID parentReservationId,
                                String createdBy, Instant createdAt) {
        this.id = id;
        this.reservationKey = reservationKey;
        this.inventoryId = inventoryId;
        this.quantity = quantity;
        this.status = ReservationStatus.ACTIVE;
        this.expiresAt = expiresAt;
        this.referenceType = referenceType;
        this.referenceId = referenceId;
        this.parentReservationId = parentReservationId;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public UUID getId() { return id; }
    public String getReservationKey() { return reservationKey; }
    public UUID getInventoryId() { return inventoryId; }
    public int getQuantity() { return quantity; }
    public ReservationStatus getStatus() { return status; }
    public Instant getExpiresAt() { return expiresAt; }
    public ReferenceType getReferenceType() { return referenceType; }
    public String getReferenceId() { return referenceId; }
    public UUID getParentReservationId() { return parentReservationId; }
    public String getStatusReason() { return statusReason; }
    public String getCreatedBy() { return createdBy; }
    public String getUpdatedBy() { return updatedBy; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
