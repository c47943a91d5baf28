package com.commerce.inventory.repository;

import com.commerce.inventory.entity.InventoryReservation;
import com.commerce.inventory.entity.ReservationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface InventoryReservationRepository extends JpaRepository<InventoryReservation, UUID> {

    Optional<InventoryReservation> findByReservationKey(String reservationKey);

    List<InventoryReservation> findByInventoryIdOrderByCreatedAtDesc(UUID inventoryId);

    /** ACTIVE and unexpired to COMMITTED; returns 0 when another caller moved it first or it expired. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE InventoryReservation r
            SET r.status = com.commerce.inventory.entity.ReservationStatus.COMMITTED,
                r.updatedBy = :actor, r.statusReason = :reason, r.updatedAt = :now
            WHERE r.id = :id
              AND r.status = com.commerce.inventory.entity.ReservationStatus.ACTIVE
              AND (r.expiresAt IS NULL OR r.expiresAt > :now)
            """)
    int commitIfActive(@Param("id") UUID id, @Param("actor") String actor,
                       @Param("reason") String reason, @Param("now") Instant now);

    /** ACTIVE to RELEASED or EXPIRED; returns 0 when the reservation already left ACTIVE. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE InventoryReservation r
            SET r.status = :target, r.updatedBy = :actor, r.statusReason = :reason, r.updatedAt = :now
            WHERE r.id = :id
              AND r.status = com.commerce.inventory.entity.ReservationStatus.ACTIVE
            """)
    int releaseIfActive(@Param("id") UUID id, @Param("target") ReservationStatus target,
                        @Param("actor") String actor, @Param("reason") String reason, @Param("now") Instant now);

    @Query("""
            SELECT r FROM InventoryReservation r
            WHERE r.status = com.commerce.inventory.entity.ReservationStatus.ACTIVE
              AND r.expiresAt <= :now
              AND r.id > :afterId
            ORDER BY r.id
            """)
    List<InventoryReservation> findExpiredAfter(@Param("now") Instant now, @Param("afterId") UUID afterId,
                                                Pageable pageable);
}
