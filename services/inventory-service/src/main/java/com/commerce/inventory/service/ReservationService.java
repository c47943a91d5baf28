package com.commerce.inventory.service;

import com.commerce.core.error.InsufficientStockException;
import com.commerce.core.error.InvalidStateException;
import com.commerce.core.error.NotFoundException;
import com.commerce.core.error.ValidationException;
import com.commerce.core.eventlog.EventLog;
import com.commerce.events.AggregateTypes;
import com.commerce.events.EventTypes;
import com.commerce.events.inventory.ReservationCommittedEvent;
import com.commerce.events.inventory.ReservationCreatedEvent;
import com.commerce.events.inventory.ReservationReleasedEvent;
import com.commerce.inventory.entity.InventoryReservation;
import com.commerce.inventory.entity.ReferenceType;
import com.commerce.inventory.entity.ReservationStatus;
import com.commerce.inventory.gateway.InventoryGateway;
import com.commerce.inventory.repository.InventoryReservationRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Holds, commits and releases stock. Every state change is a conditional update
 * on the reservation row, so of two racing callers exactly one performs the
 * transition and the other falls into the idempotent or terminal-state branch.
 */
@Service
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    public static final String SYSTEM_ACTOR = "SYSTEM";
    public static final String EXPIRED_REASON = "expired";

    private static final UUID MIN_UUID = new UUID(0L, 0L);

    private final InventoryReservationRepository reservationRepository;
    private final InventoryGateway inventoryGateway;
    private final EventLog eventLog;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final int sweepBatchSize;

    public ReservationService(InventoryReservationRepository reservationRepository,
                              InventoryGateway inventoryGateway,
                              EventLog eventLog,
                              TransactionTemplate transactionTemplate,
                              Clock clock,
                              MeterRegistry meterRegistry,
                              @Value("${reservation.sweep.batch-size:100}") int sweepBatchSize) {
        this.reservationRepository = reservationRepository;
        this.inventoryGateway = inventoryGateway;
        this.eventLog = eventLog;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.sweepBatchSize = sweepBatchSize;
    }

    @Transactional
    public InventoryReservation reserve(UUID inventoryId, int quantity, ReferenceType referenceType,
                                        String referenceId, Duration ttl, String createdBy) {
        return reserve(inventoryId, quantity, referenceType, referenceId, ttl, createdBy, null);
    }

    /**
     * Idempotent on the key derived from the reference. A repeated call returns the
     * existing hold without touching stock.
     *
     * @param ttl null for a hold that never expires
     */
    @Transactional
    public InventoryReservation reserve(UUID inventoryId, int quantity, ReferenceType referenceType,
                                        String referenceId, Duration ttl, String createdBy,
                                        UUID parentReservationId) {
        validateReserve(inventoryId, quantity, referenceType, referenceId, ttl, createdBy);
        String key = referenceType.reservationKey(referenceId);

        var existing = reservationRepository.findByReservationKey(key);
        if (existing.isPresent()) {
            return existingOrReject(existing.get());
        }

        // Serializes reserves on this record; a concurrent caller with the same key sees our row after we commit
        inventoryGateway.lock(inventoryId);
        existing = reservationRepository.findByReservationKey(key);
        if (existing.isPresent()) {
            return existingOrReject(existing.get());
        }

        Instant now = clock.instant();
        InventoryReservation reservation = new InventoryReservation(UUID.randomUUID(), key, inventoryId, quantity,
                ttl == null ? null : now.plus(ttl), referenceType, referenceId, parentReservationId, createdBy, now);

        if (!inventoryGateway.hold(inventoryId, quantity, reservation.getId().toString(), createdBy)) {
            int available = inventoryGateway.getAvailableQuantity(inventoryId);
            meterRegistry.counter("reservations_total", "outcome", "insufficient_stock").increment();
            log.warn("Insufficient stock for {}: available {}, requested {}", key, available, quantity);
            throw new InsufficientStockException(String.format(
                    "Insufficient stock for inventory %s. Available: %d, Requested: %d",
                    inventoryId, available, quantity));
        }
        reservationRepository.save(reservation);

        eventLog.append(AggregateTypes.RESERVATION, reservation.getId(), 1, EventTypes.RESERVATION_CREATED,
                new ReservationCreatedEvent(reservation.getId(), key, inventoryId, quantity, referenceType.name(),
                        referenceId, reservation.getExpiresAt(), createdBy), null);
        meterRegistry.counter("reservations_total", "outcome", "created").increment();
        log.info("Reserved {} units of inventory {} under {}", quantity, inventoryId, key);
        return reservation;
    }

    /**
     * Permanently deducts the held stock. Committing twice is a no-op; a released,
     * expired or past-expiry reservation cannot be committed.
     */
    @Transactional
    public InventoryReservation commit(String reservationKey, String actor, String reason) {
        InventoryReservation reservation = findByKey(reservationKey);
        Instant now = clock.instant();
        if (reservation.getStatus() == ReservationStatus.COMMITTED) {
            log.info("Reservation {} already committed", reservationKey);
            return reservation;
        }
        rejectCommit(reservation, now);

        if (reservationRepository.commitIfActive(reservation.getId(), actor, reason, now) == 0) {
            InventoryReservation current = findByKey(reservationKey);
            if (current.getStatus() == ReservationStatus.COMMITTED) {
                return current;
            }
            rejectCommit(current, now);
            throw new InvalidStateException("Reservation " + reservationKey + " changed concurrently");
        }

        inventoryGateway.deductHold(reservation.getInventoryId(), reservation.getQuantity(),
                reservation.getId().toString(), actor);
        eventLog.appendNext(AggregateTypes.RESERVATION, reservation.getId(), EventTypes.RESERVATION_COMMITTED,
                new ReservationCommittedEvent(reservation.getId(), reservationKey, reservation.getInventoryId(),
                        reservation.getQuantity(), actor, reason), null);
        meterRegistry.counter("reservations_total", "outcome", "committed").increment();
        log.info("Committed reservation {} ({} units of {})",
                reservationKey, reservation.getQuantity(), reservation.getInventoryId());
        return findByKey(reservationKey);
    }

    /**
     * Returns held stock to availability. Releasing twice is a no-op; a committed
     * reservation cannot be released. A hold past its expiry ends as EXPIRED.
     */
    @Transactional
    public InventoryReservation release(String reservationKey, String actor, String reason) {
        return doRelease(reservationKey, actor, reason);
    }

    /**
     * Expires every ACTIVE reservation whose expiry has passed, one transaction per
     * reservation. Failures are logged and skipped.
     *
     * @return the number of reservations expired
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        UUID afterId = MIN_UUID;
        int expired = 0;
        List<InventoryReservation> page;
        do {
            page = reservationRepository.findExpiredAfter(now, afterId, PageRequest.of(0, sweepBatchSize));
            for (InventoryReservation reservation : page) {
                try {
                    transactionTemplate.executeWithoutResult(status ->
                            doRelease(reservation.getReservationKey(), SYSTEM_ACTOR, EXPIRED_REASON));
                    expired++;
                } catch (RuntimeException e) {
                    log.error("Failed to expire reservation {}: {}", reservation.getReservationKey(), e.getMessage(), e);
                }
                afterId = reservation.getId();
            }
        } while (page.size() == sweepBatchSize);

        if (expired > 0) {
            meterRegistry.counter("reservations_expired_total").increment(expired);
            log.info("Expired {} reservations", expired);
        }
        return expired;
    }

    @Transactional(readOnly = true)
    public InventoryReservation findByKey(String reservationKey) {
        return reservationRepository.findByReservationKey(reservationKey)
                .orElseThrow(() -> new NotFoundException("Reservation not found: " + reservationKey));
    }

    @Transactional(readOnly = true)
    public List<InventoryReservation> findByInventory(UUID inventoryId) {
        return reservationRepository.findByInventoryIdOrderByCreatedAtDesc(inventoryId);
    }

    private InventoryReservation doRelease(String reservationKey, String actor, String reason) {
        InventoryReservation reservation = findByKey(reservationKey);
        if (isReleased(reservation)) {
            log.info("Reservation {} already {}", reservationKey, reservation.getStatus());
            return reservation;
        }
        rejectRelease(reservation);

        Instant now = clock.instant();
        ReservationStatus target = reservation.isExpiredAt(now) ? ReservationStatus.EXPIRED : ReservationStatus.RELEASED;
        if (reservationRepository.releaseIfActive(reservation.getId(), target, actor, reason, now) == 0) {
            InventoryReservation current = findByKey(reservationKey);
            if (isReleased(current)) {
                return current;
            }
            rejectRelease(current);
            throw new InvalidStateException("Reservation " + reservationKey + " changed concurrently");
        }

        inventoryGateway.releaseHold(reservation.getInventoryId(), reservation.getQuantity(),
                reservation.getId().toString(), actor);
        String eventType = target == ReservationStatus.EXPIRED
                ? EventTypes.RESERVATION_EXPIRED
                : EventTypes.RESERVATION_RELEASED;
        eventLog.appendNext(AggregateTypes.RESERVATION, reservation.getId(), eventType,
                new ReservationReleasedEvent(reservation.getId(), reservationKey, reservation.getInventoryId(),
                        reservation.getQuantity(), target.name(), actor, reason), null);
        meterRegistry.counter("reservations_total", "outcome", target.name().toLowerCase()).increment();
        log.info("Reservation {} {} by {}: {}", reservationKey, target, actor, reason);
        return findByKey(reservationKey);
    }

    private InventoryReservation existingOrReject(InventoryReservation existing) {
        switch (existing.getStatus()) {
            case ACTIVE -> {
                if (existing.isExpiredAt(clock.instant())) {
                    throw new InvalidStateException("Reservation " + existing.getReservationKey()
                            + " has expired and awaits release");
                }
                log.info("Reservation {} already exists", existing.getReservationKey());
                return existing;
            }
            case COMMITTED -> {
                log.info("Reservation {} already committed", existing.getReservationKey());
                return existing;
            }
            default -> throw new InvalidStateException(String.format(
                    "Reservation with key %s already exists in %s status",
                    existing.getReservationKey(), existing.getStatus()));
        }
    }

    private static void rejectCommit(InventoryReservation reservation, Instant now) {
        if (reservation.getStatus() == ReservationStatus.RELEASED
                || reservation.getStatus() == ReservationStatus.EXPIRED) {
            throw new InvalidStateException(String.format(
                    "Cannot commit reservation %s in %s status",
                    reservation.getReservationKey(), reservation.getStatus()));
        }
        if (reservation.isExpiredAt(now)) {
            throw new InvalidStateException(String.format(
                    "Reservation %s expired at %s and must be released",
                    reservation.getReservationKey(), reservation.getExpiresAt()));
        }
    }

    private static void rejectRelease(InventoryReservation reservation) {
        if (reservation.getStatus() == ReservationStatus.COMMITTED) {
            throw new InvalidStateException("Cannot release committed reservation " + reservation.getReservationKey());
        }
    }

    private static boolean isReleased(InventoryReservation reservation) {
        return reservation.getStatus() == ReservationStatus.RELEASED
                || reservation.getStatus() == ReservationStatus.EXPIRED;
    }

    private static void validateReserve(UUID inventoryId, int quantity, ReferenceType referenceType,
                                        String referenceId, Duration ttl, String createdBy) {
        if (inventoryId == null) {
            throw new ValidationException("inventoryId is required");
        }
        if (quantity <= 0) {
            throw new ValidationException("Reservation quantity must be positive, was " + quantity);
        }
        if (referenceType == null || referenceId == null || referenceId.isBlank()) {
            throw new ValidationException("Reservation reference type and id are required");
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new ValidationException("Reservation ttl must be positive");
        }
        if (createdBy == null || createdBy.isBlank()) {
            throw new ValidationException("createdBy is required");
        }
    }
}
