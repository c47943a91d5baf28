package com.commerce.inventory.gateway;

import com.commerce.core.error.InvalidStateException;
import com.commerce.core.error.NotFoundException;
import com.commerce.core.error.ValidationException;
import com.commerce.inventory.entity.InventoryItem;
import com.commerce.inventory.entity.InventoryMovement;
import com.commerce.inventory.entity.MovementType;
import com.commerce.inventory.repository.InventoryItemRepository;
import com.commerce.inventory.repository.InventoryMovementRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Component
public class JpaInventoryGateway implements InventoryGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaInventoryGateway.class);

    private final InventoryItemRepository itemRepository;
    private final InventoryMovementRepository movementRepository;
    private final Clock clock;

    public JpaInventoryGateway(InventoryItemRepository itemRepository,
                               InventoryMovementRepository movementRepository,
                               Clock clock) {
        this.itemRepository = itemRepository;
        this.movementRepository = movementRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public int getAvailableQuantity(UUID inventoryId) {
        return find(inventoryId).getAvailableQuantity();
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void lock(UUID inventoryId) {
        itemRepository.findForUpdate(inventoryId)
                .orElseThrow(() -> new NotFoundException("Inventory not found: " + inventoryId));
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean hold(UUID inventoryId, int quantity, String reference, String actor) {
        Instant now = clock.instant();
        if (itemRepository.hold(inventoryId, quantity, now) == 0) {
            find(inventoryId);
            return false;
        }
        record(inventoryId, MovementType.RESERVED, quantity, "Reserved", reference, null, actor, now);
        return true;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void releaseHold(UUID inventoryId, int quantity, String reference, String actor) {
        Instant now = clock.instant();
        if (itemRepository.releaseHold(inventoryId, quantity, now) == 0) {
            find(inventoryId);
            throw new InvalidStateException(String.format(
                    "Inventory %s holds less than %d reserved units", inventoryId, quantity));
        }
        record(inventoryId, MovementType.RELEASED, quantity, "Released", reference, null, actor, now);
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void deductHold(UUID inventoryId, int quantity, String reference, String actor) {
        Instant now = clock.instant();
        if (itemRepository.deductHold(inventoryId, quantity, now) == 0) {
            find(inventoryId);
            throw new InvalidStateException(String.format(
                    "Inventory %s holds less than %d reserved units", inventoryId, quantity));
        }
        record(inventoryId, MovementType.COMMITTED, quantity, "Committed", reference, null, actor, now);
    }

    @Override
    @Transactional
    public boolean adjustQuantity(UUID inventoryId, int delta, String adjustmentKey, String actor, String reason) {
        if (delta == 0) {
            throw new ValidationException("Adjustment delta must not be zero");
        }
        lock(inventoryId);
        if (adjustmentKey != null && movementRepository.existsByMovementKey(adjustmentKey)) {
            log.info("Adjustment {} already applied to inventory {}, skipping", adjustmentKey, inventoryId);
            return false;
        }

        Instant now = clock.instant();
        if (itemRepository.adjustOnHand(inventoryId, delta, now) == 0) {
            throw new InvalidStateException(String.format(
                    "Adjusting inventory %s by %d would drop on-hand stock below the reserved quantity",
                    inventoryId, delta));
        }
        record(inventoryId, MovementType.ADJUSTED, delta, reason, null, adjustmentKey, actor, now);
        log.info("Adjusted inventory {} by {} ({})", inventoryId, delta, reason);
        return true;
    }

    private InventoryItem find(UUID inventoryId) {
        return itemRepository.findById(inventoryId)
                .orElseThrow(() -> new NotFoundException("Inventory not found: " + inventoryId));
    }

    private void record(UUID inventoryId, MovementType type, int quantity, String reason,
                        String reference, String movementKey, String actor, Instant now) {
        movementRepository.save(new InventoryMovement(inventoryId, type, quantity, reason, reference,
                movementKey, actor, now));
    }
}
