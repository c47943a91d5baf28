package com.commerce.inventory.gateway;

import java.util.UUID;

/**
 * Read/write access to the stock record behind reservations. Every method throws
 * {@link com.commerce.core.error.NotFoundException} for an unknown inventory id.
 */
public interface InventoryGateway {

    int getAvailableQuantity(UUID inventoryId);

    /** Blocks other writers of the record until the current transaction ends. */
    void lock(UUID inventoryId);

    /**
     * Moves {@code quantity} from available to reserved.
     *
     * @return false when a tracked record has less available stock than requested
     */
    boolean hold(UUID inventoryId, int quantity, String reference, String actor);

    void releaseHold(UUID inventoryId, int quantity, String reference, String actor);

    void deductHold(UUID inventoryId, int quantity, String reference, String actor);

    /**
     * Restocks ({@code delta > 0}) or writes off on-hand stock. A repeated
     * {@code adjustmentKey} is ignored.
     *
     * @return true if this call applied the adjustment
     */
    boolean adjustQuantity(UUID inventoryId, int delta, String adjustmentKey, String actor, String reason);
}
