package com.shiptrack.tracking;

/**
 * Outcome of applying one tracking payload.
 */
public enum SyncResult {
    /**
     * The matching shipment was updated.
     */
    UPDATED,

    /**
     * No shipment matches the payload's carrier and tracking number.
     */
    UNKNOWN_SHIPMENT
}
