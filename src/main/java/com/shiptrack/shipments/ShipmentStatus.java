package com.shiptrack.shipments;

/**
 * Internal lifecycle states for a shipment.
 */
public enum ShipmentStatus {
    /**
     * Registered but no carrier movement reported yet, or the provider
     * status is not one we recognise.
     */
    PENDING,

    IN_TRANSIT,

    OUT_FOR_DELIVERY,

    DELIVERED,

    /**
     * Carrier reported a problem (damage, address issue, failed attempt).
     */
    EXCEPTION,

    RETURNED,

    CANCELLED
}
