package com.shiptrack.shipments;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update of a shipment's tracking fields.
 *
 * Null {@code trackingStatus}, {@code estimatedDelivery} and
 * {@code actualDelivery} leave the stored value untouched. Every applied field
 * is a plain overwrite, so applying the same update twice is harmless.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingUpdate {

    private String trackingStatus;
    private ShipmentStatus status;
    private Instant estimatedDelivery;
    private Instant actualDelivery;

    /**
     * Provider tracking history as a JSON array, newest first.
     */
    private String trackingEvents;

    private Instant lastTrackedAt;
}
