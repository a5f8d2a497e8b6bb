package com.shiptrack.tracking;

import com.shiptrack.shipments.Shipment;
import com.shiptrack.shipments.ShipmentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Initial tracking state obtained when a shipment is registered with Shippo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackingSnapshot {

    private String trackingStatus;
    private ShipmentStatus status;
    private Instant estimatedDelivery;
    private String trackingEvents;

    /**
     * Raw registration response, null when registration failed.
     */
    private String providerData;

    public static TrackingSnapshot unknown() {
        return TrackingSnapshot.builder()
            .trackingStatus(Shipment.UNKNOWN_TRACKING_STATUS)
            .status(ShipmentStatus.PENDING)
            .trackingEvents("[]")
            .build();
    }
}
