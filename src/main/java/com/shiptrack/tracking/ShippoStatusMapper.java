package com.shiptrack.tracking;

import com.shiptrack.shipments.ShipmentStatus;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Maps Shippo tracking status vocabulary to {@link ShipmentStatus}.
 *
 * Total and case-insensitive: anything unrecognised, including null, is PENDING.
 */
@Component
public class ShippoStatusMapper {

    public ShipmentStatus map(String providerStatus) {
        if (providerStatus == null) {
            return ShipmentStatus.PENDING;
        }

        switch (providerStatus.trim().toLowerCase(Locale.ROOT)) {
            case "delivered":
                return ShipmentStatus.DELIVERED;
            case "in_transit":
                return ShipmentStatus.IN_TRANSIT;
            case "out_for_delivery":
                return ShipmentStatus.OUT_FOR_DELIVERY;
            case "exception":
                return ShipmentStatus.EXCEPTION;
            case "returned":
                return ShipmentStatus.RETURNED;
            case "cancelled":
                return ShipmentStatus.CANCELLED;
            default:
                return ShipmentStatus.PENDING;
        }
    }
}
