package com.shiptrack.common.exception;

/**
 * Thrown when a shipment is not found.
 */
public class ShipmentNotFoundException extends ShipTrackException {

    public ShipmentNotFoundException(String reference) {
        super("Shipment not found: " + reference);
    }
}
