package com.shiptrack.common.exception;

/**
 * Thrown when a shipment with the same tracking number already exists.
 */
public class DuplicateShipmentException extends ShipTrackException {

    public DuplicateShipmentException(String trackingNumber) {
        super("A shipment with tracking number " + trackingNumber + " already exists");
    }
}
