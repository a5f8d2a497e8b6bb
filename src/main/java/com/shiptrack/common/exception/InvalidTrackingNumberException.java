package com.shiptrack.common.exception;

/**
 * Thrown when a tracking number does not match the carrier's format.
 */
public class InvalidTrackingNumberException extends ShipTrackException {

    public InvalidTrackingNumberException(String carrier, String trackingNumber) {
        super(String.format("Invalid tracking number format for %s: %s", carrier, trackingNumber));
    }
}
