package com.shiptrack.common.exception;

/**
 * Base exception for all shipment tracking exceptions.
 */
public class ShipTrackException extends RuntimeException {

    public ShipTrackException(String message) {
        super(message);
    }

    public ShipTrackException(String message, Throwable cause) {
        super(message, cause);
    }
}
