package com.shiptrack.providers.shippo;

import com.shiptrack.common.exception.ShipTrackException;

/**
 * Wraps every failure talking to the Shippo API: HTTP error statuses,
 * timeouts and unreadable responses.
 */
public class ShippoApiException extends ShipTrackException {

    private final String operation;
    private final int statusCode;

    public ShippoApiException(String operation, int statusCode, Throwable cause) {
        super("Shippo " + operation + " failed"
            + (statusCode > 0 ? " with status " + statusCode : "") + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * HTTP status reported by Shippo, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
