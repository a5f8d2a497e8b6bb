package com.shiptrack.common.exception;

/**
 * Thrown when a webhook payload passed authentication but lacks the fields
 * needed to correlate it with a shipment.
 */
public class InvalidWebhookPayloadException extends ShipTrackException {

    public InvalidWebhookPayloadException(String message) {
        super(message);
    }
}
