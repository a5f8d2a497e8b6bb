package com.shiptrack.common.exception;

/**
 * Thrown when the tracking provider has no webhook subscription with the given ID.
 */
public class WebhookNotFoundException extends ShipTrackException {

    public WebhookNotFoundException(String webhookId) {
        super("Webhook not found: " + webhookId);
    }
}
