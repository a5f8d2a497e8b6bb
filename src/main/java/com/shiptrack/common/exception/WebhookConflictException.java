package com.shiptrack.common.exception;

/**
 * Thrown when a change would give two active webhook subscriptions the same URL.
 */
public class WebhookConflictException extends ShipTrackException {

    public WebhookConflictException(String url, String existingWebhookId) {
        super(String.format("URL %s is already used by active webhook %s", url, existingWebhookId));
    }
}
