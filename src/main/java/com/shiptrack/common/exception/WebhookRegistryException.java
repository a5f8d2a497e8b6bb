package com.shiptrack.common.exception;

/**
 * Thrown when a webhook subscription operation fails at the tracking provider.
 *
 * Always carries the provider failure as its cause.
 */
public class WebhookRegistryException extends ShipTrackException {

    private final String operation;

    public WebhookRegistryException(String operation, Throwable cause) {
        super("Failed to " + operation + " webhook: " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
