package com.shiptrack.webhooks;

/**
 * Key layout of webhook data in the shared key-value store.
 */
final class WebhookCacheKeys {

    static final String SUBSCRIPTIONS = "shippo:webhooks";
    static final String STATUS = "shippo:webhook_status";
    static final String OUTCOME = "shippo:webhook_outcome";
    static final String EVENTS_PREFIX = "webhook:events:";

    private WebhookCacheKeys() {
    }

    static String events(String trackingNumber) {
        return EVENTS_PREFIX + trackingNumber;
    }
}
