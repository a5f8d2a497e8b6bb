package com.shiptrack.webhooks;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shippo tracking events this service subscribes to and synchronizes.
 */
public enum WebhookEventType {

    TRACK_UPDATED("track_updated"),
    TRACK_DELIVERED("track_delivered"),
    TRACK_RETURNED("track_returned"),
    TRACK_EXCEPTION("track_exception"),
    TRACK_FAILURE("track_failure");

    private static final Set<String> DEFAULT_EVENTS = Collections.unmodifiableSet(
        Arrays.stream(values())
            .map(WebhookEventType::getValue)
            .collect(Collectors.<String, Set<String>>toCollection(LinkedHashSet::new)));

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<WebhookEventType> fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equals(value))
            .findFirst();
    }

    /**
     * Event set used for auto-registration.
     */
    public static Set<String> defaultEvents() {
        return DEFAULT_EVENTS;
    }
}
