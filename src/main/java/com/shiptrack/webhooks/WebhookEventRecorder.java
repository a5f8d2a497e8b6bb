package com.shiptrack.webhooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.common.cache.KeyValueCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only audit log of webhook outcomes, one list per tracking number,
 * newest first.
 *
 * This log is the only record of past deliveries. It expires by TTL and is
 * never invalidated. Recording never throws: a store outage loses the entry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookEventRecorder {

    static final Duration EVENT_RETENTION = Duration.ofDays(7);
    static final Duration STATUS_TTL = Duration.ofMinutes(5);
    static final String UNKNOWN_ERROR = "Unknown error";

    private final KeyValueCache cache;
    private final ObjectMapper objectMapper;

    /**
     * Append the event to its tracking number's log and fold it into the
     * last-outcome record.
     *
     * @return the outcome after this event
     */
    public WebhookOutcome record(WebhookEvent event) {
        String trackingNumber = event.getTrackingNumber();
        if (trackingNumber != null && !trackingNumber.isBlank()) {
            append(WebhookCacheKeys.events(trackingNumber), event);
        }

        WebhookOutcome outcome = lastOutcome();
        if (event.isSuccess()) {
            outcome.setLastSuccess(event.getTimestamp());
        } else {
            outcome.setLastError(event.getError() != null ? event.getError() : UNKNOWN_ERROR);
        }
        write(WebhookCacheKeys.OUTCOME, outcome, EVENT_RETENTION);

        refreshCachedStatus(outcome);

        log.debug("Recorded webhook event: type={}, trackingNumber={}, success={}",
            event.getType(), trackingNumber, event.isSuccess());
        return outcome;
    }

    /**
     * All retained events for a tracking number, newest first. Unreadable
     * entries are skipped.
     */
    public List<WebhookEvent> events(String trackingNumber) {
        List<String> raw = cache.listRange(WebhookCacheKeys.events(trackingNumber), 0, -1);
        List<WebhookEvent> events = new ArrayList<>(raw.size());

        for (String json : raw) {
            try {
                events.add(objectMapper.readValue(json, WebhookEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable webhook event for {}: {}", trackingNumber, e.getOriginalMessage());
            }
        }
        return events;
    }

    public WebhookOutcome lastOutcome() {
        return read(WebhookCacheKeys.OUTCOME, WebhookOutcome.class)
            .orElseGet(WebhookOutcome::new);
    }

    private void refreshCachedStatus(WebhookOutcome outcome) {
        read(WebhookCacheKeys.STATUS, RegistryStatus.class).ifPresent(status -> {
            status.applyOutcome(outcome);
            write(WebhookCacheKeys.STATUS, status, STATUS_TTL);
        });
    }

    private void append(String key, WebhookEvent event) {
        try {
            cache.listPush(key, objectMapper.writeValueAsString(event));
            cache.expire(key, EVENT_RETENTION);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize webhook event for {}", event.getTrackingNumber(), e);
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        Optional<String> json = cache.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), type));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            cache.delete(key);
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration ttl) {
        try {
            cache.set(key, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize cache entry {}", key, e);
        }
    }
}
