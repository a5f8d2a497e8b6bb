package com.shiptrack.webhooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.common.cache.KeyValueCache;
import com.shiptrack.common.exception.WebhookConflictException;
import com.shiptrack.common.exception.WebhookRegistryException;
import com.shiptrack.providers.shippo.ShippoApiException;
import com.shiptrack.providers.shippo.ShippoClient;
import com.shiptrack.providers.shippo.ShippoDTOs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Manages the Shippo webhook subscription that feeds tracking updates.
 *
 * Shippo holds the authoritative subscription list. The cached copy is an
 * optimization: it is deleted, not refreshed, whenever a subscription changes.
 * Mutations rethrow provider failures as {@link WebhookRegistryException};
 * reads degrade to empty results.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRegistry {

    /**
     * Path of the ingestion endpoint, appended to the public base URL on
     * auto-registration.
     */
    public static final String WEBHOOK_PATH = "/api/v1/webhooks/shippo";

    static final Duration SUBSCRIPTIONS_TTL = Duration.ofHours(1);
    static final Duration STATUS_TTL = WebhookEventRecorder.STATUS_TTL;

    private final ShippoClient shippoClient;
    private final KeyValueCache cache;
    private final WebhookEventRecorder eventRecorder;
    private final ObjectMapper objectMapper;

    /**
     * Register a subscription for {@code url}, or return the existing one.
     *
     * Idempotency is checked against a live provider read, never the cache.
     */
    public WebhookSubscription registerWebhook(String url, Set<String> events, boolean active) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Webhook url is required");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("At least one webhook event is required");
        }

        try {
            List<WebhookSubscription> current = shippoClient.listWebhooks();

            Optional<WebhookSubscription> existing = current.stream()
                .filter(subscription -> url.equals(subscription.getUrl()))
                .findFirst();
            if (existing.isPresent()) {
                log.info("Webhook already registered: id={}, url={}", existing.get().getId(), url);
                return existing.get();
            }

            WebhookSubscription created = shippoClient.createWebhook(ShippoDTOs.WebhookRequest.builder()
                .url(url)
                .events(events)
                .active(active)
                .build());

            log.info("Registered webhook: id={}, url={}, events={}", created.getId(), url, events);

            List<WebhookSubscription> refreshed = new ArrayList<>(current);
            refreshed.add(created);
            write(WebhookCacheKeys.SUBSCRIPTIONS, refreshed, SUBSCRIPTIONS_TTL);
            cache.delete(WebhookCacheKeys.STATUS);

            return created;

        } catch (ShippoApiException e) {
            log.error("Failed to register webhook: url={}", url, e);
            throw new WebhookRegistryException("register", e);
        }
    }

    /**
     * Register this service's ingestion endpoint under {@code baseUrl} for
     * the default tracking events.
     */
    public WebhookSubscription autoRegisterWebhook(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("base_url is required for auto registration");
        }
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return registerWebhook(trimmed + WEBHOOK_PATH, WebhookEventType.defaultEvents(), true);
    }

    /**
     * Cached subscription list. Never null; empty when Shippo cannot be read.
     */
    public List<WebhookSubscription> listWebhooks() {
        Optional<List<WebhookSubscription>> cached = read(WebhookCacheKeys.SUBSCRIPTIONS,
            objectMapper.getTypeFactory().constructCollectionType(List.class, WebhookSubscription.class));
        if (cached.isPresent()) {
            return cached.get();
        }

        try {
            List<WebhookSubscription> webhooks = shippoClient.listWebhooks();
            write(WebhookCacheKeys.SUBSCRIPTIONS, webhooks, SUBSCRIPTIONS_TTL);
            return webhooks;
        } catch (ShippoApiException e) {
            log.error("Failed to list webhooks", e);
            return Collections.emptyList();
        }
    }

    /**
     * @return the subscription, or null if it does not exist or Shippo cannot be read
     */
    public WebhookSubscription getWebhook(String webhookId) {
        try {
            return shippoClient.getWebhook(webhookId);
        } catch (ShippoApiException e) {
            log.warn("Failed to get webhook {}: {}", webhookId, e.getMessage());
            return null;
        }
    }

    /**
     * Apply a partial update. Null fields in {@code changes} are left as they are.
     *
     * @throws WebhookConflictException if the subscription would end up active on a url
     *         that another active subscription already owns
     */
    public WebhookSubscription updateWebhook(String webhookId, ShippoDTOs.WebhookRequest changes) {
        try {
            boolean deactivating = Boolean.FALSE.equals(changes.getActive());
            if (!deactivating && (changes.getUrl() != null || Boolean.TRUE.equals(changes.getActive()))) {
                ensureUrlAvailable(webhookId, changes.getUrl());
            }

            WebhookSubscription updated = shippoClient.updateWebhook(webhookId, changes);
            invalidate();

            log.info("Updated webhook: id={}", webhookId);
            return updated;

        } catch (ShippoApiException e) {
            log.error("Failed to update webhook {}", webhookId, e);
            throw new WebhookRegistryException("update", e);
        }
    }

    /**
     * @return false if Shippo reports the subscription does not exist
     */
    public boolean deleteWebhook(String webhookId) {
        try {
            shippoClient.deleteWebhook(webhookId);
            invalidate();

            log.info("Deleted webhook: id={}", webhookId);
            return true;

        } catch (ShippoApiException e) {
            if (e.isNotFound()) {
                log.warn("Webhook {} not found at Shippo, nothing deleted", webhookId);
                return false;
            }
            log.error("Failed to delete webhook {}", webhookId, e);
            throw new WebhookRegistryException("delete", e);
        }
    }

    /**
     * Ask Shippo to deliver a test event to the subscription.
     */
    public boolean testWebhook(String webhookId) {
        try {
            boolean success = shippoClient.testWebhook(webhookId);
            log.info("Webhook test for {}: success={}", webhookId, success);
            return success;
        } catch (ShippoApiException e) {
            log.warn("Webhook test for {} failed: {}", webhookId, e.getMessage());
            return false;
        }
    }

    /**
     * Health of the subscription, cached for five minutes. An unreachable
     * provider yields an unregistered status carrying the error, which is not
     * cached.
     */
    public RegistryStatus getWebhookStatus() {
        Optional<RegistryStatus> cached = read(WebhookCacheKeys.STATUS, objectMapper.constructType(RegistryStatus.class));
        if (cached.isPresent()) {
            return cached.get();
        }

        List<WebhookSubscription> webhooks;
        try {
            webhooks = shippoClient.listWebhooks();
        } catch (ShippoApiException e) {
            log.error("Failed to compute webhook status", e);
            return RegistryStatus.builder()
                .registered(false)
                .active(false)
                .lastError(e.getMessage())
                .build();
        }

        Optional<WebhookSubscription> active = webhooks.stream()
            .filter(WebhookSubscription::isActive)
            .findFirst();

        RegistryStatus status = RegistryStatus.builder()
            .registered(!webhooks.isEmpty())
            .active(active.isPresent())
            .webhookId(active.map(WebhookSubscription::getId).orElse(null))
            .build();
        status.applyOutcome(eventRecorder.lastOutcome());

        write(WebhookCacheKeys.STATUS, status, STATUS_TTL);
        return status;
    }

    public WebhookOutcome recordWebhookEvent(WebhookEvent event) {
        return eventRecorder.record(event);
    }

    public List<WebhookEvent> getWebhookEvents(String trackingNumber) {
        return eventRecorder.events(trackingNumber);
    }

    /**
     * @param newUrl the requested url, or null to check the subscription's current one
     */
    private void ensureUrlAvailable(String webhookId, String newUrl) {
        List<WebhookSubscription> live = shippoClient.listWebhooks();

        String url = newUrl != null ? newUrl : live.stream()
            .filter(subscription -> webhookId.equals(subscription.getId()))
            .map(WebhookSubscription::getUrl)
            .findFirst()
            .orElse(null);
        if (url == null) {
            return;
        }

        live.stream()
            .filter(WebhookSubscription::isActive)
            .filter(subscription -> url.equals(subscription.getUrl()))
            .filter(subscription -> !webhookId.equals(subscription.getId()))
            .findFirst()
            .ifPresent(owner -> {
                throw new WebhookConflictException(url, owner.getId());
            });
    }

    private void invalidate() {
        cache.delete(WebhookCacheKeys.SUBSCRIPTIONS);
        cache.delete(WebhookCacheKeys.STATUS);
    }

    private <T> Optional<T> read(String key, JavaType type) {
        Optional<String> json = cache.get(key);
        if (json.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json.get(), type));
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
