package com.shiptrack.webhooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.tracking.SyncResult;
import com.shiptrack.tracking.TrackingPayloads;
import com.shiptrack.tracking.TrackingSyncService;
import com.shiptrack.webhooks.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Processes inbound Shippo webhook deliveries.
 *
 * Flow:
 * 1. Rate-check the caller
 * 2. Parse and shape-check the payload
 * 3. Verify the signature
 * 4. Dispatch tracking events to {@link TrackingSyncService}
 * 5. Record the outcome in the webhook event log
 *
 * Every delivery that gets past the signature step leaves exactly one
 * {@link WebhookEvent}. Shippo retries on non-2xx, which is safe because
 * tracking updates overwrite rather than accumulate.
 */
@Service
@Slf4j
public class WebhookIngestionService {

    static final String RESULT_UPDATED = "updated";
    static final String RESULT_NO_CHANGES = "no_changes";
    static final String UNKNOWN_TRACKING_NUMBER = "unknown tracking number";
    static final String INVALID_SIGNATURE = "Invalid webhook signature";

    private final RateLimiter rateLimiter;
    private final WebhookSignatureVerifier signatureVerifier;
    private final TrackingSyncService trackingSyncService;
    private final WebhookRegistry webhookRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String webhookSecret;

    public WebhookIngestionService(
            RateLimiter rateLimiter,
            WebhookSignatureVerifier signatureVerifier,
            TrackingSyncService trackingSyncService,
            WebhookRegistry webhookRegistry,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${shiptrack.webhooks.secret:}") String webhookSecret) {
        this.rateLimiter = rateLimiter;
        this.signatureVerifier = signatureVerifier;
        this.trackingSyncService = trackingSyncService;
        this.webhookRegistry = webhookRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webhookSecret = webhookSecret;
    }

    /**
     * @param rawBody the request body exactly as received; the signature is
     *                checked against these bytes, the decoded text is only parsed
     */
    public IngestionResult ingest(byte[] rawBody, String signatureHeader, String sourceAddress) {
        Instant started = clock.instant();

        if (!rateLimiter.allow(sourceAddress)) {
            return reject(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded", null);
        }

        String text = rawBody != null ? new String(rawBody, StandardCharsets.UTF_8) : "";
        if (text.isBlank()) {
            return reject(HttpStatus.BAD_REQUEST, "Empty request body", null);
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Rejected webhook with malformed JSON from {}: {}", sourceAddress, e.getOriginalMessage());
            return reject(HttpStatus.BAD_REQUEST, "Invalid JSON payload", null);
        }

        JsonNode eventNode = payload != null ? payload.get("event") : null;
        JsonNode data = payload != null ? payload.get("data") : null;
        if (eventNode == null || !eventNode.isTextual() || data == null || !data.isObject()) {
            return reject(HttpStatus.BAD_REQUEST, "Missing event or data", null);
        }

        String eventName = eventNode.asText();
        String trackingNumber = TrackingPayloads.text(data, TrackingPayloads.TRACKING_NUMBER);

        SignatureCheck signatureCheck = checkSignature(rawBody, signatureHeader);
        if (!signatureCheck.isAccepted()) {
            log.warn("Invalid webhook signature: event={}, trackingNumber={}, source={}",
                eventName, trackingNumber, sourceAddress);
            record(eventName, data, false, INVALID_SIGNATURE);
            return reject(HttpStatus.UNAUTHORIZED, "Invalid signature", signatureCheck);
        }

        log.info("Received Shippo webhook: event={}, trackingNumber={}", eventName, trackingNumber);

        try {
            Optional<WebhookEventType> eventType = WebhookEventType.fromValue(eventName);
            if (eventType.isEmpty()) {
                log.warn("Unhandled Shippo webhook event '{}' acknowledged without changes", eventName);
                record(eventName, data, true, null);
                return respond(eventName, trackingNumber, started, RESULT_NO_CHANGES,
                    "Event type not handled", signatureCheck);
            }

            SyncResult result = trackingSyncService.synchronize(data);

            if (result == SyncResult.UNKNOWN_SHIPMENT) {
                record(eventName, data, false, UNKNOWN_TRACKING_NUMBER);
                return respond(eventName, trackingNumber, started, RESULT_NO_CHANGES,
                    "No shipment matches this tracking number", signatureCheck);
            }

            record(eventName, data, true, null);
            return respond(eventName, trackingNumber, started, RESULT_UPDATED,
                "Shipment tracking updated", signatureCheck);

        } catch (RuntimeException e) {
            log.error("Error processing Shippo webhook: event={}, trackingNumber={}", eventName, trackingNumber, e);
            record(eventName, data, false, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", "Webhook processing failed");
            body.put("elapsedMs", elapsedMs(started));
            return new IngestionResult(HttpStatus.INTERNAL_SERVER_ERROR.value(), body, signatureCheck);
        }
    }

    /**
     * Whether deliveries are currently authenticated.
     */
    public boolean isSignatureVerificationEnabled() {
        return webhookSecret != null && !webhookSecret.isEmpty();
    }

    private SignatureCheck checkSignature(byte[] rawBody, String signatureHeader) {
        if (!isSignatureVerificationEnabled()) {
            return SignatureCheck.SKIPPED;
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            log.warn("Webhook secret is configured but the request carried no signature; processing unverified");
            return SignatureCheck.UNSIGNED;
        }
        return signatureVerifier.check(rawBody, signatureHeader, webhookSecret);
    }

    private void record(String eventName, JsonNode data, boolean success, String error) {
        webhookRegistry.recordWebhookEvent(WebhookEvent.builder()
            .type(eventName)
            .trackingNumber(TrackingPayloads.text(data, TrackingPayloads.TRACKING_NUMBER))
            .carrier(TrackingPayloads.text(data, TrackingPayloads.CARRIER))
            .status(TrackingPayloads.status(data))
            .timestamp(clock.instant())
            .success(success)
            .error(error)
            .build());
    }

    private IngestionResult respond(String eventName, String trackingNumber, Instant started,
                                    String result, String message, SignatureCheck signatureCheck) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", eventName);
        body.put("trackingNumber", trackingNumber);
        body.put("elapsedMs", elapsedMs(started));
        body.put("result", result);
        body.put("message", message);
        return new IngestionResult(HttpStatus.OK.value(), body, signatureCheck);
    }

    private IngestionResult reject(HttpStatus status, String error, SignatureCheck signatureCheck) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        return new IngestionResult(status.value(), body, signatureCheck);
    }

    private long elapsedMs(Instant started) {
        return Duration.between(started, clock.instant()).toMillis();
    }
}
