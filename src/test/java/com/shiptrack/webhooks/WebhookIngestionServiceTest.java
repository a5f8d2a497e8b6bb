package com.shiptrack.webhooks;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.common.exception.InvalidWebhookPayloadException;
import com.shiptrack.tracking.SyncResult;
import com.shiptrack.tracking.TrackingSyncService;
import com.shiptrack.webhooks.ratelimit.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WebhookIngestionService.
 */
@ExtendWith(MockitoExtension.class)
class WebhookIngestionServiceTest {

    private static final String SECRET = "test-webhook-secret";
    private static final String SOURCE = "203.0.113.7";
    private static final String DELIVERED = "{\"event\":\"track_delivered\",\"data\":{"
        + "\"tracking_number\":\"1Z999\",\"carrier\":\"ups\",\"tracking_status\":\"delivered\"}}";

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private TrackingSyncService trackingSyncService;

    @Mock
    private WebhookRegistry webhookRegistry;

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private WebhookIngestionService service;

    @BeforeEach
    void setUp() {
        service = newService(SECRET);
    }

    @Test
    void testIngest_SignedDeliveryUpdatesShipment() {
        when(rateLimiter.allow(SOURCE)).thenReturn(true);
        when(trackingSyncService.synchronize(any())).thenReturn(SyncResult.UPDATED);

        IngestionResult result = service.ingest(bytes(DELIVERED), verifier.sign(bytes(DELIVERED), SECRET), SOURCE);

        assertEquals(200, result.getHttpStatus());
        assertEquals(SignatureCheck.VERIFIED, result.getSignatureCheck());
        assertEquals("updated", result.getBody().get("result"));
        assertEquals("track_delivered", result.getBody().get("event"));
        assertEquals("1Z999", result.getBody().get("trackingNumber"));
        assertEquals(0L, result.getBody().get("elapsedMs"));

        WebhookEvent event = recordedEvent();
        assertTrue(event.isSuccess());
        assertEquals("ups", event.getCarrier());
        assertEquals("delivered", event.getStatus());
        assertEquals(Instant.parse("2024-06-01T12:00:00Z"), event.getTimestamp());
    }

    @Test
    void testIngest_SignatureCoversRawBytesNotDecodedText() {
        // ISO-8859-1 e-acute inside a string value: not valid UTF-8
        byte[] body = "{\"event\":\"track_updated\",\"data\":{\"tracking_number\":\"1Z999\",\"carrier\":\"ups\",\"note\":\"caf\u00e9\"}}"
            .getBytes(StandardCharsets.ISO_8859_1);
        when(rateLimiter.allow(SOURCE)).thenReturn(true);
        when(trackingSyncService.synchronize(any())).thenReturn(SyncResult.UPDATED);

        IngestionResult result = service.ingest(body, verifier.sign(body, SECRET), SOURCE);

        assertEquals(200, result.getHttpStatus());
        assertEquals(SignatureCheck.VERIFIED, result.getSignatureCheck());
    }

    @Test
    void testIngest_RateLimitedNothingRecorded() {
        when(rateLimiter.allow(SOURCE)).thenReturn(false);

        IngestionResult result = service.ingest(bytes(DELIVERED), "sig", SOURCE);

        assertEquals(429, result.getHttpStatus());
        assertNull(result.getSignatureCheck());
        verifyNoInteractions(trackingSyncService, webhookRegistry);
    }

    @Test
    void testIngest_MalformedJson() {
        when(rateLimiter.allow(SOURCE)).thenReturn(true);

        IngestionResult result = service.ingest(bytes("{not json"), null, SOURCE);

        assertEquals(400, result.getHttpStatus());
        verifyNoInteractions(trackingSyncService, webhookRegistry);
    }

    @Test
    void testIngest_EmptyBody() {
        when(rateLimiter.allow(SOURCE)).thenReturn(true);

        assertEquals(400, service.ingest(bytes(""), null, SOURCE).getHttpStatus());
        assertEquals(400, service.ingest(bytes(null), null, SOURCE).getHttpStatus());
        verifyNoInteractions(webhookRegistry);
    }

    @Test
    void testIngest_MissingEventOrData() {
        when(rateLimiter.allow(SOURCE)).thenReturn(true);

        assertEquals(400, service.ingest(bytes("{\"data\":{}}"), null, SOURCE).getHttpStatus());
        assertEquals(400, service.ingest(bytes("{\"event\":\"track_updated\"}"), null, SOURCE).getHttpStatus());
        assertEquals(400, service.ingest(bytes("{\"event\":\"track_updated\",\"data\":\"x\"}"), null, SOURCE).getHttpStatus());
        assertEquals(400, service.ingest(bytes("[1,2]"), null, SOURCE).getHttpStatus());
        verifyNoInteractions(webhookRegistry);
    }

    @Test
    void testIngest_InvalidSignatureRecordsFailure() {
        when(rateLimiter.allow(SOURCE)).thenReturn(true);

        IngestionResult result = service.ingest(bytes(DELIVERED), "deadbeef", SOURCE);

        assertEquals(401, result.getHttpStatus());
        assertEquals(SignatureCheck.FAILED, result.getSignatureCheck());
        verifyNoInteractions(trackingSyncService);

        WebhookEvent event = recordedEvent();
        assertFalse(event.isSuccess());
        assertEquals("Invalid webhook signature", event.getError());
        assertEquals("1Z999", event.getTrackingNumber());
    }

    @Test
    void testIngest_MissingSignatureProcessedUnverified() {
        when(rateLimiter.allow(SOURCE)).thenReturn(true);
        when(trackingSyncService.synchronize(any())).thenReturn(SyncResult.UPDATED);

        IngestionResult result = service.ingest(bytes(DELIVERED), null, SOURCE);

        assertEquals(200, result.getHttpStatus());
        assertEquals(SignatureCheck.UNSIGNED, result.getSignatureCheck());
    }

    @Test
    void testIngest_NoSecretSkipsVerification() {
        service = newService("");
        when(rateLimiter.allow(SOURCE)).thenReturn(true);
        when(trackingSyncService.synchronize(any())).thenReturn(SyncResult.UPDATED);

        IngestionResult result = service.ingest(bytes(DELIVERED), "garbage", SOURCE);

        assertEquals(200, result.getHttpStatus());
        assertEquals(SignatureCheck.SKIPPED, result.getSignatureCheck());
        assertFalse(service.isSignatureVerificationEnabled());
    }

    @Test
    void testIngest_UnknownTrackingNumber() {
        when(rateLimiter.allow(SOURCE)).thenReturn(true);
        when(trackingSyncService.synchronize(any())).thenReturn(SyncResult.UNKNOWN_SHIPMENT);

        IngestionResult result = service.ingest(bytes(DELIVERED), verifier.sign(bytes(DELIVERED), SECRET), SOURCE);

        assertEquals(200, result.getHttpStatus());
        assertEquals("no_changes", result.getBody().get("result"));

        WebhookEvent event = recordedEvent();
        assertFalse(event.isSuccess());
        assertEquals("unknown tracking number", event.getError());
    }

    @Test
    void testIngest_UnknownEventAcknowledged() {
        String body = "{\"event\":\"transaction_created\",\"data\":{\"object_id\":\"abc\"}}";
        when(rateLimiter.allow(SOURCE)).thenReturn(true);

        IngestionResult result = service.ingest(bytes(body), verifier.sign(bytes(body), SECRET), SOURCE);

        assertEquals(200, result.getHttpStatus());
        assertEquals("no_changes", result.getBody().get("result"));
        verifyNoInteractions(trackingSyncService);
        assertTrue(recordedEvent().isSuccess());
    }

    @Test
    void testIngest_MissingTrackingFieldsIsProcessingError() {
        String body = "{\"event\":\"track_updated\",\"data\":{\"carrier\":\"ups\"}}";
        when(rateLimiter.allow(SOURCE)).thenReturn(true);
        when(trackingSyncService.synchronize(any()))
            .thenThrow(new InvalidWebhookPayloadException("Invalid webhook data: missing tracking_number or carrier"));

        IngestionResult result = service.ingest(bytes(body), verifier.sign(bytes(body), SECRET), SOURCE);

        assertEquals(500, result.getHttpStatus());
        assertEquals("Webhook processing failed", result.getBody().get("error"));
        assertEquals(SignatureCheck.VERIFIED, result.getSignatureCheck());

        WebhookEvent event = recordedEvent();
        assertFalse(event.isSuccess());
        assertEquals("Invalid webhook data: missing tracking_number or carrier", event.getError());
    }

    @Test
    void testIngest_ProcessingFailureRecordedThen500() {
        when(rateLimiter.allow(SOURCE)).thenReturn(true);
        when(trackingSyncService.synchronize(any()))
            .thenThrow(new DataAccessResourceFailureException("database down"));

        IngestionResult result = service.ingest(bytes(DELIVERED), verifier.sign(bytes(DELIVERED), SECRET), SOURCE);

        assertEquals(500, result.getHttpStatus());
        assertEquals("Webhook processing failed", result.getBody().get("error"));
        assertTrue(result.getBody().containsKey("elapsedMs"));
        assertFalse(result.getBody().containsKey("stackTrace"));

        WebhookEvent event = recordedEvent();
        assertFalse(event.isSuccess());
        assertEquals("database down", event.getError());
    }

    private static byte[] bytes(String body) {
        return body != null ? body.getBytes(StandardCharsets.UTF_8) : null;
    }

    private WebhookIngestionService newService(String secret) {
        return new WebhookIngestionService(rateLimiter, verifier, trackingSyncService, webhookRegistry,
            objectMapper, clock, secret);
    }

    private WebhookEvent recordedEvent() {
        ArgumentCaptor<WebhookEvent> captor = ArgumentCaptor.forClass(WebhookEvent.class);
        verify(webhookRegistry).recordWebhookEvent(captor.capture());
        return captor.getValue();
    }
}
