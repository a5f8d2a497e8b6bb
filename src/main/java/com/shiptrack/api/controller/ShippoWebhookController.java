package com.shiptrack.api.controller;

import com.shiptrack.webhooks.IngestionResult;
import com.shiptrack.webhooks.WebhookIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Webhook endpoint for Shippo tracking callbacks.
 *
 * Shippo pushes tracking updates here as shipments move. The body is taken
 * as raw bytes because the signature covers the exact bytes sent, whatever
 * the declared content type or charset.
 */
@RestController
@RequestMapping("/api/v1/webhooks/shippo")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Shippo Webhooks", description = "Shippo tracking webhook callbacks")
public class ShippoWebhookController {

    static final String SIGNATURE_HEADER = "X-Shippo-Signature";
    static final String VERIFICATION_HEADER = "X-Signature-Verification";

    private final WebhookIngestionService ingestionService;

    /**
     * Receive a tracking event from Shippo.
     *
     * Non-2xx responses make Shippo retry, which is safe: tracking updates
     * overwrite the shipment's tracking fields.
     */
    @PostMapping
    @Operation(summary = "Tracking webhook from Shippo")
    public ResponseEntity<Map<String, Object>> handleTrackingEvent(
            @RequestBody(required = false) byte[] rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            HttpServletRequest request) {

        IngestionResult result = ingestionService.ingest(rawBody, signature, request.getRemoteAddr());

        ResponseEntity.BodyBuilder response = ResponseEntity.status(result.getHttpStatus());
        if (result.getSignatureCheck() != null) {
            response.header(VERIFICATION_HEADER, result.getSignatureCheck().getHeaderValue());
        }
        return response.body(result.getBody());
    }

    /**
     * Endpoint verification. Echoes {@code challenge} when given, otherwise
     * reports that the endpoint is live.
     */
    @GetMapping
    @Operation(summary = "Webhook endpoint verification")
    public ResponseEntity<Map<String, Object>> verifyEndpoint(
            @RequestParam(value = "challenge", required = false) String challenge) {

        Map<String, Object> body = new LinkedHashMap<>();
        if (challenge != null) {
            log.info("Webhook verification challenge received");
            body.put("challenge", challenge);
        } else {
            body.put("message", "Shippo webhook endpoint is active");
            body.put("timestamp", Instant.now().toString());
        }
        return ResponseEntity.ok(body);
    }
}
