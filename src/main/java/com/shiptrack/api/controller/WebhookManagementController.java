package com.shiptrack.api.controller;

import com.shiptrack.api.dto.UpdateWebhookRequest;
import com.shiptrack.api.dto.WebhookActionRequest;
import com.shiptrack.common.exception.WebhookNotFoundException;
import com.shiptrack.providers.shippo.ShippoDTOs;
import com.shiptrack.webhooks.WebhookEvent;
import com.shiptrack.webhooks.WebhookRegistry;
import com.shiptrack.webhooks.WebhookSubscription;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for managing the Shippo webhook subscription.
 *
 * Callers are expected to be authenticated upstream.
 */
@RestController
@RequestMapping("/api/v1/webhooks/manage")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhook Management", description = "Shippo webhook subscription management API")
public class WebhookManagementController {

    static final List<String> POST_ACTIONS = List.of("register", "auto_register", "test");

    private final WebhookRegistry webhookRegistry;

    @GetMapping
    @Operation(summary = "Webhook status, subscriptions or event log")
    public ResponseEntity<?> get(
            @RequestParam(value = "action", required = false) String action,
            @RequestParam(value = "tracking_number", required = false) String trackingNumber) {

        Map<String, Object> body = new LinkedHashMap<>();

        if ("status".equals(action)) {
            return ResponseEntity.ok(webhookRegistry.getWebhookStatus());
        }

        if ("list".equals(action)) {
            body.put("webhooks", webhookRegistry.listWebhooks());
            return ResponseEntity.ok(body);
        }

        if ("events".equals(action)) {
            if (trackingNumber == null || trackingNumber.isBlank()) {
                throw new IllegalArgumentException("tracking_number is required");
            }
            List<WebhookEvent> events = webhookRegistry.getWebhookEvents(trackingNumber);
            body.put("events", events);
            return ResponseEntity.ok(body);
        }

        List<WebhookSubscription> webhooks = webhookRegistry.listWebhooks();
        body.put("status", webhookRegistry.getWebhookStatus());
        body.put("webhooks", webhooks);
        body.put("total", webhooks.size());
        return ResponseEntity.ok(body);
    }

    @PostMapping
    @Operation(summary = "Register, auto-register or test a webhook")
    public ResponseEntity<Map<String, Object>> post(@RequestBody WebhookActionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        String action = request.getAction() != null ? request.getAction() : "";

        switch (action) {
            case "register": {
                if (isBlank(request.getUrl()) || request.getEvents() == null || request.getEvents().isEmpty()) {
                    body.put("error", "Missing required fields");
                    body.put("required", List.of("url", "events"));
                    return ResponseEntity.badRequest().body(body);
                }
                boolean active = request.getActive() == null || request.getActive();
                WebhookSubscription webhook =
                    webhookRegistry.registerWebhook(request.getUrl(), request.getEvents(), active);
                body.put("message", "Webhook registered successfully");
                body.put("webhook", webhook);
                return ResponseEntity.ok(body);
            }
            case "auto_register": {
                if (isBlank(request.getBaseUrl())) {
                    throw new IllegalArgumentException("base_url is required for auto registration");
                }
                WebhookSubscription webhook = webhookRegistry.autoRegisterWebhook(request.getBaseUrl());
                body.put("message", "Webhook auto-registered successfully");
                body.put("webhook", webhook);
                return ResponseEntity.ok(body);
            }
            case "test": {
                if (isBlank(request.getWebhookId())) {
                    throw new IllegalArgumentException("webhook_id is required for testing");
                }
                body.put("message", "Webhook test completed");
                body.put("success", webhookRegistry.testWebhook(request.getWebhookId()));
                return ResponseEntity.ok(body);
            }
            default:
                body.put("error", "Invalid action");
                body.put("available_actions", POST_ACTIONS);
                return ResponseEntity.badRequest().body(body);
        }
    }

    @PutMapping
    @Operation(summary = "Update a webhook subscription")
    public ResponseEntity<Map<String, Object>> update(@Valid @RequestBody UpdateWebhookRequest request) {
        WebhookSubscription webhook = webhookRegistry.updateWebhook(request.getWebhookId(),
            ShippoDTOs.WebhookRequest.builder()
                .url(request.getUrl())
                .events(request.getEvents())
                .active(request.getActive())
                .build());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Webhook updated successfully");
        body.put("webhook", webhook);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping
    @Operation(summary = "Delete a webhook subscription")
    public ResponseEntity<Map<String, Object>> delete(
            @RequestParam(value = "webhook_id", required = false) String webhookId) {

        if (isBlank(webhookId)) {
            throw new IllegalArgumentException("webhook_id is required");
        }
        if (!webhookRegistry.deleteWebhook(webhookId)) {
            throw new WebhookNotFoundException(webhookId);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Webhook deleted successfully");
        return ResponseEntity.ok(body);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
