package com.shiptrack.webhooks;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Makes sure a Shippo webhook points at this service once it is up.
 *
 * Runs once, off the startup thread. Failures are logged and never stop
 * the application.
 */
@Component
@Slf4j
public class WebhookAutoRegistrar {

    private final WebhookRegistry webhookRegistry;
    private final boolean enabled;
    private final String baseUrl;
    private final boolean signatureVerificationEnabled;

    public WebhookAutoRegistrar(
            WebhookRegistry webhookRegistry,
            @Value("${shiptrack.webhooks.auto-register.enabled:true}") boolean enabled,
            @Value("${shiptrack.webhooks.base-url:http://localhost:8080}") String baseUrl,
            @Value("${shiptrack.webhooks.secret:}") String secret) {
        this.webhookRegistry = webhookRegistry;
        this.enabled = enabled;
        this.baseUrl = baseUrl;
        this.signatureVerificationEnabled = secret != null && !secret.isEmpty();
    }

    @Async
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        registerIfNeeded();
    }

    void registerIfNeeded() {
        if (signatureVerificationEnabled) {
            log.info("Webhook signature verification enabled");
        } else {
            log.warn("Webhook signature verification DISABLED: shiptrack.webhooks.secret is not set");
        }

        if (!enabled) {
            log.info("Webhook auto-registration disabled");
            return;
        }

        try {
            RegistryStatus status = webhookRegistry.getWebhookStatus();
            if (status.isRegistered() && status.isActive()) {
                log.info("Webhook already registered and active: id={}", status.getWebhookId());
                return;
            }

            log.info("Auto-registering Shippo webhook for {}", baseUrl);
            WebhookSubscription subscription = webhookRegistry.autoRegisterWebhook(baseUrl);
            log.info("Webhook registered: id={}, url={}", subscription.getId(), subscription.getUrl());

            boolean testPassed = webhookRegistry.testWebhook(subscription.getId());
            if (testPassed) {
                log.info("Webhook test delivery succeeded");
            } else {
                log.warn("Webhook test delivery failed for {}", subscription.getId());
            }

        } catch (RuntimeException e) {
            log.error("Webhook auto-registration failed; continuing without it", e);
        }
    }
}
