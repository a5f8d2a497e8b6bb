package com.shiptrack.providers.shippo;

import com.fasterxml.jackson.databind.JsonNode;
import com.shiptrack.webhooks.WebhookSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * HTTP client for the Shippo API.
 *
 * Handles:
 * - Authentication (ShippoToken header)
 * - Tracking registration and lookup
 * - Webhook subscription management
 * - Error wrapping into {@link ShippoApiException}
 *
 * Every call is bounded by the configured connect and read timeouts so a
 * slow provider cannot tie up request threads.
 */
@Component
@Slf4j
public class ShippoClient {

    private final RestTemplate restTemplate;
    private final String shippoBaseUrl;
    private final String apiKey;

    @Autowired
    public ShippoClient(
            RestTemplateBuilder restTemplateBuilder,
            @Value("${shiptrack.shippo.base-url:https://api.goshippo.com}") String baseUrl,
            @Value("${shiptrack.shippo.api-key:}") String apiKey,
            @Value("${shiptrack.shippo.timeout-ms:10000}") long timeoutMs) {

        this(restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build(),
            baseUrl,
            apiKey);

        log.info("Shippo client initialized: baseUrl={}, timeout={}ms, apiKeyConfigured={}",
            baseUrl, timeoutMs, !apiKey.isBlank());
    }

    ShippoClient(RestTemplate restTemplate, String baseUrl, String apiKey) {
        this.restTemplate = restTemplate;
        this.shippoBaseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    /**
     * Register a tracking number so Shippo starts pushing updates for it.
     *
     * @return the raw registration response
     */
    public JsonNode createTracking(String carrier, String trackingNumber) {
        log.debug("Registering tracking: carrier={}, trackingNumber={}", carrier, trackingNumber);

        return exchange("create tracking", HttpMethod.POST, "/tracks/",
            new ShippoDTOs.TrackRequest(carrier, trackingNumber), JsonNode.class);
    }

    /**
     * Get current tracking info for a carrier/tracking number pair.
     */
    public ShippoDTOs.Track getTracking(String carrier, String trackingNumber) {
        log.debug("Fetching tracking: carrier={}, trackingNumber={}", carrier, trackingNumber);

        return exchange("get tracking", HttpMethod.GET, "/tracks/{carrier}/{trackingNumber}",
            null, ShippoDTOs.Track.class, carrier, trackingNumber);
    }

    public WebhookSubscription createWebhook(ShippoDTOs.WebhookRequest request) {
        log.debug("Creating webhook: url={}", request.getUrl());

        return exchange("create webhook", HttpMethod.POST, "/webhooks", request, WebhookSubscription.class);
    }

    /**
     * List all webhook subscriptions. Always a live read.
     */
    public List<WebhookSubscription> listWebhooks() {
        ShippoDTOs.WebhookList list = exchange("list webhooks", HttpMethod.GET, "/webhooks",
            null, ShippoDTOs.WebhookList.class);

        if (list == null || list.getResults() == null) {
            return Collections.emptyList();
        }
        return list.getResults();
    }

    public WebhookSubscription getWebhook(String webhookId) {
        return exchange("get webhook", HttpMethod.GET, "/webhooks/{id}", null,
            WebhookSubscription.class, webhookId);
    }

    public WebhookSubscription updateWebhook(String webhookId, ShippoDTOs.WebhookRequest request) {
        log.debug("Updating webhook: id={}", webhookId);

        return exchange("update webhook", HttpMethod.PUT, "/webhooks/{id}", request,
            WebhookSubscription.class, webhookId);
    }

    public void deleteWebhook(String webhookId) {
        log.debug("Deleting webhook: id={}", webhookId);

        exchange("delete webhook", HttpMethod.DELETE, "/webhooks/{id}", null, Void.class, webhookId);
    }

    /**
     * Ask Shippo to send a test event to the subscription's URL.
     */
    public boolean testWebhook(String webhookId) {
        ShippoDTOs.WebhookTestResult result = exchange("test webhook", HttpMethod.POST,
            "/webhooks/{id}/test", null, ShippoDTOs.WebhookTestResult.class, webhookId);

        return result != null && result.isSuccess();
    }

    /**
     * @param path path template; {@code pathVariables} are percent-encoded in full
     *             (including '/', '{' and '}') so ids are never read as template syntax
     */
    private <T> T exchange(String operation, HttpMethod method, String path, Object body,
                           Class<T> responseType, Object... pathVariables) {
        URI url = UriComponentsBuilder.fromHttpUrl(shippoBaseUrl)
            .path(path)
            .encode()
            .buildAndExpand(pathVariables)
            .toUri();

        try {
            ResponseEntity<T> response = restTemplate.exchange(
                url,
                method,
                new HttpEntity<>(body, createHeaders()),
                responseType
            );

            return response.getBody();

        } catch (RestClientResponseException e) {
            log.error("Shippo {} rejected: status={}, url={}", operation, e.getStatusCode().value(), url);
            throw new ShippoApiException(operation, e.getStatusCode().value(), e);

        } catch (RestClientException e) {
            log.error("Error calling Shippo {}: url={}", operation, url, e);
            throw new ShippoApiException(operation, 0, e);
        }
    }

    /**
     * Create headers with the Shippo token.
     */
    private HttpHeaders createHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, "ShippoToken " + apiKey);
        return headers;
    }
}
