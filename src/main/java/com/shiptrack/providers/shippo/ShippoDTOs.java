package com.shiptrack.providers.shippo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.shiptrack.webhooks.WebhookSubscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * DTOs for the Shippo REST API.
 *
 * These follow Shippo's snake_case JSON. See: https://docs.goshippo.com/
 */
public class ShippoDTOs {

    /**
     * Body for registering a tracking number ({@code POST /tracks/}).
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TrackRequest {
        private String carrier;

        @JsonProperty("tracking_number")
        private String trackingNumber;
    }

    /**
     * Tracking info as returned by {@code GET /tracks/{carrier}/{number}}.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Track {
        @JsonProperty("tracking_number")
        private String trackingNumber;

        private String carrier;

        @JsonProperty("tracking_status")
        private TrackingStatus trackingStatus;

        private String eta;

        /**
         * Raw provider events, newest first. Kept as JSON so they can be
         * stored without loss.
         */
        @JsonProperty("tracking_history")
        private List<JsonNode> trackingHistory = new ArrayList<>();

        @Data
        @NoArgsConstructor
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class TrackingStatus {
            private String status;

            @JsonProperty("status_details")
            private String statusDetails;

            @JsonProperty("status_date")
            private String statusDate;
        }
    }

    /**
     * Create or partial-update body for a webhook subscription.
     * Null fields are left out so updates only touch what was given.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class WebhookRequest {
        private String url;
        private Set<String> events;
        private Boolean active;
    }

    /**
     * Paged list wrapper returned by {@code GET /webhooks}.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WebhookList {
        private List<WebhookSubscription> results = new ArrayList<>();
    }

    /**
     * Result of a webhook connectivity test.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WebhookTestResult {
        private boolean success;
    }
}
