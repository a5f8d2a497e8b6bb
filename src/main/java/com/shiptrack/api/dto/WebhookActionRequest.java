package com.shiptrack.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Set;

/**
 * Body of {@code POST /api/v1/webhooks/manage}. Which fields are required
 * depends on {@code action}.
 */
@Data
public class WebhookActionRequest {

    private String action;

    private String url;

    private Set<String> events;

    private Boolean active;

    @JsonProperty("base_url")
    private String baseUrl;

    @JsonProperty("webhook_id")
    private String webhookId;
}
