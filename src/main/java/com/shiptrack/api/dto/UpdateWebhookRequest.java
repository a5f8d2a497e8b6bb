package com.shiptrack.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Set;

/**
 * Partial update of a webhook subscription. Omitted fields stay unchanged.
 */
@Data
public class UpdateWebhookRequest {

    @NotBlank(message = "webhook_id is required")
    @JsonProperty("webhook_id")
    private String webhookId;

    private String url;

    private Set<String> events;

    private Boolean active;
}
