package com.shiptrack.webhooks;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit record of one ingested webhook call. Immutable once recorded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookEvent {

    private String type;

    @JsonProperty("tracking_number")
    private String trackingNumber;

    private String carrier;

    /**
     * Raw provider status carried by the payload.
     */
    private String status;

    private Instant timestamp;

    private boolean success;

    private String error;
}
