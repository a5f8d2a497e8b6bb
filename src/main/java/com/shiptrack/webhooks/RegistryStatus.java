package com.shiptrack.webhooks;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Derived health of the webhook subscription. {@code active} implies
 * {@code registered}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryStatus {

    private boolean registered;
    private boolean active;
    private String webhookId;
    private Instant lastSuccess;
    private String lastError;

    public void applyOutcome(WebhookOutcome outcome) {
        if (outcome == null) {
            return;
        }
        this.lastSuccess = outcome.getLastSuccess();
        this.lastError = outcome.getLastError();
    }
}
