package com.shiptrack.webhooks;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A webhook subscription registered with Shippo.
 *
 * The provider holds the authoritative copy; instances in the cache are a
 * disposable, TTL-bound snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookSubscription {

    @JsonAlias("object_id")
    private String id;

    private String url;

    /**
     * Event names this subscription receives. Shippo reports a single
     * {@code event} per subscription on some API versions.
     */
    @Builder.Default
    @JsonAlias("event")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private Set<String> events = new LinkedHashSet<>();

    private boolean active;

    @JsonProperty("created_at")
    @JsonAlias("object_created")
    private Instant createdAt;

    @JsonProperty("updated_at")
    @JsonAlias("object_updated")
    private Instant updatedAt;
}
