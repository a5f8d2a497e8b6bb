package com.shiptrack.tracking;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Field access for Shippo tracking payloads ({@code data} of a webhook).
 */
public final class TrackingPayloads {

    public static final String TRACKING_NUMBER = "tracking_number";
    public static final String CARRIER = "carrier";
    public static final String TRACKING_STATUS = "tracking_status";
    public static final String TRACKING_HISTORY = "tracking_history";
    public static final String ETA = "eta";

    private TrackingPayloads() {
    }

    /**
     * @return the field as text, or null when absent, null or not a scalar
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    /**
     * The provider status. Shippo sends either a plain string or an object
     * whose {@code status} field carries it.
     */
    public static String status(JsonNode data) {
        if (data == null) {
            return null;
        }
        JsonNode status = data.get(TRACKING_STATUS);
        if (status != null && status.isObject()) {
            return text(status, "status");
        }
        return text(data, TRACKING_STATUS);
    }

    /**
     * Tracking history as a JSON array string, {@code []} when absent.
     */
    public static String history(JsonNode data) {
        JsonNode history = data != null ? data.get(TRACKING_HISTORY) : null;
        return history != null && history.isArray() ? history.toString() : "[]";
    }

    /**
     * The {@code status_date} of the newest history entry, if any.
     */
    public static String latestStatusDate(JsonNode data) {
        JsonNode history = data != null ? data.get(TRACKING_HISTORY) : null;
        if (history == null || !history.isArray() || history.isEmpty()) {
            return null;
        }
        return text(history.get(0), "status_date");
    }
}
