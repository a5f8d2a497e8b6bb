package com.shiptrack.shipments;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A shipment tracked through Shippo.
 *
 * Tracking fields are owned by the provider: they are seeded at creation and
 * afterwards only changed by webhook updates.
 */
@Entity
@Table(name = "shipments", indexes = {
    @Index(name = "idx_shipment_tracking_number", columnList = "tracking_number"),
    @Index(name = "idx_shipment_white_label_id", columnList = "white_label_tracking_id")
})
@Data
@NoArgsConstructor
public class Shipment {

    public static final String UNKNOWN_TRACKING_STATUS = "UNKNOWN";

    @Id
    private String id;

    /**
     * Customer-facing tracking ID that hides the carrier number.
     */
    @Column(name = "white_label_tracking_id", unique = true, nullable = false)
    private String whiteLabelTrackingId;

    @Column(name = "tracking_number", unique = true, nullable = false)
    private String trackingNumber;

    @Column(name = "carrier", nullable = false)
    private String carrier;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private ShipmentStatus status;

    /**
     * Raw status string last reported by the provider.
     */
    @Column(name = "tracking_status")
    private String trackingStatus;

    @Column(name = "estimated_delivery")
    private Instant estimatedDelivery;

    @Column(name = "actual_delivery")
    private Instant actualDelivery;

    /**
     * Provider tracking history, stored verbatim as a JSON array.
     */
    @Column(name = "tracking_events", length = 65535)
    private String trackingEvents;

    /**
     * Raw provider response from tracking registration.
     */
    @Column(name = "provider_data", length = 65535)
    private String providerData;

    @Column(name = "last_tracked_at")
    private Instant lastTrackedAt;

    @Column(name = "notes")
    private String notes;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Shipment(String trackingNumber, String carrier, String whiteLabelTrackingId) {
        this.id = UUID.randomUUID().toString();
        this.trackingNumber = trackingNumber;
        this.carrier = carrier;
        this.whiteLabelTrackingId = whiteLabelTrackingId;
        this.status = ShipmentStatus.PENDING;
        this.trackingStatus = UNKNOWN_TRACKING_STATUS;
        this.trackingEvents = "[]";
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }

    public void applyTracking(TrackingUpdate update) {
        if (update.getTrackingStatus() != null) {
            this.trackingStatus = update.getTrackingStatus();
        }
        if (update.getStatus() != null) {
            this.status = update.getStatus();
        }
        if (update.getEstimatedDelivery() != null) {
            this.estimatedDelivery = update.getEstimatedDelivery();
        }
        if (update.getActualDelivery() != null) {
            this.actualDelivery = update.getActualDelivery();
        }
        if (update.getTrackingEvents() != null) {
            this.trackingEvents = update.getTrackingEvents();
        }
        this.lastTrackedAt = update.getLastTrackedAt() != null ? update.getLastTrackedAt() : Instant.now();
        this.updatedAt = Instant.now();
    }

    public boolean isDelivered() {
        return status == ShipmentStatus.DELIVERED;
    }
}
