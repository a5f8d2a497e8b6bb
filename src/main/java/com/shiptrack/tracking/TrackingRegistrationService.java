package com.shiptrack.tracking;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.shiptrack.providers.shippo.ShippoClient;
import com.shiptrack.providers.shippo.ShippoDTOs;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Registers new tracking numbers with Shippo at shipment creation.
 *
 * Flow:
 * 1. Register the tracking number so Shippo starts sending webhooks
 * 2. Fetch current tracking info to seed the shipment
 *
 * Best-effort: a provider failure leaves the snapshot at PENDING/UNKNOWN and the
 * webhook path reconciles the shipment later.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingRegistrationService {

    private final ShippoClient shippoClient;
    private final ShippoStatusMapper statusMapper;

    public TrackingSnapshot register(String carrier, String trackingNumber) {
        TrackingSnapshot snapshot = TrackingSnapshot.unknown();
        String providerCarrier = carrier.toLowerCase(Locale.ROOT);

        try {
            JsonNode registration = shippoClient.createTracking(providerCarrier, trackingNumber);
            if (registration != null) {
                snapshot.setProviderData(registration.toString());
            }

            ShippoDTOs.Track track = shippoClient.getTracking(providerCarrier, trackingNumber);
            if (track != null) {
                applyTrack(snapshot, track);
            }

            log.info("Tracking registered with Shippo: carrier={}, trackingNumber={}, trackingStatus={}",
                providerCarrier, trackingNumber, snapshot.getTrackingStatus());

        } catch (Exception e) {
            log.warn("Shippo tracking registration failed, continuing with defaults: carrier={}, trackingNumber={}",
                providerCarrier, trackingNumber, e);
        }

        return snapshot;
    }

    private void applyTrack(TrackingSnapshot snapshot, ShippoDTOs.Track track) {
        String providerStatus = track.getTrackingStatus() != null ? track.getTrackingStatus().getStatus() : null;
        if (providerStatus != null && !providerStatus.isBlank()) {
            snapshot.setTrackingStatus(providerStatus);
        }
        snapshot.setStatus(statusMapper.map(providerStatus));
        snapshot.setEstimatedDelivery(TrackingTimestamps.parse(track.getEta()));
        if (track.getTrackingHistory() != null) {
            snapshot.setTrackingEvents(
                JsonNodeFactory.instance.arrayNode().addAll(track.getTrackingHistory()).toString());
        }
    }
}
