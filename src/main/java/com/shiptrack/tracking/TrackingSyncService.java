package com.shiptrack.tracking;

import com.fasterxml.jackson.databind.JsonNode;
import com.shiptrack.common.exception.InvalidWebhookPayloadException;
import com.shiptrack.shipments.Shipment;
import com.shiptrack.shipments.ShipmentService;
import com.shiptrack.shipments.ShipmentStatus;
import com.shiptrack.shipments.TrackingUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Applies a Shippo tracking payload to the matching shipment.
 *
 * Every field is overwritten rather than accumulated, so a redelivered
 * payload leaves the shipment as a single delivery would.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingSyncService {

    private final ShipmentService shipmentService;
    private final ShippoStatusMapper statusMapper;
    private final Clock clock;

    public SyncResult synchronize(JsonNode data) {
        String trackingNumber = TrackingPayloads.text(data, TrackingPayloads.TRACKING_NUMBER);
        String carrier = TrackingPayloads.text(data, TrackingPayloads.CARRIER);

        if (isBlank(trackingNumber) || isBlank(carrier)) {
            throw new InvalidWebhookPayloadException("Invalid webhook data: missing tracking_number or carrier");
        }

        Optional<Shipment> shipment = shipmentService.findForTracking(carrier, trackingNumber);
        if (shipment.isEmpty()) {
            log.warn("Shipment not found for tracking update: carrier={}, trackingNumber={}", carrier, trackingNumber);
            return SyncResult.UNKNOWN_SHIPMENT;
        }

        String providerStatus = TrackingPayloads.status(data);
        ShipmentStatus status = statusMapper.map(providerStatus);

        Instant actualDelivery = null;
        if (status == ShipmentStatus.DELIVERED) {
            actualDelivery = TrackingTimestamps.parse(TrackingPayloads.latestStatusDate(data));
        }

        TrackingUpdate update = TrackingUpdate.builder()
            .trackingStatus(providerStatus)
            .status(status)
            .estimatedDelivery(TrackingTimestamps.parse(TrackingPayloads.text(data, TrackingPayloads.ETA)))
            .actualDelivery(actualDelivery)
            .trackingEvents(TrackingPayloads.history(data))
            .lastTrackedAt(clock.instant())
            .build();

        shipmentService.applyTrackingUpdate(shipment.get().getId(), update);
        return SyncResult.UPDATED;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
