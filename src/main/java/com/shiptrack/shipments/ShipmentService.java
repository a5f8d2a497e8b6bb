package com.shiptrack.shipments;

import com.shiptrack.common.exception.DuplicateShipmentException;
import com.shiptrack.common.exception.InvalidTrackingNumberException;
import com.shiptrack.common.exception.ShipmentNotFoundException;
import com.shiptrack.tracking.TrackingRegistrationService;
import com.shiptrack.tracking.TrackingSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Service for shipment creation and tracking state updates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShipmentService {

    private static final int MAX_ID_ATTEMPTS = 10;

    private final ShipmentRepository shipmentRepository;
    private final TrackingRegistrationService trackingRegistrationService;

    /**
     * Create a shipment and register it with Shippo for tracking.
     *
     * The provider calls happen outside any transaction; their failure does
     * not prevent creation.
     */
    public Shipment createShipment(String trackingNumber, String carrier, String notes) {
        if (!TrackingNumberFormat.isValid(carrier, trackingNumber)) {
            throw new InvalidTrackingNumberException(carrier, trackingNumber);
        }
        if (shipmentRepository.existsByTrackingNumber(trackingNumber)) {
            throw new DuplicateShipmentException(trackingNumber);
        }

        TrackingSnapshot snapshot = trackingRegistrationService.register(carrier, trackingNumber);

        Shipment shipment = new Shipment(trackingNumber, carrier, newWhiteLabelTrackingId());
        shipment.setStatus(snapshot.getStatus());
        shipment.setTrackingStatus(snapshot.getTrackingStatus());
        shipment.setEstimatedDelivery(snapshot.getEstimatedDelivery());
        shipment.setTrackingEvents(snapshot.getTrackingEvents());
        shipment.setProviderData(snapshot.getProviderData());
        shipment.setLastTrackedAt(Instant.now());
        shipment.setNotes(notes);

        shipment = shipmentRepository.save(shipment);

        log.info("Created shipment {} ({}) for {} {} with status {}",
            shipment.getId(), shipment.getWhiteLabelTrackingId(), carrier, trackingNumber, shipment.getStatus());

        return shipment;
    }

    @Transactional(readOnly = true)
    public Shipment getShipment(String id) {
        return shipmentRepository.findById(id)
            .orElseThrow(() -> new ShipmentNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public Shipment getShipmentByTrackingNumber(String trackingNumber) {
        return shipmentRepository.findByTrackingNumber(trackingNumber)
            .orElseThrow(() -> new ShipmentNotFoundException(trackingNumber));
    }

    /**
     * Find the shipment a provider event refers to. Carrier codes are
     * compared case-insensitively.
     */
    @Transactional(readOnly = true)
    public Optional<Shipment> findForTracking(String carrier, String trackingNumber) {
        return shipmentRepository.findByCarrierIgnoreCaseAndTrackingNumber(carrier, trackingNumber);
    }

    @Transactional
    public Shipment applyTrackingUpdate(String shipmentId, TrackingUpdate update) {
        Shipment shipment = getShipment(shipmentId);
        shipment.applyTracking(update);
        shipment = shipmentRepository.save(shipment);

        log.info("Updated tracking for shipment {}: status={}, trackingStatus={}",
            shipmentId, shipment.getStatus(), shipment.getTrackingStatus());

        return shipment;
    }

    private String newWhiteLabelTrackingId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = WhiteLabelTrackingId.generate();
            if (!shipmentRepository.existsByWhiteLabelTrackingId(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique white-label tracking ID");
    }
}
