package com.shiptrack.shipments;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for shipment persistence.
 */
@Repository
public interface ShipmentRepository extends JpaRepository<Shipment, String> {

    Optional<Shipment> findByTrackingNumber(String trackingNumber);

    Optional<Shipment> findByCarrierIgnoreCaseAndTrackingNumber(String carrier, String trackingNumber);

    boolean existsByTrackingNumber(String trackingNumber);

    boolean existsByWhiteLabelTrackingId(String whiteLabelTrackingId);
}
