package com.shiptrack.api.controller;

import com.shiptrack.api.dto.CreateShipmentRequest;
import com.shiptrack.shipments.Shipment;
import com.shiptrack.shipments.ShipmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for tracked shipments.
 */
@RestController
@RequestMapping("/api/v1/shipments")
@RequiredArgsConstructor
@Tag(name = "Shipments", description = "Tracked shipment API")
public class ShipmentController {

    private final ShipmentService shipmentService;

    @PostMapping
    @Operation(summary = "Create a shipment and register it for tracking")
    public ResponseEntity<Shipment> createShipment(@Valid @RequestBody CreateShipmentRequest request) {
        Shipment shipment = shipmentService.createShipment(
            request.getTrackingNumber().trim(),
            request.getCarrier().trim(),
            request.getNotes()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(shipment);
    }

    @GetMapping("/{shipmentId}")
    @Operation(summary = "Get shipment details")
    public ResponseEntity<Shipment> getShipment(@PathVariable String shipmentId) {
        return ResponseEntity.ok(shipmentService.getShipment(shipmentId));
    }

    @GetMapping("/tracking/{trackingNumber}")
    @Operation(summary = "Get a shipment by carrier tracking number")
    public ResponseEntity<Shipment> getShipmentByTrackingNumber(@PathVariable String trackingNumber) {
        return ResponseEntity.ok(shipmentService.getShipmentByTrackingNumber(trackingNumber));
    }
}
