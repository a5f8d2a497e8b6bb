package com.shiptrack.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * DTO for creating a tracked shipment.
 */
@Data
public class CreateShipmentRequest {

    @NotBlank(message = "Tracking number is required")
    private String trackingNumber;

    @NotBlank(message = "Carrier is required")
    private String carrier;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    private String notes;
}
