package com.shiptrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for shipment tracking sync.
 *
 * Receives tracking webhooks from Shippo, reconciles them against stored
 * shipments and manages the webhook subscription with the provider.
 */
@SpringBootApplication
@EnableAsync
public class ShipTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShipTrackApplication.class, args);
    }
}
