package com.shiptrack.tracking;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiptrack.providers.shippo.ShippoApiException;
import com.shiptrack.providers.shippo.ShippoClient;
import com.shiptrack.providers.shippo.ShippoDTOs;
import com.shiptrack.shipments.Shipment;
import com.shiptrack.shipments.ShipmentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TrackingRegistrationService.
 */
@ExtendWith(MockitoExtension.class)
class TrackingRegistrationServiceTest {

    @Mock
    private ShippoClient shippoClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TrackingRegistrationService registrationService;

    @BeforeEach
    void setUp() {
        registrationService = new TrackingRegistrationService(shippoClient, new ShippoStatusMapper());
    }

    @Test
    void testRegister_SeedsSnapshotFromProvider() throws Exception {
        when(shippoClient.createTracking("fedex", "123456789012"))
            .thenReturn(objectMapper.readTree("{\"tracking_number\":\"123456789012\"}"));

        ShippoDTOs.Track track = new ShippoDTOs.Track();
        ShippoDTOs.Track.TrackingStatus status = new ShippoDTOs.Track.TrackingStatus();
        status.setStatus("in_transit");
        track.setTrackingStatus(status);
        track.setEta("2024-06-05T17:00:00Z");
        track.setTrackingHistory(List.of(objectMapper.readTree("{\"status\":\"in_transit\"}")));
        when(shippoClient.getTracking("fedex", "123456789012")).thenReturn(track);

        TrackingSnapshot snapshot = registrationService.register("FedEx", "123456789012");

        assertEquals("in_transit", snapshot.getTrackingStatus());
        assertEquals(ShipmentStatus.IN_TRANSIT, snapshot.getStatus());
        assertEquals(Instant.parse("2024-06-05T17:00:00Z"), snapshot.getEstimatedDelivery());
        assertEquals("[{\"status\":\"in_transit\"}]", snapshot.getTrackingEvents());
        assertEquals("{\"tracking_number\":\"123456789012\"}", snapshot.getProviderData());
    }

    @Test
    void testRegister_ProviderFailureLeavesDefaults() {
        when(shippoClient.createTracking(anyString(), anyString()))
            .thenThrow(new ShippoApiException("create tracking", 0, new ResourceAccessException("timeout")));

        TrackingSnapshot snapshot = registrationService.register("ups", "1Z999AA10123456784");

        assertEquals(Shipment.UNKNOWN_TRACKING_STATUS, snapshot.getTrackingStatus());
        assertEquals(ShipmentStatus.PENDING, snapshot.getStatus());
        assertEquals("[]", snapshot.getTrackingEvents());
        assertNull(snapshot.getProviderData());
        verify(shippoClient, never()).getTracking(anyString(), anyString());
    }
}
