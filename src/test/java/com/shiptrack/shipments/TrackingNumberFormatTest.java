package com.shiptrack.shipments;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TrackingNumberFormat and WhiteLabelTrackingId.
 */
class TrackingNumberFormatTest {

    @Test
    void testIsValid_CarrierFormats() {
        assertTrue(TrackingNumberFormat.isValid("fedex", "123456789012"));
        assertFalse(TrackingNumberFormat.isValid("fedex", "12345"));
        assertTrue(TrackingNumberFormat.isValid("UPS", "1Z999AA10123456784"));
        assertFalse(TrackingNumberFormat.isValid("ups", "2Z999AA10123456784"));
        assertTrue(TrackingNumberFormat.isValid("usps", "9400100000000000000000"));
        assertTrue(TrackingNumberFormat.isValid("dhl_express", "1234567890"));
        assertFalse(TrackingNumberFormat.isValid("dhl_ecommerce", "123456789012"));
    }

    @Test
    void testIsValid_OtherCarriersNeedNonBlank() {
        assertTrue(TrackingNumberFormat.isValid("canada_post", "ANY-123"));
        assertFalse(TrackingNumberFormat.isValid("canada_post", " "));
        assertFalse(TrackingNumberFormat.isValid("canada_post", null));
    }

    @Test
    void testWhiteLabelTrackingId_Format() {
        for (int i = 0; i < 50; i++) {
            String id = WhiteLabelTrackingId.generate();
            assertTrue(WhiteLabelTrackingId.isValid(id), id);
        }
        assertFalse(WhiteLabelTrackingId.isValid("GT1234"));
        assertFalse(WhiteLabelTrackingId.isValid("XX12345678"));
    }
}
