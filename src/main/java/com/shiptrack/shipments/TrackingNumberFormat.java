package com.shiptrack.shipments;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Carrier-specific tracking number formats.
 * Carriers without a known format accept any non-blank value.
 */
public final class TrackingNumberFormat {

    private static final Map<String, Pattern> PATTERNS = Map.of(
        "fedex", Pattern.compile("^[0-9]{12,14}$"),
        "ups", Pattern.compile("^1Z[0-9A-Z]{16}$"),
        "usps", Pattern.compile("^[0-9]{13,34}$"),
        "dhl_express", Pattern.compile("^[0-9]{10,11}$"),
        "dhl_ecommerce", Pattern.compile("^[0-9]{10,11}$")
    );

    private TrackingNumberFormat() {
    }

    public static boolean isValid(String carrier, String trackingNumber) {
        if (carrier == null || trackingNumber == null || trackingNumber.isBlank()) {
            return false;
        }
        Pattern pattern = PATTERNS.get(carrier.toLowerCase(Locale.ROOT));
        if (pattern == null) {
            return true;
        }
        return pattern.matcher(trackingNumber).matches();
    }
}
