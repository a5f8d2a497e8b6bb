package com.shiptrack.shipments;

import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * Generates and validates white-label tracking IDs: {@code GT} followed by
 * eight uppercase alphanumerics, e.g. {@code GT4A7B2C3D}.
 */
public final class WhiteLabelTrackingId {

    private static final String PREFIX = "GT";
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int RANDOM_LENGTH = 8;
    private static final Pattern FORMAT = Pattern.compile("^GT[A-Z0-9]{8}$");
    private static final SecureRandom RANDOM = new SecureRandom();

    private WhiteLabelTrackingId() {
    }

    public static String generate() {
        StringBuilder id = new StringBuilder(PREFIX);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return id.toString();
    }

    public static boolean isValid(String id) {
        return id != null && FORMAT.matcher(id).matches();
    }
}
