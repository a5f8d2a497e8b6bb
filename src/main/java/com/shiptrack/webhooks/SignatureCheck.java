package com.shiptrack.webhooks;

/**
 * Outcome of webhook signature verification, reported to the provider in the
 * {@code X-Signature-Verification} response header.
 */
public enum SignatureCheck {

    /**
     * Signature present and matching.
     */
    VERIFIED("verified"),

    /**
     * No secret configured, so nothing was checked.
     */
    SKIPPED("skipped"),

    /**
     * Secret configured but the request carried no signature header.
     */
    UNSIGNED("unsigned"),

    FAILED("failed");

    private final String headerValue;

    SignatureCheck(String headerValue) {
        this.headerValue = headerValue;
    }

    public String getHeaderValue() {
        return headerValue;
    }

    public boolean isAccepted() {
        return this != FAILED;
    }
}
