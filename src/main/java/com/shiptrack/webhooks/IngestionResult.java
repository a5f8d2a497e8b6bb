package com.shiptrack.webhooks;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * HTTP-level outcome of one webhook delivery.
 */
@Getter
@AllArgsConstructor
public class IngestionResult {

    private final int httpStatus;

    private final Map<String, Object> body;

    /**
     * Null when the request was rejected before the signature step.
     */
    private final SignatureCheck signatureCheck;
}
