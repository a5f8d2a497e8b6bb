package com.shiptrack.webhooks;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies Shippo webhook signatures: hex HMAC-SHA256 of the raw request body.
 *
 * The body must be the exact bytes received. Re-serialized JSON will not match.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    /**
     * @return true if the signature matches, or if no secret is configured
     */
    public boolean verify(byte[] rawBody, String signatureHeader, String secret) {
        return check(rawBody, signatureHeader, secret).isAccepted();
    }

    /**
     * Like {@link #verify} but tells a skipped check apart from a real pass.
     * Never throws.
     */
    public SignatureCheck check(byte[] rawBody, String signatureHeader, String secret) {
        if (secret == null || secret.isEmpty()) {
            log.debug("Webhook signature verification skipped: no secret configured");
            return SignatureCheck.SKIPPED;
        }
        if (rawBody == null || signatureHeader == null || signatureHeader.isBlank()) {
            return SignatureCheck.FAILED;
        }

        try {
            String expected = sign(rawBody, secret);
            String provided = signatureHeader.trim().toLowerCase(Locale.ROOT);

            boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8)
            );
            return matches ? SignatureCheck.VERIFIED : SignatureCheck.FAILED;

        } catch (IllegalStateException e) {
            log.warn("Error verifying webhook signature", e);
            return SignatureCheck.FAILED;
        }
    }

    /**
     * Compute the lowercase hex HMAC-SHA256 of {@code rawBody}.
     *
     * @throws IllegalStateException if the JVM cannot provide HmacSHA256
     */
    public String sign(byte[] rawBody, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(rawBody));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to compute " + ALGORITHM + " signature", e);
        }
    }
}
