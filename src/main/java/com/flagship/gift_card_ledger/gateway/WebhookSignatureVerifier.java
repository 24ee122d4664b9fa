package com.flagship.gift_card_ledger.gateway;

import com.flagship.gift_card_ledger.exception.SignatureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Verifies the HMAC-SHA256 signature the gateway sends with each webhook.
 *
 * The signature is the lowercase hex HMAC of the raw request body, optionally
 * prefixed with {@code sha256=}. Comparison is constant-time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final PaymentGatewayProperties properties;

    /**
     * @throws SignatureException if the secret is not configured or the signature does not match
     */
    public void verify(String rawBody, String signatureHeader) {
        String secret = properties.getWebhook().getSecret();
        if (secret == null || secret.isBlank()) {
            throw new SignatureException("Webhook secret is not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new SignatureException("Missing webhook signature");
        }

        String provided = signatureHeader.trim().toLowerCase();
        if (provided.startsWith(PREFIX)) {
            provided = provided.substring(PREFIX.length());
        }

        String expected = sign(secret, rawBody == null ? "" : rawBody);
        boolean matches = MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            provided.getBytes(StandardCharsets.US_ASCII));
        if (!matches) {
            log.warn("Rejected webhook with invalid signature");
            throw new SignatureException("Invalid webhook signature");
        }
    }

    /**
     * Hex HMAC-SHA256 of {@code payload}, as the gateway computes it.
     */
    public static String sign(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
