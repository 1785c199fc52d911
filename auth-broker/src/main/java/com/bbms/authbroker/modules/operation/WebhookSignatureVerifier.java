package com.bbms.authbroker.modules.operation;

import com.bbms.authbroker.config.ProviderProperties;
import lombok.RequiredArgsConstructor;
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
 * Checks the {@code X-AuthID-Signature} header of provider webhooks: the hex
 * HMAC-SHA256 of the raw request body under the shared webhook secret,
 * optionally prefixed with {@code sha256=}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    private final ProviderProperties properties;

    public boolean isConfigured() {
        String secret = properties.getWebhookSecret();
        return secret != null && !secret.isBlank();
    }

    public boolean isValid(String payload, String signature) {
        if (!isConfigured()) {
            log.warn("Webhook rejected: no webhook secret configured");
            return false;
        }
        if (payload == null || signature == null || signature.isBlank()) {
            return false;
        }

        String provided = signature.trim().toLowerCase(Locale.ROOT);
        if (provided.startsWith(SIGNATURE_PREFIX)) {
            provided = provided.substring(SIGNATURE_PREFIX.length());
        }
        String expected = sign(payload, properties.getWebhookSecret());
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    /** Hex HMAC-SHA256 of {@code payload}. */
    static String sign(String payload, String secret) {
        try {
            Mac hmac = Mac.getInstance(HMAC_ALGORITHM);
            hmac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(hmac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
