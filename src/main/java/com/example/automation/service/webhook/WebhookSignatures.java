package com.example.automation.service.webhook;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 signing for webhook bodies, in the {@code sha256=<hex>} form used by
 * GitHub and most providers. Verification compares in constant time.
 */
public final class WebhookSignatures {

    public static final String PREFIX = "sha256=";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private WebhookSignatures() {
    }

    public static String sign(String secret, byte[] body) {
        try {
            var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return PREFIX + HexFormat.of().formatHex(mac.doFinal(body));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    public static String sign(String secret, String body) {
        return sign(secret, body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @param header value of the signature header, with or without the {@code sha256=} prefix
     */
    public static boolean verify(String secret, byte[] body, String header) {
        if (header == null || header.isBlank()) {
            return false;
        }
        var provided = header.trim().toLowerCase(Locale.ROOT);
        if (!provided.startsWith(PREFIX)) {
            provided = PREFIX + provided;
        }
        var expected = sign(secret, body);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] body) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
