package com.botcore.toolgate.application.confirm;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * HMAC-SHA256 / SHA-256 helpers for confirmation tokens.
 */
public final class ConfirmationSigner {

    static final int DIGEST_HEX_LENGTH = 32;
    static final int FINGERPRINT_HEX_LENGTH = 16;

    private final byte[] secret;

    public ConfirmationSigner(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("confirmation secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    /** 32 random bytes as hex; used when no secret is configured. */
    public static String randomSecret() {
        byte[] b = new byte[32];
        new SecureRandom().nextBytes(b);
        return HexFormat.of().formatHex(b);
    }

    /** Truncated HMAC over toolName:paramsFingerprint:issuedAt. */
    public String digest(String toolName, String paramsFingerprint, long issuedAtMs) {
        String data = toolName + ":" + paramsFingerprint + ":" + issuedAtMs;
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            String hex = HexFormat.of().formatHex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
            return hex.substring(0, DIGEST_HEX_LENGTH);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to calculate HMAC-SHA256 digest", e);
        }
    }

    /** Truncated SHA-256 of the canonical parameter string. */
    public static String fingerprint(String canonicalParams) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] h = md.digest(canonicalParams.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(h).substring(0, FINGERPRINT_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // constant-time compare
    static boolean sameDigest(String expected, String supplied) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                supplied.getBytes(StandardCharsets.UTF_8));
    }
}
