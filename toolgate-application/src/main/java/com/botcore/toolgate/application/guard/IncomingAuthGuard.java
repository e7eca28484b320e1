package com.botcore.toolgate.application.guard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Gate for the inbound caller: one shared secret for every caller, no identities, no scopes.
 *
 * Rules:
 * - No secret configured: open mode, every call passes (warned once at startup).
 * - Otherwise the header must equal the secret, with an optional "Bearer " prefix.
 */
public final class IncomingAuthGuard {

    private static final Logger log = LoggerFactory.getLogger(IncomingAuthGuard.class);
    private static final String BEARER = "Bearer ";

    private final byte[] secret;

    public IncomingAuthGuard(String sharedSecret) {
        if (sharedSecret == null || sharedSecret.isBlank()) {
            this.secret = null;
            log.warn("[AUTH] No inbound auth token configured: tool gateway is running in OPEN mode, "
                    + "every caller is accepted. Set TOOLGATE_AUTH_TOKEN to enable the gate.");
        } else {
            this.secret = sharedSecret.getBytes(StandardCharsets.UTF_8);
        }
    }

    public boolean isOpen() {
        return secret == null;
    }

    public boolean validate(String header) {
        if (secret == null) {
            return true;
        }
        if (header == null || header.isBlank()) {
            return false;
        }
        String supplied = header.startsWith(BEARER) ? header.substring(BEARER.length()) : header;
        return MessageDigest.isEqual(secret, supplied.getBytes(StandardCharsets.UTF_8));
    }
}
