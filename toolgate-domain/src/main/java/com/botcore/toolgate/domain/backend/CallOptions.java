package com.botcore.toolgate.domain.backend;

import com.botcore.toolgate.domain.tool.HttpMethod;

import java.util.Objects;

/**
 * Per-request knobs for an outbound backend call.
 * timeoutMs == null means the gateway default applies.
 */
public record CallOptions(HttpMethod method, Object body, Long timeoutMs, boolean skipAuth) {

    public CallOptions {
        Objects.requireNonNull(method, "method");
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
    }

    public static CallOptions get() {
        return new CallOptions(HttpMethod.GET, null, null, false);
    }

    public static CallOptions of(HttpMethod method, Object body) {
        return new CallOptions(method, body, null, false);
    }

    public CallOptions withTimeout(long timeoutMs) {
        return new CallOptions(method, body, timeoutMs, skipAuth);
    }

    public CallOptions withoutAuth() {
        return new CallOptions(method, body, timeoutMs, true);
    }
}
