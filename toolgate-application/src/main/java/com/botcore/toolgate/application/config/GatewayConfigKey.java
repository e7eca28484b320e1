package com.botcore.toolgate.application.config;

/**
 * Known configuration keys for the tool gateway.
 * Secrets are read under their literal environment name.
 */
public enum GatewayConfigKey {
    RUST_API_URL("rustApiUrl", false, true, "http://localhost:8080"),
    PYTHON_API_URL("pythonApiUrl", false, true, "http://localhost:8000"),

    // service login for the trading backend
    BOTCORE_EMAIL("BOTCORE_EMAIL", true, true, null),
    BOTCORE_PASSWORD("BOTCORE_PASSWORD", true, true, null),
    LOGIN_PATH("loginPath", false, true, "/api/auth/login"),

    AUTH_TOKEN("TOOLGATE_AUTH_TOKEN", true, true, null),
    CONFIRM_SECRET("TOOLGATE_CONFIRM_SECRET", true, true, null),

    RATE_LIMITS("rateLimits", false, true, null),
    REQUEST_TIMEOUT_MS("requestTimeoutMs", false, true, "30000"),
    RETRY_BACKOFF_MS("retryBackoffMs", false, true, "1000"),
    CONFIRM_TTL_MS("confirmTtlMs", false, true, "300000"),
    CREDENTIAL_LIFETIME_MS("credentialLifetimeMs", false, true, "86400000"),
    CREDENTIAL_REFRESH_MARGIN_MS("credentialRefreshMarginMs", false, true, "3600000"),
    RATE_LIMIT_SWEEP_MS("rateLimitSweepMs", false, true, "60000"),
    USED_TOKEN_SWEEP_MS("usedTokenSweepMs", false, true, "600000");

    private final String key;
    private final boolean secret;
    private final boolean optional;
    private final String defaultValue;

    GatewayConfigKey(String key, boolean secret, boolean optional, String defaultValue) {
        this.key = key;
        this.secret = secret;
        this.optional = optional;
        this.defaultValue = defaultValue;
    }

    public String key() { return key; }
    public boolean isSecret() { return secret; }
    public boolean isOptional() { return optional; }
    public String defaultValue() { return defaultValue; }
}
