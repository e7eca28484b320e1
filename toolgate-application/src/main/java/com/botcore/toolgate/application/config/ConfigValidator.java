package com.botcore.toolgate.application.config;

import com.botcore.toolgate.application.ports.ConfigPort;
import com.botcore.toolgate.application.ratelimit.RateLimitPolicy;

public final class ConfigValidator {

    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        for (GatewayConfigKey k : GatewayConfigKey.values()) {
            if (k.isOptional()) continue;

            String v = k.isSecret() ? config.getSecret(k.key()) : config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required " + (k.isSecret() ? "secret" : "config") + ": " + k.key());
            }
        }

        // Lightweight sanity checks (no network calls)
        checkUrl(res, config, GatewayConfigKey.RUST_API_URL);
        checkUrl(res, config, GatewayConfigKey.PYTHON_API_URL);

        String table = config.get(GatewayConfigKey.RATE_LIMITS.key(), "");
        if (!table.isBlank()) {
            try {
                RateLimitPolicy.parse(table);
            } catch (IllegalArgumentException e) {
                res.addError("rateLimits is malformed: " + e.getMessage());
            }
        }

        checkPositive(res, config, GatewayConfigKey.REQUEST_TIMEOUT_MS);
        checkPositive(res, config, GatewayConfigKey.RETRY_BACKOFF_MS);
        checkPositive(res, config, GatewayConfigKey.CONFIRM_TTL_MS);
        checkPositive(res, config, GatewayConfigKey.CREDENTIAL_LIFETIME_MS);
        checkPositive(res, config, GatewayConfigKey.RATE_LIMIT_SWEEP_MS);
        checkPositive(res, config, GatewayConfigKey.USED_TOKEN_SWEEP_MS);

        Long lifetime = longOf(res, config, GatewayConfigKey.CREDENTIAL_LIFETIME_MS);
        Long margin = longOf(res, config, GatewayConfigKey.CREDENTIAL_REFRESH_MARGIN_MS);
        if (lifetime != null && margin != null && (margin < 0 || (lifetime > 0 && margin * 2 >= lifetime))) {
            res.addError("credentialRefreshMarginMs must be >= 0 and less than half of credentialLifetimeMs");
        }

        if (blank(config.getSecret(GatewayConfigKey.AUTH_TOKEN.key()))) {
            res.addWarning("TOOLGATE_AUTH_TOKEN is not set: inbound auth gate is disabled (open mode)");
        }
        if (blank(config.getSecret(GatewayConfigKey.CONFIRM_SECRET.key()))) {
            res.addWarning("TOOLGATE_CONFIRM_SECRET is not set: a random secret is used and every restart "
                    + "invalidates outstanding confirmation prompts");
        }
        if (blank(config.getSecret(GatewayConfigKey.BOTCORE_EMAIL.key()))
                || blank(config.getSecret(GatewayConfigKey.BOTCORE_PASSWORD.key()))) {
            res.addWarning("BOTCORE_EMAIL/BOTCORE_PASSWORD are not set: backend calls go out without a credential");
        }

        return res;
    }

    private static void checkUrl(ConfigValidationResult res, ConfigPort config, GatewayConfigKey k) {
        String url = config.get(k.key(), k.defaultValue());
        if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
            res.addError(k.key() + " must start with http:// or https://");
        }
    }

    private static void checkPositive(ConfigValidationResult res, ConfigPort config, GatewayConfigKey k) {
        try {
            if (config.getLong(k.key(), Long.parseLong(k.defaultValue())) <= 0) {
                res.addError(k.key() + " must be a positive number of milliseconds");
            }
        } catch (RuntimeException e) {
            res.addError(k.key() + " must be a positive number of milliseconds");
        }
    }

    // null when unparseable; checkPositive already reported it
    private static Long longOf(ConfigValidationResult res, ConfigPort config, GatewayConfigKey k) {
        try {
            return config.getLong(k.key(), Long.parseLong(k.defaultValue()));
        } catch (RuntimeException e) {
            if (k == GatewayConfigKey.CREDENTIAL_REFRESH_MARGIN_MS) {
                res.addError(k.key() + " must be a number of milliseconds");
            }
            return null;
        }
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
