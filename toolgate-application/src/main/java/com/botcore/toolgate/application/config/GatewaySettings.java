package com.botcore.toolgate.application.config;

import com.botcore.toolgate.application.ports.ConfigPort;
import com.botcore.toolgate.application.ratelimit.RateLimitPolicy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the gateway configuration, resolved once at startup.
 * Secrets may be null; consumers decide what "not configured" means for them.
 */
public record GatewaySettings(
        Map<String, String> serviceUrls,
        String serviceEmail,
        String servicePassword,
        String loginPath,
        String inboundSecret,
        String confirmSecret,
        RateLimitPolicy rateLimits,
        long requestTimeoutMs,
        long retryBackoffMs,
        long confirmTtlMs,
        long credentialLifetimeMs,
        long credentialRefreshMarginMs,
        long rateLimitSweepMs,
        long usedTokenSweepMs
) {

    public static final String RUST = "rust";
    public static final String PYTHON = "python";

    public GatewaySettings {
        Objects.requireNonNull(serviceUrls, "serviceUrls");
        Objects.requireNonNull(rateLimits, "rateLimits");
        serviceUrls = Map.copyOf(serviceUrls);
    }

    public static GatewaySettings from(ConfigPort config) {
        Map<String, String> urls = new LinkedHashMap<>();
        urls.put(RUST, stripTrailingSlash(str(config, GatewayConfigKey.RUST_API_URL)));
        urls.put(PYTHON, stripTrailingSlash(str(config, GatewayConfigKey.PYTHON_API_URL)));

        return new GatewaySettings(
                urls,
                config.getSecret(GatewayConfigKey.BOTCORE_EMAIL.key()),
                config.getSecret(GatewayConfigKey.BOTCORE_PASSWORD.key()),
                str(config, GatewayConfigKey.LOGIN_PATH),
                config.getSecret(GatewayConfigKey.AUTH_TOKEN.key()),
                config.getSecret(GatewayConfigKey.CONFIRM_SECRET.key()),
                RateLimitPolicy.parse(config.get(GatewayConfigKey.RATE_LIMITS.key())),
                num(config, GatewayConfigKey.REQUEST_TIMEOUT_MS),
                num(config, GatewayConfigKey.RETRY_BACKOFF_MS),
                num(config, GatewayConfigKey.CONFIRM_TTL_MS),
                num(config, GatewayConfigKey.CREDENTIAL_LIFETIME_MS),
                num(config, GatewayConfigKey.CREDENTIAL_REFRESH_MARGIN_MS),
                num(config, GatewayConfigKey.RATE_LIMIT_SWEEP_MS),
                num(config, GatewayConfigKey.USED_TOKEN_SWEEP_MS)
        );
    }

    public String baseUrl(String service) {
        return service == null ? null : serviceUrls.get(service);
    }

    public boolean hasServiceCredentials() {
        return serviceEmail != null && !serviceEmail.isBlank()
                && servicePassword != null && !servicePassword.isBlank();
    }

    private static String str(ConfigPort config, GatewayConfigKey k) {
        return config.get(k.key(), k.defaultValue());
    }

    private static long num(ConfigPort config, GatewayConfigKey k) {
        return config.getLong(k.key(), Long.parseLong(k.defaultValue()));
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return null;
        String t = url.trim();
        while (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        return t;
    }

    @Override
    public String toString() {
        // secrets stay out of logs
        return "GatewaySettings{serviceUrls=" + serviceUrls
                + ", loginPath=" + loginPath
                + ", inboundAuth=" + (inboundSecret == null || inboundSecret.isBlank() ? "OPEN" : "SET")
                + ", confirmSecret=" + (confirmSecret == null || confirmSecret.isBlank() ? "RANDOM" : "SET")
                + ", rateLimits=" + rateLimits.rules() + " default=" + rateLimits.fallback()
                + ", requestTimeoutMs=" + requestTimeoutMs
                + ", retryBackoffMs=" + retryBackoffMs
                + ", confirmTtlMs=" + confirmTtlMs
                + '}';
    }
}
