package com.botcore.toolgate.application.config;

import com.botcore.toolgate.application.ratelimit.RateLimitRule;
import com.botcore.toolgate.application.support.TestStores;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GatewaySettingsTest {

    @Test
    void defaults() {
        GatewaySettings s = GatewaySettings.from(TestStores.config(Map.of()));

        assertThat(s.baseUrl(GatewaySettings.RUST)).isEqualTo("http://localhost:8080");
        assertThat(s.baseUrl(GatewaySettings.PYTHON)).isEqualTo("http://localhost:8000");
        assertThat(s.baseUrl("java")).isNull();
        assertThat(s.loginPath()).isEqualTo("/api/auth/login");
        assertThat(s.requestTimeoutMs()).isEqualTo(30_000L);
        assertThat(s.retryBackoffMs()).isEqualTo(1_000L);
        assertThat(s.confirmTtlMs()).isEqualTo(300_000L);
        assertThat(s.credentialLifetimeMs()).isEqualTo(86_400_000L);
        assertThat(s.credentialRefreshMarginMs()).isEqualTo(3_600_000L);
        assertThat(s.rateLimitSweepMs()).isEqualTo(60_000L);
        assertThat(s.usedTokenSweepMs()).isEqualTo(600_000L);
        assertThat(s.hasServiceCredentials()).isFalse();
    }

    @Test
    void overridesAndTrailingSlash() {
        GatewaySettings s = GatewaySettings.from(TestStores.config(Map.of(
                "rustApiUrl", "https://engine.internal/",
                "rateLimits", "real-trading=5/10000",
                "BOTCORE_EMAIL", "bot@example.com",
                "BOTCORE_PASSWORD", "pw"
        )));

        assertThat(s.baseUrl(GatewaySettings.RUST)).isEqualTo("https://engine.internal");
        assertThat(s.rateLimits().ruleFor("real-trading")).isEqualTo(new RateLimitRule(5, 10_000));
        assertThat(s.hasServiceCredentials()).isTrue();
    }

    @Test
    void toStringNeverShowsSecrets() {
        GatewaySettings s = GatewaySettings.from(TestStores.config(Map.of(
                "TOOLGATE_AUTH_TOKEN", "inbound-secret-value",
                "TOOLGATE_CONFIRM_SECRET", "confirm-secret-value",
                "BOTCORE_PASSWORD", "password-value"
        )));

        assertThat(s.toString())
                .doesNotContain("inbound-secret-value")
                .doesNotContain("confirm-secret-value")
                .doesNotContain("password-value")
                .contains("inboundAuth=SET");
    }
}
