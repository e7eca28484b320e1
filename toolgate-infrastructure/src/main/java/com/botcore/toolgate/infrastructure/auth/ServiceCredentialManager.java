package com.botcore.toolgate.infrastructure.auth;

import com.botcore.toolgate.application.ports.CredentialPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Obtains and caches the bearer token the gateway presents to the trading backend.
 *
 * Notes:
 * - the cached token is used while expiresAt is more than refreshMarginMs away
 * - a login stores expiresAt = now + (lifetime - margin), so a token is never used past its real expiry
 * - concurrent refreshes are serialized; late arrivals reuse the fresh token
 * - with a budget, waiting for the refresh lock and the login request both come out of it
 * - 2 * refreshMarginMs < lifetimeMs, otherwise a fresh token would be refreshed again almost at once
 * - failures yield "" and the backend's 401 is what the caller sees
 */
public final class ServiceCredentialManager implements CredentialPort {

    private static final Logger log = LoggerFactory.getLogger(ServiceCredentialManager.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    /** Token plus the instant (epoch ms) after which it must not be attached any more. */
    record Credential(String token, long expiresAt) {}

    private final OkHttpClient http;
    private final ObjectMapper om;
    private final String loginUrl;
    private final String email;
    private final String password;
    private final long lifetimeMs;
    private final long refreshMarginMs;
    private final Clock clock;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile Credential cached;
    private volatile boolean missingCredentialsWarned;

    public ServiceCredentialManager(OkHttpClient http,
                                    ObjectMapper om,
                                    String baseUrl,
                                    String loginPath,
                                    String email,
                                    String password,
                                    long lifetimeMs,
                                    long refreshMarginMs,
                                    Clock clock) {
        this.http = Objects.requireNonNull(http, "http");
        this.om = Objects.requireNonNull(om, "om");
        this.loginUrl = Objects.requireNonNull(baseUrl, "baseUrl") + Objects.requireNonNull(loginPath, "loginPath");
        this.email = email;
        this.password = password;
        if (lifetimeMs <= 0) throw new IllegalArgumentException("lifetimeMs must be positive");
        if (refreshMarginMs < 0 || 2 * refreshMarginMs >= lifetimeMs) {
            throw new IllegalArgumentException("refreshMarginMs must be >= 0 and less than half of lifetimeMs");
        }
        this.lifetimeMs = lifetimeMs;
        this.refreshMarginMs = refreshMarginMs;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String getCredential() {
        Credential c = cached;
        if (isFresh(c)) return c.token();

        refreshLock.lock();
        try {
            c = cached;
            if (isFresh(c)) return c.token();

            return refresh(http);
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public String getCredential(long budgetMs) {
        Credential c = cached;
        if (isFresh(c)) return c.token();
        if (budgetMs <= 0) return "";

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(budgetMs);
        try {
            if (!refreshLock.tryLock(budgetMs, TimeUnit.MILLISECONDS)) {
                log.warn("[CREDENTIAL] refresh still running after {}ms, calling without a credential", budgetMs);
                return "";
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[CREDENTIAL] interrupted while waiting for a refresh");
            return "";
        }
        try {
            c = cached;
            if (isFresh(c)) return c.token();

            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) return "";
            return refresh(bounded(remainingMs));
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public void invalidate() {
        cached = null;
    }

    // caller holds refreshLock
    private String refresh(OkHttpClient client) {
        Credential next = login(client);
        if (next == null) return "";
        cached = next;
        return next.token();
    }

    private OkHttpClient bounded(long budgetMs) {
        int configured = http.callTimeoutMillis();
        long limit = configured > 0 ? Math.min(configured, budgetMs) : budgetMs;
        return http.newBuilder().callTimeout(limit, TimeUnit.MILLISECONDS).build();
    }

    boolean hasCachedCredential() {
        return cached != null;
    }

    private boolean isFresh(Credential c) {
        return c != null && c.expiresAt() > clock.millis() + refreshMarginMs;
    }

    private Credential login(OkHttpClient client) {
        if (email == null || email.isBlank() || password == null || password.isBlank()) {
            if (!missingCredentialsWarned) {
                missingCredentialsWarned = true;
                log.warn("[CREDENTIAL] BOTCORE_EMAIL/BOTCORE_PASSWORD not set, calling backend without a credential");
            }
            return null;
        }

        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("email", email);
        payload.put("password", password);

        try {
            Request req = new Request.Builder()
                    .url(loginUrl)
                    .post(RequestBody.create(om.writeValueAsString(payload), JSON))
                    .build();

            try (Response resp = client.newCall(req).execute()) {
                ResponseBody rb = resp.body();
                String text = rb == null ? "" : rb.string();
                if (!resp.isSuccessful()) {
                    log.warn("[CREDENTIAL] login failed: HTTP {}", resp.code());
                    return null;
                }

                String token = extractToken(text);
                if (token == null) {
                    log.warn("[CREDENTIAL] login response carries no token");
                    return null;
                }

                long now = clock.millis();
                log.info("[CREDENTIAL] service login ok, token valid for {}ms", lifetimeMs - refreshMarginMs);
                return new Credential(token, now + (lifetimeMs - refreshMarginMs));
            }
        } catch (IOException e) {
            log.warn("[CREDENTIAL] login failed: {}", e.getMessage());
            return null;
        }
    }

    // IOException covers Jackson parse errors too
    private String extractToken(String text) throws IOException {
        JsonNode root = om.readTree(text);
        if (root == null) return null;
        JsonNode token = root.path("data").path("token");
        if (!token.isTextual()) token = root.path("token");
        if (!token.isTextual() || token.asText().isBlank()) return null;
        return token.asText();
    }
}
