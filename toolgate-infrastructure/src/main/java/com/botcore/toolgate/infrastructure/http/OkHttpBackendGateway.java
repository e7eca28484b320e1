package com.botcore.toolgate.infrastructure.http;

import com.botcore.toolgate.application.ports.BackendPort;
import com.botcore.toolgate.application.ports.CredentialPort;
import com.botcore.toolgate.domain.backend.BackendResponse;
import com.botcore.toolgate.domain.backend.CallOptions;
import com.botcore.toolgate.domain.gate.FailureCode;
import com.botcore.toolgate.domain.tool.HttpMethod;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp based request path towards the backends.
 *
 * - one deadline per logical call; a service login, the GET retry and its backoff are paid from the same budget
 * - 5xx on GET is retried exactly once, other methods never
 * - bodies are parsed as JSON; anything else is wrapped as {"message": text}
 * - a backend 401 invalidates the cached credential
 *
 * A timeout only stops waiting: whatever the backend already committed stays committed.
 */
public final class OkHttpBackendGateway implements BackendPort {

    private static final Logger log = LoggerFactory.getLogger(OkHttpBackendGateway.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper om;
    private final Map<String, String> serviceUrls;
    private final CredentialPort credentials;
    private final long defaultTimeoutMs;
    private final long retryBackoffMs;

    public OkHttpBackendGateway(OkHttpClient client,
                                ObjectMapper om,
                                Map<String, String> serviceUrls,
                                CredentialPort credentials,
                                long defaultTimeoutMs,
                                long retryBackoffMs) {
        this.client = Objects.requireNonNull(client, "client");
        this.om = Objects.requireNonNull(om, "om");
        this.serviceUrls = Map.copyOf(serviceUrls);
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        if (defaultTimeoutMs <= 0) throw new IllegalArgumentException("defaultTimeoutMs must be positive");
        if (retryBackoffMs < 0) throw new IllegalArgumentException("retryBackoffMs must be >= 0");
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.retryBackoffMs = retryBackoffMs;
    }

    @Override
    public BackendResponse call(String service, String path, CallOptions options) {
        String baseUrl = service == null ? null : serviceUrls.get(service);
        if (baseUrl == null) {
            log.warn("[BACKEND] unknown service={} path={}", service, path);
            return BackendResponse.failure(FailureCode.UPSTREAM_ERROR, "Unknown service: " + service, 0);
        }

        HttpUrl url = HttpUrl.parse(baseUrl + path);
        if (url == null) {
            return BackendResponse.failure(FailureCode.UPSTREAM_ERROR, "Invalid URL: " + baseUrl + path, 0);
        }

        long timeoutMs = options.timeoutMs() != null ? options.timeoutMs() : defaultTimeoutMs;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        Request request;
        try {
            request = buildRequest(url, options, deadline);
        } catch (JsonProcessingException e) {
            return BackendResponse.failure(FailureCode.UPSTREAM_ERROR, "Request body is not serializable: " + e.getOriginalMessage(), 0);
        }

        boolean retryable = options.method().retryableOnServerError();

        int attempt = 1;
        while (true) {
            long remainingMs = remainingMs(deadline);
            if (remainingMs <= 0) {
                return timeout(service, path, timeoutMs);
            }

            Attempt result;
            try {
                result = execute(request, remainingMs);
            } catch (InterruptedIOException e) {
                return timeout(service, path, timeoutMs);
            } catch (IOException e) {
                log.warn("[BACKEND] network error service={} {} {} msg={}", service, options.method(), path, e.getMessage());
                return BackendResponse.failure(FailureCode.NETWORK_ERROR, "Network error: " + describe(e), 0);
            }

            if (result.status() >= 500 && retryable && attempt == 1) {
                if (remainingMs(deadline) <= retryBackoffMs) {
                    return failure(result, options);
                }
                log.warn("[BACKEND] {} {} {} -> HTTP {}, retrying once in {}ms",
                        service, options.method(), path, result.status(), retryBackoffMs);
                try {
                    Thread.sleep(retryBackoffMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return BackendResponse.failure(FailureCode.NETWORK_ERROR, "Interrupted while waiting to retry", result.status());
                }
                attempt++;
                continue;
            }

            if (result.status() < 200 || result.status() >= 300) {
                return failure(result, options);
            }
            return success(result);
        }
    }

    private Request buildRequest(HttpUrl url, CallOptions options, long deadline) throws JsonProcessingException {
        Request.Builder b = new Request.Builder()
                .url(url)
                .header("Accept", "application/json");

        if (!options.skipAuth()) {
            String token = credentials.getCredential(remainingMs(deadline));
            b.header("Authorization", "Bearer " + (token == null ? "" : token));
        }

        HttpMethod m = options.method();
        RequestBody body = null;
        if (m.carriesBody()) {
            Object payload = options.body() == null ? Map.of() : options.body();
            body = RequestBody.create(om.writeValueAsString(payload), JSON);
        }
        return b.method(m.name(), body).build();
    }

    private Attempt execute(Request request, long remainingMs) throws IOException {
        OkHttpClient perCall = client.newBuilder()
                .callTimeout(remainingMs, TimeUnit.MILLISECONDS)
                .readTimeout(remainingMs, TimeUnit.MILLISECONDS)
                .build();

        try (Response resp = perCall.newCall(request).execute()) {
            ResponseBody rb = resp.body();
            String text = rb == null ? "" : rb.string();
            return new Attempt(resp.code(), parse(text));
        }
    }

    private Object parse(String text) {
        try {
            return om.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("message", text);
            return wrapped;
        }
    }

    private BackendResponse success(Attempt result) {
        if (result.payload() instanceof Map<?, ?> map && map.containsKey("success")) {
            // backend already speaks the envelope: pass it through
            boolean ok = Boolean.TRUE.equals(map.get("success"));
            if (ok) {
                return BackendResponse.ok(envelopeData(map), result.status());
            }
            String error = errorMessage(map, result.status());
            return BackendResponse.failure(FailureCode.UPSTREAM_ERROR, error, result.status());
        }
        return BackendResponse.ok(result.payload(), result.status());
    }

    /** {success, data} yields data; an envelope with further top-level fields is kept whole. */
    private static Object envelopeData(Map<?, ?> envelope) {
        for (Object key : envelope.keySet()) {
            if (!"success".equals(key) && !"data".equals(key)) {
                return envelope;
            }
        }
        return envelope.get("data");
    }

    private BackendResponse failure(Attempt result, CallOptions options) {
        String error = result.payload() instanceof Map<?, ?> map
                ? errorMessage(map, result.status())
                : "HTTP " + result.status();

        if (result.status() == 401 && !options.skipAuth()) {
            credentials.invalidate();
            log.warn("[BACKEND] HTTP 401, cached credential dropped");
            return BackendResponse.failure(FailureCode.UPSTREAM_AUTH_FAILURE, error, result.status());
        }
        log.warn("[BACKEND] HTTP {} error={}", result.status(), error);
        return BackendResponse.failure(FailureCode.UPSTREAM_ERROR, error, result.status());
    }

    private String errorMessage(Map<?, ?> map, int status) {
        for (String field : new String[]{"error", "detail", "message"}) {
            Object v = map.get(field);
            if (v == null) continue;
            if (v instanceof String s) {
                if (!s.isBlank()) return s;
                continue;
            }
            try {
                return om.writeValueAsString(v);
            } catch (JsonProcessingException e) {
                return String.valueOf(v);
            }
        }
        return "HTTP " + status;
    }

    private BackendResponse timeout(String service, String path, long timeoutMs) {
        log.warn("[BACKEND] timeout after {}ms service={} path={}", timeoutMs, service, path);
        return BackendResponse.failure(FailureCode.TIMEOUT, "Request timed out after " + timeoutMs + "ms", 0);
    }

    private static long remainingMs(long deadlineNanos) {
        return TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
    }

    private static String describe(IOException e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }

    private record Attempt(int status, Object payload) {}
}
