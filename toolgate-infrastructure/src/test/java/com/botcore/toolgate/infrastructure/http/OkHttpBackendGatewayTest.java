package com.botcore.toolgate.infrastructure.http;

import com.botcore.toolgate.application.ports.CredentialPort;
import com.botcore.toolgate.domain.backend.BackendResponse;
import com.botcore.toolgate.domain.backend.CallOptions;
import com.botcore.toolgate.domain.gate.FailureCode;
import com.botcore.toolgate.domain.tool.HttpMethod;
import com.botcore.toolgate.infrastructure.auth.ServiceCredentialManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class OkHttpBackendGatewayTest {

    private MockWebServer server;
    private FakeCredentials credentials;
    private OkHttpBackendGateway gateway;
    private final ObjectMapper om = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        credentials = new FakeCredentials("svc-token");
        gateway = newGateway(5_000, 50);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private OkHttpBackendGateway newGateway(long timeoutMs, long backoffMs) {
        String base = server.url("/").toString().replaceAll("/$", "");
        return new OkHttpBackendGateway(new OkHttpClient(), om, Map.of("rust", base), credentials, timeoutMs, backoffMs);
    }

    private static MockResponse json(int code, String body) {
        return new MockResponse().setResponseCode(code).setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void wrapsPlainPayloadAndAttachesCredential() throws Exception {
        server.enqueue(json(200, "{\"price\": 42000.5}"));

        BackendResponse res = gateway.call("rust", "/api/market/prices", CallOptions.get());

        assertThat(res.success()).isTrue();
        assertThat(res.data()).isEqualTo(Map.of("price", 42000.5));
        RecordedRequest req = server.takeRequest();
        assertThat(req.getMethod()).isEqualTo("GET");
        assertThat(req.getPath()).isEqualTo("/api/market/prices");
        assertThat(req.getHeader("Authorization")).isEqualTo("Bearer svc-token");
    }

    @Test
    void skipAuthSendsNoAuthorizationHeader() throws Exception {
        server.enqueue(json(200, "{\"status\":\"ok\"}"));

        gateway.call("rust", "/api/health", CallOptions.get().withoutAuth());

        assertThat(server.takeRequest().getHeader("Authorization")).isNull();
        assertThat(credentials.fetches.get()).isZero();
    }

    @Test
    void postsJsonBody() throws Exception {
        server.enqueue(json(201, "{\"id\": 7}"));

        BackendResponse res = gateway.call("rust", "/api/real-trading/orders",
                CallOptions.of(HttpMethod.POST, Map.of("symbol", "BTCUSDT")));

        assertThat(res.success()).isTrue();
        RecordedRequest req = server.takeRequest();
        assertThat(req.getMethod()).isEqualTo("POST");
        assertThat(req.getHeader("Content-Type")).startsWith("application/json");
        assertThat(req.getBody().readUtf8()).isEqualTo("{\"symbol\":\"BTCUSDT\"}");
    }

    @Test
    void envelopeWithSuccessFieldPassesThrough() {
        server.enqueue(json(200, "{\"success\": true, \"data\": {\"balance\": 100}}"));
        BackendResponse ok = gateway.call("rust", "/api/real-trading/portfolio", CallOptions.get());
        assertThat(ok.success()).isTrue();
        assertThat(ok.data()).isEqualTo(Map.of("balance", 100));

        server.enqueue(json(200, "{\"success\": false, \"error\": \"engine stopped\"}"));
        BackendResponse failed = gateway.call("rust", "/api/real-trading/portfolio", CallOptions.get());
        assertThat(failed.success()).isFalse();
        assertThat(failed.error()).isEqualTo("engine stopped");
        assertThat(failed.code()).isEqualTo(FailureCode.UPSTREAM_ERROR);
    }

    @Test
    void envelopeWithExtraFieldsIsKeptWhole() {
        server.enqueue(json(200, "{\"success\": true, \"message\": \"engine started\", \"started_at\": 17}"));

        BackendResponse res = gateway.call("rust", "/api/paper-trading/start", CallOptions.of(HttpMethod.POST, Map.of()));

        assertThat(res.success()).isTrue();
        assertThat(res.data()).isEqualTo(Map.of("success", true, "message", "engine started", "started_at", 17));
    }

    @Test
    void credentialIsFetchedWithTheCallBudget() {
        server.enqueue(json(200, "{}"));

        gateway.call("rust", "/api/market/prices", CallOptions.get().withTimeout(2_000));

        assertThat(credentials.lastBudgetMs.get()).isBetween(1L, 2_000L);
    }

    @Test
    void hungLoginIsPaidFromTheCallBudget() throws IOException {
        MockWebServer login = new MockWebServer();
        login.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        login.start();
        try {
            OkHttpClient loginClient = new OkHttpClient.Builder().callTimeout(3, TimeUnit.SECONDS).build();
            ServiceCredentialManager manager = new ServiceCredentialManager(loginClient, om,
                    login.url("/").toString().replaceAll("/$", ""), "/api/auth/login",
                    "bot@example.com", "pw", 24 * 3_600_000L, 3_600_000L, Clock.systemUTC());
            String base = server.url("/").toString().replaceAll("/$", "");
            OkHttpBackendGateway gw = new OkHttpBackendGateway(new OkHttpClient(), om, Map.of("rust", base),
                    manager, 5_000, 50);

            long start = System.nanoTime();
            BackendResponse res = gw.call("rust", "/api/market/symbols", CallOptions.get().withTimeout(500));
            long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(res.code()).isEqualTo(FailureCode.TIMEOUT);
            assertThat(tookMs).isLessThan(1_500);
            assertThat(login.getRequestCount()).isEqualTo(1);
        } finally {
            login.shutdown();
        }
    }

    @Test
    void nonJsonBodyIsWrappedAsMessage() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("pong"));

        BackendResponse res = gateway.call("rust", "/ping", CallOptions.get());

        assertThat(res.success()).isTrue();
        assertThat(res.data()).isEqualTo(Map.of("message", "pong"));
    }

    @Test
    void errorMessageComesFromErrorThenDetailThenMessage() {
        server.enqueue(json(400, "{\"detail\": \"symbol is required\", \"message\": \"bad\"}"));
        assertThat(gateway.call("rust", "/a", CallOptions.get()).error()).isEqualTo("symbol is required");

        server.enqueue(json(422, "{\"error\": \"invalid side\", \"detail\": \"x\"}"));
        assertThat(gateway.call("rust", "/a", CallOptions.get()).error()).isEqualTo("invalid side");

        server.enqueue(json(404, "{}"));
        BackendResponse notFound = gateway.call("rust", "/a", CallOptions.get());
        assertThat(notFound.error()).isEqualTo("HTTP 404");
        assertThat(notFound.status()).isEqualTo(404);
        assertThat(notFound.code()).isEqualTo(FailureCode.UPSTREAM_ERROR);
    }

    @Test
    void getIsRetriedOnceAfterServerError() {
        server.enqueue(json(503, "{\"error\": \"warming up\"}"));
        server.enqueue(json(200, "{\"ok\": true}"));

        BackendResponse res = gateway.call("rust", "/api/market/overview", CallOptions.get());

        assertThat(res.success()).isTrue();
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void getIsRetriedAtMostOnce() {
        server.enqueue(json(500, "{\"error\": \"first\"}"));
        server.enqueue(json(502, "{\"error\": \"second\"}"));
        server.enqueue(json(200, "{}"));

        BackendResponse res = gateway.call("rust", "/api/market/overview", CallOptions.get());

        assertThat(res.success()).isFalse();
        assertThat(res.error()).isEqualTo("second");
        assertThat(res.status()).isEqualTo(502);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void postIsNeverRetried() {
        server.enqueue(json(500, "{\"error\": \"exchange down\"}"));
        server.enqueue(json(200, "{}"));

        BackendResponse res = gateway.call("rust", "/api/real-trading/orders",
                CallOptions.of(HttpMethod.POST, Map.of("symbol", "BTCUSDT")));

        assertThat(res.success()).isFalse();
        assertThat(res.error()).isEqualTo("exchange down");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void slowBackendTimesOut() {
        server.enqueue(json(200, "{}").setHeadersDelay(3, TimeUnit.SECONDS));

        long start = System.nanoTime();
        BackendResponse res = gateway.call("rust", "/api/ai/analyze",
                CallOptions.of(HttpMethod.POST, Map.of()).withTimeout(300));
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(res.success()).isFalse();
        assertThat(res.code()).isEqualTo(FailureCode.TIMEOUT);
        assertThat(tookMs).isLessThan(2_500);
    }

    @Test
    void retryBackoffIsPaidFromTheSameBudget() {
        OkHttpBackendGateway tight = newGateway(5_000, 1_000);
        server.enqueue(json(500, "{}"));
        server.enqueue(json(200, "{}"));

        // 400ms budget cannot fit a 1s backoff: the first failure is returned as is
        BackendResponse res = tight.call("rust", "/api/market/overview", CallOptions.get().withTimeout(400));

        assertThat(res.success()).isFalse();
        assertThat(res.status()).isEqualTo(500);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void unauthorizedDropsCachedCredential() {
        server.enqueue(json(401, "{\"error\": \"token expired\"}"));

        BackendResponse res = gateway.call("rust", "/api/real-trading/status", CallOptions.get());

        assertThat(res.code()).isEqualTo(FailureCode.UPSTREAM_AUTH_FAILURE);
        assertThat(res.error()).isEqualTo("token expired");
        assertThat(credentials.invalidations.get()).isEqualTo(1);
    }

    @Test
    void unknownServiceFailsWithoutRequest() {
        BackendResponse res = gateway.call("java", "/x", CallOptions.get());

        assertThat(res.success()).isFalse();
        assertThat(res.error()).contains("java");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void connectionFailureIsNetworkError() {
        // nothing listens on port 1
        OkHttpBackendGateway unreachable = new OkHttpBackendGateway(new OkHttpClient(), om,
                Map.of("rust", "http://127.0.0.1:1"), credentials, 2_000, 10);

        BackendResponse res = unreachable.call("rust", "/api/market/prices", CallOptions.get());

        assertThat(res.success()).isFalse();
        assertThat(res.code()).isIn(FailureCode.NETWORK_ERROR, FailureCode.TIMEOUT);
    }

    private static final class FakeCredentials implements CredentialPort {
        private final String token;
        final AtomicInteger fetches = new AtomicInteger();
        final AtomicInteger invalidations = new AtomicInteger();

        FakeCredentials(String token) {
            this.token = token;
        }

        final AtomicLong lastBudgetMs = new AtomicLong(-1);

        @Override
        public String getCredential() {
            fetches.incrementAndGet();
            return token;
        }

        @Override
        public String getCredential(long budgetMs) {
            lastBudgetMs.set(budgetMs);
            return getCredential();
        }

        @Override
        public void invalidate() {
            invalidations.incrementAndGet();
        }
    }
}
