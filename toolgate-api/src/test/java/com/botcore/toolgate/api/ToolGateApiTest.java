package com.botcore.toolgate.api;

import com.botcore.toolgate.application.ports.ConfigPort;
import com.botcore.toolgate.infrastructure.config.EnvConfigService;
import com.jayway.jsonpath.JsonPath;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full stack: HTTP -> security chain -> gateway pipeline -> OkHttp -> fake backend.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ToolGateApiTest {

  private static final String AUTH = "Bearer inbound-secret";

  static final MockWebServer backend = new MockWebServer();
  static final CopyOnWriteArrayList<RecordedRequest> received = new CopyOnWriteArrayList<>();

  static {
    backend.setDispatcher(new Dispatcher() {
      @Override
      public MockResponse dispatch(RecordedRequest request) {
        received.add(request);
        String path = request.getPath() == null ? "" : request.getPath();
        if (path.startsWith("/api/auth/login")) {
          return json("{\"success\":true,\"data\":{\"token\":\"jwt-test\",\"user\":{\"id\":1}}}");
        }
        if (path.startsWith("/api/real-trading/orders")) {
          return json("{\"success\":true,\"data\":{\"orderId\":1}}");
        }
        if (path.startsWith("/api/ai/info")) {
          return json("{\"model\":\"gpt\"}");
        }
        if (path.startsWith("/api/market/candles/")) {
          return new MockResponse().setResponseCode(503).setBody("{\"error\":\"feed down\"}");
        }
        return new MockResponse().setResponseCode(404).setBody("{\"detail\":\"not found\"}");
      }
    });
    try {
      backend.start();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static MockResponse json(String body) {
    return new MockResponse().setResponseCode(200).setHeader("Content-Type", "application/json").setBody(body);
  }

  @AfterAll
  static void stopBackend() throws IOException {
    backend.shutdown();
  }

  @TestConfiguration
  static class BackendConfig {
    @Bean
    @Primary
    ConfigPort testConfigPort() {
      String base = backend.url("/").toString().replaceAll("/$", "");
      return new EnvConfigService(Map.of(
          "rustApiUrl", base,
          "pythonApiUrl", base,
          "BOTCORE_EMAIL", "bot@example.com",
          "BOTCORE_PASSWORD", "pw",
          "TOOLGATE_AUTH_TOKEN", "inbound-secret",
          "TOOLGATE_CONFIRM_SECRET", "confirm-secret",
          "rateLimits", "ai=1/60000",
          "retryBackoffMs", "10"
      ), Map.of());
    }
  }

  @Autowired MockMvc mvc;

  @Test
  void healthIsPublicAndEchoesRequestId() throws Exception {
    mvc.perform(get("/api/v1/health").header("X-Request-Id", "req-123"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Request-Id", "req-123"))
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.inboundAuth").value("enforced"));
  }

  @Test
  void requestIdIsGeneratedWhenAbsent() throws Exception {
    mvc.perform(get("/api/v1/health"))
        .andExpect(header().exists("X-Request-Id"));
  }

  @Test
  void listingRequiresSharedSecret() throws Exception {
    mvc.perform(get("/api/v1/tools"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("AUTH_FAILURE"));

    mvc.perform(get("/api/v1/tools").header("Authorization", AUTH))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tools[?(@.name == 'place_order')].tier").value("CRITICAL"))
        .andExpect(jsonPath("$.tools[?(@.name == 'place_order')].requiresConfirmation").value(true))
        .andExpect(jsonPath("$.tools[?(@.name == 'place_order')].arguments[1].allowedValues[0]").value("buy"));
  }

  @Test
  void toolCallWithoutSecretIsUnauthorized() throws Exception {
    mvc.perform(post("/api/v1/tools/get_ai_info").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.code").value("AUTH_FAILURE"));
  }

  @Test
  void unknownToolIsNotFound() throws Exception {
    mvc.perform(post("/api/v1/tools/format_disk").header("Authorization", AUTH)
            .contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("UNKNOWN_TOOL"));
  }

  @Test
  void missingPathArgumentIsBadRequest() throws Exception {
    mvc.perform(post("/api/v1/tools/get_candles").header("Authorization", AUTH)
            .contentType(MediaType.APPLICATION_JSON).content("{\"symbol\":\"BTCUSDT\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
  }

  @Test
  void malformedBodyUsesErrorShape() throws Exception {
    mvc.perform(post("/api/v1/tools/get_ai_info").header("Authorization", AUTH)
            .contentType(MediaType.APPLICATION_JSON).content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value("error"))
        .andExpect(jsonPath("$.reason").value("malformed_body"));
  }

  @Test
  void upstreamFailureIsBadGatewayAfterOneRetry() throws Exception {
    int before = countPath("/api/market/candles/");

    mvc.perform(post("/api/v1/tools/get_candles").header("Authorization", AUTH)
            .contentType(MediaType.APPLICATION_JSON).content("{\"symbol\":\"BTCUSDT\",\"timeframe\":\"1h\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("UPSTREAM_ERROR"))
        .andExpect(jsonPath("$.error").value("feed down"));

    assertThat(countPath("/api/market/candles/") - before).isEqualTo(2);
  }

  @Test
  void secondAiCallInWindowIsRateLimited() throws Exception {
    mvc.perform(post("/api/v1/tools/get_ai_info").header("Authorization", AUTH))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.model").value("gpt"));

    mvc.perform(post("/api/v1/tools/get_ai_info").header("Authorization", AUTH))
        .andExpect(status().isTooManyRequests())
        .andExpect(header().string("Retry-After", "60"))
        .andExpect(jsonPath("$.code").value("RATE_LIMITED"));
  }

  @Test
  void placeOrderNeedsConfirmationAndRunsOnce() throws Exception {
    String order = "{\"symbol\":\"BTCUSDT\",\"side\":\"buy\",\"order_type\":\"market\",\"quantity\":0.001}";

    String prompt = mvc.perform(post("/api/v1/tools/place_order").header("Authorization", AUTH)
            .contentType(MediaType.APPLICATION_JSON).content(order))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.code").value("CONFIRMATION_REQUIRED"))
        .andReturn().getResponse().getContentAsString();
    assertThat(countPath("/api/real-trading/orders")).isZero();

    String token = JsonPath.read(prompt, "$.confirmToken");
    String confirmed = "{\"side\":\"buy\",\"order_type\":\"market\",\"quantity\":0.001,\"symbol\":\"BTCUSDT\",\"confirm_token\":\"" + token + "\"}";

    mvc.perform(post("/api/v1/tools/place_order").header("Authorization", AUTH)
            .contentType(MediaType.APPLICATION_JSON).content(confirmed))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.orderId").value(1));

    mvc.perform(post("/api/v1/tools/place_order").header("Authorization", AUTH)
            .contentType(MediaType.APPLICATION_JSON).content(confirmed))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("INVALID_CONFIRMATION"));

    assertThat(countPath("/api/real-trading/orders")).isEqualTo(1);
    RecordedRequest orderCall = received.stream()
        .filter(r -> r.getPath() != null && r.getPath().startsWith("/api/real-trading/orders"))
        .findFirst().orElseThrow();
    assertThat(orderCall.getHeader("Authorization")).isEqualTo("Bearer jwt-test");
    assertThat(orderCall.getBody().readUtf8()).doesNotContain("confirm_token").contains("BTCUSDT");
  }

  @Test
  void orderSideOutsideTheAllowedSetIsBadRequest() throws Exception {
    int before = countPath("/api/real-trading/orders");

    mvc.perform(post("/api/v1/tools/place_order").header("Authorization", AUTH)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"symbol\":\"BTCUSDT\",\"side\":\"hold\",\"order_type\":\"market\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
        .andExpect(jsonPath("$.error").value(org.hamcrest.Matchers.containsString("got hold")));

    assertThat(countPath("/api/real-trading/orders")).isEqualTo(before);
  }

  @Test
  void parameterBoundsAreAnsweredInProcess() throws Exception {
    int before = received.size();

    mvc.perform(post("/api/v1/tools/get_parameter_bounds").header("Authorization", AUTH))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.YELLOW[?(@.key == 'leverage')].max").value(20))
        .andExpect(jsonPath("$.data.RED[?(@.key == 'engine_running')].tool").value("request_red_adjustment"));

    assertThat(received.size()).isEqualTo(before);
  }

  @Test
  void unlistedPathsAreDenied() throws Exception {
    mvc.perform(get("/api/v1/admin/users").header("Authorization", AUTH))
        .andExpect(status().isForbidden());
  }

  private static int countPath(String prefix) {
    return (int) received.stream()
        .filter(r -> r.getPath() != null && r.getPath().startsWith(prefix))
        .count();
  }
}
