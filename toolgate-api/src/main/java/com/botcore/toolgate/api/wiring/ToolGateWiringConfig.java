package com.botcore.toolgate.api.wiring;

import com.botcore.toolgate.application.catalog.BotCoreTools;
import com.botcore.toolgate.application.catalog.ToolCatalog;
import com.botcore.toolgate.application.config.ConfigValidationResult;
import com.botcore.toolgate.application.config.ConfigValidator;
import com.botcore.toolgate.application.config.GatewaySettings;
import com.botcore.toolgate.application.confirm.ConfirmationAuthority;
import com.botcore.toolgate.application.confirm.ConfirmationSigner;
import com.botcore.toolgate.application.guard.IncomingAuthGuard;
import com.botcore.toolgate.application.maintenance.GatewayMaintenance;
import com.botcore.toolgate.application.ports.AdjustmentCooldownStore;
import com.botcore.toolgate.application.ports.BackendPort;
import com.botcore.toolgate.application.ports.ConfigPort;
import com.botcore.toolgate.application.ports.CredentialPort;
import com.botcore.toolgate.application.ports.ParamsCanonicalizer;
import com.botcore.toolgate.application.ports.RateBucketStore;
import com.botcore.toolgate.application.ports.UsedTokenStore;
import com.botcore.toolgate.application.ratelimit.RateLimiter;
import com.botcore.toolgate.application.service.ToolCallGateway;
import com.botcore.toolgate.application.tuning.TuningTools;
import com.botcore.toolgate.infrastructure.auth.ServiceCredentialManager;
import com.botcore.toolgate.infrastructure.config.EnvConfigService;
import com.botcore.toolgate.infrastructure.http.OkHttpBackendGateway;
import com.botcore.toolgate.infrastructure.json.JacksonParamsCanonicalizer;
import com.botcore.toolgate.infrastructure.store.InMemoryAdjustmentCooldownStore;
import com.botcore.toolgate.infrastructure.store.InMemoryRateBucketStore;
import com.botcore.toolgate.infrastructure.store.InMemoryUsedTokenStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class ToolGateWiringConfig {

  private static final Logger log = LoggerFactory.getLogger(ToolGateWiringConfig.class);

  @Bean
  public ConfigPort configPort() throws IOException {
    return EnvConfigService.defaultFromWorkingDir();
  }

  /**
   * Resolved once at startup.
   * Fail-fast: malformed URLs / rate-limit table stop the context; warnings are only logged.
   */
  @Bean
  public GatewaySettings gatewaySettings(ConfigPort config) {
    ConfigValidationResult res = new ConfigValidator().validate(config);
    for (String w : res.warnings()) {
      log.warn("[CONFIG] {}", w);
    }
    if (!res.isValid()) {
      throw new IllegalStateException("Invalid tool gateway configuration: " + String.join("; ", res.errors()));
    }
    GatewaySettings settings = GatewaySettings.from(config);
    log.info("[CONFIG] {}", settings);
    return settings;
  }

  @Bean
  public Clock gatewayClock() {
    return Clock.systemUTC();
  }

  @Bean
  public IncomingAuthGuard incomingAuthGuard(GatewaySettings settings) {
    return new IncomingAuthGuard(settings.inboundSecret());
  }

  @Bean
  public RateBucketStore rateBucketStore() {
    return new InMemoryRateBucketStore();
  }

  @Bean
  public RateLimiter rateLimiter(GatewaySettings settings, RateBucketStore buckets, Clock clock) {
    return new RateLimiter(settings.rateLimits(), buckets, clock);
  }

  @Bean
  public UsedTokenStore usedTokenStore() {
    return new InMemoryUsedTokenStore();
  }

  @Bean
  public ParamsCanonicalizer paramsCanonicalizer() {
    return new JacksonParamsCanonicalizer();
  }

  @Bean
  public ConfirmationSigner confirmationSigner(GatewaySettings settings) {
    String secret = settings.confirmSecret();
    if (secret == null || secret.isBlank()) {
      log.warn("[CONFIRM] TOOLGATE_CONFIRM_SECRET not set, using a per-process random secret; "
          + "a restart invalidates every outstanding confirmation token");
      secret = ConfirmationSigner.randomSecret();
    }
    return new ConfirmationSigner(secret);
  }

  @Bean
  public ConfirmationAuthority confirmationAuthority(ConfirmationSigner signer,
                                                     ParamsCanonicalizer canonicalizer,
                                                     UsedTokenStore usedTokens,
                                                     Clock clock,
                                                     GatewaySettings settings) {
    return new ConfirmationAuthority(signer, canonicalizer, usedTokens, clock, settings.confirmTtlMs());
  }

  /** Per-call deadlines are applied by the gateway; the shared client only bounds connects. */
  @Bean
  public OkHttpClient backendHttpClient() {
    return new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .readTimeout(0, TimeUnit.MILLISECONDS)
        .writeTimeout(0, TimeUnit.MILLISECONDS)
        .build();
  }

  @Bean
  public CredentialPort credentialPort(OkHttpClient http, ObjectMapper om, GatewaySettings settings, Clock clock) {
    OkHttpClient loginClient = http.newBuilder()
        .callTimeout(settings.requestTimeoutMs(), TimeUnit.MILLISECONDS)
        .build();
    return new ServiceCredentialManager(
        loginClient,
        om,
        settings.baseUrl(GatewaySettings.RUST),
        settings.loginPath(),
        settings.serviceEmail(),
        settings.servicePassword(),
        settings.credentialLifetimeMs(),
        settings.credentialRefreshMarginMs(),
        clock
    );
  }

  @Bean
  public BackendPort backendPort(OkHttpClient http, ObjectMapper om, GatewaySettings settings, CredentialPort credentials) {
    return new OkHttpBackendGateway(http, om, settings.serviceUrls(), credentials,
        settings.requestTimeoutMs(), settings.retryBackoffMs());
  }

  @Bean
  public ToolCatalog toolCatalog() {
    ToolCatalog catalog = BotCoreTools.catalog();
    log.info("[TOOL_CALL] catalog loaded tools={}", catalog.size());
    return catalog;
  }

  @Bean
  public AdjustmentCooldownStore adjustmentCooldownStore() {
    return new InMemoryAdjustmentCooldownStore();
  }

  @Bean
  public TuningTools tuningTools(BackendPort backend, AdjustmentCooldownStore cooldowns, Clock clock) {
    return new TuningTools(backend, cooldowns, clock);
  }

  @Bean
  public ToolCallGateway toolCallGateway(IncomingAuthGuard guard,
                                         ToolCatalog catalog,
                                         RateLimiter rateLimiter,
                                         ConfirmationAuthority confirmations,
                                         BackendPort backend,
                                         TuningTools tuningTools) {
    return new ToolCallGateway(guard, catalog, rateLimiter, confirmations, backend, tuningTools.handlers());
  }

  @Bean(initMethod = "start", destroyMethod = "shutdown")
  public GatewayMaintenance gatewayMaintenance(RateLimiter rateLimiter,
                                               ConfirmationAuthority confirmations,
                                               GatewaySettings settings) {
    return new GatewayMaintenance(rateLimiter, confirmations,
        settings.rateLimitSweepMs(), settings.usedTokenSweepMs());
  }
}
