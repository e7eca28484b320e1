package com.botcore.toolgate.application.tuning;

import com.botcore.toolgate.application.ports.AdjustmentCooldownStore;
import com.botcore.toolgate.application.ports.BackendPort;
import com.botcore.toolgate.application.service.InProcessTool;
import com.botcore.toolgate.domain.backend.BackendResponse;
import com.botcore.toolgate.domain.backend.CallOptions;
import com.botcore.toolgate.domain.gate.FailureCode;
import com.botcore.toolgate.domain.gate.ToolResult;
import com.botcore.toolgate.domain.tool.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import static com.botcore.toolgate.application.config.GatewaySettings.RUST;

/**
 * Bounded self-tuning of the paper trading engine.
 *
 * Flow per adjustment tool:
 * - normalize: parameter must exist and belong to the tool's tier; value is bounds-checked and step-rounded,
 *   so a confirmation token is bound to the value that will actually be written
 * - execute (after the gateway's confirmation stage): cooldown check, backend write, cooldown recorded on success
 *
 * Changes of one parameter are serialized; a cooldown is only started by a successful write.
 */
public final class TuningTools {

    private static final Logger log = LoggerFactory.getLogger(TuningTools.class);

    public static final String GET_PARAMETER_BOUNDS = "get_parameter_bounds";
    public static final String APPLY_GREEN = "apply_green_adjustment";
    public static final String REQUEST_YELLOW = "request_yellow_adjustment";
    public static final String REQUEST_RED = "request_red_adjustment";

    static final long BACKEND_TIMEOUT_MS = 10_000L;

    private final BackendPort backend;
    private final AdjustmentCooldownStore cooldowns;
    private final Clock clock;
    private final AdjustmentValidator validator = new AdjustmentValidator();
    private final ConcurrentHashMap<String, Object> applyLocks = new ConcurrentHashMap<>();

    public TuningTools(BackendPort backend, AdjustmentCooldownStore cooldowns, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.cooldowns = Objects.requireNonNull(cooldowns, "cooldowns");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Map<String, InProcessTool> handlers() {
        Map<String, InProcessTool> m = new LinkedHashMap<>();
        m.put(GET_PARAMETER_BOUNDS, args -> ToolResult.ok(describeBounds()));
        m.put(APPLY_GREEN, new Adjustment(TuningTier.GREEN));
        m.put(REQUEST_YELLOW, new Adjustment(TuningTier.YELLOW));
        m.put(REQUEST_RED, new Adjustment(TuningTier.RED));
        return m;
    }

    /** Parameters grouped by tier with ranges and current cooldown state. */
    public Map<String, Object> describeBounds() {
        long now = clock.millis();
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<TuningTier, List<ParameterBound>> e : ParameterBounds.byTier().entrySet()) {
            List<Map<String, Object>> items = new ArrayList<>();
            for (ParameterBound b : e.getValue()) {
                items.add(describe(b, now));
            }
            out.put(e.getKey().name(), items);
        }
        return out;
    }

    long cooldownRemainingMs(ParameterBound bound, long now) {
        Long last = cooldowns.lastAppliedAt(bound.key());
        if (last == null) return 0;
        return Math.max(0, last + bound.cooldownMs() - now);
    }

    static String toolFor(TuningTier tier) {
        return switch (tier) {
            case GREEN -> APPLY_GREEN;
            case YELLOW -> REQUEST_YELLOW;
            case RED -> REQUEST_RED;
        };
    }

    private Map<String, Object> describe(ParameterBound b, long now) {
        long remaining = cooldownRemainingMs(b, now);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("key", b.key());
        m.put("name", b.name());
        m.put("type", b.type().name().toLowerCase(Locale.ROOT));
        if (b.min() != null) m.put("min", AdjustmentValidator.normalize(b.min()));
        if (b.max() != null) m.put("max", AdjustmentValidator.normalize(b.max()));
        if (b.step() != null) m.put("step", AdjustmentValidator.normalize(b.step()));
        if (!b.enumValues().isEmpty()) m.put("values", b.enumValues());
        m.put("default", b.defaultValue());
        m.put("description", b.description());
        m.put("tool", toolFor(b.tier()));
        m.put("inCooldown", remaining > 0);
        m.put("cooldownRemainingSeconds", seconds(remaining));
        return m;
    }

    private BackendResponse write(ParameterBound bound, Object value) {
        String path = bound.apiEndpoint();
        HttpMethod method = HttpMethod.PUT;
        Map<String, Object> body = new LinkedHashMap<>();

        if (bound.type() == ParameterType.BOOLEAN && ParameterBounds.ENGINE_START.equals(bound.apiEndpoint())) {
            path = Boolean.TRUE.equals(value) ? ParameterBounds.ENGINE_START : ParameterBounds.ENGINE_STOP;
            method = HttpMethod.POST;
        } else if (ParameterBounds.SIGNAL_INTERVAL.equals(bound.apiEndpoint())) {
            body.put(bound.apiField(), ((Number) value).longValue() * 60);
        } else {
            body.put(bound.apiField(), value);
        }
        return backend.call(RUST, path, new CallOptions(method, body, BACKEND_TIMEOUT_MS, false));
    }

    private static long seconds(long ms) {
        return (ms + 999) / 1000;
    }

    private final class Adjustment implements InProcessTool {

        private final TuningTier tier;

        Adjustment(TuningTier tier) {
            this.tier = tier;
        }

        @Override
        public Map<String, Object> normalize(Map<String, Object> arguments) {
            Object rawKey = arguments.get("parameter");
            String key = rawKey == null ? null : String.valueOf(rawKey);
            ParameterBound bound = ParameterBounds.find(key)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown parameter: " + key));
            if (bound.tier() != tier) {
                throw new IllegalArgumentException(key + " is " + bound.tier() + " tier, not " + tier
                        + ". Use " + toolFor(bound.tier()) + ".");
            }

            AdjustmentValidation v = validator.validate(bound, arguments.get("new_value"));
            if (!v.valid()) {
                throw new IllegalArgumentException(v.error());
            }

            Map<String, Object> out = new LinkedHashMap<>(arguments);
            out.put("new_value", v.value());
            return out;
        }

        @Override
        public ToolResult execute(Map<String, Object> arguments) {
            String key = String.valueOf(arguments.get("parameter"));
            ParameterBound bound = ParameterBounds.find(key)
                    .orElseThrow(() -> new IllegalStateException("Unknown parameter after normalize: " + key));
            Object value = arguments.get("new_value");

            synchronized (applyLocks.computeIfAbsent(key, k -> new Object())) {
                long remaining = cooldownRemainingMs(bound, clock.millis());
                if (remaining > 0) {
                    long secs = seconds(remaining);
                    log.warn("[TUNING] parameter={} in cooldown remainingSec={}", key, secs);
                    return new ToolResult(false, null,
                            key + " is in cooldown. " + secs + "s remaining before next adjustment.",
                            FailureCode.RATE_LIMITED, secs, null);
                }

                BackendResponse res = write(bound, value);
                if (!res.success()) {
                    log.warn("[TUNING] parameter={} write failed status={} error={}", key, res.status(), res.error());
                    FailureCode code = res.code() == null ? FailureCode.UPSTREAM_ERROR : res.code();
                    String error = res.error() == null ? "Failed to apply adjustment" : res.error();
                    return ToolResult.failure(code, error);
                }
                cooldowns.recordApplied(key, clock.millis());
            }

            log.info("[TUNING] applied parameter={} tier={} value={}", key, tier, value);
            return ToolResult.ok(summary(bound, value, arguments));
        }

        private Map<String, Object> summary(ParameterBound bound, Object value, Map<String, Object> arguments) {
            Object reasoning = arguments.get("reasoning");
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("applied", true);
            out.put("parameter", bound.name());
            out.put("key", bound.key());
            out.put("newValue", value);
            out.put("reasoning", reasoning);
            switch (tier) {
                case GREEN -> {
                    out.put("source", "auto");
                    out.put("notification", "[AUTO] " + bound.name() + " changed to " + value + ". Reason: " + reasoning);
                }
                case YELLOW -> out.put("source", "confirmed");
                case RED -> {
                    out.put("source", "approved");
                    out.put("riskAssessment", arguments.get("risk_assessment"));
                    out.put("warning", "RED tier change applied. Monitor closely.");
                }
            }
            return out;
        }
    }
}
