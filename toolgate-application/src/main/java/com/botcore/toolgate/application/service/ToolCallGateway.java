package com.botcore.toolgate.application.service;

import com.botcore.toolgate.application.catalog.ToolCatalog;
import com.botcore.toolgate.application.confirm.ConfirmationAuthority;
import com.botcore.toolgate.application.confirm.ConfirmationDecision;
import com.botcore.toolgate.application.guard.IncomingAuthGuard;
import com.botcore.toolgate.application.ports.BackendPort;
import com.botcore.toolgate.application.ratelimit.RateDecision;
import com.botcore.toolgate.application.ratelimit.RateLimiter;
import com.botcore.toolgate.domain.backend.BackendResponse;
import com.botcore.toolgate.domain.backend.CallOptions;
import com.botcore.toolgate.domain.gate.FailureCode;
import com.botcore.toolgate.domain.gate.ToolResult;
import com.botcore.toolgate.domain.tool.ToolDefinition;
import com.botcore.toolgate.domain.tool.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Admission pipeline for one tool call:
 * IncomingAuthGuard -> catalog -> arguments -> RateLimiter -> ConfirmationAuthority -> backend (or in-process tool).
 *
 * Every stage may short-circuit with a terminal {@link ToolResult}; nothing is thrown to the caller.
 * A timeout aborts the local wait only: a side effect the backend already committed stays committed.
 */
public class ToolCallGateway {

    private static final Logger log = LoggerFactory.getLogger(ToolCallGateway.class);

    private final IncomingAuthGuard authGuard;
    private final ToolCatalog catalog;
    private final RateLimiter rateLimiter;
    private final ConfirmationAuthority confirmations;
    private final BackendPort backend;
    private final Map<String, InProcessTool> inProcessTools;
    private final ToolArgumentValidator argumentValidator = new ToolArgumentValidator();
    private final ToolRequestRenderer renderer = new ToolRequestRenderer();

    /**
     * @param inProcessTools handlers keyed by tool name; every in-process catalog entry needs one
     */
    public ToolCallGateway(IncomingAuthGuard authGuard,
                           ToolCatalog catalog,
                           RateLimiter rateLimiter,
                           ConfirmationAuthority confirmations,
                           BackendPort backend,
                           Map<String, InProcessTool> inProcessTools) {
        this.authGuard = Objects.requireNonNull(authGuard, "authGuard");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.confirmations = Objects.requireNonNull(confirmations, "confirmations");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.inProcessTools = Map.copyOf(inProcessTools);
        for (ToolDefinition def : catalog.all()) {
            if (def.inProcess() && !this.inProcessTools.containsKey(def.name())) {
                throw new IllegalStateException("No in-process handler for tool " + def.name());
            }
        }
    }

    public ToolResult invoke(String authorization, String toolName, Map<String, Object> arguments) {
        if (!authGuard.validate(authorization)) {
            log.warn("[TOOL_CALL] tool={} stage=AUTH outcome=DENIED", toolName);
            return ToolResult.failure(FailureCode.AUTH_FAILURE, "Unauthorized: missing or invalid bearer token");
        }

        ToolDefinition def = catalog.find(toolName).orElse(null);
        if (def == null) {
            log.warn("[TOOL_CALL] tool={} stage=CATALOG outcome=UNKNOWN", toolName);
            return ToolResult.failure(FailureCode.UNKNOWN_TOOL, "Unknown tool: " + toolName);
        }

        Map<String, Object> params = new LinkedHashMap<>(arguments == null ? Map.of() : arguments);
        Object rawToken = params.remove(ConfirmationAuthority.CONFIRM_TOKEN_PARAM);
        String confirmToken = rawToken == null ? null : String.valueOf(rawToken);

        InProcessTool local = def.inProcess() ? inProcessTools.get(def.name()) : null;
        try {
            params = argumentValidator.validate(def, params);
            if (local != null) {
                params = local.normalize(params);
            }
        } catch (IllegalArgumentException e) {
            log.warn("[TOOL_CALL] tool={} tier={} stage=ARGS outcome=INVALID msg={}", def.name(), def.tier(), e.getMessage());
            return ToolResult.failure(FailureCode.INVALID_ARGUMENT, e.getMessage());
        }
        ToolInvocation call = def.invocation(params);

        RateDecision rate = rateLimiter.admit(call.category());
        if (!rate.allowed()) {
            log.warn("[TOOL_CALL] tool={} tier={} stage=RATE_LIMIT outcome=DENIED retryAfterSec={}",
                    call.toolName(), call.tier(), rate.retryAfterSeconds());
            return ToolResult.rateLimited(call.category(), rate.retryAfterSeconds());
        }

        ConfirmationDecision confirmation;
        try {
            confirmation = confirmations.check(call.toolName(), call.tier(), call.parameters(), confirmToken);
        } catch (IllegalArgumentException e) {
            log.warn("[TOOL_CALL] tool={} stage=CONFIRM outcome=INVALID msg={}", call.toolName(), e.getMessage());
            return ToolResult.failure(FailureCode.INVALID_ARGUMENT, e.getMessage());
        }
        switch (confirmation.outcome()) {
            case REQUIRE_CONFIRMATION -> {
                log.info("[TOOL_CALL] tool={} tier={} stage=CONFIRM outcome=PENDING", call.toolName(), call.tier());
                return ToolResult.confirmationRequired(confirmation.message(), confirmation.token());
            }
            case REJECT -> {
                log.warn("[TOOL_CALL] tool={} tier={} stage=CONFIRM outcome=REJECTED", call.toolName(), call.tier());
                return ToolResult.failure(FailureCode.INVALID_CONFIRMATION, confirmation.reason());
            }
            case PROCEED -> {
                // fall through to the backend
            }
        }

        if (local != null) {
            return executeInProcess(local, call);
        }

        RenderedRequest request;
        try {
            request = renderer.render(def, call.parameters());
        } catch (IllegalArgumentException e) {
            log.warn("[TOOL_CALL] tool={} stage=RENDER outcome=INVALID msg={}", call.toolName(), e.getMessage());
            return ToolResult.failure(FailureCode.INVALID_ARGUMENT, e.getMessage());
        }

        CallOptions options = new CallOptions(def.method(), request.body(), def.timeoutMs(), def.skipAuth());
        BackendResponse res = backend.call(def.service(), request.path(), options);

        if (res.success()) {
            log.info("[TOOL_CALL] tool={} tier={} stage=BACKEND outcome=OK status={}",
                    call.toolName(), call.tier(), res.status());
            return ToolResult.ok(res.data());
        }

        FailureCode code = res.code() == null ? FailureCode.UPSTREAM_ERROR : res.code();
        log.warn("[TOOL_CALL] tool={} tier={} stage=BACKEND outcome={} status={} error={}",
                call.toolName(), call.tier(), code, res.status(), res.error());
        return ToolResult.failure(code, res.error());
    }

    private ToolResult executeInProcess(InProcessTool local, ToolInvocation call) {
        ToolResult result;
        try {
            result = local.execute(call.parameters());
        } catch (RuntimeException e) {
            log.error("[TOOL_CALL] tool={} tier={} stage=IN_PROCESS outcome=ERROR", call.toolName(), call.tier(), e);
            return ToolResult.failure(FailureCode.UPSTREAM_ERROR, "Tool " + call.toolName() + " failed: " + e.getMessage());
        }
        if (result.success()) {
            log.info("[TOOL_CALL] tool={} tier={} stage=IN_PROCESS outcome=OK", call.toolName(), call.tier());
        } else {
            log.warn("[TOOL_CALL] tool={} tier={} stage=IN_PROCESS outcome={} error={}",
                    call.toolName(), call.tier(), result.code(), result.error());
        }
        return result;
    }

    public ToolCatalog catalog() {
        return catalog;
    }
}
