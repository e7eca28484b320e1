package com.botcore.toolgate.domain.gate;

import java.util.Objects;

/**
 * Structured outcome of a tool call as seen by the agent.
 *
 * - success=true: data holds the backend payload
 * - success=false: error is human-readable, code classifies it
 * - CONFIRMATION_REQUIRED is not a failure of the call itself; confirmToken must be resubmitted
 */
public record ToolResult(
        boolean success,
        Object data,
        String error,
        FailureCode code,
        Long retryAfterSeconds,
        String confirmToken
) {

    public ToolResult {
        if (!success) {
            Objects.requireNonNull(code, "code");
            if (error == null || error.isBlank()) {
                error = code.name();
            }
        }
    }

    public static ToolResult ok(Object data) {
        return new ToolResult(true, data, null, null, null, null);
    }

    public static ToolResult failure(FailureCode code, String error) {
        return new ToolResult(false, null, error, code, null, null);
    }

    public static ToolResult rateLimited(String category, long retryAfterSeconds) {
        return new ToolResult(false, null,
                "Rate limit exceeded for category '" + category + "'. Retry after " + retryAfterSeconds + "s.",
                FailureCode.RATE_LIMITED, retryAfterSeconds, null);
    }

    public static ToolResult confirmationRequired(String message, String token) {
        return new ToolResult(false, null, message, FailureCode.CONFIRMATION_REQUIRED, null,
                Objects.requireNonNull(token, "token"));
    }

    public boolean awaitingConfirmation() {
        return code == FailureCode.CONFIRMATION_REQUIRED;
    }
}
