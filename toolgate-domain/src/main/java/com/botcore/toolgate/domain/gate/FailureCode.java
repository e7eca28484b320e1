package com.botcore.toolgate.domain.gate;

public enum FailureCode {
    AUTH_FAILURE,
    UPSTREAM_AUTH_FAILURE,
    RATE_LIMITED,
    CONFIRMATION_REQUIRED,
    INVALID_CONFIRMATION,
    UPSTREAM_ERROR,
    TIMEOUT,
    NETWORK_ERROR,
    UNKNOWN_TOOL,
    INVALID_ARGUMENT
}
