package com.botcore.toolgate.domain.tool;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE;

    /**
     * Only GET may be replayed after a 5xx. Everything else can duplicate a side effect
     * (an order, a settings change) on the backend.
     */
    public boolean retryableOnServerError() {
        return this == GET;
    }

    public boolean carriesBody() {
        return this == POST || this == PUT || this == PATCH;
    }
}
