package com.botcore.toolgate.application.ports;

import com.botcore.toolgate.domain.backend.BackendResponse;
import com.botcore.toolgate.domain.backend.CallOptions;

/**
 * Outbound request path towards the trading / AI backends.
 */
public interface BackendPort {

    /**
     * Performs one logical call (at most one retry for GET + 5xx).
     * Never throws: every transport problem becomes a failed {@link BackendResponse}.
     */
    BackendResponse call(String service, String path, CallOptions options);
}
