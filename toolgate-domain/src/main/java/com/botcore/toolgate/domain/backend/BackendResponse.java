package com.botcore.toolgate.domain.backend;

import com.botcore.toolgate.domain.gate.FailureCode;

/**
 * Normalized outcome of one backend call: {success:true, data} or {success:false, error}.
 *
 * code is set only for failures produced by the gateway itself (timeout, network,
 * non-2xx). A backend envelope passed through with success=false carries UPSTREAM_ERROR.
 * status is the final HTTP status, or 0 when no response was received.
 */
public record BackendResponse(boolean success, Object data, String error, FailureCode code, int status) {

    public static BackendResponse ok(Object data, int status) {
        return new BackendResponse(true, data, null, null, status);
    }

    public static BackendResponse failure(FailureCode code, String error, int status) {
        return new BackendResponse(false, null, error, code, status);
    }
}
