package com.botcore.toolgate.application.service;

import java.util.Map;

/**
 * Backend path (with query string, if any) and JSON body derived from tool arguments.
 * body is null when the HTTP method carries no body.
 */
public record RenderedRequest(String path, Map<String, Object> body) {
}
