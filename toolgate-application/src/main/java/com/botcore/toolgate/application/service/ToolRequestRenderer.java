package com.botcore.toolgate.application.service;

import com.botcore.toolgate.domain.tool.ArgumentSpec;
import com.botcore.toolgate.domain.tool.ToolDefinition;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Maps tool arguments onto the backend request:
 * - {placeholders} in the path template are filled (URL-encoded) and consumed
 * - remaining arguments go to the JSON body for POST/PUT/PATCH, to the query string otherwise
 * - a declared body argument replaces the whole JSON body with its own value
 * - array values are sent as one comma-separated query parameter
 */
public final class ToolRequestRenderer {

    public RenderedRequest render(ToolDefinition def, Map<String, Object> arguments) {
        Map<String, Object> rest = new LinkedHashMap<>(arguments == null ? Map.of() : arguments);

        String path = def.pathTemplate();
        for (String name : def.pathParameters()) {
            Object v = rest.remove(name);
            if (v == null || String.valueOf(v).isBlank()) {
                throw new IllegalArgumentException("Missing required argument '" + name + "' for tool " + def.name());
            }
            path = path.replace("{" + name + "}", encode(String.valueOf(v)));
        }

        if (def.method().carriesBody()) {
            Optional<ArgumentSpec> bodyArg = def.bodyArgument();
            if (bodyArg.isPresent()) {
                return new RenderedRequest(path, asBody(rest.get(bodyArg.get().name())));
            }
            return new RenderedRequest(path, rest);
        }

        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, Object> e : rest.entrySet()) {
            if (e.getValue() == null) continue;
            query.add(encode(e.getKey()) + "=" + encode(queryValue(e.getValue())));
        }
        return new RenderedRequest(query.length() == 0 ? path : path + "?" + query, null);
    }

    private static Map<String, Object> asBody(Object value) {
        if (value == null) return null;
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("body argument must be an object");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        map.forEach((k, v) -> body.put(String.valueOf(k), v));
        return body;
    }

    private static String queryValue(Object value) {
        if (value instanceof Collection<?> items) {
            StringJoiner joined = new StringJoiner(",");
            for (Object item : items) joined.add(String.valueOf(item));
            return joined.toString();
        }
        return String.valueOf(value);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
