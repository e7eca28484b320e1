package com.botcore.toolgate.domain.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One inbound tool call. Ephemeral: never stored.
 */
public record ToolInvocation(String toolName, Tier tier, Map<String, Object> parameters, String category) {

    public ToolInvocation {
        Objects.requireNonNull(toolName, "toolName");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(category, "category");
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
