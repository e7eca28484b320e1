package com.botcore.toolgate.application.catalog;

import com.botcore.toolgate.domain.tool.ToolDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the tools the gateway is willing to proxy. Names are unique.
 */
public final class ToolCatalog {

    private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();

    public synchronized ToolCatalog register(ToolDefinition def) {
        if (tools.putIfAbsent(def.name(), def) != null) {
            throw new IllegalStateException("Duplicate tool name: " + def.name());
        }
        return this;
    }

    public synchronized Optional<ToolDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public synchronized Collection<ToolDefinition> all() {
        return Collections.unmodifiableList(new ArrayList<>(tools.values()));
    }

    public synchronized int size() {
        return tools.size();
    }
}
