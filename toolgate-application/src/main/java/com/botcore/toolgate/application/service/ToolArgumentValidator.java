package com.botcore.toolgate.application.service;

import com.botcore.toolgate.domain.tool.ArgumentSpec;
import com.botcore.toolgate.domain.tool.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks call arguments against the tool's declared input schema.
 *
 * - missing required argument, wrong JSON type or a value outside the allowed set: rejected
 * - arguments the tool does not declare are dropped, they never reach the backend
 * - a null value counts as absent
 * - tools without a declared schema get their arguments back unchanged
 */
public final class ToolArgumentValidator {

    private static final Logger log = LoggerFactory.getLogger(ToolArgumentValidator.class);

    /**
     * @return the accepted arguments, in declaration order
     * @throws IllegalArgumentException listing every problem found
     */
    public Map<String, Object> validate(ToolDefinition def, Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        if (!def.declaresArguments()) {
            return new LinkedHashMap<>(args);
        }

        List<String> problems = new ArrayList<>();
        Map<String, Object> accepted = new LinkedHashMap<>();
        for (ArgumentSpec spec : def.arguments()) {
            Object v = args.get(spec.name());
            if (v == null) {
                if (spec.required()) problems.add("missing required argument '" + spec.name() + "'");
                continue;
            }
            if (!spec.type().accepts(v)) {
                problems.add("argument '" + spec.name() + "' must be " + spec.type().label());
                continue;
            }
            if (!spec.allowedValues().isEmpty() && !spec.allowedValues().contains(v)) {
                problems.add("argument '" + spec.name() + "' must be one of " + spec.allowedValues() + " (got " + v + ")");
                continue;
            }
            accepted.put(spec.name(), v);
        }

        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid arguments for " + def.name() + ": " + String.join("; ", problems));
        }

        if (accepted.size() < args.size()) {
            List<String> dropped = new ArrayList<>();
            for (String k : args.keySet()) {
                if (!accepted.containsKey(k) && args.get(k) != null) dropped.add(k);
            }
            if (!dropped.isEmpty()) {
                log.debug("[TOOL_CALL] tool={} dropped undeclared arguments={}", def.name(), dropped);
            }
        }
        return accepted;
    }
}
