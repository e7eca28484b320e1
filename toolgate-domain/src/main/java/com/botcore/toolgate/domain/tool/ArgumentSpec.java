package com.botcore.toolgate.domain.tool;

import java.util.List;
import java.util.Objects;

/**
 * Declared input of a tool.
 *
 * - allowedValues restricts a STRING argument to a fixed set (exact match)
 * - body=true marks an OBJECT argument whose value is sent as the whole JSON request body
 */
public record ArgumentSpec(String name, ArgType type, boolean required, List<String> allowedValues, boolean body) {

    public ArgumentSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) throw new IllegalArgumentException("argument name must not be blank");
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
        if (!allowedValues.isEmpty() && type != ArgType.STRING) {
            throw new IllegalArgumentException("allowed values need a STRING argument: " + name);
        }
        if (body && type != ArgType.OBJECT) {
            throw new IllegalArgumentException("body argument must be an OBJECT: " + name);
        }
    }

    public static ArgumentSpec required(String name, ArgType type) {
        return new ArgumentSpec(name, type, true, List.of(), false);
    }

    public static ArgumentSpec optional(String name, ArgType type) {
        return new ArgumentSpec(name, type, false, List.of(), false);
    }

    public static ArgumentSpec requiredOneOf(String name, String... values) {
        return new ArgumentSpec(name, ArgType.STRING, true, List.of(values), false);
    }

    public static ArgumentSpec optionalOneOf(String name, String... values) {
        return new ArgumentSpec(name, ArgType.STRING, false, List.of(values), false);
    }

    /** Required object sent as the request body itself, e.g. a settings patch. */
    public static ArgumentSpec body(String name) {
        return new ArgumentSpec(name, ArgType.OBJECT, true, List.of(), true);
    }
}
