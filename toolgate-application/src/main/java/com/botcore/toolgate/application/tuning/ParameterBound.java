package com.botcore.toolgate.application.tuning;

import java.util.List;
import java.util.Objects;

/**
 * Hard limits for one tunable engine parameter and where it is written on the backend.
 * min/max/step apply to NUMBER only, enumValues to ENUM only.
 */
public record ParameterBound(
        String key,
        String name,
        TuningTier tier,
        ParameterType type,
        Double min,
        Double max,
        Double step,
        List<String> enumValues,
        String apiEndpoint,
        String apiField,
        String description,
        Object defaultValue,
        long cooldownMs
) {

    public ParameterBound {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(apiEndpoint, "apiEndpoint");
        Objects.requireNonNull(apiField, "apiField");
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        if (type == ParameterType.ENUM && enumValues.isEmpty()) {
            throw new IllegalArgumentException("enum parameter without values: " + key);
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min > max for " + key);
        }
        if (step != null && step <= 0) {
            throw new IllegalArgumentException("step must be positive for " + key);
        }
        if (cooldownMs < 0) {
            throw new IllegalArgumentException("cooldownMs must be >= 0 for " + key);
        }
        if (description == null) description = "";
    }
}
