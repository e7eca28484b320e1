package com.botcore.toolgate.application.tuning;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Checks a proposed parameter value against its hard bounds.
 *
 * - NUMBER: finite number within [min, max], then rounded to the nearest step (4 decimals)
 * - ENUM: exact member of the allowed values
 * - BOOLEAN: a real boolean, no "yes"/"1" coercion
 *
 * Whole numbers come back as Long so the backend receives 30, not 30.0.
 */
public final class AdjustmentValidator {

    public AdjustmentValidation validate(String key, Object newValue) {
        ParameterBound bound = ParameterBounds.find(key).orElse(null);
        if (bound == null) {
            return AdjustmentValidation.rejected("Unknown parameter: " + key);
        }
        return validate(bound, newValue);
    }

    public AdjustmentValidation validate(ParameterBound bound, Object newValue) {
        String key = bound.key();
        switch (bound.type()) {
            case BOOLEAN -> {
                if (!(newValue instanceof Boolean)) {
                    return AdjustmentValidation.rejected(key + " must be a boolean");
                }
                return AdjustmentValidation.accepted(newValue);
            }
            case ENUM -> {
                if (!(newValue instanceof String s) || !bound.enumValues().contains(s)) {
                    return AdjustmentValidation.rejected(key + " must be one of: " + String.join(", ", bound.enumValues()));
                }
                return AdjustmentValidation.accepted(s);
            }
            case NUMBER -> {
                if (!(newValue instanceof Number n) || !Double.isFinite(n.doubleValue())) {
                    return AdjustmentValidation.rejected(key + " must be a number");
                }
                double num = n.doubleValue();
                if (bound.min() != null && num < bound.min()) {
                    return AdjustmentValidation.rejected(key + " must be >= " + plain(bound.min()) + " (got " + plain(num) + ")");
                }
                if (bound.max() != null && num > bound.max()) {
                    return AdjustmentValidation.rejected(key + " must be <= " + plain(bound.max()) + " (got " + plain(num) + ")");
                }
                if (bound.step() == null) {
                    return AdjustmentValidation.accepted(normalize(num));
                }
                double rounded = Math.round(num / bound.step()) * bound.step();
                double fixed = BigDecimal.valueOf(rounded).setScale(4, RoundingMode.HALF_UP).doubleValue();
                return AdjustmentValidation.accepted(normalize(fixed));
            }
            default -> throw new IllegalStateException("Unsupported parameter type: " + bound.type());
        }
    }

    static Number normalize(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return (long) v;
        }
        return v;
    }

    private static String plain(double v) {
        return String.valueOf(normalize(v));
    }
}
