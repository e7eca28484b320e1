package com.botcore.toolgate.application.tuning;

/**
 * Result of checking a proposed value. value is the effective (step-rounded) value when valid.
 */
public record AdjustmentValidation(boolean valid, String error, Object value) {

    public static AdjustmentValidation accepted(Object value) {
        return new AdjustmentValidation(true, null, value);
    }

    public static AdjustmentValidation rejected(String error) {
        return new AdjustmentValidation(false, error, null);
    }
}
