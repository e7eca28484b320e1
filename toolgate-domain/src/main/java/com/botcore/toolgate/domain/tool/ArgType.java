package com.botcore.toolgate.domain.tool;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * JSON shape a tool argument must have. Values arrive as parsed JSON (String, Number, Boolean, Map, List).
 */
public enum ArgType {
    STRING("a string"),
    NUMBER("a number"),
    INTEGER("an integer"),
    BOOLEAN("a boolean"),
    OBJECT("an object"),
    ARRAY("an array"),
    ANY("a value");

    private final String label;

    ArgType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean accepts(Object value) {
        if (value == null) return false;
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number n && isFinite(n);
            case INTEGER -> value instanceof Number n && isIntegral(n);
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map<?, ?>;
            case ARRAY -> value instanceof Collection<?>;
            case ANY -> true;
        };
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double d) return Double.isFinite(d);
        if (n instanceof Float f) return Float.isFinite(f);
        return true;
    }

    private static boolean isIntegral(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte || n instanceof BigInteger) {
            return true;
        }
        if (n instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        double d = n.doubleValue();
        return Double.isFinite(d) && d == Math.rint(d);
    }
}
