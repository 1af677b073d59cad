package com.eainde.atlas.tools;

import java.util.Collection;
import java.util.Map;

/**
 * Argument types a tool schema can declare.
 */
public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    ARRAY,
    OBJECT;

    /**
     * Checks whether a raw argument value (as decoded from JSON) is acceptable for this type.
     * Integral doubles such as {@code 3.0} are accepted for {@link #INTEGER}.
     */
    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof CharSequence;
            case INTEGER -> isIntegral(value);
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case ARRAY -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
            case OBJECT -> value instanceof Map<?, ?>;
        };
    }

    static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (value instanceof java.math.BigInteger) {
            return true;
        }
        if (value instanceof java.math.BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    public String jsonName() {
        return name().toLowerCase();
    }
}
