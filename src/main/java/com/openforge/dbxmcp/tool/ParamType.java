package com.openforge.dbxmcp.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a tool parameter; names follow JSON Schema.
 *
 * Arguments arrive already decoded from JSON, so values are String, Boolean,
 * Integer/Long/Double/BigDecimal, Map or List.
 */
public enum ParamType {

    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY;

    public boolean matches(Object value) {
        return switch (this) {
            case STRING  -> value instanceof CharSequence;
            case INTEGER -> isIntegral(value);
            case NUMBER  -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT  -> value instanceof Map<?, ?>;
            case ARRAY   -> value instanceof Collection<?> || (value != null && value.getClass().isArray());
        };
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ParamType fromJson(String value) {
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }

    /** Whole numbers, including 3.0 as JSON clients sometimes send it. */
    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }
}
