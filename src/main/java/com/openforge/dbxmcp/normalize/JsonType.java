package com.openforge.dbxmcp.normalize;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/** JSON node kinds a response field may be declared as. */
public enum JsonType {

    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    /** Present, any kind. */
    ANY;

    public boolean matches(JsonNode node) {
        return switch (this) {
            case STRING  -> node.isTextual();
            case INTEGER -> node.isIntegralNumber();
            case NUMBER  -> node.isNumber();
            case BOOLEAN -> node.isBoolean();
            case OBJECT  -> node.isObject();
            case ARRAY   -> node.isArray();
            case ANY     -> true;
        };
    }

    /** Lower-case name of the kind of {@code node}, for error messages. */
    public static String describe(JsonNode node) {
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JsonType fromJson(String value) {
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
