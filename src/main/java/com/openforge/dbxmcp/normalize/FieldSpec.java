package com.openforge.dbxmcp.normalize;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Expected shape of one response field.
 *
 * @param defaultValue filled in when an optional field is absent or null; null = leave absent
 * @param shape        for OBJECT fields the shape of the object, for ARRAY fields the
 *                     shape of every element; null = not checked further
 */
public record FieldSpec(
        String        name,
        JsonType      type,
        boolean       required,
        JsonNode      defaultValue,
        ResponseShape shape
) {

    public static FieldSpec required(String name, JsonType type) {
        return new FieldSpec(name, type, true, null, null);
    }

    public static FieldSpec optional(String name, JsonType type, JsonNode defaultValue) {
        return new FieldSpec(name, type, false, defaultValue, null);
    }

    public FieldSpec withShape(ResponseShape nested) {
        return new FieldSpec(name, type, required, defaultValue, nested);
    }
}
