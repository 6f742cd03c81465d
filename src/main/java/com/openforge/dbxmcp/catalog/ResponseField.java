package com.openforge.dbxmcp.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.dbxmcp.normalize.FieldSpec;
import com.openforge.dbxmcp.normalize.JsonType;
import com.openforge.dbxmcp.normalize.ResponseShape;

import java.util.List;

/**
 * Catalog form of a response field expectation.
 *
 * @param fields nested expectations: the object's fields, or each element's for arrays
 */
public record ResponseField(
        String              name,
        JsonType            type,
        boolean             required,
        @JsonProperty("default")
        JsonNode            defaultValue,
        List<ResponseField> fields
) {

    public ResponseField {
        type   = type == null ? JsonType.ANY : type;
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public FieldSpec toFieldSpec() {
        FieldSpec spec = new FieldSpec(name, type, required, defaultValue, null);
        return fields.isEmpty() ? spec : spec.withShape(toShape(fields));
    }

    static ResponseShape toShape(List<ResponseField> fields) {
        return new ResponseShape(fields.stream().map(ResponseField::toFieldSpec).toList());
    }
}
