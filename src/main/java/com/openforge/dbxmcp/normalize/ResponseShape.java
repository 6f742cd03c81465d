package com.openforge.dbxmcp.normalize;

import java.util.List;

/** Ordered field expectations for one JSON object. */
public record ResponseShape(List<FieldSpec> fields) {

    /** Accepts any JSON value unchanged. */
    public static final ResponseShape ANY = new ResponseShape(List.of());

    public ResponseShape {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static ResponseShape of(FieldSpec... fields) {
        return new ResponseShape(List.of(fields));
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
